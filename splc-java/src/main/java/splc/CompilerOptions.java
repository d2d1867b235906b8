package splc;

import static com.google.common.base.Preconditions.checkArgument;

public record CompilerOptions(int maxInlineDepth, int lineStart, int lineStep, long maxSteps) {

    public static final int DEFAULT_MAX_INLINE_DEPTH = 64;
    public static final int DEFAULT_LINE_START = 10;
    public static final int DEFAULT_LINE_STEP = 10;
    public static final long DEFAULT_MAX_STEPS = 1_000_000L;

    public CompilerOptions {
        checkArgument(maxInlineDepth > 0, "maxInlineDepth must be positive: %s", maxInlineDepth);
        checkArgument(lineStart > 0, "lineStart must be positive: %s", lineStart);
        checkArgument(lineStep > 0, "lineStep must be positive: %s", lineStep);
        checkArgument(maxSteps > 0, "maxSteps must be positive: %s", maxSteps);
    }

    public static CompilerOptions defaults() {
        return new CompilerOptions(DEFAULT_MAX_INLINE_DEPTH, DEFAULT_LINE_START, DEFAULT_LINE_STEP, DEFAULT_MAX_STEPS);
    }

    public CompilerOptions withMaxInlineDepth(int depth) {
        return new CompilerOptions(depth, lineStart, lineStep, maxSteps);
    }

    public CompilerOptions withLineNumbering(int start, int step) {
        return new CompilerOptions(maxInlineDepth, start, step, maxSteps);
    }

    public CompilerOptions withMaxSteps(long steps) {
        return new CompilerOptions(maxInlineDepth, lineStart, lineStep, steps);
    }
}
