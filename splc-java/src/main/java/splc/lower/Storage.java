package splc.lower;

public sealed interface Storage permits FlatSlot, FrameSlot {}
