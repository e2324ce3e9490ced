package com.example.syncroom.model;

public class MutationResult {
    private final boolean applied;
    private final boolean semanticChange;
    private final RoomSnapshot snapshot;

    public MutationResult(boolean applied, boolean semanticChange, RoomSnapshot snapshot) {
        this.applied = applied;
        this.semanticChange = semanticChange;
        this.snapshot = snapshot;
    }

    public static MutationResult rejected(RoomSnapshot snapshot) {
        return new MutationResult(false, false, snapshot);
    }

    /** False when the op could not be applied (unknown room, index out of range). Nothing was broadcast. */
    public boolean isApplied() { return applied; }

    /** True when the timeline anchor moved. */
    public boolean isSemanticChange() { return semanticChange; }

    public RoomSnapshot getSnapshot() { return snapshot; }
}
