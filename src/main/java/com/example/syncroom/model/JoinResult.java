package com.example.syncroom.model;

public class JoinResult {
    private final boolean created;
    private final Role role;
    private final RoomSnapshot snapshot;

    public JoinResult(boolean created, Role role, RoomSnapshot snapshot) {
        this.created = created;
        this.role = role;
        this.snapshot = snapshot;
    }

    /** True only for the single join that created the room record. */
    public boolean isCreated() { return created; }
    public Role getRole() { return role; }
    public RoomSnapshot getSnapshot() { return snapshot; }
}
