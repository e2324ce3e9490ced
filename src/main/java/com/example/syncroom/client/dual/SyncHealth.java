package com.example.syncroom.client.dual;

public enum SyncHealth {
    GOOD,
    /** A heavy resync is running or the last one failed. */
    RECOVERING,
    /** Too many heavy resyncs failed; only a new media load resets it. */
    FAILED
}
