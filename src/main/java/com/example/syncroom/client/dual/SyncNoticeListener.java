package com.example.syncroom.client.dual;

public interface SyncNoticeListener {

    /** Heavy resync gave up. The message is meant for the viewer. */
    void onSyncExhausted(String message);
}
