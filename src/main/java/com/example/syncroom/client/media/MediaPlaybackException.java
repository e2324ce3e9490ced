package com.example.syncroom.client.media;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

public class MediaPlaybackException extends RuntimeException {

    public enum Reason {
        /** Autoplay policy refused playback with sound. */
        NOT_ALLOWED,
        /** The play request was interrupted by a load or a pause. */
        ABORTED,
        FAILED
    }

    private final Reason reason;

    public MediaPlaybackException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public Reason getReason() {
        return reason;
    }

    /** Unwraps future wrappers; anything that is not a playback exception counts as FAILED. */
    public static Reason reasonOf(Throwable t) {
        Throwable cur = t;
        while ((cur instanceof CompletionException || cur instanceof ExecutionException) && cur.getCause() != null) {
            cur = cur.getCause();
        }
        if (cur instanceof MediaPlaybackException) return ((MediaPlaybackException) cur).getReason();
        return Reason.FAILED;
    }
}
