package com.example.syncroom.client.media;

public enum StreamType {
    /** One muxed url. */
    SINGLE,
    /** Separate video-only and audio-only urls. */
    DUAL
}
