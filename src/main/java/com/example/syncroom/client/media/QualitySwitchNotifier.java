package com.example.syncroom.client.media;

/** Prefetch hint sent upstream when the viewer changes quality. */
public interface QualitySwitchNotifier {

    void onQualitySwitch(String originalUrl, String quality);
}
