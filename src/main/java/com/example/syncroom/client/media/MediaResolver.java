package com.example.syncroom.client.media;

import java.io.IOException;

public interface MediaResolver {

    /**
     * @param quality preferred quality label, null for the resolver's default
     */
    ResolvedMedia resolve(String originalUrl, String quality) throws IOException;
}
