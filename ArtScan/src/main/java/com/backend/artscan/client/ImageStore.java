package com.backend.artscan.client;

import java.io.IOException;

/**
 * Object storage for scan images. Rows only ever hold the returned URL.
 */
public interface ImageStore {

    String store(byte[] image, String contentType, String originalFilename) throws IOException;
}
