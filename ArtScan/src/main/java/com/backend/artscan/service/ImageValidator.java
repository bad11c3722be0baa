package com.backend.artscan.service;

import com.backend.artscan.exception.InvalidImageException;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;

/**
 * Rejects uploads that are empty, declared as something other than an image, or undecodable.
 */
@Component
public class ImageValidator {

    public void validate(byte[] image, String contentType) {
        if (image == null || image.length == 0) {
            throw new InvalidImageException("Image cannot be empty");
        }
        if (contentType != null && !contentType.startsWith("image/")
                && !contentType.equals("application/octet-stream")) {
            throw new InvalidImageException("Invalid file type. Please upload an image file.");
        }
        BufferedImage decoded;
        try {
            decoded = ImageIO.read(new ByteArrayInputStream(image));
        } catch (IOException e) {
            throw new InvalidImageException("Image could not be decoded: " + e.getMessage());
        }
        if (decoded == null || decoded.getWidth() == 0 || decoded.getHeight() == 0) {
            throw new InvalidImageException("Image format not recognised");
        }
    }
}
