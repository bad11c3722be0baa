package com.backend.artscan.client;

import com.backend.artscan.config.ArtScanProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;

/**
 * Writes images under a local directory that is served at {@code storage.public-base-url}.
 */
@Component
public class FileSystemImageStore implements ImageStore {

    private final Path directory;
    private final String publicBaseUrl;

    public FileSystemImageStore(ArtScanProperties properties) {
        this.directory = Paths.get(properties.getStorage().getDirectory()).toAbsolutePath().normalize();
        String base = properties.getStorage().getPublicBaseUrl();
        this.publicBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    }

    @Override
    public String store(byte[] image, String contentType, String originalFilename) throws IOException {
        String fileName = generateFileName(originalFilename, contentType);
        Files.createDirectories(directory);
        Files.write(directory.resolve(fileName), image);
        return publicBaseUrl + "/" + URLEncoder.encode(fileName, StandardCharsets.UTF_8);
    }

    public Path getDirectory() {
        return directory;
    }

    private String generateFileName(String originalFileName, String contentType) {
        String extension = "";
        if (originalFileName != null && originalFileName.contains(".")) {
            extension = originalFileName.substring(originalFileName.lastIndexOf(".")).toLowerCase();
            if (!extension.matches("\\.[a-z0-9]{1,5}")) {
                extension = "";
            }
        } else if ("image/png".equals(contentType)) {
            extension = ".png";
        } else if ("image/jpeg".equals(contentType)) {
            extension = ".jpg";
        }
        return UUID.randomUUID() + extension;
    }
}
