package com.backend.artscan;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class ArtScanApplication {

    public static void main(String[] args) {
        SpringApplication.run(ArtScanApplication.class, args);
    }

}
