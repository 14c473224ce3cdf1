package com.exifworker.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application entry point for the ExifTool worker.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ExifWorkerApplication {
    
    public static void main(String[] args) {
        SpringApplication.run(ExifWorkerApplication.class, args);
    }
}
