package com.exifworker.app.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;

/**
 * Settings under {@code exif-worker.*}: output location and how ExifTool is launched.
 */
@ConfigurationProperties(prefix = "exif-worker")
public class WorkerProperties {

    /**
     * Used when a request does not name an output directory.
     */
    private String defaultOutputPath = System.getProperty("java.io.tmpdir");
    private ExifTool exiftool = new ExifTool();

    public static class ExifTool {
        private String executable = "exiftool";
        // Null waits indefinitely
        private Duration timeout;

        public String getExecutable() { return executable; }
        public void setExecutable(String executable) { this.executable = executable; }
        public Duration getTimeout() { return timeout; }
        public void setTimeout(Duration timeout) { this.timeout = timeout; }
    }

    public String getDefaultOutputPath() {
        return defaultOutputPath;
    }

    public void setDefaultOutputPath(String defaultOutputPath) {
        this.defaultOutputPath = defaultOutputPath;
    }

    public ExifTool getExiftool() {
        return exiftool;
    }

    public void setExiftool(ExifTool exiftool) {
        this.exiftool = exiftool;
    }
}
