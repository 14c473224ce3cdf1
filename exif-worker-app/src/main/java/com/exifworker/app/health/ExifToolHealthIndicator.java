package com.exifworker.app.health;

import com.exifworker.app.config.WorkerProperties;
import com.exifworker.runtime.process.ProcessOutcome;
import com.exifworker.runtime.process.ProcessRunner;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Health indicator checking that the ExifTool executable can be run.
 */
@Component
public class ExifToolHealthIndicator implements HealthIndicator {

    private static final Duration PROBE_TIMEOUT = Duration.ofSeconds(5);

    private final ProcessRunner processRunner;
    private final String executable;

    public ExifToolHealthIndicator(ProcessRunner processRunner, WorkerProperties properties) {
        this.processRunner = processRunner;
        this.executable = properties.getExiftool().getExecutable();
    }

    @Override
    public Health health() {
        Path versionFile = null;
        try {
            versionFile = Files.createTempFile("exiftool-version", ".txt");
            ProcessOutcome outcome = processRunner.run(List.of(executable, "-ver"), versionFile, PROBE_TIMEOUT);

            if (!outcome.isSuccess()) {
                return Health.down()
                    .withDetail("executable", executable)
                    .withDetail("exitCode", outcome.exitCode())
                    .withDetail("timedOut", outcome.timedOut())
                    .withDetail("error", outcome.stderr().trim())
                    .build();
            }

            return Health.up()
                .withDetail("executable", executable)
                .withDetail("version", Files.readString(versionFile).trim())
                .build();

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Health.unknown().withDetail("executable", executable).build();
        } catch (IOException e) {
            return Health.down(e)
                .withDetail("executable", executable)
                .build();
        } finally {
            deleteQuietly(versionFile);
        }
    }

    private static void deleteQuietly(Path file) {
        if (file == null) {
            return;
        }
        try {
            Files.deleteIfExists(file);
        } catch (IOException e) {
            file.toFile().deleteOnExit();
        }
    }
}
