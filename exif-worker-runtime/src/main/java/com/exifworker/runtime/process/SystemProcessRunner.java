package com.exifworker.runtime.process;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * {@link ProcessRunner} backed by {@link ProcessBuilder}.
 * Standard output is redirected by the OS; standard error is buffered in memory.
 */
public class SystemProcessRunner implements ProcessRunner {

    private static final Logger log = LoggerFactory.getLogger(SystemProcessRunner.class);

    @Override
    public ProcessOutcome run(List<String> command, Path stdoutTarget, Duration timeout)
            throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command)
            .redirectOutput(ProcessBuilder.Redirect.to(stdoutTarget.toFile()))
            .redirectError(ProcessBuilder.Redirect.PIPE)
            .start();
        process.getOutputStream().close();
        log.debug("Started {} (pid {})", command.get(0), process.pid());

        if (timeout == null) {
            byte[] stderr = process.getErrorStream().readAllBytes();
            int exitCode = process.waitFor();
            return ProcessOutcome.exited(exitCode, decode(stderr));
        }

        // Drain stderr concurrently so a chatty process cannot block on a full pipe
        CompletableFuture<byte[]> stderr = CompletableFuture.supplyAsync(() -> readAll(process.getErrorStream()));
        if (!process.waitFor(timeout.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("{} did not finish within {}, killing pid {}", command.get(0), timeout, process.pid());
            process.destroyForcibly();
            process.waitFor();
            return ProcessOutcome.timedOut(decode(join(stderr)));
        }
        return ProcessOutcome.exited(process.exitValue(), decode(join(stderr)));
    }

    private static byte[] readAll(InputStream in) {
        try (in) {
            return in.readAllBytes();
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static byte[] join(CompletableFuture<byte[]> future) throws IOException, InterruptedException {
        try {
            return future.get();
        } catch (ExecutionException e) {
            if (e.getCause() instanceof UncheckedIOException io) {
                throw io.getCause();
            }
            throw new IOException("Failed to read standard error", e.getCause());
        }
    }

    private static String decode(byte[] bytes) {
        return new String(bytes, StandardCharsets.UTF_8);
    }
}
