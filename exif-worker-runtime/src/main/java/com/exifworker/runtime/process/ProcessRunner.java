package com.exifworker.runtime.process;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;

/**
 * Abstraction over executing a child process whose standard output goes
 * straight into a file.
 */
@FunctionalInterface
public interface ProcessRunner {

    /**
     * Run the command and wait for it to finish.
     *
     * @param command full argument list, no shell expansion
     * @param stdoutTarget file receiving standard output, truncated first
     * @param timeout maximum time to wait, or null to wait indefinitely
     * @return exit status and captured standard error
     * @throws IOException if the process cannot be started
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    ProcessOutcome run(List<String> command, Path stdoutTarget, Duration timeout)
        throws IOException, InterruptedException;
}
