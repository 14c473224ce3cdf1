package com.exifworker.runtime.process;

/**
 * Exit status and standard error of a finished child process.
 */
public record ProcessOutcome(
    int exitCode,
    String stderr,
    boolean timedOut
) {
    public static ProcessOutcome exited(int exitCode, String stderr) {
        return new ProcessOutcome(exitCode, stderr, false);
    }

    public static ProcessOutcome timedOut(String stderr) {
        return new ProcessOutcome(-1, stderr, true);
    }

    public boolean isSuccess() {
        return !timedOut && exitCode == 0;
    }
}
