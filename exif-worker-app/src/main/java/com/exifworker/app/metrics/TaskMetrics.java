package com.exifworker.app.metrics;

import com.exifworker.core.model.TaskResult;
import com.exifworker.runtime.DispatchListener;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.MeterBinder;

import java.time.Duration;

/**
 * Metrics for dispatched tasks.
 *
 * Metrics exposed:
 * - Completed and failed task counts, failures tagged by error code
 * - Task duration by outcome
 * - Number of files processed
 */
public class TaskMetrics implements MeterBinder, DispatchListener {

    // Metric names
    public static final String TASKS_COMPLETED = "exif_worker.tasks.completed";
    public static final String TASKS_FAILED = "exif_worker.tasks.failed";
    public static final String TASK_DURATION = "exif_worker.task.duration";
    public static final String FILES_PROCESSED = "exif_worker.files.processed";

    private volatile MeterRegistry registry;

    @Override
    public void bindTo(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void taskCompleted(String taskName, TaskResult result, Duration elapsed) {
        MeterRegistry meterRegistry = registry;
        if (meterRegistry == null) {
            return;
        }

        Counter.builder(TASKS_COMPLETED)
            .tag("task", taskName)
            .description("Total tasks completed successfully")
            .register(meterRegistry)
            .increment();

        Counter.builder(FILES_PROCESSED)
            .tag("task", taskName)
            .description("Total input files turned into output artifacts")
            .register(meterRegistry)
            .increment(result.outputFiles().size());

        recordDuration(meterRegistry, taskName, "success", elapsed);
    }

    @Override
    public void taskFailed(String taskName, String errorCode, Duration elapsed) {
        MeterRegistry meterRegistry = registry;
        if (meterRegistry == null) {
            return;
        }

        Counter.builder(TASKS_FAILED)
            .tag("task", taskName)
            .tag("error_code", errorCode != null ? errorCode : "unknown")
            .description("Total tasks failed")
            .register(meterRegistry)
            .increment();

        recordDuration(meterRegistry, taskName, "failure", elapsed);
    }

    private static void recordDuration(MeterRegistry meterRegistry, String taskName, String outcome, Duration elapsed) {
        Timer.builder(TASK_DURATION)
            .tag("task", taskName)
            .tag("outcome", outcome)
            .description("Task execution duration")
            .register(meterRegistry)
            .record(elapsed);
    }
}
