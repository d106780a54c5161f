package com.safepocket.consensus.execution;

import com.safepocket.consensus.detector.DependencyProbe;
import com.safepocket.consensus.detector.DependencyUnavailableException;
import com.safepocket.consensus.detector.DetectorDescriptor;
import com.safepocket.consensus.detector.DetectorRegistry;
import com.safepocket.consensus.model.Dataset;
import com.safepocket.consensus.model.DetectionConfig;
import com.safepocket.consensus.model.DetectionOutput;
import com.safepocket.consensus.model.DetectionResult;
import com.safepocket.consensus.normalize.ResultNormalizer;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.task.AsyncTaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.scheduling.TaskScheduler;

/**
 * Runs every registered detector against one dataset on a bounded worker pool and returns one
 * terminal result per detector, in registry order. Detector faults, missing dependencies,
 * timeouts and invalid output all become result statuses; nothing thrown by a detector leaves
 * this class.
 *
 * <p>A detector's own timeout is measured from the moment its work starts on a worker thread.
 * When a watchdog scheduler is configured the work is cancelled on that deadline, independently
 * of which detector the caller is waiting on. Output that arrives after the deadline is
 * {@code TIMED_OUT} either way. The optional run timeout is measured from the start of
 * {@link #run} and turns every detector still pending at that instant into {@code TIMED_OUT}.
 */
public class ExecutionHarness {

    private static final Logger log = LoggerFactory.getLogger(ExecutionHarness.class);
    private static final Duration HELD_AFTER_CANCEL_WARNING = Duration.ofSeconds(1);

    private final AsyncTaskExecutor executor;
    private final TaskScheduler watchdog;
    private final DependencyProbe dependencyProbe;
    private final ResultNormalizer normalizer;
    private final Duration runTimeout;

    public ExecutionHarness(AsyncTaskExecutor executor, DependencyProbe dependencyProbe, ResultNormalizer normalizer, Duration runTimeout) {
        this(executor, null, dependencyProbe, normalizer, runTimeout);
    }

    public ExecutionHarness(
            AsyncTaskExecutor executor,
            TaskScheduler watchdog,
            DependencyProbe dependencyProbe,
            ResultNormalizer normalizer,
            Duration runTimeout
    ) {
        this.executor = executor;
        this.watchdog = watchdog;
        this.dependencyProbe = dependencyProbe;
        this.normalizer = normalizer;
        this.runTimeout = runTimeout;
    }

    public List<DetectionResult> run(Dataset dataset, DetectorRegistry registry, DetectionConfig config) {
        long runStart = System.nanoTime();
        Long runDeadline = runTimeout == null ? null : runStart + runTimeout.toNanos();

        List<Execution> executions = new ArrayList<>(registry.size());
        for (DetectorDescriptor descriptor : registry.list()) {
            executions.add(submit(descriptor, dataset, config));
        }

        List<DetectionResult> results = new ArrayList<>(executions.size());
        for (Execution execution : executions) {
            DetectionResult result = execution.terminal != null
                    ? execution.terminal
                    : await(execution, dataset.rowCount(), runDeadline);
            logOutcome(result);
            results.add(result);
        }
        return List.copyOf(results);
    }

    private Execution submit(DetectorDescriptor descriptor, Dataset dataset, DetectionConfig config) {
        Execution execution = new Execution(descriptor);
        Optional<String> missing = descriptor.requiredDependency().filter(dependency -> !dependencyProbe.isAvailable(dependency));
        if (missing.isPresent()) {
            execution.terminal = DetectionResult.skipped(descriptor.name(), descriptor.category(),
                    "required dependency '" + missing.get() + "' is unavailable");
            return execution;
        }
        try {
            execution.future = executor.submit(() -> execution.invoke(dataset, config, watchdog));
        } catch (TaskRejectedException ex) {
            execution.terminal = DetectionResult.failed(descriptor.name(), descriptor.category(), Duration.ZERO,
                    "detector pool rejected execution: " + ex.getMessage());
        }
        return execution;
    }

    private DetectionResult await(Execution execution, int rowCount, Long runDeadline) {
        DetectorDescriptor descriptor = execution.descriptor;
        try {
            if (!awaitStart(execution, runDeadline)) {
                execution.cancel();
                return DetectionResult.timedOut(descriptor.name(), descriptor.category(), Duration.ZERO,
                        runTimeoutMessage() + " before detector started");
            }
            Long detectorDeadline = descriptor.timeout()
                    .map(limit -> execution.startNanos + limit.toNanos())
                    .orElse(null);
            Long deadline = earliest(detectorDeadline, runDeadline);
            DetectionOutput output = deadline == null
                    ? execution.future.get()
                    : execution.future.get(Math.max(0L, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
            DetectionResult late = lateCompletion(execution, runDeadline);
            return late != null ? late : normalizer.normalize(descriptor, output, rowCount, execution.elapsed());
        } catch (TimeoutException | CancellationException ex) {
            execution.cancel();
            Duration elapsed = execution.elapsedUntilCancel();
            DetectorTimeoutException timeout = timeoutFor(execution, runDeadline);
            return DetectionResult.timedOut(descriptor.name(), descriptor.category(), elapsed, timeout.getMessage());
        } catch (ExecutionException ex) {
            DetectionResult late = lateCompletion(execution, runDeadline);
            if (late != null) {
                return late;
            }
            Throwable cause = ex.getCause() != null ? ex.getCause() : ex;
            if (cause instanceof DependencyUnavailableException unavailable) {
                return DetectionResult.skipped(descriptor.name(), descriptor.category(), execution.elapsed(), unavailable.getMessage());
            }
            return DetectionResult.failed(descriptor.name(), descriptor.category(), execution.elapsed(), describe(cause));
        } catch (InterruptedException ex) {
            Thread.currentThread().interrupt();
            execution.cancel();
            return DetectionResult.failed(descriptor.name(), descriptor.category(), Duration.ZERO, "harness interrupted while waiting");
        }
    }

    /**
     * A detector that finished past its own deadline, or past the run deadline, is timed out even
     * though its future completed before the caller got round to it.
     */
    private DetectionResult lateCompletion(Execution execution, Long runDeadline) {
        DetectorDescriptor descriptor = execution.descriptor;
        Duration elapsed = execution.elapsed();
        Optional<Duration> limit = descriptor.timeout();
        if (limit.isPresent() && elapsed.compareTo(limit.get()) > 0) {
            return DetectionResult.timedOut(descriptor.name(), descriptor.category(), elapsed,
                    new DetectorTimeoutException(descriptor.name(), limit.get()).getMessage());
        }
        if (runDeadline != null && execution.endNanos - runDeadline > 0) {
            return DetectionResult.timedOut(descriptor.name(), descriptor.category(), elapsed, runTimeoutMessage());
        }
        return null;
    }

    private boolean awaitStart(Execution execution, Long runDeadline) throws InterruptedException {
        if (runDeadline == null) {
            execution.started.await();
            return true;
        }
        return execution.started.await(Math.max(0L, runDeadline - System.nanoTime()), TimeUnit.NANOSECONDS);
    }

    private DetectorTimeoutException timeoutFor(Execution execution, Long runDeadline) {
        DetectorDescriptor descriptor = execution.descriptor;
        if (descriptor.timeout().isPresent()) {
            long detectorDeadline = execution.startNanos + descriptor.timeout().get().toNanos();
            if (runDeadline == null || detectorDeadline - runDeadline <= 0) {
                return new DetectorTimeoutException(descriptor.name(), descriptor.timeout().get());
            }
        }
        return new DetectorTimeoutException(runTimeoutMessage());
    }

    private String runTimeoutMessage() {
        return "run timeout of " + (runTimeout == null ? 0 : runTimeout.toMillis()) + "ms reached";
    }

    private static Long earliest(Long a, Long b) {
        if (a == null) {
            return b;
        }
        if (b == null) {
            return a;
        }
        return a - b <= 0 ? a : b;
    }

    private static String describe(Throwable cause) {
        String message = cause.getMessage();
        return message == null || message.isBlank() ? cause.getClass().getSimpleName() : message;
    }

    private void logOutcome(DetectionResult result) {
        if (result.successful()) {
            log.info("detector_result detector={} status={} anomalies={} elapsedMs={}",
                    result.detectorName(), result.status(), result.anomalyCount(), result.executionTime().toMillis());
        } else {
            log.warn("detector_result detector={} status={} elapsedMs={} error={}",
                    result.detectorName(), result.status(), result.executionTime().toMillis(), result.errorMessage());
        }
    }

    private static final class Execution {

        private final DetectorDescriptor descriptor;
        private final CountDownLatch started = new CountDownLatch(1);
        private volatile long startNanos;
        private volatile long endNanos;
        private volatile long cancelNanos;
        private volatile Future<DetectionOutput> future;
        private DetectionResult terminal;

        private Execution(DetectorDescriptor descriptor) {
            this.descriptor = descriptor;
        }

        private DetectionOutput invoke(Dataset dataset, DetectionConfig config, TaskScheduler watchdog) {
            startNanos = System.nanoTime();
            ScheduledFuture<?> expiry = descriptor.timeout()
                    .filter(limit -> watchdog != null)
                    .map(limit -> watchdog.schedule(this::expire, Instant.now().plus(limit)))
                    .orElse(null);
            started.countDown();
            try {
                return descriptor.detector().detect(dataset, config);
            } finally {
                endNanos = System.nanoTime();
                if (expiry != null) {
                    expiry.cancel(false);
                }
                reportHeldThread();
            }
        }

        private void expire() {
            if (endNanos == 0 && cancel()) {
                log.warn("detector_deadline_reached detector={} timeoutMs={}", descriptor.name(),
                        descriptor.timeout().map(Duration::toMillis).orElse(0L));
            }
        }

        private boolean cancel() {
            Future<DetectionOutput> current = future;
            if (current == null) {
                return false;
            }
            if (cancelNanos == 0) {
                cancelNanos = System.nanoTime();
            }
            return current.cancel(true);
        }

        private void reportHeldThread() {
            long requested = cancelNanos;
            if (requested == 0) {
                return;
            }
            Duration held = Duration.ofNanos(Math.max(0L, endNanos - requested));
            if (held.compareTo(HELD_AFTER_CANCEL_WARNING) > 0) {
                log.warn("detector_thread_held_after_cancel detector={} heldMs={} thread={}",
                        descriptor.name(), held.toMillis(), Thread.currentThread().getName());
            }
        }

        private Duration elapsedUntilCancel() {
            long stop = cancelNanos != 0 ? cancelNanos : System.nanoTime();
            if (endNanos != 0 && endNanos - stop < 0) {
                stop = endNanos;
            }
            return Duration.ofNanos(Math.max(0L, stop - startNanos));
        }

        private Duration elapsed() {
            long end = endNanos != 0 ? endNanos : System.nanoTime();
            return Duration.ofNanos(Math.max(0L, end - startNanos));
        }
    }
}
