package dev.evalkit.experiment;

import dev.evalkit.config.EvalkitConfig;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import lombok.extern.slf4j.Slf4j;

/** Hands experiment runs to a background mechanism. A run may take unbounded time. */
public interface JobSubmitter extends AutoCloseable {
    JobHandle submit(long experimentId, long runId);

    @Override
    default void close() {}

    /** The unit of work a submitter executes. */
    @FunctionalInterface
    interface JobRunner {
        void run(long experimentId, long runId);
    }

    /**
     * @param completion completes when the run is over, exceptionally when it failed
     */
    record JobHandle(String jobId, CompletableFuture<Void> completion) {}

    /** Runs jobs on a fixed thread pool sized by {@code EVALKIT_JOB_THREADS}. */
    @Slf4j
    class ExecutorImpl implements JobSubmitter {
        private final JobRunner runner;
        private final ExecutorService executor;

        public ExecutorImpl(EvalkitConfig config, JobRunner runner) {
            this.runner = Objects.requireNonNull(runner);
            this.executor =
                    Executors.newFixedThreadPool(config.jobThreads(), new JobThreadFactory());
        }

        @Override
        public JobHandle submit(long experimentId, long runId) {
            var jobId = UUID.randomUUID().toString();
            var completion =
                    CompletableFuture.runAsync(() -> runner.run(experimentId, runId), executor)
                            .whenComplete(
                                    (ignored, error) -> {
                                        if (error != null) {
                                            log.error(
                                                    "job {} for experiment {} run {} failed",
                                                    jobId,
                                                    experimentId,
                                                    runId,
                                                    error);
                                        } else {
                                            log.debug("job {} finished", jobId);
                                        }
                                    });
            log.info("submitted job {} for experiment {} run {}", jobId, experimentId, runId);
            return new JobHandle(jobId, completion);
        }

        @Override
        public void close() {
            executor.shutdown();
        }

        private static final class JobThreadFactory implements ThreadFactory {
            private final AtomicInteger counter = new AtomicInteger();

            @Override
            public Thread newThread(Runnable runnable) {
                var thread = new Thread(runnable, "evalkit-job-" + counter.incrementAndGet());
                thread.setDaemon(true);
                return thread;
            }
        }
    }

    /** Runs each job on the submitting thread before {@link #submit} returns. */
    @Slf4j
    class InlineImpl implements JobSubmitter {
        private final JobRunner runner;

        public InlineImpl(JobRunner runner) {
            this.runner = Objects.requireNonNull(runner);
        }

        @Override
        public JobHandle submit(long experimentId, long runId) {
            var jobId = UUID.randomUUID().toString();
            try {
                runner.run(experimentId, runId);
                return new JobHandle(jobId, CompletableFuture.completedFuture(null));
            } catch (RuntimeException e) {
                log.error("job {} for experiment {} run {} failed", jobId, experimentId, runId, e);
                return new JobHandle(jobId, CompletableFuture.failedFuture(e));
            }
        }
    }
}
