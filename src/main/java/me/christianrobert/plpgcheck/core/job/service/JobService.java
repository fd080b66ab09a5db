package me.christianrobert.plpgcheck.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.plpgcheck.core.job.Job;
import me.christianrobert.plpgcheck.core.job.model.JobProgress;
import me.christianrobert.plpgcheck.core.job.model.JobStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Runs check jobs in the background and keeps their status, progress and result in memory
 * until {@link #cleanupOldJobs(int)} drops them.
 */
@ApplicationScoped
public class JobService {

    private static final Logger log = LoggerFactory.getLogger(JobService.class);

    private final Map<String, JobExecution<?>> jobExecutions = new ConcurrentHashMap<>();

    private ExecutorService executorService;

    @PostConstruct
    public void init() {
        executorService = Executors.newCachedThreadPool();
        log.info("Job executor started");
    }

    @PreDestroy
    public void shutdown() {
        if (executorService == null || executorService.isShutdown()) {
            return;
        }
        log.info("Stopping job executor, {} job(s) known", jobExecutions.size());
        executorService.shutdown();
        try {
            if (!executorService.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Jobs still running after 30s, interrupting them");
                executorService.shutdownNow();
            }
        } catch (InterruptedException e) {
            executorService.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    /**
     * State of one submitted job. Status changes only through the service.
     */
    public static class JobExecution<T> {
        private final Job<T> job;
        private volatile JobStatus status = JobStatus.PENDING;
        private volatile JobProgress progress = new JobProgress();
        private volatile LocalDateTime startTime;
        private volatile LocalDateTime endTime;
        private volatile T result;
        private volatile Exception error;
        private CompletableFuture<T> future;

        JobExecution(Job<T> job) {
            this.job = job;
        }

        public Job<T> getJob() { return job; }
        public JobStatus getStatus() { return status; }
        public JobProgress getProgress() { return progress; }
        public LocalDateTime getStartTime() { return startTime; }
        public LocalDateTime getEndTime() { return endTime; }
        public T getResult() { return result; }
        public Exception getError() { return error; }
        public CompletableFuture<T> getFuture() { return future; }

        synchronized void started() {
            if (status == JobStatus.PENDING) {
                startTime = LocalDateTime.now();
                status = JobStatus.RUNNING;
            }
        }

        synchronized void finished(T value, Throwable failure) {
            if (status != JobStatus.PENDING && status != JobStatus.RUNNING) {
                return;
            }
            endTime = LocalDateTime.now();
            if (failure == null) {
                result = value;
                status = JobStatus.COMPLETED;
                return;
            }
            Throwable cause = failure instanceof CompletionException && failure.getCause() != null
                    ? failure.getCause() : failure;
            error = cause instanceof Exception ? (Exception) cause : new RuntimeException(cause);
            status = cause instanceof CancellationException ? JobStatus.CANCELLED : JobStatus.FAILED;
        }
    }

    public <T> String submitJob(Job<T> job) {
        String jobId = job.getJobId();
        JobExecution<T> execution = new JobExecution<>(job);
        jobExecutions.put(jobId, execution);
        log.info("Submitting job {} ({})", jobId, job.getJobType());

        execution.future = CompletableFuture
                .supplyAsync(() -> {
                    execution.started();
                    return job.execute(progress -> {
                        execution.progress = progress;
                        log.debug("Job {} at {}%: {}", jobId, progress.getPercentage(), progress.getCurrentTask());
                    });
                }, executorService)
                .thenCompose(running -> running)
                .whenComplete((result, failure) -> {
                    execution.finished(result, failure);
                    if (failure == null) {
                        log.info("Job {} completed", jobId);
                    } else if (execution.getStatus() == JobStatus.CANCELLED) {
                        log.warn("Job {} cancelled", jobId);
                    } else {
                        log.error("Job " + jobId + " failed", execution.getError());
                    }
                });
        return jobId;
    }

    /**
     * Requests cancellation of a running job. A job already finished is left as it is.
     *
     * @return {@code true} when the job was cancelled
     */
    public boolean cancelJob(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        if (execution == null || execution.getFuture() == null || isJobComplete(jobId)) {
            return false;
        }
        boolean cancelled = execution.getFuture().cancel(true);
        if (cancelled) {
            execution.finished(null, new CancellationException("Job cancelled: " + jobId));
        }
        return cancelled;
    }

    public JobExecution<?> getJobExecution(String jobId) {
        return jobExecutions.get(jobId);
    }

    public JobStatus getJobStatus(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null ? execution.getStatus() : null;
    }

    @SuppressWarnings("unchecked")
    public <T> T getJobResult(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null && execution.getStatus() == JobStatus.COMPLETED ? (T) execution.getResult() : null;
    }

    public Exception getJobError(String jobId) {
        JobExecution<?> execution = jobExecutions.get(jobId);
        return execution != null && execution.getStatus() == JobStatus.FAILED ? execution.getError() : null;
    }

    public boolean isJobComplete(String jobId) {
        JobStatus status = getJobStatus(jobId);
        return status == JobStatus.COMPLETED || status == JobStatus.FAILED || status == JobStatus.CANCELLED;
    }

    /**
     * Forgets jobs that finished more than {@code maxAgeHours} ago.
     */
    public int cleanupOldJobs(int maxAgeHours) {
        LocalDateTime cutoff = LocalDateTime.now().minusHours(maxAgeHours);
        int before = jobExecutions.size();
        jobExecutions.values().removeIf(execution ->
                execution.getEndTime() != null && execution.getEndTime().isBefore(cutoff));
        int removed = before - jobExecutions.size();
        if (removed > 0) {
            log.debug("Dropped {} finished job(s)", removed);
        }
        return removed;
    }

    public Map<String, JobExecution<?>> getAllJobExecutions() {
        return Map.copyOf(jobExecutions);
    }
}
