package me.christianrobert.plpgcheck.core.job;

import me.christianrobert.plpgcheck.core.job.model.JobProgress;

import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * A unit of background work run by the {@link me.christianrobert.plpgcheck.core.job.service.JobService}.
 *
 * @param <T> result type
 */
public interface Job<T> {

    String getJobId();

    String getJobType();

    String getDescription();

    CompletableFuture<T> execute(Consumer<JobProgress> progressCallback);

    default void updateProgress(Consumer<JobProgress> progressCallback, int percentage, String currentTask,
                                String details) {
        if (progressCallback != null) {
            progressCallback.accept(new JobProgress(percentage, currentTask, details));
        }
    }

    default void updateProgress(Consumer<JobProgress> progressCallback, JobProgress progress) {
        if (progressCallback != null) {
            progressCallback.accept(progress);
        }
    }
}
