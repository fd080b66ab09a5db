package me.christianrobert.plpgcheck.core.job;

import java.util.List;

/**
 * A job that works on the routines of the configured PostgreSQL database. Implementations
 * are discovered by the {@link me.christianrobert.plpgcheck.core.job.service.JobRegistry}.
 *
 * @param <T> the type of one result item
 */
public interface DatabaseCheckJob<T> extends Job<List<T>> {

    /**
     * @return the kind of work, e.g. {@code "ROUTINE_CHECK"}
     */
    String getCheckType();

    Class<T> getResultType();

    default String getJobTypeIdentifier() {
        return "POSTGRES_" + getCheckType();
    }
}
