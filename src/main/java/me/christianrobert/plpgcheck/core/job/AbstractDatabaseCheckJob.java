package me.christianrobert.plpgcheck.core.job;

import jakarta.inject.Inject;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import me.christianrobert.plpgcheck.core.job.model.JobProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.function.Consumer;

/**
 * Base class for database check jobs: job id, schema selection and error handling.
 *
 * @param <T> the type of one result item
 */
public abstract class AbstractDatabaseCheckJob<T> implements DatabaseCheckJob<T> {

    private static final Logger log = LoggerFactory.getLogger(AbstractDatabaseCheckJob.class);

    protected final String jobId;

    @Inject
    protected ConfigService configService;

    protected AbstractDatabaseCheckJob() {
        this.jobId = "postgres-" + getCheckType().toLowerCase(Locale.ROOT).replace("_", "-") + "-"
                + UUID.randomUUID();
    }

    @Override
    public String getJobId() {
        return jobId;
    }

    @Override
    public String getJobType() {
        return getJobTypeIdentifier();
    }

    @Override
    public String getDescription() {
        return String.format("Run %s on the routines of the configured PostgreSQL schemas",
                getCheckType().replace("_", " ").toLowerCase(Locale.ROOT));
    }

    @Override
    public CompletableFuture<List<T>> execute(Consumer<JobProgress> progressCallback) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                List<T> results = performCheck(progressCallback);
                updateProgress(progressCallback, 100, "Completed", generateSummaryMessage(results));
                log.info("{} completed successfully: {}", getCheckType(), generateSummaryMessage(results));
                return results;
            } catch (Exception e) {
                log.error("{} failed", getCheckType(), e);
                throw new RuntimeException(String.format("%s failed: %s", getCheckType(), e.getMessage()), e);
            }
        });
    }

    protected abstract List<T> performCheck(Consumer<JobProgress> progressCallback) throws Exception;

    /**
     * The configured schemas ({@code check.schemas}) that exist in the database.
     */
    protected List<String> determineSchemasToProcess(List<String> availableSchemas,
                                                     Consumer<JobProgress> progressCallback) {
        List<String> configured = configService.getConfigValueAsStringList(ConfigService.CHECK_SCHEMAS);
        if (configured.isEmpty()) {
            updateProgress(progressCallback, 100, "Configuration error", "No schema configured in check.schemas");
            log.error("No schema configured in {}", ConfigService.CHECK_SCHEMAS);
            throw new IllegalStateException("No schema configured in " + ConfigService.CHECK_SCHEMAS);
        }

        List<String> valid = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String schema : configured) {
            String normalized = schema.toLowerCase(Locale.ROOT);
            if (availableSchemas.contains(normalized)) {
                valid.add(normalized);
            } else {
                missing.add(normalized);
            }
        }
        if (!missing.isEmpty()) {
            log.warn("Configured schema(s) not found: {}. Available: {}", missing, availableSchemas);
        }
        updateProgress(progressCallback, 0, "Using schema(s)", "Processing schema(s): " + String.join(", ", valid));
        return valid;
    }

    protected String generateSummaryMessage(List<T> results) {
        return String.format("%d result(s)", results.size());
    }
}
