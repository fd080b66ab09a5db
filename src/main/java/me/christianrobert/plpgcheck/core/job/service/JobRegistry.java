package me.christianrobert.plpgcheck.core.job.service;

import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Instance;
import jakarta.inject.Inject;
import me.christianrobert.plpgcheck.core.job.DatabaseCheckJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of database check jobs, discovered through CDI.
 */
@ApplicationScoped
public class JobRegistry {

    private static final Logger log = LoggerFactory.getLogger(JobRegistry.class);

    @Inject
    Instance<DatabaseCheckJob<?>> checkJobInstances;

    private final Map<String, Class<? extends DatabaseCheckJob<?>>> jobTypeMap = new HashMap<>();
    private final Map<String, String> descriptions = new HashMap<>();

    @PostConstruct
    public void initialize() {
        log.info("Initializing JobRegistry and discovering database check jobs");

        for (DatabaseCheckJob<?> job : checkJobInstances) {
            @SuppressWarnings("unchecked")
            Class<? extends DatabaseCheckJob<?>> jobClass = (Class<? extends DatabaseCheckJob<?>>) job.getClass();
            String key = job.getCheckType().toUpperCase(Locale.ROOT);
            jobTypeMap.put(key, jobClass);
            descriptions.put(key, job.getDescription());
            log.info("Registered check job: {} -> {} ({})", key, jobClass.getSimpleName(), job.getDescription());
        }

        if (jobTypeMap.isEmpty()) {
            log.warn("No database check jobs were discovered. Check that job classes are properly annotated with CDI scopes.");
        }
    }

    /**
     * Creates a new job instance for the given check type.
     *
     * @return the job, or empty if no job handles the type
     */
    public Optional<DatabaseCheckJob<?>> createJob(String checkType) {
        String key = checkType.toUpperCase(Locale.ROOT);
        Class<? extends DatabaseCheckJob<?>> jobClass = jobTypeMap.get(key);
        if (jobClass == null) {
            log.warn("No job registered for key: {}", key);
            return Optional.empty();
        }
        try {
            DatabaseCheckJob<?> job = checkJobInstances.select(jobClass).get();
            log.debug("Created new job instance: {} for key: {}", jobClass.getSimpleName(), key);
            return Optional.of(job);
        } catch (RuntimeException e) {
            log.error("Failed to create job instance for key: {}", key, e);
            return Optional.empty();
        }
    }

    public Map<String, String> getAvailableJobTypes() {
        return new HashMap<>(descriptions);
    }

    public boolean isJobTypeSupported(String checkType) {
        return jobTypeMap.containsKey(checkType.toUpperCase(Locale.ROOT));
    }
}
