package me.christianrobert.plpgcheck.core.job.service;

import me.christianrobert.plpgcheck.core.job.Job;
import me.christianrobert.plpgcheck.core.job.model.JobProgress;
import me.christianrobert.plpgcheck.core.job.model.JobStatus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for JobService: submission, completion and failure bookkeeping.
 */
class JobServiceTest {

    private JobService jobService;

    @BeforeEach
    void setUp() {
        jobService = new JobService();
        jobService.init();
    }

    @AfterEach
    void tearDown() {
        jobService.shutdown();
    }

    private static Job<String> job(String id, CompletableFuture<String> outcome) {
        return new Job<>() {
            @Override
            public String getJobId() {
                return id;
            }

            @Override
            public String getJobType() {
                return "TEST_JOB";
            }

            @Override
            public String getDescription() {
                return "Test job " + id;
            }

            @Override
            public CompletableFuture<String> execute(Consumer<JobProgress> progressCallback) {
                updateProgress(progressCallback, 50, "Working", "Halfway");
                return outcome;
            }
        };
    }

    @Test
    void testSubmitJob_Completes() throws Exception {
        String jobId = jobService.submitJob(job("job-1", CompletableFuture.completedFuture("done")));

        jobService.getJobExecution(jobId).getFuture().get(10, TimeUnit.SECONDS);

        assertEquals(JobStatus.COMPLETED, jobService.getJobStatus(jobId));
        assertTrue(jobService.isJobComplete(jobId));
        assertEquals("done", jobService.<String>getJobResult(jobId));
        assertEquals(50, jobService.getJobExecution(jobId).getProgress().getPercentage());
        assertNotNull(jobService.getJobExecution(jobId).getEndTime());
    }

    @Test
    void testSubmitJob_Fails() {
        CompletableFuture<String> failing = new CompletableFuture<>();
        failing.completeExceptionally(new IllegalStateException("boom"));
        String jobId = jobService.submitJob(job("job-2", failing));

        assertThrows(ExecutionException.class,
                () -> jobService.getJobExecution(jobId).getFuture().get(10, TimeUnit.SECONDS));

        assertEquals(JobStatus.FAILED, jobService.getJobStatus(jobId));
        assertNull(jobService.getJobResult(jobId), "failed jobs have no result");
        assertNotNull(jobService.getJobError(jobId));
    }

    @Test
    void testCancelJob_Running() {
        CompletableFuture<String> neverEnding = new CompletableFuture<>();
        String jobId = jobService.submitJob(job("job-3", neverEnding));

        assertTrue(jobService.cancelJob(jobId));

        assertEquals(JobStatus.CANCELLED, jobService.getJobStatus(jobId));
        assertTrue(jobService.isJobComplete(jobId));
        assertNull(jobService.getJobError(jobId), "only failed jobs report an error");
        assertFalse(jobService.cancelJob(jobId), "a finished job cannot be cancelled again");
    }

    @Test
    void testCleanupOldJobs_KeepsRecentJobs() throws Exception {
        String jobId = jobService.submitJob(job("job-4", CompletableFuture.completedFuture("done")));
        jobService.getJobExecution(jobId).getFuture().get(10, TimeUnit.SECONDS);

        assertEquals(0, jobService.cleanupOldJobs(1));
        assertEquals(1, jobService.getAllJobExecutions().size());
        assertEquals(1, jobService.cleanupOldJobs(-1), "a negative age drops every finished job");
        assertNull(jobService.getJobExecution(jobId));
    }

    @Test
    void testUnknownJob() {
        assertNull(jobService.getJobExecution("nope"));
        assertNull(jobService.getJobStatus("nope"));
        assertFalse(jobService.isJobComplete("nope"));
    }
}
