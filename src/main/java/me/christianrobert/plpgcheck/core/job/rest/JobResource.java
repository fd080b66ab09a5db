package me.christianrobert.plpgcheck.core.job.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.plpgcheck.check.rest.CheckResource;
import me.christianrobert.plpgcheck.core.job.model.JobProgress;
import me.christianrobert.plpgcheck.core.job.model.JobStatus;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary;
import me.christianrobert.plpgcheck.core.job.service.JobRegistry;
import me.christianrobert.plpgcheck.core.job.service.JobService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Generic REST resource for job status and result retrieval.
 * Endpoints that start jobs live in the domain resources.
 */
@ApplicationScoped
@Path("/api/jobs")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class JobResource {

    private static final Logger log = LoggerFactory.getLogger(JobResource.class);

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @GET
    @Path("/types")
    public Response getJobTypes() {
        return Response.ok(jobRegistry.getAvailableJobTypes()).build();
    }

    @GET
    @Path("/{jobId}/status")
    public Response getJobStatus(@PathParam("jobId") String jobId) {
        log.debug("Getting job status for: {}", jobId);

        JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);
        if (execution == null) {
            return notFound(jobId);
        }

        JobStatus status = execution.getStatus();
        JobProgress progress = execution.getProgress();

        Map<String, Object> result = new HashMap<>();
        result.put("jobId", jobId);
        result.put("jobType", execution.getJob().getJobType());
        result.put("status", status.name());
        result.put("isComplete", jobService.isJobComplete(jobId));

        if (progress != null) {
            Map<String, Object> progressInfo = new HashMap<>();
            progressInfo.put("percentage", progress.getPercentage());
            progressInfo.put("currentTask", progress.getCurrentTask());
            progressInfo.put("details", progress.getDetails());
            progressInfo.put("processedItems", progress.getProcessedItems());
            progressInfo.put("totalItems", progress.getTotalItems());
            progressInfo.put("lastUpdated", progress.getLastUpdated().toString());
            result.put("progress", progressInfo);
        }

        if (status == JobStatus.FAILED) {
            Exception error = jobService.getJobError(jobId);
            if (error != null) {
                result.put("error", error.getMessage());
            }
        }
        if (execution.getStartTime() != null) {
            result.put("startTime", execution.getStartTime().toString());
        }
        if (execution.getEndTime() != null) {
            result.put("endTime", execution.getEndTime().toString());
        }

        return Response.ok(result).build();
    }

    @GET
    @Path("/{jobId}/result")
    public Response getJobResult(@PathParam("jobId") String jobId) {
        log.debug("Getting job result for: {}", jobId);

        try {
            JobService.JobExecution<?> execution = jobService.getJobExecution(jobId);
            if (execution == null) {
                return notFound(jobId);
            }

            if (!jobService.isJobComplete(jobId)) {
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(Map.of("status", "error", "message", "Job is not yet complete: " + jobId))
                        .build();
            }

            if (execution.getStatus() != JobStatus.COMPLETED) {
                Exception error = execution.getError();
                Map<String, Object> errorResult = Map.of(
                        "status", execution.getStatus() == JobStatus.CANCELLED ? "cancelled" : "failed",
                        "jobId", jobId,
                        "message", error != null ? error.getMessage() : "Job failed with unknown error"
                );
                return Response.status(Response.Status.BAD_REQUEST)
                        .entity(errorResult)
                        .build();
            }

            Object result = jobService.getJobResult(jobId);

            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("jobId", jobId);
            response.put("jobType", execution.getJob().getJobType());
            response.put("result", result);

            List<RoutineCheckSummary> summaries = routineCheckSummaries(result);
            if (!summaries.isEmpty()) {
                response.put("summary", CheckResource.generateRoutineCheckSummary(summaries));
            }

            return Response.ok(response).build();

        } catch (Exception e) {
            log.error("Error getting job result for: " + jobId, e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(Map.of("status", "error", "message", "Error getting job result: " + e.getMessage()))
                    .build();
        }
    }

    @POST
    @Path("/{jobId}/cancel")
    public Response cancelJob(@PathParam("jobId") String jobId) {
        if (jobService.getJobExecution(jobId) == null) {
            return notFound(jobId);
        }
        if (!jobService.cancelJob(jobId)) {
            return Response.status(Response.Status.CONFLICT)
                    .entity(Map.of("status", "error", "message", "Job already finished: " + jobId))
                    .build();
        }
        log.info("Cancelled job {}", jobId);
        return Response.ok(Map.of("status", "success", "jobId", jobId, "message", "Job cancelled")).build();
    }

    @DELETE
    @Path("/finished")
    public Response cleanupFinishedJobs(@QueryParam("maxAgeHours") @DefaultValue("24") int maxAgeHours) {
        int removed = jobService.cleanupOldJobs(maxAgeHours);
        return Response.ok(Map.of("status", "success", "removed", removed)).build();
    }

    private static List<RoutineCheckSummary> routineCheckSummaries(Object result) {
        List<RoutineCheckSummary> summaries = new ArrayList<>();
        if (result instanceof List) {
            for (Object item : (List<?>) result) {
                if (item instanceof RoutineCheckSummary) {
                    summaries.add((RoutineCheckSummary) item);
                }
            }
        }
        return summaries;
    }

    private static Response notFound(String jobId) {
        return Response.status(Response.Status.NOT_FOUND)
                .entity(Map.of("status", "error", "message", "Job not found: " + jobId))
                .build();
    }
}
