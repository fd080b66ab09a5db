package me.christianrobert.plpgcheck.check.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.plpgcheck.check.service.CheckService;
import me.christianrobert.plpgcheck.checker.CheckOptions;
import me.christianrobert.plpgcheck.checker.CheckResult;
import me.christianrobert.plpgcheck.checker.InvalidInputException;
import me.christianrobert.plpgcheck.core.job.Job;
import me.christianrobert.plpgcheck.core.job.model.check.RoutineCheckSummary;
import me.christianrobert.plpgcheck.core.job.service.JobRegistry;
import me.christianrobert.plpgcheck.core.job.service.JobService;
import me.christianrobert.plpgcheck.dependency.DependencyReport;
import me.christianrobert.plpgcheck.diagnostic.OutputFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST resource for routine checks, dependency reports and profiler coverage.
 */
@ApplicationScoped
@Path("/api/check")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class CheckResource {

    private static final Logger log = LoggerFactory.getLogger(CheckResource.class);

    @Inject
    CheckService checkService;

    @Inject
    JobService jobService;

    @Inject
    JobRegistry jobRegistry;

    @POST
    @Path("/source")
    public Response checkSource(CheckSourceRequest request) {
        if (request == null || request.getRoutine() == null || request.getRoutine().getSource() == null) {
            return error(Response.Status.BAD_REQUEST, "Request must contain a routine with source");
        }
        log.info("Checking submitted routine {}", request.getRoutine().getSignature());
        try {
            CheckOptions options = request.getOptions() != null ? request.getOptions() : CheckOptions.defaults();
            CheckResult result = checkService.checkSource(request.getRoutine(), request.getRelation(), options);
            return Response.ok(toResponse(result, options.getFormat())).build();
        } catch (InvalidInputException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Error checking submitted routine", e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Error checking routine: " + e.getMessage());
        }
    }

    @GET
    @Path("/routine/{name}")
    public Response checkRoutine(@PathParam("name") String name,
                                 @QueryParam("relation") String relation,
                                 @QueryParam("format") String format,
                                 @QueryParam("fatalErrors") @DefaultValue("true") boolean fatalErrors,
                                 @QueryParam("otherWarnings") @DefaultValue("true") boolean otherWarnings,
                                 @QueryParam("extraWarnings") @DefaultValue("true") boolean extraWarnings,
                                 @QueryParam("performanceWarnings") @DefaultValue("false") boolean performanceWarnings,
                                 @QueryParam("securityWarnings") @DefaultValue("false") boolean securityWarnings,
                                 @QueryParam("compatibilityWarnings") @DefaultValue("false") boolean compatibilityWarnings,
                                 @QueryParam("oldTable") String oldTable,
                                 @QueryParam("newTable") String newTable) {
        log.info("Checking routine {}", name);
        try {
            CheckOptions options = CheckOptions.defaults();
            options.setFormat(OutputFormat.fromString(format));
            options.setFatalErrors(fatalErrors);
            options.setOtherWarnings(otherWarnings);
            options.setExtraWarnings(extraWarnings);
            options.setPerformanceWarnings(performanceWarnings);
            options.setSecurityWarnings(securityWarnings);
            options.setCompatibilityWarnings(compatibilityWarnings);
            options.setOldTable(oldTable);
            options.setNewTable(newTable);

            CheckResult result = checkService.checkRoutine(name, relation, options);
            return Response.ok(toResponse(result, options.getFormat())).build();
        } catch (InvalidInputException | IllegalArgumentException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Error checking routine " + name, e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Error checking routine: " + e.getMessage());
        }
    }

    @GET
    @Path("/routine/{name}/dependencies")
    public Response showDependencies(@PathParam("name") String name, @QueryParam("relation") String relation) {
        log.info("Collecting dependencies of {}", name);
        try {
            DependencyReport report = checkService.showDependencies(name, relation);
            Map<String, Object> response = new HashMap<>();
            response.put("status", "success");
            response.put("functionId", report.getFunctionId());
            response.put("dependencies", report.getRows());
            return Response.ok(response).build();
        } catch (InvalidInputException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Error collecting dependencies of " + name, e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Error collecting dependencies: " + e.getMessage());
        }
    }

    @GET
    @Path("/routine/{name}/coverage")
    public Response coverage(@PathParam("name") String name,
                             @QueryParam("type") @DefaultValue("statement") String type) {
        try {
            double coverage = checkService.coverage(name, type);
            return Response.ok(Map.of("status", "success", "routine", name, "type", type, "coverage", coverage))
                    .build();
        } catch (InvalidInputException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        } catch (Exception e) {
            log.error("Error computing coverage of " + name, e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Error computing coverage: " + e.getMessage());
        }
    }

    @POST
    @Path("/profile/reset")
    public Response resetProfile(@QueryParam("routineId") String routineId) {
        checkService.resetProfile(routineId);
        String message = routineId != null ? "Profile of " + routineId + " reset" : "All profiles reset";
        log.info(message);
        return Response.ok(Map.of("status", "success", "message", message)).build();
    }

    @POST
    @Path("/jobs/routines")
    public Response checkAllRoutines() {
        return startJob("ROUTINE_CHECK", "PL/pgSQL routine check");
    }

    private Response startJob(String checkType, String friendlyName) {
        log.info("Starting {} job via REST API", friendlyName);

        try {
            Job<?> job = jobRegistry.createJob(checkType)
                    .orElseThrow(() -> new IllegalArgumentException("No job available for " + checkType));

            String jobId = jobService.submitJob(job);

            Map<String, Object> result = Map.of(
                    "status", "success",
                    "jobId", jobId,
                    "message", friendlyName + " job started successfully"
            );

            log.info("{} job started with ID: {}", friendlyName, jobId);
            return Response.ok(result).build();

        } catch (Exception e) {
            log.error("Failed to start {} job", friendlyName, e);
            return error(Response.Status.INTERNAL_SERVER_ERROR, "Failed to start " + friendlyName + ": " + e.getMessage());
        }
    }

    private Map<String, Object> toResponse(CheckResult result, OutputFormat format) {
        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("routineId", result.getRoutineId());
        response.put("checked", !result.isNotChecked());
        response.put("errorCount", result.countErrors());
        response.put("diagnostics", result.getDiagnostics());
        response.put("notices", result.getNotices());
        response.put("format", format.name());
        response.put("output", checkService.render(result, format));
        return response;
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .entity(Map.of("status", "error", "message", message))
                .build();
    }

    /**
     * Summary of a batch routine check, as returned by the job result endpoint.
     */
    public static Map<String, Object> generateRoutineCheckSummary(List<RoutineCheckSummary> summaries) {
        int total = 0;
        int clean = 0;
        int warnings = 0;
        int errors = 0;
        int failed = 0;
        Map<String, Integer> routinesPerSchema = new HashMap<>();

        for (RoutineCheckSummary summary : summaries) {
            total += summary.getTotalRoutines();
            clean += summary.getCleanCount();
            warnings += summary.getWarningCount();
            errors += summary.getErrorCount();
            failed += summary.getFailedCount();
            summary.getSchemas().forEach((schema, outcomes) ->
                    routinesPerSchema.merge(schema, outcomes.size(), Integer::sum));
        }

        return Map.of(
                "totalRoutines", total,
                "cleanCount", clean,
                "warningCount", warnings,
                "errorCount", errors,
                "failedCount", failed,
                "routinesPerSchema", routinesPerSchema,
                "message", String.format("Check completed: %d routine(s) in %d schema(s), %d with errors, %d failed",
                        total, routinesPerSchema.size(), errors, failed)
        );
    }
}
