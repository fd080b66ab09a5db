package me.christianrobert.plpgcheck.database.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.plpgcheck.database.service.PostgresConnectionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

@Path("/api/database")
@Produces(MediaType.APPLICATION_JSON)
public class ConnectionTestResource {

    private static final Logger log = LoggerFactory.getLogger(ConnectionTestResource.class);

    @Inject
    PostgresConnectionService postgresConnectionService;

    /**
     * 200 when the configured server can be checked, 503 otherwise.
     */
    @GET
    @Path("/status")
    public Response status() {
        if (!postgresConnectionService.isConfigured()) {
            return Response.status(Response.Status.SERVICE_UNAVAILABLE)
                    .entity(Map.of("status", "error", "connected", false,
                            "message", "PostgreSQL connection parameters not configured"))
                    .build();
        }
        log.info("Checking PostgreSQL server status via REST API");
        Map<String, Object> result = postgresConnectionService.testConnection();
        Response.Status status = "success".equals(result.get("status"))
                ? Response.Status.OK : Response.Status.SERVICE_UNAVAILABLE;
        return Response.status(status).entity(result).build();
    }
}
