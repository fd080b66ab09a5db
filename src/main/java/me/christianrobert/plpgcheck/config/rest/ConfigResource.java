package me.christianrobert.plpgcheck.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.plpgcheck.cache.CheckCache;
import me.christianrobert.plpgcheck.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

/**
 * Reads and changes the checker settings. Changing a {@code plpgsql_check.*} setting
 * drops the passive check cache, since routines may now be checked differently.
 */
@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigResource {

    private static final Logger log = LoggerFactory.getLogger(ConfigResource.class);

    @Inject
    ConfigService configService;

    @Inject
    CheckCache checkCache;

    @GET
    public Response getConfiguration() {
        Map<String, Object> config = configService.getAllConfiguration();
        config.put(ConfigService.POSTGRES_PASSWORD, "********");
        return Response.ok(config).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        if (config == null || config.isEmpty()) {
            return error(Response.Status.BAD_REQUEST, "Request body must contain at least one setting");
        }
        log.info("Saving {} setting(s)", config.size());
        try {
            configService.updateConfiguration(config);
        } catch (IllegalArgumentException e) {
            log.warn("Rejected configuration: {}", e.getMessage());
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
        dropCacheIfCheckerSettings(config.keySet().toArray(new String[0]));
        return Response.ok(Map.of("status", "success", "message", "Configuration saved")).build();
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        Object value = configService.getConfigValue(key);
        if (value == null) {
            return error(Response.Status.NOT_FOUND, "Configuration key not found: " + key);
        }
        if (ConfigService.POSTGRES_PASSWORD.equals(key)) {
            value = "********";
        }
        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        if (body == null || !body.containsKey("value")) {
            return error(Response.Status.BAD_REQUEST, "Request body must contain 'value' field");
        }
        log.debug("Setting {} via REST API", key);
        try {
            configService.setConfigValue(key, body.get("value"));
        } catch (IllegalArgumentException e) {
            return error(Response.Status.BAD_REQUEST, e.getMessage());
        }
        dropCacheIfCheckerSettings(key);

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("key", key);
        response.put("value", configService.getConfigValue(key));
        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        configService.resetToDefaults();
        checkCache.clear();
        return Response.ok(Map.of("status", "success", "message", "Configuration reset to defaults")).build();
    }

    private void dropCacheIfCheckerSettings(String... keys) {
        for (String key : keys) {
            if (key.startsWith("plpgsql_check.")) {
                checkCache.clear();
                return;
            }
        }
    }

    private static Response error(Response.Status status, String message) {
        return Response.status(status)
                .entity(Map.of("status", "error", "message", message))
                .build();
    }
}
