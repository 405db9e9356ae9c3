package me.christianrobert.trigconv.config.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;
import me.christianrobert.trigconv.config.service.ConfigService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;

@Path("/api/config")
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class ConfigRestService {

    private static final Logger log = LoggerFactory.getLogger(ConfigRestService.class);

    @Inject
    ConfigService configService;

    @GET
    public Response getConfiguration() {
        log.info("Getting configuration");
        return Response.ok(configService.getAllConfiguration()).build();
    }

    @POST
    public Response saveConfiguration(Map<String, Object> config) {
        log.info("Saving configuration with {} entries", config.size());

        try {
            configService.updateConfiguration(config);
            return Response.ok(status("success", "Configuration saved successfully")).build();
        } catch (IllegalArgumentException e) {
            log.warn("Invalid configuration submitted: {}", e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(status("error", "Invalid configuration: " + e.getMessage()))
                    .build();
        } catch (Exception e) {
            log.error("Error saving configuration", e);
            return Response.status(Response.Status.INTERNAL_SERVER_ERROR)
                    .entity(status("error", "Failed to save configuration: " + e.getMessage()))
                    .build();
        }
    }

    @GET
    @Path("/{key}")
    public Response getConfigValue(@PathParam("key") String key) {
        log.debug("Getting config value for key: {}", key);

        Object value = configService.getConfigValue(key);
        if (value == null) {
            return Response.status(Response.Status.NOT_FOUND)
                    .entity(Map.of("error", "Configuration key not found: " + key))
                    .build();
        }

        return Response.ok(Map.of("key", key, "value", value)).build();
    }

    @PUT
    @Path("/{key}")
    public Response setConfigValue(@PathParam("key") String key, Map<String, Object> body) {
        log.debug("Setting config value for key: {}", key);

        if (body == null || !body.containsKey("value")) {
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Request body must contain 'value' field"))
                    .build();
        }

        Object value = body.get("value");
        try {
            configService.setConfigValue(key, value);
        } catch (IllegalArgumentException e) {
            log.warn("Invalid value for {}: {}", key, e.getMessage());
            return Response.status(Response.Status.BAD_REQUEST)
                    .entity(Map.of("error", "Invalid configuration: " + e.getMessage()))
                    .build();
        }

        Map<String, Object> response = new HashMap<>();
        response.put("status", "success");
        response.put("message", "Configuration value updated successfully");
        response.put("key", key);
        response.put("value", value);

        return Response.ok(response).build();
    }

    @POST
    @Path("/reset")
    public Response resetConfiguration() {
        log.info("Resetting configuration to defaults");
        configService.resetToDefaults();
        return Response.ok(status("success", "Configuration reset to defaults successfully")).build();
    }

    private static Map<String, String> status(String status, String message) {
        Map<String, String> response = new HashMap<>();
        response.put("status", status);
        response.put("message", message);
        return response;
    }
}
