package me.christianrobert.trigconv.trigger.rest;

import jakarta.inject.Inject;
import jakarta.ws.rs.*;
import jakarta.ws.rs.core.MediaType;
import me.christianrobert.trigconv.core.exception.TriggerConversionException;
import me.christianrobert.trigconv.trigger.model.BatchConversionResult;
import me.christianrobert.trigconv.trigger.model.ConversionResult;
import me.christianrobert.trigconv.trigger.model.TriggerSource;
import me.christianrobert.trigconv.trigger.service.TriggerConversionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * REST endpoint for Oracle trigger to PL/pgSQL conversion.
 *
 * <p>Usage:
 * <pre>
 * # Convert a trigger (body with optional CREATE TRIGGER header)
 * curl -X POST "http://localhost:8080/api/triggers/convert?name=trg_emp_audit" \
 *   -H "Content-Type: text/plain" \
 *   --data-binary @trg_emp_audit.sql
 *
 * # Show the parsed IR document
 * curl -X POST "http://localhost:8080/api/triggers/parse" -H "Content-Type: text/plain" --data-binary @trg.sql
 *
 * # Convert several triggers, each with optional explicit metadata
 * curl -X POST "http://localhost:8080/api/triggers/convert/batch" \
 *   -H "Content-Type: application/json" \
 *   --data '[{"name": "first", "triggerName": "trg_a", "triggerText": "BEGIN ... END;", "timing": "BEFORE", "events": ["INSERT"], "tableName": "emp", "level": "ROW"}]'
 * </pre>
 *
 * <p>Note: Always returns HTTP 200. Check "success" field in response.
 * A trigger that cannot be converted is a valid business outcome, not an HTTP error.
 */
@Path("/api/triggers")
@Produces(MediaType.APPLICATION_JSON)
public class TriggerConversionResource {

    private static final Logger log = LoggerFactory.getLogger(TriggerConversionResource.class);

    @Inject
    TriggerConversionService conversionService;

    @POST
    @Path("/convert")
    @Consumes(MediaType.TEXT_PLAIN)
    public ConversionResult convert(@QueryParam("name") String name, String triggerText) {
        log.info("Trigger conversion request received via REST API");
        log.trace("Trigger text: {}", triggerText);

        if (triggerText == null || triggerText.trim().isEmpty()) {
            log.warn("Empty trigger text received");
            return ConversionResult.failure(name, new TriggerConversionException("Trigger text cannot be empty"));
        }

        ConversionResult result = conversionService.convert(new TriggerSource(name, triggerText));
        if (result.isFailure()) {
            log.warn("Trigger conversion failed: {}", result.getErrorMessage());
        }
        return result;
    }

    @POST
    @Path("/convert/batch")
    @Consumes(MediaType.APPLICATION_JSON)
    public BatchConversionResult convertBatch(List<TriggerSource> sources) {
        log.info("Batch conversion request with {} triggers", sources == null ? 0 : sources.size());
        return conversionService.convertBatch(sources == null ? List.of() : sources);
    }

    /**
     * Parses a trigger and returns the IR document, or a failure object with the error position.
     */
    @POST
    @Path("/parse")
    @Consumes(MediaType.TEXT_PLAIN)
    public Map<String, Object> parse(@QueryParam("name") String name, String triggerText) {
        log.info("Trigger parse request received via REST API");

        Map<String, Object> response = new HashMap<>();
        try {
            response.put("ir", conversionService.parseToJson(new TriggerSource(name, triggerText)));
            response.put("success", true);
        } catch (TriggerConversionException e) {
            log.warn("Trigger parse failed ({}): {}", e.getErrorKind(), e.getMessage());
            response.put("success", false);
            response.put("errorKind", e.getErrorKind());
            response.put("errorMessage", e.getDetailedMessage());
            response.put("lineNumber", e.getLineNumber());
        }
        return response;
    }
}
