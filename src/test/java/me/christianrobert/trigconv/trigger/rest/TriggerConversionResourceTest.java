package me.christianrobert.trigconv.trigger.rest;

import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.trigconv.config.service.ConfigService;
import me.christianrobert.trigconv.translator.mapping.ClasspathMappingTableProvider;
import me.christianrobert.trigconv.trigger.model.BatchConversionResult;
import me.christianrobert.trigconv.trigger.model.ConversionResult;
import me.christianrobert.trigconv.trigger.model.TriggerSource;
import me.christianrobert.trigconv.trigger.service.TriggerConversionService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TriggerConversionResource.
 *
 * Note: Creates the resource manually with a real service; no HTTP layer involved.
 */
class TriggerConversionResourceTest {

    private TriggerConversionResource resource;

    @BeforeEach
    void setUp() {
        resource = new TriggerConversionResource();
        resource.conversionService = new TriggerConversionService(new ConfigService(),
                new ClasspathMappingTableProvider());
    }

    @Test
    void convert_success() {
        ConversionResult result = resource.convert("t", "BEGIN\n  x := NVL(y, 0);\nEND;");

        assertTrue(result.isSuccess());
        assertTrue(result.getPostgresBody().contains("x := COALESCE(y, 0);"));
    }

    @Test
    void convert_emptyTextIsFailedResult() {
        ConversionResult result = resource.convert("t", "  ");

        assertTrue(result.isFailure());
        assertEquals("t", result.getTriggerName());
    }

    @Test
    void convertBatch_nullBodyIsEmptyBatch() {
        BatchConversionResult batch = resource.convertBatch(null);
        assertEquals(0, batch.getTotalCount());
    }

    @Test
    void convertBatch_mixedResults() {
        BatchConversionResult batch = resource.convertBatch(List.of(
                new TriggerSource("ok", "BEGIN\n  NULL;\nEND;"),
                new TriggerSource("bad", "BEGIN\n  NULL;\n")));

        assertEquals(1, batch.getSuccessCount());
        assertEquals(1, batch.getFailureCount());
    }

    @Test
    void parse_returnsIr() {
        Map<String, Object> response = resource.parse("t", "BEGIN\n  NULL;\nEND;");

        assertEquals(true, response.get("success"));
        assertInstanceOf(ObjectNode.class, response.get("ir"));
    }

    @Test
    void parse_failureCarriesPosition() {
        Map<String, Object> response = resource.parse("t", "BEGIN\n  IF x THEN\n    NULL;\n  END LOOP;\nEND;");

        assertEquals(false, response.get("success"));
        assertEquals("STRUCTURAL_PARSE_ERROR", response.get("errorKind"));
        assertEquals(4, response.get("lineNumber"));
    }
}
