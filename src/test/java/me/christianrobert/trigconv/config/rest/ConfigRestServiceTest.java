package me.christianrobert.trigconv.config.rest;

import jakarta.ws.rs.core.Response;
import me.christianrobert.trigconv.config.service.ConfigService;
import me.christianrobert.trigconv.parser.ParseLimits;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigRestService.
 *
 * Note: Creates the resource manually with a real ConfigService; no HTTP layer involved.
 */
class ConfigRestServiceTest {

    private ConfigRestService resource;
    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
        resource = new ConfigRestService();
        resource.configService = configService;
    }

    @Test
    void putValue_success() {
        Response response = resource.setConfigValue(ConfigService.OPERATION_VARIABLE, Map.of("value", "op"));

        assertEquals(200, response.getStatus());
        assertEquals("op", configService.getConfigValue(ConfigService.OPERATION_VARIABLE));
    }

    @Test
    void putValue_depthAboveCeilingIsBadRequest() {
        Response response = resource.setConfigValue(ConfigService.MAX_NESTING_DEPTH, Map.of("value", 1000000));

        assertEquals(400, response.getStatus());
        assertEquals(ParseLimits.DEFAULT_MAX_NESTING_DEPTH, configService.getParseLimits().getMaxNestingDepth());
    }

    @Test
    void putValue_missingValueIsBadRequest() {
        assertEquals(400, resource.setConfigValue(ConfigService.INDENT, Map.of()).getStatus());
    }

    @Test
    void saveConfiguration_invalidIsBadRequest() {
        Response response = resource.saveConfiguration(Map.of(ConfigService.INDENT, 40));

        assertEquals(400, response.getStatus());
        assertEquals(2, configService.getConversionOptions().getIndentWidth());
    }
}
