package me.christianrobert.trigconv.config.service;

import me.christianrobert.trigconv.parser.ParseLimits;
import me.christianrobert.trigconv.translator.ConversionOptions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for ConfigService.
 *
 * Purpose: defaults, value coercion and the typed views handed to the converter.
 */
class ConfigServiceTest {

    private ConfigService configService;

    @BeforeEach
    void setUp() {
        configService = new ConfigService();
    }

    @Test
    void defaults() {
        ParseLimits limits = configService.getParseLimits();
        ConversionOptions options = configService.getConversionOptions();

        assertEquals(ParseLimits.DEFAULT_MAX_LINES, limits.getMaxLines());
        assertEquals(ParseLimits.DEFAULT_MAX_NESTING_DEPTH, limits.getMaxNestingDepth());
        assertEquals("NEW", options.getNewRecordName());
        assertEquals("TG_OP", options.getOperationVariable());
        assertEquals(2, options.getIndentWidth());
        assertTrue(options.isGenerateDdl());
        assertEquals("public", options.getDefaultSchema());
        assertEquals("", configService.getConfigValueAsString(ConfigService.MAPPING_DIRECTORY));
    }

    @Test
    void stringValuesCoerced() {
        configService.updateConfiguration(Map.of(
                ConfigService.MAX_LINES, " 500 ",
                ConfigService.GENERATE_DDL, "false",
                ConfigService.INDENT, 4L));

        assertEquals(500, configService.getParseLimits().getMaxLines());
        assertFalse(configService.getConversionOptions().isGenerateDdl());
        assertEquals(4, configService.getConversionOptions().getIndentWidth());
    }

    @Test
    void unparseableNumber_fallsBack() {
        configService.setConfigValue(ConfigService.MAX_NESTING_DEPTH, "deep");
        assertEquals(ParseLimits.DEFAULT_MAX_NESTING_DEPTH, configService.getParseLimits().getMaxNestingDepth());
    }

    @Test
    void blankNames_useDefaults() {
        configService.setConfigValue(ConfigService.NEW_RECORD_NAME, "  ");
        configService.setConfigValue(ConfigService.DEFAULT_SCHEMA, " app ");

        ConversionOptions options = configService.getConversionOptions();
        assertEquals("NEW", options.getNewRecordName());
        assertEquals("app", options.getDefaultSchema());
    }

    @Test
    void optionsAreSnapshots() {
        ConversionOptions before = configService.getConversionOptions();
        configService.setConfigValue(ConfigService.OPERATION_VARIABLE, "op");

        assertEquals("TG_OP", before.getOperationVariable());
        assertEquals("op", configService.getConversionOptions().getOperationVariable());
    }

    @Test
    void invalidValue_rejectedAndPreviousValueKept() {
        assertThrows(IllegalArgumentException.class, () -> configService.setConfigValue(ConfigService.INDENT, 40));
        assertEquals(2, configService.getConversionOptions().getIndentWidth());

        assertThrows(IllegalArgumentException.class, () -> configService.setConfigValue(ConfigService.MAX_LINES, 0));
        assertEquals(ParseLimits.DEFAULT_MAX_LINES, configService.getParseLimits().getMaxLines());
    }

    @Test
    void nestingDepthAboveHardCeiling_rejected() {
        assertThrows(IllegalArgumentException.class,
                () -> configService.setConfigValue(ConfigService.MAX_NESTING_DEPTH, 1000000));
        assertEquals(ParseLimits.DEFAULT_MAX_NESTING_DEPTH, configService.getParseLimits().getMaxNestingDepth());

        configService.setConfigValue(ConfigService.MAX_NESTING_DEPTH, ParseLimits.HARD_MAX_NESTING_DEPTH);
        assertEquals(ParseLimits.HARD_MAX_NESTING_DEPTH, configService.getParseLimits().getMaxNestingDepth());
    }

    @Test
    void invalidBulkUpdate_appliesNothing() {
        assertThrows(IllegalArgumentException.class, () -> configService.updateConfiguration(Map.of(
                ConfigService.OPERATION_VARIABLE, "op",
                ConfigService.MAX_NESTING_DEPTH, 257)));

        assertEquals("TG_OP", configService.getConfigValue(ConfigService.OPERATION_VARIABLE));
        assertEquals(ParseLimits.DEFAULT_MAX_NESTING_DEPTH, configService.getParseLimits().getMaxNestingDepth());
    }

    @Test
    void resetRestoresDefaults() {
        configService.setConfigValue(ConfigService.OPERATION_VARIABLE, "op");
        configService.setConfigValue("custom.key", "x");

        configService.resetToDefaults();

        assertEquals("TG_OP", configService.getConfigValue(ConfigService.OPERATION_VARIABLE));
        assertFalse(configService.hasConfigKey("custom.key"));
    }
}
