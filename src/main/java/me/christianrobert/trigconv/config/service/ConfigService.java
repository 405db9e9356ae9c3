package me.christianrobert.trigconv.config.service;

import jakarta.enterprise.context.ApplicationScoped;
import me.christianrobert.trigconv.parser.ParseLimits;
import me.christianrobert.trigconv.translator.ConversionOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

@ApplicationScoped
public class ConfigService {

    private static final Logger log = LoggerFactory.getLogger(ConfigService.class);

    public static final String MAX_LINES = "conversion.max-lines";
    public static final String MAX_NESTING_DEPTH = "conversion.max-nesting-depth";
    public static final String NEW_RECORD_NAME = "conversion.new-record-name";
    public static final String OLD_RECORD_NAME = "conversion.old-record-name";
    public static final String OPERATION_VARIABLE = "conversion.operation-variable";
    public static final String INDENT = "conversion.indent";
    public static final String GENERATE_DDL = "conversion.generate-ddl";
    public static final String DEFAULT_SCHEMA = "conversion.default-schema";
    public static final String MAPPING_DIRECTORY = "mapping.directory";

    private final Map<String, Object> configuration = new ConcurrentHashMap<>();

    public ConfigService() {
        initializeDefaultConfiguration();
    }

    private void initializeDefaultConfiguration() {
        configuration.put(MAX_LINES, ParseLimits.DEFAULT_MAX_LINES);
        configuration.put(MAX_NESTING_DEPTH, ParseLimits.DEFAULT_MAX_NESTING_DEPTH);
        configuration.put(NEW_RECORD_NAME, "NEW");
        configuration.put(OLD_RECORD_NAME, "OLD");
        configuration.put(OPERATION_VARIABLE, "TG_OP");
        configuration.put(INDENT, 2);
        configuration.put(GENERATE_DDL, true);
        configuration.put(DEFAULT_SCHEMA, "public");
        configuration.put(MAPPING_DIRECTORY, "");

        log.info("Configuration service initialized with default values");
    }

    public Map<String, Object> getAllConfiguration() {
        return new HashMap<>(configuration);
    }

    public Object getConfigValue(String key) {
        return configuration.get(key);
    }

    public String getConfigValueAsString(String key) {
        Object value = configuration.get(key);
        return value != null ? value.toString() : null;
    }

    public Boolean getConfigValueAsBoolean(String key) {
        Object value = configuration.get(key);
        if (value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof String) {
            return Boolean.parseBoolean((String) value);
        }
        return null;
    }

    /**
     * Gets a configuration value as an integer. JSON bodies deliver numbers as Integer or Long,
     * hand-edited values arrive as strings; anything unparseable yields the fallback.
     */
    public int getConfigValueAsInt(String key, int fallback) {
        Object value = configuration.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        if (value instanceof String) {
            try {
                return Integer.parseInt(((String) value).trim());
            } catch (NumberFormatException e) {
                log.warn("Config value {} = '{}' is not a number, using {}", key, value, fallback);
            }
        }
        return fallback;
    }

    /**
     * Applies all entries, or none of them when the resulting settings are unusable.
     *
     * @throws IllegalArgumentException if a value is rejected by the conversion core
     */
    public void updateConfiguration(Map<String, Object> newConfig) {
        log.info("Updating configuration with {} entries", newConfig.size());

        Map<String, Object> previous = new HashMap<>(configuration);
        newConfig.forEach((key, value) -> {
            Object oldValue = configuration.put(key, value);
            if (log.isDebugEnabled()) {
                log.debug("Config updated: {} = {} (was: {})", key, value, oldValue);
            }
        });
        try {
            validate();
        } catch (IllegalArgumentException e) {
            configuration.clear();
            configuration.putAll(previous);
            throw e;
        }

        log.info("Configuration updated successfully");
    }

    /**
     * @throws IllegalArgumentException if the value is rejected by the conversion core; the old value stays
     */
    public void setConfigValue(String key, Object value) {
        Object oldValue = configuration.put(key, value);
        try {
            validate();
        } catch (IllegalArgumentException e) {
            if (oldValue != null) {
                configuration.put(key, oldValue);
            } else {
                configuration.remove(key);
            }
            throw e;
        }
        log.debug("Config value set: {} = {} (was: {})", key, value, oldValue);
    }

    // the typed views reject what the converter could not run with
    private void validate() {
        getParseLimits();
        getConversionOptions();
    }

    public boolean hasConfigKey(String key) {
        return configuration.containsKey(key);
    }

    public void resetToDefaults() {
        log.info("Resetting configuration to defaults");
        configuration.clear();
        initializeDefaultConfiguration();
    }

    // ========== Typed views for the conversion core ==========

    public ParseLimits getParseLimits() {
        return new ParseLimits(getConfigValueAsInt(MAX_LINES, ParseLimits.DEFAULT_MAX_LINES),
                getConfigValueAsInt(MAX_NESTING_DEPTH, ParseLimits.DEFAULT_MAX_NESTING_DEPTH));
    }

    /**
     * Snapshot of the current settings; later configuration changes do not affect it.
     */
    public ConversionOptions getConversionOptions() {
        ConversionOptions defaults = ConversionOptions.defaults();
        Boolean generateDdl = getConfigValueAsBoolean(GENERATE_DDL);
        return ConversionOptions.builder()
                .newRecordName(valueOr(NEW_RECORD_NAME, defaults.getNewRecordName()))
                .oldRecordName(valueOr(OLD_RECORD_NAME, defaults.getOldRecordName()))
                .operationVariable(valueOr(OPERATION_VARIABLE, defaults.getOperationVariable()))
                .indentWidth(getConfigValueAsInt(INDENT, defaults.getIndentWidth()))
                .generateDdl(generateDdl != null ? generateDdl : defaults.isGenerateDdl())
                .defaultSchema(valueOr(DEFAULT_SCHEMA, defaults.getDefaultSchema()))
                .build();
    }

    private String valueOr(String key, String fallback) {
        String value = getConfigValueAsString(key);
        return value == null || value.trim().isEmpty() ? fallback : value.trim();
    }
}
