package me.christianrobert.trigconv.trigger.transformer;

import me.christianrobert.trigconv.ir.TriggerMetadata;

/**
 * Generates PostgreSQL trigger function DDL.
 *
 * <p>PostgreSQL requires a two-part trigger definition:
 * <ol>
 *   <li><strong>Trigger Function</strong> - Contains the PL/pgSQL logic</li>
 *   <li><strong>Trigger Definition</strong> - Binds the function to table events</li>
 * </ol>
 *
 * <p>This class generates the trigger function (part 1).</p>
 *
 * <h3>PostgreSQL Trigger Function Template:</h3>
 * <pre>
 * CREATE OR REPLACE FUNCTION schema.trigger_name_func()
 * RETURNS TRIGGER AS $$
 * DECLARE
 *   ...
 * BEGIN
 *   -- Converted trigger body (PL/pgSQL)
 *   RETURN NEW;
 * END;
 * $$ LANGUAGE plpgsql;
 * </pre>
 *
 * <h3>Naming Convention:</h3>
 * <p>Function name = trigger_name + "_func" suffix</p>
 * <p>Example: audit_trigger → audit_trigger_func</p>
 */
public class TriggerFunctionGenerator {

    /**
     * Generates CREATE OR REPLACE FUNCTION DDL for a trigger function.
     *
     * @param metadata Trigger metadata (trigger name, optional schema)
     * @param defaultSchema Schema used when the metadata names none
     * @param convertedBody Complete PL/pgSQL block, ending with {@code END;}
     * @return CREATE FUNCTION DDL statement
     * @throws IllegalArgumentException if metadata or body is null/empty
     */
    public static String generateFunctionDdl(TriggerMetadata metadata, String defaultSchema, String convertedBody) {
        if (metadata == null) {
            throw new IllegalArgumentException("TriggerMetadata cannot be null");
        }
        if (convertedBody == null || convertedBody.trim().isEmpty()) {
            throw new IllegalArgumentException("Converted body cannot be null or empty");
        }

        String qualifiedName = getQualifiedFunctionName(schemaOf(metadata, defaultSchema), metadata.getTriggerName());

        StringBuilder ddl = new StringBuilder();
        ddl.append("CREATE OR REPLACE FUNCTION ")
           .append(qualifiedName)
           .append("()\n");
        ddl.append("RETURNS TRIGGER AS $$\n");
        ddl.append(convertedBody);
        if (!convertedBody.endsWith("\n")) {
            ddl.append("\n");
        }
        ddl.append("$$ LANGUAGE plpgsql;\n");

        return ddl.toString();
    }

    /**
     * Generates just the function name (without schema qualification).
     *
     * @param triggerName Original trigger name
     * @return Function name (trigger_name + "_func")
     */
    public static String getFunctionName(String triggerName) {
        if (triggerName == null || triggerName.isEmpty()) {
            throw new IllegalArgumentException("Trigger name cannot be null or empty");
        }
        return triggerName + "_func";
    }

    /**
     * Generates the qualified function name (schema.function_name).
     */
    public static String getQualifiedFunctionName(String schema, String triggerName) {
        if (schema == null || schema.isEmpty()) {
            throw new IllegalArgumentException("Schema cannot be null or empty");
        }
        return schema + "." + getFunctionName(triggerName);
    }

    static String schemaOf(TriggerMetadata metadata, String defaultSchema) {
        String schema = metadata.getSchema();
        return schema == null || schema.isEmpty() ? defaultSchema : schema;
    }
}
