package me.christianrobert.trigconv.trigger.transformer;

import me.christianrobert.trigconv.ir.TriggerMetadata;

/**
 * Generates PostgreSQL CREATE TRIGGER DDL statements.
 *
 * <p>This class generates the trigger definition (part 2 of the two-part
 * PostgreSQL trigger system) that binds a trigger function to table events.</p>
 *
 * <h3>PostgreSQL Trigger Definition Template:</h3>
 * <pre>
 * CREATE TRIGGER trigger_name
 *   {BEFORE|AFTER|INSTEAD OF} {INSERT|UPDATE [OF col, ...]|DELETE} [OR ...]
 *   ON schema.table_name
 *   [FOR EACH ROW]
 *   [WHEN (condition)]
 *   EXECUTE FUNCTION schema.trigger_name_func();
 * </pre>
 */
public class TriggerDefinitionGenerator {

    /**
     * Generates CREATE TRIGGER DDL statement.
     *
     * @param metadata Trigger metadata with all trigger characteristics
     * @param defaultSchema Schema used when the metadata names none
     * @param convertedWhenClause WHEN condition already converted to PostgreSQL, or null
     * @return CREATE TRIGGER DDL statement
     * @throws IllegalArgumentException if metadata is null or incomplete
     */
    public static String generateTriggerDdl(TriggerMetadata metadata, String defaultSchema, String convertedWhenClause) {
        if (metadata == null) {
            throw new IllegalArgumentException("TriggerMetadata cannot be null");
        }
        if (!metadata.isComplete()) {
            throw new IllegalArgumentException("Trigger metadata is incomplete: " + metadata);
        }

        String schema = TriggerFunctionGenerator.schemaOf(metadata, defaultSchema);
        String tableSchema = metadata.getTableSchema() != null ? metadata.getTableSchema() : schema;

        StringBuilder ddl = new StringBuilder();

        ddl.append("CREATE TRIGGER ")
           .append(metadata.getTriggerName())
           .append("\n");

        ddl.append("  ")
           .append(metadata.getTiming())
           .append(" ")
           .append(events(metadata))
           .append("\n");

        ddl.append("  ON ")
           .append(tableSchema)
           .append(".")
           .append(metadata.getTableName())
           .append("\n");

        if (metadata.isRowLevel()) {
            ddl.append("  FOR EACH ROW\n");
        }

        if (convertedWhenClause != null && !convertedWhenClause.trim().isEmpty()) {
            ddl.append("  WHEN (")
               .append(convertedWhenClause.trim())
               .append(")\n");
        }

        ddl.append("  EXECUTE FUNCTION ")
           .append(TriggerFunctionGenerator.getQualifiedFunctionName(schema, metadata.getTriggerName()))
           .append("();\n");

        return ddl.toString();
    }

    // INSERT OR UPDATE OF a, b OR DELETE
    private static String events(TriggerMetadata metadata) {
        StringBuilder sb = new StringBuilder();
        for (String event : metadata.getEvents()) {
            if (sb.length() > 0) {
                sb.append(" OR ");
            }
            sb.append(event);
            if ("UPDATE".equals(event) && !metadata.getUpdateColumns().isEmpty()) {
                sb.append(" OF ").append(String.join(", ", metadata.getUpdateColumns()));
            }
        }
        return sb.toString();
    }
}
