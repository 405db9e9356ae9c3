package me.christianrobert.trigconv.trigger.transformer;

import me.christianrobert.trigconv.ir.TriggerMetadata;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TriggerDefinitionGenerator.
 *
 * Purpose: CREATE TRIGGER clauses for each timing, level and event combination.
 */
class TriggerDefinitionGeneratorTest {

    @Test
    void beforeInsertRowTrigger() {
        TriggerMetadata metadata = TriggerMetadata.builder()
                .schema("hr").triggerName("trg_emp").timing("BEFORE").event("INSERT")
                .tableSchema("hr").tableName("emp").level("ROW").build();

        assertEquals("CREATE TRIGGER trg_emp\n"
                        + "  BEFORE INSERT\n"
                        + "  ON hr.emp\n"
                        + "  FOR EACH ROW\n"
                        + "  EXECUTE FUNCTION hr.trg_emp_func();\n",
                TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", null));
    }

    @Test
    void statementTrigger_noForEachRow() {
        TriggerMetadata metadata = TriggerMetadata.builder()
                .triggerName("trg_audit").timing("AFTER").event("DELETE").tableName("emp").level("STATEMENT").build();

        String ddl = TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", null);

        assertFalse(ddl.contains("FOR EACH ROW"));
        assertTrue(ddl.contains("  ON public.emp\n"));
        assertTrue(ddl.contains("EXECUTE FUNCTION public.trg_audit_func();"));
    }

    @Test
    void multipleEventsWithUpdateColumns() {
        TriggerMetadata metadata = TriggerMetadata.builder()
                .triggerName("t").timing("AFTER").event("INSERT").event("UPDATE").updateColumn("sal")
                .updateColumn("comm").event("DELETE").tableName("emp").level("ROW").build();

        String ddl = TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", null);

        assertTrue(ddl.contains("  AFTER INSERT OR UPDATE OF sal, comm OR DELETE\n"));
    }

    @Test
    void tableSchemaDiffersFromTriggerSchema() {
        TriggerMetadata metadata = TriggerMetadata.builder()
                .schema("audit").triggerName("t").timing("AFTER").event("INSERT")
                .tableSchema("hr").tableName("emp").level("ROW").build();

        String ddl = TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", null);

        assertTrue(ddl.contains("  ON hr.emp\n"));
        assertTrue(ddl.contains("EXECUTE FUNCTION audit.t_func();"));
    }

    @Test
    void whenClauseWrappedInParentheses() {
        TriggerMetadata metadata = TriggerMetadata.builder()
                .triggerName("t").timing("BEFORE").event("UPDATE").tableName("emp").level("ROW").build();

        String ddl = TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", " NEW.sal > 0 ");

        assertTrue(ddl.contains("  FOR EACH ROW\n  WHEN (NEW.sal > 0)\n  EXECUTE FUNCTION"));
    }

    @Test
    void blankWhenClause_omitted() {
        TriggerMetadata metadata = TriggerMetadata.builder()
                .triggerName("t").timing("BEFORE").event("UPDATE").tableName("emp").level("ROW").build();

        assertFalse(TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", "  ").contains("WHEN"));
    }

    @Test
    void incompleteMetadata_rejected() {
        TriggerMetadata metadata = TriggerMetadata.builder().triggerName("t").build();

        assertThrows(IllegalArgumentException.class,
                () -> TriggerDefinitionGenerator.generateTriggerDdl(metadata, "public", null));
        assertThrows(IllegalArgumentException.class,
                () -> TriggerDefinitionGenerator.generateTriggerDdl(null, "public", null));
    }
}
