package me.christianrobert.trigconv.trigger.transformer;

import me.christianrobert.trigconv.ir.TriggerMetadata;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TriggerFunctionGenerator.
 *
 * Purpose: CREATE FUNCTION wrapping and function naming.
 */
class TriggerFunctionGeneratorTest {

    private static final String BODY = "BEGIN\n  RETURN NEW;\nEND;\n";

    @Test
    void wrapsBodyInFunction() {
        TriggerMetadata metadata = TriggerMetadata.builder().schema("hr").triggerName("trg_emp").build();

        String ddl = TriggerFunctionGenerator.generateFunctionDdl(metadata, "public", BODY);

        assertEquals("CREATE OR REPLACE FUNCTION hr.trg_emp_func()\n"
                + "RETURNS TRIGGER AS $$\n"
                + "BEGIN\n  RETURN NEW;\nEND;\n"
                + "$$ LANGUAGE plpgsql;\n", ddl);
    }

    @Test
    void missingSchema_usesDefault() {
        TriggerMetadata metadata = TriggerMetadata.builder().triggerName("trg_emp").build();

        String ddl = TriggerFunctionGenerator.generateFunctionDdl(metadata, "app", "BEGIN\n  NULL;\nEND;");

        assertTrue(ddl.startsWith("CREATE OR REPLACE FUNCTION app.trg_emp_func()\n"));
        assertTrue(ddl.endsWith("END;\n$$ LANGUAGE plpgsql;\n"));
    }

    @Test
    void functionNames() {
        assertEquals("audit_trigger_func", TriggerFunctionGenerator.getFunctionName("audit_trigger"));
        assertEquals("hr.audit_trigger_func", TriggerFunctionGenerator.getQualifiedFunctionName("hr", "audit_trigger"));
    }

    @Test
    void invalidArguments() {
        TriggerMetadata metadata = TriggerMetadata.builder().triggerName("t").build();

        assertThrows(IllegalArgumentException.class, () -> TriggerFunctionGenerator.generateFunctionDdl(null, "public", BODY));
        assertThrows(IllegalArgumentException.class, () -> TriggerFunctionGenerator.generateFunctionDdl(metadata, "public", " "));
        assertThrows(IllegalArgumentException.class, () -> TriggerFunctionGenerator.getFunctionName(""));
        assertThrows(IllegalArgumentException.class, () -> TriggerFunctionGenerator.getQualifiedFunctionName(null, "t"));
    }
}
