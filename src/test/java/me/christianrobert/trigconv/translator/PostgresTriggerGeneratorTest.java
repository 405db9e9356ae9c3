package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.parser.TriggerParser;
import me.christianrobert.trigconv.report.TranslationReport;
import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.ClasspathMappingTableProvider;
import me.christianrobert.trigconv.translator.mapping.MappingTables;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for PostgresTriggerGenerator.
 *
 * Purpose: end-to-end generation of PL/pgSQL bodies and DDL from parsed triggers.
 */
class PostgresTriggerGeneratorTest {

    private static final MappingTables BUNDLED = new ClasspathMappingTableProvider().getTables();

    private static final ConversionOptions BODY_ONLY = ConversionOptions.builder().generateDdl(false).build();

    private static final String BEFORE_ROW = String.join("\n",
            "CREATE OR REPLACE TRIGGER trg_emp_bi",
            "BEFORE INSERT OR UPDATE ON emp",
            "FOR EACH ROW",
            "DECLARE",
            "  v_count PLS_INTEGER := 0;",
            "BEGIN",
            "  IF INSERTING OR UPDATING THEN",
            "    :NEW.name := NVL(:NEW.name, 'x');",
            "  END IF;",
            "END;");

    private static TranslationOutput generate(String text, MappingTables tables, ConversionOptions options) {
        TriggerIR ir = new TriggerParser().parse(text).getIr();
        return PostgresTriggerGenerator.generate(ir, tables, options);
    }

    // ========== Bodies ==========

    @Test
    void beforeRowTrigger_bodyWithInjectedReturn() {
        TranslationOutput output = generate(BEFORE_ROW, BUNDLED, ConversionOptions.defaults());

        String expected = "DECLARE\n"
                + "  v_count integer := 0;\n"
                + "BEGIN\n"
                + "  IF TG_OP IN ('INSERT', 'UPDATE') THEN\n"
                + "    NEW.name := COALESCE(NEW.name, 'x');\n"
                + "  END IF;\n"
                + "  RETURN NEW;\n"
                + "END;\n";
        assertEquals(expected, output.getBody());
        assertFalse(output.getReport().hasWarnings());
        assertEquals(1, output.getReport().getStatementCount());
    }

    @Test
    void beforeRowTrigger_ddl() {
        TranslationOutput output = generate(BEFORE_ROW, BUNDLED, ConversionOptions.defaults());

        assertTrue(output.hasDdl());
        assertTrue(output.getFunctionDdl().startsWith(
                "CREATE OR REPLACE FUNCTION public.trg_emp_bi_func()\nRETURNS TRIGGER AS $$\nDECLARE\n"));
        assertTrue(output.getFunctionDdl().endsWith("END;\n$$ LANGUAGE plpgsql;\n"));
        assertEquals("CREATE TRIGGER trg_emp_bi\n"
                        + "  BEFORE INSERT OR UPDATE\n"
                        + "  ON public.emp\n"
                        + "  FOR EACH ROW\n"
                        + "  EXECUTE FUNCTION public.trg_emp_bi_func();\n",
                output.getTriggerDdl());
    }

    @Test
    void whenClauseAndUpdateColumnsInTriggerDdl() {
        TranslationOutput output = generate(
                "CREATE TRIGGER hr.trg_sal BEFORE UPDATE OF sal ON hr.emp FOR EACH ROW WHEN (new.sal > old.sal)\n"
                        + "BEGIN\n  NULL;\nEND;",
                BUNDLED, ConversionOptions.defaults());

        assertTrue(output.getTriggerDdl().contains("  BEFORE UPDATE OF sal\n"));
        assertTrue(output.getTriggerDdl().contains("  ON hr.emp\n"));
        assertTrue(output.getTriggerDdl().contains("  WHEN (NEW.sal > OLD.sal)\n"));
        assertTrue(output.getTriggerDdl().contains("EXECUTE FUNCTION hr.trg_sal_func();"));
    }

    @Test
    void afterStatementTrigger_returnsInMainAndFallThroughHandlers() {
        TranslationOutput output = generate(String.join("\n",
                "CREATE TRIGGER trg_audit AFTER DELETE ON emp",
                "BEGIN",
                "  DELETE FROM audit WHERE id = 1;",
                "EXCEPTION",
                "  WHEN NO_DATA_FOUND THEN",
                "    NULL;",
                "  WHEN OTHERS THEN",
                "    RAISE;",
                "END;"), BUNDLED, ConversionOptions.defaults());

        String expected = "BEGIN\n"
                + "  DELETE FROM audit WHERE id = 1;\n"
                + "  RETURN NULL;\n"
                + "EXCEPTION\n"
                + "  WHEN no_data_found THEN\n"
                + "    NULL;\n"
                + "    RETURN NULL;\n"
                + "  WHEN OTHERS THEN\n"
                + "    RAISE;\n"
                + "END;\n";
        assertEquals(expected, output.getBody());
        assertFalse(output.getTriggerDdl().contains("FOR EACH ROW"));
    }

    @Test
    void multiLineLiteral_isNotReindented() {
        TranslationOutput output = generate(
                "BEGIN\n  IF a THEN\n    v_msg := 'first  \n\n  second';\n  END IF;\nEND;", BUNDLED, BODY_ONLY);

        assertEquals("BEGIN\n  IF a THEN\n    v_msg := 'first  \n\n  second';\n  END IF;\nEND;\n",
                output.getBody());
    }

    @Test
    void bodyOnly_noReturnNoDdl() {
        TranslationOutput output = generate("BEGIN\n  x := 1;\nEND;", BUNDLED, BODY_ONLY);

        assertEquals("BEGIN\n  x := 1;\nEND;\n", output.getBody());
        assertNull(output.getFunctionDdl());
        assertNull(output.getTriggerDdl());
    }

    @Test
    void incompleteMetadata_noDdl() {
        TranslationOutput output = generate("BEGIN\n  NULL;\nEND;", BUNDLED, ConversionOptions.defaults());

        assertFalse(output.hasDdl());
        assertTrue(output.getBody().contains("RETURN NULL;"));
    }

    @Test
    void bareReturnGetsTriggerValue() {
        TranslationOutput output = generate(
                "CREATE TRIGGER t BEFORE INSERT ON emp FOR EACH ROW\nBEGIN\n  IF :NEW.id IS NOT NULL THEN\n"
                        + "    RETURN;\n  END IF;\n  :NEW.id := 1;\nEND;",
                BUNDLED, ConversionOptions.defaults());

        assertTrue(output.getBody().contains("    RETURN NEW;\n"));
        assertTrue(output.getBody().endsWith("  NEW.id := 1;\n  RETURN NEW;\nEND;\n"));
    }

    // ========== Mapping Tables ==========

    @Test
    void emptyTables_identityWithWarnings() {
        TranslationOutput output = generate("BEGIN\n  x := NVL(y, 0);\nEND;", MappingTables.empty(), BODY_ONLY);
        TranslationReport report = output.getReport();

        assertEquals("BEGIN\n  x := NVL(y, 0);\nEND;\n", output.getBody());
        assertEquals(3, report.getWarnings(WarningKind.EMPTY_MAPPING_TABLE).size());
        assertEquals(1, report.getWarnings(WarningKind.UNMAPPED_FUNCTION).size());
        assertTrue(report.getUnmappedFunctions().contains("NVL"));
    }

    @Test
    void mappedTables_nvlBecomesCoalesce() {
        TranslationOutput output = generate("BEGIN\n  x := NVL(y, 0);\nEND;", BUNDLED, BODY_ONLY);

        assertEquals("BEGIN\n  x := COALESCE(y, 0);\nEND;\n", output.getBody());
        assertFalse(output.getReport().hasWarnings());
    }

    // ========== Statements ==========

    @Test
    void exceptionsDeclaredRaisedAndHandled() {
        TranslationOutput output = generate(String.join("\n",
                "DECLARE",
                "  e_bad EXCEPTION;",
                "BEGIN",
                "  RAISE e_bad;",
                "EXCEPTION",
                "  WHEN e_bad THEN",
                "    RAISE_APPLICATION_ERROR(-20001, 'Bad');",
                "END;"), BUNDLED, BODY_ONLY);

        String expected = "DECLARE\n"
                + "  -- e_bad EXCEPTION; (mapped to SQLSTATE 'P9001')\n"
                + "BEGIN\n"
                + "  RAISE EXCEPTION 'e_bad' USING ERRCODE = 'P9001';\n"
                + "EXCEPTION\n"
                + "  WHEN SQLSTATE 'P9001' THEN\n"
                + "    RAISE EXCEPTION 'Bad' USING ERRCODE = 'P0001', HINT = 'Original Oracle error code: -20001';\n"
                + "END;\n";
        assertEquals(expected, output.getBody());
    }

    @Test
    void queryForLoop_declaresRecord() {
        TranslationOutput output = generate(
                "BEGIN\n  FOR r IN (SELECT id FROM t) LOOP\n    x := r.id;\n  END LOOP;\nEND;", BUNDLED, BODY_ONLY);

        String expected = "DECLARE\n"
                + "  r RECORD;\n"
                + "BEGIN\n"
                + "  FOR r IN SELECT id FROM t LOOP\n"
                + "    x := r.id;\n"
                + "  END LOOP;\n"
                + "END;\n";
        assertEquals(expected, output.getBody());
    }

    @Test
    void reverseRange_boundsSwapped() {
        TranslationOutput output = generate(
                "BEGIN\n  FOR i IN REVERSE 1..10 LOOP\n    NULL;\n  END LOOP;\nEND;", BUNDLED, BODY_ONLY);

        assertTrue(output.getBody().contains("  FOR i IN REVERSE 10..1 LOOP\n"));
    }

    @Test
    void caseStatement() {
        TranslationOutput output = generate(
                "BEGIN\n  CASE v\n    WHEN 1 THEN x := 1;\n    ELSE NULL;\n  END CASE;\nEND;", BUNDLED, BODY_ONLY);

        String expected = "BEGIN\n"
                + "  CASE v\n"
                + "    WHEN 1 THEN\n"
                + "      x := 1;\n"
                + "    ELSE\n"
                + "      NULL;\n"
                + "  END CASE;\n"
                + "END;\n";
        assertEquals(expected, output.getBody());
    }

    @Test
    void procedureCalls_becomePerform() {
        TranslationOutput output = generate("BEGIN\n  log_change(:NEW.id);\n  do_it;\nEND;", BUNDLED, BODY_ONLY);

        assertTrue(output.getBody().contains("  PERFORM log_change(NEW.id);\n"));
        assertTrue(output.getBody().contains("  PERFORM do_it();\n"));
        assertEquals(2, output.getReport().getWarnings(WarningKind.UNMAPPED_FUNCTION).size());
    }

    @Test
    void nestedBlockAndIndentOption() {
        ConversionOptions options = ConversionOptions.builder().generateDdl(false).indentWidth(4).build();
        TranslationOutput output = generate(
                "BEGIN\n  BEGIN\n    x := 1;\n  EXCEPTION\n    WHEN OTHERS THEN\n      NULL;\n  END;\nEND;",
                BUNDLED, options);

        String expected = "BEGIN\n"
                + "    BEGIN\n"
                + "        x := 1;\n"
                + "    EXCEPTION\n"
                + "        WHEN OTHERS THEN\n"
                + "            NULL;\n"
                + "    END;\n"
                + "END;\n";
        assertEquals(expected, output.getBody());
    }

    @Test
    void executeImmediate() {
        TranslationOutput output = generate("BEGIN\n  EXECUTE IMMEDIATE 'TRUNCATE TABLE t';\nEND;", BUNDLED, BODY_ONLY);
        assertTrue(output.getBody().contains("  EXECUTE 'TRUNCATE TABLE t';\n"));
    }

    // ========== Idempotence ==========

    @Test
    void generatedBodyTranslatesToItself() {
        String first = generate(BEFORE_ROW, BUNDLED, BODY_ONLY).getBody();
        TranslationOutput second = generate(first, BUNDLED, BODY_ONLY);

        assertEquals(first, second.getBody());
        assertFalse(second.getReport().hasWarnings());
    }

    @Test
    void nullIr_rejected() {
        assertThrows(IllegalArgumentException.class, () -> PostgresTriggerGenerator.generate(null, BUNDLED, BODY_ONLY));
    }
}
