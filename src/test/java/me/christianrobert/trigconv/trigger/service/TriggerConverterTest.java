package me.christianrobert.trigconv.trigger.service;

import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.parser.ParseLimits;
import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.ConversionOptions;
import me.christianrobert.trigconv.translator.mapping.ClasspathMappingTableProvider;
import me.christianrobert.trigconv.translator.mapping.MappingTables;
import me.christianrobert.trigconv.trigger.model.ConversionResult;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TriggerConverter.
 *
 * Purpose: parse and translate in one call, with fatal errors turned into failed results.
 */
class TriggerConverterTest {

    private final TriggerConverter converter = new TriggerConverter(ParseLimits.defaults(),
            new ClasspathMappingTableProvider().getTables(), ConversionOptions.defaults());

    // ========== Success ==========

    @Test
    void convertsTriggerWithHeader() {
        ConversionResult result = converter.convert("input", String.join("\n",
                "CREATE TRIGGER trg_emp BEFORE INSERT ON emp FOR EACH ROW",
                "BEGIN",
                "  :NEW.created := SYSDATE;",
                "END;"), null);

        assertTrue(result.isSuccess());
        assertEquals("trg_emp", result.getTriggerName());
        assertEquals("BEGIN\n  NEW.created := CURRENT_TIMESTAMP;\n  RETURN NEW;\nEND;\n", result.getPostgresBody());
        assertNotNull(result.getFunctionDdl());
        assertNotNull(result.getTriggerDdl());
        assertEquals(1, result.getReport().getStatementCount());
    }

    @Test
    void bodyOnly_explicitMetadataEnablesDdl() {
        TriggerMetadata metadata = TriggerMetadata.builder().triggerName("trg_x").timing("AFTER")
                .event("UPDATE").tableName("emp").level("ROW").build();

        ConversionResult result = converter.convert("trg_x", "BEGIN\n  NULL;\nEND;", metadata);

        assertTrue(result.isSuccess());
        assertTrue(result.getPostgresBody().contains("  RETURN NULL;\n"));
        assertTrue(result.getTriggerDdl().contains("  AFTER UPDATE\n  ON public.emp\n  FOR EACH ROW\n"));
    }

    @Test
    void bodyOnly_nameFromArgument() {
        ConversionResult result = converter.convert("my_trigger", "BEGIN\n  NULL;\nEND;", null);

        assertTrue(result.isSuccess());
        assertEquals("my_trigger", result.getTriggerName());
        assertNull(result.getFunctionDdl());
    }

    @Test
    void parseWarningsPrecedeTranslationWarnings() {
        TriggerConverter bare = new TriggerConverter(ParseLimits.defaults(), MappingTables.empty(),
                ConversionOptions.builder().generateDdl(false).build());

        ConversionResult result = bare.convert("t", "BEGIN\n  x := 1;\nEND;\nSHOW ERRORS", null);

        assertTrue(result.isSuccess());
        assertEquals(WarningKind.TRAILING_CONTENT, result.getReport().getWarnings().get(0).getKind());
        assertEquals(3, result.getReport().getWarnings(WarningKind.EMPTY_MAPPING_TABLE).size());
    }

    @Test
    void convertingTwice_sameResult() {
        String text = "BEGIN\n  IF INSERTING OR UPDATING THEN\n    x := NVL(y, 0);\n  END IF;\nEND;";

        ConversionResult first = converter.convert("t", text, null);
        ConversionResult second = converter.convert("t", text, null);

        assertEquals(first.getPostgresBody(), second.getPostgresBody());
        assertTrue(first.getPostgresBody().contains("IF TG_OP IN ('INSERT', 'UPDATE') THEN"));
        assertTrue(first.getPostgresBody().contains("x := COALESCE(y, 0);"));
    }

    // ========== Failures ==========

    @Test
    void deepNestingAtHardCeiling_isInputSizeFailure() {
        TriggerConverter widest = new TriggerConverter(new ParseLimits(100000, ParseLimits.HARD_MAX_NESTING_DEPTH),
                MappingTables.empty(), ConversionOptions.defaults());
        StringBuilder text = new StringBuilder("BEGIN\n");
        for (int i = 0; i < 5000; i++) {
            text.append("IF a THEN\n");
        }
        text.append("NULL;\n");
        for (int i = 0; i < 5000; i++) {
            text.append("END IF;\n");
        }
        text.append("END;");

        ConversionResult result = widest.convert("deep", text.toString(), null);

        assertTrue(result.isFailure());
        assertEquals("INPUT_SIZE_ERROR", result.getErrorKind());
    }

    @Test
    void emptyText_fails() {
        ConversionResult result = converter.convert("t", "   ", null);

        assertTrue(result.isFailure());
        assertEquals("CONVERSION_ERROR", result.getErrorKind());
        assertNull(result.getPostgresBody());
    }

    @Test
    void nullText_fails() {
        assertTrue(converter.convert("t", null, null).isFailure());
    }

    @Test
    void structuralError_reportsLine() {
        ConversionResult result = converter.convert("t", "BEGIN\n  IF x THEN\n    NULL;\n  END LOOP;\nEND;", null);

        assertTrue(result.isFailure());
        assertEquals("STRUCTURAL_PARSE_ERROR", result.getErrorKind());
        assertEquals(4, result.getLineNumber());
        assertTrue(result.getErrorMessage().contains("Line: 4"));
    }

    @Test
    void missingBegin_sectionBoundaryError() {
        ConversionResult result = converter.convert("t", "x := 1;", null);

        assertEquals("SECTION_BOUNDARY_ERROR", result.getErrorKind());
    }

    @Test
    void tooManyLines_inputSizeError() {
        TriggerConverter limited = new TriggerConverter(new ParseLimits(3, 64), MappingTables.empty(),
                ConversionOptions.defaults());

        ConversionResult result = limited.convert("t", "BEGIN\n  NULL;\n  NULL;\nEND;", null);

        assertTrue(result.isFailure());
        assertEquals("INPUT_SIZE_ERROR", result.getErrorKind());
    }

    @Test
    void defaultConstructor_emptyTables() {
        TriggerConverter plain = new TriggerConverter();

        assertTrue(plain.getTables().getFunctions().isEmpty());
        assertTrue(plain.getOptions().isGenerateDdl());
    }
}
