package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.report.WarningKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for TriggerHeaderParser, run through TriggerParser so the header range is found the
 * same way as in production.
 */
class TriggerHeaderParserTest {

    private final TriggerParser parser = new TriggerParser();

    @Test
    void fullRowTriggerHeader() {
        String text = String.join("\n",
                "CREATE OR REPLACE TRIGGER HR.TRG_EMP",
                "BEFORE INSERT OR UPDATE OF sal, comm ON hr.emp",
                "REFERENCING NEW AS n OLD AS o",
                "FOR EACH ROW",
                "WHEN (n.sal > 0)",
                "BEGIN",
                "  :n.bonus := 1;",
                "END;");

        ParseResult result = parser.parse(text);
        TriggerMetadata metadata = result.getIr().getMetadata();

        assertEquals("hr", metadata.getSchema());
        assertEquals("trg_emp", metadata.getTriggerName());
        assertEquals("BEFORE", metadata.getTiming());
        assertEquals(List.of("INSERT", "UPDATE"), metadata.getEvents());
        assertEquals(List.of("sal", "comm"), metadata.getUpdateColumns());
        assertEquals("hr", metadata.getTableSchema());
        assertEquals("emp", metadata.getTableName());
        assertEquals("n", metadata.getNewAlias());
        assertEquals("o", metadata.getOldAlias());
        assertEquals("ROW", metadata.getLevel());
        assertEquals("n.sal > 0", metadata.getWhenClause());
        assertTrue(metadata.isBeforeRow());
        assertTrue(metadata.isComplete());
        assertTrue(result.getWarnings().isEmpty());
        assertEquals(6, result.getIr().getMainBlock().getBeginLine());
    }

    @Test
    void statementLevelWithoutForEachRow() {
        TriggerMetadata metadata = parser.parse("CREATE TRIGGER audit_del AFTER DELETE ON emp\nBEGIN\n  NULL;\nEND;")
                .getIr().getMetadata();

        assertEquals("STATEMENT", metadata.getLevel());
        assertNull(metadata.getSchema());
        assertFalse(metadata.isRowLevel());
    }

    @Test
    void insteadOfIsRowLevel() {
        TriggerMetadata metadata = parser.parse(
                "CREATE OR REPLACE EDITIONABLE TRIGGER v_trg INSTEAD OF INSERT ON emp_view\nBEGIN\n  NULL;\nEND;")
                .getIr().getMetadata();

        assertEquals("INSTEAD OF", metadata.getTiming());
        assertEquals("ROW", metadata.getLevel());
    }

    @Test
    void quotedNamesKeepCase() {
        TriggerMetadata metadata = parser.parse(
                "CREATE TRIGGER \"MyTrigger\" AFTER INSERT ON \"Orders\"\nBEGIN\n  NULL;\nEND;")
                .getIr().getMetadata();

        assertEquals("MyTrigger", metadata.getTriggerName());
        assertEquals("Orders", metadata.getTableName());
    }

    @Test
    void unrecognizedHeader_warnsAndKeepsWhatWasRead() {
        ParseResult result = parser.parse("CREATE TRIGGER trg BEFORE TRUNCATE ON emp\nBEGIN\n  NULL;\nEND;");

        assertEquals(WarningKind.UNRECOGNIZED_HEADER, result.getWarnings().get(0).getKind());
        assertEquals("trg", result.getIr().getMetadata().getTriggerName());
        assertEquals("BEFORE", result.getIr().getMetadata().getTiming());
        assertFalse(result.getIr().getMetadata().isComplete());
    }

    @Test
    void bodyOnly_hasEmptyMetadata() {
        TriggerMetadata metadata = parser.parse("BEGIN\n  NULL;\nEND;").getIr().getMetadata();
        assertNull(metadata.getTriggerName());
        assertTrue(metadata.getEvents().isEmpty());
    }

    @Test
    void explicitMetadataOverridesHeader() {
        TriggerMetadata explicit = TriggerMetadata.builder().triggerName("renamed").tableName("staff").build();

        TriggerMetadata metadata = parser.parse(
                "CREATE TRIGGER trg AFTER INSERT ON emp FOR EACH ROW\nBEGIN\n  NULL;\nEND;", explicit)
                .getIr().getMetadata();

        assertEquals("renamed", metadata.getTriggerName());
        assertEquals("staff", metadata.getTableName());
        assertEquals("AFTER", metadata.getTiming());
        assertEquals("ROW", metadata.getLevel());
    }

    @Test
    void cleanWhenClause_onlyStripsWrappingParens() {
        assertEquals("a > 1", TriggerHeaderParser.cleanWhenClause("((a > 1))"));
        assertEquals("(a) OR (b)", TriggerHeaderParser.cleanWhenClause("(a) OR (b)"));
    }
}
