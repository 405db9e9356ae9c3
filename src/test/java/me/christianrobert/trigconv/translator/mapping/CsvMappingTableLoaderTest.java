package me.christianrobert.trigconv.translator.mapping;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for CsvMappingTableLoader.
 *
 * Purpose: header handling, comments, key normalization and duplicate keys.
 */
class CsvMappingTableLoaderTest {

    private static MappingTable load(String csv) throws IOException {
        return CsvMappingTableLoader.load("function_mappings", new StringReader(csv));
    }

    @Test
    void headerIsSkipped() throws IOException {
        MappingTable table = load("oracle_function,postgresql_function\nnvl,COALESCE\n");

        assertEquals(1, table.size());
        assertFalse(table.contains("oracle_function"));
        assertEquals("COALESCE", table.lookup("nvl"));
    }

    @Test
    void commentsAndEmptyLinesIgnored() throws IOException {
        MappingTable table = load("key,value\n# null handling\n\nnvl,COALESCE\n# dates\nsysdate,CURRENT_TIMESTAMP\n");

        assertEquals(2, table.size());
        assertEquals("CURRENT_TIMESTAMP", table.lookup("sysdate"));
    }

    @Test
    void lookupIsCaseInsensitive() throws IOException {
        MappingTable table = load("key,value\nNVL,COALESCE\n");

        assertEquals("COALESCE", table.lookup("nvl"));
        assertEquals("COALESCE", table.lookup("Nvl"));
        assertTrue(table.getEntries().containsKey("nvl"));
    }

    @Test
    void quotedValueWithComma() throws IOException {
        MappingTable table = load("key,value\nsessiontimezone,\"current_setting('timezone')\"\n");
        assertEquals("current_setting('timezone')", table.lookup("SESSIONTIMEZONE"));
    }

    @Test
    void duplicateKey_firstValueWins() throws IOException {
        MappingTable table = load("key,value\nnvl,COALESCE\nNVL,IFNULL\n");

        assertEquals(1, table.size());
        assertEquals("COALESCE", table.lookup("nvl"));
    }

    @Test
    void shortAndBlankRowsSkipped() throws IOException {
        MappingTable table = load("key,value\nlonely\n,orphan\nnvl,COALESCE\n");

        assertEquals(1, table.size());
        assertEquals("COALESCE", table.lookup("nvl"));
    }

    @Test
    void headerOnly_emptyTable() throws IOException {
        MappingTable table = load("key,value\n");

        assertTrue(table.isEmpty());
        assertEquals("function_mappings", table.getName());
        assertNull(table.lookup("nvl"));
    }
}
