package me.christianrobert.trigconv.translator.mapping;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads a two-column mapping table from CSV.
 *
 * <p>The first record is a header; the first column is the key, the second the value.
 * Lines starting with {@code #} are comments. Rows with a blank key are skipped, and a
 * repeated key keeps its first value.</p>
 *
 * <pre>
 * oracle_function,postgresql_function
 * nvl,COALESCE
 * sessiontimezone,current_setting('timezone')
 * </pre>
 */
public class CsvMappingTableLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvMappingTableLoader.class);

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT
            .builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setCommentMarker('#')
            .setIgnoreEmptyLines(true)
            .setTrim(true)
            .build();

    public static MappingTable load(String tableName, Reader reader) throws IOException {
        Map<String, String> entries = new LinkedHashMap<>();
        try (CSVParser parser = FORMAT.parse(reader)) {
            for (CSVRecord record : parser) {
                if (record.size() < 2) {
                    log.warn("Skipping {} record {}: expected two columns, got {}",
                            tableName, record.getRecordNumber(), record.size());
                    continue;
                }
                String key = record.get(0);
                if (key.isEmpty()) {
                    continue;
                }
                String value = record.get(1);
                if (entries.putIfAbsent(key.toLowerCase(Locale.ROOT), value) != null) {
                    log.debug("Duplicate key '{}' in {} ignored", key, tableName);
                }
            }
        }
        log.debug("Loaded {} entries into {}", entries.size(), tableName);
        return MappingTable.of(tableName, entries);
    }
}
