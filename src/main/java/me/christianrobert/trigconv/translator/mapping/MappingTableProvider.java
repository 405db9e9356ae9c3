package me.christianrobert.trigconv.translator.mapping;

/**
 * Supplies mapping tables to the converter. Implementations own all I/O.
 */
public interface MappingTableProvider {

    /**
     * Returns the current tables. Never null; a table that could not be read is returned empty.
     */
    MappingTables getTables();
}
