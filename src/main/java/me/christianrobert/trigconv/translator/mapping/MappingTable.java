package me.christianrobert.trigconv.translator.mapping;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable case-insensitive key-to-value table (Oracle name to PostgreSQL equivalent).
 */
public class MappingTable {

    private final String name;
    private final Map<String, String> entries;

    private MappingTable(String name, Map<String, String> entries) {
        this.name = name;
        TreeMap<String, String> copy = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);
        copy.putAll(entries);
        this.entries = Collections.unmodifiableMap(copy);
    }

    public static MappingTable of(String name, Map<String, String> entries) {
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Mapping table name cannot be null or empty");
        }
        if (entries == null) {
            throw new IllegalArgumentException("Mapping table entries cannot be null");
        }
        return new MappingTable(name, entries);
    }

    public static MappingTable empty(String name) {
        return of(name, Map.of());
    }

    public String getName() {
        return name;
    }

    /**
     * @return the mapped value, or null when the key is not in the table
     */
    public String lookup(String key) {
        if (key == null) {
            return null;
        }
        return entries.get(key);
    }

    public boolean contains(String key) {
        return key != null && entries.containsKey(key);
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public int size() {
        return entries.size();
    }

    public Map<String, String> getEntries() {
        return entries;
    }

    @Override
    public String toString() {
        return "MappingTable{" + name + ", " + entries.size() + " entries}";
    }
}
