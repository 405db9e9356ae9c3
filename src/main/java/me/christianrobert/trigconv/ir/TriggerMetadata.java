package me.christianrobert.trigconv.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Trigger header information: name, timing, events and target table.
 *
 * <p>Parsed from a {@code CREATE TRIGGER} clause preceding the body, or supplied
 * explicitly by the caller. Every field is optional; an unknown trigger still
 * converts, it only cannot produce DDL.</p>
 */
public class TriggerMetadata {

    private static final TriggerMetadata EMPTY = builder().build();

    private final String schema;
    private final String triggerName;
    private final String timing;          // BEFORE/AFTER/INSTEAD OF
    private final List<String> events;    // INSERT/UPDATE/DELETE
    private final List<String> updateColumns;
    private final String tableSchema;
    private final String tableName;
    private final String level;           // ROW/STATEMENT
    private final String whenClause;
    private final String newAlias;
    private final String oldAlias;

    private TriggerMetadata(Builder builder) {
        this.schema = builder.schema;
        this.triggerName = builder.triggerName;
        this.timing = builder.timing;
        this.events = Collections.unmodifiableList(new ArrayList<>(builder.events));
        this.updateColumns = Collections.unmodifiableList(new ArrayList<>(builder.updateColumns));
        this.tableSchema = builder.tableSchema;
        this.tableName = builder.tableName;
        this.level = builder.level;
        this.whenClause = builder.whenClause;
        this.newAlias = builder.newAlias;
        this.oldAlias = builder.oldAlias;
    }

    public static TriggerMetadata empty() {
        return EMPTY;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Returns metadata where every value set in {@code explicit} replaces the value parsed here.
     */
    public TriggerMetadata overriddenBy(TriggerMetadata explicit) {
        if (explicit == null) {
            return this;
        }
        Builder b = toBuilder();
        if (explicit.schema != null) b.schema(explicit.schema);
        if (explicit.triggerName != null) b.triggerName(explicit.triggerName);
        if (explicit.timing != null) b.timing(explicit.timing);
        if (!explicit.events.isEmpty()) b.events(explicit.events);
        if (!explicit.updateColumns.isEmpty()) b.updateColumns(explicit.updateColumns);
        if (explicit.tableSchema != null) b.tableSchema(explicit.tableSchema);
        if (explicit.tableName != null) b.tableName(explicit.tableName);
        if (explicit.level != null) b.level(explicit.level);
        if (explicit.whenClause != null) b.whenClause(explicit.whenClause);
        if (explicit.newAlias != null) b.newAlias(explicit.newAlias);
        if (explicit.oldAlias != null) b.oldAlias(explicit.oldAlias);
        return b.build();
    }

    public Builder toBuilder() {
        return builder()
                .schema(schema)
                .triggerName(triggerName)
                .timing(timing)
                .events(events)
                .updateColumns(updateColumns)
                .tableSchema(tableSchema)
                .tableName(tableName)
                .level(level)
                .whenClause(whenClause)
                .newAlias(newAlias)
                .oldAlias(oldAlias);
    }

    public String getSchema() {
        return schema;
    }

    public String getTriggerName() {
        return triggerName;
    }

    public String getTiming() {
        return timing;
    }

    public List<String> getEvents() {
        return events;
    }

    public List<String> getUpdateColumns() {
        return updateColumns;
    }

    public String getTableSchema() {
        return tableSchema;
    }

    public String getTableName() {
        return tableName;
    }

    public String getLevel() {
        return level;
    }

    public String getWhenClause() {
        return whenClause;
    }

    public String getNewAlias() {
        return newAlias;
    }

    public String getOldAlias() {
        return oldAlias;
    }

    public boolean isRowLevel() {
        return "ROW".equalsIgnoreCase(level);
    }

    public boolean isBeforeRow() {
        return "BEFORE".equalsIgnoreCase(timing) && isRowLevel();
    }

    /**
     * True when enough is known to generate CREATE TRIGGER DDL.
     */
    public boolean isComplete() {
        return triggerName != null && tableName != null && timing != null && !events.isEmpty();
    }

    @Override
    public String toString() {
        return "TriggerMetadata{" + triggerName + " " + timing + " " + events + " ON " + tableName + " " + level + "}";
    }

    public static class Builder {
        private String schema;
        private String triggerName;
        private String timing;
        private List<String> events = new ArrayList<>();
        private List<String> updateColumns = new ArrayList<>();
        private String tableSchema;
        private String tableName;
        private String level;
        private String whenClause;
        private String newAlias;
        private String oldAlias;

        public Builder schema(String schema) {
            this.schema = schema;
            return this;
        }

        public Builder triggerName(String triggerName) {
            this.triggerName = triggerName;
            return this;
        }

        public Builder timing(String timing) {
            this.timing = timing;
            return this;
        }

        public Builder events(List<String> events) {
            this.events = new ArrayList<>(events);
            return this;
        }

        public Builder event(String event) {
            this.events.add(event);
            return this;
        }

        public Builder updateColumns(List<String> updateColumns) {
            this.updateColumns = new ArrayList<>(updateColumns);
            return this;
        }

        public Builder updateColumn(String column) {
            this.updateColumns.add(column);
            return this;
        }

        public Builder tableSchema(String tableSchema) {
            this.tableSchema = tableSchema;
            return this;
        }

        public Builder tableName(String tableName) {
            this.tableName = tableName;
            return this;
        }

        public Builder level(String level) {
            this.level = level;
            return this;
        }

        public Builder whenClause(String whenClause) {
            this.whenClause = whenClause;
            return this;
        }

        public Builder newAlias(String newAlias) {
            this.newAlias = newAlias;
            return this;
        }

        public Builder oldAlias(String oldAlias) {
            this.oldAlias = oldAlias;
            return this;
        }

        public TriggerMetadata build() {
            return new TriggerMetadata(this);
        }
    }
}
