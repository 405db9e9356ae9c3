package me.christianrobert.trigconv.trigger.model;

import me.christianrobert.trigconv.ir.TriggerMetadata;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * One trigger to convert, as submitted by a client: the trigger text (body, optionally preceded
 * by a CREATE TRIGGER header) plus metadata values that replace the ones found in the header.
 *
 * <p>{@code name} only labels the source in results and logs and stands in for the trigger
 * name when nothing else names it; {@code triggerName} replaces the header's name.</p>
 *
 * <p>Mutable bean so that it can be bound from JSON request bodies.</p>
 */
public class TriggerSource {

    private String name;
    private String triggerName;
    private String triggerText;
    private String schema;
    private String timing;
    private List<String> events = new ArrayList<>();
    private String tableName;
    private String level;
    private String whenClause;

    public TriggerSource() {
    }

    public TriggerSource(String name, String triggerText) {
        this.name = name;
        this.triggerText = triggerText;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getTriggerName() {
        return triggerName;
    }

    public void setTriggerName(String triggerName) {
        this.triggerName = triggerName;
    }

    public String getTriggerText() {
        return triggerText;
    }

    public void setTriggerText(String triggerText) {
        this.triggerText = triggerText;
    }

    public String getSchema() {
        return schema;
    }

    public void setSchema(String schema) {
        this.schema = schema;
    }

    public String getTiming() {
        return timing;
    }

    public void setTiming(String timing) {
        this.timing = timing;
    }

    public List<String> getEvents() {
        return events;
    }

    public void setEvents(List<String> events) {
        this.events = events != null ? events : new ArrayList<>();
    }

    public String getTableName() {
        return tableName;
    }

    public void setTableName(String tableName) {
        this.tableName = tableName;
    }

    public String getLevel() {
        return level;
    }

    public void setLevel(String level) {
        this.level = level;
    }

    public String getWhenClause() {
        return whenClause;
    }

    public void setWhenClause(String whenClause) {
        this.whenClause = whenClause;
    }

    /**
     * Builds the explicit metadata of this source, or null when no metadata value is set.
     */
    public TriggerMetadata toExplicitMetadata() {
        if (triggerName == null && schema == null && timing == null && events.isEmpty()
                && tableName == null && level == null && whenClause == null) {
            return null;
        }
        TriggerMetadata.Builder builder = TriggerMetadata.builder()
                .schema(schema)
                .triggerName(triggerName)
                .timing(upperOrNull(timing))
                .tableName(tableName)
                .level(upperOrNull(level))
                .whenClause(whenClause);
        for (String event : events) {
            builder.event(event.trim().toUpperCase(Locale.ROOT));
        }
        return builder.build();
    }

    private static String upperOrNull(String value) {
        return value == null || value.trim().isEmpty() ? null : value.trim().toUpperCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return "TriggerSource{name='" + name + "', length=" + (triggerText != null ? triggerText.length() : 0) + "}";
    }
}
