package me.christianrobert.trigconv.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Accumulates warnings during one parse or translation run. Not shared between runs.
 */
public class WarningCollector {

    private final List<ConversionWarning> warnings = new ArrayList<>();

    public void add(ConversionWarning warning) {
        warnings.add(warning);
    }

    public void add(WarningKind kind, String message, int lineNumber, int nestingDepth,
                    String identifier, String rawText) {
        warnings.add(new ConversionWarning(kind, message, lineNumber, nestingDepth, identifier, rawText));
    }

    public void addAll(List<ConversionWarning> other) {
        warnings.addAll(other);
    }

    public List<ConversionWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    public long count(WarningKind kind) {
        return warnings.stream().filter(w -> w.getKind() == kind).count();
    }

    public boolean isEmpty() {
        return warnings.isEmpty();
    }
}
