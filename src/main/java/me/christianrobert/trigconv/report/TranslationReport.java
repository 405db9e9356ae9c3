package me.christianrobert.trigconv.report;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

/**
 * Summary of one trigger conversion: every warning in encounter order and the
 * distinct unmapped function, type and exception names.
 */
public class TranslationReport {

    private final List<ConversionWarning> warnings;
    private final Set<String> unmappedFunctions;
    private final Set<String> unmappedTypes;
    private final Set<String> unmappedExceptions;
    private final int statementCount;

    public TranslationReport(List<ConversionWarning> warnings, int statementCount) {
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.unmappedFunctions = collect(warnings, WarningKind.UNMAPPED_FUNCTION);
        this.unmappedTypes = collect(warnings, WarningKind.UNMAPPED_TYPE);
        this.unmappedExceptions = collect(warnings, WarningKind.UNMAPPED_EXCEPTION);
        this.statementCount = statementCount;
    }

    private static Set<String> collect(List<ConversionWarning> warnings, WarningKind kind) {
        Set<String> names = new TreeSet<>(String.CASE_INSENSITIVE_ORDER);
        for (ConversionWarning warning : warnings) {
            if (warning.getKind() == kind && warning.getIdentifier() != null) {
                names.add(warning.getIdentifier());
            }
        }
        return Collections.unmodifiableSet(names);
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }

    public List<ConversionWarning> getWarnings(WarningKind kind) {
        List<ConversionWarning> result = new ArrayList<>();
        for (ConversionWarning warning : warnings) {
            if (warning.getKind() == kind) {
                result.add(warning);
            }
        }
        return result;
    }

    public Set<String> getUnmappedFunctions() {
        return unmappedFunctions;
    }

    public Set<String> getUnmappedTypes() {
        return unmappedTypes;
    }

    public Set<String> getUnmappedExceptions() {
        return unmappedExceptions;
    }

    /**
     * Number of SQL leaf statements translated.
     */
    public int getStatementCount() {
        return statementCount;
    }

    public boolean hasWarnings() {
        return !warnings.isEmpty();
    }

    @Override
    public String toString() {
        return "TranslationReport{warnings=" + warnings.size()
                + ", unmappedFunctions=" + unmappedFunctions
                + ", unmappedTypes=" + unmappedTypes
                + ", unmappedExceptions=" + unmappedExceptions + "}";
    }
}
