package me.christianrobert.trigconv.trigger.model;

import me.christianrobert.trigconv.core.exception.TriggerConversionException;
import me.christianrobert.trigconv.report.TranslationReport;
import me.christianrobert.trigconv.translator.TranslationOutput;

/**
 * Outcome of converting one trigger. Either the translated body with its report, or the kind,
 * message and position of the error that stopped the conversion.
 */
public class ConversionResult {

    public static final String INTERNAL = "INTERNAL";

    private final String triggerName;
    private final boolean success;
    private final String postgresBody;
    private final String functionDdl;
    private final String triggerDdl;
    private final TranslationReport report;
    private final String errorKind;
    private final String errorMessage;
    private final int lineNumber;
    private final int nestingDepth;

    private ConversionResult(String triggerName, boolean success, TranslationOutput output,
                             String errorKind, String errorMessage, int lineNumber, int nestingDepth) {
        this.triggerName = triggerName;
        this.success = success;
        this.postgresBody = output != null ? output.getBody() : null;
        this.functionDdl = output != null ? output.getFunctionDdl() : null;
        this.triggerDdl = output != null ? output.getTriggerDdl() : null;
        this.report = output != null ? output.getReport() : null;
        this.errorKind = errorKind;
        this.errorMessage = errorMessage;
        this.lineNumber = lineNumber;
        this.nestingDepth = nestingDepth;
    }

    public static ConversionResult success(String triggerName, TranslationOutput output) {
        return new ConversionResult(triggerName, true, output, null, null, -1, -1);
    }

    public static ConversionResult failure(String triggerName, TriggerConversionException exception) {
        return new ConversionResult(triggerName, false, null, exception.getErrorKind(),
                exception.getDetailedMessage(), exception.getLineNumber(), exception.getNestingDepth());
    }

    /**
     * Failure not caused by the input, e.g. a defect in the converter.
     */
    public static ConversionResult internalFailure(String triggerName, String message) {
        return new ConversionResult(triggerName, false, null, INTERNAL, message, -1, -1);
    }

    public String getTriggerName() {
        return triggerName;
    }

    public boolean isSuccess() {
        return success;
    }

    public boolean isFailure() {
        return !success;
    }

    public String getPostgresBody() {
        return postgresBody;
    }

    public String getFunctionDdl() {
        return functionDdl;
    }

    public String getTriggerDdl() {
        return triggerDdl;
    }

    public TranslationReport getReport() {
        return report;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getNestingDepth() {
        return nestingDepth;
    }

    @Override
    public String toString() {
        if (success) {
            return "ConversionResult{trigger=" + triggerName + ", success=true, report=" + report + "}";
        }
        return "ConversionResult{trigger=" + triggerName + ", success=false, kind=" + errorKind
                + ", error='" + errorMessage + "'}";
    }
}
