package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.report.TranslationReport;

/**
 * Result of translating one trigger: the PL/pgSQL body, optional DDL and the report.
 */
public class TranslationOutput {

    private final String body;
    private final String functionDdl;
    private final String triggerDdl;
    private final TranslationReport report;

    public TranslationOutput(String body, String functionDdl, String triggerDdl, TranslationReport report) {
        if (body == null) {
            throw new IllegalArgumentException("Translated body cannot be null");
        }
        if (report == null) {
            throw new IllegalArgumentException("Translation report cannot be null");
        }
        this.body = body;
        this.functionDdl = functionDdl;
        this.triggerDdl = triggerDdl;
        this.report = report;
    }

    /**
     * The DECLARE ... BEGIN ... END; block, without the surrounding function definition.
     */
    public String getBody() {
        return body;
    }

    /**
     * CREATE OR REPLACE FUNCTION statement, or null when DDL was not requested or the
     * trigger metadata was incomplete.
     */
    public String getFunctionDdl() {
        return functionDdl;
    }

    public String getTriggerDdl() {
        return triggerDdl;
    }

    public boolean hasDdl() {
        return functionDdl != null && triggerDdl != null;
    }

    public TranslationReport getReport() {
        return report;
    }

    @Override
    public String toString() {
        return "TranslationOutput{bodyLength=" + body.length() + ", ddl=" + hasDdl() + ", report=" + report + "}";
    }
}
