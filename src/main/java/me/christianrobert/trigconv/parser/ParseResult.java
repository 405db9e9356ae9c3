package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.report.ConversionWarning;

import java.util.Collections;
import java.util.List;

/**
 * The IR of one trigger together with the warnings raised while parsing it.
 */
public class ParseResult {

    private final TriggerIR ir;
    private final List<ConversionWarning> warnings;

    public ParseResult(TriggerIR ir, List<ConversionWarning> warnings) {
        this.ir = ir;
        this.warnings = Collections.unmodifiableList(warnings);
    }

    public TriggerIR getIr() {
        return ir;
    }

    public List<ConversionWarning> getWarnings() {
        return warnings;
    }
}
