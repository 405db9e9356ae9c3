package me.christianrobert.trigconv.trigger.service;

import me.christianrobert.trigconv.core.exception.TriggerConversionException;
import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.parser.ParseLimits;
import me.christianrobert.trigconv.parser.ParseResult;
import me.christianrobert.trigconv.parser.TriggerParser;
import me.christianrobert.trigconv.report.ConversionWarning;
import me.christianrobert.trigconv.report.TranslationReport;
import me.christianrobert.trigconv.translator.ConversionOptions;
import me.christianrobert.trigconv.translator.PostgresTriggerGenerator;
import me.christianrobert.trigconv.translator.TranslationOutput;
import me.christianrobert.trigconv.translator.mapping.MappingTables;
import me.christianrobert.trigconv.trigger.model.ConversionResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts Oracle trigger text to PL/pgSQL with fixed limits, tables and options.
 *
 * <h3>Pipeline:</h3>
 * <pre>
 * trigger text
 *   ↓
 * TriggerParser.parse()                   [text → TriggerIR + parse warnings]
 *   ↓
 * PostgresTriggerGenerator.generate()     [TriggerIR → body, DDL, translation warnings]
 *   ↓
 * ConversionResult                        [parse and translation warnings merged]
 * </pre>
 *
 * <p>Holds no per-trigger state; one converter may translate any number of triggers.
 * {@link #convert} never throws for bad input: fatal input errors become failed results.</p>
 */
public class TriggerConverter {

    private static final Logger log = LoggerFactory.getLogger(TriggerConverter.class);

    private final TriggerParser parser;
    private final MappingTables tables;
    private final ConversionOptions options;

    public TriggerConverter(ParseLimits limits, MappingTables tables, ConversionOptions options) {
        this.parser = new TriggerParser(limits);
        this.tables = tables != null ? tables : MappingTables.empty();
        this.options = options != null ? options : ConversionOptions.defaults();
    }

    public TriggerConverter() {
        this(ParseLimits.defaults(), MappingTables.empty(), ConversionOptions.defaults());
    }

    /**
     * Parses only.
     *
     * @throws TriggerConversionException on fatal input errors
     */
    public ParseResult parse(String triggerText, TriggerMetadata explicitMetadata) {
        if (triggerText == null || triggerText.trim().isEmpty()) {
            throw new TriggerConversionException("Trigger text is empty");
        }
        return parser.parse(triggerText, explicitMetadata);
    }

    /**
     * Parses and translates one trigger.
     *
     * @param name used in logs, the result and the DDL when neither header nor metadata names the trigger
     */
    public ConversionResult convert(String name, String triggerText, TriggerMetadata explicitMetadata) {
        String displayName = name;
        try {
            ParseResult parsed = parse(triggerText, explicitMetadata);
            TriggerIR ir = parsed.getIr();
            if (ir.getMetadata().getTriggerName() != null) {
                displayName = ir.getMetadata().getTriggerName();
            } else if (name != null && !name.trim().isEmpty()) {
                ir = ir.withMetadata(ir.getMetadata().toBuilder().triggerName(name.trim()).build());
            }
            log.debug("Translating trigger {}", displayName);

            TranslationOutput output = PostgresTriggerGenerator.generate(ir, tables, options);
            TranslationOutput merged = withParseWarnings(output, parsed.getWarnings());

            log.info("Successfully converted trigger {} ({} statements, {} warnings)", displayName,
                    merged.getReport().getStatementCount(), merged.getReport().getWarnings().size());
            return ConversionResult.success(displayName, merged);

        } catch (TriggerConversionException e) {
            log.warn("Conversion of trigger {} failed ({}): {}", displayName, e.getErrorKind(), e.getMessage());
            return ConversionResult.failure(displayName, e);
        } catch (RuntimeException e) {
            log.error("Unexpected error converting trigger " + displayName, e);
            return ConversionResult.internalFailure(displayName,
                    "Unexpected error converting trigger " + displayName + ": " + e.getMessage());
        }
    }

    // parse warnings come first; they precede translation in the pipeline
    private static TranslationOutput withParseWarnings(TranslationOutput output, List<ConversionWarning> parseWarnings) {
        if (parseWarnings.isEmpty()) {
            return output;
        }
        List<ConversionWarning> all = new ArrayList<>(parseWarnings);
        all.addAll(output.getReport().getWarnings());
        TranslationReport report = new TranslationReport(all, output.getReport().getStatementCount());
        return new TranslationOutput(output.getBody(), output.getFunctionDdl(), output.getTriggerDdl(), report);
    }

    public MappingTables getTables() {
        return tables;
    }

    public ConversionOptions getOptions() {
        return options;
    }
}
