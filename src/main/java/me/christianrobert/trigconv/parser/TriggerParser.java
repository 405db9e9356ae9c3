package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.ir.BeginEndBlock;
import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.report.WarningCollector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Entry point of the parsing pipeline: text to {@link TriggerIR}.
 *
 * <pre>
 * text -> Preprocessor -> InputGuard (lines) -> SqlLexer -> SectionSplitter -> InputGuard (depth)
 *      -> TriggerHeaderParser + DeclarationParser + StatementParser -> TriggerIR
 * </pre>
 *
 * <p>Stateless apart from its limits; every call builds its own working state, so one
 * instance may be shared between threads.</p>
 */
public class TriggerParser {

    private static final Logger log = LoggerFactory.getLogger(TriggerParser.class);

    private final ParseLimits limits;

    public TriggerParser(ParseLimits limits) {
        this.limits = limits != null ? limits : ParseLimits.defaults();
    }

    public TriggerParser() {
        this(ParseLimits.defaults());
    }

    public ParseResult parse(String triggerText) {
        return parse(triggerText, null);
    }

    /**
     * Parses a trigger body, optionally preceded by a {@code CREATE TRIGGER} header.
     *
     * @param explicitMetadata values that replace the ones read from the header; may be null
     * @throws me.christianrobert.trigconv.core.exception.TriggerConversionException on fatal input errors
     */
    public ParseResult parse(String triggerText, TriggerMetadata explicitMetadata) {
        PreprocessedSource source = Preprocessor.preprocess(triggerText);
        InputGuard.checkLineCount(source, limits);

        TokenSequence tokens = TokenSequence.of(source.getLines());
        WarningCollector warnings = new WarningCollector();

        TriggerSections sections = SectionSplitter.split(tokens, warnings);
        InputGuard.checkNestingDepth(sections, limits, tokens);

        TriggerMetadata metadata = TriggerHeaderParser.parse(tokens, 0, sections.getHeaderEnd(), warnings)
                .overriddenBy(explicitMetadata);

        Declarations declarations = Declarations.empty();
        if (sections.hasDeclareSection()) {
            declarations = new DeclarationParser(tokens, warnings)
                    .parse(sections.getDeclareIndex() + 1, sections.getBeginIndex(), 0);
        }

        StatementParser statementParser = new StatementParser(tokens, warnings, limits.getMaxNestingDepth());
        BeginEndBlock mainBlock = statementParser.parseMainBlock(sections.getBeginIndex(),
                sections.getTerminatorIndex() + 1);

        TriggerIR ir = new TriggerIR(metadata, declarations, mainBlock,
                new ArrayList<>(source.getComments()), sections.hasDeclareSection());
        log.debug("Parsed trigger {}: {} declarations, {} top-level statements, {} warnings",
                metadata.getTriggerName(), declarations.size(), mainBlock.getMainStatements().size(),
                warnings.getWarnings().size());
        return new ParseResult(ir, new ArrayList<>(warnings.getWarnings()));
    }

    public ParseLimits getLimits() {
        return limits;
    }
}
