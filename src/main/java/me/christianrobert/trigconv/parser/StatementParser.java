package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.core.exception.InputSizeException;
import me.christianrobert.trigconv.core.exception.StructuralParseException;
import me.christianrobert.trigconv.ir.BasicLoop;
import me.christianrobert.trigconv.ir.BeginEndBlock;
import me.christianrobert.trigconv.ir.CaseWhen;
import me.christianrobert.trigconv.ir.ConditionalBranch;
import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.ExceptionHandler;
import me.christianrobert.trigconv.ir.ForLoop;
import me.christianrobert.trigconv.ir.IfElse;
import me.christianrobert.trigconv.ir.LeafKind;
import me.christianrobert.trigconv.ir.SqlLeaf;
import me.christianrobert.trigconv.ir.Statement;
import me.christianrobert.trigconv.ir.WhenClause;
import me.christianrobert.trigconv.ir.WhileLoop;
import me.christianrobert.trigconv.report.WarningCollector;
import me.christianrobert.trigconv.report.WarningKind;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser building the statement tree of a trigger body.
 *
 * <p>Dispatch happens on the first token of each statement. Compound constructs are parsed
 * in three passes over the same token range:</p>
 * <ol>
 *   <li>{@link BlockBoundaryScanner} finds the construct's own separators and closer
 *       (indices only, no content);</li>
 *   <li>each section between two separators is parsed recursively into statements;</li>
 *   <li>for blocks with an EXCEPTION section, the handler range is split on its own
 *       {@code WHEN ... THEN} separators into {@link ExceptionHandler} entries.</li>
 * </ol>
 *
 * <p>Because every section is bounded by separators found at the construct's own depth,
 * an inner ELSE or EXCEPTION is never attributed to an outer construct. Recursion is
 * bounded by the configured nesting ceiling.</p>
 *
 * <p>One instance parses one trigger; leaf ids ({@code stmt_1}, {@code stmt_2}, ...) are
 * numbered in source order.</p>
 */
public class StatementParser {

    private final TokenSequence tokens;
    private final BlockBoundaryScanner scanner;
    private final DeclarationParser declarationParser;
    private final WarningCollector warnings;
    private final int maxNestingDepth;
    private int leafCounter;

    public StatementParser(TokenSequence tokens, WarningCollector warnings, int maxNestingDepth) {
        this.tokens = tokens;
        this.scanner = new BlockBoundaryScanner(tokens);
        this.declarationParser = new DeclarationParser(tokens, warnings);
        this.warnings = warnings;
        this.maxNestingDepth = maxNestingDepth;
    }

    /**
     * Parses the main block opened by the BEGIN at {@code beginIndex}; it must close before {@code limit}.
     */
    public BeginEndBlock parseMainBlock(int beginIndex, int limit) {
        ConstructBoundaries boundaries = scanner.scan(beginIndex, limit, 1);
        return buildBlock(boundaries, Declarations.empty(), 1);
    }

    /**
     * Parses the statements in {@code [from, to)}.
     *
     * @param depth depth of the enclosing construct; constructs opened here get {@code depth + 1}
     */
    public List<Statement> parseSequence(int from, int to, int depth) {
        List<Statement> statements = new ArrayList<>();
        int i = from;
        while (i < to) {
            SqlToken token = tokens.get(i);

            if (token.isSymbol(";")) {
                i++;
                continue;
            }
            if (token.isSymbol("<<")) {
                i = parseLabel(i, to, depth, statements);
                continue;
            }
            if (!token.isWord()) {
                i = parseLeaf(i, to, depth, statements);
                continue;
            }

            switch (token.getUpper()) {
                case "BEGIN" -> {
                    ConstructBoundaries b = scan(i, to, depth + 1);
                    statements.add(buildBlock(b, Declarations.empty(), depth + 1));
                    i = b.getTerminatorIndex() + 1;
                }
                case "DECLARE" -> i = parseDeclareBlock(i, to, depth, statements);
                case "IF" -> {
                    ConstructBoundaries b = scan(i, to, depth + 1);
                    statements.add(buildIf(b, depth + 1));
                    i = b.getTerminatorIndex() + 1;
                }
                case "CASE" -> {
                    ConstructBoundaries b = scan(i, to, depth + 1);
                    statements.add(buildCase(b, depth + 1));
                    i = b.getTerminatorIndex() + 1;
                }
                case "FOR", "WHILE", "LOOP" -> {
                    ConstructBoundaries b = scan(i, to, depth + 1);
                    statements.add(buildLoop(b, depth + 1));
                    i = b.getTerminatorIndex() + 1;
                }
                case "END", "ELSIF", "ELSE", "WHEN", "EXCEPTION" -> throw new StructuralParseException(
                        token.getUpper() + " without a matching open construct",
                        token.getLineNumber(), depth, tokens.lineText(i));
                default -> i = parseLeaf(i, to, depth, statements);
            }
        }
        return statements;
    }

    private ConstructBoundaries scan(int openerIndex, int limit, int depth) {
        if (depth > maxNestingDepth) {
            throw new InputSizeException("Nesting depth " + depth + " exceeds the limit of " + maxNestingDepth,
                    maxNestingDepth, depth, tokens.lineOf(openerIndex));
        }
        return scanner.scan(openerIndex, limit, depth);
    }

    private int parseLeaf(int from, int to, int depth, List<Statement> statements) {
        int semicolon = scanner.findStatementEnd(from, to, depth);
        LeafKind kind = StatementClassifier.classify(tokens, from, semicolon - 1);
        statements.add(new SqlLeaf(nextId(), kind, tokens.text(from, semicolon - 1),
                tokens.lineOf(from), tokens.lineOf(semicolon)));
        return semicolon + 1;
    }

    // <<label>>
    private int parseLabel(int from, int to, int depth, List<Statement> statements) {
        int close = -1;
        for (int i = from + 1; i < to; i++) {
            if (tokens.isSymbol(i, ">>")) {
                close = i;
                break;
            }
        }
        if (close < 0) {
            throw new StructuralParseException("Label is not closed by '>>'", tokens.lineOf(from), depth,
                    tokens.lineText(from));
        }
        statements.add(new SqlLeaf(nextId(), LeafKind.LABEL, tokens.text(from, close),
                tokens.lineOf(from), tokens.lineOf(close)));
        return close + 1;
    }

    // DECLARE decls BEGIN ... END;
    private int parseDeclareBlock(int declareIndex, int to, int depth, List<Statement> statements) {
        int begin = -1;
        int i = declareIndex + 1;
        while (i < to) {
            if (tokens.isWord(i, "BEGIN")) {
                begin = i;
                break;
            }
            int semicolon = tokens.findSemicolon(i, to);
            if (semicolon < 0) {
                break;
            }
            i = semicolon + 1;
        }
        if (begin < 0) {
            throw new StructuralParseException("DECLARE without a following BEGIN",
                    tokens.lineOf(declareIndex), depth + 1, tokens.lineText(declareIndex));
        }
        Declarations declarations = declarationParser.parse(declareIndex + 1, begin, depth + 1);
        ConstructBoundaries b = scan(begin, to, depth + 1);
        statements.add(buildBlock(b, declarations, depth + 1));
        return b.getTerminatorIndex() + 1;
    }

    private BeginEndBlock buildBlock(ConstructBoundaries b, Declarations declarations, int depth) {
        ConstructBoundaries.Separator exception = b.findSeparator("EXCEPTION");
        int mainEnd = exception != null ? exception.getIndex() : b.getCloserIndex();

        // pass 2: main section
        List<Statement> main = parseSequence(b.getHeaderEnd() + 1, mainEnd, depth);

        // pass 3: handlers
        List<ExceptionHandler> handlers = new ArrayList<>();
        Integer exceptionLine = null;
        if (exception != null) {
            exceptionLine = tokens.lineOf(exception.getIndex());
            handlers = buildHandlers(b, exception, depth);
        }

        return new BeginEndBlock(declarations, main, handlers,
                tokens.lineOf(b.getOpenerIndex()), tokens.lineOf(b.getCloserIndex()), exceptionLine);
    }

    private List<ExceptionHandler> buildHandlers(ConstructBoundaries b, ConstructBoundaries.Separator exception,
                                                 int depth) {
        List<ConstructBoundaries.Separator> whens = new ArrayList<>();
        for (ConstructBoundaries.Separator separator : b.getSeparators()) {
            if (separator.getKeyword().equals("WHEN")) {
                whens.add(separator);
            }
        }
        if (whens.isEmpty()) {
            throw new StructuralParseException("EXCEPTION section without WHEN handlers",
                    tokens.lineOf(exception.getIndex()), depth, tokens.lineText(exception.getIndex()));
        }
        if (whens.get(0).getIndex() != exception.getIndex() + 1) {
            int stray = exception.getIndex() + 1;
            throw new StructuralParseException("Statement between EXCEPTION and the first WHEN handler",
                    tokens.lineOf(stray), depth, tokens.lineText(stray));
        }

        List<ExceptionHandler> handlers = new ArrayList<>();
        Set<String> caught = new HashSet<>();
        boolean afterOthers = false;
        for (int k = 0; k < whens.size(); k++) {
            ConstructBoundaries.Separator when = whens.get(k);
            int bodyEnd = k + 1 < whens.size() ? whens.get(k + 1).getIndex() : b.getCloserIndex();
            List<String> names = handlerNames(when, depth);
            int line = tokens.lineOf(when.getIndex());

            if (afterOthers) {
                warnings.add(WarningKind.AMBIGUOUS_HANDLER, "Handler after WHEN OTHERS is never reached",
                        line, depth, String.join(" OR ", names), tokens.lineText(when.getIndex()));
            }
            for (String name : names) {
                if (!caught.add(name.toUpperCase(Locale.ROOT))) {
                    warnings.add(WarningKind.AMBIGUOUS_HANDLER,
                            "Exception '" + name + "' is caught by more than one handler of the same block",
                            line, depth, name, tokens.lineText(when.getIndex()));
                }
            }

            List<Statement> body = parseSequence(when.getHeaderEnd() + 1, bodyEnd, depth);
            ExceptionHandler handler = new ExceptionHandler(names, body, line);
            afterOthers |= handler.catchesOthers();
            handlers.add(handler);
        }
        return handlers;
    }

    // WHEN a OR b.c OR OTHERS THEN
    private List<String> handlerNames(ConstructBoundaries.Separator when, int depth) {
        List<String> names = new ArrayList<>();
        int start = when.getIndex() + 1;
        for (int i = start; i <= when.getHeaderEnd(); i++) {
            if (i == when.getHeaderEnd() || tokens.isWord(i, "OR")) {
                if (i == start) {
                    throw new StructuralParseException("WHEN handler without an exception name",
                            tokens.lineOf(when.getIndex()), depth, tokens.lineText(when.getIndex()));
                }
                names.add(tokens.flatText(start, i - 1));
                start = i + 1;
            }
        }
        return names;
    }

    private IfElse buildIf(ConstructBoundaries b, int depth) {
        int opener = b.getOpenerIndex();
        if (b.getHeaderEnd() == opener + 1) {
            throw new StructuralParseException("IF without condition", tokens.lineOf(opener), depth,
                    tokens.lineText(opener));
        }
        String condition = tokens.flatText(opener + 1, b.getHeaderEnd() - 1);
        List<ConstructBoundaries.Separator> separators = b.getSeparators();

        int firstEnd = separators.isEmpty() ? b.getCloserIndex() : separators.get(0).getIndex();
        List<Statement> thenBranch = parseSequence(b.getHeaderEnd() + 1, firstEnd, depth);

        List<ConditionalBranch> elifs = new ArrayList<>();
        List<Statement> elseBranch = null;
        int elseLine = -1;
        for (int k = 0; k < separators.size(); k++) {
            ConstructBoundaries.Separator separator = separators.get(k);
            int sectionEnd = k + 1 < separators.size() ? separators.get(k + 1).getIndex() : b.getCloserIndex();
            if (elseBranch != null) {
                throw new StructuralParseException(separator.getKeyword() + " after ELSE",
                        tokens.lineOf(separator.getIndex()), depth, tokens.lineText(separator.getIndex()));
            }
            List<Statement> section = parseSequence(separator.getHeaderEnd() + 1, sectionEnd, depth);
            if (separator.getKeyword().equals("ELSIF")) {
                if (separator.getHeaderEnd() == separator.getIndex() + 1) {
                    throw new StructuralParseException("ELSIF without condition",
                            tokens.lineOf(separator.getIndex()), depth, tokens.lineText(separator.getIndex()));
                }
                String elifCondition = tokens.flatText(separator.getIndex() + 1, separator.getHeaderEnd() - 1);
                elifs.add(new ConditionalBranch(elifCondition, section, tokens.lineOf(separator.getIndex())));
            } else {
                elseBranch = section;
                elseLine = tokens.lineOf(separator.getIndex());
            }
        }

        return new IfElse(condition, thenBranch, elifs, elseBranch,
                tokens.lineOf(opener), elseLine, tokens.lineOf(b.getCloserIndex()));
    }

    private CaseWhen buildCase(ConstructBoundaries b, int depth) {
        int opener = b.getOpenerIndex();
        String selector = b.getHeaderEnd() > opener ? tokens.flatText(opener + 1, b.getHeaderEnd()) : null;

        List<ConstructBoundaries.Separator> separators = b.getSeparators();
        List<WhenClause> whens = new ArrayList<>();
        List<Statement> elseBranch = null;
        int elseLine = -1;
        for (int k = 0; k < separators.size(); k++) {
            ConstructBoundaries.Separator separator = separators.get(k);
            int sectionEnd = k + 1 < separators.size() ? separators.get(k + 1).getIndex() : b.getCloserIndex();
            if (elseBranch != null) {
                throw new StructuralParseException(separator.getKeyword() + " after ELSE in CASE",
                        tokens.lineOf(separator.getIndex()), depth, tokens.lineText(separator.getIndex()));
            }
            List<Statement> section = parseSequence(separator.getHeaderEnd() + 1, sectionEnd, depth);
            if (separator.getKeyword().equals("WHEN")) {
                if (separator.getHeaderEnd() == separator.getIndex() + 1) {
                    throw new StructuralParseException("WHEN without expression",
                            tokens.lineOf(separator.getIndex()), depth, tokens.lineText(separator.getIndex()));
                }
                String match = tokens.flatText(separator.getIndex() + 1, separator.getHeaderEnd() - 1);
                whens.add(new WhenClause(match, section, tokens.lineOf(separator.getIndex())));
            } else {
                elseBranch = section;
                elseLine = tokens.lineOf(separator.getIndex());
            }
        }
        if (whens.isEmpty()) {
            throw new StructuralParseException("CASE without WHEN clause", tokens.lineOf(opener), depth,
                    tokens.lineText(opener));
        }

        return new CaseWhen(selector, whens, elseBranch, tokens.lineOf(opener), elseLine,
                tokens.lineOf(b.getCloserIndex()));
    }

    private Statement buildLoop(ConstructBoundaries b, int depth) {
        int opener = b.getOpenerIndex();
        int line = tokens.lineOf(opener);
        int endLine = tokens.lineOf(b.getCloserIndex());
        List<Statement> body = parseSequence(b.getHeaderEnd() + 1, b.getCloserIndex(), depth);

        if (tokens.isWord(opener, "LOOP")) {
            return new BasicLoop(body, line, endLine);
        }
        if (tokens.isWord(opener, "WHILE")) {
            if (b.getHeaderEnd() == opener + 1) {
                throw new StructuralParseException("WHILE without condition", line, depth, tokens.lineText(opener));
            }
            return new WhileLoop(tokens.flatText(opener + 1, b.getHeaderEnd() - 1), body, line, endLine);
        }

        // FOR var IN [REVERSE] iterable LOOP
        int i = opener + 1;
        SqlToken variable = tokens.get(i);
        if (!variable.isWord() || !tokens.isWord(i + 1, "IN")) {
            throw new StructuralParseException("FOR loop header must be 'FOR <variable> IN ... LOOP'",
                    line, depth, tokens.lineText(opener));
        }
        i += 2;
        boolean reverse = false;
        if (tokens.isWord(i, "REVERSE")) {
            reverse = true;
            i++;
        }
        if (i >= b.getHeaderEnd()) {
            throw new StructuralParseException("FOR loop without iterable", line, depth, tokens.lineText(opener));
        }
        return new ForLoop(variable.getText(), tokens.text(i, b.getHeaderEnd() - 1), reverse, body, line, endLine);
    }

    private String nextId() {
        return "stmt_" + (++leafCounter);
    }
}
