package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.BasicLoop;
import me.christianrobert.trigconv.ir.BeginEndBlock;
import me.christianrobert.trigconv.ir.CaseWhen;
import me.christianrobert.trigconv.ir.ConditionalBranch;
import me.christianrobert.trigconv.ir.ConstantDecl;
import me.christianrobert.trigconv.ir.CursorDecl;
import me.christianrobert.trigconv.ir.Declaration;
import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.ExceptionDecl;
import me.christianrobert.trigconv.ir.ExceptionHandler;
import me.christianrobert.trigconv.ir.ForLoop;
import me.christianrobert.trigconv.ir.IfElse;
import me.christianrobert.trigconv.ir.LeafKind;
import me.christianrobert.trigconv.ir.RawUnparsed;
import me.christianrobert.trigconv.ir.SqlLeaf;
import me.christianrobert.trigconv.ir.Statement;
import me.christianrobert.trigconv.ir.StatementVisitor;
import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.ir.VariableDecl;
import me.christianrobert.trigconv.ir.WhenClause;
import me.christianrobert.trigconv.ir.WhileLoop;
import me.christianrobert.trigconv.parser.SqlLexer;
import me.christianrobert.trigconv.report.TranslationReport;
import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.MappingTable;
import me.christianrobert.trigconv.translator.mapping.MappingTables;
import me.christianrobert.trigconv.trigger.transformer.TriggerDefinitionGenerator;
import me.christianrobert.trigconv.trigger.transformer.TriggerFunctionGenerator;
import me.christianrobert.trigconv.trigger.transformer.TriggerReturnInjector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Walks a {@link TriggerIR} depth-first and emits the PL/pgSQL trigger body.
 *
 * <p>Every IR node comes out in the same structural shape; only the opaque texts (conditions,
 * SQL leaves, declared types) are rewritten, by {@link ExpressionTranslator},
 * {@link TypeTranslator} and {@link ExceptionMapper}. A generator instance serves one
 * translation; {@link #generate} creates a fresh one per call, so the IR can be re-walked with
 * different mapping tables or options.</p>
 *
 * <h3>Output shape:</h3>
 * <pre>
 * DECLARE
 *   v_total numeric(10,2) := 0;
 *   -- e_invalid EXCEPTION; (mapped to SQLSTATE 'P9001')
 *   rec RECORD;                      -- hoisted cursor FOR loop record
 * BEGIN
 *   IF TG_OP = 'INSERT' THEN
 *     NEW.created_at := CURRENT_TIMESTAMP;
 *   END IF;
 *   RETURN NEW;                      -- injected when DDL is generated
 * EXCEPTION
 *   WHEN SQLSTATE 'P9001' THEN
 *     ...
 * END;
 * </pre>
 */
public class PostgresTriggerGenerator implements StatementVisitor<String> {

    private static final Logger log = LoggerFactory.getLogger(PostgresTriggerGenerator.class);

    private final TriggerIR ir;
    private final TranslationContext context;
    private final ExpressionTranslator expressions;
    private final TypeTranslator types;
    private final ExceptionMapper exceptions;
    private final String indentUnit;

    // RECORD variables of cursor FOR loops, one set per enclosing block
    private final Deque<Set<String>> loopRecords = new ArrayDeque<>();

    private int level;
    private int statementCount;

    private PostgresTriggerGenerator(TriggerIR ir, MappingTables tables, ConversionOptions options) {
        this.ir = ir;
        this.context = new TranslationContext(ir, tables, options);
        this.expressions = new ExpressionTranslator(context);
        this.types = new TypeTranslator(context);
        this.exceptions = new ExceptionMapper(context, expressions);
        this.indentUnit = " ".repeat(context.getOptions().getIndentWidth());
    }

    /**
     * Translates one trigger. Never fails on unmapped names; those become warnings in the report.
     */
    public static TranslationOutput generate(TriggerIR ir, MappingTables tables, ConversionOptions options) {
        if (ir == null) {
            throw new IllegalArgumentException("TriggerIR cannot be null");
        }
        return new PostgresTriggerGenerator(ir, tables, options).run();
    }

    private TranslationOutput run() {
        reportEmptyTables();

        String body = writeMainBlock();
        TriggerMetadata metadata = ir.getMetadata();
        ConversionOptions options = context.getOptions();

        String functionDdl = null;
        String triggerDdl = null;
        if (options.isGenerateDdl() && metadata.isComplete()) {
            String when = metadata.getWhenClause() == null ? null
                    : expressions.translateWhenClause(metadata.getWhenClause(), 0);
            functionDdl = TriggerFunctionGenerator.generateFunctionDdl(metadata, options.getDefaultSchema(), body);
            triggerDdl = TriggerDefinitionGenerator.generateTriggerDdl(metadata, options.getDefaultSchema(), when);
            log.debug("Generated function and trigger DDL for {}", metadata.getTriggerName());
        } else if (options.isGenerateDdl()) {
            log.debug("Trigger metadata incomplete, DDL not generated: {}", metadata);
        }

        TranslationReport report = new TranslationReport(context.getWarnings().getWarnings(), statementCount);
        return new TranslationOutput(body, functionDdl, triggerDdl, report);
    }

    private void reportEmptyTables() {
        MappingTables tables = context.getTables();
        for (MappingTable table : List.of(tables.getFunctions(), tables.getTypes(), tables.getExceptions())) {
            if (table.isEmpty()) {
                log.warn("Mapping table {} is empty, names pass through unchanged", table.getName());
                context.warn(WarningKind.EMPTY_MAPPING_TABLE, "Mapping table " + table.getName()
                        + " is empty; identity mapping used", 0, table.getName(), null);
            }
        }
    }

    // ========== Blocks ==========

    private String writeMainBlock() {
        BeginEndBlock main = ir.getMainBlock();
        boolean injectReturns = context.getOptions().isGenerateDdl();
        String returnStatement = TriggerReturnInjector.returnStatement(ir.getMetadata(),
                context.getOptions().getNewRecordName());
        return writeBlock(ir.getDeclarations(), main, injectReturns ? returnStatement : null);
    }

    @Override
    public String visitBlock(BeginEndBlock block) {
        return writeBlock(block.getDeclarations(), block, null);
    }

    /**
     * @param finalReturn statement appended to the main section and to every handler that can
     *                    fall through, or null for none
     */
    private String writeBlock(Declarations declarations, BeginEndBlock block, String finalReturn) {
        exceptions.enterScope(declarations);
        loopRecords.push(new LinkedHashSet<>());
        context.enter();
        level++;
        try {
            String declarationText = writeDeclarations(declarations);

            StringBuilder main = new StringBuilder(writeStatements(block.getMainStatements()));
            if (finalReturn != null && TriggerReturnInjector.needsReturn(block.getMainStatements())) {
                main.append(line(finalReturn));
            }

            StringBuilder handlers = new StringBuilder();
            for (ExceptionHandler handler : block.getExceptionHandlers()) {
                handlers.append(writeHandler(handler, finalReturn));
            }

            Set<String> records = loopRecords.peek();
            level--;
            StringBuilder sb = new StringBuilder();
            if (!declarationText.isEmpty() || !records.isEmpty()) {
                sb.append(line("DECLARE"));
                sb.append(declarationText);
                for (String record : records) {
                    sb.append(indentUnit.repeat(level + 1)).append(record).append(" RECORD;\n");
                }
            }
            sb.append(line("BEGIN"));
            sb.append(main);
            if (block.hasExceptionSection()) {
                sb.append(line("EXCEPTION"));
                sb.append(handlers);
            }
            sb.append(line("END;"));
            level++;
            return sb.toString();
        } finally {
            level--;
            context.exit();
            loopRecords.pop();
            exceptions.exitScope();
        }
    }

    private String writeHandler(ExceptionHandler handler, String finalReturn) {
        StringBuilder conditions = new StringBuilder();
        for (String name : handler.getExceptionNames()) {
            if (conditions.length() > 0) {
                conditions.append(" OR ");
            }
            conditions.append(exceptions.handlerCondition(name, handler.getLineNumber()));
        }
        StringBuilder sb = new StringBuilder(line("WHEN " + conditions + " THEN"));
        level++;
        sb.append(writeStatements(handler.getHandlerStatements()));
        if (finalReturn != null && TriggerReturnInjector.needsReturn(handler.getHandlerStatements())) {
            sb.append(line(finalReturn));
        }
        level--;
        return sb.toString();
    }

    // ========== Declarations ==========

    private String writeDeclarations(Declarations declarations) {
        StringBuilder sb = new StringBuilder();
        for (Declaration declaration : declarations.getAll()) {
            int lineNumber = declaration.getLineNumber();
            if (declaration instanceof VariableDecl) {
                VariableDecl variable = (VariableDecl) declaration;
                StringBuilder decl = new StringBuilder(variable.getName()).append(' ')
                        .append(types.translate(variable.getDeclaredType(), lineNumber));
                if (variable.isNotNull()) {
                    decl.append(" NOT NULL");
                }
                if (variable.getDefaultExpr() != null) {
                    decl.append(" := ").append(expressions.translate(variable.getDefaultExpr(), lineNumber).trim());
                }
                sb.append(line(decl + ";"));
            } else if (declaration instanceof ConstantDecl) {
                ConstantDecl constant = (ConstantDecl) declaration;
                sb.append(line(constant.getName() + " CONSTANT "
                        + types.translate(constant.getDeclaredType(), lineNumber) + " := "
                        + expressions.translate(constant.getValueExpr(), lineNumber).trim() + ";"));
            } else if (declaration instanceof ExceptionDecl) {
                sb.append(line(exceptions.declarationComment((ExceptionDecl) declaration)));
            } else if (declaration instanceof CursorDecl) {
                sb.append(lines(cursorDeclaration((CursorDecl) declaration)));
            } else if (declaration instanceof RawUnparsed) {
                for (String rawLine : ((RawUnparsed) declaration).getText().split("\n")) {
                    sb.append(line("-- " + rawLine.trim()));
                }
            }
        }
        return sb.toString();
    }

    // CURSOR c (p NUMBER) IS SELECT ... → c CURSOR (p numeric) FOR SELECT ...
    private String cursorDeclaration(CursorDecl cursor) {
        int lineNumber = cursor.getLineNumber();
        StringBuilder sb = new StringBuilder(cursor.getName()).append(" CURSOR");
        if (cursor.getParameters() != null && !cursor.getParameters().trim().isEmpty()) {
            List<TextToken> tokens = TextTokens.tokenize("(" + cursor.getParameters() + ")");
            StringBuilder params = new StringBuilder();
            for (List<TextToken> param : TextTokens.splitArguments(tokens, 0, tokens.size() - 1)) {
                if (param.isEmpty()) {
                    continue;
                }
                int typeStart = param.size() > 1 && param.get(1).isWord("IN") ? 2 : 1;
                int typeEnd = typeStart;
                while (typeEnd < param.size() && !param.get(typeEnd).isSymbol(":=") && !param.get(typeEnd).isWord("DEFAULT")) {
                    typeEnd++;
                }
                if (params.length() > 0) {
                    params.append(", ");
                }
                params.append(param.get(0).getText());
                if (typeEnd > typeStart) {
                    params.append(' ').append(types.translate(
                            TextTokens.renderTrimmed(param.subList(typeStart, typeEnd)), lineNumber));
                }
            }
            sb.append(" (").append(params).append(')');
        }
        sb.append(" FOR ").append(expressions.translate(cursor.getQuery(), lineNumber).trim()).append(';');
        return sb.toString();
    }

    // ========== Statements ==========

    private String writeStatements(List<Statement> statements) {
        StringBuilder sb = new StringBuilder();
        for (Statement statement : statements) {
            sb.append(statement.accept(this));
        }
        return sb.toString();
    }

    private String writeNested(List<Statement> statements) {
        level++;
        context.enter();
        try {
            return writeStatements(statements);
        } finally {
            context.exit();
            level--;
        }
    }

    @Override
    public String visitLeaf(SqlLeaf leaf) {
        statementCount++;
        String text = leaf.getSourceText();
        int lineNumber = leaf.getLineNumber();
        LeafKind kind = leaf.getKind();

        String converted;
        switch (kind) {
            case RAISE:
                converted = exceptions.translateRaise(text, lineNumber);
                break;
            case RETURN:
                converted = "RETURN".equalsIgnoreCase(text.trim())
                        ? "RETURN " + TriggerReturnInjector.determineReturnValue(ir.getMetadata(),
                                context.getOptions().getNewRecordName())
                        : expressions.translate(text, lineNumber);
                break;
            case PROCEDURE_CALL:
                converted = procedureCall(text, lineNumber);
                break;
            case LABEL:
                return line(text.trim());
            case OTHER:
                converted = otherStatement(text, lineNumber);
                break;
            default:
                converted = expressions.translate(text, lineNumber);
                break;
        }
        return lines(converted + ";");
    }

    // my_proc(a) → PERFORM my_proc(a); my_proc → PERFORM my_proc()
    private String procedureCall(String text, int lineNumber) {
        String converted = expressions.translate(text, lineNumber).trim();
        List<TextToken> tokens = TextTokens.tokenize(converted);
        if (!tokens.isEmpty() && tokens.get(0).isWord("PERFORM")) {
            return converted;
        }
        if (isBareName(tokens)) {
            if (!context.isKnownTargetFunction(converted)) {
                context.warn(WarningKind.UNMAPPED_FUNCTION, "No mapping for procedure " + converted,
                        lineNumber, converted, text.trim());
            }
            converted = converted + "()";
        }
        return "PERFORM " + converted;
    }

    private static boolean isBareName(List<TextToken> tokens) {
        if (tokens.isEmpty() || tokens.size() % 2 == 0) {
            return false;
        }
        for (int i = 0; i < tokens.size(); i++) {
            boolean expected = i % 2 == 0 ? tokens.get(i).isWord() : tokens.get(i).isSymbol(".");
            if (!expected) {
                return false;
            }
        }
        return true;
    }

    private String otherStatement(String text, int lineNumber) {
        List<TextToken> tokens = TextTokens.tokenize(text);
        if (tokens.size() > 1 && tokens.get(0).isWord("EXECUTE") && tokens.get(1).isWord("IMMEDIATE")) {
            String rest = TextTokens.render(tokens.subList(2, tokens.size()));
            return "EXECUTE" + expressions.translate(rest, lineNumber);
        }
        return expressions.translate(text, lineNumber);
    }

    @Override
    public String visitIfElse(IfElse ifElse) {
        StringBuilder sb = new StringBuilder();
        sb.append(line("IF " + condition(ifElse.getCondition(), ifElse.getLineNumber()) + " THEN"));
        sb.append(writeNested(ifElse.getThenBranch()));
        for (ConditionalBranch branch : ifElse.getElifBranches()) {
            sb.append(line("ELSIF " + condition(branch.getCondition(), branch.getLineNumber()) + " THEN"));
            sb.append(writeNested(branch.getStatements()));
        }
        if (ifElse.hasElse()) {
            sb.append(line("ELSE"));
            sb.append(writeNested(ifElse.getElseBranch()));
        }
        sb.append(line("END IF;"));
        return sb.toString();
    }

    @Override
    public String visitCaseWhen(CaseWhen caseWhen) {
        StringBuilder sb = new StringBuilder();
        sb.append(line(caseWhen.isSearched() ? "CASE"
                : "CASE " + condition(caseWhen.getSelector(), caseWhen.getLineNumber())));
        level++;
        for (WhenClause clause : caseWhen.getWhenClauses()) {
            sb.append(line("WHEN " + condition(clause.getMatchExpr(), clause.getLineNumber()) + " THEN"));
            sb.append(writeNested(clause.getStatements()));
        }
        if (caseWhen.hasElse()) {
            sb.append(line("ELSE"));
            sb.append(writeNested(caseWhen.getElseBranch()));
        }
        level--;
        sb.append(line("END CASE;"));
        return sb.toString();
    }

    @Override
    public String visitForLoop(ForLoop forLoop) {
        int lineNumber = forLoop.getLineNumber();
        String header;
        if (forLoop.isNumericRange()) {
            header = "FOR " + forLoop.getLoopVar() + " IN " + numericRange(forLoop) + " LOOP";
        } else {
            header = "FOR " + forLoop.getLoopVar() + " IN " + cursorSource(forLoop) + " LOOP";
        }
        StringBuilder sb = new StringBuilder(line(header));
        sb.append(writeNested(forLoop.getBody()));
        sb.append(line("END LOOP;"));
        log.trace("FOR loop at line {} → {}", lineNumber, header);
        return sb.toString();
    }

    // PostgreSQL REVERSE counts from the first bound down to the second
    private String numericRange(ForLoop forLoop) {
        List<TextToken> tokens = TextTokens.tokenize(forLoop.getIterableExpr());
        int range = TextTokens.indexOfTopLevel(tokens, "..");
        if (range < 0) {
            return expressions.translate(forLoop.getIterableExpr(), forLoop.getLineNumber()).trim();
        }
        String lower = expressions.translate(TextTokens.renderTrimmed(tokens.subList(0, range)),
                forLoop.getLineNumber()).trim();
        String upper = expressions.translate(TextTokens.renderTrimmed(tokens.subList(range + 1, tokens.size())),
                forLoop.getLineNumber()).trim();
        if (forLoop.isReverse()) {
            return "REVERSE " + upper + ".." + lower;
        }
        return lower + ".." + upper;
    }

    private String cursorSource(ForLoop forLoop) {
        String iterable = forLoop.getIterableExpr().trim();
        List<TextToken> tokens = TextTokens.tokenize(iterable);
        boolean parenthesizedQuery = !tokens.isEmpty() && tokens.get(0).isSymbol("(")
                && TextTokens.matchingParen(tokens, 0) == tokens.size() - 1;
        boolean bareQuery = !tokens.isEmpty() && (tokens.get(0).isWord("SELECT") || tokens.get(0).isWord("WITH"));

        if (parenthesizedQuery || bareQuery) {
            // a query loop needs its record declared; a bound cursor loop declares it implicitly
            if (!context.isDeclared(forLoop.getLoopVar())) {
                loopRecords.peek().add(forLoop.getLoopVar());
            }
            String query = parenthesizedQuery ? TextTokens.renderTrimmed(tokens.subList(1, tokens.size() - 1)) : iterable;
            return expressions.translate(query, forLoop.getLineNumber()).trim();
        }
        return expressions.translate(iterable, forLoop.getLineNumber()).trim();
    }

    @Override
    public String visitWhileLoop(WhileLoop whileLoop) {
        StringBuilder sb = new StringBuilder();
        sb.append(line("WHILE " + condition(whileLoop.getCondition(), whileLoop.getLineNumber()) + " LOOP"));
        sb.append(writeNested(whileLoop.getBody()));
        sb.append(line("END LOOP;"));
        return sb.toString();
    }

    @Override
    public String visitBasicLoop(BasicLoop basicLoop) {
        return line("LOOP") + writeNested(basicLoop.getBody()) + line("END LOOP;");
    }

    // ========== Text helpers ==========

    private String condition(String text, int lineNumber) {
        return expressions.translate(text, lineNumber).trim();
    }

    private String line(String text) {
        return indentUnit.repeat(level) + text + "\n";
    }

    // continuation lines keep their indentation relative to the first line;
    // lines continuing a string literal are copied as they are
    private String lines(String text) {
        StringBuilder sb = new StringBuilder();
        String prefix = indentUnit.repeat(level);
        boolean insideString = false;
        for (String part : text.trim().split("\n", -1)) {
            boolean continued = insideString;
            insideString = SqlLexer.endsInsideString(part, continued);
            String content = insideString ? part : stripTrailing(part);
            if (continued) {
                sb.append(content);
            } else if (!part.isBlank()) {
                sb.append(prefix).append(content);
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static String stripTrailing(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) {
            end--;
        }
        return s.substring(0, end);
    }
}
