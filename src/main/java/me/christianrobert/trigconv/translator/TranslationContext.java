package me.christianrobert.trigconv.translator;

import me.christianrobert.trigconv.ir.BasicLoop;
import me.christianrobert.trigconv.ir.BeginEndBlock;
import me.christianrobert.trigconv.ir.CaseWhen;
import me.christianrobert.trigconv.ir.ConditionalBranch;
import me.christianrobert.trigconv.ir.ConstantDecl;
import me.christianrobert.trigconv.ir.Declaration;
import me.christianrobert.trigconv.ir.Declarations;
import me.christianrobert.trigconv.ir.ExceptionHandler;
import me.christianrobert.trigconv.ir.ForLoop;
import me.christianrobert.trigconv.ir.IfElse;
import me.christianrobert.trigconv.ir.RawUnparsed;
import me.christianrobert.trigconv.ir.SqlLeaf;
import me.christianrobert.trigconv.ir.Statement;
import me.christianrobert.trigconv.ir.StatementVisitor;
import me.christianrobert.trigconv.ir.TriggerIR;
import me.christianrobert.trigconv.ir.TriggerMetadata;
import me.christianrobert.trigconv.ir.VariableDecl;
import me.christianrobert.trigconv.ir.WhenClause;
import me.christianrobert.trigconv.ir.WhileLoop;
import me.christianrobert.trigconv.report.WarningCollector;
import me.christianrobert.trigconv.report.WarningKind;
import me.christianrobert.trigconv.translator.mapping.MappingTable;
import me.christianrobert.trigconv.translator.mapping.MappingTables;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Per-translation state: options, mapping tables, warnings, the literal cache and an index of
 * every name declared anywhere in the trigger.
 *
 * <p>A context is created for one translation and discarded afterwards; nothing in it is
 * shared between triggers.</p>
 */
public class TranslationContext {

    private static final Pattern LEADING_IDENTIFIER = Pattern.compile("^([A-Za-z_][A-Za-z0-9_$.]*)");

    private final TriggerMetadata metadata;
    private final MappingTables tables;
    private final ConversionOptions options;
    private final WarningCollector warnings = new WarningCollector();
    private final LiteralNormalizer literals = new LiteralNormalizer();

    private final Map<String, Declaration> declared = new HashMap<>();
    private final Set<String> knownTargetNames = new HashSet<>();

    private int depth;

    public TranslationContext(TriggerIR ir, MappingTables tables, ConversionOptions options) {
        this.metadata = ir.getMetadata();
        this.tables = tables != null ? tables : MappingTables.empty();
        this.options = options != null ? options : ConversionOptions.defaults();

        register(ir.getDeclarations());
        ir.getMainBlock().accept(new NestedDeclarationCollector());
        collectKnownTargets(this.tables.getFunctions());
    }

    private void register(Declarations declarations) {
        if (declarations == null) {
            return;
        }
        for (Declaration declaration : declarations.getAll()) {
            if (declaration instanceof RawUnparsed) {
                continue;
            }
            declared.putIfAbsent(declaration.getName().toUpperCase(Locale.ROOT), declaration);
        }
    }

    // function names that are already PostgreSQL spellings pass without a warning
    private void collectKnownTargets(MappingTable functions) {
        for (String target : functions.getEntries().values()) {
            Matcher m = LEADING_IDENTIFIER.matcher(target.trim());
            if (m.find()) {
                knownTargetNames.add(m.group(1).toUpperCase(Locale.ROOT));
            }
        }
        if (!functions.isEmpty()) {
            knownTargetNames.add("NEXTVAL");
            knownTargetNames.add("CURRVAL");
        }
    }

    public TriggerMetadata getMetadata() {
        return metadata;
    }

    public MappingTables getTables() {
        return tables;
    }

    public ConversionOptions getOptions() {
        return options;
    }

    public WarningCollector getWarnings() {
        return warnings;
    }

    public LiteralNormalizer getLiterals() {
        return literals;
    }

    public boolean isDeclared(String name) {
        return name != null && declared.containsKey(name.toUpperCase(Locale.ROOT));
    }

    public Declaration getDeclaration(String name) {
        return name == null ? null : declared.get(name.toUpperCase(Locale.ROOT));
    }

    /**
     * True for variables and constants declared with a DATE or TIMESTAMP type.
     */
    public boolean isDateVariable(String name) {
        Declaration declaration = getDeclaration(name);
        String type = null;
        if (declaration instanceof VariableDecl) {
            type = ((VariableDecl) declaration).getDeclaredType();
        } else if (declaration instanceof ConstantDecl) {
            type = ((ConstantDecl) declaration).getDeclaredType();
        }
        if (type == null) {
            return false;
        }
        String upper = type.trim().toUpperCase(Locale.ROOT);
        return upper.startsWith("DATE") || upper.startsWith("TIMESTAMP");
    }

    public boolean isKnownTargetFunction(String name) {
        return name != null && knownTargetNames.contains(name.toUpperCase(Locale.ROOT));
    }

    public int getDepth() {
        return depth;
    }

    public void enter() {
        depth++;
    }

    public void exit() {
        depth--;
    }

    public void warn(WarningKind kind, String message, int lineNumber, String identifier, String rawText) {
        warnings.add(kind, message, lineNumber, depth, identifier, rawText);
    }

    private class NestedDeclarationCollector implements StatementVisitor<Void> {

        private void visitAll(List<Statement> statements) {
            for (Statement statement : statements) {
                statement.accept(this);
            }
        }

        @Override
        public Void visitLeaf(SqlLeaf leaf) {
            return null;
        }

        @Override
        public Void visitIfElse(IfElse ifElse) {
            visitAll(ifElse.getThenBranch());
            for (ConditionalBranch branch : ifElse.getElifBranches()) {
                visitAll(branch.getStatements());
            }
            if (ifElse.hasElse()) {
                visitAll(ifElse.getElseBranch());
            }
            return null;
        }

        @Override
        public Void visitCaseWhen(CaseWhen caseWhen) {
            for (WhenClause clause : caseWhen.getWhenClauses()) {
                visitAll(clause.getStatements());
            }
            if (caseWhen.hasElse()) {
                visitAll(caseWhen.getElseBranch());
            }
            return null;
        }

        @Override
        public Void visitForLoop(ForLoop forLoop) {
            visitAll(forLoop.getBody());
            return null;
        }

        @Override
        public Void visitWhileLoop(WhileLoop whileLoop) {
            visitAll(whileLoop.getBody());
            return null;
        }

        @Override
        public Void visitBasicLoop(BasicLoop basicLoop) {
            visitAll(basicLoop.getBody());
            return null;
        }

        @Override
        public Void visitBlock(BeginEndBlock block) {
            register(block.getDeclarations());
            visitAll(block.getMainStatements());
            for (ExceptionHandler handler : block.getExceptionHandlers()) {
                visitAll(handler.getHandlerStatements());
            }
            return null;
        }
    }
}
