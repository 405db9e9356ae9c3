package me.christianrobert.trigconv.ir.json;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.christianrobert.trigconv.core.exception.TriggerConversionException;
import me.christianrobert.trigconv.ir.BasicLoop;
import me.christianrobert.trigconv.ir.BeginEndBlock;
import me.christianrobert.trigconv.ir.CaseWhen;
import me.christianrobert.trigconv.ir.ConditionalBranch;
import me.christianrobert.trigconv.ir.ConstantDecl;
import me.christianrobert.trigconv.ir.CursorDecl;
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
import me.christianrobert.trigconv.parser.ProcedureCall;

import java.util.List;

/**
 * Serializes a {@link TriggerIR} into the IR document consumed by downstream tooling.
 *
 * <p>Field names and nesting are a stable contract; new information is only ever added
 * as new fields. Shape:</p>
 * <pre>
 * {
 *   "trigger_metadata": { "trigger_name", "timing", "events": [], "table_name",
 *                         "has_declare_section", "has_begin_section", "has_exception_section",
 *                         "schema", "level", "when_clause" },
 *   "declarations": { "variables": [{ "name", "data_type", "default_value", "line_no" }],
 *                     "constants": [{ "name", "data_type", "value", "line_no" }],
 *                     "exceptions": [{ "name", "type", "error_code", "line_no" }],
 *                     "cursors": [...], "raw": [...] },
 *   "main": { "type": "begin_end", "begin_end_statements": [...], "exception_handlers": [...] },
 *   leaves: { "type", "id", "sql_statement", "line_no", "end_line_no",
 *             "function_calling": { "function_name", "parameter_type", "positional_params": [],
 *                                   "named_params": {}, "raw_text" } },
 *   "exception_handlers": [{ "exception_name", "handler_code" }],
 *   "sql_comments": []
 * }
 * </pre>
 */
public class IrJsonWriter {

    private final ObjectMapper objectMapper = new ObjectMapper();

    public ObjectNode toJson(TriggerIR ir) {
        ObjectNode root = objectMapper.createObjectNode();
        root.set("trigger_metadata", metadata(ir));
        root.set("declarations", declarations(ir.getDeclarations()));
        root.set("main", ir.getMainBlock().accept(new NodeBuilder()));

        ArrayNode handlers = root.putArray("exception_handlers");
        for (ExceptionHandler handler : ir.getMainBlock().getExceptionHandlers()) {
            ObjectNode node = handlers.addObject();
            node.put("exception_name", String.join(" OR ", handler.getExceptionNames()));
            node.put("handler_code", handlerCode(handler));
        }

        ArrayNode comments = root.putArray("sql_comments");
        ir.getComments().forEach(comments::add);
        return root;
    }

    public String toJsonString(TriggerIR ir) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toJson(ir));
        } catch (JsonProcessingException e) {
            throw new TriggerConversionException("Failed to serialize trigger IR", e);
        }
    }

    private ObjectNode metadata(TriggerIR ir) {
        TriggerMetadata m = ir.getMetadata();
        ObjectNode node = objectMapper.createObjectNode();
        node.put("trigger_name", m.getTriggerName());
        node.put("timing", m.getTiming());
        ArrayNode events = node.putArray("events");
        m.getEvents().forEach(events::add);
        node.put("table_name", m.getTableName());
        node.put("has_declare_section", ir.hasDeclareSection());
        node.put("has_begin_section", true);
        node.put("has_exception_section", ir.hasExceptionSection());
        node.put("schema", m.getSchema());
        node.put("level", m.getLevel());
        node.put("when_clause", m.getWhenClause());
        if (!m.getUpdateColumns().isEmpty()) {
            ArrayNode columns = node.putArray("update_columns");
            m.getUpdateColumns().forEach(columns::add);
        }
        return node;
    }

    private ObjectNode declarations(Declarations declarations) {
        ObjectNode node = objectMapper.createObjectNode();

        ArrayNode variables = node.putArray("variables");
        for (VariableDecl v : declarations.getVariables()) {
            ObjectNode item = variables.addObject();
            item.put("name", v.getName());
            item.put("data_type", v.getDeclaredType());
            item.put("default_value", v.getDefaultExpr());
            if (v.isNotNull()) {
                item.put("not_null", true);
            }
            item.put("line_no", v.getLineNumber());
        }

        ArrayNode constants = node.putArray("constants");
        for (ConstantDecl c : declarations.getConstants()) {
            ObjectNode item = constants.addObject();
            item.put("name", c.getName());
            item.put("data_type", c.getDeclaredType());
            item.put("value", c.getValueExpr());
            item.put("line_no", c.getLineNumber());
        }

        ArrayNode exceptions = node.putArray("exceptions");
        for (ExceptionDecl e : declarations.getExceptions()) {
            ObjectNode item = exceptions.addObject();
            item.put("name", e.getName());
            item.put("type", "EXCEPTION");
            if (e.getErrorCode() != null) {
                item.put("error_code", e.getErrorCode());
            }
            item.put("line_no", e.getLineNumber());
        }

        ArrayNode cursors = node.putArray("cursors");
        for (CursorDecl c : declarations.getCursors()) {
            ObjectNode item = cursors.addObject();
            item.put("name", c.getName());
            item.put("parameters", c.getParameters());
            item.put("query", c.getQuery());
            item.put("line_no", c.getLineNumber());
        }

        ArrayNode raw = node.putArray("raw");
        for (RawUnparsed r : declarations.getRaw()) {
            ObjectNode item = raw.addObject();
            item.put("text", r.getText());
            item.put("line_no", r.getLineNumber());
        }
        return node;
    }

    private static String handlerCode(ExceptionHandler handler) {
        StringBuilder sb = new StringBuilder();
        SourceText source = new SourceText();
        for (Statement statement : handler.getHandlerStatements()) {
            if (sb.length() > 0) {
                sb.append(' ');
            }
            sb.append(statement.accept(source));
        }
        return sb.toString().replaceAll("\\s+", " ").trim();
    }

    private class NodeBuilder implements StatementVisitor<ObjectNode> {

        @Override
        public ObjectNode visitLeaf(SqlLeaf leaf) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", leaf.getKind().getJsonType());
            node.put("id", leaf.getId());
            node.put("sql_statement", leaf.getSourceText());
            node.put("line_no", leaf.getLineNumber());
            if (leaf.getEndLine() != leaf.getLineNumber()) {
                node.put("end_line_no", leaf.getEndLine());
            }
            if (leaf.getKind() == LeafKind.PROCEDURE_CALL || leaf.getKind() == LeafKind.RAISE) {
                ProcedureCall call = ProcedureCall.parse(leaf.getSourceText());
                // RAISE leaves only when they are RAISE_APPLICATION_ERROR(...)
                if (call != null && (leaf.getKind() == LeafKind.PROCEDURE_CALL
                        || call.getFunctionName().equalsIgnoreCase("RAISE_APPLICATION_ERROR"))) {
                    node.set("function_calling", functionCalling(call));
                }
            }
            return node;
        }

        private ObjectNode functionCalling(ProcedureCall call) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("function_name", call.getFunctionName());
            node.put("parameter_type", call.getParameterType());
            ArrayNode positional = node.putArray("positional_params");
            ObjectNode named = node.putObject("named_params");
            for (ProcedureCall.Argument argument : call.getArguments()) {
                if (argument.isNamed()) {
                    named.put(argument.getName(), argument.getValue());
                } else {
                    positional.add(argument.getValue());
                }
            }
            node.put("raw_text", call.getRawArguments());
            return node;
        }

        @Override
        public ObjectNode visitIfElse(IfElse ifElse) {
            ObjectNode node = compound("if_else", ifElse);
            node.put("condition", ifElse.getCondition());
            node.set("then_statements", list(ifElse.getThenBranch()));
            ArrayNode elifs = node.putArray("else_if");
            for (ConditionalBranch branch : ifElse.getElifBranches()) {
                ObjectNode item = elifs.addObject();
                item.put("condition", branch.getCondition());
                item.put("line_no", branch.getLineNumber());
                item.set("then_statements", list(branch.getStatements()));
            }
            if (ifElse.hasElse()) {
                node.put("else_line_no", ifElse.getElseLine());
                node.set("else_statements", list(ifElse.getElseBranch()));
            }
            return node;
        }

        @Override
        public ObjectNode visitCaseWhen(CaseWhen caseWhen) {
            ObjectNode node = compound("case_when", caseWhen);
            node.put("case_expression", caseWhen.getSelector());
            ArrayNode clauses = node.putArray("when_clauses");
            for (WhenClause clause : caseWhen.getWhenClauses()) {
                ObjectNode item = clauses.addObject();
                item.put("when_value", clause.getMatchExpr());
                item.put("line_no", clause.getLineNumber());
                item.set("then_statements", list(clause.getStatements()));
            }
            if (caseWhen.hasElse()) {
                node.put("else_line_no", caseWhen.getElseLine());
                node.set("else_statements", list(caseWhen.getElseBranch()));
            }
            return node;
        }

        @Override
        public ObjectNode visitForLoop(ForLoop forLoop) {
            ObjectNode node = compound("for_loop", forLoop);
            node.put("loop_variable", forLoop.getLoopVar());
            node.put("cursor_query", forLoop.getIterableExpr());
            node.put("reverse", forLoop.isReverse());
            node.set("loop_statements", list(forLoop.getBody()));
            return node;
        }

        @Override
        public ObjectNode visitWhileLoop(WhileLoop whileLoop) {
            ObjectNode node = compound("while_loop", whileLoop);
            node.put("condition", whileLoop.getCondition());
            node.set("loop_statements", list(whileLoop.getBody()));
            return node;
        }

        @Override
        public ObjectNode visitBasicLoop(BasicLoop basicLoop) {
            ObjectNode node = compound("loop", basicLoop);
            node.set("loop_statements", list(basicLoop.getBody()));
            return node;
        }

        @Override
        public ObjectNode visitBlock(BeginEndBlock block) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", "begin_end");
            node.put("begin_line_no", block.getBeginLine());
            node.put("end_line_no", block.getEndLine());
            node.put("exception_line_no", block.hasExceptionSection() ? block.getExceptionLine() : -1);
            if (!block.getDeclarations().isEmpty()) {
                node.set("declarations", declarations(block.getDeclarations()));
            }
            node.set("begin_end_statements", list(block.getMainStatements()));
            ArrayNode handlers = node.putArray("exception_handlers");
            for (ExceptionHandler handler : block.getExceptionHandlers()) {
                ObjectNode item = handlers.addObject();
                item.put("type", "exception_handler");
                item.put("exception_name", String.join(" OR ", handler.getExceptionNames()));
                item.put("when_line_no", handler.getLineNumber());
                item.set("exception_statements", list(handler.getHandlerStatements()));
            }
            return node;
        }

        private ObjectNode compound(String type, Statement statement) {
            ObjectNode node = objectMapper.createObjectNode();
            node.put("type", type);
            node.put("line_no", statement.getLineNumber());
            node.put("end_line_no", statement.getEndLine());
            return node;
        }

        private ArrayNode list(List<Statement> statements) {
            ArrayNode array = objectMapper.createArrayNode();
            for (Statement statement : statements) {
                array.add(statement.accept(this));
            }
            return array;
        }
    }

    /**
     * Renders statements back to one-line PL/SQL for the flat {@code handler_code} field.
     */
    private static class SourceText implements StatementVisitor<String> {

        @Override
        public String visitLeaf(SqlLeaf leaf) {
            return leaf.getKind() == LeafKind.LABEL
                    ? leaf.getSourceText()
                    : leaf.getSourceText() + ";";
        }

        @Override
        public String visitIfElse(IfElse ifElse) {
            StringBuilder sb = new StringBuilder("IF ").append(ifElse.getCondition()).append(" THEN ")
                    .append(join(ifElse.getThenBranch()));
            for (ConditionalBranch branch : ifElse.getElifBranches()) {
                sb.append(" ELSIF ").append(branch.getCondition()).append(" THEN ").append(join(branch.getStatements()));
            }
            if (ifElse.hasElse()) {
                sb.append(" ELSE ").append(join(ifElse.getElseBranch()));
            }
            return sb.append(" END IF;").toString();
        }

        @Override
        public String visitCaseWhen(CaseWhen caseWhen) {
            StringBuilder sb = new StringBuilder("CASE");
            if (!caseWhen.isSearched()) {
                sb.append(' ').append(caseWhen.getSelector());
            }
            for (WhenClause clause : caseWhen.getWhenClauses()) {
                sb.append(" WHEN ").append(clause.getMatchExpr()).append(" THEN ").append(join(clause.getStatements()));
            }
            if (caseWhen.hasElse()) {
                sb.append(" ELSE ").append(join(caseWhen.getElseBranch()));
            }
            return sb.append(" END CASE;").toString();
        }

        @Override
        public String visitForLoop(ForLoop forLoop) {
            return "FOR " + forLoop.getLoopVar() + " IN " + (forLoop.isReverse() ? "REVERSE " : "")
                    + forLoop.getIterableExpr() + " LOOP " + join(forLoop.getBody()) + " END LOOP;";
        }

        @Override
        public String visitWhileLoop(WhileLoop whileLoop) {
            return "WHILE " + whileLoop.getCondition() + " LOOP " + join(whileLoop.getBody()) + " END LOOP;";
        }

        @Override
        public String visitBasicLoop(BasicLoop basicLoop) {
            return "LOOP " + join(basicLoop.getBody()) + " END LOOP;";
        }

        @Override
        public String visitBlock(BeginEndBlock block) {
            StringBuilder sb = new StringBuilder("BEGIN ").append(join(block.getMainStatements()));
            if (block.hasExceptionSection()) {
                sb.append(" EXCEPTION");
                for (ExceptionHandler handler : block.getExceptionHandlers()) {
                    sb.append(" WHEN ").append(String.join(" OR ", handler.getExceptionNames()))
                            .append(" THEN ").append(join(handler.getHandlerStatements()));
                }
            }
            return sb.append(" END;").toString();
        }

        private String join(List<Statement> statements) {
            StringBuilder sb = new StringBuilder();
            for (Statement statement : statements) {
                if (sb.length() > 0) {
                    sb.append(' ');
                }
                sb.append(statement.accept(this));
            }
            return sb.toString();
        }
    }
}
