package me.christianrobert.trigconv.parser;

import me.christianrobert.trigconv.ir.LeafKind;

/**
 * Decides the {@link LeafKind} of a semicolon-terminated statement from its leading tokens.
 * The kind is fixed here once; generation never re-inspects the statement text to dispatch.
 */
public class StatementClassifier {

    /**
     * Classifies the statement occupying {@code [from, to]} (terminator excluded).
     */
    public static LeafKind classify(TokenSequence tokens, int from, int to) {
        if (from > to) {
            return LeafKind.OTHER;
        }
        // a := b, :new.x := b, arr(i) := b
        if (hasTopLevelAssignment(tokens, from, to)) {
            return LeafKind.ASSIGNMENT;
        }

        SqlToken first = tokens.get(from);
        if (!first.isWord()) {
            return LeafKind.OTHER;
        }

        switch (first.getUpper()) {
            case "SELECT":
            case "WITH":
                return LeafKind.SELECT;
            case "INSERT":
                return LeafKind.INSERT;
            case "UPDATE":
                return LeafKind.UPDATE;
            case "DELETE":
                return LeafKind.DELETE;
            case "MERGE":
                return LeafKind.MERGE;
            case "RAISE":
            case "RAISE_APPLICATION_ERROR":
                return LeafKind.RAISE;
            case "RETURN":
                return LeafKind.RETURN;
            case "NULL":
                return LeafKind.NULL;
            case "EXIT":
                return LeafKind.EXIT;
            case "CONTINUE":
                return LeafKind.CONTINUE;
            case "OPEN":
                return LeafKind.OPEN;
            case "FETCH":
                return LeafKind.FETCH;
            case "CLOSE":
                return LeafKind.CLOSE;
            case "COMMIT":
            case "ROLLBACK":
            case "SAVEPOINT":
            case "EXECUTE":
            case "SET":
            case "LOCK":
            case "GOTO":
                return LeafKind.OTHER;
            default:
                return LeafKind.PROCEDURE_CALL;
        }
    }

    private static boolean hasTopLevelAssignment(TokenSequence tokens, int from, int to) {
        int parenDepth = 0;
        for (int i = from; i <= to; i++) {
            SqlToken token = tokens.get(i);
            if (token.isSymbol("(")) {
                parenDepth++;
            } else if (token.isSymbol(")")) {
                parenDepth--;
            } else if (parenDepth == 0 && token.isSymbol(":=")) {
                return true;
            }
        }
        return false;
    }
}
