package me.christianrobert.trigconv.ir;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The declarations of one DECLARE section in source order, with typed views per kind.
 */
public class Declarations {

    private static final Declarations EMPTY = new Declarations(Collections.emptyList());

    private final List<Declaration> all;

    public Declarations(List<Declaration> declarations) {
        this.all = Collections.unmodifiableList(new ArrayList<>(declarations));
    }

    public static Declarations empty() {
        return EMPTY;
    }

    public List<Declaration> getAll() {
        return all;
    }

    public List<VariableDecl> getVariables() {
        return ofType(VariableDecl.class);
    }

    public List<ConstantDecl> getConstants() {
        return ofType(ConstantDecl.class);
    }

    public List<ExceptionDecl> getExceptions() {
        return ofType(ExceptionDecl.class);
    }

    public List<CursorDecl> getCursors() {
        return ofType(CursorDecl.class);
    }

    public List<RawUnparsed> getRaw() {
        return ofType(RawUnparsed.class);
    }

    /**
     * Case-insensitive lookup by declared name.
     */
    public Declaration find(String name) {
        for (Declaration declaration : all) {
            if (declaration.getName() != null && declaration.getName().equalsIgnoreCase(name)) {
                return declaration;
            }
        }
        return null;
    }

    public boolean isEmpty() {
        return all.isEmpty();
    }

    public int size() {
        return all.size();
    }

    private <T extends Declaration> List<T> ofType(Class<T> type) {
        List<T> result = new ArrayList<>();
        for (Declaration declaration : all) {
            if (type.isInstance(declaration)) {
                result.add(type.cast(declaration));
            }
        }
        return Collections.unmodifiableList(result);
    }

    @Override
    public String toString() {
        return "Declarations{" + all + "}";
    }
}
