package me.christianrobert.trigconv.ir;

/**
 * {@code name type [NOT NULL] [:= default];}
 *
 * <p>The declared type is kept verbatim, including anchored references such as
 * {@code employees.salary%TYPE}. Type translation happens during generation.</p>
 */
public class VariableDecl extends Declaration {

    private final String name;
    private final String declaredType;
    private final String defaultExpr;
    private final boolean notNull;

    public VariableDecl(String name, String declaredType, String defaultExpr, boolean notNull, int lineNumber) {
        super(lineNumber);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Variable name cannot be null or empty");
        }
        if (declaredType == null || declaredType.isEmpty()) {
            throw new IllegalArgumentException("Declared type cannot be null or empty for " + name);
        }
        this.name = name;
        this.declaredType = declaredType;
        this.defaultExpr = defaultExpr;
        this.notNull = notNull;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    /**
     * Default expression after {@code :=} or {@code DEFAULT}, or null.
     */
    public String getDefaultExpr() {
        return defaultExpr;
    }

    public boolean isNotNull() {
        return notNull;
    }

    @Override
    public String toString() {
        return "VariableDecl{name='" + name + "', declaredType='" + declaredType
                + "', defaultExpr=" + (defaultExpr == null ? "null" : "'" + defaultExpr + "'") + "}";
    }
}
