package me.christianrobert.trigconv.ir;

/**
 * {@code name CONSTANT type := value;}
 */
public class ConstantDecl extends Declaration {

    private final String name;
    private final String declaredType;
    private final String valueExpr;

    public ConstantDecl(String name, String declaredType, String valueExpr, int lineNumber) {
        super(lineNumber);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Constant name cannot be null or empty");
        }
        if (valueExpr == null || valueExpr.isEmpty()) {
            throw new IllegalArgumentException("Constant " + name + " requires a value");
        }
        this.name = name;
        this.declaredType = declaredType;
        this.valueExpr = valueExpr;
    }

    @Override
    public String getName() {
        return name;
    }

    public String getDeclaredType() {
        return declaredType;
    }

    public String getValueExpr() {
        return valueExpr;
    }

    @Override
    public String toString() {
        return "ConstantDecl{name='" + name + "', declaredType='" + declaredType
                + "', valueExpr='" + valueExpr + "'}";
    }
}
