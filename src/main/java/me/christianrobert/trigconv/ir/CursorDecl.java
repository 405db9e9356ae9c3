package me.christianrobert.trigconv.ir;

/**
 * {@code CURSOR name [(parameters)] IS query;}
 */
public class CursorDecl extends Declaration {

    private final String name;
    private final String parameters;
    private final String query;

    public CursorDecl(String name, String parameters, String query, int lineNumber) {
        super(lineNumber);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Cursor name cannot be null or empty");
        }
        if (query == null || query.isEmpty()) {
            throw new IllegalArgumentException("Cursor " + name + " requires a query");
        }
        this.name = name;
        this.parameters = parameters;
        this.query = query;
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Parameter list without the surrounding parentheses, or null.
     */
    public String getParameters() {
        return parameters;
    }

    public String getQuery() {
        return query;
    }

    @Override
    public String toString() {
        return "CursorDecl{name='" + name + "', query='" + query + "'}";
    }
}
