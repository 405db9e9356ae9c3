package me.christianrobert.trigconv.translator.mapping;

/**
 * The three tables a translation reads: functions, types and exception message templates.
 */
public class MappingTables {

    public static final String FUNCTIONS = "function_mappings";
    public static final String TYPES = "type_mappings";
    public static final String EXCEPTIONS = "exception_mappings";

    private final MappingTable functions;
    private final MappingTable types;
    private final MappingTable exceptions;

    public MappingTables(MappingTable functions, MappingTable types, MappingTable exceptions) {
        this.functions = functions != null ? functions : MappingTable.empty(FUNCTIONS);
        this.types = types != null ? types : MappingTable.empty(TYPES);
        this.exceptions = exceptions != null ? exceptions : MappingTable.empty(EXCEPTIONS);
    }

    public static MappingTables empty() {
        return new MappingTables(null, null, null);
    }

    public MappingTable getFunctions() {
        return functions;
    }

    public MappingTable getTypes() {
        return types;
    }

    public MappingTable getExceptions() {
        return exceptions;
    }

    @Override
    public String toString() {
        return "MappingTables{functions=" + functions.size() + ", types=" + types.size()
                + ", exceptions=" + exceptions.size() + "}";
    }
}
