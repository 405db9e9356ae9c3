package me.christianrobert.trigconv.ir;

/**
 * Classification of a semicolon-terminated statement by its leading keyword.
 * The JSON type tag is part of the stable IR document contract.
 */
public enum LeafKind {
    SELECT("select_statement"),
    INSERT("insert_statement"),
    UPDATE("update_statement"),
    DELETE("delete_statement"),
    MERGE("merge_statement"),
    ASSIGNMENT("assignment"),
    RAISE("raise_statement"),
    RETURN("return_statement"),
    NULL("null_statement"),
    PROCEDURE_CALL("function_calling"),
    EXIT("exit_statement"),
    CONTINUE("continue_statement"),
    OPEN("open_statement"),
    FETCH("fetch_statement"),
    CLOSE("close_statement"),
    LABEL("label"),
    OTHER("other_statement");

    private final String jsonType;

    LeafKind(String jsonType) {
        this.jsonType = jsonType;
    }

    public String getJsonType() {
        return jsonType;
    }

    public boolean isDml() {
        return this == SELECT || this == INSERT || this == UPDATE || this == DELETE || this == MERGE;
    }
}
