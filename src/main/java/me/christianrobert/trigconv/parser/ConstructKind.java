package me.christianrobert.trigconv.parser;

/**
 * Statement-level constructs that open a nesting level.
 */
public enum ConstructKind {
    BLOCK("BEGIN"),
    IF("IF"),
    CASE("CASE"),
    LOOP("LOOP");

    private final String keyword;

    ConstructKind(String keyword) {
        this.keyword = keyword;
    }

    /**
     * Keyword as written in the closer ({@code END IF}, {@code END LOOP}, ...). Blocks close with a bare END.
     */
    public String getKeyword() {
        return keyword;
    }

    public String closerText() {
        return this == BLOCK ? "END" : "END " + keyword;
    }
}
