package me.christianrobert.trigconv.parser;

/**
 * One non-blank physical line of a trigger body after comment removal.
 *
 * <p>{@code lineNumber} is 1-based and refers to the original input, {@code indent}
 * is the width of the leading whitespace (a tab counts as four columns) and
 * {@code text} is the line content without leading and trailing whitespace. When a
 * string literal continues past the line, {@code text} also holds the following
 * physical lines up to the one that closes it, joined by {@code \n} and untouched.</p>
 */
public class SourceLine {

    private final int lineNumber;
    private final int indent;
    private final String text;

    public SourceLine(int lineNumber, int indent, String text) {
        if (lineNumber < 1) {
            throw new IllegalArgumentException("Line number must be positive: " + lineNumber);
        }
        if (text == null) {
            throw new IllegalArgumentException("Line text cannot be null");
        }
        this.lineNumber = lineNumber;
        this.indent = indent;
        this.text = text;
    }

    public int getLineNumber() {
        return lineNumber;
    }

    public int getIndent() {
        return indent;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "SourceLine{" + lineNumber + ", indent=" + indent + ", '" + text + "'}";
    }
}
