package me.christianrobert.trigconv.ir;

/**
 * A declaration that matches no recognized shape, kept verbatim.
 */
public class RawUnparsed extends Declaration {

    private final String text;

    public RawUnparsed(String text, int lineNumber) {
        super(lineNumber);
        this.text = text;
    }

    @Override
    public String getName() {
        return null;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return "RawUnparsed{'" + text + "'}";
    }
}
