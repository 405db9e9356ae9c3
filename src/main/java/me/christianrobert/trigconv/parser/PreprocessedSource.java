package me.christianrobert.trigconv.parser;

import java.util.Collections;
import java.util.List;

/**
 * Output of the {@link Preprocessor}: the ordered line records and the comments removed from them.
 */
public class PreprocessedSource {

    private final List<SourceLine> lines;
    private final List<String> comments;
    private final int physicalLineCount;

    public PreprocessedSource(List<SourceLine> lines, List<String> comments, int physicalLineCount) {
        this.lines = Collections.unmodifiableList(lines);
        this.comments = Collections.unmodifiableList(comments);
        this.physicalLineCount = physicalLineCount;
    }

    public List<SourceLine> getLines() {
        return lines;
    }

    public List<String> getComments() {
        return comments;
    }

    public int getPhysicalLineCount() {
        return physicalLineCount;
    }
}
