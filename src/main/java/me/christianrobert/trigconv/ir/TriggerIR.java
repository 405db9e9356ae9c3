package me.christianrobert.trigconv.ir;

import java.util.Collections;
import java.util.List;

/**
 * Root of the intermediate representation of one trigger body.
 *
 * <p>Built once by the parser and read-only afterwards; translating the same IR
 * with different mapping tables re-walks this tree without modifying it.</p>
 */
public class TriggerIR {

    private final TriggerMetadata metadata;
    private final Declarations declarations;
    private final BeginEndBlock mainBlock;
    private final List<String> comments;
    private final boolean declareSection;

    public TriggerIR(TriggerMetadata metadata, Declarations declarations, BeginEndBlock mainBlock,
                     List<String> comments, boolean declareSection) {
        if (mainBlock == null) {
            throw new IllegalArgumentException("Main block cannot be null");
        }
        this.metadata = metadata != null ? metadata : TriggerMetadata.empty();
        this.declarations = declarations != null ? declarations : Declarations.empty();
        this.mainBlock = mainBlock;
        this.comments = comments != null ? Collections.unmodifiableList(comments) : Collections.emptyList();
        this.declareSection = declareSection;
    }

    public TriggerIR withMetadata(TriggerMetadata newMetadata) {
        return new TriggerIR(newMetadata, declarations, mainBlock, comments, declareSection);
    }

    public TriggerMetadata getMetadata() {
        return metadata;
    }

    public Declarations getDeclarations() {
        return declarations;
    }

    public BeginEndBlock getMainBlock() {
        return mainBlock;
    }

    public List<String> getComments() {
        return comments;
    }

    public boolean hasDeclareSection() {
        return declareSection;
    }

    public boolean hasExceptionSection() {
        return mainBlock.hasExceptionSection();
    }

    @Override
    public String toString() {
        return "TriggerIR{" + metadata + ", declarations=" + declarations.size() + ", main=" + mainBlock + "}";
    }
}
