package me.christianrobert.trigconv.translator;

/**
 * Immutable generation settings passed into one translation.
 */
public class ConversionOptions {

    private final String newRecordName;
    private final String oldRecordName;
    private final String operationVariable;
    private final int indentWidth;
    private final boolean generateDdl;
    private final String defaultSchema;

    private ConversionOptions(Builder builder) {
        this.newRecordName = requireText(builder.newRecordName, "New record name");
        this.oldRecordName = requireText(builder.oldRecordName, "Old record name");
        this.operationVariable = requireText(builder.operationVariable, "Operation variable");
        if (builder.indentWidth < 0 || builder.indentWidth > 16) {
            throw new IllegalArgumentException("Indent width must be between 0 and 16, was " + builder.indentWidth);
        }
        this.indentWidth = builder.indentWidth;
        this.generateDdl = builder.generateDdl;
        this.defaultSchema = requireText(builder.defaultSchema, "Default schema");
    }

    public static ConversionOptions defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    private static String requireText(String value, String what) {
        if (value == null || value.trim().isEmpty()) {
            throw new IllegalArgumentException(what + " cannot be null or empty");
        }
        return value.trim();
    }

    public String getNewRecordName() {
        return newRecordName;
    }

    public String getOldRecordName() {
        return oldRecordName;
    }

    public String getOperationVariable() {
        return operationVariable;
    }

    public int getIndentWidth() {
        return indentWidth;
    }

    public boolean isGenerateDdl() {
        return generateDdl;
    }

    public String getDefaultSchema() {
        return defaultSchema;
    }

    @Override
    public String toString() {
        return "ConversionOptions{new=" + newRecordName + ", old=" + oldRecordName
                + ", op=" + operationVariable + ", indent=" + indentWidth
                + ", ddl=" + generateDdl + ", schema=" + defaultSchema + "}";
    }

    public static class Builder {
        private String newRecordName = "NEW";
        private String oldRecordName = "OLD";
        private String operationVariable = "TG_OP";
        private int indentWidth = 2;
        private boolean generateDdl = true;
        private String defaultSchema = "public";

        public Builder newRecordName(String newRecordName) {
            this.newRecordName = newRecordName;
            return this;
        }

        public Builder oldRecordName(String oldRecordName) {
            this.oldRecordName = oldRecordName;
            return this;
        }

        public Builder operationVariable(String operationVariable) {
            this.operationVariable = operationVariable;
            return this;
        }

        public Builder indentWidth(int indentWidth) {
            this.indentWidth = indentWidth;
            return this;
        }

        public Builder generateDdl(boolean generateDdl) {
            this.generateDdl = generateDdl;
            return this;
        }

        public Builder defaultSchema(String defaultSchema) {
            this.defaultSchema = defaultSchema;
            return this;
        }

        public ConversionOptions build() {
            return new ConversionOptions(this);
        }
    }
}
