package me.christianrobert.trigconv.ir;

/**
 * {@code name EXCEPTION;} optionally linked to an Oracle error number by
 * {@code PRAGMA EXCEPTION_INIT(name, code)}.
 */
public class ExceptionDecl extends Declaration {

    private final String name;
    private final Integer errorCode;

    public ExceptionDecl(String name, Integer errorCode, int lineNumber) {
        super(lineNumber);
        if (name == null || name.isEmpty()) {
            throw new IllegalArgumentException("Exception name cannot be null or empty");
        }
        this.name = name;
        this.errorCode = errorCode;
    }

    public ExceptionDecl withErrorCode(int code) {
        return new ExceptionDecl(name, code, getLineNumber());
    }

    @Override
    public String getName() {
        return name;
    }

    /**
     * Oracle error number from PRAGMA EXCEPTION_INIT (e.g. -20001), or null.
     */
    public Integer getErrorCode() {
        return errorCode;
    }

    @Override
    public String toString() {
        return "ExceptionDecl{name='" + name + "'" + (errorCode != null ? ", errorCode=" + errorCode : "") + "}";
    }
}
