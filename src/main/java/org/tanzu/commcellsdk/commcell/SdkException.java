package org.tanzu.commcellsdk.commcell;

/**
 * Single exception type raised by every Commcell operation.
 *
 * Carries the feature area ("module"), the catalog error id and an optional detail
 * string, usually the message the server returned. The exception message is the
 * catalog text followed by the detail on a new line.
 */
public class SdkException extends RuntimeException {

    private final String module;
    private final String errorId;
    private final String detail;

    public SdkException(String module, String errorId) {
        this(module, errorId, null);
    }

    public SdkException(String module, String errorId, String detail) {
        super(ErrorCatalog.message(module, errorId, detail));
        this.module = module;
        this.errorId = errorId;
        this.detail = detail;
    }

    public SdkException(String module, String errorId, String detail, Throwable cause) {
        super(ErrorCatalog.message(module, errorId, detail), cause);
        this.module = module;
        this.errorId = errorId;
        this.detail = detail;
    }

    public String getModule() {
        return module;
    }

    public String getErrorId() {
        return errorId;
    }

    public String getDetail() {
        return detail;
    }
}
