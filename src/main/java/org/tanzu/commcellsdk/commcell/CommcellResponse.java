package org.tanzu.commcellsdk.commcell;

/**
 * Raw result of one request: the HTTP status and the body text.
 * {@link #isOk()} is the success flag every caller checks first.
 */
public class CommcellResponse {

    private final int status;
    private final String body;
    private final String contentType;

    public CommcellResponse(int status, String body, String contentType) {
        this.status = status;
        this.body = body == null ? "" : body;
        this.contentType = contentType;
    }

    public int getStatus() {
        return status;
    }

    public String getBody() {
        return body;
    }

    public String getContentType() {
        return contentType;
    }

    public boolean isOk() {
        return status == 200;
    }

    public boolean isEmpty() {
        return body.trim().isEmpty();
    }

    @Override
    public String toString() {
        return "CommcellResponse{status=" + status + ", length=" + body.length() + '}';
    }
}
