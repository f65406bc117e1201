package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Classified result of a Commcell call, produced by {@link ResponseClassifier}.
 *
 * Exactly one of four shapes:
 * <ul>
 *   <li>{@link Success} – 200 status with a JSON body that carries no error code</li>
 *   <li>{@link HttpError} – non-200 status, message taken from the HTML title when present</li>
 *   <li>{@link ApiError} – 200 status whose body reports a non-zero error code</li>
 *   <li>{@link MalformedBody} – 200 status with an empty or non-JSON body</li>
 * </ul>
 */
public abstract class ResponseOutcome {

    public enum Kind { SUCCESS, HTTP_ERROR, API_ERROR, MALFORMED_BODY }

    private ResponseOutcome() {
    }

    public abstract Kind kind();

    public boolean isSuccess() {
        return kind() == Kind.SUCCESS;
    }

    /**
     * Returns the JSON body of a successful outcome, or raises.
     *
     * HTTP errors raise Response/101 with the server message, malformed bodies raise
     * Response/102, and API errors raise the given module/id with the server message
     * verbatim.
     *
     * @param module module of the exception raised for an API error
     * @param errorId catalog id of the exception raised for an API error
     * @return the parsed response body
     */
    public JsonNode orThrow(String module, String errorId) {
        switch (kind()) {
            case SUCCESS:
                return ((Success) this).getJson();
            case HTTP_ERROR:
                throw new SdkException("Response", "101", ((HttpError) this).getMessage());
            case API_ERROR:
                throw new SdkException(module, errorId, ((ApiError) this).getMessage());
            default:
                throw new SdkException("Response", "102");
        }
    }

    public static final class Success extends ResponseOutcome {
        private final JsonNode json;

        public Success(JsonNode json) {
            this.json = json;
        }

        public JsonNode getJson() {
            return json;
        }

        @Override
        public Kind kind() {
            return Kind.SUCCESS;
        }
    }

    public static final class HttpError extends ResponseOutcome {
        private final int status;
        private final String message;

        public HttpError(int status, String message) {
            this.status = status;
            this.message = message;
        }

        public int getStatus() {
            return status;
        }

        public String getMessage() {
            return message;
        }

        @Override
        public Kind kind() {
            return Kind.HTTP_ERROR;
        }

        @Override
        public String toString() {
            return "HttpError{status=" + status + ", message='" + message + "'}";
        }
    }

    public static final class ApiError extends ResponseOutcome {
        private final String code;
        private final String message;
        private final JsonNode json;

        public ApiError(String code, String message, JsonNode json) {
            this.code = code;
            this.message = message;
            this.json = json;
        }

        public String getCode() {
            return code;
        }

        public String getMessage() {
            return message;
        }

        public JsonNode getJson() {
            return json;
        }

        @Override
        public Kind kind() {
            return Kind.API_ERROR;
        }

        @Override
        public String toString() {
            return "ApiError{code=" + code + ", message='" + message + "'}";
        }
    }

    public static final class MalformedBody extends ResponseOutcome {
        private final String text;

        public MalformedBody(String text) {
            this.text = text;
        }

        public String getText() {
            return text;
        }

        @Override
        public Kind kind() {
            return Kind.MALFORMED_BODY;
        }
    }
}
