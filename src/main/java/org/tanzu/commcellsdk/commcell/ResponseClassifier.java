package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * Turns a raw {@link CommcellResponse} into a {@link ResponseOutcome}.
 *
 * The server reports failures in several places: a non-200 status with an HTML error
 * page, a top level {@code errorCode}, an {@code error} object, or the first element of
 * a {@code response} array. All of them are mapped here so feature code only deals
 * with the outcome.
 */
public class ResponseClassifier {

    private static final String[] MESSAGE_FIELDS = {"errorMessage", "errorString", "errLogMessage", "warningMessage"};

    private final ObjectMapper objectMapper;

    public ResponseClassifier(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ResponseOutcome classify(CommcellResponse response) {
        if (!response.isOk()) {
            return new ResponseOutcome.HttpError(response.getStatus(), updateResponse(response.getBody()));
        }
        if (response.isEmpty()) {
            return new ResponseOutcome.MalformedBody("");
        }
        JsonNode json = parse(response.getBody());
        if (json == null || json.isMissingNode() || json.isNull()) {
            return new ResponseOutcome.MalformedBody(response.getBody());
        }
        return classifyJson(json);
    }

    /**
     * Classifies an already parsed body.
     */
    public ResponseOutcome classifyJson(JsonNode json) {
        ResponseOutcome.ApiError error = errorIn(json, json);
        if (error == null && json.path("error").isObject()) {
            error = errorIn(json.path("error"), json);
        }
        if (error == null && json.path("response").isArray() && json.path("response").size() > 0) {
            error = errorIn(json.path("response").get(0), json);
        }
        return error != null ? error : new ResponseOutcome.Success(json);
    }

    /**
     * Parses the body as JSON, or returns null when it is not JSON.
     */
    public JsonNode parse(String body) {
        if (body == null || body.trim().isEmpty()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * Extracts the text of the HTML {@code <title>} element from an error page.
     * Input without both title tags is returned unchanged.
     */
    public static String updateResponse(String input) {
        if (input == null) {
            return "";
        }
        int start = input.indexOf("<title>");
        int end = input.indexOf("</title>");
        if (start >= 0 && end > start) {
            return input.substring(start + "<title>".length(), end);
        }
        return input;
    }

    /**
     * True when the node holds an error code other than zero, numeric or textual.
     */
    public static boolean hasErrorCode(JsonNode node) {
        JsonNode code = node.path("errorCode");
        if (code.isMissingNode() || code.isNull()) {
            return false;
        }
        String text = code.asText().trim();
        return !text.isEmpty() && !"0".equals(text);
    }

    /**
     * First non-empty error message field of the node.
     */
    public static String errorMessage(JsonNode node) {
        for (String field : MESSAGE_FIELDS) {
            String value = node.path(field).asText("");
            if (!value.isEmpty()) {
                return value;
            }
        }
        return "";
    }

    private static ResponseOutcome.ApiError errorIn(JsonNode node, JsonNode body) {
        if (!node.isObject() || !hasErrorCode(node)) {
            return null;
        }
        return new ResponseOutcome.ApiError(node.path("errorCode").asText(), errorMessage(node), body);
    }
}
