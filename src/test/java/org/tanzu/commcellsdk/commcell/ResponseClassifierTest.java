package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ResponseClassifierTest {

    private final ResponseClassifier classifier = new ResponseClassifier(new ObjectMapper());

    private ResponseOutcome classify(int status, String body) {
        return classifier.classify(new CommcellResponse(status, body, "application/json"));
    }

    @Test
    void plainJsonIsSuccess() {
        ResponseOutcome outcome = classify(200, "{\"clientProperties\":[]}");

        assertTrue(outcome.isSuccess());
        assertTrue(((ResponseOutcome.Success) outcome).getJson().has("clientProperties"));
    }

    @Test
    void zeroErrorCodeIsSuccess() {
        assertTrue(classify(200, "{\"errorCode\":0,\"errorMessage\":\"\"}").isSuccess());
        assertTrue(classify(200, "{\"error\":{\"errorCode\":\"0\"}}").isSuccess());
    }

    @Test
    void nonSuccessStatusUsesHtmlTitle() {
        ResponseOutcome outcome = classify(500, "<html><head><title>Internal Server Error</title></head></html>");

        assertEquals(ResponseOutcome.Kind.HTTP_ERROR, outcome.kind());
        ResponseOutcome.HttpError error = (ResponseOutcome.HttpError) outcome;
        assertEquals(500, error.getStatus());
        assertEquals("Internal Server Error", error.getMessage());
    }

    @Test
    void topLevelErrorCodeIsApiError() {
        ResponseOutcome outcome = classify(200, "{\"errorCode\":2,\"errorMessage\":\"Client not found\"}");

        assertEquals(ResponseOutcome.Kind.API_ERROR, outcome.kind());
        assertEquals("2", ((ResponseOutcome.ApiError) outcome).getCode());
        assertEquals("Client not found", ((ResponseOutcome.ApiError) outcome).getMessage());
    }

    @Test
    void nestedErrorObjectIsApiError() {
        ResponseOutcome outcome = classify(200, "{\"error\":{\"errorCode\":9,\"errLogMessage\":\"Access denied\"}}");

        assertEquals("Access denied", ((ResponseOutcome.ApiError) outcome).getMessage());
    }

    @Test
    void firstResponseElementIsChecked() {
        ResponseOutcome outcome = classify(200,
                "{\"response\":[{\"errorCode\":3,\"errorString\":\"Group already exists\"},{\"errorCode\":0}]}");

        assertEquals(ResponseOutcome.Kind.API_ERROR, outcome.kind());
        assertEquals("Group already exists", ((ResponseOutcome.ApiError) outcome).getMessage());
    }

    @Test
    void emptyOrNonJsonBodyIsMalformed() {
        assertEquals(ResponseOutcome.Kind.MALFORMED_BODY, classify(200, "").kind());
        assertEquals(ResponseOutcome.Kind.MALFORMED_BODY, classify(200, "Operation completed").kind());
    }

    @Test
    void orThrowMapsEachKind() {
        SdkException http = assertThrows(SdkException.class,
                () -> classify(404, "<title>Not Found</title>").orThrow("Client", "102"));
        assertEquals("Response", http.getModule());
        assertEquals("101", http.getErrorId());
        assertEquals("Response was not success\nNot Found", http.getMessage());

        SdkException api = assertThrows(SdkException.class,
                () -> classify(200, "{\"errorCode\":1,\"errorMessage\":\"boom\"}").orThrow("Client", "102"));
        assertEquals("Client", api.getModule());
        assertEquals("boom", api.getMessage());

        SdkException empty = assertThrows(SdkException.class, () -> classify(200, "").orThrow("Client", "102"));
        assertEquals("102", empty.getErrorId());
        assertEquals("Response received is empty", empty.getMessage());
    }

    @Test
    void updateResponseKeepsTextWithoutTitle() {
        assertEquals("plain failure", ResponseClassifier.updateResponse("plain failure"));
        assertEquals("", ResponseClassifier.updateResponse(null));
    }
}
