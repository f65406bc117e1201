package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;

import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Collections;

/**
 * Login, token renewal, logout and token validation calls of a session.
 *
 * The token itself is held by the {@link CommcellTransport}; these calls only read or
 * replace it.
 */
public class Authentication {

    private static final Logger logger = LoggerFactory.getLogger(Authentication.class);

    public static final String QSDK_PREFIX = "QSDK ";
    public static final String SAML_PREFIX = "SAML ";

    private final CommcellTransport transport;
    private final Services services;
    private final ResponseClassifier classifier;
    private final ObjectMapper objectMapper;
    private final XmlMapper xmlMapper;
    private final String deviceId;

    public Authentication(CommcellTransport transport, Services services, ResponseClassifier classifier,
                          ObjectMapper objectMapper, XmlMapper xmlMapper, String deviceId) {
        this.transport = transport;
        this.services = services;
        this.classifier = classifier;
        this.objectMapper = objectMapper;
        this.xmlMapper = xmlMapper;
        this.deviceId = deviceId;
    }

    /**
     * Result of a successful login.
     */
    public static class LoginResult {
        private final String userName;
        private final String token;

        public LoginResult(String userName, String token) {
            this.userName = userName;
            this.token = token;
        }

        public String getUserName() { return userName; }
        public String getToken() { return token; }
    }

    /**
     * Logs in with a user name and a plain password and stores the returned token.
     *
     * @throws SdkException CVPySDK/101 when the server rejects the credentials,
     *         Response/102 for an empty body, Response/101 for a non-200 status
     */
    public LoginResult login(String username, String password) {
        ObjectNode request = objectMapper.createObjectNode();
        request.put("mode", 4);
        request.put("username", username);
        request.put("password", encodePassword(password));
        request.put("deviceId", deviceId);

        logger.info("Logging in to {} as {}", services.webServiceUrl(), username);
        CommcellResponse response = transport.makeRequest(HttpMethod.POST, services.url(Endpoint.LOGIN), request);
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = classifier.parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        if (json.hasNonNull("userName") && json.hasNonNull("token")) {
            LoginResult result = new LoginResult(json.get("userName").asText(), json.get("token").asText());
            transport.setToken(result.getToken());
            logger.info("Login succeeded for {}", result.getUserName());
            return result;
        }
        String errorMessage = json.path("errList").path(0).path("errLogMessage").asText("");
        throw new SdkException("CVPySDK", "101", "Error: \"" + errorMessage + "\"");
    }

    /**
     * Exchanges the current token for a new one.
     *
     * @return the new token
     * @throws SdkException CVPySDK/106 for SAML tokens, CVPySDK/101 when renewal is refused
     */
    public String renewToken() {
        String token = transport.getToken();
        if (token != null && token.startsWith(SAML_PREFIX)) {
            throw new SdkException("CVPySDK", "106");
        }
        ObjectNode request = objectMapper.createObjectNode();
        request.put("sessionId", token);
        request.put("deviceId", deviceId);

        CommcellResponse response = transport.exchange(HttpMethod.POST, services.url(Endpoint.RENEW_LOGIN_TOKEN),
                request, Collections.emptyMap(), null);
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = classifier.parse(response.getBody());
        if (json == null) {
            throw new SdkException("Response", "102");
        }
        if (json.hasNonNull("token")) {
            logger.info("Login token renewed");
            return json.get("token").asText();
        }
        throw new SdkException("CVPySDK", "101", json.path("error").path("errLogMessage").asText(""));
    }

    /**
     * Ends the session on the server and clears the token.
     *
     * @return the server message, or a text describing why logout did not happen
     */
    public String logout() {
        if (transport.getToken() == null) {
            return "User already logged out.";
        }
        try {
            CommcellResponse response = transport.makeRequest(HttpMethod.POST, services.url(Endpoint.LOGOUT));
            if (response.isOk()) {
                transport.setToken(null);
                logger.info("Logged out of {}", services.webServiceUrl());
                return response.getBody();
            }
            logger.warn("Logout returned status {}", response.getStatus());
            return "Failed to logout the user";
        } catch (WebClientRequestException e) {
            logger.warn("Logout request failed: {}", e.getMessage());
            return "User already logged out";
        }
    }

    /**
     * Resolves the user that owns the current token.
     *
     * @throws SdkException CVPySDK/107 when the token maps to no user
     */
    public String whoAmI() {
        CommcellResponse response = transport.makeRequest(HttpMethod.POST, services.url(Endpoint.WHO_AM_I), null,
                Collections.singletonMap("Accept", "application/xml"));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        String userName = userNameFrom(response.getBody());
        if (userName == null || userName.isEmpty()) {
            throw new SdkException("CVPySDK", "107");
        }
        return userName;
    }

    String userNameFrom(String body) {
        String trimmed = body.trim();
        if (trimmed.startsWith("{")) {
            JsonNode json = classifier.parse(trimmed);
            return json == null ? null
                    : json.path("CvEntities_ProcessingInstructionInfo").path("user").path("userName").asText(null);
        }
        if (!trimmed.startsWith("<")) {
            return null;
        }
        try {
            // XmlMapper drops the root element and exposes attributes as fields
            JsonNode root = xmlMapper.readTree(trimmed);
            return root.path("user").path("userName").asText(null);
        } catch (JsonProcessingException e) {
            logger.warn("WhoAmI response is not valid XML: {}", e.getOriginalMessage());
            return null;
        }
    }

    public static String encodePassword(String password) {
        return Base64.getEncoder().encodeToString(password.getBytes(StandardCharsets.UTF_8));
    }

    /**
     * Adds the QSDK prefix to a bare token. QSDK and SAML tokens are kept as given.
     */
    public static String normalizeToken(String authtoken) {
        if (authtoken.startsWith(QSDK_PREFIX) || authtoken.startsWith(SAML_PREFIX)) {
            return authtoken;
        }
        return QSDK_PREFIX + authtoken;
    }
}
