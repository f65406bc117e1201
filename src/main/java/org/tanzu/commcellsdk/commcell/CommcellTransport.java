package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.util.UriComponentsBuilder;
import reactor.core.publisher.Mono;

import java.net.URI;
import java.time.Duration;
import java.util.Collections;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * The single request dispatcher shared by every feature of a session.
 *
 * Each call attaches the session headers (including {@code Authtoken}), performs a
 * blocking exchange and returns a {@link CommcellResponse} whatever the HTTP status.
 * A 401 received while a token is held renews the token and repeats the call, up to
 * the configured number of attempts.
 */
public class CommcellTransport {

    private static final Logger logger = LoggerFactory.getLogger(CommcellTransport.class);

    public static final String AUTHTOKEN_HEADER = "Authtoken";

    private static final Set<HttpMethod> SUPPORTED_METHODS =
            Set.of(HttpMethod.GET, HttpMethod.POST, HttpMethod.PUT, HttpMethod.DELETE);

    private final WebClient webClient;
    private final ObjectMapper objectMapper;
    private final XmlMapper xmlMapper;
    private final int maxAttempts;

    /** Session headers; the token lives here under {@link #AUTHTOKEN_HEADER} */
    private final ConcurrentHashMap<String, String> sessionHeaders = new ConcurrentHashMap<>();

    private volatile Supplier<String> tokenRenewer;

    public CommcellTransport(WebClient webClient, ObjectMapper objectMapper, XmlMapper xmlMapper, int maxAttempts) {
        this.webClient = webClient;
        this.objectMapper = objectMapper;
        this.xmlMapper = xmlMapper;
        this.maxAttempts = maxAttempts;
    }

    /**
     * Sets the callback used to obtain a fresh token after a 401.
     */
    public void setTokenRenewer(Supplier<String> tokenRenewer) {
        this.tokenRenewer = tokenRenewer;
    }

    public String getToken() {
        return sessionHeaders.get(AUTHTOKEN_HEADER);
    }

    public void setToken(String token) {
        if (token == null) {
            sessionHeaders.remove(AUTHTOKEN_HEADER);
        } else {
            sessionHeaders.put(AUTHTOKEN_HEADER, token);
        }
    }

    public CommcellResponse makeRequest(HttpMethod method, String url) {
        return makeRequest(method, url, null, Collections.emptyMap());
    }

    public CommcellResponse makeRequest(HttpMethod method, String url, Object payload) {
        return makeRequest(method, url, payload, Collections.emptyMap());
    }

    /**
     * Performs a request and renews the token on 401 responses.
     *
     * @param method GET, POST, PUT or DELETE
     * @param url absolute request URL
     * @param payload JSON tree, map, string or null
     * @param extraHeaders headers added on top of the session headers
     * @return the response, successful or not
     * @throws SdkException CVPySDK/102 for an unsupported method, CVPySDK/103 when the
     *         token keeps being rejected
     */
    public CommcellResponse makeRequest(HttpMethod method, String url, Object payload, Map<String, String> extraHeaders) {
        if (!SUPPORTED_METHODS.contains(method)) {
            throw new SdkException("CVPySDK", "102", "HTTP method " + method + " not supported");
        }
        int attempts = 0;
        while (true) {
            CommcellResponse response = exchange(method, url, payload, extraHeaders, null);
            if (response.getStatus() != 401 || getToken() == null || tokenRenewer == null) {
                return response;
            }
            if (attempts >= maxAttempts) {
                logger.error("Token rejected {} times for {} {}", attempts, method, url);
                throw new SdkException("CVPySDK", "103");
            }
            attempts++;
            logger.warn("Received 401 for {} {}, renewing login token (attempt {})", method, url, attempts);
            setToken(tokenRenewer.get());
        }
    }

    /**
     * Performs exactly one request. Connection failures propagate as
     * {@code WebClientRequestException}.
     *
     * @param timeout optional limit for the whole exchange
     */
    public CommcellResponse exchange(HttpMethod method, String url, Object payload,
                                     Map<String, String> extraHeaders, Duration timeout) {
        logger.debug("Commcell request: {} {}", method, url);

        WebClient.RequestBodySpec request = webClient.method(method)
                .uri(toUri(url))
                .headers(headers -> {
                    headers.setAccept(Collections.singletonList(MediaType.APPLICATION_JSON));
                    sessionHeaders.forEach(headers::set);
                    extraHeaders.forEach(headers::set);
                });

        WebClient.RequestHeadersSpec<?> spec = request;
        if (payload != null) {
            spec = request.contentType(contentTypeFor(method, payload)).bodyValue(serialize(payload));
        } else if (HttpMethod.POST.equals(method) || HttpMethod.PUT.equals(method)) {
            request.contentType(MediaType.APPLICATION_JSON);
        }

        Mono<ResponseEntity<String>> call =
                spec.exchangeToMono(clientResponse -> clientResponse.toEntity(String.class));
        if (timeout != null) {
            call = call.timeout(timeout);
        }
        ResponseEntity<String> entity = call.block();
        if (entity == null) {
            throw new SdkException("Response", "102", "No response received for " + method + " " + url);
        }

        MediaType contentType = entity.getHeaders().getContentType();
        CommcellResponse response = new CommcellResponse(entity.getStatusCode().value(), entity.getBody(),
                contentType != null ? contentType.toString() : null);
        logger.debug("Commcell response: {} {} -> {}", method, url, response.getStatus());
        return response;
    }

    static URI toUri(String url) {
        return UriComponentsBuilder.fromUriString(url).build().encode().toUri();
    }

    /**
     * JSON for structured payloads. A string payload sent with POST is XML when it parses
     * as XML, plain text otherwise.
     */
    MediaType contentTypeFor(HttpMethod method, Object payload) {
        if (!(payload instanceof String)) {
            return MediaType.APPLICATION_JSON;
        }
        if (!HttpMethod.POST.equals(method)) {
            return MediaType.APPLICATION_JSON;
        }
        return isXml((String) payload) ? MediaType.APPLICATION_XML : MediaType.TEXT_PLAIN;
    }

    boolean isXml(String payload) {
        String trimmed = payload.trim();
        if (!trimmed.startsWith("<")) {
            return false;
        }
        try {
            xmlMapper.readTree(trimmed);
            return true;
        } catch (JsonProcessingException e) {
            logger.debug("Payload is not XML: {}", e.getOriginalMessage());
            return false;
        }
    }

    private String serialize(Object payload) {
        if (payload instanceof String) {
            return (String) payload;
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            throw new SdkException("CVPySDK", "102", "Payload could not be serialized: " + e.getOriginalMessage(), e);
        }
    }
}
