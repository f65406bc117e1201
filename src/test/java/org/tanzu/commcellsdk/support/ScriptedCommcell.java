package org.tanzu.commcellsdk.support;

import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.codec.HttpMessageWriter;
import org.springframework.http.server.reactive.ServerHttpRequest;
import org.springframework.mock.http.client.reactive.MockClientHttpRequest;
import org.springframework.web.reactive.function.BodyInserter;
import org.springframework.web.reactive.function.client.ClientRequest;
import org.springframework.web.reactive.function.client.ClientResponse;
import org.springframework.web.reactive.function.client.ExchangeFunction;
import org.springframework.web.reactive.function.client.ExchangeStrategies;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.config.CommcellConfig;
import reactor.core.publisher.Mono;

import java.net.ConnectException;
import java.net.URI;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Scripted Commcell web service for tests.
 *
 * Routes are keyed by method and the path after {@code /webconsole/api/}, with an
 * optional query, e.g. {@code "GET Client"} or {@code "GET User/5?Level=50"}. A request
 * is matched on its exact key first, then on the key without its query. Several
 * responses queued on one route are returned in order, the last one repeatedly.
 * Unrouted requests get a 404.
 */
public class ScriptedCommcell implements ExchangeFunction {

    public static final String HOST = "cs.example.com";
    public static final String API = "/webconsole/api/";

    public static final String LOGIN_OK = "{\"userName\":\"admin\",\"token\":\"QSDK 1234\"}";
    public static final String COMMSERV_OK = "{\"commcell\":{\"commCellName\":\"CS1\",\"csGUID\":\"guid-1\","
            + "\"commCellId\":2},\"hostName\":\"cs1.example.com\",\"csVersionInfo\":\"11.0 SP32\","
            + "\"timeZone\":\"-05:00 (Eastern Standard Time)\","
            + "\"csTimeZone\":{\"TimeZoneName\":\"Eastern Standard Time\"},\"currentSPVersion\":32}";

    private final Map<String, Deque<Reply>> routes = new HashMap<>();
    private final Set<String> unreachableSchemes = new HashSet<>();
    private final List<Recorded> requests = Collections.synchronizedList(new ArrayList<>());

    public ScriptedCommcell() {
        on(HttpMethod.GET, "").respond(200, "");
        on(HttpMethod.POST, "Login").respond(200, LOGIN_OK);
        on(HttpMethod.GET, "CommServ").respond(200, COMMSERV_OK);
        on(HttpMethod.POST, "Logout").respond(200, "User logged out");
    }

    public Route on(HttpMethod method, String pathAndQuery) {
        String key = method.name() + " " + pathAndQuery;
        Deque<Reply> replies = new ArrayDeque<>();
        routes.put(key, replies);
        return new Route(replies);
    }

    /**
     * Connections to the given scheme fail as if nothing listened on the port.
     */
    public ScriptedCommcell unreachable(String scheme) {
        unreachableSchemes.add(scheme);
        return this;
    }

    public WebClient webClient() {
        return WebClient.builder().exchangeFunction(this).build();
    }

    public static CommcellConfig config() {
        CommcellConfig config = new CommcellConfig();
        config.setHost(HOST);
        config.setUsername("admin");
        config.setPassword("secret");
        return config;
    }

    public Commcell connect() {
        return connect(config());
    }

    public Commcell connect(CommcellConfig config) {
        return new Commcell(config, webClient(), Executors.newFixedThreadPool(2));
    }

    public Commcell connect(CommcellConfig config, ExecutorService executor) {
        return new Commcell(config, webClient(), executor);
    }

    public List<Recorded> requests() {
        return new ArrayList<>(requests);
    }

    /**
     * Requests sent with the given method and path, query ignored.
     */
    public List<Recorded> requests(HttpMethod method, String path) {
        List<Recorded> matching = new ArrayList<>();
        for (Recorded recorded : requests()) {
            if (recorded.method.equals(method) && recorded.path.equals(path)) {
                matching.add(recorded);
            }
        }
        return matching;
    }

    public Recorded lastRequest(HttpMethod method, String path) {
        List<Recorded> matching = requests(method, path);
        if (matching.isEmpty()) {
            throw new AssertionError("No " + method + " request sent to " + path);
        }
        return matching.get(matching.size() - 1);
    }

    @Override
    public Mono<ClientResponse> exchange(ClientRequest request) {
        URI uri = request.url();
        if (unreachableSchemes.contains(uri.getScheme())) {
            return Mono.error(new WebClientRequestException(new ConnectException("Connection refused"),
                    request.method(), uri, request.headers()));
        }
        String path = uri.getPath();
        int api = path.indexOf(API);
        path = api >= 0 ? path.substring(api + API.length()) : path;
        String query = uri.getQuery();

        Recorded recorded = new Recorded(request.method(), path, query, request.headers(), bodyOf(request));
        requests.add(recorded);

        String base = request.method().name() + " " + path;
        Deque<Reply> replies = null;
        if (query != null && !query.isEmpty()) {
            replies = routes.get(base + "?" + query);
        }
        if (replies == null) {
            replies = routes.get(base);
        }
        if (replies == null || replies.isEmpty()) {
            return Mono.just(ClientResponse.create(HttpStatus.NOT_FOUND)
                    .header(HttpHeaders.CONTENT_TYPE, "text/html")
                    .body("<html><title>Not Found</title></html>")
                    .build());
        }
        Reply reply = replies.size() > 1 ? replies.poll() : replies.peek();
        return Mono.just(ClientResponse.create(HttpStatus.valueOf(reply.status))
                .header(HttpHeaders.CONTENT_TYPE, reply.contentType)
                .body(reply.body)
                .build());
    }

    private static String bodyOf(ClientRequest request) {
        MockClientHttpRequest mock = new MockClientHttpRequest(request.method(), request.url());
        request.body().insert(mock, new BodyInserter.Context() {
            @Override
            public List<HttpMessageWriter<?>> messageWriters() {
                return ExchangeStrategies.withDefaults().messageWriters();
            }

            @Override
            public Optional<ServerHttpRequest> serverRequest() {
                return Optional.empty();
            }

            @Override
            public Map<String, Object> hints() {
                return Collections.emptyMap();
            }
        }).block();
        String body = mock.getBodyAsString().block();
        return body == null ? "" : body;
    }

    public static final class Route {
        private final Deque<Reply> replies;

        Route(Deque<Reply> replies) {
            this.replies = replies;
        }

        public Route respond(int status, String body) {
            String trimmed = body.trim();
            String contentType = trimmed.startsWith("{") || trimmed.startsWith("[") ? "application/json"
                    : trimmed.startsWith("<") ? "application/xml" : "text/plain";
            replies.add(new Reply(status, body, contentType));
            return this;
        }

        public Route respondHtml(int status, String title) {
            replies.add(new Reply(status, "<html><head><title>" + title + "</title></head></html>", "text/html"));
            return this;
        }
    }

    private static final class Reply {
        private final int status;
        private final String body;
        private final String contentType;

        Reply(int status, String body, String contentType) {
            this.status = status;
            this.body = body;
            this.contentType = contentType;
        }
    }

    /**
     * A request as it reached the scripted server.
     */
    public static final class Recorded {
        private final HttpMethod method;
        private final String path;
        private final String query;
        private final HttpHeaders headers;
        private final String body;

        Recorded(HttpMethod method, String path, String query, HttpHeaders headers, String body) {
            this.method = method;
            this.path = path;
            this.query = query;
            this.headers = headers;
            this.body = body;
        }

        public HttpMethod getMethod() { return method; }
        public String getPath() { return path; }
        public String getQuery() { return query; }
        public HttpHeaders getHeaders() { return headers; }
        public String getBody() { return body; }

        @Override
        public String toString() {
            return method + " " + path + (query != null ? "?" + query : "");
        }
    }
}
