package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.xml.XmlMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClient;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.tanzu.commcellsdk.activate.Datacube;
import org.tanzu.commcellsdk.clientgroup.ClientGroups;
import org.tanzu.commcellsdk.clients.Clients;
import org.tanzu.commcellsdk.config.CommcellConfig;
import org.tanzu.commcellsdk.policies.SchedulePolicies;
import org.tanzu.commcellsdk.policies.StoragePolicies;
import org.tanzu.commcellsdk.replication.BlrPairs;
import org.tanzu.commcellsdk.replication.ReplicationPairs;
import org.tanzu.commcellsdk.security.UserGroups;
import org.tanzu.commcellsdk.security.Users;
import reactor.core.Exceptions;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * An authenticated session with one Commcell.
 *
 * Construction finds a reachable web service URL (https first, then http), authenticates
 * with a token or with username and password, and reads the CommServ details. Feature
 * clients such as {@link #clients()} are built lazily and cached for the life of the
 * session; {@link #refresh()} drops them and {@link #logout()} makes them unavailable.
 */
public class Commcell {

    private static final Logger logger = LoggerFactory.getLogger(Commcell.class);

    static final String WEB_SERVICE_PATH = "/webconsole/api/";

    private static final Pattern TIMEZONE_SUFFIX = Pattern.compile("\\(.*");
    private static final Pattern TIMEZONE_OFFSET_PREFIX = Pattern.compile("^([+|-]*\\d*:)*");
    private static final String[][] VERSION_REPLACEMENTS = {
            {".0 SP", "."}, {" SP", "."}, {" HPK", "."}, {"+", ""}, {"-", ""}, {"a", ".1"}, {"b", ".2"}
    };

    private final CommcellConfig config;
    private final ObjectMapper objectMapper;
    private final XmlMapper xmlMapper;
    private final ResponseClassifier classifier;
    private final CommcellTransport transport;
    private final ExecutorService initExecutor;
    private final FeatureHandles features = new FeatureHandles();
    private final Services services;
    private final Authentication authentication;
    private final String deviceId;

    private volatile String user;
    private volatile CommServDetails commServ;

    public Commcell(CommcellConfig config, WebClient webClient, ExecutorService initExecutor) {
        this.config = config;
        this.objectMapper = new ObjectMapper();
        this.xmlMapper = new XmlMapper();
        this.classifier = new ResponseClassifier(objectMapper);
        this.transport = new CommcellTransport(webClient, objectMapper, xmlMapper, config.getMaxLoginAttempts());
        this.initExecutor = initExecutor;
        this.deviceId = localDeviceId();

        if (!CommcellConfig.hasText(config.getHost())) {
            throw new SdkException("Commcell", "101", "No Commcell host configured");
        }

        this.services = new Services(discoverWebService());
        this.authentication = new Authentication(transport, services, classifier, objectMapper, xmlMapper, deviceId);
        authenticate();
        transport.setTokenRenewer(authentication::renewToken);
        this.commServ = fetchCommServDetails();
        logger.info("Connected to CommServ {} ({}) version {}", commServ.getName(), commServ.getHostname(),
                commServ.getVersion());
    }

    /**
     * Candidate web service URLs in the order they are tried.
     */
    List<String> candidateWebServices() {
        List<String> candidates = new ArrayList<>();
        candidates.add("https://" + config.getHost() + WEB_SERVICE_PATH);
        if (!config.isHttpsOnly()) {
            candidates.add("http://" + config.getHost() + WEB_SERVICE_PATH);
        }
        return candidates;
    }

    private String discoverWebService() {
        for (String candidate : candidateWebServices()) {
            try {
                CommcellResponse response = transport.exchange(HttpMethod.GET, candidate, null,
                        Collections.emptyMap(), config.getServiceCheckTimeout());
                if (response.isOk()) {
                    logger.info("Using Commcell web service {}", candidate);
                    return candidate;
                }
                logger.warn("Web service {} answered with status {}", candidate, response.getStatus());
            } catch (WebClientRequestException e) {
                if (config.isForceHttps()) {
                    throw e;
                }
                logger.warn("Web service {} is not reachable: {}", candidate, e.getMessage());
            } catch (RuntimeException e) {
                if (!(Exceptions.unwrap(e) instanceof TimeoutException)) {
                    throw e;
                }
                if (config.isForceHttps()) {
                    throw e;
                }
                logger.warn("Web service {} timed out after {}", candidate, config.getServiceCheckTimeout());
            }
        }
        throw new SdkException("Commcell", "101");
    }

    /**
     * Validates the configured token first. A token the server rejects is dropped, and the
     * username and password are tried when both are set.
     */
    private void authenticate() {
        boolean hasCredentials = CommcellConfig.hasText(config.getUsername())
                && CommcellConfig.hasText(config.getPassword());
        SdkException tokenError = null;
        if (CommcellConfig.hasText(config.getAuthtoken())) {
            transport.setToken(Authentication.normalizeToken(config.getAuthtoken()));
            try {
                this.user = authentication.whoAmI();
                logger.info("Authenticated with token as {}", user);
                return;
            } catch (SdkException e) {
                transport.setToken(null);
                if (!hasCredentials) {
                    throw e;
                }
                logger.warn("Configured token was rejected, logging in as {}: {}", config.getUsername(),
                        e.getMessage());
                tokenError = e;
            }
        }
        if (hasCredentials) {
            this.user = authentication.login(config.getUsername(), config.getPassword()).getUserName();
        }
        if (transport.getToken() == null) {
            throw tokenError != null ? tokenError : new SdkException("Commcell", "102");
        }
    }

    private void requireOpen() {
        if (features.isClosed()) {
            throw new SdkException("CVPySDK", "104");
        }
    }

    private CommServDetails fetchCommServDetails() {
        CommcellResponse response = transport.makeRequest(HttpMethod.GET, services.url(Endpoint.COMMSERV));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = classifier.parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        JsonNode commcell = json.path("commcell");
        if (!commcell.hasNonNull("commCellName")) {
            throw new SdkException("Commcell", "103", "Key does not exist: commcell.commCellName");
        }
        String versionInfo = json.hasNonNull("csVersionInfo") ? normalizeVersion(json.get("csVersionInfo").asText()) : null;
        String timezone = json.hasNonNull("timeZone") ? normalizeTimezone(json.get("timeZone").asText()) : null;
        return new CommServDetails(
                commcell.path("commCellName").asText(),
                json.path("hostName").asText(null),
                commcell.path("csGUID").asText(null),
                json.path("csTimeZone").path("TimeZoneName").asText(null),
                timezone,
                json.path("currentSPVersion").asText(null),
                versionInfo,
                commcell.path("commCellId").asText(null));
    }

    /**
     * Converts the server version string to {@code major.servicepack.hotfix} form.
     */
    public static String normalizeVersion(String versionInfo) {
        String version = versionInfo;
        for (String[] replacement : VERSION_REPLACEMENTS) {
            version = version.replace(replacement[0], replacement[1]);
        }
        while (version.split("\\.").length < 3) {
            version = version + ".0";
        }
        return version;
    }

    /**
     * Keeps the parenthesised zone description, or strips a leading offset.
     */
    public static String normalizeTimezone(String timezone) {
        Matcher matcher = TIMEZONE_SUFFIX.matcher(timezone);
        if (matcher.find()) {
            return matcher.group();
        }
        return TIMEZONE_OFFSET_PREFIX.matcher(timezone).replaceFirst("");
    }

    private static String localDeviceId() {
        try {
            return InetAddress.getLocalHost().getCanonicalHostName();
        } catch (UnknownHostException e) {
            logger.warn("Could not resolve local host name, using 'localhost' as device id: {}", e.getMessage());
            return "localhost";
        }
    }

    // Feature clients

    public Clients clients() {
        return features.get(Clients.class, () -> new Clients(this));
    }

    public ClientGroups clientGroups() {
        return features.get(ClientGroups.class, () -> new ClientGroups(this));
    }

    public StoragePolicies storagePolicies() {
        return features.get(StoragePolicies.class, () -> new StoragePolicies(this));
    }

    public SchedulePolicies schedulePolicies() {
        return features.get(SchedulePolicies.class, () -> new SchedulePolicies(this));
    }

    public Users users() {
        return features.get(Users.class, () -> new Users(this));
    }

    public UserGroups userGroups() {
        return features.get(UserGroups.class, () -> new UserGroups(this));
    }

    public ReplicationPairs replicationPairs() {
        return features.get(ReplicationPairs.class, () -> new ReplicationPairs(this));
    }

    public BlrPairs blrPairs() {
        return features.get(BlrPairs.class, () -> new BlrPairs(this));
    }

    public Datacube datacube() {
        return features.get(Datacube.class, () -> new Datacube(this));
    }

    /**
     * Drops every cached feature client and re-reads the CommServ details.
     */
    public void refresh() {
        requireOpen();
        features.clear();
        this.commServ = fetchCommServDetails();
        logger.info("Commcell {} refreshed", commServ.getName());
    }

    /**
     * Logs out and makes every feature client unavailable for this session.
     *
     * @return the server message, or the reason logout was not performed
     */
    public String logout() {
        if (features.isClosed() || transport.getToken() == null) {
            features.close();
            return "User already logged out.";
        }
        String output = authentication.logout();
        features.close();
        return output;
    }

    public boolean isLoggedOut() {
        return features.isClosed();
    }

    /**
     * Runs a qoperation command and returns its JSON result, or {@code {"output": text}}
     * when the server does not answer with JSON.
     *
     * @throws SdkException CVPySDK/104 after logout
     */
    public JsonNode qoperationExecute(Object request) {
        requireOpen();
        CommcellResponse response = transport.makeRequest(HttpMethod.POST, services.url(Endpoint.EXECUTE_QCOMMAND), request);
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = classifier.parse(response.getBody());
        if (json != null) {
            return json;
        }
        ObjectNode output = objectMapper.createObjectNode();
        output.put("output", response.getBody());
        return output;
    }

    /**
     * Sends an email through the CommServ mail server.
     *
     * @throws SdkException Commcell/104 when the server reports an error
     */
    public void sendMail(List<String> receivers, String subject, String body, boolean copySender, boolean isHtml) {
        requireOpen();
        ObjectNode emailInfo = objectMapper.createObjectNode();
        emailInfo.put("subject", subject);
        emailInfo.put("body", body == null ? "" : body);
        emailInfo.put("copySender", copySender);
        emailInfo.put("emailFormat", isHtml ? "HTML" : "TEXT");
        ArrayNode toEmail = emailInfo.putArray("toEmail");
        for (String receiver : receivers) {
            toEmail.addObject().put("emailAddress", receiver);
        }
        ObjectNode request = objectMapper.createObjectNode();
        request.set("emailInfo", emailInfo);

        String xml;
        try {
            xml = xmlMapper.writer().withRootName("App_SendEmailReq").writeValueAsString(request);
        } catch (JsonProcessingException e) {
            throw new SdkException("Commcell", "104", e.getOriginalMessage(), e);
        }

        JsonNode result = qoperationExecute(xml);
        if (ResponseClassifier.hasErrorCode(result)) {
            throw new SdkException("Commcell", "104", "Error: \"" + ResponseClassifier.errorMessage(result) + "\"");
        }
        logger.info("Mail '{}' sent to {} receivers", subject, receivers.size());
    }

    /**
     * Sends a request to any endpoint relative to the web service URL.
     */
    public CommcellResponse request(HttpMethod method, String relativePath, Object body) {
        requireOpen();
        return transport.makeRequest(method, services.resolve(relativePath), body);
    }

    // Accessors used by feature clients

    public CommcellTransport transport() {
        return transport;
    }

    public Services services() {
        return services;
    }

    public ResponseClassifier classifier() {
        return classifier;
    }

    public ObjectMapper objectMapper() {
        return objectMapper;
    }

    public XmlMapper xmlMapper() {
        return xmlMapper;
    }

    public CommcellConfig config() {
        return config;
    }

    public ExecutorService initExecutor() {
        return initExecutor;
    }

    // CommServ details

    public CommServDetails commServDetails() {
        return commServ;
    }

    public String commservName() {
        return commServ.getName();
    }

    public String commservHostname() {
        return commServ.getHostname();
    }

    public String commservGuid() {
        return commServ.getGuid();
    }

    public String commservTimezone() {
        return commServ.getTimezone();
    }

    public String commservTimezoneName() {
        return commServ.getTimezoneName();
    }

    public String commservVersion() {
        return commServ.getServicePack();
    }

    public String version() {
        return commServ.getVersion();
    }

    public String commcellId() {
        return commServ.getCommcellId();
    }

    public String commcellUsername() {
        return user;
    }

    public String webserviceBaseUrl() {
        return services.webServiceUrl();
    }

    public String authToken() {
        return transport.getToken();
    }

    public String deviceId() {
        return deviceId;
    }

    @Override
    public String toString() {
        return "Commcell{commserv='" + commServ.getName() + "', webService='" + services.webServiceUrl() + "'}";
    }

    /**
     * CommServ properties read at connect and refresh time.
     */
    public static class CommServDetails {
        private final String name;
        private final String hostname;
        private final String guid;
        private final String timezoneName;
        private final String timezone;
        private final String servicePack;
        private final String version;
        private final String commcellId;

        public CommServDetails(String name, String hostname, String guid, String timezoneName, String timezone,
                               String servicePack, String version, String commcellId) {
            this.name = name;
            this.hostname = hostname;
            this.guid = guid;
            this.timezoneName = timezoneName;
            this.timezone = timezone;
            this.servicePack = servicePack;
            this.version = version;
            this.commcellId = commcellId;
        }

        public String getName() { return name; }
        public String getHostname() { return hostname; }
        public String getGuid() { return guid; }
        public String getTimezoneName() { return timezoneName; }
        public String getTimezone() { return timezone; }
        public String getServicePack() { return servicePack; }
        public String getVersion() { return version; }
        public String getCommcellId() { return commcellId; }

        @Override
        public String toString() {
            return "CommServDetails{name='" + name + "', hostname='" + hostname + "', version='" + version +
                    "', timezone='" + timezone + "'}";
        }
    }
}
