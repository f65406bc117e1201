package org.tanzu.commcellsdk.mcp;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;
import org.tanzu.commcellsdk.activate.CrawlJobState;
import org.tanzu.commcellsdk.activate.Datasource;
import org.tanzu.commcellsdk.activate.EdiscoveryClientOperations;
import org.tanzu.commcellsdk.clients.Client;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellConnector;
import org.tanzu.commcellsdk.commcell.SdkException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * MCP tools over the shared Commcell session.
 *
 * This service sits between the MCP server and the Commcell SDK. It turns the SDK's
 * entity maps into small info objects that serialize cleanly for MCP clients. All
 * tools are read-only. Create and delete operations stay in the Java API.
 *
 * The service provides these tools:
 * - getCommcellInfo(): CommServ name, host, version and timezone
 * - listClients(): every client with its id and host name
 * - listClientGroups(), listStoragePolicies(), listSchedulePolicies(), listUsers(): names and ids
 * - listBlrPairs(): block level replication pairs
 * - listDatasources(): Datacube datasources
 * - getCrawlJobStatus(): the crawl job state of one datasource on one client
 *
 * Each call opens the session through {@link CommcellConnector} when none is open yet.
 * SDK failures are logged and rethrown as RuntimeException with the tool's context.
 */
@Service
public class CommcellToolService {

    private static final Logger logger = LoggerFactory.getLogger(CommcellToolService.class);

    private final CommcellConnector connector;

    /**
     * @param connector holder of the shared Commcell session
     */
    public CommcellToolService(CommcellConnector connector) {
        this.connector = connector;
        logger.info("CommcellToolService initialized");
    }

    /**
     * MCP tool: describes the connected CommServ.
     *
     * The values come from the CommServ details read when the session was opened, so
     * this call only reaches the server when it has to open the session first.
     *
     * @return the CommServ name, host name, normalized version and timezone
     * @throws RuntimeException if the session cannot be opened
     */
    @Tool(description = "Get the CommServ name, version and timezone of the Commcell")
    public CommcellInfo getCommcellInfo() {
        logger.info("MCP tool called: getCommcellInfo()");
        try {
            Commcell commcell = connector.session();
            return new CommcellInfo(commcell.commservName(), commcell.commservHostname(),
                    commcell.version(), commcell.commservTimezone());
        } catch (SdkException e) {
            logger.error("Failed to read Commcell details: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to read Commcell details: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: lists every client registered on the Commcell.
     *
     * Client names are returned in lower case, the form the SDK uses as lookup key.
     *
     * @return one ClientInfo per client
     * @throws RuntimeException if the client list cannot be read
     */
    @Tool(description = "Get a list of all clients registered on the Commcell")
    public List<ClientInfo> listClients() {
        logger.info("MCP tool called: listClients()");
        try {
            List<ClientInfo> result = new ArrayList<>();
            for (Map.Entry<String, JsonNode> entry : connector.session().clients().all().entrySet()) {
                result.add(new ClientInfo(entry.getKey(), entry.getValue().path("id").asText(),
                        entry.getValue().path("hostname").asText(null)));
            }
            logger.info("Retrieved {} clients", result.size());
            return result;
        } catch (SdkException e) {
            logger.error("Failed to list clients: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list clients: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: lists client groups by name and id.
     */
    @Tool(description = "Get a list of all client groups on the Commcell")
    public List<EntityInfo> listClientGroups() {
        logger.info("MCP tool called: listClientGroups()");
        return entities("client groups", () -> connector.session().clientGroups().all());
    }

    /**
     * MCP tool: lists storage policies by name and id.
     */
    @Tool(description = "Get a list of all storage policies on the Commcell")
    public List<EntityInfo> listStoragePolicies() {
        logger.info("MCP tool called: listStoragePolicies()");
        return entities("storage policies", () -> connector.session().storagePolicies().all());
    }

    /**
     * MCP tool: lists schedule policies by task name and task id.
     */
    @Tool(description = "Get a list of all schedule policies on the Commcell")
    public List<EntityInfo> listSchedulePolicies() {
        logger.info("MCP tool called: listSchedulePolicies()");
        return entities("schedule policies", () -> connector.session().schedulePolicies().all());
    }

    /**
     * MCP tool: lists users by user name and id.
     *
     * Domain users appear under their domain-qualified name.
     */
    @Tool(description = "Get a list of all users on the Commcell")
    public List<EntityInfo> listUsers() {
        logger.info("MCP tool called: listUsers()");
        return entities("users", () -> connector.session().users().all());
    }

    /**
     * MCP tool: lists the block level replication pairs.
     *
     * Pairs come from the continuous replication monitor and are identified by pair id.
     * Source and destination are client names as the monitor reports them.
     *
     * @return one BlrPairInfo per pair
     * @throws RuntimeException if the replication monitor cannot be read
     */
    @Tool(description = "Get a list of all block level replication (BLR) pairs with their source and destination")
    public List<BlrPairInfo> listBlrPairs() {
        logger.info("MCP tool called: listBlrPairs()");
        try {
            List<BlrPairInfo> result = new ArrayList<>();
            for (Map.Entry<String, JsonNode> entry : connector.session().blrPairs().all().entrySet()) {
                JsonNode pair = entry.getValue();
                result.add(new BlrPairInfo(entry.getKey(), pair.path("sourceName").asText(null),
                        pair.path("destinationName").asText(null)));
            }
            logger.info("Retrieved {} BLR pairs", result.size());
            return result;
        } catch (SdkException e) {
            logger.error("Failed to list BLR pairs: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list BLR pairs: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: lists the Datacube datasources across all collections.
     *
     * Reading the datasources also builds the Datacube handle, which loads the
     * analytics engines in parallel. An engine failure does not fail this tool.
     *
     * @return one DatasourceInfo per datasource, with the numeric datasource type
     * @throws RuntimeException if the datasource list cannot be read
     */
    @Tool(description = "Get a list of all Datacube datasources")
    public List<DatasourceInfo> listDatasources() {
        logger.info("MCP tool called: listDatasources()");
        try {
            List<DatasourceInfo> result = new ArrayList<>();
            for (Map.Entry<String, JsonNode> entry : connector.session().datacube().datasources().all().entrySet()) {
                result.add(new DatasourceInfo(entry.getKey(), entry.getValue().path("id").asText(),
                        entry.getValue().path("type").asInt()));
            }
            logger.info("Retrieved {} datasources", result.size());
            return result;
        } catch (SdkException e) {
            logger.error("Failed to list datasources: {}", e.getMessage(), e);
            throw new RuntimeException("Failed to list datasources: " + e.getMessage(), e);
        }
    }

    /**
     * MCP tool: reads the crawl job state of a datasource on an eDiscovery client.
     *
     * The client is resolved by name or host name, and the datasource by name. The
     * job status is then read from the eDiscovery client jobs endpoint for that pair.
     *
     * @param clientName the client name or host name
     * @param datasourceName the datasource name
     * @return the raw state code and its name
     * @throws RuntimeException if the client or datasource is unknown, or the status cannot be read
     */
    @Tool(description = "Get the crawl job status of a datasource on an eDiscovery client. "
            + "Parameters: clientName (String) - the client name or host name, "
            + "datasourceName (String) - the datasource name")
    public CrawlStatusInfo getCrawlJobStatus(String clientName, String datasourceName) {
        logger.info("MCP tool called: getCrawlJobStatus({}, {})", clientName, datasourceName);
        try {
            Commcell commcell = connector.session();
            Client client = commcell.clients().get(clientName);
            Datasource datasource = commcell.datacube().datasources().get(datasourceName);
            EdiscoveryClientOperations operations = datasource.crawlOperations(client.getClientId());
            JsonNode status = operations.jobStatus();
            int code = status.path("state").asInt();
            return new CrawlStatusInfo(client.getClientName(), datasource.getDatasourceName(), code,
                    CrawlJobState.fromCode(code).name());
        } catch (SdkException e) {
            logger.error("Failed to read crawl job status for '{}' on '{}': {}",
                    datasourceName, clientName, e.getMessage(), e);
            throw new RuntimeException("Failed to read crawl job status: " + e.getMessage(), e);
        }
    }

    private List<EntityInfo> entities(String what, Supplier<Map<String, JsonNode>> lister) {
        try {
            List<EntityInfo> result = new ArrayList<>();
            lister.get().forEach((name, id) -> result.add(new EntityInfo(name, id.asText())));
            logger.info("Retrieved {} {}", result.size(), what);
            return result;
        } catch (SdkException e) {
            logger.error("Failed to list {}: {}", what, e.getMessage(), e);
            throw new RuntimeException("Failed to list " + what + ": " + e.getMessage(), e);
        }
    }

    public static class CommcellInfo {
        private final String commservName;
        private final String hostname;
        private final String version;
        private final String timezone;

        public CommcellInfo(String commservName, String hostname, String version, String timezone) {
            this.commservName = commservName;
            this.hostname = hostname;
            this.version = version;
            this.timezone = timezone;
        }

        public String getCommservName() { return commservName; }
        public String getHostname() { return hostname; }
        public String getVersion() { return version; }
        public String getTimezone() { return timezone; }

        @Override
        public String toString() {
            return "CommcellInfo{commservName='" + commservName + "', version='" + version + "'}";
        }
    }

    public static class ClientInfo {
        private final String name;
        private final String id;
        private final String hostname;

        public ClientInfo(String name, String id, String hostname) {
            this.name = name;
            this.id = id;
            this.hostname = hostname;
        }

        public String getName() { return name; }
        public String getId() { return id; }
        public String getHostname() { return hostname; }

        @Override
        public String toString() {
            return "ClientInfo{name='" + name + "', id='" + id + "', hostname='" + hostname + "'}";
        }
    }

    /**
     * Name and id of a listed entity.
     */
    public static class EntityInfo {
        private final String name;
        private final String id;

        public EntityInfo(String name, String id) {
            this.name = name;
            this.id = id;
        }

        public String getName() { return name; }
        public String getId() { return id; }

        @Override
        public String toString() {
            return "EntityInfo{name='" + name + "', id='" + id + "'}";
        }
    }

    public static class BlrPairInfo {
        private final String id;
        private final String sourceName;
        private final String destinationName;

        public BlrPairInfo(String id, String sourceName, String destinationName) {
            this.id = id;
            this.sourceName = sourceName;
            this.destinationName = destinationName;
        }

        public String getId() { return id; }
        public String getSourceName() { return sourceName; }
        public String getDestinationName() { return destinationName; }

        @Override
        public String toString() {
            return "BlrPairInfo{id='" + id + "', source='" + sourceName + "', destination='" + destinationName + "'}";
        }
    }

    public static class DatasourceInfo {
        private final String name;
        private final String id;
        private final int type;

        public DatasourceInfo(String name, String id, int type) {
            this.name = name;
            this.id = id;
            this.type = type;
        }

        public String getName() { return name; }
        public String getId() { return id; }
        public int getType() { return type; }

        @Override
        public String toString() {
            return "DatasourceInfo{name='" + name + "', id='" + id + "', type=" + type + "}";
        }
    }

    public static class CrawlStatusInfo {
        private final String clientName;
        private final String datasourceName;
        private final int state;
        private final String stateName;

        public CrawlStatusInfo(String clientName, String datasourceName, int state, String stateName) {
            this.clientName = clientName;
            this.datasourceName = datasourceName;
            this.state = state;
            this.stateName = stateName;
        }

        public String getClientName() { return clientName; }
        public String getDatasourceName() { return datasourceName; }
        public int getState() { return state; }
        public String getStateName() { return stateName; }

        @Override
        public String toString() {
            return "CrawlStatusInfo{datasource='" + datasourceName + "', state=" + stateName + "}";
        }
    }
}
