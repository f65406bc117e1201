package org.tanzu.commcellsdk.clientgroup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseOutcome;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One client group and its associated clients.
 */
public class ClientGroup {

    private static final Logger logger = LoggerFactory.getLogger(ClientGroup.class);

    /** Values of {@code associatedClientsOperationType} */
    public enum ClientsOperation {
        NONE(0), OVERWRITE(1), ADD(2), DELETE(3), CLEAR(4);

        private final int code;

        ClientsOperation(int code) {
            this.code = code;
        }

        public int getCode() {
            return code;
        }
    }

    private final Commcell commcell;
    private final String clientGroupName;
    private final String clientGroupId;

    private volatile JsonNode properties;

    public ClientGroup(Commcell commcell, String clientGroupName, String clientGroupId) {
        this.commcell = commcell;
        this.clientGroupName = clientGroupName;
        this.clientGroupId = clientGroupId;
    }

    public String getClientGroupName() { return clientGroupName; }
    public String getClientGroupId() { return clientGroupId; }

    /**
     * The {@code clientGroupDetail} node from {@code ClientGroup/{id}}.
     */
    public JsonNode properties() {
        if (properties == null) {
            refresh();
        }
        return properties;
    }

    public void refresh() {
        JsonNode json = commcell.classifier()
                .classify(commcell.transport().makeRequest(HttpMethod.GET,
                        commcell.services().url(Endpoint.CLIENTGROUP, clientGroupId)))
                .orThrow("ClientGroup", "102");
        if (!json.has("clientGroupDetail")) {
            throw new SdkException("Response", "102");
        }
        this.properties = json.get("clientGroupDetail");
    }

    public String getDescription() {
        return properties().path("description").asText("");
    }

    public boolean isSmartClientGroup() {
        return properties().path("isSmartClientGroup").asBoolean(false);
    }

    /**
     * Lower-cased names of the clients in the group.
     */
    public List<String> getAssociatedClients() {
        List<String> clients = new ArrayList<>();
        for (JsonNode client : properties().path("associatedClients")) {
            clients.add(NamedEntityCollection.normalize(client.path("clientName").asText()));
        }
        return Collections.unmodifiableList(clients);
    }

    public boolean isBackupEnabled() {
        return isActivityEnabled(ClientGroups.ACTIVITY_BACKUP);
    }

    public boolean isRestoreEnabled() {
        return isActivityEnabled(ClientGroups.ACTIVITY_RESTORE);
    }

    public boolean isDataAgingEnabled() {
        return isActivityEnabled(ClientGroups.ACTIVITY_DATA_AGING);
    }

    private boolean isActivityEnabled(int activityType) {
        for (JsonNode option : properties().path("clientGroupActivityControl").path("activityControlOptions")) {
            if (option.path("activityType").asInt() == activityType) {
                return option.path("enableActivityType").asBoolean(true);
            }
        }
        return true;
    }

    /**
     * Adds clients that exist on the Commcell and are not yet in the group.
     *
     * @throws SdkException ClientGroup/102 when no client is left to add or the update fails
     */
    public void addClients(List<String> clientNames) {
        List<String> valid = new ArrayList<>(commcell.clientGroups().validClients(clientNames));
        valid.removeAll(getAssociatedClients());
        update(valid, ClientsOperation.ADD, "Failed to add clients to the ClientGroup");
    }

    /**
     * Removes clients from the group.
     */
    public void removeClients(List<String> clientNames) {
        List<String> valid = commcell.clientGroups().validClients(clientNames);
        update(valid, ClientsOperation.DELETE, "Failed to remove clients from the ClientGroup");
    }

    private void update(List<String> clients, ClientsOperation operation, String failure) {
        if (clients.isEmpty()) {
            throw new SdkException("ClientGroup", "102", "No valid clients were found");
        }
        ObjectNode request = commcell.objectMapper().createObjectNode();
        request.put("clientGroupOperationType", 2);
        ObjectNode detail = request.putObject("clientGroupDetail");
        detail.put("description", getDescription());
        detail.putObject("clientGroup").put("newName", clientGroupName);
        detail.put("associatedClientsOperationType", operation.getCode());
        ArrayNode associated = detail.putArray("associatedClients");
        for (String client : clients) {
            associated.addObject().put("clientName", client);
        }

        ResponseOutcome outcome = commcell.classifier().classify(commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.CLIENTGROUP, clientGroupId), request));
        this.properties = null;
        if (outcome.kind() == ResponseOutcome.Kind.API_ERROR) {
            throw new SdkException("ClientGroup", "102",
                    failure + "\nError: \"" + ((ResponseOutcome.ApiError) outcome).getMessage() + "\"");
        }
        outcome.orThrow("ClientGroup", "102");
        logger.info("Client group {}: {} {} clients", clientGroupName, operation, clients.size());
    }

    @Override
    public String toString() {
        return "ClientGroup{name='" + clientGroupName + "', id='" + clientGroupId + "'}";
    }
}
