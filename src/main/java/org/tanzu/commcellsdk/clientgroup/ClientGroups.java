package org.tanzu.commcellsdk.clientgroup;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.clients.Clients;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseOutcome;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.Mutator;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Client groups on the Commcell, keyed by group name.
 */
public class ClientGroups extends NamedEntityCollection<ClientGroup> implements Mutator<ClientGroup, ClientGroupSpec> {

    private static final Logger logger = LoggerFactory.getLogger(ClientGroups.class);

    /** Activity types sent with a new group's activity control options */
    static final int ACTIVITY_BACKUP = 1;
    static final int ACTIVITY_RESTORE = 2;
    static final int ACTIVITY_DATA_AGING = 16;

    public ClientGroups(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "ClientGroup";
    }

    @Override
    protected String entityLabel() {
        return "ClientGroup";
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        JsonNode json = getJson(commcell.services().url(Endpoint.CLIENTGROUPS), module(), "102");
        Map<String, JsonNode> groups = new LinkedHashMap<>();
        for (JsonNode group : json.path("groups")) {
            if (group.hasNonNull("name")) {
                groups.put(group.get("name").asText(), group.path("Id"));
            }
        }
        return groups;
    }

    @Override
    protected ClientGroup wrap(String name, JsonNode properties) {
        return new ClientGroup(commcell, name, properties.asText());
    }

    /**
     * Creates a client group. Only clients that exist on the Commcell are associated.
     *
     * @throws SdkException ClientGroup/102 when the group exists or the server refuses it
     */
    @Override
    public ClientGroup add(ClientGroupSpec spec) {
        requireName(spec.getName());
        if (has(spec.getName())) {
            throw new SdkException(module(), "102", "Client Group \"" + spec.getName() + "\" already exists.");
        }

        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.CLIENTGROUPS), buildAddRequest(spec));
        ResponseOutcome outcome = commcell.classifier().classify(response);
        if (outcome.kind() == ResponseOutcome.Kind.API_ERROR) {
            throw failedToCreate(((ResponseOutcome.ApiError) outcome).getMessage());
        }
        JsonNode json = outcome.orThrow(module(), "102");
        if (json.hasNonNull("errorMessage")) {
            throw failedToCreate(json.get("errorMessage").asText());
        }
        JsonNode groupId = json.path("clientGroupDetail").path("clientGroup").path("clientGroupId");
        if (groupId.isMissingNode()) {
            throw new SdkException(module(), "102", "Failed to create new ClientGroup");
        }
        logger.info("Created client group {} ({})", spec.getName(), groupId.asText());
        refresh();
        return new ClientGroup(commcell, normalize(spec.getName()), groupId.asText());
    }

    private SdkException failedToCreate(String message) {
        return new SdkException(module(), "102", "Failed to create new ClientGroup\nError:\"" + message + "\"");
    }

    ObjectNode buildAddRequest(ClientGroupSpec spec) {
        ObjectNode request = commcell.objectMapper().createObjectNode();
        request.put("clientGroupOperationType", 1);
        ObjectNode detail = request.putObject("clientGroupDetail");
        detail.put("description", spec.getDescription());
        detail.put("isSmartClientGroup", spec.isSmart());
        if (spec.isSmart()) {
            detail.set("scgRule", spec.getScgRule());
        } else {
            detail.putObject("scgRule");
        }
        detail.putObject("clientGroup").put("clientGroupName", spec.getName());
        ArrayNode associated = detail.putArray("associatedClients");
        for (String client : validClients(spec.getClients())) {
            associated.addObject().put("clientName", client);
        }
        if (spec.hasActivityControl()) {
            ArrayNode options = detail.putObject("clientGroupActivityControl").putArray("activityControlOptions");
            addActivity(options, ACTIVITY_BACKUP, spec.getEnableBackup());
            addActivity(options, ACTIVITY_DATA_AGING, spec.getEnableDataAging());
            addActivity(options, ACTIVITY_RESTORE, spec.getEnableRestore());
        }
        return request;
    }

    private static void addActivity(ArrayNode options, int activityType, Boolean enabled) {
        ObjectNode option = options.addObject();
        option.put("activityType", activityType);
        option.put("enableAfterADelay", false);
        option.put("enableActivityType", enabled == null || enabled);
    }

    /**
     * Names from the input that match an existing client, lower-cased, without blanks.
     */
    List<String> validClients(List<String> clientNames) {
        List<String> valid = new ArrayList<>();
        if (clientNames.isEmpty()) {
            return valid;
        }
        Clients clients = commcell.clients();
        for (String clientName : clientNames) {
            String trimmed = clientName.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            if (clients.has(trimmed)) {
                valid.add(normalize(trimmed));
            } else {
                logger.warn("Client {} does not exist on the Commcell and is skipped", trimmed);
            }
        }
        return valid;
    }

    /**
     * Deletes a client group.
     *
     * @throws SdkException ClientGroup/102 when no group has that name or the server refuses
     */
    @Override
    public void delete(String name) {
        ClientGroup group = get(name);
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.DELETE,
                commcell.services().url(Endpoint.CLIENTGROUP, group.getClientGroupId()));
        ResponseOutcome outcome = commcell.classifier().classify(response);
        if (outcome.kind() == ResponseOutcome.Kind.API_ERROR) {
            String message = ((ResponseOutcome.ApiError) outcome).getMessage();
            throw new SdkException(module(), "102", "Failed to delete ClientGroup\nError: \"" + message + "\"");
        }
        outcome.orThrow(module(), "102");
        logger.info("Deleted client group {}", name);
        refresh();
    }
}
