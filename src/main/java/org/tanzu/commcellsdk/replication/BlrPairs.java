package org.tanzu.commcellsdk.replication;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.clients.Client;
import org.tanzu.commcellsdk.clients.Clients;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Block level replication pairs from the continuous replication monitor.
 *
 * Pairs are listed by pair id and looked up by source and destination name.
 */
public class BlrPairs extends NamedEntityCollection<BlrPair> {

    private static final Logger logger = LoggerFactory.getLogger(BlrPairs.class);

    /** Endpoint type of a file system pair */
    static final int END_POINT_FILESYSTEM = 2;

    public BlrPairs(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "BLRPairs";
    }

    @Override
    protected SdkException notFound(String name) {
        return new SdkException(module(), "102", "No BLR pair exists with id: " + name);
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_BLR_PAIRS));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        Map<String, JsonNode> pairs = new LinkedHashMap<>();
        for (JsonNode pair : json.path("siteInfo")) {
            if (pair.hasNonNull("id")) {
                pairs.put(pair.get("id").asText(), pair);
            }
        }
        return pairs;
    }

    @Override
    protected BlrPair wrap(String name, JsonNode properties) {
        return new BlrPair(commcell, name);
    }

    public boolean has(String sourceName, String destinationName) {
        return findId(sourceName, destinationName) != null;
    }

    /**
     * @throws SdkException BLRPairs/102 when no pair joins the two names
     */
    public BlrPair get(String sourceName, String destinationName) {
        String pairId = findId(sourceName, destinationName);
        if (pairId == null) {
            throw missingPair(sourceName, destinationName);
        }
        return new BlrPair(commcell, pairId);
    }

    /**
     * Deletes the pair between the two names.
     *
     * @throws SdkException BLRPairs/102 when there is no such pair or the server refuses
     */
    public void delete(String sourceName, String destinationName) {
        String pairId = findId(sourceName, destinationName);
        if (pairId == null) {
            throw missingPair(sourceName, destinationName);
        }
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.DELETE,
                commcell.services().url(Endpoint.DELETE_BLR_PAIR, pairId));
        if (!response.isOk()) {
            throw new SdkException("Response", "102");
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json != null && json.has("error")) {
            throw new SdkException(module(), "102", "Failed to delete Source: " + sourceName + " and Destination: "
                    + destinationName + " \nError: \"" + json.get("error").path("errorMessage").asText() + "\"");
        }
        logger.info("Deleted BLR pair {} -> {}", sourceName, destinationName);
        refresh();
    }

    /**
     * Creates a file system BLR pair. The source and destination clients must exist.
     */
    public void create(BlrPairSpec spec) {
        Clients clients = commcell.clients();
        Client source = clients.get(spec.getSourceClient());
        Client destination = clients.get(spec.getDestinationClient());

        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.CREATE_BLR_PAIR), buildCreateRequest(spec, source, destination));
        if (!response.isOk()) {
            throw new SdkException("Response", "101");
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        if (ResponseClassifier.hasErrorCode(json)) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        logger.info("Created BLR pair {} -> {}", source.getClientName(), destination.getClientName());
        refresh();
    }

    ObjectNode buildCreateRequest(BlrPairSpec spec, Client source, Client destination) {
        ObjectNode request = commcell.objectMapper().createObjectNode();
        request.put("destEndPointType", END_POINT_FILESYSTEM);
        request.put("blrRecoveryOpts", recoveryOptionsXml(spec));
        request.put("srcEndPointType", END_POINT_FILESYSTEM);
        ArrayNode volumeMap = request.putArray("srcDestVolumeMap");
        for (BlrPairSpec.VolumeMapping volume : spec.getVolumes()) {
            ObjectNode entry = volumeMap.addObject();
            entry.put("sourceVolumeGUID", volume.getSourceVolumeGuid());
            entry.put("sourceVolume", volume.getSourceVolume());
            entry.put("destVolumeGUID", volume.getDestinationVolumeGuid());
            entry.put("destVolume", volume.getDestinationVolume());
            entry.put("sourceVolumeSize", volume.getSourceVolumeSize());
            entry.put("disabled", "");
        }
        request.putObject("destEntity").set("client", clientEntity(destination));
        request.putObject("sourceEntity").set("client", clientEntity(source));
        return request;
    }

    String recoveryOptionsXml(BlrPairSpec spec) {
        try {
            return commcell.xmlMapper().writeValueAsString(new BlrRecoveryOptions(spec));
        } catch (JsonProcessingException e) {
            throw new SdkException(module(), "101", e.getOriginalMessage(), e);
        }
    }

    private ObjectNode clientEntity(Client client) {
        ObjectNode entity = commcell.objectMapper().createObjectNode();
        entity.put("clientId", Integer.parseInt(client.getClientId()));
        entity.put("clientName", client.getClientName());
        entity.put("hasDrivesInPair", true);
        entity.put("tabLevel", "level-0");
        entity.put("checked", true);
        return entity;
    }

    private String findId(String sourceName, String destinationName) {
        if (sourceName == null || destinationName == null) {
            throw new SdkException(module(), "101");
        }
        for (Map.Entry<String, JsonNode> pair : all().entrySet()) {
            JsonNode row = pair.getValue();
            if (sourceName.equalsIgnoreCase(row.path("sourceName").asText(""))
                    && destinationName.equalsIgnoreCase(row.path("destinationName").asText(""))) {
                return pair.getKey();
            }
        }
        return null;
    }

    private SdkException missingPair(String sourceName, String destinationName) {
        return new SdkException(module(), "102", "No BLR pair exists with source: \"" + sourceName
                + "\" and destination: \"" + destinationName + "\"");
    }
}
