package org.tanzu.commcellsdk.replication;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;

/**
 * One live sync VM pair. Properties are the first {@code siteInfo} entry for the pair id.
 */
public class ReplicationPair {

    private final Commcell commcell;
    private final String pairId;

    private volatile JsonNode properties;

    public ReplicationPair(Commcell commcell, String pairId) {
        this.commcell = commcell;
        this.pairId = pairId;
    }

    public String getPairId() {
        return pairId;
    }

    public JsonNode properties() {
        if (properties == null) {
            refresh();
        }
        return properties;
    }

    public void refresh() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_REPLICATION_PAIR, pairId));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.path("siteInfo").has(0)) {
            throw new SdkException("ReplicationPairs", "103", "No replication pair with id: " + pairId);
        }
        this.properties = json.get("siteInfo").get(0);
    }

    public String getSourceVm() {
        return properties().path("sourceName").asText(null);
    }

    public String getDestinationVm() {
        return properties().path("destinationName").asText(null);
    }

    public String getReplicationGuid() {
        return properties().path("replicationGuid").asText(null);
    }

    public int getStatus() {
        return properties().path("status").asInt();
    }

    public String getDestinationClient() {
        return properties().path("destinationInstance").path("clientName").asText(null);
    }

    public String getDestinationProxy() {
        return properties().path("destProxy").path("clientName").asText(null);
    }

    public String getLastSyncedBackupJob() {
        return properties().path("lastSyncedBkpJob").asText(null);
    }

    @Override
    public String toString() {
        if (properties != null && getSourceVm() != null && getDestinationVm() != null) {
            return "Replication pair: " + getSourceVm() + " -> " + getDestinationVm();
        }
        return "Replication pair ID: " + pairId;
    }
}
