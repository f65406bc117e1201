package org.tanzu.commcellsdk.replication;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;

/**
 * One BLR pair, read from the continuous monitor on first access.
 */
public class BlrPair {

    /** Replication states reported in {@code status} */
    public enum PairStatus {
        NOT_SYNCED, BACKING_UP, RESTORING, RESYNCING, REPLICATING, SUSPENDED, STOPPED, VERIFYING, PROBLEM,
        FAILED, STARTING, STOPPING, SUSPENDING, RESUMING, FAILING_OVER, FAILOVER_FAILED, FAILOVER_DONE,
        FAILING_BACK, FAILBACK_FAILED, SWITCHING_ROLES, SWITCH_ROLES_FAILED;

        /**
         * @return the state for the code, or null for a code this client does not know
         */
        public static PairStatus fromCode(int code) {
            PairStatus[] values = values();
            return code >= 0 && code < values.length ? values[code] : null;
        }
    }

    private final Commcell commcell;
    private final String pairId;

    private volatile JsonNode properties;

    public BlrPair(Commcell commcell, String pairId) {
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
                commcell.services().url(Endpoint.GET_BLR_PAIR, pairId));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.path("siteInfo").has(0)) {
            throw new SdkException("Response", "102");
        }
        this.properties = json.get("siteInfo").get(0);
    }

    public String getSourceName() {
        return properties().path("sourceName").asText(null);
    }

    public String getDestinationName() {
        return properties().path("destinationName").asText(null);
    }

    public String getSourceClientId() {
        return properties().path("srcClientId").asText(null);
    }

    public String getDestinationClientId() {
        return properties().path("destClientId").asText(null);
    }

    public PairStatus getStatus() {
        return PairStatus.fromCode(properties().path("status").asInt(-1));
    }

    /**
     * Replication lag in minutes.
     */
    public long getLagTime() {
        return properties().path("lagTime").asLong();
    }

    public String getReplicationGroupName() {
        return properties().path("replicationGroup").path("replicationGroupName").asText(null);
    }

    @Override
    public String toString() {
        return "BlrPair{id='" + pairId + "'}";
    }
}
