package org.tanzu.commcellsdk.replication;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Live sync replication pairs from the streaming replication monitor, keyed by pair id.
 */
public class ReplicationPairs extends NamedEntityCollection<ReplicationPair> {

    public ReplicationPairs(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "ReplicationPairs";
    }

    @Override
    protected SdkException notFound(String name) {
        return new SdkException(module(), "103", "No replication pair with id: " + name);
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_REPLICATION_PAIRS));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.path("siteInfo").isArray()) {
            throw new SdkException(module(), "102");
        }
        Map<String, JsonNode> pairs = new LinkedHashMap<>();
        for (JsonNode pair : json.get("siteInfo")) {
            if (pair.hasNonNull("id")) {
                pairs.put(pair.get("id").asText(), pair);
            }
        }
        return pairs;
    }

    @Override
    protected ReplicationPair wrap(String name, JsonNode properties) {
        return new ReplicationPair(commcell, name);
    }
}
