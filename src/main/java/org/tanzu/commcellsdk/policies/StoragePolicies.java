package org.tanzu.commcellsdk.policies;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
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
 * Storage policies on the Commcell, keyed by policy name with the policy id as value.
 */
public class StoragePolicies extends NamedEntityCollection<StoragePolicy> {

    private static final Logger logger = LoggerFactory.getLogger(StoragePolicies.class);

    public StoragePolicies(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "Storage";
    }

    @Override
    protected String entityLabel() {
        return "policy";
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_ALL_STORAGE_POLICIES));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        Map<String, JsonNode> policies = new LinkedHashMap<>();
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null) {
            return policies;
        }
        for (JsonNode policy : json.path("policies")) {
            if (policy.hasNonNull("storagePolicyName")) {
                policies.put(policy.get("storagePolicyName").asText(),
                        TextNode.valueOf(policy.path("storagePolicyId").asText()));
            }
        }
        return policies;
    }

    @Override
    protected StoragePolicy wrap(String name, JsonNode properties) {
        return new StoragePolicy(commcell, name, properties.asText());
    }

    /**
     * Deletes a storage policy.
     *
     * @throws SdkException Storage/102 when no policy has that name or the server refuses
     */
    public void delete(String name) {
        StoragePolicy policy = get(name);
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.DELETE,
                commcell.services().url(Endpoint.DELETE_STORAGE_POLICY, policy.getStoragePolicyId()));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        if (response.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        JsonNode error = json == null ? null : json.get("error");
        if (error != null && ResponseClassifier.hasErrorCode(error)) {
            throw new SdkException(module(), "102",
                    "Failed to delete storage policy\nError: \"" + error.path("errorMessage").asText() + "\"");
        }
        if (json == null && response.getBody().contains("errorCode") && response.getBody().contains("errorMessage")) {
            throw new SdkException(module(), "102", response.getBody().trim());
        }
        logger.info("Deleted storage policy {}", name);
        refresh();
    }
}
