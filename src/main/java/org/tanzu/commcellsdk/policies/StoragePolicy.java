package org.tanzu.commcellsdk.policies;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.Endpoint;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

public class StoragePolicy {

    private final Commcell commcell;
    private final String storagePolicyName;
    private final String storagePolicyId;

    private volatile JsonNode properties;

    public StoragePolicy(Commcell commcell, String storagePolicyName, String storagePolicyId) {
        this.commcell = commcell;
        this.storagePolicyName = storagePolicyName;
        this.storagePolicyId = storagePolicyId;
    }

    public String getStoragePolicyName() { return storagePolicyName; }
    public String getStoragePolicyId() { return storagePolicyId; }

    public JsonNode properties() {
        if (properties == null) {
            refresh();
        }
        return properties;
    }

    public void refresh() {
        JsonNode json = commcell.classifier()
                .classify(commcell.transport().makeRequest(HttpMethod.GET,
                        commcell.services().url(Endpoint.STORAGE_POLICY, storagePolicyId)))
                .orThrow("Storage", "102");
        this.properties = json;
    }

    /**
     * Copies of this policy keyed by lower-cased copy name, with copy id and precedence.
     */
    public Map<String, JsonNode> copies() {
        Map<String, JsonNode> copies = new LinkedHashMap<>();
        for (JsonNode copy : properties().path("copy")) {
            String copyName = copy.path("StoragePolicyCopy").path("copyName").asText(null);
            if (copyName != null) {
                copies.put(copyName.toLowerCase(Locale.ROOT), copy);
            }
        }
        return copies;
    }

    public boolean hasCopy(String copyName) {
        return copies().containsKey(copyName.toLowerCase(Locale.ROOT));
    }

    @Override
    public String toString() {
        return "StoragePolicy{name='" + storagePolicyName + "', id='" + storagePolicyId + "'}";
    }
}
