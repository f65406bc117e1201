package org.tanzu.commcellsdk.activate;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;

/**
 * One datasource, with the summary properties from the datasource list.
 */
public class Datasource {

    private final Commcell commcell;
    private final String datasourceName;
    private final JsonNode properties;

    public Datasource(Commcell commcell, String datasourceName, JsonNode properties) {
        this.commcell = commcell;
        this.datasourceName = datasourceName;
        this.properties = properties;
    }

    public String getDatasourceName() { return datasourceName; }
    public String getDatasourceId() { return properties.path("id").asText(); }
    public int getDatasourceType() { return properties.path("type").asInt(); }
    public String getComputedCoreName() { return properties.path("computedCoreName").asText(null); }
    public String getCloudId() { return properties.path("cloudId").asText(null); }
    public JsonNode properties() { return properties; }

    /**
     * Starts a crawl job on the datasource.
     *
     * @return the job id
     */
    public String startJob() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.START_JOB_DATASOURCE, getDatasourceId()));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", response.getBody());
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json != null && json.has("error")) {
            throw new SdkException("Datacube", "102", "Failed to start job on datasource\nError: \""
                    + json.get("error").path("errLogMessage").asText() + "\"");
        }
        if (json == null || !json.has("status")) {
            throw new SdkException("Datacube", "102", "Status object not found in response");
        }
        return json.get("status").path("jobId").asText();
    }

    /**
     * Crawl history entries of the datasource.
     */
    public JsonNode crawlHistory() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_CRAWL_HISTORY, getDatasourceId()));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        return json.path("status");
    }

    /**
     * Crawl job operations for this datasource on the given client.
     */
    public EdiscoveryClientOperations crawlOperations(String clientId) {
        return new EdiscoveryClientOperations(commcell, clientId, getDatasourceId());
    }

    @Override
    public String toString() {
        return "Datasource{name='" + datasourceName + "', id='" + getDatasourceId() + "'}";
    }
}
