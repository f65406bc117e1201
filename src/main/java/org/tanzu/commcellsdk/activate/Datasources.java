package org.tanzu.commcellsdk.activate;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
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
 * Datacube datasources across every collection, keyed by datasource name.
 *
 * Each entry holds {@code id}, {@code type}, and when the server sends them
 * {@code coreId}, {@code computedCoreName}, {@code cloudId}, {@code description},
 * {@code totalCount} and {@code state}.
 */
public class Datasources extends NamedEntityCollection<Datasource> {

    public Datasources(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "Datacube";
    }

    @Override
    protected SdkException notFound(String name) {
        return new SdkException(module(), "102", "No datasource exists with the name: " + name);
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_ALL_DATASOURCES));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        Map<String, JsonNode> datasources = new LinkedHashMap<>();
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null) {
            return datasources;
        }
        if (!json.has("collections")) {
            if (json.has("error")) {
                throw new SdkException(module(), "104");
            }
            return datasources;
        }
        for (JsonNode collection : json.get("collections")) {
            for (JsonNode datasource : collection.path("datasources")) {
                if (!datasource.hasNonNull("datasourceName")) {
                    continue;
                }
                ObjectNode summary = commcell.objectMapper().createObjectNode();
                summary.put("id", datasource.path("datasourceId").asText());
                summary.put("type", datasource.path("datasourceType").asInt());
                copyIfPresent(collection, "computedCoreName", summary, "computedCoreName");
                copyIfPresent(collection, "cloudId", summary, "cloudId");
                copyIfPresent(datasource, "coreId", summary, "coreId");
                copyIfPresent(datasource, "description", summary, "description");
                JsonNode status = datasource.path("status");
                copyIfPresent(status, "totalcount", summary, "totalCount");
                copyIfPresent(status, "state", summary, "state");
                datasources.put(datasource.get("datasourceName").asText(), summary);
            }
        }
        return datasources;
    }

    private static void copyIfPresent(JsonNode from, String field, ObjectNode to, String target) {
        if (from.hasNonNull(field)) {
            to.set(target, from.get(field));
        }
    }

    @Override
    protected Datasource wrap(String name, JsonNode properties) {
        return new Datasource(commcell, name, properties);
    }
}
