package org.tanzu.commcellsdk.clients;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.SdkException;

/**
 * One client. Detailed properties are read on first access.
 */
public class Client {

    private final Commcell commcell;
    private final String clientName;
    private final String clientId;
    private final String hostname;

    private volatile JsonNode properties;

    public Client(Commcell commcell, String clientName, String clientId, String hostname) {
        this.commcell = commcell;
        this.clientName = clientName;
        this.clientId = clientId;
        this.hostname = hostname;
    }

    public String getClientName() { return clientName; }
    public String getClientId() { return clientId; }
    public String getHostname() { return hostname; }

    /**
     * The {@code clientProperties} entry from {@code Client/{id}}.
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
                        commcell.services().url(Endpoint.CLIENT, clientId)))
                .orThrow("Client", "102");
        JsonNode clientProperties = json.path("clientProperties").path(0);
        if (clientProperties.isMissingNode()) {
            throw new SdkException("Response", "102", "Client properties missing for " + clientName);
        }
        this.properties = clientProperties;
    }

    public String getDisplayName() {
        return properties().path("client").path("displayName").asText(clientName);
    }

    @Override
    public String toString() {
        return "Client{name='" + clientName + "', id='" + clientId + "', hostname='" + hostname + "'}";
    }
}
