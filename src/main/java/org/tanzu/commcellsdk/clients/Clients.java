package org.tanzu.commcellsdk.clients;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Clients registered on the Commcell.
 *
 * Clients can be looked up by client name, host name or client id. Each list entry
 * holds {@code id} and {@code hostname}.
 */
public class Clients extends NamedEntityCollection<Client> {

    private static final Logger logger = LoggerFactory.getLogger(Clients.class);

    public Clients(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "Client";
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        JsonNode json = getJson(commcell.services().url(Endpoint.GET_ALL_CLIENTS), module(), "102");
        Map<String, JsonNode> clients = new LinkedHashMap<>();
        for (JsonNode properties : json.path("clientProperties")) {
            JsonNode entity = properties.path("client").path("clientEntity");
            if (!entity.hasNonNull("clientName")) {
                continue;
            }
            ObjectNode summary = commcell.objectMapper().createObjectNode();
            summary.put("id", entity.path("clientId").asText());
            summary.put("hostname", normalize(entity.path("hostName").asText("")));
            summary.put("displayName", entity.path("displayName").asText(entity.path("clientName").asText()));
            clients.put(entity.path("clientName").asText(), summary);
        }
        return clients;
    }

    /**
     * True when a client has the given name or host name.
     */
    @Override
    public boolean has(String name) {
        return super.has(name) || nameForHostname(name) != null;
    }

    /**
     * Returns the client with the given name, host name or id, checked in that order.
     */
    @Override
    public Client get(String nameOrHostname) {
        requireName(nameOrHostname);
        if (super.has(nameOrHostname)) {
            return super.get(nameOrHostname);
        }
        String name = nameForHostname(nameOrHostname);
        if (name == null) {
            name = nameForId(nameOrHostname);
        }
        if (name == null) {
            throw new SdkException(module(), "102", "No client exists with given name/hostname: " + nameOrHostname);
        }
        return super.get(name);
    }

    public boolean hasHostname(String hostname) {
        requireName(hostname);
        return nameForHostname(hostname) != null;
    }

    /**
     * Client name for a client id, or null.
     */
    public String nameForId(String clientId) {
        for (Map.Entry<String, JsonNode> entry : all().entrySet()) {
            if (entry.getValue().path("id").asText().equals(clientId)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Client id for a client name or host name.
     *
     * @throws SdkException Client/102 when no client matches
     */
    public String idFor(String nameOrHostname) {
        return get(nameOrHostname).getClientId();
    }

    private String nameForHostname(String hostname) {
        String lowered = normalize(hostname);
        for (Map.Entry<String, JsonNode> entry : all().entrySet()) {
            if (entry.getValue().path("hostname").asText().equals(lowered)) {
                return entry.getKey();
            }
        }
        return null;
    }

    /**
     * Deletes a client. The server reports failures inside a 200 response, either in the
     * first element of {@code response} or as a top level {@code errorCode}. A non-zero
     * top level {@code warningCode} also fails the delete.
     */
    public void delete(String clientName) {
        Client client = get(clientName);
        logger.info("Deleting client {} ({})", client.getClientName(), client.getClientId());
        JsonNode json = send(HttpMethod.DELETE, commcell.services().url(Endpoint.DELETE_CLIENT, client.getClientId()),
                null, module(), "102");
        if (json != null && json.path("warningCode").asInt(0) != 0) {
            throw new SdkException(module(), "102",
                    "Warning: \"" + json.path("warningMessage").asText("") + "\"");
        }
        refresh();
    }

    @Override
    protected Client wrap(String name, JsonNode properties) {
        return new Client(commcell, name, properties.path("id").asText(), properties.path("hostname").asText(null));
    }

    @Override
    public String toString() {
        return "Clients{commserv='" + commcell.commservName() + "', count=" + all().size() + '}';
    }
}
