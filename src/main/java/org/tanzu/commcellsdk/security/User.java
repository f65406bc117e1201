package org.tanzu.commcellsdk.security;

import com.fasterxml.jackson.databind.JsonNode;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;

import java.util.ArrayList;
import java.util.List;

/**
 * One user. Properties come from {@code User/{id}?Level=50} on first access.
 */
public class User {

    private final Commcell commcell;
    private final String userName;
    private final String userId;

    private volatile JsonNode properties;

    public User(Commcell commcell, String userName, String userId) {
        this.commcell = commcell;
        this.userName = userName;
        this.userId = userId;
    }

    public String getUserName() { return userName; }
    public String getUserId() { return userId; }

    public JsonNode properties() {
        if (properties == null) {
            refresh();
        }
        return properties;
    }

    public void refresh() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.USER, userId));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.path("users").has(0)) {
            throw new SdkException("Response", "102");
        }
        this.properties = json.path("users").get(0);
    }

    public String getEmail() {
        return properties().path("email").asText(null);
    }

    public String getFullName() {
        return properties().path("fullName").asText(null);
    }

    public String getDescription() {
        return properties().path("description").asText(null);
    }

    public boolean isEnabled() {
        return properties().path("enableUser").asBoolean(true);
    }

    public List<String> getAssociatedUserGroups() {
        List<String> groups = new ArrayList<>();
        for (JsonNode group : properties().path("associatedUserGroups")) {
            if (group.hasNonNull("userGroupName")) {
                groups.add(group.get("userGroupName").asText());
            }
        }
        return groups;
    }

    @Override
    public String toString() {
        return "User{name='" + userName + "', id='" + userId + "'}";
    }
}
