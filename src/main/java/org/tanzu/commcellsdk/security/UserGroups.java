package org.tanzu.commcellsdk.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * User groups on the Commcell, system created ones included.
 */
public class UserGroups extends NamedEntityCollection<UserGroup> {

    public UserGroups(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "UserGroup";
    }

    @Override
    protected SdkException notFound(String name) {
        return new SdkException(module(), "102", "UserGroup " + name + " doesn't exists on this commcell.");
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        JsonNode json = getJson(commcell.services().url(Endpoint.USERGROUPS), module(), "102");
        if (!json.has("userGroups")) {
            throw new SdkException("Response", "102");
        }
        Map<String, JsonNode> groups = new LinkedHashMap<>();
        for (JsonNode group : json.get("userGroups")) {
            JsonNode entity = group.path("userGroupEntity");
            if (entity.hasNonNull("userGroupName")) {
                groups.put(entity.get("userGroupName").asText(), TextNode.valueOf(entity.path("userGroupId").asText()));
            }
        }
        return groups;
    }

    @Override
    protected UserGroup wrap(String name, JsonNode properties) {
        return new UserGroup(name, properties.asText());
    }
}
