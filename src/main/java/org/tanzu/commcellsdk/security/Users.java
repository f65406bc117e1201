package org.tanzu.commcellsdk.security;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Authentication;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.entity.Mutator;
import org.tanzu.commcellsdk.entity.NamedEntityCollection;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Users on the Commcell, keyed by user name with the user id as value.
 */
public class Users extends NamedEntityCollection<User> implements Mutator<User, UserSpec> {

    private static final Logger logger = LoggerFactory.getLogger(Users.class);

    public Users(Commcell commcell) {
        super(commcell);
    }

    @Override
    protected String module() {
        return "User";
    }

    @Override
    protected SdkException notFound(String name) {
        return new SdkException(module(), "102", "User " + name + " doesn't exists on this commcell.");
    }

    @Override
    protected Map<String, JsonNode> fetchAll() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.USERS));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.has("users")) {
            throw new SdkException("Response", "102");
        }
        Map<String, JsonNode> users = new LinkedHashMap<>();
        for (JsonNode user : json.get("users")) {
            JsonNode entity = user.path("userEntity");
            if (entity.hasNonNull("userName")) {
                users.put(entity.get("userName").asText(), TextNode.valueOf(entity.path("userId").asText()));
            }
        }
        return users;
    }

    @Override
    protected User wrap(String name, JsonNode properties) {
        return new User(commcell, name, properties.asText());
    }

    /**
     * Creates a user and returns it.
     *
     * @throws SdkException User/103 when the name is taken, User/102 when the server refuses
     */
    @Override
    public User add(UserSpec spec) {
        requireName(spec.getUserName());
        if (spec.getEmail() == null) {
            throw new SdkException(module(), "101");
        }
        String userName = spec.qualifiedName();
        if (has(userName)) {
            throw new SdkException(module(), "103", "User: " + userName);
        }

        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.POST,
                commcell.services().url(Endpoint.USERS), buildAddRequest(spec));
        JsonNode json = checkResult(response, "Failed to add user. Please check logs for further details.");
        refresh();
        String created = json.path("response").path(0).path("entity").path("userName").asText(userName);
        logger.info("Created user {}", created);
        return get(created);
    }

    ObjectNode buildAddRequest(UserSpec spec) {
        boolean external = spec.getDomain() != null && !spec.getDomain().isEmpty();
        String password = external ? "" : spec.getPassword();
        boolean systemGenerated = !external && (spec.isSystemGeneratedPassword() || password == null);

        ObjectNode user = commcell.objectMapper().createObjectNode();
        user.put("password", password == null ? "" : Authentication.encodePassword(password));
        user.put("email", spec.getEmail());
        user.put("fullName", spec.getFullName());
        user.put("systemGeneratePassword", systemGenerated);
        user.putObject("userEntity").put("userName", spec.qualifiedName());

        ObjectNode security = user.putObject("securityAssociations");
        if (spec.getSecurityAssociations() != null) {
            security.put("associationsOperationType", "ADD");
            security.set("associations", spec.getSecurityAssociations());
        }
        ArrayNode groups = user.putArray("associatedUserGroups");
        if (spec.getLocalUserGroups().isEmpty()) {
            groups.addObject();
        } else {
            for (String group : spec.getLocalUserGroups()) {
                groups.addObject().put("userGroupName", group);
            }
        }

        ObjectNode request = commcell.objectMapper().createObjectNode();
        request.putArray("users").add(user);
        return request;
    }

    /**
     * Users are only deleted with a new owner, see {@link #delete(String, String, String)}.
     *
     * @throws SdkException User/102 in every case
     */
    @Override
    public void delete(String name) {
        delete(name, null, null);
    }

    /**
     * Deletes a user and hands its entities to exactly one new owner, a user or a user group.
     *
     * @throws SdkException User/102 when a user is missing or the owner is not exactly one
     */
    public void delete(String name, String newOwnerUser, String newOwnerGroup) {
        User user = get(name);
        if (newOwnerUser != null && newOwnerGroup != null) {
            throw new SdkException(module(), "102", newOwnerUser + " and " + newOwnerGroup
                    + " both can not be set as owner!! please send either new_user or new_usergroup");
        }
        String newUserId = "0";
        String newGroupId = "0";
        if (newOwnerUser != null) {
            newUserId = get(newOwnerUser).getUserId();
        } else if (newOwnerGroup != null) {
            UserGroups groups = commcell.userGroups();
            if (!groups.has(newOwnerGroup)) {
                throw new SdkException("UserGroup", "102",
                        "UserGroup " + newOwnerGroup + " doesn't exists on this commcell.");
            }
            newGroupId = groups.get(newOwnerGroup).getUserGroupId();
        } else {
            throw new SdkException(module(), "102",
                    "Ownership transfer is mondatory!! Please provide new owner information");
        }

        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.DELETE,
                commcell.services().url(Endpoint.DELETE_USER, user.getUserId(), newUserId, newGroupId));
        checkResult(response, "Failed to delete user. Please check logs for further details.");
        logger.info("Deleted user {}", name);
        refresh();
    }

    /**
     * Reads the add or delete result, from {@code response[0]} or the top level.
     */
    private JsonNode checkResult(CommcellResponse response, String fallbackMessage) {
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("Response", "102");
        }
        JsonNode result = json.has("response") ? json.path("response").path(0) : json;
        if (!result.has("errorCode")) {
            throw new SdkException(module(), "102", fallbackMessage);
        }
        if (ResponseClassifier.hasErrorCode(result)) {
            String message = result.path(json.has("response") ? "errorString" : "errorMessage").asText("");
            throw new SdkException(module(), "102", message.isEmpty() ? fallbackMessage : message);
        }
        return json;
    }
}
