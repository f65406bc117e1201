package org.tanzu.commcellsdk.security;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Authentication;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.support.ScriptedCommcell;

import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class UsersTest {

    private static final String USERS = "{\"users\":["
            + "{\"userEntity\":{\"userName\":\"admin\",\"userId\":1}},"
            + "{\"userEntity\":{\"userName\":\"jdoe\",\"userId\":5}},"
            + "{\"userEntity\":{\"userName\":\"operator\",\"userId\":6}}]}";
    private static final String USERS_AFTER_ADD = "{\"users\":["
            + "{\"userEntity\":{\"userName\":\"admin\",\"userId\":1}},"
            + "{\"userEntity\":{\"userName\":\"asmith\",\"userId\":9}}]}";
    private static final String GROUPS = "{\"userGroups\":["
            + "{\"userGroupEntity\":{\"userGroupName\":\"Backup Operators\",\"userGroupId\":3}}]}";

    private ScriptedCommcell server;
    private Commcell commcell;

    @BeforeEach
    void setUp() {
        server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "User").respond(200, USERS);
        server.on(HttpMethod.GET, "UserGroup").respond(200, GROUPS);
        commcell = server.connect();
    }

    @Test
    void listsUsersById() {
        assertEquals("5", commcell.users().get("JDOE").getUserId());
        assertEquals(3, commcell.users().all().size());
    }

    @Test
    void unknownUserMessage() {
        SdkException e = assertThrows(SdkException.class, () -> commcell.users().get("ghost"));

        assertEquals("User ghost doesn't exists on this commcell.", e.getMessage());
    }

    @Test
    void userDetailsAreReadAtLevel50() {
        server.on(HttpMethod.GET, "User/5").respond(200, "{\"users\":[{\"email\":\"jdoe@example.com\","
                + "\"fullName\":\"John Doe\",\"enableUser\":false,"
                + "\"associatedUserGroups\":[{\"userGroupName\":\"Backup Operators\"}]}]}");

        User user = commcell.users().get("jdoe");

        assertEquals("jdoe@example.com", user.getEmail());
        assertEquals("John Doe", user.getFullName());
        assertFalse(user.isEnabled());
        assertEquals(Arrays.asList("Backup Operators"), user.getAssociatedUserGroups());
        assertEquals("Level=50", server.lastRequest(HttpMethod.GET, "User/5").getQuery());
    }

    @Test
    void addSendsEncodedPasswordAndGroups() throws Exception {
        server.on(HttpMethod.POST, "User").respond(200,
                "{\"response\":[{\"errorCode\":0,\"entity\":{\"userName\":\"asmith\",\"userId\":9}}]}");

        server.on(HttpMethod.GET, "User").respond(200, USERS).respond(200, USERS_AFTER_ADD);
        User user = commcell.users().add(new UserSpec("asmith", "asmith@example.com")
                .fullName("Alice Smith")
                .password("Pa55word")
                .localUserGroups(Arrays.asList("Backup Operators")));

        assertEquals("9", user.getUserId());
        JsonNode sent = commcell.objectMapper().readTree(server.lastRequest(HttpMethod.POST, "User").getBody())
                .get("users").get(0);
        assertEquals(Authentication.encodePassword("Pa55word"), sent.get("password").asText());
        assertFalse(sent.get("systemGeneratePassword").asBoolean());
        assertEquals("asmith", sent.get("userEntity").get("userName").asText());
        assertEquals("Backup Operators", sent.get("associatedUserGroups").get(0).get("userGroupName").asText());
    }

    @Test
    void addWithoutPasswordLetsServerGenerateOne() {
        Users users = commcell.users();

        JsonNode user = users.buildAddRequest(new UserSpec("bob", "bob@example.com")).get("users").get(0);

        assertTrue(user.get("systemGeneratePassword").asBoolean());
        assertEquals("", user.get("password").asText());
        assertEquals(1, user.get("associatedUserGroups").size());
        assertEquals(0, user.get("associatedUserGroups").get(0).size());
    }

    @Test
    void domainUserIsCreatedUnderQualifiedName() {
        JsonNode user = commcell.users().buildAddRequest(new UserSpec("carol", "carol@example.com")
                .domain("CORP").password("ignored")).get("users").get(0);

        assertEquals("CORP\\carol", user.get("userEntity").get("userName").asText());
        assertEquals("", user.get("password").asText());
    }

    @Test
    void addRejectsExistingUser() {
        SdkException e = assertThrows(SdkException.class,
                () -> commcell.users().add(new UserSpec("jdoe", "jdoe@example.com")));

        assertEquals("User", e.getModule());
        assertEquals("103", e.getErrorId());
        assertEquals("User with same name already exists\nUser: jdoe", e.getMessage());
    }

    @Test
    void addReportsServerError() {
        server.on(HttpMethod.POST, "User").respond(200,
                "{\"response\":[{\"errorCode\":4,\"errorString\":\"Email already in use\"}]}");

        SdkException e = assertThrows(SdkException.class,
                () -> commcell.users().add(new UserSpec("asmith", "jdoe@example.com")));

        assertEquals("Email already in use", e.getMessage());
    }

    @Test
    void deleteTransfersOwnershipToGroup() {
        server.on(HttpMethod.DELETE, "User/5").respond(200, "{\"response\":[{\"errorCode\":0}]}");

        commcell.users().delete("jdoe", null, "backup operators");

        assertEquals("newUserId=0&newUserGroupId=3", server.lastRequest(HttpMethod.DELETE, "User/5").getQuery());
    }

    @Test
    void deleteTransfersOwnershipToUser() {
        server.on(HttpMethod.DELETE, "User/5").respond(200, "{\"errorCode\":0}");

        commcell.users().delete("jdoe", "operator", null);

        assertEquals("newUserId=6&newUserGroupId=0", server.lastRequest(HttpMethod.DELETE, "User/5").getQuery());
        assertEquals(2, server.requests(HttpMethod.GET, "User").size());
    }

    @Test
    void deleteNeedsExactlyOneOwner() {
        SdkException none = assertThrows(SdkException.class, () -> commcell.users().delete("jdoe"));
        assertEquals("Ownership transfer is mondatory!! Please provide new owner information", none.getMessage());

        SdkException both = assertThrows(SdkException.class,
                () -> commcell.users().delete("jdoe", "operator", "backup operators"));
        assertTrue(both.getMessage().contains("both can not be set as owner"));
        assertTrue(server.requests(HttpMethod.DELETE, "User/5").isEmpty());
    }

    @Test
    void deleteWithUnknownGroupRaisesUserGroup102() {
        SdkException e = assertThrows(SdkException.class,
                () -> commcell.users().delete("jdoe", null, "auditors"));

        assertEquals("UserGroup", e.getModule());
        assertEquals("UserGroup auditors doesn't exists on this commcell.", e.getMessage());
    }

    @Test
    void addedUserIsListedUntilDeleted() {
        server.on(HttpMethod.GET, "User").respond(200, USERS).respond(200, USERS_AFTER_ADD).respond(200, USERS);
        server.on(HttpMethod.POST, "User").respond(200,
                "{\"response\":[{\"errorCode\":0,\"entity\":{\"userName\":\"asmith\",\"userId\":9}}]}");
        server.on(HttpMethod.DELETE, "User/9").respond(200, "{\"response\":[{\"errorCode\":0}]}");
        Users users = commcell.users();

        assertFalse(users.has("asmith"));
        users.add(new UserSpec("asmith", "asmith@example.com").password("Pa55word"));
        assertTrue(users.has("ASMITH"));

        users.delete("asmith", "admin", null);
        assertFalse(users.has("asmith"));
        assertEquals("newUserId=1&newUserGroupId=0", server.lastRequest(HttpMethod.DELETE, "User/9").getQuery());
    }
}
