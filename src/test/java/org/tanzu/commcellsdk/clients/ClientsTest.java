package org.tanzu.commcellsdk.clients;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.support.ScriptedCommcell;

import static org.junit.jupiter.api.Assertions.*;

class ClientsTest {

    static final String CLIENTS = "{\"clientProperties\":["
            + "{\"client\":{\"clientEntity\":{\"clientName\":\"FS01\",\"clientId\":11,\"hostName\":\"FS01.example.com\",\"displayName\":\"File Server 1\"}}},"
            + "{\"client\":{\"clientEntity\":{\"clientName\":\"sql02\",\"clientId\":12,\"hostName\":\"sql02.example.com\"}}}]}";

    private ScriptedCommcell server;
    private Commcell commcell;

    @BeforeEach
    void setUp() {
        server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "Client").respond(200, CLIENTS);
        commcell = server.connect();
    }

    @Test
    void listsClientsByLowerCasedName() {
        assertEquals(2, commcell.clients().all().size());
        assertTrue(commcell.clients().all().containsKey("fs01"));
        assertEquals("fs01.example.com", commcell.clients().all().get("fs01").get("hostname").asText());
    }

    @Test
    void lookupIsCaseInsensitiveAndAcceptsHostname() {
        Clients clients = commcell.clients();

        assertTrue(clients.has("FS01"));
        assertTrue(clients.has("sql02.EXAMPLE.com"));
        assertFalse(clients.has("exchange01"));
        assertEquals("12", clients.get("sql02.example.com").getClientId());
        assertEquals("fs01", clients.get("11").getClientName());
        assertEquals("11", clients.idFor("fs01.example.com"));
    }

    @Test
    void listIsReadOnceUntilRefresh() {
        Clients clients = commcell.clients();
        clients.has("fs01");
        clients.get("sql02");
        assertEquals(1, server.requests(HttpMethod.GET, "Client").size());

        clients.refresh();
        assertEquals(2, server.requests(HttpMethod.GET, "Client").size());
    }

    @Test
    void unknownClientRaisesClient102() {
        SdkException e = assertThrows(SdkException.class, () -> commcell.clients().get("exchange01"));

        assertEquals("Client", e.getModule());
        assertEquals("102", e.getErrorId());
        assertEquals("No client exists with given name/hostname: exchange01", e.getMessage());
    }

    @Test
    void blankNameRaisesClient101() {
        SdkException e = assertThrows(SdkException.class, () -> commcell.clients().has(" "));

        assertEquals("101", e.getErrorId());
    }

    @Test
    void clientPropertiesAreReadLazily() {
        server.on(HttpMethod.GET, "Client/11").respond(200,
                "{\"clientProperties\":[{\"client\":{\"displayName\":\"File Server 1\"}}]}");

        Client client = commcell.clients().get("fs01");
        assertTrue(server.requests(HttpMethod.GET, "Client/11").isEmpty());

        assertEquals("File Server 1", client.getDisplayName());
        assertEquals(1, server.requests(HttpMethod.GET, "Client/11").size());
    }

    @Test
    void deleteSendsForceDeleteAndRefreshes() {
        server.on(HttpMethod.DELETE, "Client/12").respond(200, "{\"response\":[{\"errorCode\":0}]}");

        commcell.clients().delete("SQL02");

        assertEquals("forceDelete=1", server.lastRequest(HttpMethod.DELETE, "Client/12").getQuery());
        assertEquals(2, server.requests(HttpMethod.GET, "Client").size());
    }

    @Test
    void deleteReportsServerError() {
        server.on(HttpMethod.DELETE, "Client/12").respond(200,
                "{\"response\":[{\"errorCode\":7,\"errorString\":\"Client has active jobs\"}]}");

        SdkException e = assertThrows(SdkException.class, () -> commcell.clients().delete("sql02"));

        assertEquals("Client has active jobs", e.getMessage());
    }

    @Test
    void deleteWarningFailsAndKeepsTheList() {
        server.on(HttpMethod.DELETE, "Client/11").respond(200,
                "{\"errorCode\":0,\"warningCode\":7,\"warningMessage\":\"Client has jobs\"}");

        SdkException e = assertThrows(SdkException.class, () -> commcell.clients().delete("fs01"));

        assertEquals("Client", e.getModule());
        assertEquals("102", e.getErrorId());
        assertEquals("Warning: \"Client has jobs\"", e.getMessage());
        assertEquals(1, server.requests(HttpMethod.GET, "Client").size());
    }
}
