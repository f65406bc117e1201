package org.tanzu.commcellsdk.commcell;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.web.reactive.function.client.WebClientRequestException;
import org.tanzu.commcellsdk.config.CommcellConfig;
import org.tanzu.commcellsdk.support.ScriptedCommcell;

import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class CommcellTest {

    private static final String CLIENTS = "{\"clientProperties\":[{\"client\":{\"clientEntity\":"
            + "{\"clientName\":\"FS01\",\"clientId\":11,\"hostName\":\"fs01.example.com\"}}}]}";

    @Test
    void connectsOverHttpsAndReadsCommServDetails() {
        ScriptedCommcell server = new ScriptedCommcell();

        Commcell commcell = server.connect();

        assertEquals("https://cs.example.com/webconsole/api/", commcell.webserviceBaseUrl());
        assertEquals("CS1", commcell.commservName());
        assertEquals("cs1.example.com", commcell.commservHostname());
        assertEquals("11.32.0", commcell.version());
        assertEquals("(Eastern Standard Time)", commcell.commservTimezone());
        assertEquals("Eastern Standard Time", commcell.commservTimezoneName());
        assertEquals("admin", commcell.commcellUsername());
        assertEquals("QSDK 1234", commcell.authToken());
        assertEquals("QSDK 1234", server.lastRequest(HttpMethod.GET, "CommServ").getHeaders().getFirst("Authtoken"));
    }

    @Test
    void loginSendsEncodedPassword() throws Exception {
        ScriptedCommcell server = new ScriptedCommcell();
        Commcell commcell = server.connect();

        JsonNode login = commcell.objectMapper().readTree(server.lastRequest(HttpMethod.POST, "Login").getBody());
        assertEquals("admin", login.get("username").asText());
        assertEquals(Authentication.encodePassword("secret"), login.get("password").asText());
        assertEquals(4, login.get("mode").asInt());
    }

    @Test
    void fallsBackToHttpWhenHttpsIsUnreachable() {
        ScriptedCommcell server = new ScriptedCommcell().unreachable("https");

        Commcell commcell = server.connect();

        assertEquals("http://cs.example.com/webconsole/api/", commcell.webserviceBaseUrl());
    }

    @Test
    void unreachableHostRaisesCommcell101() {
        ScriptedCommcell server = new ScriptedCommcell().unreachable("https").unreachable("http");

        SdkException e = assertThrows(SdkException.class, server::connect);

        assertEquals("Commcell", e.getModule());
        assertEquals("101", e.getErrorId());
        assertTrue(server.requests(HttpMethod.POST, "Login").isEmpty());
    }

    @Test
    void forcedHttpsDoesNotTryHttp() {
        ScriptedCommcell server = new ScriptedCommcell().unreachable("https");
        CommcellConfig config = ScriptedCommcell.config();
        config.setForceHttps(true);

        assertThrows(WebClientRequestException.class, () -> server.connect(config));
        assertTrue(server.requests().isEmpty());
    }

    @Test
    void authenticatesWithBareToken() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.POST, "WhoAmI").respond(200,
                "<CvEntities_ProcessingInstructionInfo><user userName=\"tokenuser\" userId=\"5\"/>"
                        + "</CvEntities_ProcessingInstructionInfo>");
        CommcellConfig config = new CommcellConfig();
        config.setHost(ScriptedCommcell.HOST);
        config.setAuthtoken("abcd");

        Commcell commcell = server.connect(config);

        assertEquals("QSDK abcd", commcell.authToken());
        assertEquals("tokenuser", commcell.commcellUsername());
        assertTrue(server.requests(HttpMethod.POST, "Login").isEmpty());
    }

    @Test
    void tokenWithoutUserRaisesCvPySdk107() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.POST, "WhoAmI").respond(200, "<CvEntities_ProcessingInstructionInfo/>");
        CommcellConfig config = new CommcellConfig();
        config.setHost(ScriptedCommcell.HOST);
        config.setAuthtoken("QSDK stale");

        SdkException e = assertThrows(SdkException.class, () -> server.connect(config));

        assertEquals("CVPySDK", e.getModule());
        assertEquals("107", e.getErrorId());
    }

    @Test
    void rejectedTokenFallsBackToCredentials() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.POST, "WhoAmI").respond(200, "<CvEntities_ProcessingInstructionInfo/>");
        CommcellConfig config = ScriptedCommcell.config();
        config.setAuthtoken("QSDK stale");

        Commcell commcell = server.connect(config);

        assertEquals("QSDK 1234", commcell.authToken());
        assertEquals("admin", commcell.commcellUsername());
        assertEquals(1, server.requests(HttpMethod.POST, "WhoAmI").size());
        assertEquals(1, server.requests(HttpMethod.POST, "Login").size());
        assertEquals("QSDK 1234", server.lastRequest(HttpMethod.GET, "CommServ").getHeaders().getFirst("Authtoken"));
    }

    @Test
    void missingCredentialsRaiseCommcell102() {
        CommcellConfig config = new CommcellConfig();
        config.setHost(ScriptedCommcell.HOST);
        config.setUsername("admin");

        SdkException e = assertThrows(SdkException.class, () -> new ScriptedCommcell().connect(config));

        assertEquals("Commcell", e.getModule());
        assertEquals("102", e.getErrorId());
    }

    @Test
    void rejectedLoginCarriesServerMessage() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.POST, "Login").respond(200,
                "{\"errList\":[{\"errLogMessage\":\"Invalid username or password\",\"errorCode\":5}]}");

        SdkException e = assertThrows(SdkException.class, server::connect);

        assertEquals("CVPySDK", e.getModule());
        assertEquals("101", e.getErrorId());
        assertEquals("Failed to Login with the credentials provided\nError: \"Invalid username or password\"",
                e.getMessage());
    }

    @Test
    void missingCommCellNameRaisesCommcell103() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "CommServ").respond(200, "{\"commcell\":{\"csGUID\":\"x\"}}");

        SdkException e = assertThrows(SdkException.class, server::connect);

        assertEquals("Commcell", e.getModule());
        assertEquals("103", e.getErrorId());
    }

    @Test
    void renewsTokenAfter401AndRepeatsRequest() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "Client").respondHtml(401, "Unauthorized").respond(200, CLIENTS);
        server.on(HttpMethod.POST, "RenewLoginToken").respond(200, "{\"token\":\"QSDK 5678\"}");
        Commcell commcell = server.connect();

        assertTrue(commcell.clients().has("fs01"));

        assertEquals(2, server.requests(HttpMethod.GET, "Client").size());
        assertEquals("QSDK 5678", server.lastRequest(HttpMethod.GET, "Client").getHeaders().getFirst("Authtoken"));
        assertEquals("QSDK 5678", commcell.authToken());
    }

    @Test
    void repeated401StopsAtMaximumAttempts() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "Client").respondHtml(401, "Unauthorized");
        server.on(HttpMethod.POST, "RenewLoginToken").respond(200, "{\"token\":\"QSDK 5678\"}");
        Commcell commcell = server.connect();

        SdkException e = assertThrows(SdkException.class, () -> commcell.clients().all());

        assertEquals("CVPySDK", e.getModule());
        assertEquals("103", e.getErrorId());
        assertEquals(4, server.requests(HttpMethod.GET, "Client").size());
    }

    @Test
    void featureClientsAreCachedUntilRefresh() {
        Commcell commcell = new ScriptedCommcell().connect();

        assertSame(commcell.clients(), commcell.clients());
        Object before = commcell.users();
        commcell.refresh();
        assertNotSame(before, commcell.users());
    }

    @Test
    void logoutClosesTheSession() {
        ScriptedCommcell server = new ScriptedCommcell();
        Commcell commcell = server.connect();

        assertEquals("User logged out", commcell.logout());

        assertTrue(commcell.isLoggedOut());
        assertNull(commcell.authToken());
        SdkException e = assertThrows(SdkException.class, commcell::clients);
        assertEquals("CVPySDK", e.getModule());
        assertEquals("104", e.getErrorId());
        assertEquals("User already logged out.", commcell.logout());
        assertEquals(1, server.requests(HttpMethod.POST, "Logout").size());
    }

    @Test
    void requestsAfterLogoutAreRefused() {
        ScriptedCommcell server = new ScriptedCommcell();
        Commcell commcell = server.connect();
        commcell.logout();
        int sent = server.requests().size();

        assertEquals("104", assertThrows(SdkException.class,
                () -> commcell.qoperationExecute("<TMMsg_TaskOperationReq/>")).getErrorId());
        assertEquals("104", assertThrows(SdkException.class,
                () -> commcell.request(HttpMethod.GET, "Client", null)).getErrorId());
        assertEquals("104", assertThrows(SdkException.class, () -> commcell.sendMail(
                Collections.singletonList("ops@example.com"), "Report", "body", false, false)).getErrorId());
        assertEquals("104", assertThrows(SdkException.class, commcell::refresh).getErrorId());
        assertEquals(sent, server.requests().size());
    }

    @Test
    void qoperationReturnsPlainTextAsOutput() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.POST, "Qcommand/qoperation execute").respond(200, "Operation completed");
        Commcell commcell = server.connect();

        JsonNode result = commcell.qoperationExecute("<TMMsg_TaskOperationReq/>");

        assertEquals("Operation completed", result.get("output").asText());
    }

    @Test
    void sendMailRaisesOnServerError() {
        ScriptedCommcell server = new ScriptedCommcell();
        server.on(HttpMethod.POST, "Qcommand/qoperation execute")
                .respond(200, "{\"errorCode\":2,\"errorMessage\":\"SMTP server not configured\"}");
        Commcell commcell = server.connect();

        SdkException e = assertThrows(SdkException.class, () -> commcell.sendMail(
                Collections.singletonList("ops@example.com"), "Report", "body", false, false));

        assertEquals("104", e.getErrorId());
        assertTrue(e.getMessage().endsWith("Error: \"SMTP server not configured\""));
        assertTrue(server.lastRequest(HttpMethod.POST, "Qcommand/qoperation execute").getBody()
                .contains("App_SendEmailReq"));
    }

    @Test
    void normalizesVersionStrings() {
        assertEquals("11.32.0", Commcell.normalizeVersion("11.0 SP32"));
        assertEquals("11.24.7", Commcell.normalizeVersion("11 SP24 HPK7"));
        assertEquals("11.0.0", Commcell.normalizeVersion("11"));
    }

    @Test
    void normalizesTimezones() {
        assertEquals("(UTC-05:00) Eastern Time", Commcell.normalizeTimezone("-300:(UTC-05:00) Eastern Time"));
        assertEquals("Pacific Standard Time", Commcell.normalizeTimezone("-480:Pacific Standard Time"));
    }
}
