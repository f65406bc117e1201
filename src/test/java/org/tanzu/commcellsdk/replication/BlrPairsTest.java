package org.tanzu.commcellsdk.replication;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.support.ScriptedCommcell;

import static org.junit.jupiter.api.Assertions.*;

class BlrPairsTest {

    private static final String PAIRS = "{\"siteInfo\":["
            + "{\"id\":21,\"sourceName\":\"FS01\",\"destinationName\":\"dr-fs01\"},"
            + "{\"id\":22,\"sourceName\":\"sql02\",\"destinationName\":\"dr-sql02\"}]}";
    private static final String CLIENTS = "{\"clientProperties\":["
            + "{\"client\":{\"clientEntity\":{\"clientName\":\"FS01\",\"clientId\":11,\"hostName\":\"fs01.example.com\"}}},"
            + "{\"client\":{\"clientEntity\":{\"clientName\":\"dr-fs01\",\"clientId\":31,\"hostName\":\"dr-fs01.example.com\"}}}]}";

    private ScriptedCommcell server;
    private Commcell commcell;

    @BeforeEach
    void setUp() {
        server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "Replications/Monitors/continuous").respond(200, PAIRS);
        commcell = server.connect();
    }

    @Test
    void pairsAreFoundBySourceAndDestination() {
        BlrPairs pairs = commcell.blrPairs();

        assertTrue(pairs.has("fs01", "DR-FS01"));
        assertFalse(pairs.has("fs01", "dr-sql02"));
        assertEquals("22", pairs.get("SQL02", "dr-sql02").getPairId());
        assertTrue(pairs.all().containsKey("21"));
    }

    @Test
    void missingPairRaisesBlr102() {
        SdkException e = assertThrows(SdkException.class, () -> commcell.blrPairs().get("fs01", "elsewhere"));

        assertEquals("BLRPairs", e.getModule());
        assertEquals("102", e.getErrorId());
        assertTrue(e.getMessage().contains("source: \"fs01\" and destination: \"elsewhere\""));
    }

    @Test
    void pairDetailsAreLoadedOnFirstUse() {
        server.on(HttpMethod.GET, "Replications/Monitors/continuous?replicationPairId=21").respond(200,
                "{\"siteInfo\":[{\"id\":21,\"sourceName\":\"FS01\",\"destinationName\":\"dr-fs01\","
                        + "\"srcClientId\":11,\"destClientId\":31,\"status\":4,\"lagTime\":7,"
                        + "\"replicationGroup\":{\"replicationGroupName\":\"fs-group\"}}]}");

        BlrPair pair = commcell.blrPairs().get("fs01", "dr-fs01");
        assertTrue(server.requests(HttpMethod.GET, "Replications/Monitors/continuous").stream()
                .noneMatch(r -> r.getQuery() != null));

        assertEquals(BlrPair.PairStatus.REPLICATING, pair.getStatus());
        assertEquals(7, pair.getLagTime());
        assertEquals("fs-group", pair.getReplicationGroupName());
        assertEquals("11", pair.getSourceClientId());
        assertEquals("31", pair.getDestinationClientId());
    }

    @Test
    void unknownStatusCodeHasNoState() {
        assertNull(BlrPair.PairStatus.fromCode(99));
        assertEquals(BlrPair.PairStatus.NOT_SYNCED, BlrPair.PairStatus.fromCode(0));
    }

    @Test
    void deleteRefreshesTheList() {
        server.on(HttpMethod.DELETE, "Replications/Monitors/continuous/21").respond(200, "{}");
        server.on(HttpMethod.GET, "Replications/Monitors/continuous").respond(200, PAIRS)
                .respond(200, "{\"siteInfo\":[{\"id\":22,\"sourceName\":\"sql02\",\"destinationName\":\"dr-sql02\"}]}");

        BlrPairs pairs = commcell.blrPairs();
        pairs.delete("FS01", "dr-fs01");

        assertFalse(pairs.has("FS01", "dr-fs01"));
        assertEquals(1, server.requests(HttpMethod.DELETE, "Replications/Monitors/continuous/21").size());
    }

    @Test
    void deleteReportsServerError() {
        server.on(HttpMethod.DELETE, "Replications/Monitors/continuous/21").respond(200,
                "{\"error\":{\"errorCode\":2,\"errorMessage\":\"Pair is busy\"}}");

        SdkException e = assertThrows(SdkException.class, () -> commcell.blrPairs().delete("FS01", "dr-fs01"));

        assertEquals("BLR Pair not found\nFailed to delete Source: FS01 and Destination: dr-fs01 \nError: \"Pair is busy\"",
                e.getMessage());
    }

    @Test
    void createPostsFileSystemPair() throws Exception {
        server.on(HttpMethod.GET, "Client").respond(200, CLIENTS);
        server.on(HttpMethod.POST, "Replications/Groups").respond(200, "{\"errorCode\":0}");

        commcell.blrPairs().create(new BlrPairSpec("FS01", "dr-fs01", BlrPairSpec.RecoveryType.GRANULARV2)
                .volume(new BlrPairSpec.VolumeMapping("{src-guid}", "E:", "{dst-guid}", "F:", 1024L))
                .rpStore(5, "rpstore1"));

        JsonNode sent = commcell.objectMapper()
                .readTree(server.lastRequest(HttpMethod.POST, "Replications/Groups").getBody());
        assertEquals(2, sent.get("destEndPointType").asInt());
        assertEquals(2, sent.get("srcEndPointType").asInt());
        assertEquals(11, sent.get("sourceEntity").get("client").get("clientId").asInt());
        assertEquals("dr-fs01", sent.get("destEntity").get("client").get("clientName").asText());
        assertEquals("F:", sent.get("srcDestVolumeMap").get(0).get("destVolume").asText());
        String options = sent.get("blrRecoveryOpts").asText();
        assertTrue(options.startsWith("<BlockReplication_BLRRecoveryOptions"));
        assertTrue(options.contains("recoveryType=\"4\""));
        assertEquals(1, server.requests(HttpMethod.GET, "Replications/Monitors/continuous").size());
    }

    @Test
    void createRejectsUnknownClient() {
        server.on(HttpMethod.GET, "Client").respond(200, CLIENTS);

        assertThrows(SdkException.class, () -> commcell.blrPairs()
                .create(new BlrPairSpec("FS01", "missing", BlrPairSpec.RecoveryType.LIVE)));
        assertTrue(server.requests(HttpMethod.POST, "Replications/Groups").isEmpty());
    }
}
