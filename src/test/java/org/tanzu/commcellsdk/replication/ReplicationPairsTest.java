package org.tanzu.commcellsdk.replication;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.SdkException;
import org.tanzu.commcellsdk.support.ScriptedCommcell;

import static org.junit.jupiter.api.Assertions.*;

class ReplicationPairsTest {

    private static final String PAIRS = "{\"siteInfo\":["
            + "{\"id\":7,\"sourceName\":\"web-vm\",\"destinationName\":\"web-vm_DR\"},"
            + "{\"id\":8,\"sourceName\":\"db-vm\",\"destinationName\":\"db-vm_DR\"}]}";

    private ScriptedCommcell server;
    private Commcell commcell;

    @BeforeEach
    void setUp() {
        server = new ScriptedCommcell();
        server.on(HttpMethod.GET, "Replications/Monitors/streaming").respond(200, PAIRS);
        commcell = server.connect();
    }

    @Test
    void pairsAreKeyedById() {
        ReplicationPairs pairs = commcell.replicationPairs();

        assertEquals(2, pairs.all().size());
        assertTrue(pairs.has("8"));
        assertEquals("Replication pair ID: 7", pairs.get("7").toString());
    }

    @Test
    void pairReadsStreamingMonitorEntry() {
        server.on(HttpMethod.GET, "Replications/Monitors/streaming?replicationPairId=7").respond(200,
                "{\"siteInfo\":[{\"id\":7,\"sourceName\":\"web-vm\",\"destinationName\":\"web-vm_DR\","
                        + "\"replicationGuid\":\"5B1D\",\"status\":2,\"lastSyncedBkpJob\":4711,"
                        + "\"destinationInstance\":{\"clientName\":\"hyperv-dr\"},"
                        + "\"destProxy\":{\"clientName\":\"proxy-dr\"}}]}");

        ReplicationPair pair = commcell.replicationPairs().get("7");

        assertEquals("web-vm", pair.getSourceVm());
        assertEquals("web-vm_DR", pair.getDestinationVm());
        assertEquals("5B1D", pair.getReplicationGuid());
        assertEquals(2, pair.getStatus());
        assertEquals("hyperv-dr", pair.getDestinationClient());
        assertEquals("proxy-dr", pair.getDestinationProxy());
        assertEquals("4711", pair.getLastSyncedBackupJob());
        assertEquals("Replication pair: web-vm -> web-vm_DR", pair.toString());
    }

    @Test
    void unknownPairRaises103() {
        SdkException e = assertThrows(SdkException.class, () -> commcell.replicationPairs().get("99"));

        assertEquals("ReplicationPairs", e.getModule());
        assertEquals("103", e.getErrorId());
    }

    @Test
    void emptyPairDetailsRaise103() {
        server.on(HttpMethod.GET, "Replications/Monitors/streaming?replicationPairId=8").respond(200,
                "{\"siteInfo\":[]}");

        ReplicationPair pair = commcell.replicationPairs().get("8");
        SdkException e = assertThrows(SdkException.class, pair::getSourceVm);

        assertEquals("103", e.getErrorId());
    }

    @Test
    void responseWithoutSiteInfoRaises102() {
        server.on(HttpMethod.GET, "Replications/Monitors/streaming").respond(200, "{\"errorCode\":0}");

        SdkException e = assertThrows(SdkException.class, () -> commcell.replicationPairs().all());

        assertEquals("ReplicationPairs", e.getModule());
        assertEquals("102", e.getErrorId());
    }
}
