package org.tanzu.commcellsdk.commcell;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ErrorCatalogTest {

    @Test
    void messageJoinsCatalogTextAndDetail() {
        assertEquals("Response was not success\nService Unavailable",
                ErrorCatalog.message("Response", "101", "Service Unavailable"));
    }

    @Test
    void emptyCatalogTextLeavesDetailOnly() {
        assertEquals("No client exists with name: fs9", ErrorCatalog.message("Client", "102", "No client exists with name: fs9"));
    }

    @Test
    void missingDetailLeavesCatalogTextOnly() {
        assertEquals("Reached the maximum attempts limit", ErrorCatalog.message("CVPySDK", "103", null));
        assertEquals("Reached the maximum attempts limit", ErrorCatalog.message("CVPySDK", "103", ""));
    }

    @Test
    void unknownIdsHaveNoText() {
        assertEquals("", ErrorCatalog.text("Nope", "101"));
        assertEquals("", ErrorCatalog.text("Client", "999"));
    }

    @Test
    void exceptionCarriesModuleAndId() {
        SdkException e = new SdkException("EdiscoveryClients", "105");

        assertEquals("EdiscoveryClients", e.getModule());
        assertEquals("105", e.getErrorId());
        assertNull(e.getDetail());
        assertEquals("Failed to get job status", e.getMessage());
    }
}
