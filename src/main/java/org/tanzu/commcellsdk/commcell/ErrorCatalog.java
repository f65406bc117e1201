package org.tanzu.commcellsdk.commcell;

import java.util.Collections;
import java.util.HashMap;
import java.util.Map;

/**
 * Catalog texts for {@link SdkException}, keyed by module and error id.
 */
public final class ErrorCatalog {

    private static final Map<String, Map<String, String>> CATALOG = new HashMap<>();

    static {
        register("Response",
                "101", "Response was not success",
                "102", "Response received is empty",
                "500", "Unable to perform the requested method");
        register("Commcell",
                "101", "Commcell is not reachable. Please check the commcell name and services again",
                "102", "Credentials not received. Please try again.",
                "103", "Failed to get the CommServ details",
                "104", "Failed to send an email to specified user",
                "105", "Failed to run the qoperation command",
                "107", "Data type of the input(s) is not valid");
        register("CVPySDK",
                "101", "Failed to Login with the credentials provided",
                "102", "",
                "103", "Reached the maximum attempts limit",
                "104", "This session has expired. Please login again",
                "105", "Invalid Authtoken",
                "106", "The token has expired. Please login again",
                "107", "No mapping exists for the given token for any user");
        register("Client",
                "101", "Data type of the input(s) is not valid",
                "102", "");
        register("ClientGroup",
                "101", "Data type of the input(s) is not valid",
                "102", "");
        register("Storage",
                "101", "Data type of the input(s) is not valid",
                "102", "",
                "105", "No storage policies exist for this user");
        register("Schedules",
                "101", "Invalid Class object passed to get schedules",
                "102", "Data type of the input(s) is not valid",
                "103", "Failed to get the schedule policies",
                "104", "Failed to create the schedule policy",
                "105", "Could not find the provided schedule name/id",
                "106", "");
        register("User",
                "101", "Data type of input(s) is not valid",
                "102", "",
                "103", "User with same name already exists");
        register("UserGroup",
                "101", "Data type of input(s) is not valid",
                "102", "");
        register("Datacube",
                "101", "Data type of the input(s) is not valid",
                "102", "",
                "103", "Failed to get the list of analytics engines",
                "104", "Failed to get the datasources");
        register("EdiscoveryClients",
                "101", "Data type of the input(s) is not valid",
                "102", "",
                "103", "Failed to start crawl job",
                "104", "Failed to get job history",
                "105", "Failed to get job status");
        register("ReplicationPairs",
                "101", "Failed to get replication pairs information",
                "102", "Invalid response received for replication pairs",
                "103", "Replication Pair not found");
        register("BLRPairs",
                "101", "Data type of the input(s) is not valid",
                "102", "BLR Pair not found",
                "103", "RPStore not found",
                "104", "");
    }

    private ErrorCatalog() {
    }

    private static void register(String module, String... idsAndTexts) {
        Map<String, String> texts = new HashMap<>();
        for (int i = 0; i < idsAndTexts.length; i += 2) {
            texts.put(idsAndTexts[i], idsAndTexts[i + 1]);
        }
        CATALOG.put(module, Collections.unmodifiableMap(texts));
    }

    /**
     * Catalog text for the given module and id, or an empty string when unknown.
     */
    public static String text(String module, String errorId) {
        return CATALOG.getOrDefault(module, Collections.emptyMap()).getOrDefault(errorId, "");
    }

    /**
     * Builds an exception message: the catalog text, then the detail on its own line.
     * When either part is empty the other one is returned alone.
     */
    public static String message(String module, String errorId, String detail) {
        String base = text(module, errorId);
        if (detail == null || detail.isEmpty()) {
            return base;
        }
        if (base.isEmpty()) {
            return detail;
        }
        return base + "\n" + detail;
    }
}
