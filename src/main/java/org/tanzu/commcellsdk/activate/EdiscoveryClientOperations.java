package org.tanzu.commcellsdk.activate;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.Endpoint;
import org.tanzu.commcellsdk.commcell.ResponseClassifier;
import org.tanzu.commcellsdk.commcell.SdkException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Crawl job operations of an eDiscovery client for one datasource.
 */
public class EdiscoveryClientOperations {

    private static final Logger logger = LoggerFactory.getLogger(EdiscoveryClientOperations.class);

    private static final int CRAWL_TYPE = 1;
    private static final int INCREMENTAL_CRAWL = 2;
    private static final int FULL_CRAWL = 3;

    /**
     * Pause between job status polls.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final Commcell commcell;
    private final String clientId;
    private final String datasourceId;
    private final Clock clock;
    private final Sleeper sleeper;

    public EdiscoveryClientOperations(Commcell commcell, String clientId, String datasourceId) {
        this(commcell, clientId, datasourceId, Clock.systemUTC(), duration -> Thread.sleep(duration.toMillis()));
    }

    public EdiscoveryClientOperations(Commcell commcell, String clientId, String datasourceId,
                                      Clock clock, Sleeper sleeper) {
        this.commcell = commcell;
        this.clientId = clientId;
        this.datasourceId = datasourceId;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public String getClientId() {
        return clientId;
    }

    public String getDatasourceId() {
        return datasourceId;
    }

    /**
     * Starts a crawl job.
     *
     * @param waitForJob  block until the job finishes
     * @param waitMinutes how long to wait when blocking
     * @param incremental incremental crawl when true, full crawl otherwise
     */
    public void startJob(boolean waitForJob, int waitMinutes, boolean incremental) {
        int operation = incremental ? INCREMENTAL_CRAWL : FULL_CRAWL;
        logger.debug("Starting {} crawl on client {} datasource {}",
                incremental ? "incremental" : "full", clientId, datasourceId);
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.EDISCOVERY_CRAWL, clientId, datasourceId, CRAWL_TYPE, operation));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || json.isEmpty()) {
            throw new SdkException("EdiscoveryClients", "103");
        }
        if (json.has("errorCode") && json.get("errorCode").asInt() != 0) {
            throw new SdkException("EdiscoveryClients", "102", json.path("errorMessage").asText());
        }
        if (waitForJob) {
            waitForCollectionJob(waitMinutes);
        }
    }

    public void startJob() {
        startJob(false, 60, true);
    }

    /**
     * The {@code status} node of the current crawl job.
     */
    public JsonNode jobStatus() {
        return statusNode(Endpoint.EDISCOVERY_JOB_STATUS, "status", "105");
    }

    /**
     * The {@code status} node of the crawl job history.
     */
    public JsonNode jobHistory() {
        return statusNode(Endpoint.EDISCOVERY_JOBS_HISTORY, "history", "104");
    }

    private JsonNode statusNode(Endpoint endpoint, String what, String missingId) {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(endpoint, clientId, CRAWL_TYPE, datasourceId));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json != null && json.has("status")) {
            return json.get("status");
        }
        if (json != null && json.has("error")) {
            JsonNode error = json.get("error");
            if (error.path("errorCode").asInt() != 0) {
                throw new SdkException("EdiscoveryClients", "102", error.path("errLogMessage").asText());
            }
            throw new SdkException("EdiscoveryClients", "102", "Something went wrong while fetching job " + what);
        }
        throw new SdkException("EdiscoveryClients", missingId);
    }

    /**
     * Polls the job status until the crawl job reaches a final state.
     *
     * @throws SdkException EdiscoveryClients/102 when the job fails or the wait times out
     */
    public void waitForCollectionJob(int waitMinutes) {
        Instant deadline = clock.instant().plus(Duration.ofMinutes(waitMinutes));
        Duration pollInterval = commcell.config().getCrawlPollInterval();
        while (true) {
            if (clock.instant().isAfter(deadline)) {
                throw new SdkException("EdiscoveryClients", "102", "Collection job Timeout");
            }
            CrawlJobState state = CrawlJobState.fromCode(jobStatus().path("state").asInt());
            logger.debug("Crawl job on datasource {} is {}", datasourceId, state);
            if (state == CrawlJobState.COMPLETE) {
                return;
            }
            if (state == CrawlJobState.COMPLETE_WITH_ERROR) {
                throw new SdkException("EdiscoveryClients", "102", "Job status is marked as Completed with Error");
            }
            if (state.isFailed()) {
                throw new SdkException("EdiscoveryClients", "102", "Job status is marked as Failed/Error/Pending");
            }
            try {
                sleeper.sleep(pollInterval);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new SdkException("EdiscoveryClients", "102", "Interrupted while waiting for collection job", e);
            }
        }
    }

    @Override
    public String toString() {
        return "EdiscoveryClientOperations{clientId='" + clientId + "', datasourceId='" + datasourceId + "'}";
    }
}
