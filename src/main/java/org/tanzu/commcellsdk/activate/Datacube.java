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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

/**
 * Datacube: analytics engines and datasources.
 *
 * Both are loaded in parallel on the session's init executor when the Datacube is
 * built. A part that failed to load is reported when it is first accessed.
 */
public class Datacube {

    private static final Logger logger = LoggerFactory.getLogger(Datacube.class);

    private final Commcell commcell;

    private volatile Loaded<JsonNode> analyticsEngines;
    private volatile Loaded<Datasources> datasources;

    public Datacube(Commcell commcell) {
        this.commcell = commcell;
        load();
    }

    private void load() {
        Future<JsonNode> engines = CompletableFuture.supplyAsync(this::fetchAnalyticsEngines, commcell.initExecutor());
        Future<Datasources> sources = CompletableFuture.supplyAsync(() -> {
            Datasources loaded = new Datasources(commcell);
            loaded.all();
            return loaded;
        }, commcell.initExecutor());
        this.analyticsEngines = await(engines, "analytics engines");
        this.datasources = await(sources, "datasources");
    }

    private static <T> Loaded<T> await(Future<T> future, String part) {
        try {
            return new Loaded<>(future.get(), null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Failed to load Datacube {}: {}", part, cause.getMessage());
            return new Loaded<>(null, cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new Loaded<>(null, e);
        }
    }

    JsonNode fetchAnalyticsEngines() {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET,
                commcell.services().url(Endpoint.GET_ANALYTICS_ENGINES));
        if (!response.isOk()) {
            throw new SdkException("Response", "101", ResponseClassifier.updateResponse(response.getBody()));
        }
        JsonNode json = commcell.classifier().parse(response.getBody());
        if (json == null || !json.has("listOfCIServer")) {
            throw new SdkException("Datacube", "103");
        }
        return json.get("listOfCIServer");
    }

    /**
     * The {@code listOfCIServer} array.
     *
     * @throws SdkException the error that stopped the engines from loading
     */
    public JsonNode analyticsEngines() {
        return analyticsEngines.get("103");
    }

    /**
     * @throws SdkException the error that stopped the datasources from loading
     */
    public Datasources datasources() {
        return datasources.get("104");
    }

    /**
     * Reloads both parts.
     */
    public void refresh() {
        load();
    }

    @Override
    public String toString() {
        return "Datacube{commserv='" + commcell.commservName() + "'}";
    }

    /**
     * A loaded value or the failure that replaced it.
     */
    private static final class Loaded<T> {
        private final T value;
        private final Throwable failure;

        Loaded(T value, Throwable failure) {
            this.value = value;
            this.failure = failure;
        }

        T get(String errorId) {
            if (failure instanceof SdkException) {
                throw (SdkException) failure;
            }
            if (failure != null) {
                throw new SdkException("Datacube", errorId, failure.getMessage(), failure);
            }
            return value;
        }
    }
}
