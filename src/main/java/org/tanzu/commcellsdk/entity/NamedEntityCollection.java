package org.tanzu.commcellsdk.entity;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpMethod;
import org.tanzu.commcellsdk.commcell.Commcell;
import org.tanzu.commcellsdk.commcell.CommcellResponse;
import org.tanzu.commcellsdk.commcell.SdkException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Base class for features whose entities are listed by one GET call and looked up by
 * name.
 *
 * The list is read on first access and kept until {@link #refresh()}. Keys are stored
 * lower-cased, so every lookup is case-insensitive.
 *
 * @param <T> the entity wrapper returned by {@link #get(String)}
 */
public abstract class NamedEntityCollection<T> implements Lister<JsonNode>, Fetcher<T> {

    private static final Logger logger = LoggerFactory.getLogger(NamedEntityCollection.class);

    protected final Commcell commcell;

    private volatile Map<String, JsonNode> entries;

    protected NamedEntityCollection(Commcell commcell) {
        this.commcell = commcell;
    }

    /**
     * Reads the full entity list from the server. Keys may be in any case.
     */
    protected abstract Map<String, JsonNode> fetchAll();

    /**
     * Wraps one entry of the list.
     *
     * @param name lower-cased entity name
     * @param properties the summary properties from the list
     */
    protected abstract T wrap(String name, JsonNode properties);

    /**
     * Module name used for this feature's exceptions.
     */
    protected abstract String module();

    protected SdkException notFound(String name) {
        return new SdkException(module(), "102", "No " + entityLabel() + " exists with name: " + name);
    }

    protected String entityLabel() {
        return "entity";
    }

    @Override
    public Map<String, JsonNode> all() {
        Map<String, JsonNode> current = entries;
        if (current == null) {
            synchronized (this) {
                if (entries == null) {
                    entries = load();
                }
                current = entries;
            }
        }
        return current;
    }

    @Override
    public void refresh() {
        Map<String, JsonNode> loaded = load();
        synchronized (this) {
            entries = loaded;
        }
    }

    private Map<String, JsonNode> load() {
        Map<String, JsonNode> fetched = fetchAll();
        Map<String, JsonNode> normalized = new LinkedHashMap<>();
        fetched.forEach((name, properties) -> normalized.put(normalize(name), properties));
        logger.debug("Loaded {} {} entries", normalized.size(), getClass().getSimpleName());
        return Collections.unmodifiableMap(normalized);
    }

    @Override
    public boolean has(String name) {
        requireName(name);
        return all().containsKey(normalize(name));
    }

    @Override
    public T get(String name) {
        requireName(name);
        JsonNode properties = all().get(normalize(name));
        if (properties == null) {
            throw notFound(name);
        }
        return wrap(normalize(name), properties);
    }

    protected void requireName(String name) {
        if (name == null || name.trim().isEmpty()) {
            throw new SdkException(module(), "101");
        }
    }

    public static String normalize(String name) {
        return name.toLowerCase(Locale.ROOT);
    }

    // Request helpers shared by the feature clients

    protected JsonNode getJson(String url, String module, String errorId) {
        CommcellResponse response = commcell.transport().makeRequest(HttpMethod.GET, url);
        return commcell.classifier().classify(response).orThrow(module, errorId);
    }

    protected JsonNode send(HttpMethod method, String url, Object payload, String module, String errorId) {
        CommcellResponse response = commcell.transport().makeRequest(method, url, payload);
        return commcell.classifier().classify(response).orThrow(module, errorId);
    }
}
