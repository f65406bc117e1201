package org.tanzu.commcellsdk.commcell;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Endpoint URL templates resolved against one web service base URL.
 * Built once per session and never modified.
 */
public final class Services {

    private final String webServiceUrl;
    private final Map<Endpoint, String> templates;

    public Services(String webServiceUrl) {
        this.webServiceUrl = webServiceUrl.endsWith("/") ? webServiceUrl : webServiceUrl + "/";
        Map<Endpoint, String> resolved = new EnumMap<>(Endpoint.class);
        for (Endpoint endpoint : Endpoint.values()) {
            resolved.put(endpoint, this.webServiceUrl + endpoint.getTemplate());
        }
        this.templates = Collections.unmodifiableMap(resolved);
    }

    public String webServiceUrl() {
        return webServiceUrl;
    }

    /**
     * Full URL of an endpoint with its {@code %s} placeholders filled in order.
     */
    public String url(Endpoint endpoint, Object... args) {
        String template = templates.get(endpoint);
        return args.length == 0 ? template : String.format(template, args);
    }

    /**
     * Full URL for a path relative to the web service base URL.
     */
    public String resolve(String relativePath) {
        String path = relativePath.startsWith("/") ? relativePath.substring(1) : relativePath;
        return webServiceUrl + path;
    }
}
