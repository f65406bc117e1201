package org.tanzu.commcellsdk.entity;

import java.util.Map;

/**
 * A feature that can list every entity it knows about.
 *
 * @param <P> the per-entity summary type
 */
public interface Lister<P> {

    /**
     * All entities from the last refresh, keyed by lower-cased name.
     */
    Map<String, P> all();

    /**
     * Re-reads the entity list from the server.
     */
    void refresh();
}
