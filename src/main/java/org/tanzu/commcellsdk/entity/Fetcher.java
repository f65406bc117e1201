package org.tanzu.commcellsdk.entity;

/**
 * A feature that can look up one entity by name. Lookups ignore case.
 *
 * @param <T> the entity wrapper type
 */
public interface Fetcher<T> {

    boolean has(String name);

    /**
     * @throws org.tanzu.commcellsdk.commcell.SdkException when no entity has that name
     */
    T get(String name);
}
