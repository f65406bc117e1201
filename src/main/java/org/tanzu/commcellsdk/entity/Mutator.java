package org.tanzu.commcellsdk.entity;

/**
 * A feature that can create and delete entities.
 *
 * @param <T> the entity wrapper type
 * @param <S> the creation request type
 */
public interface Mutator<T, S> {

    T add(S spec);

    void delete(String name);
}
