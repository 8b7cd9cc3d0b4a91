package com.architekt.core.persistence;

import com.architekt.core.model.DomainAggregate;

/**
 * Loads and saves the whole project aggregate of one user.
 *
 * <p>The user id is an opaque key supplied by the caller's authorization layer; repositories
 * only use it to partition storage. Every save replaces the complete document.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DomainAggregate aggregate = repository.load(userId);
 * repository.save(userId, aggregate.withProject(project));
 * }</pre>
 */
public interface AggregateRepository {

    /**
     * Loads the aggregate of a user.
     *
     * @param userId opaque user id
     * @return stored aggregate, or {@link DomainAggregate#empty()} if nothing is stored
     * @throws IllegalStateException if the storage cannot be read
     */
    DomainAggregate load(String userId);

    /**
     * Replaces the stored aggregate of a user.
     *
     * @param userId opaque user id
     * @param aggregate aggregate to store
     * @throws IllegalStateException if the storage cannot be written
     */
    void save(String userId, DomainAggregate aggregate);
}
