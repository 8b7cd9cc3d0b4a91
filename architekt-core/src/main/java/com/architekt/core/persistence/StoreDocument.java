package com.architekt.core.persistence;

import com.architekt.core.model.DomainAggregate;
import com.architekt.core.util.Immutables;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * On-disk layout of the file-system repository: one aggregate per user id.
 *
 * @param aggregates aggregates by user id
 */
public record StoreDocument(@JsonProperty("aggregates") Map<String, DomainAggregate> aggregates) {

    /**
     * Compact constructor with defaults.
     */
    public StoreDocument {
        aggregates = Immutables.orderedMap(aggregates);
    }

    public static StoreDocument empty() {
        return new StoreDocument(Map.of());
    }

    public StoreDocument with(String userId, DomainAggregate aggregate) {
        return new StoreDocument(Immutables.with(aggregates, userId, aggregate));
    }
}
