package com.architekt.core.persistence;

import com.architekt.core.model.DomainAggregate;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Repository keeping aggregates in process memory. Contents are lost on exit.
 *
 * <p>Aggregates are immutable, so stored values are shared without copying.
 */
public class InMemoryAggregateRepository implements AggregateRepository {

    private final Map<String, DomainAggregate> aggregates = new ConcurrentHashMap<>();

    @Override
    public DomainAggregate load(String userId) {
        return aggregates.getOrDefault(userId, DomainAggregate.empty());
    }

    @Override
    public void save(String userId, DomainAggregate aggregate) {
        aggregates.put(userId, Objects.requireNonNull(aggregate, "aggregate must not be null"));
    }
}
