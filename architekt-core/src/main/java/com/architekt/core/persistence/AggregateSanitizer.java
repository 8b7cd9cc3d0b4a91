package com.architekt.core.persistence;

import com.architekt.core.model.Component;
import com.architekt.core.model.DataModel;
import com.architekt.core.model.DomainAggregate;
import com.architekt.core.model.EntryPoint;
import com.architekt.core.model.Flow;
import com.architekt.core.model.Project;
import com.architekt.core.model.SystemNode;
import com.architekt.core.util.Immutables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Drops malformed entries from a loaded aggregate.
 *
 * <p>Entries without an id or a name are removed and map keys are realigned with entity ids.
 * Projects whose root system is missing are removed. Child and entry point references to
 * missing entities are dropped.
 */
public final class AggregateSanitizer {

    private static final Logger log = LoggerFactory.getLogger(AggregateSanitizer.class);

    private AggregateSanitizer() {
        // Utility class
    }

    /**
     * Sanitizes an aggregate.
     *
     * @param aggregate loaded aggregate
     * @return aggregate containing only well-formed entries
     */
    public static DomainAggregate sanitize(DomainAggregate aggregate) {
        Map<String, Project> projects = new LinkedHashMap<>();
        for (Project project : aggregate.projects().values()) {
            if (Immutables.isBlank(project.id()) || Immutables.isBlank(project.name())
                || Immutables.isBlank(project.rootSystemId())) {
                log.warn("Dropping project without id, name or root system: {}", project.id());
                continue;
            }
            Project sanitized = sanitize(project);
            if (sanitized.rootSystem() == null) {
                log.warn("Dropping project {} whose root system {} is missing", project.id(), project.rootSystemId());
                continue;
            }
            projects.put(sanitized.id(), sanitized);
        }
        return new DomainAggregate(projects);
    }

    private static Project sanitize(Project project) {
        Map<String, SystemNode> systems = rekey(project.systems(),
            system -> !Immutables.isBlank(system.id()) && !Immutables.isBlank(system.name()), SystemNode::id);
        systems.replaceAll((id, system) -> system.withChildIds(
            system.childIds().stream().filter(systems::containsKey).toList()));

        Map<String, EntryPoint> entryPoints = rekey(project.entryPoints(),
            entryPoint -> !Immutables.isBlank(entryPoint.id()) && !Immutables.isBlank(entryPoint.name()),
            EntryPoint::id);
        Map<String, Component> components = rekey(project.components(),
            component -> !Immutables.isBlank(component.id()) && !Immutables.isBlank(component.name()), Component::id);
        components.replaceAll((id, component) -> component.withEntryPointIds(
            component.entryPointIds().stream().filter(entryPoints::containsKey).toList()));

        return project
            .withSystems(systems)
            .withFlows(rekey(project.flows(),
                flow -> !Immutables.isBlank(flow.id()) && !Immutables.isBlank(flow.name()), Flow::id))
            .withDataModels(rekey(project.dataModels(),
                model -> !Immutables.isBlank(model.id()) && !Immutables.isBlank(model.name()), DataModel::id))
            .withComponents(components, entryPoints);
    }

    private static <V> Map<String, V> rekey(Map<String, V> values, Predicate<V> valid, Function<V, String> idOf) {
        Map<String, V> result = new LinkedHashMap<>();
        for (V value : values.values()) {
            if (valid.test(value)) {
                result.put(idOf.apply(value), value);
            } else {
                log.warn("Dropping malformed entry: {}", value);
            }
        }
        return result;
    }
}
