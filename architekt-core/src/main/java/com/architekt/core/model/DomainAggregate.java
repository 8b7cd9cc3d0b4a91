package com.architekt.core.model;

import com.architekt.core.util.Immutables;

import java.util.List;
import java.util.Map;

/**
 * Every project visible to one user, loaded and saved as a single document.
 *
 * @param projects projects by id
 */
public record DomainAggregate(Map<String, Project> projects) {

    /**
     * Compact constructor with defaults.
     */
    public DomainAggregate {
        projects = Immutables.orderedMap(projects);
    }

    /**
     * Creates an aggregate with no projects.
     *
     * @return empty aggregate
     */
    public static DomainAggregate empty() {
        return new DomainAggregate(Map.of());
    }

    public DomainAggregate withProject(Project project) {
        return new DomainAggregate(Immutables.with(projects, project.id(), project));
    }

    public DomainAggregate withoutProject(String projectId) {
        return new DomainAggregate(Immutables.without(projects, List.of(projectId)));
    }
}
