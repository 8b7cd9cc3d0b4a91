package com.architekt.core.store;

import com.architekt.core.attribute.AttributeSchemaValidator;
import com.architekt.core.attribute.AttributeTree;
import com.architekt.core.component.EntryPointValidator;
import com.architekt.core.config.ArchitektConfig.CyclePolicy;
import com.architekt.core.config.ArchitektConfig.FlowConfig;
import com.architekt.core.error.NotFoundException;
import com.architekt.core.error.ValidationException;
import com.architekt.core.flow.AlternateFlowCycleDetector;
import com.architekt.core.flow.FlowValidationResult;
import com.architekt.core.flow.FlowValidator;
import com.architekt.core.model.Component;
import com.architekt.core.model.DataModel;
import com.architekt.core.model.DomainAggregate;
import com.architekt.core.model.EntryPoint;
import com.architekt.core.model.Flow;
import com.architekt.core.model.Project;
import com.architekt.core.model.Step;
import com.architekt.core.model.SystemNode;
import com.architekt.core.persistence.AggregateRepository;
import com.architekt.core.system.SystemTree;
import com.architekt.core.util.IdGenerator;
import com.architekt.core.util.Immutables;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Entry point of the consistency engine: every read and mutation of a project aggregate goes
 * through this store.
 *
 * <p>Each mutation loads the caller's aggregate, applies exactly one structural change to an
 * immutable copy, validates the result and saves the whole aggregate back. Nothing is saved
 * when validation fails, and the loaded value is never modified.
 *
 * <p>Mutations for the same user id are serialized by an in-process lock held from load to
 * save. There is no version check and no coordination across processes.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ProjectAggregateStore store = new ProjectAggregateStore(new InMemoryAggregateRepository());
 * Project project = store.createProject(userId, ProjectInput.named("Shop"));
 * SystemNode billing = store.createSystem(userId, project.id(), SystemInput.under(null, "Billing"));
 * }</pre>
 */
public class ProjectAggregateStore {

    private static final Logger log = LoggerFactory.getLogger(ProjectAggregateStore.class);

    private final AggregateRepository repository;
    private final FlowValidator flowValidator;
    private final FlowConfig flowConfig;
    // One lock per user id seen by this instance; never evicted.
    private final Map<String, ReentrantLock> userLocks = new ConcurrentHashMap<>();

    public ProjectAggregateStore(AggregateRepository repository) {
        this(repository, FlowConfig.defaults());
    }

    public ProjectAggregateStore(AggregateRepository repository, FlowConfig flowConfig) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.flowConfig = Objects.requireNonNull(flowConfig, "flowConfig must not be null");
        this.flowValidator = new FlowValidator();
    }

    // ------------------------------------------------------------------ projects

    public List<Project> listProjects(String userId) {
        return List.copyOf(repository.load(userId).projects().values());
    }

    public Project getProject(String userId, String projectId) {
        return requireProject(repository.load(userId), projectId);
    }

    /**
     * Creates a project together with its root system, which takes the project's name.
     *
     * @param userId caller
     * @param input project fields; the name is required
     * @return created project
     * @throws ValidationException if the name is blank
     */
    public Project createProject(String userId, ProjectInput input) {
        String name = requireName(input.name(), "Project name is required");
        Project project = Project.withRoot(IdGenerator.newId(), name, input.description(), input.tags(),
            SystemNode.root(IdGenerator.newId(), name, input.description()));
        return mutateAggregate(userId, aggregate -> {
            log.debug("Creating project {} ({}) for user {}", project.id(), name, userId);
            return new AggregateChange<>(aggregate.withProject(project), project);
        });
    }

    /**
     * Updates a project's details. Blank or null fields keep their previous values.
     *
     * @param userId caller
     * @param projectId project id
     * @param input new fields
     * @return updated project
     * @throws NotFoundException if the project does not exist
     */
    public Project updateProject(String userId, String projectId, ProjectInput input) {
        return mutateProject(userId, projectId, project -> {
            String name = Immutables.isBlank(input.name()) ? project.name() : input.name().trim();
            String description = input.description() == null ? project.description() : input.description();
            List<String> tags = input.tags() == null ? project.tags() : input.tags();
            Project updated = project.withDetails(name, description, tags);
            return new ProjectChange<>(updated, updated);
        });
    }

    public void deleteProject(String userId, String projectId) {
        mutateAggregate(userId, aggregate -> {
            requireProject(aggregate, projectId);
            log.debug("Deleting project {} for user {}", projectId, userId);
            return new AggregateChange<Void>(aggregate.withoutProject(projectId), null);
        });
    }

    // ------------------------------------------------------------------ systems

    public List<SystemNode> listSystems(String userId, String projectId) {
        return List.copyOf(getProject(userId, projectId).systems().values());
    }

    public SystemNode getSystem(String userId, String projectId, String systemId) {
        return require(getProject(userId, projectId).systems(), systemId, "System");
    }

    /**
     * Adds a system under a parent.
     *
     * @param userId caller
     * @param projectId project id
     * @param input system fields; a null parent id selects the root system
     * @return created system
     * @throws NotFoundException if the project or parent does not exist
     * @throws ValidationException if the name is blank
     */
    public SystemNode createSystem(String userId, String projectId, SystemInput input) {
        String name = requireName(input.name(), "System name is required");
        return mutateProject(userId, projectId, project -> {
            String parentId = input.parentId() == null ? project.rootSystemId() : input.parentId();
            SystemNode system = SystemNode.leaf(IdGenerator.newId(), name, input.description(), input.tags());
            Project updated = SystemTree.add(project, parentId, system);
            log.debug("Added system {} under {} in project {}", system.id(), parentId, projectId);
            return new ProjectChange<>(updated, updated.systems().get(system.id()));
        });
    }

    /**
     * Updates a system's name, description and tags. Null description or tags keep their
     * previous values, and the position in the tree is kept.
     *
     * @param userId caller
     * @param projectId project id
     * @param systemId system id
     * @param input new fields; the name is required
     * @return updated system
     */
    public SystemNode updateSystem(String userId, String projectId, String systemId, SystemInput input) {
        String name = requireName(input.name(), "System name is required");
        return mutateProject(userId, projectId, project -> {
            SystemNode existing = require(project.systems(), systemId, "System");
            String description = input.description() == null ? existing.description() : input.description();
            List<String> tags = input.tags() == null ? existing.tags() : input.tags();
            SystemNode updated = existing.withDetails(name, description, tags);
            return new ProjectChange<>(project.withSystems(Immutables.with(project.systems(), systemId, updated)), updated);
        });
    }

    /**
     * Deletes a system and its whole subtree.
     *
     * @param userId caller
     * @param projectId project id
     * @param systemId system id
     * @throws ValidationException if the system is the root
     */
    public void deleteSystem(String userId, String projectId, String systemId) {
        mutateProject(userId, projectId, project -> {
            Project updated = SystemTree.remove(project, systemId);
            log.debug("Removed {} systems from project {}",
                project.systems().size() - updated.systems().size(), projectId);
            return new ProjectChange<Void>(updated, null);
        });
    }

    // ------------------------------------------------------------------ flows

    public List<Flow> listFlows(String userId, String projectId, FlowFilter filter) {
        FlowFilter criteria = filter == null ? FlowFilter.none() : filter;
        return getProject(userId, projectId).flows().values().stream()
            .filter(criteria::matches)
            .toList();
    }

    public Flow getFlow(String userId, String projectId, String flowId) {
        return require(getProject(userId, projectId).flows(), flowId, "Flow");
    }

    /**
     * Validates a flow draft without saving it.
     *
     * @param userId caller
     * @param projectId project id
     * @param draft flow draft
     * @return validation result
     */
    public FlowValidationResult validateFlow(String userId, String projectId, Flow draft) {
        return flowValidator.validate(draft, getProject(userId, projectId));
    }

    /**
     * Creates a flow.
     *
     * @param userId caller
     * @param projectId project id
     * @param draft flow document; its id and step ids are ignored
     * @return saved flow
     * @throws ValidationException carrying the {@link FlowValidationResult} if the draft is invalid
     */
    public Flow createFlow(String userId, String projectId, Flow draft) {
        return mutateProject(userId, projectId, project -> {
            Flow flow = saveFlow(project, draft.withId(IdGenerator.newId()), null);
            return new ProjectChange<>(project.withFlows(flowsWith(project, flow)), flow);
        });
    }

    /**
     * Replaces a flow document. Steps whose id existed in the previous version keep it.
     *
     * @param userId caller
     * @param projectId project id
     * @param flowId flow id
     * @param draft new flow document
     * @return saved flow
     * @throws NotFoundException if the flow does not exist
     * @throws ValidationException carrying the {@link FlowValidationResult} if the draft is invalid
     */
    public Flow updateFlow(String userId, String projectId, String flowId, Flow draft) {
        return mutateProject(userId, projectId, project -> {
            Flow existing = require(project.flows(), flowId, "Flow");
            Flow flow = saveFlow(project, draft.withId(flowId), existing);
            return new ProjectChange<>(project.withFlows(flowsWith(project, flow)), flow);
        });
    }

    /**
     * Deletes a flow and removes it from the alternate paths of every other flow.
     *
     * @param userId caller
     * @param projectId project id
     * @param flowId flow id
     */
    public void deleteFlow(String userId, String projectId, String flowId) {
        mutateProject(userId, projectId, project -> {
            require(project.flows(), flowId, "Flow");
            Map<String, Flow> flows = new LinkedHashMap<>();
            for (Flow flow : project.flows().values()) {
                if (flow.id().equals(flowId)) {
                    continue;
                }
                flows.put(flow.id(), flow.referencesAlternate(flowId) ? withoutAlternate(flow, flowId) : flow);
            }
            log.debug("Deleted flow {} from project {}", flowId, projectId);
            return new ProjectChange<Void>(project.withFlows(flows), null);
        });
    }

    private Flow saveFlow(Project project, Flow draft, Flow previous) {
        FlowValidationResult result = flowValidator.validate(draft, project);
        if (!result.isValid()) {
            throw ValidationException.forFlow(result);
        }

        Set<String> reusableStepIds = previous == null
            ? new HashSet<>()
            : previous.steps().stream().map(Step::id).filter(Objects::nonNull).collect(Collectors.toCollection(HashSet::new));
        List<Step> steps = draft.steps().stream()
            .map(step -> step.withId(claimId(reusableStepIds, step.id())).withName(step.name().trim()))
            .toList();
        List<String> scope = draft.systemScopeIds().stream()
            .filter(project.systems()::containsKey)
            .toList();

        Flow flow = new Flow(draft.id(), draft.name().trim(), draft.description(), draft.tags(), scope, steps);
        if (flowConfig.alternateFlowCycles() == CyclePolicy.REJECT) {
            rejectCycles(project, flowsWith(project, flow));
        }
        return flow;
    }

    private void rejectCycles(Project project, Map<String, Flow> flows) {
        Optional<List<String>> cycle = AlternateFlowCycleDetector.findCycle(flows);
        if (cycle.isPresent()) {
            String path = cycle.get().stream()
                .map(id -> flows.get(id).name())
                .collect(Collectors.joining(" -> "));
            log.debug("Rejecting alternate flow cycle in project {}: {}", project.id(), path);
            throw ValidationException.of("Alternate flows form a cycle: " + path);
        }
    }

    private static Map<String, Flow> flowsWith(Project project, Flow flow) {
        return Immutables.with(project.flows(), flow.id(), flow);
    }

    private static Flow withoutAlternate(Flow flow, String flowId) {
        return flow.withSteps(flow.steps().stream()
            .map(step -> step.withAlternateFlowIds(step.alternateFlowIds().stream()
                .filter(id -> !id.equals(flowId))
                .toList()))
            .toList());
    }

    // ------------------------------------------------------------------ data models

    public List<DataModel> listDataModels(String userId, String projectId) {
        return List.copyOf(getProject(userId, projectId).dataModels().values());
    }

    public DataModel getDataModel(String userId, String projectId, String dataModelId) {
        return require(getProject(userId, projectId).dataModels(), dataModelId, "DataModel");
    }

    /**
     * Creates a data model. Attributes without an id receive one.
     *
     * @param userId caller
     * @param projectId project id
     * @param draft data model document; its id is ignored
     * @return saved data model
     * @throws ValidationException if the name is blank or the attribute schema is invalid
     */
    public DataModel createDataModel(String userId, String projectId, DataModel draft) {
        DataModel model = prepareDataModel(IdGenerator.newId(), draft);
        return mutateProject(userId, projectId, project ->
            new ProjectChange<>(project.withDataModels(Immutables.with(project.dataModels(), model.id(), model)), model));
    }

    public DataModel updateDataModel(String userId, String projectId, String dataModelId, DataModel draft) {
        DataModel model = prepareDataModel(dataModelId, draft);
        return mutateProject(userId, projectId, project -> {
            require(project.dataModels(), dataModelId, "DataModel");
            return new ProjectChange<>(project.withDataModels(Immutables.with(project.dataModels(), dataModelId, model)), model);
        });
    }

    /**
     * Deletes a data model and removes it from every entry point's request and response models.
     *
     * @param userId caller
     * @param projectId project id
     * @param dataModelId data model id
     */
    public void deleteDataModel(String userId, String projectId, String dataModelId) {
        mutateProject(userId, projectId, project -> {
            require(project.dataModels(), dataModelId, "DataModel");
            Map<String, EntryPoint> entryPoints = new LinkedHashMap<>();
            project.entryPoints().forEach((id, entryPoint) -> entryPoints.put(id, entryPoint.withModelIds(
                entryPoint.requestModelIds().stream().filter(modelId -> !modelId.equals(dataModelId)).toList(),
                entryPoint.responseModelIds().stream().filter(modelId -> !modelId.equals(dataModelId)).toList())));
            Project updated = project
                .withDataModels(Immutables.without(project.dataModels(), List.of(dataModelId)))
                .withEntryPoints(entryPoints);
            return new ProjectChange<Void>(updated, null);
        });
    }

    private static DataModel prepareDataModel(String id, DataModel draft) {
        String name = requireName(draft.name(), "Data model name is required");
        List<String> errors = AttributeSchemaValidator.validate(draft.attributes());
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return new DataModel(id, name, draft.description(), AttributeTree.assignIds(draft.attributes()));
    }

    // ------------------------------------------------------------------ components

    public List<Component> listComponents(String userId, String projectId) {
        return List.copyOf(getProject(userId, projectId).components().values());
    }

    public Component getComponent(String userId, String projectId, String componentId) {
        return require(getProject(userId, projectId).components(), componentId, "Component");
    }

    /**
     * Creates a component with its entry points.
     *
     * @param userId caller
     * @param projectId project id
     * @param input component fields and entry point drafts
     * @return saved component
     * @throws ValidationException if the name is blank or an entry point is invalid
     */
    public Component createComponent(String userId, String projectId, ComponentInput input) {
        String name = requireName(input.name(), "Component name is required");
        return mutateProject(userId, projectId, project ->
            saveComponent(project, new Component(IdGenerator.newId(), name, input.description(), List.of()),
                input.entryPoints()));
    }

    /**
     * Replaces a component and its full list of entry points.
     *
     * @param userId caller
     * @param projectId project id
     * @param componentId component id
     * @param input component fields and entry point drafts
     * @return saved component
     */
    public Component updateComponent(String userId, String projectId, String componentId, ComponentInput input) {
        String name = requireName(input.name(), "Component name is required");
        return mutateProject(userId, projectId, project -> {
            Component existing = require(project.components(), componentId, "Component");
            return saveComponent(project, new Component(componentId, name, input.description(), existing.entryPointIds()),
                input.entryPoints());
        });
    }

    /**
     * Deletes a component and every entry point it owns.
     *
     * @param userId caller
     * @param projectId project id
     * @param componentId component id
     */
    public void deleteComponent(String userId, String projectId, String componentId) {
        mutateProject(userId, projectId, project -> {
            Component component = require(project.components(), componentId, "Component");
            Project updated = project.withComponents(
                Immutables.without(project.components(), List.of(componentId)),
                Immutables.without(project.entryPoints(), component.entryPointIds()));
            return new ProjectChange<Void>(updated, null);
        });
    }

    private ProjectChange<Component> saveComponent(Project project, Component component, List<EntryPoint> drafts) {
        List<String> errors = new ArrayList<>();
        for (int i = 0; i < drafts.size(); i++) {
            String prefix = "Entry point " + (i + 1) + ": ";
            EntryPointValidator.validate(drafts.get(i), project).forEach(error -> errors.add(prefix + error));
        }
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }

        Map<String, EntryPoint> entryPoints = new LinkedHashMap<>(
            Immutables.without(project.entryPoints(), component.entryPointIds()));
        Set<String> reusableIds = new HashSet<>(component.entryPointIds());
        List<String> entryPointIds = new ArrayList<>();
        for (EntryPoint draft : drafts) {
            String id = claimId(reusableIds, draft.id());
            entryPoints.put(id, prepareEntryPoint(id, draft));
            entryPointIds.add(id);
        }

        Component saved = component.withEntryPointIds(entryPointIds);
        Project updated = project.withComponents(Immutables.with(project.components(), saved.id(), saved), entryPoints);
        log.debug("Saved component {} with {} entry points in project {}", saved.id(), entryPointIds.size(), project.id());
        return new ProjectChange<>(updated, saved);
    }

    // ------------------------------------------------------------------ entry points

    public List<EntryPoint> listEntryPoints(String userId, String projectId, String componentId) {
        Project project = getProject(userId, projectId);
        Component component = require(project.components(), componentId, "Component");
        return component.entryPointIds().stream()
            .map(project.entryPoints()::get)
            .filter(Objects::nonNull)
            .toList();
    }

    public EntryPoint getEntryPoint(String userId, String projectId, String componentId, String entryPointId) {
        Project project = getProject(userId, projectId);
        return requireOwnedEntryPoint(project, require(project.components(), componentId, "Component"), entryPointId);
    }

    /**
     * Adds an entry point to a component.
     *
     * @param userId caller
     * @param projectId project id
     * @param componentId owning component id
     * @param draft entry point draft; its id is ignored
     * @return saved entry point
     * @throws ValidationException if the entry point is invalid
     */
    public EntryPoint createEntryPoint(String userId, String projectId, String componentId, EntryPoint draft) {
        return mutateProject(userId, projectId, project -> {
            Component component = require(project.components(), componentId, "Component");
            EntryPoint entryPoint = validEntryPoint(project, IdGenerator.newId(), draft);
            List<String> entryPointIds = new ArrayList<>(component.entryPointIds());
            entryPointIds.add(entryPoint.id());
            return new ProjectChange<>(withEntryPoint(project, component.withEntryPointIds(entryPointIds), entryPoint),
                entryPoint);
        });
    }

    public EntryPoint updateEntryPoint(String userId, String projectId, String componentId,
                                      String entryPointId, EntryPoint draft) {
        return mutateProject(userId, projectId, project -> {
            Component component = require(project.components(), componentId, "Component");
            requireOwnedEntryPoint(project, component, entryPointId);
            EntryPoint entryPoint = validEntryPoint(project, entryPointId, draft);
            return new ProjectChange<>(withEntryPoint(project, component, entryPoint), entryPoint);
        });
    }

    public void deleteEntryPoint(String userId, String projectId, String componentId, String entryPointId) {
        mutateProject(userId, projectId, project -> {
            Component component = require(project.components(), componentId, "Component");
            requireOwnedEntryPoint(project, component, entryPointId);
            Component updatedComponent = component.withEntryPointIds(component.entryPointIds().stream()
                .filter(id -> !id.equals(entryPointId))
                .toList());
            Project updated = project.withComponents(
                Immutables.with(project.components(), componentId, updatedComponent),
                Immutables.without(project.entryPoints(), List.of(entryPointId)));
            return new ProjectChange<Void>(updated, null);
        });
    }

    private static EntryPoint validEntryPoint(Project project, String id, EntryPoint draft) {
        List<String> errors = EntryPointValidator.validate(draft, project);
        if (!errors.isEmpty()) {
            throw new ValidationException(errors);
        }
        return prepareEntryPoint(id, draft);
    }

    private static EntryPoint prepareEntryPoint(String id, EntryPoint draft) {
        return new EntryPoint(id, draft.name().trim(), draft.description(), draft.type().trim(),
            Immutables.trimToNull(draft.functionName()), Immutables.trimToNull(draft.protocol()),
            Immutables.trimToNull(draft.method()), Immutables.trimToNull(draft.path()),
            draft.requestModelIds(), draft.responseModelIds(),
            AttributeTree.assignIds(draft.requestAttributes()), AttributeTree.assignIds(draft.responseAttributes()));
    }

    private static Project withEntryPoint(Project project, Component component, EntryPoint entryPoint) {
        return project.withComponents(
            Immutables.with(project.components(), component.id(), component),
            Immutables.with(project.entryPoints(), entryPoint.id(), entryPoint));
    }

    private static EntryPoint requireOwnedEntryPoint(Project project, Component component, String entryPointId) {
        EntryPoint entryPoint = project.entryPoints().get(entryPointId);
        if (entryPoint == null || !component.entryPointIds().contains(entryPointId)) {
            throw new NotFoundException("EntryPoint", entryPointId);
        }
        return entryPoint;
    }

    // ------------------------------------------------------------------ protocol

    private <T> T mutateProject(String userId, String projectId, Function<Project, ProjectChange<T>> mutation) {
        return mutateAggregate(userId, aggregate -> {
            ProjectChange<T> change = mutation.apply(requireProject(aggregate, projectId));
            return new AggregateChange<>(aggregate.withProject(change.project()), change.result());
        });
    }

    private <T> T mutateAggregate(String userId, Function<DomainAggregate, AggregateChange<T>> mutation) {
        Objects.requireNonNull(userId, "userId must not be null");
        ReentrantLock lock = userLocks.computeIfAbsent(userId, key -> new ReentrantLock());
        lock.lock();
        try {
            DomainAggregate loaded = repository.load(userId);
            AggregateChange<T> change = mutation.apply(loaded);
            repository.save(userId, change.aggregate());
            return change.result();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns {@code candidate} if it is still unclaimed in {@code reusable} and claims it,
     * otherwise a new id. Each reusable id is handed out at most once.
     */
    private static String claimId(Set<String> reusable, String candidate) {
        return candidate != null && reusable.remove(candidate) ? candidate : IdGenerator.newId();
    }

    private static Project requireProject(DomainAggregate aggregate, String projectId) {
        return require(aggregate.projects(), projectId, "Project");
    }

    private static <V> V require(Map<String, V> values, String id, String entityType) {
        V value = id == null ? null : values.get(id);
        if (value == null) {
            throw new NotFoundException(entityType, id);
        }
        return value;
    }

    private static String requireName(String name, String message) {
        if (Immutables.isBlank(name)) {
            throw ValidationException.of(message);
        }
        return name.trim();
    }

    private record AggregateChange<T>(DomainAggregate aggregate, T result) {
    }

    private record ProjectChange<T>(Project project, T result) {
    }
}
