package com.architekt.cli;

import com.architekt.core.flow.FlowValidationResult;
import com.architekt.core.model.Flow;
import com.architekt.core.store.FlowFilter;
import com.architekt.core.store.ProjectAggregateStore;
import com.architekt.core.util.Tags;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Commands to list, validate, save and delete flows.
 *
 * <p>Flows are read from JSON documents:
 * <pre>{@code
 * {
 *   "name": "Checkout",
 *   "systemScopeIds": ["<webId>", "<apiId>"],
 *   "steps": [
 *     {
 *       "name": "Submit order",
 *       "source": {"kind": "system", "systemId": "<webId>"},
 *       "target": {"kind": "entryPoint", "componentId": "<componentId>", "entryPointId": "<entryPointId>"}
 *     }
 *   ]
 * }
 * }</pre>
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * architekt flow list -p <projectId> --scope <systemId> --tags checkout
 * architekt flow validate -p <projectId> checkout.json
 * architekt flow save -p <projectId> checkout.json
 * architekt flow save -p <projectId> checkout.json --id <flowId>
 * architekt flow delete -p <projectId> <flowId>
 * }</pre>
 */
@Command(
    name = "flow",
    description = "List, validate, save and delete flows",
    mixinStandardHelpOptions = true,
    subcommands = {
        FlowCommand.ListCommand.class,
        FlowCommand.ValidateCommand.class,
        FlowCommand.SaveCommand.class,
        FlowCommand.DeleteCommand.class
    }
)
public class FlowCommand extends GroupCommand {

    @Command(name = "list", description = "List flows", mixinStandardHelpOptions = true)
    static class ListCommand extends ProjectScopedCommand {

        @Option(names = {"--scope"}, description = "Only flows whose scope contains this system id")
        private String scopeSystemId;

        @Option(names = {"-t", "--tags"}, description = "Only flows carrying all of these comma-separated tags")
        private String tags;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            List<Flow> flows = store.listFlows(userId, projectId, new FlowFilter(scopeSystemId, Tags.split(tags)));
            PrintWriter out = out();
            out.println("Flows:");
            out.println();
            if (flows.isEmpty()) {
                out.println("  No flows found.");
            }
            for (Flow flow : flows) {
                out.printf("  • %s (ID: %s)%n", flow.name(), flow.id());
                out.printf("    Steps: %d, Scope: %d system(s)%n", flow.steps().size(), flow.systemScopeIds().size());
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "validate", description = "Validate a flow document without saving it",
        mixinStandardHelpOptions = true)
    static class ValidateCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Flow JSON file")
        private Path file;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            FlowValidationResult result = store.validateFlow(userId, projectId, readDocument(file, Flow.class));
            if (result.isValid()) {
                out().println("✓ Flow is valid");
                return ExitCodes.OK;
            }
            PrintWriter err = spec.commandLine().getErr();
            result.allMessages().forEach(message -> err.println("✗ " + message));
            err.flush();
            return ExitCodes.VALIDATION;
        }
    }

    @Command(name = "save", description = "Create a flow, or replace it when an id is given",
        mixinStandardHelpOptions = true)
    static class SaveCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Flow JSON file")
        private Path file;

        @Option(names = {"--id"}, description = "Flow id to replace (default: the document's id)")
        private String flowId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            Flow draft = readDocument(file, Flow.class);
            String id = flowId != null ? flowId : draft.id();
            Flow saved = id == null
                ? store.createFlow(userId, projectId, draft)
                : store.updateFlow(userId, projectId, id, draft);
            out().printf("✓ Saved flow %s (ID: %s) with %d step(s)%n", saved.name(), saved.id(), saved.steps().size());
            return ExitCodes.OK;
        }
    }

    @Command(name = "delete", description = "Delete a flow", mixinStandardHelpOptions = true)
    static class DeleteCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Flow id")
        private String flowId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            store.deleteFlow(userId, projectId, flowId);
            out().printf("✓ Deleted flow %s%n", flowId);
            return ExitCodes.OK;
        }
    }
}
