package com.architekt.cli;

import com.architekt.core.model.Component;
import com.architekt.core.model.EntryPoint;
import com.architekt.core.store.ComponentInput;
import com.architekt.core.store.ProjectAggregateStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Commands to list, save and delete components with their entry points.
 *
 * <p>Components are read from JSON documents listing every entry point:
 * <pre>{@code
 * {
 *   "name": "Orders",
 *   "entryPoints": [
 *     {"name": "Create order", "type": "http", "protocol": "HTTPS", "method": "post", "path": "/orders"}
 *   ]
 * }
 * }</pre>
 */
@Command(
    name = "component",
    description = "List, save and delete components",
    mixinStandardHelpOptions = true,
    subcommands = {
        ComponentCommand.ListCommand.class,
        ComponentCommand.SaveCommand.class,
        ComponentCommand.DeleteCommand.class
    }
)
public class ComponentCommand extends GroupCommand {

    @Command(name = "list", description = "List components and their entry points", mixinStandardHelpOptions = true)
    static class ListCommand extends ProjectScopedCommand {

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            List<Component> components = store.listComponents(userId, projectId);
            PrintWriter out = out();
            out.println("Components:");
            out.println();
            if (components.isEmpty()) {
                out.println("  No components found.");
            }
            for (Component component : components) {
                out.printf("  • %s (ID: %s)%n", component.name(), component.id());
                for (EntryPoint entryPoint : store.listEntryPoints(userId, projectId, component.id())) {
                    out.printf("    - %s [%s] %s %s %s (ID: %s)%n", entryPoint.name(), entryPoint.type(),
                        orDash(entryPoint.protocol()), orDash(entryPoint.method()), orDash(entryPoint.path()),
                        entryPoint.id());
                }
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "save", description = "Create a component, or replace it when --id is given",
        mixinStandardHelpOptions = true)
    static class SaveCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Component JSON file")
        private Path file;

        @Option(names = {"--id"}, description = "Component id to replace")
        private String componentId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            ComponentInput input = readDocument(file, ComponentInput.class);
            Component saved = componentId == null
                ? store.createComponent(userId, projectId, input)
                : store.updateComponent(userId, projectId, componentId, input);
            out().printf("✓ Saved component %s (ID: %s) with %d entry point(s)%n",
                saved.name(), saved.id(), saved.entryPointIds().size());
            return ExitCodes.OK;
        }
    }

    @Command(name = "delete", description = "Delete a component and its entry points", mixinStandardHelpOptions = true)
    static class DeleteCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Component id")
        private String componentId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            store.deleteComponent(userId, projectId, componentId);
            out().printf("✓ Deleted component %s%n", componentId);
            return ExitCodes.OK;
        }
    }
}
