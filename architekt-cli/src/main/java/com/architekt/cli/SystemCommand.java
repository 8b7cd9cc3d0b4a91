package com.architekt.cli;

import com.architekt.core.model.Project;
import com.architekt.core.model.SystemNode;
import com.architekt.core.store.ProjectAggregateStore;
import com.architekt.core.store.SystemInput;
import com.architekt.core.util.Tags;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;

/**
 * Commands to edit a project's system hierarchy.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * architekt system add -p <projectId> Billing
 * architekt system add -p <projectId> Invoices --parent <systemId>
 * architekt system remove -p <projectId> <systemId>
 * architekt system tree -p <projectId>
 * }</pre>
 */
@Command(
    name = "system",
    description = "Add, remove and print systems",
    mixinStandardHelpOptions = true,
    subcommands = {
        SystemCommand.AddCommand.class,
        SystemCommand.RemoveCommand.class,
        SystemCommand.TreeCommand.class
    }
)
public class SystemCommand extends GroupCommand {

    @Command(name = "add", description = "Add a system (under the root unless --parent is given)",
        mixinStandardHelpOptions = true)
    static class AddCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "System name")
        private String name;

        @Option(names = {"--parent"}, description = "Parent system id (default: root system)")
        private String parentId;

        @Option(names = {"-d", "--description"}, description = "System description")
        private String description;

        @Option(names = {"-t", "--tags"}, description = "Comma-separated tags")
        private String tags;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            SystemNode system = store.createSystem(userId, projectId,
                new SystemInput(name, description, Tags.split(tags), parentId));
            out().printf("✓ Added system %s (ID: %s)%n", system.name(), system.id());
            return ExitCodes.OK;
        }
    }

    @Command(name = "remove", description = "Remove a system and its whole subtree", mixinStandardHelpOptions = true)
    static class RemoveCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "System id")
        private String systemId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            int before = store.listSystems(userId, projectId).size();
            store.deleteSystem(userId, projectId, systemId);
            int removed = before - store.listSystems(userId, projectId).size();
            out().printf("✓ Removed %d system(s)%n", removed);
            return ExitCodes.OK;
        }
    }

    @Command(name = "tree", description = "Print the system hierarchy", mixinStandardHelpOptions = true)
    static class TreeCommand extends ProjectScopedCommand {

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            Project project = store.getProject(userId, projectId);
            printTree(out(), project, project.rootSystemId(), 0);
            return ExitCodes.OK;
        }
    }

    /**
     * Prints a system and its descendants, indenting two spaces per level.
     *
     * @param out target writer
     * @param project project holding the systems
     * @param systemId system to start from
     * @param depth indentation level of the first line
     */
    static void printTree(PrintWriter out, Project project, String systemId, int depth) {
        SystemNode system = project.systems().get(systemId);
        if (system == null) {
            return;
        }
        out.printf("%s• %s (ID: %s)%n", "  ".repeat(depth), system.name(), system.id());
        for (String childId : system.childIds()) {
            printTree(out, project, childId, depth + 1);
        }
    }
}
