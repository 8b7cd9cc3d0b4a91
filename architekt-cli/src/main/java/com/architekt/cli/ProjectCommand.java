package com.architekt.cli;

import com.architekt.core.model.Project;
import com.architekt.core.persistence.AggregateJson;
import com.architekt.core.store.ProjectAggregateStore;
import com.architekt.core.store.ProjectInput;
import com.architekt.core.util.Tags;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.util.List;

/**
 * Commands to list, create, show and delete projects.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * architekt project list
 * architekt project create "Web Shop" --description "Public storefront" --tags retail,b2c
 * architekt project show <projectId>
 * architekt project show <projectId> --json
 * architekt project delete <projectId>
 * }</pre>
 */
@Command(
    name = "project",
    description = "List, create, show and delete projects",
    mixinStandardHelpOptions = true,
    subcommands = {
        ProjectCommand.ListCommand.class,
        ProjectCommand.CreateCommand.class,
        ProjectCommand.ShowCommand.class,
        ProjectCommand.DeleteCommand.class
    }
)
public class ProjectCommand extends GroupCommand {

    @Command(name = "list", description = "List projects", mixinStandardHelpOptions = true)
    static class ListCommand extends StoreCommand {

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            List<Project> projects = store.listProjects(userId);
            PrintWriter out = out();
            out.println("Projects:");
            out.println();
            if (projects.isEmpty()) {
                out.println("  No projects found.");
            }
            for (Project project : projects) {
                out.printf("  • %s (ID: %s)%n", project.name(), project.id());
                if (!project.tags().isEmpty()) {
                    out.printf("    Tags: %s%n", String.join(", ", project.tags()));
                }
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "create", description = "Create a project with its root system", mixinStandardHelpOptions = true)
    static class CreateCommand extends StoreCommand {

        @Parameters(index = "0", description = "Project name")
        private String name;

        @Option(names = {"-d", "--description"}, description = "Project description")
        private String description;

        @Option(names = {"-t", "--tags"}, description = "Comma-separated tags")
        private String tags;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            Project project = store.createProject(userId, new ProjectInput(name, description, Tags.split(tags)));
            out().printf("✓ Created project %s (ID: %s)%n", project.name(), project.id());
            return ExitCodes.OK;
        }
    }

    @Command(name = "show", description = "Show a project", mixinStandardHelpOptions = true)
    static class ShowCommand extends StoreCommand {

        @Parameters(index = "0", description = "Project id")
        private String projectId;

        @Option(names = {"--json"}, description = "Print the project document as JSON")
        private boolean json;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) throws Exception {
            Project project = store.getProject(userId, projectId);
            PrintWriter out = out();
            if (json) {
                out.println(AggregateJson.mapper().writeValueAsString(project));
                return ExitCodes.OK;
            }
            out.printf("Project: %s (ID: %s)%n", project.name(), project.id());
            out.printf("Description: %s%n", orDash(project.description()));
            out.printf("Tags: %s%n", project.tags().isEmpty() ? "-" : String.join(", ", project.tags()));
            out.println();
            out.println("Systems:");
            SystemCommand.printTree(out, project, project.rootSystemId(), 1);
            out.println();
            out.printf("Flows: %d%n", project.flows().size());
            out.printf("Data models: %d%n", project.dataModels().size());
            out.printf("Components: %d (%d entry points)%n", project.components().size(), project.entryPoints().size());
            return ExitCodes.OK;
        }
    }

    @Command(name = "delete", description = "Delete a project", mixinStandardHelpOptions = true)
    static class DeleteCommand extends StoreCommand {

        @Parameters(index = "0", description = "Project id")
        private String projectId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            store.deleteProject(userId, projectId);
            out().printf("✓ Deleted project %s%n", projectId);
            return ExitCodes.OK;
        }
    }
}
