package com.architekt.cli;

import com.architekt.core.model.DataModel;
import com.architekt.core.store.ProjectAggregateStore;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.List;

/**
 * Commands to list, save and delete data models.
 *
 * <p>Data models are read from JSON documents:
 * <pre>{@code
 * {
 *   "name": "Customer",
 *   "attributes": [
 *     {"name": "email", "type": "string", "constraints": [{"type": "maxLength", "value": 120}],
 *      "flags": {"required": true}}
 *   ]
 * }
 * }</pre>
 */
@Command(
    name = "datamodel",
    description = "List, save and delete data models",
    mixinStandardHelpOptions = true,
    subcommands = {
        DataModelCommand.ListCommand.class,
        DataModelCommand.SaveCommand.class,
        DataModelCommand.DeleteCommand.class
    }
)
public class DataModelCommand extends GroupCommand {

    @Command(name = "list", description = "List data models", mixinStandardHelpOptions = true)
    static class ListCommand extends ProjectScopedCommand {

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            List<DataModel> models = store.listDataModels(userId, projectId);
            PrintWriter out = out();
            out.println("Data models:");
            out.println();
            if (models.isEmpty()) {
                out.println("  No data models found.");
            }
            for (DataModel model : models) {
                out.printf("  • %s (ID: %s)%n", model.name(), model.id());
                out.printf("    Attributes: %d%n", model.attributes().size());
            }
            return ExitCodes.OK;
        }
    }

    @Command(name = "save", description = "Create a data model, or replace it when an id is given",
        mixinStandardHelpOptions = true)
    static class SaveCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Data model JSON file")
        private Path file;

        @Option(names = {"--id"}, description = "Data model id to replace (default: the document's id)")
        private String dataModelId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            DataModel draft = readDocument(file, DataModel.class);
            String id = dataModelId != null ? dataModelId : draft.id();
            DataModel saved = id == null
                ? store.createDataModel(userId, projectId, draft)
                : store.updateDataModel(userId, projectId, id, draft);
            out().printf("✓ Saved data model %s (ID: %s)%n", saved.name(), saved.id());
            return ExitCodes.OK;
        }
    }

    @Command(name = "delete", description = "Delete a data model", mixinStandardHelpOptions = true)
    static class DeleteCommand extends ProjectScopedCommand {

        @Parameters(index = "0", description = "Data model id")
        private String dataModelId;

        @Override
        protected int execute(ProjectAggregateStore store, String userId) {
            store.deleteDataModel(userId, projectId, dataModelId);
            out().printf("✓ Deleted data model %s%n", dataModelId);
            return ExitCodes.OK;
        }
    }
}
