package com.architekt.cli;

import com.architekt.core.persistence.AggregateJson;
import com.architekt.core.store.ProjectAggregateStore;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Base class for commands working on the project store.
 *
 * <p>Subclasses implement {@link #execute(ProjectAggregateStore, String)} and let engine
 * exceptions propagate; {@link CommandErrorHandler} turns them into exit codes.
 */
public abstract class StoreCommand implements Callable<Integer> {

    @Mixin
    protected StoreOptions storeOptions;

    @Spec
    protected CommandSpec spec;

    @Override
    public Integer call() throws Exception {
        return execute(storeOptions.openStore(), storeOptions.userId());
    }

    /**
     * Runs the command.
     *
     * @param store opened store
     * @param userId user owning the projects
     * @return exit code
     * @throws Exception on failure
     */
    protected abstract int execute(ProjectAggregateStore store, String userId) throws Exception;

    protected PrintWriter out() {
        return spec.commandLine().getOut();
    }

    /**
     * Reads a JSON document into a model type.
     *
     * @param file JSON file
     * @param type target type
     * @param <T> target type
     * @return parsed document
     * @throws IllegalStateException if the file cannot be read or parsed
     */
    protected static <T> T readDocument(Path file, Class<T> type) {
        try {
            return AggregateJson.mapper().readValue(file.toFile(), type);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read document: " + file, e);
        }
    }

    protected static String orDash(String value) {
        return value == null || value.isBlank() ? "-" : value;
    }
}
