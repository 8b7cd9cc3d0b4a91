package com.architekt.cli;

import picocli.CommandLine.Option;

/**
 * Base class for commands acting inside one project.
 */
public abstract class ProjectScopedCommand extends StoreCommand {

    @Option(names = {"-p", "--project"}, required = true, description = "Project id")
    protected String projectId;
}
