package com.architekt.cli;

import com.architekt.ArchitektCLI;
import com.architekt.core.model.Component;
import com.architekt.core.model.Project;
import com.architekt.core.model.SystemNode;
import com.architekt.core.persistence.FileSystemAggregateRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * End-to-end tests running the command line against a file-system store in a temp directory.
 */
@DisplayName("Architekt CLI")
class ArchitektCLITest {

    private static final String USER = "local-user";

    @TempDir
    Path tempDir;

    private Path dataFile;
    private Path backupDir;
    private StringWriter out;
    private StringWriter err;

    @BeforeEach
    void setUp() {
        dataFile = tempDir.resolve("architekt.json");
        backupDir = tempDir.resolve("backups");
    }

    private int run(String... args) {
        out = new StringWriter();
        err = new StringWriter();
        CommandLine commandLine = ArchitektCLI.commandLine();
        commandLine.setOut(new PrintWriter(out, true));
        commandLine.setErr(new PrintWriter(err, true));
        return commandLine.execute(args);
    }

    private int runWithStore(String... args) {
        List<String> full = new ArrayList<>(List.of(args));
        full.addAll(List.of("--data-file", dataFile.toString(), "--backup-dir", backupDir.toString()));
        return run(full.toArray(new String[0]));
    }

    private Project onlyProject() {
        List<Project> projects = List.copyOf(
            new FileSystemAggregateRepository(dataFile, backupDir, 10).load(USER).projects().values());
        assertThat(projects).hasSize(1);
        return projects.get(0);
    }

    private Project createProject() {
        assertThat(runWithStore("project", "create", "Shop", "--tags", "retail,b2c")).isEqualTo(ExitCodes.OK);
        return onlyProject();
    }

    @Test
    @DisplayName("Should create and list projects")
    void projectCreate_persistsProject() {
        Project project = createProject();

        assertThat(out.toString()).contains("✓ Created project Shop (ID: " + project.id() + ")");
        assertThat(project.tags()).containsExactly("retail", "b2c");
        assertThat(project.rootSystem().name()).isEqualTo("Shop");

        assertThat(runWithStore("project", "list")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("• Shop (ID: " + project.id() + ")");
    }

    @Test
    @DisplayName("Should map validation errors to exit code 2")
    void projectCreate_blankName_returnsValidationExitCode() {
        assertThat(runWithStore("project", "create", " ")).isEqualTo(ExitCodes.VALIDATION);

        assertThat(err.toString()).contains("✗ Project name is required");
        assertThat(Files.exists(dataFile)).isFalse();
    }

    @Test
    @DisplayName("Should map missing entities to exit code 3")
    void projectShow_unknownProject_returnsNotFoundExitCode() {
        assertThat(runWithStore("project", "show", "nope")).isEqualTo(ExitCodes.NOT_FOUND);

        assertThat(err.toString()).contains("✗ Project not found: nope");
    }

    @Test
    @DisplayName("Should add systems and print the tree")
    void systemAdd_thenTree_printsHierarchy() {
        Project project = createProject();
        assertThat(runWithStore("system", "add", "-p", project.id(), "Billing")).isEqualTo(ExitCodes.OK);
        SystemNode billing = onlyProject().systems().values().stream()
            .filter(system -> system.name().equals("Billing"))
            .findFirst()
            .orElseThrow();
        assertThat(runWithStore("system", "add", "-p", project.id(), "Invoices", "--parent", billing.id()))
            .isEqualTo(ExitCodes.OK);

        assertThat(runWithStore("system", "tree", "-p", project.id())).isEqualTo(ExitCodes.OK);

        assertThat(out.toString())
            .contains("• Shop (ID: " + project.rootSystemId() + ")")
            .contains("  • Billing (ID: " + billing.id() + ")")
            .contains("    • Invoices (ID: ");
    }

    @Test
    @DisplayName("Should refuse to remove the root system")
    void systemRemove_root_returnsValidationExitCode() {
        Project project = createProject();

        assertThat(runWithStore("system", "remove", "-p", project.id(), project.rootSystemId()))
            .isEqualTo(ExitCodes.VALIDATION);
        assertThat(err.toString()).contains("✗ Cannot delete the root system.");
    }

    @Test
    @DisplayName("Should validate and save flow documents")
    void flowValidateAndSave_readsJsonDocument() throws IOException {
        Project project = createProject();
        String root = project.rootSystemId();
        Path valid = tempDir.resolve("checkout.json");
        Files.writeString(valid, """
            {
              "name": "Checkout",
              "systemScopeIds": ["%s"],
              "steps": [
                {
                  "name": "Submit order",
                  "source": {"kind": "system", "systemId": "%s"},
                  "target": {"kind": "system", "systemId": "%s"}
                }
              ]
            }
            """.formatted(root, root, root));
        Path invalid = tempDir.resolve("broken.json");
        Files.writeString(invalid, """
            {"name": "", "systemScopeIds": ["%s"], "steps": [{"name": "Call"}]}
            """.formatted(root));

        assertThat(runWithStore("flow", "validate", "-p", project.id(), invalid.toString()))
            .isEqualTo(ExitCodes.VALIDATION);
        assertThat(err.toString())
            .contains("✗ Flow name is required.")
            .contains("✗ Step 1: Select a source system.");

        assertThat(runWithStore("flow", "save", "-p", project.id(), valid.toString())).isEqualTo(ExitCodes.OK);
        assertThat(onlyProject().flows()).hasSize(1);

        assertThat(runWithStore("flow", "list", "-p", project.id())).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("• Checkout (ID: ").contains("Steps: 1");
    }

    @Test
    @DisplayName("Should save components with entry points")
    void componentSave_persistsEntryPoints() throws IOException {
        Project project = createProject();
        Path file = tempDir.resolve("orders.json");
        Files.writeString(file, """
            {
              "name": "Orders",
              "entryPoints": [
                {"name": "Create order", "type": "http", "protocol": "HTTPS", "method": "post", "path": "/orders"}
              ]
            }
            """);

        assertThat(runWithStore("component", "save", "-p", project.id(), file.toString())).isEqualTo(ExitCodes.OK);

        Project saved = onlyProject();
        Component component = saved.components().values().iterator().next();
        assertThat(component.entryPointIds()).hasSize(1);

        assertThat(runWithStore("component", "list", "-p", project.id())).isEqualTo(ExitCodes.OK);
        assertThat(out.toString()).contains("- Create order [http] HTTPS post /orders");
    }

    @Test
    @DisplayName("Should reject entry points with a protocol their type does not allow")
    void componentSave_invalidProtocol_returnsValidationExitCode() throws IOException {
        Project project = createProject();
        Path file = tempDir.resolve("jobs.json");
        Files.writeString(file, """
            {"name": "Jobs", "entryPoints": [{"name": "Nightly", "type": "cron", "protocol": "HTTP"}]}
            """);

        assertThat(runWithStore("component", "save", "-p", project.id(), file.toString()))
            .isEqualTo(ExitCodes.VALIDATION);
        assertThat(err.toString()).contains("✗ Entry point 1: Protocol does not apply to cron entry points.");
    }

    @Test
    @DisplayName("Should save and delete data models")
    void dataModelSaveAndDelete() throws IOException {
        Project project = createProject();
        Path file = tempDir.resolve("customer.json");
        Files.writeString(file, """
            {"name": "Customer", "attributes": [{"name": "email", "type": "string"}]}
            """);

        assertThat(runWithStore("datamodel", "save", "-p", project.id(), file.toString())).isEqualTo(ExitCodes.OK);
        String modelId = onlyProject().dataModels().keySet().iterator().next();

        assertThat(runWithStore("datamodel", "delete", "-p", project.id(), modelId)).isEqualTo(ExitCodes.OK);
        assertThat(onlyProject().dataModels()).isEmpty();
    }

    @Test
    @DisplayName("Should report unreadable documents as failures")
    void flowSave_missingFile_returnsFailureExitCode() {
        Project project = createProject();

        assertThat(runWithStore("flow", "save", "-p", project.id(), tempDir.resolve("missing.json").toString()))
            .isEqualTo(ExitCodes.FAILURE);
        assertThat(err.toString()).contains("✗ Command failed: Failed to read document");
    }

    @Test
    @DisplayName("Should build regex patterns")
    void regex_buildsPattern() {
        assertThat(run("regex", "--lower", "--digits", "--min", "3", "--max", "8")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString().trim()).isEqualTo("^[a-z0-9]{3,8}$");

        assertThat(run("regex", "--hex", "--exact", "6")).isEqualTo(ExitCodes.OK);
        assertThat(out.toString().trim()).isEqualTo("^[A-Fa-f0-9]{6}$");
    }

    @Test
    @DisplayName("Should reject regex options without a character class")
    void regex_withoutCharacterClass_returnsValidationExitCode() {
        assertThat(run("regex", "--exact", "4")).isEqualTo(ExitCodes.VALIDATION);
        assertThat(err.toString()).contains("✗ Select at least one character option.");
    }
}
