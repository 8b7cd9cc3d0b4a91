package com.architekt.core.component;

import com.architekt.core.TestProjects;
import com.architekt.core.model.Attribute;
import com.architekt.core.model.DataModel;
import com.architekt.core.model.EntryPoint;
import com.architekt.core.model.Project;
import com.architekt.core.util.Immutables;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link EntryPointValidator}.
 */
class EntryPointValidatorTest {

    private Project project;

    @BeforeEach
    void setUp() {
        Project base = TestProjects.rootOnly();
        DataModel order = new DataModel("dm-order", "Order", null, List.of());
        project = base.withDataModels(Immutables.with(base.dataModels(), order.id(), order));
    }

    @Test
    void validate_completeHttpEntryPoint_returnsNoErrors() {
        EntryPoint entryPoint = new EntryPoint(null, "Create order", null, "http", null, "HTTPS", "POST",
            "/orders", List.of("dm-order"), List.of("dm-order"), List.of(), List.of());

        assertThat(EntryPointValidator.validate(entryPoint, project)).isEmpty();
    }

    @Test
    void validate_missingNameAndType_reportsBoth() {
        assertThat(EntryPointValidator.validate(EntryPoint.draft(" ", null), project))
            .containsExactly("Entry point name is required.", "Entry point type is required.");
    }

    @Test
    void validate_unknownType_reportsError() {
        assertThat(EntryPointValidator.validate(EntryPoint.draft("Poll", "carrier-pigeon"), project))
            .containsExactly("Unknown entry point type: carrier-pigeon");
    }

    @ParameterizedTest
    @CsvSource({
        "queue, HTTP, publish, Protocol HTTP is not allowed for queue entry points.",
        "webhook, HTTPS, get, Method get is not allowed for webhook entry points.",
        "cron, HTTP, schedule, Protocol does not apply to cron entry points."
    })
    void validate_transportNotAllowedForType_reportsError(String type, String protocol, String method, String expected) {
        EntryPoint entryPoint = new EntryPoint(null, "Handler", null, type, null, protocol, method, null,
            List.of(), List.of(), List.of(), List.of());

        assertThat(EntryPointValidator.validate(entryPoint, project)).containsExactly(expected);
    }

    @Test
    void validate_firebaseFunction_acceptsFunctionNameOnly() {
        EntryPoint entryPoint = new EntryPoint(null, "onSignup", null, "firebase-function", "onSignup", null, null,
            null, List.of(), List.of(), List.of(), List.of());

        assertThat(EntryPointValidator.validate(entryPoint, project)).isEmpty();
    }

    @Test
    void validate_unknownModelsAndBadSchema_collectsEverything() {
        EntryPoint entryPoint = new EntryPoint(null, "Create order", null, "http", null, null, null, null,
            List.of("missing-in"), List.of("missing-out"), List.of(Attribute.draft("", null)), List.of());

        assertThat(EntryPointValidator.validate(entryPoint, project)).containsExactly(
            "Request data model does not exist: missing-in",
            "Response data model does not exist: missing-out",
            "Request #1: Attribute name is required.",
            "Request #1: Attribute type is required.");
    }

    @Test
    void fromId_isCaseInsensitive() {
        assertThat(EntryPointType.fromId(" Firebase-Function ")).contains(EntryPointType.FIREBASE_FUNCTION);
        assertThat(EntryPointType.fromId("smtp")).isEmpty();
    }
}
