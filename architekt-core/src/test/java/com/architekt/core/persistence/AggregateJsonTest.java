package com.architekt.core.persistence;

import com.architekt.core.model.AttributeType;
import com.architekt.core.model.Constraint;
import com.architekt.core.model.DataModel;
import com.architekt.core.model.Flow;
import com.architekt.core.model.StepEndpoint;
import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for the JSON shape of model documents read and written through {@link AggregateJson}.
 */
class AggregateJsonTest {

    @Test
    void readFlow_withBothEndpointForms_resolvesSubtypes() throws Exception {
        String json = """
            {
              "name": "Checkout",
              "systemScopeIds": ["sysA"],
              "steps": [
                {
                  "name": "Charge card",
                  "source": {"kind": "system", "systemId": "sysA"},
                  "target": {"kind": "entryPoint", "componentId": "c1", "entryPointId": "ep1"},
                  "alternateFlowIds": ["f2", "f2"]
                }
              ]
            }
            """;

        Flow flow = AggregateJson.mapper().readValue(json, Flow.class);

        assertThat(flow.id()).isNull();
        assertThat(flow.tags()).isEmpty();
        assertThat(flow.steps().get(0).source()).isEqualTo(StepEndpoint.system("sysA"));
        assertThat(flow.steps().get(0).target()).isEqualTo(StepEndpoint.entryPoint("c1", "ep1"));
        assertThat(flow.steps().get(0).alternateFlowIds()).containsExactly("f2");
    }

    @Test
    void readDataModel_withConstraintsAndFlags_resolvesSubtypes() throws Exception {
        String json = """
            {
              "name": "Customer",
              "attributes": [
                {
                  "name": "email",
                  "type": "string",
                  "constraints": [
                    {"type": "regex", "value": "^.+@.+$"},
                    {"type": "maxLength", "value": 120}
                  ],
                  "flags": {"required": true, "private": true}
                },
                {
                  "name": "status",
                  "type": "STRING",
                  "constraints": [{"type": "enum", "values": ["active", "blocked"]}]
                }
              ]
            }
            """;

        DataModel model = AggregateJson.mapper().readValue(json, DataModel.class);

        assertThat(model.attributes()).hasSize(2);
        assertThat(model.attributes().get(0).type()).isEqualTo(AttributeType.STRING);
        assertThat(model.attributes().get(0).constraints())
            .containsExactly(new Constraint.Regex("^.+@.+$"), new Constraint.MaxLength(120));
        assertThat(model.attributes().get(0).flags().required()).isTrue();
        assertThat(model.attributes().get(0).flags().isPrivate()).isTrue();
        assertThat(model.attributes().get(0).localId()).isNotBlank();
        assertThat(model.attributes().get(1).constraints())
            .containsExactly(new Constraint.Enumeration(List.of("active", "blocked")));
    }

    @Test
    void writeConstraint_usesTypeDiscriminator() {
        JsonNode node = AggregateJson.mapper().valueToTree(new Constraint.MinLength(3));

        assertThat(node.get("type").asText()).isEqualTo("minLength");
        assertThat(node.get("value").asInt()).isEqualTo(3);
        assertThat(node.has("kind")).isFalse();
    }

    @Test
    void writeSystemNode_usesIsRootKey() {
        JsonNode node = AggregateJson.mapper().valueToTree(
            com.architekt.core.model.SystemNode.root("r", "Shop", null));

        assertThat(node.get("isRoot").asBoolean()).isTrue();
        assertThat(node.has("root")).isFalse();
    }
}
