package com.architekt.core.attribute;

import com.architekt.core.error.NotFoundException;
import com.architekt.core.model.Attribute;
import com.architekt.core.model.AttributeType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AttributeTree}.
 */
class AttributeTreeTest {

    private Attribute address;
    private Attribute street;
    private Attribute email;
    private List<Attribute> tree;

    @BeforeEach
    void setUp() {
        street = Attribute.draft("street", AttributeType.STRING).withLocalId("a2");
        address = Attribute.draft("address", AttributeType.OBJECT).withLocalId("a1").withAttributes(List.of(street));
        email = Attribute.draft("email", AttributeType.STRING).withLocalId("a3");
        tree = List.of(address, email);
    }

    @Test
    void add_withNullParent_appendsAtTopLevel() {
        Attribute phone = Attribute.draft("phone", AttributeType.STRING);

        List<Attribute> result = AttributeTree.add(tree, null, phone);

        assertThat(result).extracting(Attribute::name).containsExactly("address", "email", "phone");
        assertThat(tree).hasSize(2);
    }

    @Test
    void add_withParent_appendsToChildren() {
        Attribute zip = Attribute.draft("zip", AttributeType.STRING).withLocalId("a4");

        List<Attribute> result = AttributeTree.add(tree, "a1", zip);

        assertThat(AttributeTree.find(result, "a1").orElseThrow().attributes())
            .extracting(Attribute::localId)
            .containsExactly("a2", "a4");
    }

    @Test
    void add_withMissingParent_throwsNotFound() {
        assertThatThrownBy(() -> AttributeTree.add(tree, "nope", Attribute.draft("x", AttributeType.STRING)))
            .isInstanceOf(NotFoundException.class)
            .hasMessageContaining("nope");
    }

    @Test
    void remove_objectNode_removesWholeSubtree() {
        List<Attribute> single = List.of(address);

        List<Attribute> result = AttributeTree.remove(single, "a1");

        assertThat(result).isEmpty();
        assertThat(AttributeTree.find(result, "a2")).isEmpty();
    }

    @Test
    void remove_nestedNode_prunesOnlyThatNode() {
        List<Attribute> result = AttributeTree.remove(tree, "a2");

        assertThat(result).hasSize(2);
        assertThat(result.get(0).attributes()).isEmpty();
        assertThat(result.get(1)).isSameAs(email);
    }

    @Test
    void remove_unknownId_returnsSameTree() {
        assertThat(AttributeTree.remove(tree, "unknown")).isSameAs(tree);
    }

    @Test
    void remove_arrayElement_clearsElement() {
        Attribute element = Attribute.draft("tag", AttributeType.STRING).withLocalId("e1");
        Attribute tags = Attribute.draft("tags", AttributeType.ARRAY).withLocalId("t1").withElement(element);

        List<Attribute> result = AttributeTree.remove(List.of(tags), "e1");

        assertThat(result.get(0).element()).isNull();
    }

    @Test
    void update_replacesTargetAndKeepsSiblingIdentity() {
        List<Attribute> result = AttributeTree.update(tree, "a2", node -> node.withName("line1"));

        assertThat(AttributeTree.find(result, "a2").orElseThrow().name()).isEqualTo("line1");
        assertThat(result.get(1)).isSameAs(email);
        assertThat(result.get(0)).isNotSameAs(address);
    }

    @Test
    void update_unknownId_returnsSameTree() {
        assertThat(AttributeTree.update(tree, "unknown", node -> node.withName("x"))).isSameAs(tree);
    }

    @Test
    void find_searchesDepthFirstIncludingElements() {
        Attribute element = Attribute.draft("item", AttributeType.OBJECT).withLocalId("e1")
            .withAttributes(List.of(Attribute.draft("sku", AttributeType.STRING).withLocalId("e2")));
        Attribute items = Attribute.draft("items", AttributeType.ARRAY).withLocalId("i1").withElement(element);

        assertThat(AttributeTree.find(List.of(address, items), "e2")).map(Attribute::name).contains("sku");
        assertThat(AttributeTree.find(tree, "missing")).isEmpty();
    }

    @Test
    void collectLocalIds_returnsWholeSubtree() {
        assertThat(AttributeTree.collectLocalIds(address)).containsExactly("a1", "a2");
    }

    @Test
    void assignIds_mintsMissingIdsAndAlignsLocalIds() {
        Attribute persisted = new Attribute("keep-me", "local", "name", null, AttributeType.STRING,
            List.of(), null, List.of(), null);

        List<Attribute> result = AttributeTree.assignIds(List.of(address, persisted));

        assertThat(result.get(0).id()).isNotNull().isEqualTo(result.get(0).localId());
        assertThat(result.get(0).attributes().get(0).id()).isNotNull();
        assertThat(result.get(1).id()).isEqualTo("keep-me");
        assertThat(result.get(1).localId()).isEqualTo("keep-me");
    }
}
