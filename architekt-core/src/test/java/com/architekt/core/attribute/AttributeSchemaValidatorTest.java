package com.architekt.core.attribute;

import com.architekt.core.model.Attribute;
import com.architekt.core.model.AttributeType;
import com.architekt.core.model.Constraint;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link AttributeSchemaValidator}.
 */
class AttributeSchemaValidatorTest {

    @Test
    void validate_wellFormedTree_returnsNoErrors() {
        Attribute street = Attribute.draft("street", AttributeType.STRING)
            .withConstraints(List.of(new Constraint.MaxLength(80)));
        Attribute address = Attribute.draft("address", AttributeType.OBJECT).withAttributes(List.of(street));
        Attribute tags = Attribute.draft("tags", AttributeType.ARRAY)
            .withElement(Attribute.draft("tag", AttributeType.STRING));

        assertThat(AttributeSchemaValidator.validate(List.of(address, tags))).isEmpty();
    }

    @Test
    void validate_missingNameAndType_reportsByPosition() {
        Attribute unnamed = Attribute.draft(" ", null);

        assertThat(AttributeSchemaValidator.validate(List.of(Attribute.draft("id", AttributeType.STRING), unnamed)))
            .containsExactly("#2: Attribute name is required.", "#2: Attribute type is required.");
    }

    @Test
    void validate_nestedConstraintError_prefixesDottedPath() {
        Attribute zip = Attribute.draft("zip", AttributeType.INTEGER)
            .withConstraints(List.of(new Constraint.Regex("^\\d{5}$")));
        Attribute address = Attribute.draft("address", AttributeType.OBJECT).withAttributes(List.of(zip));

        assertThat(AttributeSchemaValidator.validate(List.of(address)))
            .containsExactly("address.zip: Constraint 'regex' is not allowed for integer attributes.");
    }

    @Test
    void validate_childrenOnNonObject_reportsError() {
        Attribute name = Attribute.draft("name", AttributeType.STRING)
            .withAttributes(List.of(Attribute.draft("first", AttributeType.STRING)));

        assertThat(AttributeSchemaValidator.validate(List.of(name)))
            .containsExactly("name: Only object attributes can have nested attributes.");
    }

    @Test
    void validate_elementOnNonArray_reportsError() {
        Attribute name = Attribute.draft("name", AttributeType.STRING)
            .withElement(Attribute.draft("x", AttributeType.STRING));

        assertThat(AttributeSchemaValidator.validate(List.of(name)))
            .containsExactly("name: Only array attributes can define an element.");
    }

    @Test
    void validate_incompleteArrayElement_reportsError() {
        Attribute items = Attribute.draft("items", AttributeType.ARRAY)
            .withElement(Attribute.draft("", AttributeType.OBJECT));

        assertThat(AttributeSchemaValidator.validate(List.of(items)))
            .containsExactly("items: Array element requires a name and type.");
    }

    @Test
    void validate_elementChildren_areValidated() {
        Attribute sku = Attribute.draft("sku", null);
        Attribute item = Attribute.draft("item", AttributeType.OBJECT).withAttributes(List.of(sku));
        Attribute items = Attribute.draft("items", AttributeType.ARRAY).withElement(item);

        assertThat(AttributeSchemaValidator.validate(List.of(items)))
            .containsExactly("items[].sku: Attribute type is required.");
    }
}
