package com.architekt.core.attribute;

import com.architekt.core.model.Attribute;
import com.architekt.core.model.AttributeType;
import com.architekt.core.util.Immutables;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects every structural problem of an attribute tree.
 *
 * <p>Each message is prefixed with the dotted path of the offending attribute
 * (e.g., {@code "address.street: Attribute type is required."}). Unnamed attributes are
 * addressed by their 1-based position ({@code "#2"}); array elements by {@code "[]"}.
 */
public final class AttributeSchemaValidator {

    private AttributeSchemaValidator() {
        // Utility class
    }

    /**
     * Validates a whole tree.
     *
     * @param tree attributes to validate
     * @return every problem found, empty when valid
     */
    public static List<String> validate(List<Attribute> tree) {
        List<String> errors = new ArrayList<>();
        validateList(tree, "", errors);
        return errors;
    }

    private static void validateList(List<Attribute> attributes, String parentPath, List<String> errors) {
        for (int i = 0; i < attributes.size(); i++) {
            Attribute attribute = attributes.get(i);
            String segment = Immutables.isBlank(attribute.name()) ? "#" + (i + 1) : attribute.name().trim();
            validateNode(attribute, parentPath.isEmpty() ? segment : parentPath + "." + segment, errors, true);
        }
    }

    private static void validateNode(Attribute attribute, String path, List<String> errors, boolean checkIdentity) {
        if (checkIdentity && Immutables.isBlank(attribute.name())) {
            errors.add(path + ": Attribute name is required.");
        }
        if (checkIdentity && attribute.type() == null) {
            errors.add(path + ": Attribute type is required.");
        }
        ConstraintEngine.validate(attribute).forEach(message -> errors.add(path + ": " + message));

        AttributeType type = attribute.type();
        if (!attribute.attributes().isEmpty() && type != null && type != AttributeType.OBJECT) {
            errors.add(path + ": Only object attributes can have nested attributes.");
        }

        Attribute element = attribute.element();
        if (element != null && type != null && type != AttributeType.ARRAY) {
            errors.add(path + ": Only array attributes can define an element.");
        } else if (element != null) {
            if (Immutables.isBlank(element.name()) || element.type() == null) {
                errors.add(path + ": Array element requires a name and type.");
            }
            validateNode(element, path + "[]", errors, false);
        }

        validateList(attribute.attributes(), path, errors);
    }
}
