package com.phillippitts.makeready.service.attribute;

import com.phillippitts.makeready.util.JsonTrees;
import org.json.JSONObject;

import java.util.List;

/**
 * Priority-list lookups over an attribute container.
 */
public final class AttributeValues {

    private AttributeValues() {}

    /**
     * First attribute among {@code names} whose raw value is truthy.
     *
     * @return the wrapped value, or null when none is present
     */
    public static AttributeValue first(JSONObject attributes, String... names) {
        Object raw = JsonTrees.firstTruthy(attributes, names);
        return AttributeValue.of(raw);
    }

    /** Lenient text of the first truthy attribute among {@code names}. */
    public static String text(JSONObject attributes, String... names) {
        AttributeValue value = first(attributes, names);
        return value == null ? null : value.text();
    }

    /**
     * Strict lookup: the first attribute among {@code names} whose payload is found under
     * {@code keys} (nested wrappers yield their {@code nestedKeys}).
     */
    public static String find(JSONObject attributes, List<String> names, List<String> keys, List<String> nestedKeys) {
        for (String name : names) {
            AttributeValue value = AttributeValue.of(JsonTrees.value(attributes, name));
            String found = value == null ? null : value.find(keys, nestedKeys);
            if (found != null) {
                return found;
            }
        }
        return null;
    }
}
