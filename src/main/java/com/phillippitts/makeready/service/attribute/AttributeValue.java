package com.phillippitts.makeready.service.attribute;

import com.phillippitts.makeready.util.JsonTrees;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * An attribute as stored in a survey document: either a bare scalar or a wrapper map whose
 * payload sits under one of several known sub-keys ({@code -Imported}, {@code assessment},
 * {@code button_added}, ...).
 *
 * <p>Extraction is always by an ordered list of payload keys. {@link #find(List, List)} is strict
 * and only looks at the listed keys; {@link #text()} falls back to the first value of a wrapper.
 */
public interface AttributeValue {

    /** Payload keys of a wrapper, in priority order. */
    List<String> WRAPPER_KEYS = List.of("-Imported", "assessment", "button_added", "tagtext", "value", "name", "id");

    /** Payload keys inside a nested wrapper, in priority order. */
    List<String> NESTED_KEYS = List.of("tagtext", "value", "name", "id");

    /**
     * Strict extraction.
     *
     * @param keys       wrapper payload keys, in priority order
     * @param nestedKeys keys tried when a payload is itself a wrapper
     * @return the first non-blank payload, or null
     */
    String find(List<String> keys, List<String> nestedKeys);

    /**
     * Lenient extraction: {@link #WRAPPER_KEYS}, then the first value of the wrapper.
     *
     * @return the text, or null when the wrapper holds nothing usable
     */
    String text();

    /**
     * Wraps a raw JSON value.
     *
     * @return the attribute value, or null for null, {@link JSONObject#NULL} and empty arrays
     */
    static AttributeValue of(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return null;
        }
        if (raw instanceof JSONObject object) {
            Map<String, AttributeValue> entries = new TreeMap<>();
            for (String key : object.keySet()) {
                AttributeValue child = of(object.opt(key));
                if (child != null) {
                    entries.put(key, child);
                }
            }
            return new Wrapper(entries);
        }
        if (raw instanceof JSONArray array) {
            return array.isEmpty() ? null : of(array.opt(0));
        }
        return new Scalar(raw.toString());
    }

    /** A bare value. */
    record Scalar(String value) implements AttributeValue {

        @Override
        public String find(List<String> keys, List<String> nestedKeys) {
            return text();
        }

        @Override
        public String text() {
            return value == null || value.isBlank() ? null : value.trim();
        }
    }

    /** A map of payload keys to values; entries are held in key order. */
    record Wrapper(Map<String, AttributeValue> entries) implements AttributeValue {

        public Wrapper {
            entries = Collections.unmodifiableMap(new TreeMap<>(entries));
        }

        @Override
        public String find(List<String> keys, List<String> nestedKeys) {
            for (String key : keys) {
                AttributeValue child = entries.get(key);
                if (child == null) {
                    continue;
                }
                String found = child instanceof Wrapper nested
                        ? nested.find(nestedKeys, nestedKeys)
                        : child.text();
                if (found != null) {
                    return found;
                }
            }
            return null;
        }

        @Override
        public String text() {
            String found = find(WRAPPER_KEYS, NESTED_KEYS);
            if (found != null) {
                return found;
            }
            for (AttributeValue child : entries.values()) {
                String text = child.text();
                if (text != null) {
                    return text;
                }
            }
            return null;
        }
    }

    /** Lenient text of a JSON member, or null. */
    static String textOf(JSONObject parent, String key) {
        AttributeValue value = of(JsonTrees.value(parent, key));
        return value == null ? null : value.text();
    }
}
