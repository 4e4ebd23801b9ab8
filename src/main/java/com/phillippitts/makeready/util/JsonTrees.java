package com.phillippitts.makeready.util;

import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Null-safe traversal helpers over org.json trees.
 *
 * <p>Input documents mix "object keyed by id" and "array" shapes for the same collection, and
 * store numbers as strings often enough that every accessor here tolerates both. Keys of a
 * {@link JSONObject} are always visited in lexicographic order so traversal is deterministic.
 * None of these methods throw on malformed input.
 */
public final class JsonTrees {

    private JsonTrees() {}

    /** Keys of {@code object} in lexicographic order; empty for null. */
    public static List<String> sortedKeys(JSONObject object) {
        if (object == null) {
            return List.of();
        }
        return new ArrayList<>(new TreeSet<>(object.keySet()));
    }

    /**
     * Child object under {@code key}.
     *
     * @return the child, or an empty object when absent or not an object
     */
    public static JSONObject object(JSONObject parent, String key) {
        JSONObject child = parent == null ? null : parent.optJSONObject(key);
        return child == null ? new JSONObject() : child;
    }

    /** Child array under {@code key}, or an empty array. */
    public static JSONArray array(JSONObject parent, String key) {
        JSONArray child = parent == null ? null : parent.optJSONArray(key);
        return child == null ? new JSONArray() : child;
    }

    /**
     * Objects contained in a collection that may be an array or an id-keyed object.
     * Non-object members are skipped.
     */
    public static List<JSONObject> objects(Object collection) {
        List<JSONObject> result = new ArrayList<>();
        if (collection instanceof JSONArray array) {
            for (int i = 0; i < array.length(); i++) {
                JSONObject item = array.optJSONObject(i);
                if (item != null) {
                    result.add(item);
                }
            }
        } else if (collection instanceof JSONObject object) {
            for (String key : sortedKeys(object)) {
                JSONObject item = object.optJSONObject(key);
                if (item != null) {
                    result.add(item);
                }
            }
        }
        return result;
    }

    /** Same as {@link #objects(Object)} for the member {@code key} of {@code parent}. */
    public static List<JSONObject> objects(JSONObject parent, String key) {
        return parent == null ? List.of() : objects(parent.opt(key));
    }

    /** Raw member value with {@link JSONObject#NULL} mapped to null. */
    public static Object value(JSONObject parent, String key) {
        if (parent == null || key == null) {
            return null;
        }
        Object raw = parent.opt(key);
        return JSONObject.NULL.equals(raw) ? null : raw;
    }

    /**
     * Scalar member rendered as a string.
     *
     * @return the text, or null when absent, null, or a nested container
     */
    public static String text(JSONObject parent, String key) {
        Object raw = value(parent, key);
        if (raw == null || raw instanceof JSONObject || raw instanceof JSONArray) {
            return null;
        }
        return raw.toString();
    }

    /** {@link #text(JSONObject, String)} with blank mapped to {@code fallback}. */
    public static String text(JSONObject parent, String key, String fallback) {
        String text = text(parent, key);
        return text == null || text.isBlank() ? fallback : text;
    }

    /**
     * Numeric interpretation of a raw value: numbers as is, numeric strings parsed.
     *
     * @return the number, or null when the value is absent or not numeric
     */
    public static Double number(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            return Double.isNaN(value) ? null : value;
        }
        if (raw instanceof String text) {
            try {
                return Double.parseDouble(text.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Double number(JSONObject parent, String key) {
        return number(value(parent, key));
    }

    /**
     * Truthiness as the source documents use it: false, zero, empty strings and empty
     * containers are false; everything else present is true.
     */
    public static boolean truthy(Object raw) {
        if (raw == null || JSONObject.NULL.equals(raw)) {
            return false;
        }
        if (raw instanceof Boolean flag) {
            return flag;
        }
        if (raw instanceof Number number) {
            return number.doubleValue() != 0.0;
        }
        if (raw instanceof String text) {
            return !text.isEmpty();
        }
        if (raw instanceof JSONObject object) {
            return !object.isEmpty();
        }
        if (raw instanceof JSONArray array) {
            return !array.isEmpty();
        }
        if (raw instanceof Map<?, ?> map) {
            return !map.isEmpty();
        }
        return true;
    }

    /**
     * First truthy member among {@code keys}, in order.
     *
     * @return the raw value, or null when none is truthy
     */
    public static Object firstTruthy(JSONObject parent, String... keys) {
        if (parent == null) {
            return null;
        }
        for (String key : keys) {
            Object raw = value(parent, key);
            if (truthy(raw)) {
                return raw;
            }
        }
        return null;
    }
}
