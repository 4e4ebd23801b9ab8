package com.phillippitts.makeready.service.survey;

import com.phillippitts.makeready.util.HeightFormat;
import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.Locale;

/**
 * Reads the attachment height of a wire record, in inches.
 *
 * <p>Keys are tried in order: {@code _measured_height}, {@code measured_height}, {@code height},
 * {@code position.z}, {@code position.z_coord}, {@code elevation}, {@code attachmentHeight}
 * (a {@code {value, unit}} pair, or {@code value} when the wire has none), {@code measuredHeight_in}.
 * Coordinate keys below 15 are taken as metres. Strings may be feet-inch text.
 */
public final class WireHeightReader {

    private static final Logger LOG = LogManager.getLogger(WireHeightReader.class);

    private static final double METRE_COORDINATE_LIMIT = 15.0;

    private WireHeightReader() {}

    /**
     * @return height in inches, or null when no key holds a usable height
     */
    public static Double read(JSONObject wire) {
        if (wire == null || wire.isEmpty()) {
            return null;
        }
        Double height = firstOf(wire, "_measured_height", "measured_height", "height");
        if (height != null) {
            return height;
        }
        JSONObject position = wire.optJSONObject("position");
        for (String key : new String[] {"z", "z_coord"}) {
            Double coordinate = parse(JsonTrees.value(position, key));
            if (coordinate != null) {
                return coordinate < METRE_COORDINATE_LIMIT ? HeightFormat.metersToInches(coordinate) : coordinate;
            }
        }
        Double elevation = parse(JsonTrees.value(wire, "elevation"));
        if (elevation != null) {
            return elevation < METRE_COORDINATE_LIMIT ? HeightFormat.metersToInches(elevation) : elevation;
        }
        Object attachment = JsonTrees.value(wire, "attachmentHeight");
        if (attachment instanceof JSONObject pair) {
            Double withUnit = withUnit(pair);
            if (withUnit != null) {
                return withUnit;
            }
        } else if (attachment == null) {
            Double value = parse(JsonTrees.value(wire, "value"));
            if (value != null) {
                return value;
            }
        } else {
            Double plain = parse(attachment);
            if (plain != null) {
                return plain;
            }
        }
        Double span = parse(JsonTrees.value(wire, "measuredHeight_in"));
        if (span == null) {
            LOG.debug("No usable height on wire {}", JsonTrees.text(wire, "id", "unknown"));
        }
        return span;
    }

    /**
     * {@code _measured_height} of a wire photographed at the pole; zero and unparsable values
     * count as absent.
     */
    public static Double measured(JSONObject wire) {
        Object raw = JsonTrees.value(wire, "_measured_height");
        if (!JsonTrees.truthy(raw)) {
            return null;
        }
        Double height = parse(raw);
        return height == null || height == 0.0 ? null : height;
    }

    /** {@code {value, unit}} with unit {@code m}/{@code meters}, {@code ft}/{@code feet}, else inches. */
    static Double withUnit(JSONObject pair) {
        Double value = JsonTrees.number(pair, "value");
        if (value == null) {
            return null;
        }
        String unit = JsonTrees.text(pair, "unit", "inches").trim().toLowerCase(Locale.ROOT);
        return switch (unit) {
            case "m", "meters", "metre", "metres" -> HeightFormat.metersToInches(value);
            case "ft", "feet" -> HeightFormat.feetToInches(value);
            default -> value;
        };
    }

    private static Double firstOf(JSONObject wire, String... keys) {
        for (String key : keys) {
            Double parsed = parse(JsonTrees.value(wire, key));
            if (parsed != null) {
                return parsed;
            }
        }
        return null;
    }

    private static Double parse(Object raw) {
        if (raw instanceof String text) {
            return HeightFormat.parseFeetInches(text);
        }
        return JsonTrees.number(raw);
    }
}
