package com.phillippitts.makeready.domain;

import com.phillippitts.makeready.util.HeightFormat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lowest mid-span heights on one span, split into communications and utility electrical wires.
 *
 * @param toPole        label of the opposite pole
 * @param communication lowest communications mid-span height in inches (nullable)
 * @param electrical    lowest electrical mid-span height in inches (nullable)
 * @param underground   the span is an underground path
 */
public record SpanMidspanHeights(String toPole, Double communication, Double electrical, boolean underground) {

    static final String MISSING = "NA";

    public static SpanMidspanHeights underground(String toPole) {
        return new SpanMidspanHeights(toPole, null, null, true);
    }

    public String communicationText() {
        return render(communication);
    }

    public String electricalText() {
        return render(electrical);
    }

    private String render(Double inches) {
        if (underground) {
            return Midspan.UNDERGROUND_LABEL;
        }
        return inches == null ? MISSING : HeightFormat.toFeetInches(inches);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("to_pole", toPole);
        row.put("lowest_com", communicationText());
        row.put("lowest_cps_electrical", electricalText());
        return row;
    }
}
