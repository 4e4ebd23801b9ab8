package com.phillippitts.makeready.domain;

import com.phillippitts.makeready.util.HeightFormat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Lowest heights observed on the primary span of a pole.
 *
 * @param connectionId        survey connection id
 * @param fromPole            label of the pole being reported
 * @param toPole              label of the opposite endpoint
 * @param lowestCommunication lowest communications wire height in inches (nullable)
 * @param lowestElectrical    lowest utility electrical wire height in inches (nullable)
 */
public record ConnectionSummary(
        String connectionId,
        String fromPole,
        String toPole,
        Double lowestCommunication,
        Double lowestElectrical
) {

    public static ConnectionSummary empty(String fromPole) {
        return new ConnectionSummary(null, fromPole, null, null, null);
    }

    public boolean hasKnownTarget() {
        return toPole != null && !toPole.isBlank();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("connection_id", connectionId);
        row.put("from_pole", fromPole);
        row.put("to_pole", toPole);
        row.put("lowest_com", HeightFormat.toFeetInches(lowestCommunication));
        row.put("lowest_cps_electrical", HeightFormat.toFeetInches(lowestElectrical));
        return row;
    }
}
