package com.phillippitts.makeready.service.neutral;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.domain.NeutralWire;
import com.phillippitts.makeready.service.survey.SurveyWireCollector;
import com.phillippitts.makeready.service.survey.TraceResolver;
import com.phillippitts.makeready.service.survey.WireHeightReader;
import com.phillippitts.makeready.util.HeightFormat;
import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONArray;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Finds the governing neutral of a pole and filters its attachments to those at or below it.
 *
 * <p>Candidates come from the wires photographed at the pole and from the measured design of
 * the engineering location; the tallest candidate governs. The comparison is inclusive: an
 * attachment exactly at the neutral height is kept. New installs are compared by their proposed
 * height. Without any neutral the list is returned unfiltered and a warning is logged.
 */
public final class NeutralIdentifier {

    private static final Logger LOG = LogManager.getLogger(NeutralIdentifier.class);

    private final double matchToleranceInches;

    /**
     * @param matchToleranceInches height drift tolerated when checking whether the neutral is
     *                             already present in the filtered list
     */
    public NeutralIdentifier(double matchToleranceInches) {
        if (matchToleranceInches < 0) {
            throw new IllegalArgumentException("matchToleranceInches must be >= 0");
        }
        this.matchToleranceInches = matchToleranceInches;
    }

    /**
     * Neutral candidates among the wires photographed at the pole: trace cable type or usage
     * group mentions neutral, or {@code "company cable_type"} matches a neutral pattern.
     */
    public List<NeutralWire> surveyCandidates(JSONObject survey, JSONObject node, TraceResolver traces) {
        List<NeutralWire> candidates = new ArrayList<>();
        for (JSONObject wire : SurveyWireCollector.poleWires(survey, node)) {
            String traceId = SurveyWireCollector.traceId(wire);
            if (traceId == null) {
                continue;
            }
            Double height = WireHeightReader.measured(wire);
            JSONObject trace = traces.resolve(traceId);
            if (height == null || trace.isEmpty()) {
                continue;
            }
            String cableType = JsonTrees.text(trace, "cable_type", "");
            String description = (JsonTrees.text(trace, "company", "") + " " + cableType).trim();
            if (cableType.toLowerCase(Locale.ROOT).contains("neutral")
                    || neutralUsage(JsonTrees.value(trace, "usageGroup"))
                    || NeutralPatterns.matches(description)) {
                LOG.debug("Survey neutral {} at {} in (trace {})", description, height, traceId);
                candidates.add(new NeutralWire(height, description, NeutralWire.Source.SURVEY));
            }
        }
        return candidates;
    }

    /**
     * Neutral candidates in the measured design: usage group mentions {@code NEUTRAL}, or
     * {@code "owner type"} matches a neutral pattern.
     */
    public List<NeutralWire> engineeringCandidates(JSONObject location) {
        List<NeutralWire> candidates = new ArrayList<>();
        if (location == null) {
            return candidates;
        }
        for (JSONObject design : JsonTrees.objects(location, "designs")) {
            if (!"measured design".equalsIgnoreCase(JsonTrees.text(design, "label", "").trim())) {
                continue;
            }
            for (JSONObject wire : JsonTrees.objects(JsonTrees.object(design, "structure"), "wires")) {
                String owner = JsonTrees.text(JsonTrees.object(wire, "owner"), "id", "");
                String type = JsonTrees.text(JsonTrees.object(wire, "clientItem"), "type", "");
                String description = (owner + " " + type).trim();
                if (!neutralUsage(JsonTrees.value(wire, "usageGroup")) && !NeutralPatterns.matches(description)) {
                    continue;
                }
                Double meters = JsonTrees.number(JsonTrees.object(wire, "attachmentHeight"), "value");
                if (meters != null) {
                    candidates.add(new NeutralWire(HeightFormat.metersToInches(meters), description,
                            NeutralWire.Source.ENGINEERING));
                }
            }
        }
        return candidates;
    }

    public Optional<NeutralWire> highest(List<NeutralWire> candidates) {
        return candidates.stream().max(Comparator.comparingDouble(NeutralWire::heightInches));
    }

    /**
     * Keeps attachments at or below the neutral, drops duplicates sharing owner, type and
     * existing height, and makes sure the neutral itself is listed.
     *
     * @param attachments consolidated attachments, tallest first
     * @param neutral     governing neutral, empty when the pole has none
     */
    public NeutralFilterResult filter(List<AttachmentRecord> attachments, Optional<NeutralWire> neutral) {
        if (neutral.isEmpty()) {
            LOG.warn("No neutral wire found; keeping all {} attachments", attachments.size());
            return new NeutralFilterResult(null, attachments);
        }
        NeutralWire governing = neutral.get();
        double limit = governing.heightInches();

        List<AttachmentRecord> below = new ArrayList<>();
        Set<String> seen = new HashSet<>();
        boolean neutralListed = false;
        for (AttachmentRecord record : attachments) {
            if (record.sortHeight() > limit || !seen.add(dedupeKey(record))) {
                continue;
            }
            if (!neutralListed && isSameNeutral(record, governing)) {
                neutralListed = true;
                record = record.asNeutral();
            }
            below.add(record);
        }
        if (!neutralListed) {
            below.add(0, governing.toAttachment());
        }
        LOG.debug("{} of {} attachments at or below neutral at {} in", below.size(), attachments.size(), limit);
        return new NeutralFilterResult(governing, below);
    }

    private boolean isSameNeutral(AttachmentRecord record, NeutralWire neutral) {
        boolean sameDescription = record.description().equals(neutral.description())
                || NeutralPatterns.matches(record.description());
        return sameDescription && Math.abs(record.sortHeight() - neutral.heightInches()) < matchToleranceInches;
    }

    private static String dedupeKey(AttachmentRecord record) {
        String[] parts = record.description().trim().split(" ", 2);
        String type = parts.length > 1 ? parts[1] : "";
        return parts[0] + "|" + type + "|" + record.existingHeightText();
    }

    private static boolean neutralUsage(Object usageGroup) {
        if (usageGroup instanceof JSONArray groups) {
            for (int i = 0; i < groups.length(); i++) {
                if (groups.optString(i, "").toUpperCase(Locale.ROOT).contains("NEUTRAL")) {
                    return true;
                }
            }
            return false;
        }
        return usageGroup instanceof String group && group.toUpperCase(Locale.ROOT).contains("NEUTRAL");
    }
}
