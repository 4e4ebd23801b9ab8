package com.phillippitts.makeready.service.equipment;

import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Counts proposed risers and guys of a pole from the survey node, the recommended engineering
 * design and the make-ready notes.
 */
public final class ProposedEquipmentCounter {

    private static final Logger LOG = LogManager.getLogger(ProposedEquipmentCounter.class);

    static final String NONE = "NO";

    private static final List<Pattern> RISER_NOTES = List.of(
            Pattern.compile("add\\s+riser"),
            Pattern.compile("install\\s+riser"),
            Pattern.compile("new\\s+riser"),
            Pattern.compile("proposed\\s+riser"));
    private static final List<Pattern> GUY_NOTES = List.of(
            Pattern.compile("add\\s+(down|overhead)?\\s*guy"),
            Pattern.compile("install\\s+(down|overhead)?\\s*guy"),
            Pattern.compile("new\\s+(down|overhead)?\\s*guy"),
            Pattern.compile("proposed\\s+(down|overhead)?\\s*guy"));

    /**
     * Riser and guy counts of one pole.
     */
    public record Counts(int risers, int guys) {

        public String riserText() {
            return render(risers);
        }

        public String guyText() {
            return render(guys);
        }

        private static String render(int count) {
            return count > 0 ? "YES (" + count + ")" : NONE;
        }
    }

    /**
     * @param node     survey node
     * @param location engineering location, or null
     * @param notes    make-ready notes, or null
     */
    public Counts count(JSONObject node, JSONObject location, String notes) {
        int risers = 0;
        int guys = 0;

        JSONObject attachments = JsonTrees.object(node, "attachments");
        for (JSONObject riser : JsonTrees.objects(attachments, "riser")) {
            if (JsonTrees.truthy(JsonTrees.value(riser, "proposed"))) {
                risers++;
            }
        }
        for (JSONObject guy : JsonTrees.objects(attachments, "guying")) {
            if (JsonTrees.truthy(JsonTrees.value(guy, "proposed"))) {
                guys++;
            } else if (lower(JsonTrees.text(guy, "desc")).contains("proposed")) {
                guys++;
            }
            if (JsonTrees.firstTruthy(JsonTrees.object(guy, "attributes"), "proposed", "is_proposed") != null) {
                guys++;
            }
        }
        for (JSONObject wire : JsonTrees.objects(attachments, "wires")) {
            String desc = lower(JsonTrees.text(wire, "desc"));
            if (desc.contains("guy") && (JsonTrees.truthy(JsonTrees.value(wire, "proposed")) || desc.contains("proposed"))) {
                guys++;
            }
        }

        if (location != null) {
            for (JSONObject design : JsonTrees.objects(location, "designs")) {
                if (!lower(JsonTrees.text(design, "label")).contains("recommended")) {
                    continue;
                }
                JSONObject structure = JsonTrees.object(design, "structure");
                for (JSONObject equipment : JsonTrees.objects(structure, "equipments")) {
                    if ("RISER".equals(clientItemType(equipment))) {
                        risers++;
                    }
                }
                for (JSONObject guy : JsonTrees.objects(structure, "guys")) {
                    String type = clientItemType(guy);
                    if (type.contains("GUY") || type.contains("DOWN")) {
                        guys++;
                    }
                }
            }
            String analysisNotes = lower(JsonTrees.text(JsonTrees.object(location, "analysis"), "notes"));
            if (analysisNotes.contains("add guy") || analysisNotes.contains("proposed guy")) {
                guys++;
            }
        }

        String noteText = lower(notes);
        if (risers == 0 && RISER_NOTES.stream().anyMatch(p -> p.matcher(noteText).find())) {
            risers = 1;
        }
        if (guys == 0 && GUY_NOTES.stream().anyMatch(p -> p.matcher(noteText).find())) {
            guys = 1;
        }
        LOG.debug("Proposed risers={}, guys={}", risers, guys);
        return new Counts(risers, guys);
    }

    private static String clientItemType(JSONObject item) {
        return JsonTrees.text(JsonTrees.object(item, "clientItem"), "type", "").toUpperCase(Locale.ROOT);
    }

    private static String lower(String text) {
        return text == null ? "" : text.toLowerCase(Locale.ROOT);
    }
}
