package com.phillippitts.makeready.service.attachment;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.util.HeightFormat;
import com.phillippitts.makeready.util.JsonTrees;
import com.phillippitts.makeready.util.OwnerNormalizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Builds attachment records from the measured and recommended designs of an engineering
 * location.
 *
 * <p>Measured items become existing attachments. Each recommended item is matched against the
 * measured items (type-qualified key, then item id, then a relaxed Charter/Spectrum keyword
 * match); a matched item whose height differs by at least the change tolerance gets the
 * recommended height as its proposed height. Unmatched recommended items are new installs.
 * Items without a height or without a description are skipped.
 */
public final class EngineeringAttachmentExtractor {

    private static final Logger LOG = LogManager.getLogger(EngineeringAttachmentExtractor.class);

    static final String MEASURED_DESIGN = "measured design";
    static final String RECOMMENDED_DESIGN = "recommended design";

    private static final String KEY_SEPARATOR = "||";
    private static final List<String> RELAXED_KEYWORDS =
            List.of("fiber", "optic", "coax", "drop", "messenger", "service", "com");

    private final double changeToleranceInches;

    public EngineeringAttachmentExtractor(double changeToleranceInches) {
        if (changeToleranceInches < 0) {
            throw new IllegalArgumentException("changeToleranceInches must be >= 0");
        }
        this.changeToleranceInches = changeToleranceInches;
    }

    /**
     * @param location engineering location of the pole (nullable)
     * @return records keyed by simple and detailed keys, in design order; empty without designs
     */
    public Map<String, AttachmentRecord> extract(JSONObject location) {
        JSONObject measured = design(location, MEASURED_DESIGN);
        JSONObject recommended = design(location, RECOMMENDED_DESIGN);
        if (measured == null && recommended == null) {
            return Map.of();
        }

        List<Entry> entries = new ArrayList<>();
        for (DesignItem item : items(measured)) {
            AttachmentRecord record = AttachmentRecord.existing(item.description(), item.heightInches());
            entries.add(new Entry(item, item.underground() ? record.withUnderground(true) : record));
        }
        int measuredCount = entries.size();

        for (DesignItem item : items(recommended)) {
            Optional<Entry> match = findMatch(entries.subList(0, measuredCount), item);
            if (match.isPresent()) {
                applyRecommended(match.get(), item);
            } else {
                AttachmentRecord record = AttachmentRecord.newInstall(item.description(), item.heightInches());
                entries.add(new Entry(item, item.underground() ? record.withUnderground(true) : record));
            }
        }

        Map<String, AttachmentRecord> byKey = new LinkedHashMap<>();
        for (Entry entry : entries) {
            byKey.put(entry.item.simpleKey(), entry.record);
            byKey.put(entry.item.detailedKey(), entry.record);
        }
        LOG.debug("Engineering location yielded {} measured and {} total items", measuredCount, entries.size());
        return byKey;
    }

    private void applyRecommended(Entry entry, DesignItem recommended) {
        entry.matched = true;
        AttachmentRecord record = entry.record;
        if (Math.abs(record.existingHeight() - recommended.heightInches()) >= changeToleranceInches) {
            record = record.withProposedHeight(recommended.heightInches());
        }
        if (recommended.underground() || record.underground()) {
            record = record.withUnderground(true);
        }
        entry.record = record;
    }

    private static Optional<Entry> findMatch(List<Entry> measured, DesignItem item) {
        for (Entry entry : measured) {
            if (!entry.matched && entry.item.matchKey().equals(item.matchKey())) {
                return Optional.of(entry);
            }
        }
        if (!item.id().isEmpty()) {
            for (Entry entry : measured) {
                if (!entry.matched && item.id().equals(entry.item.id())) {
                    return Optional.of(entry);
                }
            }
        }
        if (AttachmentDescriptions.isCharterFamily(item.owner() + " " + item.description())) {
            for (Entry entry : measured) {
                if (!entry.matched && relaxedMatch(entry.item, item)) {
                    return Optional.of(entry);
                }
            }
        }
        return Optional.empty();
    }

    /** Both items are Charter/Spectrum and their descriptions share a keyword. */
    static boolean relaxedMatch(DesignItem measured, DesignItem recommended) {
        if (!AttachmentDescriptions.isCharterFamily(measured.owner() + " " + measured.description())) {
            return false;
        }
        String a = (measured.rawDescription() + " " + measured.type()).toLowerCase(Locale.ROOT);
        String b = (recommended.rawDescription() + " " + recommended.type()).toLowerCase(Locale.ROOT);
        return RELAXED_KEYWORDS.stream().anyMatch(k -> a.contains(k) && b.contains(k));
    }

    static JSONObject design(JSONObject location, String label) {
        for (JSONObject design : JsonTrees.objects(location, "designs")) {
            String designLabel = JsonTrees.text(design, "label", "");
            if (designLabel.trim().equalsIgnoreCase(label)) {
                return design;
            }
        }
        return null;
    }

    private static List<DesignItem> items(JSONObject design) {
        List<DesignItem> result = new ArrayList<>();
        if (design == null) {
            return result;
        }
        JSONObject structure = JsonTrees.object(design, "structure");
        for (JSONObject wire : JsonTrees.objects(structure, "wires")) {
            JSONObject clientItem = JsonTrees.object(wire, "clientItem");
            String description = JsonTrees.text(clientItem, "description", "");
            addItem(result, wire, description, JsonTrees.text(clientItem, "type", ""),
                    JsonTrees.text(wire, "usageGroup", ""));
        }
        for (JSONObject equipment : JsonTrees.objects(structure, "equipments")) {
            JSONObject clientItem = JsonTrees.object(equipment, "clientItem");
            String type = JsonTrees.text(clientItem, "type", "");
            addItem(result, equipment, JsonTrees.text(clientItem, "description", type), type, "");
        }
        return result;
    }

    private static void addItem(List<DesignItem> target, JSONObject raw, String description, String type,
                                String usageGroup) {
        String owner = JsonTrees.text(JsonTrees.object(raw, "owner"), "id", "");
        String id = JsonTrees.text(raw, "id", "");
        Double meters = JsonTrees.number(JsonTrees.object(raw, "attachmentHeight"), "value");
        String formatted = AttachmentDescriptions.format(owner, description);
        if (meters == null || formatted.isBlank()) {
            LOG.debug("Skipping design item {}: missing height or description", id);
            return;
        }
        target.add(new DesignItem(owner, description, formatted, type, usageGroup, id,
                HeightFormat.metersToInches(meters), AttachmentDescriptions.isUnderground(description, type)));
    }

    /**
     * A wire or equipment item of one design, heights already in inches.
     */
    record DesignItem(String owner, String rawDescription, String description, String type,
                      String usageGroup, String id, double heightInches, boolean underground) {

        private String ownerKey() {
            return Objects.toString(OwnerNormalizer.normalize(owner), "");
        }

        String simpleKey() {
            return ownerKey() + KEY_SEPARATOR + AttachmentDescriptions.normalizeType(rawDescription);
        }

        String matchKey() {
            return simpleKey() + KEY_SEPARATOR + type.trim().toLowerCase(Locale.ROOT);
        }

        String detailedKey() {
            return matchKey() + KEY_SEPARATOR + usageGroup + KEY_SEPARATOR + id;
        }
    }

    private static final class Entry {
        private final DesignItem item;
        private AttachmentRecord record;
        private boolean matched;

        private Entry(DesignItem item, AttachmentRecord record) {
            this.item = item;
            this.record = record;
        }
    }
}
