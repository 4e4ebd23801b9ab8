package com.phillippitts.makeready.service.attribute;

import com.phillippitts.makeready.util.JsonTrees;
import org.json.JSONObject;

/**
 * Pole attributes of a survey node.
 */
public final class SurveyAttributeExtractor {

    static final String DEFAULT_SPECIES = "Southern Pine";

    private SurveyAttributeExtractor() {}

    public static SourceAttributes extract(JSONObject node) {
        JSONObject attributes = JsonTrees.object(node, "attributes");
        String owner = AttributeValues.text(attributes, "pole_owner", "PoleOwner");
        return new SourceAttributes(owner, structure(attributes), null, null, notes(attributes));
    }

    /** {@code "<height>-<class> <species>"}, else the node's own {@code pole_structure}. */
    static String structure(JSONObject attributes) {
        String height = AttributeValues.text(attributes, "pole_height", "PoleHeight");
        String poleClass = AttributeValues.text(attributes, "pole_class", "PoleClass");
        String species = AttributeValues.text(attributes, "pole_species", "PoleSpecies");
        if (height != null && poleClass != null) {
            return height + "-" + poleClass + " " + (species == null ? DEFAULT_SPECIES : species);
        }
        return AttributeValues.text(attributes, "pole_structure");
    }

    /** Make-ready notes, or null when the node has none. */
    public static String notes(JSONObject attributes) {
        return AttributeValues.text(attributes, "kat_mr_notes", "kat_MR_notes", "stress_MR_notes");
    }

    /** Numeric {@code passing_capacity}, or null. */
    public static Double passingCapacity(JSONObject attributes) {
        String text = AttributeValues.text(attributes, "passing_capacity");
        return text == null ? null : JsonTrees.number(text.replace("%", ""));
    }
}
