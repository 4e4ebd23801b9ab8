package com.phillippitts.makeready.service.attribute;

import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.List;
import java.util.Locale;

/**
 * Pole attributes of an engineering location.
 */
public final class EngineeringAttributeExtractor {

    private static final Logger LOG = LogManager.getLogger(EngineeringAttributeExtractor.class);

    static final String RECOMMENDED_DESIGN = "Recommended Design";

    private EngineeringAttributeExtractor() {}

    /**
     * @param location    engineering location of the pole (nullable)
     * @param engineering whole engineering document, for the construction grade (nullable)
     */
    public static SourceAttributes extract(JSONObject location, JSONObject engineering) {
        if (location == null) {
            return SourceAttributes.NONE;
        }
        String owner = scalar(JsonTrees.value(JsonTrees.object(location, "poleTags"), "owner"));
        if (owner == null) {
            owner = JsonTrees.text(JsonTrees.object(location, "owner"), "id");
        }
        String notes = JsonTrees.text(JsonTrees.object(location, "analysis"), "notes");
        return new SourceAttributes(blankToNull(owner), structure(location), constructionGrade(engineering),
                plaPercentage(location), blankToNull(notes));
    }

    /**
     * {@code "<height>-<class> <species>"} or {@code "<height>-<class>"} from pole tags, direct
     * fields, then the first alias id.
     */
    static String structure(JSONObject location) {
        JSONObject tags = JsonTrees.object(location, "poleTags");
        String height = firstScalar(tags, location, "height");
        String poleClass = firstScalar(tags, location, "class");
        String species = firstScalar(tags, location, "species");

        if (height == null || poleClass == null) {
            List<JSONObject> aliases = JsonTrees.objects(location, "aliases");
            String alias = aliases.isEmpty() ? null : JsonTrees.text(aliases.get(0), "id");
            if (alias != null && alias.contains("-")) {
                String[] parts = alias.split("-", 2);
                height = height == null ? blankToNull(parts[0]) : height;
                poleClass = poleClass == null ? blankToNull(parts[1]) : poleClass;
            }
        }
        if (height == null || poleClass == null) {
            LOG.debug("Incomplete pole structure for location {}", JsonTrees.text(location, "label"));
            return null;
        }
        return species == null ? height + "-" + poleClass : height + "-" + poleClass + " " + species;
    }

    /** First {@code clientData.analysisCases[].constructionGrade}. */
    static String constructionGrade(JSONObject engineering) {
        for (JSONObject analysisCase : JsonTrees.objects(JsonTrees.object(engineering, "clientData"), "analysisCases")) {
            if (analysisCase.has("constructionGrade")) {
                return scalar(JsonTrees.value(analysisCase, "constructionGrade"));
            }
        }
        return null;
    }

    /**
     * Pole stress result of the first analysis of the recommended design, as {@code "78.70%"}.
     */
    static String plaPercentage(JSONObject location) {
        for (JSONObject design : JsonTrees.objects(location, "designs")) {
            if (!RECOMMENDED_DESIGN.equals(JsonTrees.text(design, "label"))) {
                continue;
            }
            List<JSONObject> analyses = JsonTrees.objects(design, "analysis");
            if (analyses.isEmpty()) {
                return null;
            }
            for (JSONObject result : JsonTrees.objects(analyses.get(0), "results")) {
                if (!"Pole".equals(JsonTrees.text(result, "component"))
                        || !"STRESS".equals(JsonTrees.text(result, "analysisType"))) {
                    continue;
                }
                Object actual = JsonTrees.value(result, "actual");
                Double value = JsonTrees.number(actual);
                if (value != null) {
                    return String.format(Locale.ROOT, "%.2f%%", value);
                }
                if (actual instanceof String text) {
                    return text;
                }
            }
            return null;
        }
        return null;
    }

    private static String firstScalar(JSONObject primary, JSONObject fallback, String key) {
        String value = scalar(JsonTrees.value(primary, key));
        return value != null ? value : scalar(JsonTrees.value(fallback, key));
    }

    /** Scalar as text; integral numbers render without a fraction ({@code 40}, not {@code 40.0}). */
    static String scalar(Object raw) {
        if (raw instanceof Number number) {
            double value = number.doubleValue();
            if (value == Math.rint(value) && !Double.isInfinite(value)) {
                return Long.toString((long) value);
            }
            return number.toString();
        }
        AttributeValue value = AttributeValue.of(raw);
        return value == null ? null : value.text();
    }

    private static String blankToNull(String text) {
        return text == null || text.isBlank() ? null : text.trim();
    }
}
