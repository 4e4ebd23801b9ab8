package com.phillippitts.makeready.service.source;

import com.phillippitts.makeready.service.survey.TraceResolver;
import org.json.JSONObject;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Lookups built once per batch from both documents and shared read-only by every pole.
 *
 * <p>Pole keys are normalized pole ids (trailing digits of the pole label).
 */
public final class SourceIndex {

    private final JSONObject survey;
    private final JSONObject engineering;
    private final TraceResolver traces;
    private final Map<String, JSONObject> locationsByPole;
    private final List<String> poleSequence;
    private final Map<WireKey, JSONObject> wiresByEndpoints;
    private final Map<String, String> nodeIdsByPole;

    SourceIndex(JSONObject survey, JSONObject engineering, TraceResolver traces,
                Map<String, JSONObject> locationsByPole, List<String> poleSequence,
                Map<WireKey, JSONObject> wiresByEndpoints, Map<String, String> nodeIdsByPole) {
        this.survey = Objects.requireNonNull(survey, "survey must not be null");
        this.engineering = engineering;
        this.traces = Objects.requireNonNull(traces, "traces must not be null");
        this.locationsByPole = Map.copyOf(locationsByPole);
        this.poleSequence = List.copyOf(poleSequence);
        this.wiresByEndpoints = Map.copyOf(wiresByEndpoints);
        this.nodeIdsByPole = Map.copyOf(nodeIdsByPole);
    }

    public JSONObject survey() {
        return survey;
    }

    /** Engineering document, or null for a survey-only batch. */
    public JSONObject engineering() {
        return engineering;
    }

    public boolean hasEngineering() {
        return engineering != null;
    }

    public TraceResolver traces() {
        return traces;
    }

    /** Engineering location of a pole, or null when the engineering data does not cover it. */
    public JSONObject location(String normalizedPole) {
        return normalizedPole == null ? null : locationsByPole.get(normalizedPole);
    }

    /** Normalized pole ids in the order the engineering document lists them. */
    public List<String> poleSequence() {
        return poleSequence;
    }

    /** Zero-based sequence position, or -1 for a pole outside the sequence. */
    public int sequenceIndex(String normalizedPole) {
        return normalizedPole == null ? -1 : poleSequence.indexOf(normalizedPole);
    }

    /** One-based operation number, or null for a pole outside the sequence. */
    public Integer operationNumber(String normalizedPole) {
        int index = sequenceIndex(normalizedPole);
        return index < 0 ? null : index + 1;
    }

    /** Pole visited immediately before {@code normalizedPole}. */
    public Optional<String> previousPole(String normalizedPole) {
        int index = sequenceIndex(normalizedPole);
        return index > 0 ? Optional.of(poleSequence.get(index - 1)) : Optional.empty();
    }

    /** First survey node (in key order) carrying the given pole number. */
    public Optional<String> nodeIdForPole(String normalizedPole) {
        return Optional.ofNullable(normalizedPole == null ? null : nodeIdsByPole.get(normalizedPole));
    }

    /**
     * Engineering wire of {@code owner} spanning exactly the given endpoints.
     *
     * @param normalizedOwner owner as returned by {@code OwnerNormalizer.normalize}
     * @param endpoints       normalized pole ids, any order
     */
    public Optional<JSONObject> wire(String normalizedOwner, List<String> endpoints) {
        return Optional.ofNullable(wiresByEndpoints.get(WireKey.of(normalizedOwner, endpoints)));
    }

    int wireCount() {
        return wiresByEndpoints.size();
    }
}
