package com.phillippitts.makeready.service.survey;

import com.phillippitts.makeready.util.JsonTrees;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONObject;

import java.util.List;

/**
 * Locates the classification record (trace) of a surveyed wire.
 *
 * <p>Survey exports store traces in several shapes. Lookup order:
 * <ol>
 *   <li>{@code traces[id]}</li>
 *   <li>{@code traces.trace_data[id]}</li>
 *   <li>{@code traces.trace_items[id]}</li>
 *   <li>any other top-level trace group holding the id one level down</li>
 * </ol>
 * First match wins. A miss is logged at DEBUG and yields an empty object; lookups never throw.
 */
public final class TraceResolver {

    private static final Logger LOG = LogManager.getLogger(TraceResolver.class);

    private static final List<String> SUB_COLLECTIONS = List.of("trace_data", "trace_items");

    private final JSONObject traces;

    public TraceResolver(JSONObject survey) {
        this.traces = JsonTrees.object(survey, "traces");
    }

    /**
     * @param traceId trace identifier (nullable)
     * @return the trace record, or an empty object when not found
     */
    public JSONObject resolve(String traceId) {
        if (traceId == null || traceId.isBlank()) {
            return new JSONObject();
        }
        String id = traceId.trim();

        JSONObject direct = traces.optJSONObject(id);
        if (direct != null) {
            return direct;
        }
        for (String group : SUB_COLLECTIONS) {
            JSONObject nested = JsonTrees.object(traces, group).optJSONObject(id);
            if (nested != null) {
                return nested;
            }
        }
        for (String group : JsonTrees.sortedKeys(traces)) {
            JSONObject candidate = traces.optJSONObject(group);
            JSONObject nested = candidate == null ? null : candidate.optJSONObject(id);
            if (nested != null) {
                return nested;
            }
        }
        LOG.debug("Trace {} not found", id);
        return new JSONObject();
    }
}
