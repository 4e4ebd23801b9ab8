package com.phillippitts.makeready.service.span;

import com.phillippitts.makeready.domain.ConnectionSummary;
import com.phillippitts.makeready.domain.SpanBlock;
import com.phillippitts.makeready.domain.SpanMidspanHeights;
import com.phillippitts.makeready.service.survey.SpanWire;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything derived from the connections of one pole.
 *
 * @param connections    one summary per connection touching the pole
 * @param primarySpan    summary used for the pole's primary-span columns
 * @param referenceSpans reference-span blocks in connection order
 * @param backspan       backspan block, or null
 * @param spanWires      every photographed wire on every connection of the pole
 * @param midspanHeights lowest mid-span heights per span to another pole
 */
public record ConnectionResult(
        List<ConnectionSummary> connections,
        ConnectionSummary primarySpan,
        List<SpanBlock> referenceSpans,
        SpanBlock backspan,
        List<SpanWire> spanWires,
        List<SpanMidspanHeights> midspanHeights
) {

    public ConnectionResult {
        Objects.requireNonNull(primarySpan, "primarySpan must not be null");
        connections = List.copyOf(connections);
        referenceSpans = List.copyOf(referenceSpans);
        spanWires = List.copyOf(spanWires);
        midspanHeights = List.copyOf(midspanHeights);
    }

    public Optional<SpanBlock> backspanBlock() {
        return Optional.ofNullable(backspan);
    }
}
