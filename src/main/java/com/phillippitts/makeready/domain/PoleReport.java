package com.phillippitts.makeready.domain;

import com.phillippitts.makeready.util.HeightFormat;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Final report record for one pole, in the shape consumed by spreadsheet renderers.
 *
 * <p>{@code attachers} is the ordered attacher list: primary attachments, then the backspan
 * block, then reference-span blocks. {@code belowNeutral} is the primary list before the
 * span blocks were appended.
 */
public record PoleReport(
        String nodeId,
        PoleAttributes attributes,
        String proposedRiser,
        String proposedGuy,
        ConnectionSummary primarySpan,
        List<ConnectionSummary> connections,
        String midspanProposed,
        List<AttacherLine> attachers,
        List<AttachmentRecord> belowNeutral,
        PoleAction action,
        PoleStatus status,
        Integer operationNumber,
        List<SpanMidspanHeights> midspanHeights,
        boolean primary
) {

    public PoleReport {
        Objects.requireNonNull(nodeId, "nodeId must not be null");
        Objects.requireNonNull(attributes, "attributes must not be null");
        Objects.requireNonNull(action, "action must not be null");
        Objects.requireNonNull(status, "status must not be null");
        primarySpan = primarySpan == null ? ConnectionSummary.empty(attributes.poleNumber()) : primarySpan;
        connections = connections == null ? List.of() : List.copyOf(connections);
        attachers = attachers == null ? List.of() : List.copyOf(attachers);
        belowNeutral = belowNeutral == null ? List.of() : List.copyOf(belowNeutral);
        midspanHeights = midspanHeights == null ? List.of() : List.copyOf(midspanHeights);
        midspanProposed = midspanProposed == null ? HeightFormat.NOT_AVAILABLE : midspanProposed;
    }

    public static Builder builder(String nodeId, PoleAttributes attributes) {
        return new Builder(nodeId, attributes);
    }

    public String poleNumber() {
        return attributes.poleNumber();
    }

    public String normalizedPoleNumber() {
        return attributes.normalizedPoleNumber();
    }

    public PoleReport withOperationNumber(Integer number, boolean isPrimary) {
        return new PoleReport(nodeId, attributes, proposedRiser, proposedGuy, primarySpan, connections,
                midspanProposed, attachers, belowNeutral, action, status, number, midspanHeights, isPrimary);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("node_id", nodeId);
        row.put("operation_number", operationNumber);
        row.put("pole_number", attributes.poleNumber());
        row.put("norm_pole_number", attributes.normalizedPoleNumber());
        row.put("pole_owner", attributes.owner());
        row.put("pole_structure", attributes.structure());
        row.put("construction_grade", attributes.constructionGrade());
        row.put("pla_percentage", attributes.plaPercentage());
        row.put("proposed_riser", proposedRiser);
        row.put("proposed_guy", proposedGuy);
        row.put("existing_midspan_lowest_com", HeightFormat.toFeetInches(primarySpan.lowestCommunication()));
        row.put("existing_midspan_lowest_cps_electrical", HeightFormat.toFeetInches(primarySpan.lowestElectrical()));
        row.put("midspan_proposed", midspanProposed);
        row.put("from_pole", primarySpan.fromPole());
        row.put("to_pole", primarySpan.toPole());
        row.put("connections", connections.stream().map(ConnectionSummary::toMap).toList());
        row.put("attachers", attachers.stream().map(AttacherLine::toMap).toList());
        row.put("attachments_below_neutral", belowNeutral.stream().map(AttachmentRecord::toMap).toList());
        row.put("pole_action", action.label());
        row.put("status", status.label());
        row.put("latitude", attributes.latitude());
        row.put("longitude", attributes.longitude());
        row.put("midspan_heights", midspanHeights.stream().map(SpanMidspanHeights::toMap).toList());
        row.put("is_primary", primary);
        return row;
    }

    /** Accumulates the pieces produced by the per-pole pipeline. */
    public static final class Builder {

        private final String nodeId;
        private final PoleAttributes attributes;
        private String proposedRiser = "NO";
        private String proposedGuy = "NO";
        private ConnectionSummary primarySpan;
        private List<ConnectionSummary> connections = new ArrayList<>();
        private String midspanProposed;
        private List<AttacherLine> attachers = new ArrayList<>();
        private List<AttachmentRecord> belowNeutral = new ArrayList<>();
        private PoleAction action = PoleAction.EXISTING;
        private PoleStatus status = PoleStatus.NO_CHANGE;
        private Integer operationNumber;
        private List<SpanMidspanHeights> midspanHeights = new ArrayList<>();
        private boolean primary;

        private Builder(String nodeId, PoleAttributes attributes) {
            this.nodeId = nodeId;
            this.attributes = attributes;
        }

        public Builder proposedRiser(String value) {
            this.proposedRiser = value;
            return this;
        }

        public Builder proposedGuy(String value) {
            this.proposedGuy = value;
            return this;
        }

        public Builder primarySpan(ConnectionSummary value) {
            this.primarySpan = value;
            return this;
        }

        public Builder connections(List<ConnectionSummary> value) {
            this.connections = value;
            return this;
        }

        public Builder midspanProposed(String value) {
            this.midspanProposed = value;
            return this;
        }

        public Builder attachers(List<AttacherLine> value) {
            this.attachers = value;
            return this;
        }

        public Builder belowNeutral(List<AttachmentRecord> value) {
            this.belowNeutral = value;
            return this;
        }

        public Builder action(PoleAction value) {
            this.action = value;
            return this;
        }

        public Builder status(PoleStatus value) {
            this.status = value;
            return this;
        }

        public Builder operationNumber(Integer value) {
            this.operationNumber = value;
            return this;
        }

        public Builder midspanHeights(List<SpanMidspanHeights> value) {
            this.midspanHeights = value;
            return this;
        }

        public Builder primary(boolean value) {
            this.primary = value;
            return this;
        }

        public PoleReport build() {
            return new PoleReport(nodeId, attributes, proposedRiser, proposedGuy, primarySpan, connections,
                    midspanProposed, attachers, belowNeutral, action, status, operationNumber,
                    midspanHeights, primary);
        }
    }
}
