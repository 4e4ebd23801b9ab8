package com.phillippitts.makeready.domain;

import java.util.List;
import java.util.Objects;

/**
 * A backspan or reference span: its header and the attachments photographed on it.
 */
public record SpanBlock(SpanHeader header, List<AttachmentRecord> attachments) {

    public SpanBlock {
        Objects.requireNonNull(header, "header must not be null");
        attachments = attachments == null ? List.of() : List.copyOf(attachments);
    }

    public SpanKind kind() {
        return header.kind();
    }
}
