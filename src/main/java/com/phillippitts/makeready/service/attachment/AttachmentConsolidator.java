package com.phillippitts.makeready.service.attachment;

import com.phillippitts.makeready.domain.AttachmentRecord;
import com.phillippitts.makeready.util.OwnerNormalizer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Merges the engineering and survey attachment maps of one pole into a single list.
 *
 * <p>Engineering records are authoritative when present. The survey map then only contributes
 * midspan values: a moved attachment with no midspan inherits the survey midspan of the same
 * description. Records are grouped by description and the group member carrying both an
 * existing and a proposed height wins. Output is sorted tallest first (stable).
 */
public final class AttachmentConsolidator {

    /** Tallest first: existing height, proposed height for new installs. */
    public static final Comparator<AttachmentRecord> BY_HEIGHT_DESCENDING =
            Comparator.comparingDouble(AttachmentRecord::sortHeight).reversed();

    public List<AttachmentRecord> consolidate(Map<String, AttachmentRecord> engineering,
                                              Map<String, AttachmentRecord> survey) {
        Map<String, AttachmentRecord> surveyByDescription = new LinkedHashMap<>();
        for (AttachmentRecord record : survey.values()) {
            surveyByDescription.putIfAbsent(record.description(), record);
        }

        List<AttachmentRecord> result = new ArrayList<>();
        if (engineering.isEmpty()) {
            result.addAll(surveyByDescription.values());
        } else {
            for (List<AttachmentRecord> group : groupByDescription(engineering.values()).values()) {
                AttachmentRecord best = group.stream()
                        .filter(r -> r.hasExisting() && r.hasProposed())
                        .findFirst()
                        .orElse(group.get(0));
                result.add(inheritMidspan(best, surveyByDescription.get(best.description())));
            }
        }
        result.sort(BY_HEIGHT_DESCENDING);
        return result;
    }

    /**
     * Owners whose attachments move or are proposed, as owner tokens of their descriptions.
     */
    public Set<String> ownersWithChanges(Collection<AttachmentRecord> attachments) {
        Set<String> owners = new LinkedHashSet<>();
        for (AttachmentRecord record : attachments) {
            if (record.isMoved() || record.isNewInstall() || record.proposed()) {
                String owner = OwnerNormalizer.ownerOfDescription(record.description());
                if (owner != null) {
                    owners.add(owner);
                }
            }
        }
        return owners;
    }

    private static Map<String, List<AttachmentRecord>> groupByDescription(Collection<AttachmentRecord> records) {
        Map<String, List<AttachmentRecord>> groups = new LinkedHashMap<>();
        Set<AttachmentRecord> seen = Collections.newSetFromMap(new IdentityHashMap<>());
        for (AttachmentRecord record : records) {
            if (seen.add(record)) {
                groups.computeIfAbsent(record.description(), d -> new ArrayList<>()).add(record);
            }
        }
        return groups;
    }

    private static AttachmentRecord inheritMidspan(AttachmentRecord record, AttachmentRecord surveyRecord) {
        if (record.isMoved() && !record.midspan().isSet()
                && surveyRecord != null && surveyRecord.midspan().isSet()) {
            return record.withMidspan(surveyRecord.midspan());
        }
        return record;
    }
}
