package com.bookkeeper.ingest.dedup;

import com.bookkeeper.ingest.model.Disposition;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Outcome of resolving one batch.
 *
 * @param resolved                 one entry per input row, in input order
 * @param existingGroupAssignments stored transaction id to the group id it newly joins
 * @param touchedGroups            groups formed or grown by this batch
 */
public record ResolutionResult(
        List<ResolvedTransaction> resolved,
        Map<Long, String> existingGroupAssignments,
        Set<String> touchedGroups
) {

    public List<ResolvedTransaction> toInsert() {
        return resolved.stream().filter(r -> r.disposition().inserts()).toList();
    }

    public long count(Disposition disposition) {
        return resolved.stream().filter(r -> r.disposition() == disposition).count();
    }
}
