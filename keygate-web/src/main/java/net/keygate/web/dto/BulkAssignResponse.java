package net.keygate.web.dto;

import net.keygate.core.model.BulkAssignReport;

import java.util.List;

/** 한 건이라도 할당되면 success */
public record BulkAssignResponse(boolean success, int assigned, List<ClaimResponse> batches,
                                 List<String> failedSubjects, List<String> errors) {

    public static BulkAssignResponse of(BulkAssignReport r) {
        return new BulkAssignResponse(r.assigned() > 0, r.assigned(),
                r.batches().stream().map(ClaimResponse::of).toList(), r.failedSubjects(), r.errors());
    }
}
