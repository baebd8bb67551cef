package net.keygate.core.model;

import java.util.List;

/** 주체별 독립 클레임 결과. assigned는 할당된 크리덴셜 총수. */
public record BulkAssignReport(int assigned, List<ClaimedBatch> batches, List<String> failedSubjects,
                               List<String> errors) {
    public BulkAssignReport {
        batches = List.copyOf(batches);
        failedSubjects = List.copyOf(failedSubjects);
        errors = List.copyOf(errors);
    }
}
