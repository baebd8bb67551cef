package net.keygate.core.model;

import java.util.List;

public record BulkChangeReport(int changed, int skipped, List<String> errors) {
    public BulkChangeReport {
        errors = List.copyOf(errors);
    }
}
