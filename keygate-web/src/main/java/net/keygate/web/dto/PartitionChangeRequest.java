package net.keygate.web.dto;

import jakarta.validation.constraints.NotBlank;

import java.util.ArrayList;
import java.util.List;

/** 단건(PUT /{id}/partition)은 ids 없이, 일괄(POST /partition)은 ids와 함께 */
public class PartitionChangeRequest {

    @NotBlank(message = "partition is required")
    private String partition;

    private List<Long> ids = new ArrayList<>();

    public String getPartition() {
        return partition;
    }

    public void setPartition(String partition) {
        this.partition = partition;
    }

    public List<Long> getIds() {
        return ids;
    }

    public void setIds(List<Long> ids) {
        this.ids = ids;
    }
}
