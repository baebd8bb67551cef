package net.keygate.web.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

public class ImportRequest {

    @NotBlank(message = "partition is required")
    private String partition;

    @NotEmpty(message = "payloads must not be empty")
    private List<String> payloads = new ArrayList<>();

    public String getPartition() {
        return partition;
    }

    public void setPartition(String partition) {
        this.partition = partition;
    }

    public List<String> getPayloads() {
        return payloads;
    }

    public void setPayloads(List<String> payloads) {
        this.payloads = payloads;
    }
}
