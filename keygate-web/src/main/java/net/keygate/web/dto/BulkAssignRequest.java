package net.keygate.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;

import java.util.ArrayList;
import java.util.List;

public class BulkAssignRequest {

    @NotBlank(message = "partition is required")
    private String partition;

    @NotEmpty(message = "subjects is required")
    private List<String> subjects = new ArrayList<>();

    @Min(value = 1, message = "countPerSubject must be >= 1")
    private int countPerSubject = 1;

    public String getPartition() {
        return partition;
    }

    public void setPartition(String partition) {
        this.partition = partition;
    }

    public List<String> getSubjects() {
        return subjects;
    }

    public void setSubjects(List<String> subjects) {
        this.subjects = subjects;
    }

    public int getCountPerSubject() {
        return countPerSubject;
    }

    public void setCountPerSubject(int countPerSubject) {
        this.countPerSubject = countPerSubject;
    }
}
