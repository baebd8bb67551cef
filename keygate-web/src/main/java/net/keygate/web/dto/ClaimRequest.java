package net.keygate.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public class ClaimRequest {

    /** enum 이름 또는 라벨 ("auto-assign") */
    @NotBlank(message = "partition is required")
    private String partition;

    @Min(value = 1, message = "count must be >= 1")
    private int count = 1;

    @NotBlank(message = "subject is required")
    private String subject;

    public String getPartition() {
        return partition;
    }

    public void setPartition(String partition) {
        this.partition = partition;
    }

    public int getCount() {
        return count;
    }

    public void setCount(int count) {
        this.count = count;
    }

    public String getSubject() {
        return subject;
    }

    public void setSubject(String subject) {
        this.subject = subject;
    }
}
