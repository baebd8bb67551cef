package net.keygate.web.dto;

import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

public class SlotReleaseRequest {

    /** success | error | expired */
    @NotBlank(message = "result is required")
    private String result;

    @Min(value = 0, message = "elapsedSeconds must be >= 0")
    private Integer elapsedSeconds;

    public String getResult() {
        return result;
    }

    public void setResult(String result) {
        this.result = result;
    }

    public Integer getElapsedSeconds() {
        return elapsedSeconds;
    }

    public void setElapsedSeconds(Integer elapsedSeconds) {
        this.elapsedSeconds = elapsedSeconds;
    }
}
