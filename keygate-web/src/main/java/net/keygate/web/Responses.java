package net.keygate.web;

import net.keygate.core.model.ReleaseOutcome;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Map;

final class Responses {
    private Responses() {}

    /** 중복 반납은 409 */
    static ResponseEntity<Map<String, Object>> release(ReleaseOutcome outcome) {
        if (outcome == ReleaseOutcome.ALREADY_RELEASED) {
            return ResponseEntity.status(HttpStatus.CONFLICT)
                    .body(Map.of("error", "Already released", "status", "already_released"));
        }
        return ResponseEntity.ok(Map.of("status", "released"));
    }
}
