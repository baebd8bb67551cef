package net.keygate.web;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import net.keygate.core.model.SlotResult;
import net.keygate.core.service.AllocationCoordinator;
import net.keygate.web.dto.AcquireRequest;
import net.keygate.web.dto.AcquireResponse;
import net.keygate.web.dto.SlotReleaseRequest;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/api/slots")
public class SlotController {

    private final AllocationCoordinator coordinator;

    public SlotController(AllocationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    /** 대기열 없음: granted 아니면 wait(+retryAfter) */
    @PostMapping("/acquire")
    public ResponseEntity<AcquireResponse> acquire(@Valid @RequestBody AcquireRequest req,
                                                   HttpServletRequest http) throws Exception {
        var result = coordinator.acquireSlot(req.getProductId(), req.getHolder(), http.getRemoteAddr());
        var body = AcquireResponse.of(result);
        if (!result.isGranted() && body.retryAfter() != null) {
            return ResponseEntity.ok().header(HttpHeaders.RETRY_AFTER, String.valueOf(body.retryAfter())).body(body);
        }
        return ResponseEntity.ok(body);
    }

    /** 반납은 acquire 때 받은 slot-release 토큰으로 */
    @PostMapping("/{id}/release")
    public ResponseEntity<Map<String, Object>> release(@PathVariable("id") long id,
                                                       @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
                                                       @Valid @RequestBody SlotReleaseRequest req,
                                                       HttpServletRequest http) throws Exception {
        String raw = BearerTokens.extract(authorization);
        var outcome = coordinator.releaseSlot(id, raw, SlotResult.from(req.getResult()), req.getElapsedSeconds(),
                http.getRemoteAddr());
        return Responses.release(outcome);
    }
}
