package net.keygate.web;

import jakarta.servlet.http.HttpServletRequest;
import net.keygate.core.model.CredentialPayload;
import net.keygate.core.model.ProductPayload;
import net.keygate.core.service.AllocationCoordinator;
import org.springframework.http.CacheControl;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * 세션 없는 부팅 스크립트용 수령 엔드포인트. 인증은 bearer 토큰 하나뿐이고 한 번 쓰면 끝.
 */
@RestController
@RequestMapping("/api/handoff")
public class HandoffController {

    private final AllocationCoordinator coordinator;

    public HandoffController(AllocationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/credential")
    public ResponseEntity<CredentialPayload> credential(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest http) throws Exception {
        var payload = coordinator.fetchCredentialPayload(BearerTokens.extract(authorization), http.getRemoteAddr());
        return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(payload);
    }

    @GetMapping("/product")
    public ResponseEntity<ProductPayload> product(
            @RequestHeader(value = HttpHeaders.AUTHORIZATION, required = false) String authorization,
            HttpServletRequest http) throws Exception {
        var payload = coordinator.fetchProductPayload(BearerTokens.extract(authorization), http.getRemoteAddr());
        return ResponseEntity.ok().cacheControl(CacheControl.noStore()).body(payload);
    }
}
