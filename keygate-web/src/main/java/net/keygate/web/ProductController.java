package net.keygate.web;

import net.keygate.core.service.AllocationCoordinator;
import net.keygate.web.dto.HandoffResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/products")
public class ProductController {

    private final AllocationCoordinator coordinator;

    public ProductController(AllocationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @PostMapping("/{id}/handoff")
    public ResponseEntity<HandoffResponse> handoff(@PathVariable("id") long id) throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED).body(HandoffResponse.of(coordinator.issueProductHandoff(id)));
    }
}
