package net.keygate.web;

import net.keygate.core.model.Partition;
import net.keygate.core.model.PoolStats;
import net.keygate.core.model.QueueStatus;
import net.keygate.core.model.TokenPurpose;
import net.keygate.core.model.TokenStats;
import net.keygate.core.service.AllocationCoordinator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/stats")
public class StatsController {

    private final AllocationCoordinator coordinator;

    public StatsController(AllocationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    @GetMapping("/pool")
    public ResponseEntity<List<PoolStats>> pool(@RequestParam(value = "partition", required = false) String partition)
            throws Exception {
        return ResponseEntity.ok(coordinator.poolStats(partition == null ? null : Partition.from(partition)));
    }

    @GetMapping("/queue")
    public ResponseEntity<List<QueueStatus>> queue(@RequestParam(value = "productId", required = false) Long productId)
            throws Exception {
        return ResponseEntity.ok(coordinator.queueStatus(productId));
    }

    @GetMapping("/tokens")
    public ResponseEntity<List<TokenStats>> tokens(@RequestParam(value = "purpose", required = false) String purpose)
            throws Exception {
        return ResponseEntity.ok(coordinator.tokenStats(purpose == null ? null : TokenPurpose.from(purpose)));
    }
}
