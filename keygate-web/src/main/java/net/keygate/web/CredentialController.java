package net.keygate.web;

import jakarta.validation.Valid;
import net.keygate.core.model.BulkChangeReport;
import net.keygate.core.model.Partition;
import net.keygate.core.model.RequestBatch;
import net.keygate.core.service.AllocationCoordinator;
import net.keygate.core.service.ResourcePoolService;
import net.keygate.web.dto.*;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

/** 크리덴셜 풀 경계. 호출자 인증/권한은 앞단에서 끝난 상태로 들어온다. */
@RestController
@RequestMapping("/api/credentials")
public class CredentialController {

    private final AllocationCoordinator coordinator;
    private final ResourcePoolService pool;

    public CredentialController(AllocationCoordinator coordinator, ResourcePoolService pool) {
        this.coordinator = coordinator;
        this.pool = pool;
    }

    @PostMapping("/claim")
    public ResponseEntity<ClaimResponse> claim(@Valid @RequestBody ClaimRequest req) throws Exception {
        var batch = coordinator.claimCredentials(Partition.from(req.getPartition()), req.getCount(), req.getSubject());
        return ResponseEntity.ok(ClaimResponse.of(batch));
    }

    /** 주체마다 독립 클레임. 일부 실패해도 200으로 보고한다. */
    @PostMapping("/bulk-assign")
    public ResponseEntity<BulkAssignResponse> bulkAssign(@Valid @RequestBody BulkAssignRequest req) throws Exception {
        var report = coordinator.bulkAssignCredentials(req.getSubjects(), Partition.from(req.getPartition()),
                req.getCountPerSubject());
        return ResponseEntity.ok(BulkAssignResponse.of(report));
    }

    @GetMapping("/batches")
    public ResponseEntity<List<RequestBatch>> batches(@RequestParam("subject") String subject) throws Exception {
        return ResponseEntity.ok(coordinator.requestBatches(subject));
    }

    @PostMapping("/{id}/release")
    public ResponseEntity<Map<String, Object>> release(@PathVariable("id") long id) throws Exception {
        return Responses.release(coordinator.releaseCredential(id));
    }

    @PutMapping("/{id}/partition")
    public ResponseEntity<CredentialView> changePartition(@PathVariable("id") long id,
                                                          @Valid @RequestBody PartitionChangeRequest req) throws Exception {
        var changed = coordinator.changePartition(id, Partition.from(req.getPartition()));
        return ResponseEntity.ok(CredentialView.of(changed));
    }

    @PostMapping("/partition")
    public ResponseEntity<BulkChangeReport> bulkChangePartition(@Valid @RequestBody PartitionChangeRequest req)
            throws Exception {
        return ResponseEntity.ok(coordinator.bulkChangePartition(req.getIds(), Partition.from(req.getPartition())));
    }

    @PostMapping("/{id}/handoff")
    public ResponseEntity<HandoffResponse> handoff(@PathVariable("id") long id) throws Exception {
        return ResponseEntity.status(HttpStatus.CREATED).body(HandoffResponse.of(coordinator.issueCredentialHandoff(id)));
    }

    /** 임포트 피드 진입점 */
    @PostMapping("/import")
    public ResponseEntity<Map<String, Object>> importCredentials(@Valid @RequestBody ImportRequest req) throws Exception {
        var partition = Partition.from(req.getPartition());
        List<Long> ids = pool.importCredentials(partition, req.getPayloads()).stream().map(c -> c.id()).toList();
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(Map.of("partition", partition.label(), "imported", ids.size(), "ids", ids));
    }

    @GetMapping("/{id}")
    public ResponseEntity<CredentialView> get(@PathVariable("id") long id) throws Exception {
        return ResponseEntity.ok(CredentialView.of(pool.find(id)));
    }

    @GetMapping
    public ResponseEntity<List<CredentialView>> assignedTo(@RequestParam("subject") String subject) throws Exception {
        return ResponseEntity.ok(pool.assignedTo(subject).stream().map(CredentialView::of).toList());
    }
}
