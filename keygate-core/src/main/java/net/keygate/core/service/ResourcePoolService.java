package net.keygate.core.service;

import net.keygate.core.error.InsufficientResourcesException;
import net.keygate.core.error.KeygateException;
import net.keygate.core.error.PartitionChangeRejectedException;
import net.keygate.core.error.ResourceConflictException;
import net.keygate.core.error.ResourceNotFoundException;
import net.keygate.core.model.BulkAssignReport;
import net.keygate.core.model.BulkChangeReport;
import net.keygate.core.model.ClaimedBatch;
import net.keygate.core.model.Credential;
import net.keygate.core.model.Partition;
import net.keygate.core.model.PoolStats;
import net.keygate.core.model.ReleaseOutcome;
import net.keygate.core.model.RequestBatch;
import net.keygate.core.policy.PolicyDefaults;
import net.keygate.core.spi.CredentialRepository;
import net.keygate.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/** 파티션별 크리덴셜 풀: 클레임/반납/재분류 */
public final class ResourcePoolService {
    private static final Logger log = LoggerFactory.getLogger(ResourcePoolService.class);

    private final CredentialRepository credentials;
    private final TxRunner tx;
    private final PolicyDefaults defaults;

    public ResourcePoolService(CredentialRepository credentials, TxRunner tx, PolicyDefaults defaults) {
        this.credentials = credentials; this.tx = tx; this.defaults = defaults;
    }

    /**
     * 전부 아니면 전무. 잠글 수 있는 미할당 행이 count보다 적으면
     * {@link InsufficientResourcesException}을 던지고 트랜잭션은 롤백된다.
     */
    public ClaimedBatch claim(Partition partition, int count, String subject) throws Exception {
        if (partition == null) throw new IllegalArgumentException("partition is required");
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject is required");
        if (count < 1 || count > defaults.maxClaimCount()) {
            throw new IllegalArgumentException("count must be between 1 and " + defaults.maxClaimCount());
        }

        return tx.required(() -> {
            List<Credential> locked = credentials.lockUnassigned(partition, count);
            if (locked.size() < count) {
                throw new InsufficientResourcesException(partition, count, locked.size());
            }
            String batchId = UUID.randomUUID().toString();
            List<Long> ids = locked.stream().map(Credential::id).toList();
            List<Credential> assigned = credentials.assign(ids, subject, batchId);
            log.info("Credentials claimed: partition={}, count={}, subject={}, batch={}",
                    partition.label(), count, subject, batchId);
            return new ClaimedBatch(batchId, subject, assigned);
        });
    }

    /**
     * 주체마다 독립된 트랜잭션으로 count개씩 클레임한다. 한 주체가 실패해도 나머지는 진행.
     * 인자 자체가 잘못되면 아무것도 하지 않고 던진다.
     */
    public BulkAssignReport bulkAssign(List<String> subjects, Partition partition, int countPerSubject)
            throws Exception {
        if (partition == null) throw new IllegalArgumentException("partition is required");
        if (countPerSubject < 1 || countPerSubject > defaults.maxClaimCount()) {
            throw new IllegalArgumentException("count must be between 1 and " + defaults.maxClaimCount());
        }
        if (subjects == null || subjects.isEmpty()) return new BulkAssignReport(0, List.of(), List.of(), List.of());

        int assigned = 0;
        List<ClaimedBatch> batches = new ArrayList<>();
        List<String> failed = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        for (String subject : subjects) {
            try {
                ClaimedBatch b = tx.requiresNew(() -> claim(partition, countPerSubject, subject));
                batches.add(b);
                assigned += b.size();
            } catch (KeygateException | IllegalArgumentException e) {
                failed.add(String.valueOf(subject));
                errors.add("Subject " + subject + ": " + e.getMessage());
            }
        }
        log.info("Bulk assign: partition={}, subjects={}, assigned={}, failed={}",
                partition.label(), subjects.size(), assigned, failed.size());
        return new BulkAssignReport(assigned, batches, failed, errors);
    }

    /** 멱등. 이미 미할당이면 ALREADY_RELEASED */
    public ReleaseOutcome release(long credentialId) throws Exception {
        return tx.required(() -> {
            Credential c = credentials.lockById(credentialId)
                    .orElseThrow(() -> new ResourceNotFoundException("Credential", credentialId));
            if (!c.assigned()) return ReleaseOutcome.ALREADY_RELEASED;
            credentials.clearAssignment(credentialId);
            log.info("Credential released: id={}, was assigned to {}", credentialId, c.assignedTo());
            return ReleaseOutcome.RELEASED;
        });
    }

    public Credential changePartition(long credentialId, Partition partition) throws Exception {
        if (partition == null) throw new IllegalArgumentException("partition is required");
        return tx.required(() -> {
            Credential c = credentials.lockById(credentialId)
                    .orElseThrow(() -> new ResourceNotFoundException("Credential", credentialId));
            if (c.assigned()) throw new PartitionChangeRejectedException(credentialId, c.assignedTo());
            if (c.partition() != partition) {
                credentials.updatePartition(credentialId, partition);
                log.info("Credential partition changed: id={}, {} -> {}", credentialId,
                        c.partition().label(), partition.label());
            }
            return credentials.findById(credentialId).orElseThrow();
        });
    }

    /** 할당 중이거나 없는 id는 건너뛰고 보고한다. 잠금은 id 오름차순. */
    public BulkChangeReport bulkChangePartition(List<Long> ids, Partition partition) throws Exception {
        if (partition == null) throw new IllegalArgumentException("partition is required");
        if (ids == null || ids.isEmpty()) return new BulkChangeReport(0, 0, List.of());

        List<Long> ordered = ids.stream().filter(Objects::nonNull).distinct().sorted().toList();
        return tx.required(() -> {
            int changed = 0;
            List<String> errors = new ArrayList<>();
            for (Long id : ordered) {
                var found = credentials.lockById(id);
                if (found.isEmpty()) {
                    errors.add("Credential " + id + " not found");
                    continue;
                }
                Credential c = found.get();
                if (c.assigned()) {
                    errors.add("Credential " + id + " is assigned to " + c.assignedTo());
                    continue;
                }
                if (c.partition() != partition) credentials.updatePartition(id, partition);
                changed++;
            }
            log.info("Bulk partition change: target={}, changed={}, skipped={}",
                    partition.label(), changed, errors.size());
            return new BulkChangeReport(changed, errors.size(), errors);
        });
    }

    /** 임포트 피드 진입점. 빈 payload는 무시. */
    public List<Credential> importCredentials(Partition partition, List<String> payloads) throws Exception {
        if (partition == null) throw new IllegalArgumentException("partition is required");
        return tx.required(() -> {
            List<Credential> out = new ArrayList<>();
            for (String payload : payloads) {
                if (payload == null || payload.isBlank()) continue;
                out.add(credentials.insert(partition, payload));
            }
            log.info("Credentials imported: partition={}, count={}", partition.label(), out.size());
            return out;
        });
    }

    public void retire(long credentialId) throws Exception {
        tx.required(() -> {
            Credential c = credentials.lockById(credentialId)
                    .orElseThrow(() -> new ResourceNotFoundException("Credential", credentialId));
            if (c.assigned()) {
                throw new ResourceConflictException("Credential " + credentialId + " is assigned; release it first");
            }
            credentials.retire(credentialId);
            return null;
        });
    }

    public Credential find(long credentialId) throws Exception {
        return tx.required(() -> credentials.findById(credentialId))
                .orElseThrow(() -> new ResourceNotFoundException("Credential", credentialId));
    }

    public List<Credential> assignedTo(String subject) throws Exception {
        return tx.required(() -> credentials.findAssignedTo(subject));
    }

    public List<Credential> batch(String subject, String batchId) throws Exception {
        return tx.required(() -> credentials.findBatch(subject, batchId));
    }

    public List<RequestBatch> requestBatches(String subject) throws Exception {
        if (subject == null || subject.isBlank()) throw new IllegalArgumentException("subject is required");
        return tx.required(() -> credentials.findBatches(subject));
    }

    public List<PoolStats> stats(Partition partition) throws Exception {
        List<Partition> targets = partition == null ? List.of(Partition.values()) : List.of(partition);
        return tx.required(() -> {
            List<PoolStats> out = new ArrayList<>();
            for (Partition p : targets) out.add(credentials.stats(p));
            return out;
        });
    }

    /**
     * 소비 주체가 삭제됐을 때. 플래그가 꺼져 있으면 할당을 유지하고 로그만 남긴다.
     * @return 반납된 개수
     */
    public int onSubjectDeleted(String subject) throws Exception {
        return tx.required(() -> {
            List<Credential> held = credentials.findAssignedTo(subject);
            if (held.isEmpty()) return 0;
            if (!defaults.releaseOnSubjectDeletion()) {
                log.info("Subject {} deleted; keeping {} assigned credential(s)", subject, held.size());
                return 0;
            }
            int released = 0;
            List<Credential> ordered = new ArrayList<>(held);
            ordered.sort(Comparator.comparingLong(Credential::id));
            for (Credential c : ordered) {
                var locked = credentials.lockById(c.id());
                if (locked.isPresent() && subject.equals(locked.get().assignedTo()) && credentials.clearAssignment(c.id())) {
                    released++;
                }
            }
            log.info("Subject {} deleted; released {} credential(s)", subject, released);
            return released;
        });
    }
}
