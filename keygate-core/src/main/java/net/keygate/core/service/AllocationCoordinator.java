package net.keygate.core.service;

import net.keygate.core.error.InvalidTokenException;
import net.keygate.core.error.KeygateException;
import net.keygate.core.error.RejectionReason;
import net.keygate.core.error.ResourceConflictException;
import net.keygate.core.error.ResourceNotFoundException;
import net.keygate.core.model.AcquireResult;
import net.keygate.core.model.BulkAssignReport;
import net.keygate.core.model.BulkChangeReport;
import net.keygate.core.model.ClaimedBatch;
import net.keygate.core.model.Credential;
import net.keygate.core.model.CredentialPayload;
import net.keygate.core.model.Handoff;
import net.keygate.core.model.IssuedToken;
import net.keygate.core.model.Partition;
import net.keygate.core.model.PoolStats;
import net.keygate.core.model.Product;
import net.keygate.core.model.ProductPayload;
import net.keygate.core.model.QueueStatus;
import net.keygate.core.model.ReleaseOutcome;
import net.keygate.core.model.RequestBatch;
import net.keygate.core.model.Slot;
import net.keygate.core.model.SlotResult;
import net.keygate.core.model.TokenPurpose;
import net.keygate.core.model.TokenStats;
import net.keygate.core.model.TokenSubject;
import net.keygate.core.policy.PolicyRegistry;
import net.keygate.core.policy.PolicySnapshot;
import net.keygate.core.spi.AuditEvent;
import net.keygate.core.spi.AuditSink;
import net.keygate.core.spi.Clock;
import net.keygate.core.spi.ProductRepository;
import net.keygate.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Function;

/**
 * 경계 오퍼레이션 파사드.
 * 오퍼레이션 하나 = {@code tx.required} 하나. 결과가 정해진 뒤 감사 이벤트를 한 번 보낸다.
 */
public final class AllocationCoordinator {
    private static final Logger log = LoggerFactory.getLogger(AllocationCoordinator.class);

    public static final String CREDENTIAL_FETCH_PATH = "/api/handoff/credential";
    public static final String PRODUCT_FETCH_PATH = "/api/handoff/product";

    private final ResourcePoolService pool;
    private final SlotLedgerService ledger;
    private final TokenIssuer tokens;
    private final ProductRepository products;
    private final PolicyRegistry policy;
    private final TxRunner tx;
    private final AuditSink audit;
    private final Clock clock;
    private final String handoffBaseUrl;

    public AllocationCoordinator(ResourcePoolService pool,
                                 SlotLedgerService ledger,
                                 TokenIssuer tokens,
                                 ProductRepository products,
                                 PolicyRegistry policy,
                                 TxRunner tx,
                                 AuditSink audit,
                                 Clock clock,
                                 String handoffBaseUrl) {
        this.pool = pool;
        this.ledger = ledger;
        this.tokens = tokens;
        this.products = products;
        this.policy = policy;
        this.tx = tx;
        this.audit = audit;
        this.clock = clock;
        this.handoffBaseUrl = stripTrailingSlash(handoffBaseUrl);
    }

    // --- credentials ---

    public ClaimedBatch claimCredentials(Partition partition, int count, String subject) throws Exception {
        return audited("credential.claim", subject, details("partition", partition, "count", count),
                () -> tx.required(() -> pool.claim(partition, count, subject)),
                b -> "CLAIMED batch=" + b.batchId());
    }

    /** 주체별 트랜잭션이라 바깥 트랜잭션으로 감싸지 않는다 */
    public BulkAssignReport bulkAssignCredentials(List<String> subjects, Partition partition, int countPerSubject)
            throws Exception {
        return audited("credential.claim.bulk", null,
                details("partition", partition, "subjects", subjects == null ? 0 : subjects.size(),
                        "countPerSubject", countPerSubject),
                () -> pool.bulkAssign(subjects, partition, countPerSubject),
                r -> "ASSIGNED " + r.assigned() + ", FAILED " + r.failedSubjects().size());
    }

    public List<RequestBatch> requestBatches(String subject) throws Exception {
        return pool.requestBatches(subject);
    }

    public ReleaseOutcome releaseCredential(long credentialId) throws Exception {
        return audited("credential.release", null, details("credentialId", credentialId),
                () -> tx.required(() -> pool.release(credentialId)),
                ReleaseOutcome::name);
    }

    public Credential changePartition(long credentialId, Partition partition) throws Exception {
        return audited("credential.partition", null, details("credentialId", credentialId, "partition", partition),
                () -> tx.required(() -> pool.changePartition(credentialId, partition)),
                c -> "CHANGED");
    }

    public BulkChangeReport bulkChangePartition(List<Long> ids, Partition partition) throws Exception {
        return audited("credential.partition.bulk", null,
                details("partition", partition, "requested", ids == null ? 0 : ids.size()),
                () -> tx.required(() -> pool.bulkChangePartition(ids, partition)),
                r -> "CHANGED " + r.changed() + ", SKIPPED " + r.skipped());
    }

    /** 할당된 크리덴셜에 대해서만 credential-payload 토큰 발급 */
    public Handoff issueCredentialHandoff(long credentialId) throws Exception {
        return audited("credential.handoff", null, details("credentialId", credentialId),
                () -> tx.required(() -> {
                    Credential c = pool.find(credentialId);
                    if (!c.assigned() || c.retired()) {
                        throw new ResourceConflictException("Credential " + credentialId + " is not assigned");
                    }
                    IssuedToken t = tokens.issue(TokenPurpose.CREDENTIAL_PAYLOAD, String.valueOf(credentialId),
                            policy.defaults().credentialTokenTtl());
                    return new Handoff(TokenPurpose.CREDENTIAL_PAYLOAD, String.valueOf(credentialId), t.raw(),
                            t.expiresAt(), handoffBaseUrl + CREDENTIAL_FETCH_PATH, Map.of());
                }),
                h -> "ISSUED");
    }

    /**
     * 토큰 소비 후 크리덴셜 로드. 발급 이후 할당이 풀렸거나 바뀌었으면 무효 처리(소비도 롤백).
     */
    public CredentialPayload fetchCredentialPayload(String raw, String address) throws Exception {
        return audited("credential.fetch", null, details("address", address),
                () -> tx.required(() -> {
                    TokenSubject ts = tokens.validateAndConsume(raw, TokenPurpose.CREDENTIAL_PAYLOAD, address);
                    Credential c = pool.find(ts.subjectAsLong());
                    boolean stillHeld = c.assigned() && !c.retired()
                            && (c.assignedAt() == null || !c.assignedAt().isAfter(ts.issuedAt()));
                    if (!stillHeld) {
                        log.warn("Credential {} no longer held by its token's assignee", c.id());
                        throw new InvalidTokenException(RejectionReason.SUBJECT_UNAVAILABLE);
                    }
                    return new CredentialPayload(c.id(), c.partition(), c.payload());
                }),
                p -> "DELIVERED credential=" + p.credentialId());
    }

    // --- slots ---

    public AcquireResult acquireSlot(long productId, String holder, String address) throws Exception {
        return audited("slot.acquire", holder, details("productId", productId, "address", address),
                () -> tx.required(() -> ledger.acquire(productId, holder, address)),
                r -> r.isGranted() ? "GRANTED slot=" + r.slotId() : "WAIT " + r.reason());
    }

    /**
     * 이미 terminal이면 ALREADY_RELEASED. 아니면 이 슬롯에 묶인 slot-release 토큰을 소비한 뒤 반납.
     */
    public ReleaseOutcome releaseSlot(long slotId, String raw, SlotResult result, Integer elapsedSeconds)
            throws Exception {
        return releaseSlot(slotId, raw, result, elapsedSeconds, null);
    }

    /** @param address 반납 요청자 주소. null이면 슬롯 보유자 주소로 기록. */
    public ReleaseOutcome releaseSlot(long slotId, String raw, SlotResult result, Integer elapsedSeconds,
                                      String address) throws Exception {
        return audited("slot.release", null, details("slotId", slotId, "result", result, "elapsed", elapsedSeconds),
                () -> tx.required(() -> {
                    Slot s = ledger.lock(slotId);
                    if (s.status().terminal()) return ReleaseOutcome.ALREADY_RELEASED;

                    TokenSubject ts = tokens.validateAndConsume(raw, TokenPurpose.SLOT_RELEASE,
                            address != null ? address : s.holderAddress());
                    if (!String.valueOf(slotId).equals(ts.subject())) {
                        log.warn("Slot-release token {} is bound to slot {}, not {}", ts.tokenId(), ts.subject(), slotId);
                        throw new InvalidTokenException(RejectionReason.SUBJECT_MISMATCH);
                    }
                    return ledger.release(slotId, result, elapsedSeconds);
                }),
                ReleaseOutcome::name);
    }

    // --- products ---

    public Handoff issueProductHandoff(long productId) throws Exception {
        return audited("product.handoff", null, details("productId", productId),
                () -> tx.required(() -> {
                    PolicySnapshot.ProductPolicy p = policy.product(productId)
                            .filter(PolicySnapshot.ProductPolicy::active)
                            .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
                    IssuedToken t = tokens.issue(TokenPurpose.PRODUCT_PAYLOAD, String.valueOf(productId), p.tokenTtl());
                    Map<String, String> extra = new LinkedHashMap<>();
                    if (p.downloadFilename() != null) extra.put("download_filename", p.downloadFilename());
                    return new Handoff(TokenPurpose.PRODUCT_PAYLOAD, String.valueOf(productId), t.raw(),
                            t.expiresAt(), handoffBaseUrl + PRODUCT_FETCH_PATH, extra);
                }),
                h -> "ISSUED");
    }

    public ProductPayload fetchProductPayload(String raw, String address) throws Exception {
        return audited("product.fetch", null, details("address", address),
                () -> tx.required(() -> {
                    TokenSubject ts = tokens.validateAndConsume(raw, TokenPurpose.PRODUCT_PAYLOAD, address);
                    Product p = products.findById(ts.subjectAsLong())
                            .filter(Product::active)
                            .orElseThrow(() -> new InvalidTokenException(RejectionReason.SUBJECT_UNAVAILABLE));
                    return new ProductPayload(p.id(), p.name(), p.payload(), p.downloadFilename());
                }),
                p -> "DELIVERED product=" + p.productId());
    }

    // --- lifecycle / stats ---

    public int onSubjectDeleted(String subject) throws Exception {
        return audited("subject.deleted", subject, Map.of(),
                () -> tx.required(() -> pool.onSubjectDeleted(subject)),
                n -> "RELEASED " + n);
    }

    public List<PoolStats> poolStats(Partition partition) throws Exception {
        return pool.stats(partition);
    }

    public List<QueueStatus> queueStatus(Long productId) throws Exception {
        return ledger.queueStatus(productId);
    }

    public List<TokenStats> tokenStats(TokenPurpose purpose) throws Exception {
        return tokens.stats(purpose);
    }

    // --- audit ---

    private <T> T audited(String action, String subject, Map<String, Object> details,
                          Callable<T> body, Function<T, String> outcome) throws Exception {
        T result;
        try {
            result = body.call();
        } catch (InvalidTokenException e) {
            emit(action, "REJECTED " + e.getReason(), subject, details);
            throw e;
        } catch (KeygateException | IllegalArgumentException | IllegalStateException e) {
            emit(action, "FAILED " + e.getClass().getSimpleName(), subject, details);
            throw e;
        }
        emit(action, outcome.apply(result), subject, details);
        return result;
    }

    private void emit(String action, String outcome, String subject, Map<String, Object> details) {
        try {
            audit.record(new AuditEvent(clock.now(), action, outcome, subject, details));
        } catch (Exception e) {
            log.warn("Audit sink failed for action={} outcome={}", action, outcome, e);
        }
    }

    private static Map<String, Object> details(Object... kv) {
        Map<String, Object> m = new LinkedHashMap<>();
        for (int i = 0; i + 1 < kv.length; i += 2) m.put((String) kv[i], kv[i + 1]);
        return m;
    }

    private static String stripTrailingSlash(String url) {
        if (url == null) return "";
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
