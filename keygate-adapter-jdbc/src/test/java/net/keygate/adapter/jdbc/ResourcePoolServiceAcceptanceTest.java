package net.keygate.adapter.jdbc;

import net.keygate.adapter.jdbc.repo.JdbcCredentialRepository;
import net.keygate.core.error.InsufficientResourcesException;
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
import net.keygate.core.service.ResourcePoolService;
import net.keygate.core.spi.CredentialRepository;
import net.keygate.core.spi.TxRunner;
import org.junit.jupiter.api.*;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * 크리덴셜 풀 인수 테스트
 * - 동시 클레임 시 중복 할당 없음 (SKIP LOCKED)
 * - 부족하면 전부 롤백
 * - 파티션 격리
 */
@TestMethodOrder(MethodOrderer.MethodName.class)
class ResourcePoolServiceAcceptanceTest extends TestSupport {

    TxRunner tx;
    CredentialRepository credentials;
    ResourcePoolService pool;

    @BeforeAll
    void initAll() {
        tx = new JdbcTxRunner(ds);
        credentials = new JdbcCredentialRepository(ds);
        pool = new ResourcePoolService(credentials, tx, PolicyDefaults.standard());
    }

    @BeforeEach
    void clean() throws Exception {
        truncateAll(tx);
    }

    private void seed(Partition partition, int n) throws Exception {
        List<String> payloads = IntStream.range(0, n)
                .mapToObj(i -> "[Interface]\nPrivateKey = key-" + partition.code() + "-" + i)
                .toList();
        pool.importCredentials(partition, payloads);
    }

    // ========== t1: 20 동시 호출 × 3개, 100개 풀 → 60개 서로소 ==========
    @Test
    void t1_concurrentClaims_areDisjoint() throws Exception {
        seed(Partition.AUTO_ASSIGN, 100);

        int callers = 20;
        ExecutorService es = Executors.newFixedThreadPool(callers);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClaimedBatch>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            String subject = "instance-" + i;
            futures.add(es.submit(() -> {
                start.await();
                return pool.claim(Partition.AUTO_ASSIGN, 3, subject);
            }));
        }
        start.countDown();

        Set<Long> ids = new HashSet<>();
        int total = 0;
        for (Future<ClaimedBatch> f : futures) {
            ClaimedBatch b = f.get(60, TimeUnit.SECONDS);   // 하나라도 실패하면 여기서 ExecutionException
            assertEquals(3, b.size());
            for (Credential c : b.credentials()) {
                ids.add(c.id());
                assertEquals(b.subject(), c.assignedTo());
                assertEquals(b.batchId(), c.batchId());
            }
            total += b.size();
        }
        es.shutdown();

        assertEquals(60, total);
        assertEquals(60, ids.size(), "no credential may be handed out twice");
        PoolStats s = pool.stats(Partition.AUTO_ASSIGN).get(0);
        assertEquals(60, s.assigned());
        assertEquals(40, s.available());
    }

    // ========== t2: 부족 → 예외, 아무것도 바뀌지 않음 ==========
    @Test
    void t2_insufficient_rollsBackEverything() throws Exception {
        seed(Partition.USER_REQUESTABLE, 10);

        var ex = assertThrows(InsufficientResourcesException.class,
                () -> pool.claim(Partition.USER_REQUESTABLE, 15, "user-1"));
        assertEquals(15, ex.getRequested());
        assertEquals(10, ex.getAvailable());

        PoolStats s = pool.stats(Partition.USER_REQUESTABLE).get(0);
        assertEquals(10, s.available());
        assertEquals(0, s.assigned());
        assertEquals(0, count(tx, "SELECT COUNT(*) FROM KG_CREDENTIAL WHERE BATCH_ID IS NOT NULL"));
    }

    // ========== t3: claim → release → 같은 풀에서 다시 클레임 가능 ==========
    @Test
    void t3_claimRelease_roundTrip() throws Exception {
        seed(Partition.USER_REQUESTABLE, 1);

        ClaimedBatch first = pool.claim(Partition.USER_REQUESTABLE, 1, "user-a");
        long id = first.credentials().get(0).id();
        assertThrows(InsufficientResourcesException.class,
                () -> pool.claim(Partition.USER_REQUESTABLE, 1, "user-b"));

        assertEquals(ReleaseOutcome.RELEASED, pool.release(id));
        assertEquals(ReleaseOutcome.ALREADY_RELEASED, pool.release(id));

        ClaimedBatch second = pool.claim(Partition.USER_REQUESTABLE, 1, "user-b");
        assertEquals(id, second.credentials().get(0).id());
        assertNotEquals(first.batchId(), second.batchId());
        assertEquals(List.of(id), pool.assignedTo("user-b").stream().map(Credential::id).toList());
        assertEquals(1, pool.batch("user-b", second.batchId()).size());
    }

    // ========== t4: 다른 파티션의 행은 절대 안 나옴 ==========
    @Test
    void t4_partitionIsolation() throws Exception {
        seed(Partition.RESERVED, 5);
        seed(Partition.USER_REQUESTABLE, 2);

        assertThrows(InsufficientResourcesException.class,
                () -> pool.claim(Partition.USER_REQUESTABLE, 3, "user-1"));
        ClaimedBatch b = pool.claim(Partition.USER_REQUESTABLE, 2, "user-1");
        assertTrue(b.credentials().stream().allMatch(c -> c.partition() == Partition.USER_REQUESTABLE));
        assertEquals(5, pool.stats(Partition.RESERVED).get(0).available());
    }

    // ========== t5: 할당 중이면 파티션 변경 거절, 반납 후 허용 ==========
    @Test
    void t5_changePartition_onlyWhileUnassigned() throws Exception {
        seed(Partition.USER_REQUESTABLE, 1);
        long id = pool.claim(Partition.USER_REQUESTABLE, 1, "user-1").credentials().get(0).id();

        assertThrows(PartitionChangeRejectedException.class, () -> pool.changePartition(id, Partition.RESERVED));
        assertEquals(Partition.USER_REQUESTABLE, pool.find(id).partition());

        pool.release(id);
        Credential changed = pool.changePartition(id, Partition.RESERVED);
        assertEquals(Partition.RESERVED, changed.partition());
        assertThrows(ResourceNotFoundException.class, () -> pool.changePartition(9_999_999L, Partition.RESERVED));
    }

    // ========== t6: 일괄 변경은 할당/미존재 id를 건너뛰고 보고 ==========
    @Test
    void t6_bulkChange_skipsAssignedAndUnknown() throws Exception {
        seed(Partition.USER_REQUESTABLE, 3);
        List<Long> all = tx.required(() -> credentials.lockUnassigned(Partition.USER_REQUESTABLE, 3))
                .stream().map(Credential::id).toList();
        long held = pool.claim(Partition.USER_REQUESTABLE, 1, "user-1").credentials().get(0).id();

        List<Long> ids = new ArrayList<>(all);
        ids.add(424242L);
        BulkChangeReport r = pool.bulkChangePartition(ids, Partition.AUTO_ASSIGN);

        assertEquals(2, r.changed());
        assertEquals(2, r.skipped());
        assertEquals(Partition.USER_REQUESTABLE, pool.find(held).partition());
        assertEquals(2, pool.stats(Partition.AUTO_ASSIGN).get(0).total());
    }

    // ========== t7: 주체 삭제 → 기본은 유지, 플래그 켜면 반납 ==========
    @Test
    void t7_subjectDeletion_respectsFlag() throws Exception {
        seed(Partition.AUTO_ASSIGN, 4);
        pool.claim(Partition.AUTO_ASSIGN, 2, "instance-x");

        assertEquals(0, pool.onSubjectDeleted("instance-x"));
        assertEquals(2, pool.assignedTo("instance-x").size());

        var releasing = new ResourcePoolService(credentials, tx,
                new PolicyDefaults(PolicyDefaults.DEFAULT_CREDENTIAL_TOKEN_TTL, 25, PolicyDefaults.DEFAULT_RETRY_AFTER, true));
        assertEquals(2, releasing.onSubjectDeleted("instance-x"));
        assertTrue(pool.assignedTo("instance-x").isEmpty());
    }

    // ========== t8: 요청 개수 상한 / 퇴역 ==========
    @Test
    void t8_countBounds_andRetire() throws Exception {
        seed(Partition.RESERVED, 2);
        assertThrows(IllegalArgumentException.class, () -> pool.claim(Partition.RESERVED, 0, "s"));
        assertThrows(IllegalArgumentException.class, () -> pool.claim(Partition.RESERVED, 26, "s"));

        long id = tx.required(() -> credentials.lockUnassigned(Partition.RESERVED, 1)).get(0).id();
        long other = pool.claim(Partition.RESERVED, 1, "holder").credentials().get(0).id();
        assertThrows(ResourceConflictException.class, () -> pool.retire(other));
        pool.release(other);
        pool.retire(id);
        assertEquals(1, pool.stats(Partition.RESERVED).get(0).total());
        assertThrows(InsufficientResourcesException.class, () -> pool.claim(Partition.RESERVED, 2, "s"));
    }

    // ========== t9: 파티션을 섞은 동시 클레임: 각자 자기 파티션 행만 받는다 ==========
    @Test
    void t9_concurrentClaimsAcrossPartitions_stayIsolated() throws Exception {
        seed(Partition.USER_REQUESTABLE, 20);
        seed(Partition.AUTO_ASSIGN, 20);
        seed(Partition.RESERVED, 20);

        Partition[] partitions = Partition.values();
        int callers = 24;
        ExecutorService es = Executors.newFixedThreadPool(12);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<ClaimedBatch>> futures = new ArrayList<>();
        for (int i = 0; i < callers; i++) {
            Partition p = partitions[i % partitions.length];
            String subject = p.code() + "-" + i;
            futures.add(es.submit(() -> {
                start.await();
                return pool.claim(p, 2, subject);
            }));
        }
        start.countDown();

        Set<Long> ids = new HashSet<>();
        for (int i = 0; i < callers; i++) {
            Partition expected = partitions[i % partitions.length];
            ClaimedBatch b = futures.get(i).get(60, TimeUnit.SECONDS);
            assertEquals(2, b.size());
            for (Credential c : b.credentials()) {
                assertEquals(expected, c.partition());
                assertTrue(ids.add(c.id()));
            }
        }
        es.shutdown();

        for (Partition p : partitions) {
            PoolStats s = pool.stats(p).get(0);
            assertEquals(16, s.assigned(), p.label());
            assertEquals(4, s.available(), p.label());
        }
    }

    // ========== t10: 일괄 할당: 주체별 독립, 부족한 주체만 실패 ==========
    @Test
    void t10_bulkAssign_isIndependentPerSubject() throws Exception {
        seed(Partition.AUTO_ASSIGN, 5);

        BulkAssignReport r = pool.bulkAssign(List.of("vm-1", "vm-2", "vm-3"), Partition.AUTO_ASSIGN, 2);

        assertEquals(4, r.assigned());
        assertEquals(2, r.batches().size());
        assertEquals(List.of("vm-3"), r.failedSubjects());
        assertTrue(r.errors().get(0).startsWith("Subject vm-3: "), r.errors().get(0));
        // 실패한 주체의 트랜잭션만 롤백되고 남은 1개는 그대로
        assertEquals(1, pool.stats(Partition.AUTO_ASSIGN).get(0).available());
        assertEquals(2, pool.assignedTo("vm-2").size());
        assertTrue(pool.assignedTo("vm-3").isEmpty());
    }

    // ========== t11: 요청 배치 목록: 배치별 개수, 최근 배치부터 ==========
    @Test
    void t11_requestBatches_groupsBySubjectBatches() throws Exception {
        seed(Partition.USER_REQUESTABLE, 6);
        ClaimedBatch first = pool.claim(Partition.USER_REQUESTABLE, 3, "user-1");
        exec(tx, "UPDATE KG_CREDENTIAL SET ASSIGNED_AT = ASSIGNED_AT - INTERVAL '1 hour' WHERE BATCH_ID = '"
                + first.batchId() + "'");
        ClaimedBatch second = pool.claim(Partition.USER_REQUESTABLE, 2, "user-1");
        pool.claim(Partition.USER_REQUESTABLE, 1, "user-2");

        List<RequestBatch> batches = pool.requestBatches("user-1");

        assertEquals(2, batches.size());
        assertEquals(second.batchId(), batches.get(0).batchId());
        assertEquals(2, batches.get(0).count());
        assertEquals(first.batchId(), batches.get(1).batchId());
        assertEquals(3, batches.get(1).count());
        assertTrue(batches.get(1).requestedAt().isBefore(batches.get(0).requestedAt()));
        assertTrue(pool.requestBatches("nobody").isEmpty());
    }

    // ========== t12: 겹치는 id를 반대 순서로 동시에 일괄 변경해도 교착 없음 ==========
    @Test
    void t12_overlappingBulkChanges_inOppositeOrder_complete() throws Exception {
        seed(Partition.USER_REQUESTABLE, 40);
        List<Long> ids = tx.required(() -> credentials.lockUnassigned(Partition.USER_REQUESTABLE, 40))
                .stream().map(Credential::id).toList();
        List<Long> reversed = new ArrayList<>(ids);
        Collections.reverse(reversed);

        int rounds = 8;
        ExecutorService es = Executors.newFixedThreadPool(2);
        try {
            for (int i = 0; i < rounds; i++) {
                CountDownLatch start = new CountDownLatch(1);
                Future<BulkChangeReport> a = es.submit(() -> {
                    start.await();
                    return pool.bulkChangePartition(ids, Partition.RESERVED);
                });
                Future<BulkChangeReport> b = es.submit(() -> {
                    start.await();
                    return pool.bulkChangePartition(reversed, Partition.AUTO_ASSIGN);
                });
                start.countDown();
                // 교착이면 한쪽이 40P01로 실패한다
                assertEquals(40, a.get(60, TimeUnit.SECONDS).changed());
                assertEquals(40, b.get(60, TimeUnit.SECONDS).changed());
            }
        } finally {
            es.shutdown();
        }
        assertEquals(40, count(tx, "SELECT COUNT(*) FROM KG_CREDENTIAL WHERE PARTITION IN ('RESERVED', 'AUTO_ASSIGN')"));
    }
}
