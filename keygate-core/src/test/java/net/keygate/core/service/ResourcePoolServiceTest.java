package net.keygate.core.service;

import net.keygate.core.error.ResourceConflictException;
import net.keygate.core.model.Credential;
import net.keygate.core.model.Partition;
import net.keygate.core.policy.PolicyDefaults;
import net.keygate.core.spi.CredentialRepository;
import net.keygate.core.support.DirectTxRunner;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;

class ResourcePoolServiceTest {

    private static final Instant NOW = Instant.parse("2026-05-01T12:00:00Z");

    private CredentialRepository credentials;
    private DirectTxRunner tx;
    private ResourcePoolService pool;

    @BeforeEach
    void setUp() {
        credentials = mock(CredentialRepository.class);
        tx = new DirectTxRunner();
        pool = new ResourcePoolService(credentials, tx,
                new PolicyDefaults(Duration.ofSeconds(180), 10, Duration.ofSeconds(30), true));
    }

    private static Credential free(long id) {
        return new Credential(id, Partition.AUTO_ASSIGN, "secret-" + id, null, null, null, false, NOW, NOW);
    }

    private static Credential held(long id, String subject) {
        return new Credential(id, Partition.AUTO_ASSIGN, "secret-" + id, subject, NOW, "batch-" + subject,
                false, NOW, NOW);
    }

    // ========== bulkAssign: 주체별 독립 트랜잭션, 실패는 모아서 보고 ==========
    @Test
    void bulkAssign_eachSubjectInItsOwnTx_failuresAreCollected() throws Exception {
        when(credentials.lockUnassigned(Partition.AUTO_ASSIGN, 1))
                .thenReturn(List.of(free(1)))
                .thenReturn(List.of())
                .thenReturn(List.of(free(3)));
        when(credentials.assign(anyList(), anyString(), anyString())).thenAnswer(inv -> {
            List<Long> ids = inv.getArgument(0);
            String subject = inv.getArgument(1);
            return ids.stream().map(id -> held(id, subject)).toList();
        });

        var report = pool.bulkAssign(List.of("vm-1", "vm-2", "vm-3"), Partition.AUTO_ASSIGN, 1);

        assertEquals(2, report.assigned());
        assertEquals(List.of("vm-1", "vm-3"), report.batches().stream().map(b -> b.subject()).toList());
        assertEquals(List.of("vm-2"), report.failedSubjects());
        assertEquals(1, report.errors().size());
        assertTrue(report.errors().get(0).startsWith("Subject vm-2: "), report.errors().get(0));
        assertEquals(3, tx.requiresNewCalls);
    }

    @Test
    void bulkAssign_blankSubject_isReportedNotThrown() throws Exception {
        var report = pool.bulkAssign(Arrays.asList(" ", null), Partition.AUTO_ASSIGN, 1);

        assertEquals(0, report.assigned());
        assertEquals(2, report.failedSubjects().size());
        verify(credentials, never()).lockUnassigned(any(), anyInt());
    }

    @Test
    void bulkAssign_invalidCount_isRejectedUpFront() throws Exception {
        assertThrows(IllegalArgumentException.class,
                () -> pool.bulkAssign(List.of("vm-1"), Partition.AUTO_ASSIGN, 11));
        assertThrows(IllegalArgumentException.class,
                () -> pool.bulkAssign(List.of("vm-1"), null, 1));
        verifyNoInteractions(credentials);
    }

    // ========== 잠금 순서: 호출자 순서와 무관하게 id 오름차순 ==========
    @Test
    void bulkChangePartition_locksInAscendingIdOrder() throws Exception {
        when(credentials.lockById(anyLong())).thenAnswer(inv -> Optional.of(free((Long) inv.getArgument(0))));

        var report = pool.bulkChangePartition(List.of(9L, 2L, 5L, 2L), Partition.RESERVED);

        assertEquals(3, report.changed());
        InOrder order = inOrder(credentials);
        order.verify(credentials).lockById(2L);
        order.verify(credentials).lockById(5L);
        order.verify(credentials).lockById(9L);
        verify(credentials, times(1)).lockById(2L);
    }

    @Test
    void onSubjectDeleted_locksHeldCredentialsInAscendingIdOrder() throws Exception {
        when(credentials.findAssignedTo("vm-1")).thenReturn(List.of(held(7, "vm-1"), held(3, "vm-1")));
        when(credentials.lockById(anyLong())).thenAnswer(inv -> Optional.of(held((Long) inv.getArgument(0), "vm-1")));
        when(credentials.clearAssignment(anyLong())).thenReturn(true);

        assertEquals(2, pool.onSubjectDeleted("vm-1"));
        InOrder order = inOrder(credentials);
        order.verify(credentials).lockById(3L);
        order.verify(credentials).lockById(7L);
    }

    // ========== 충돌은 도메인 예외 ==========
    @Test
    void retire_assignedCredential_isConflict() throws Exception {
        when(credentials.lockById(4L)).thenReturn(Optional.of(held(4, "vm-1")));

        assertThrows(ResourceConflictException.class, () -> pool.retire(4L));
        verify(credentials, never()).retire(anyLong());
    }

    @Test
    void requestBatches_requiresSubject() {
        assertThrows(IllegalArgumentException.class, () -> pool.requestBatches(" "));
    }
}
