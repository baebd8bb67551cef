package net.keygate.core.spi;

import net.keygate.core.model.Credential;
import net.keygate.core.model.Partition;
import net.keygate.core.model.PoolStats;
import net.keygate.core.model.RequestBatch;

import java.util.List;
import java.util.Optional;

public interface CredentialRepository {
    Credential insert(Partition partition, String payload) throws Exception;

    /**
     * 미할당 행을 최대 {@code count}개 잠가서 가져온다(SKIP LOCKED).
     * 반환 개수가 count보다 적을 수 있다.
     */
    List<Credential> lockUnassigned(Partition partition, int count) throws Exception;

    /** 잠근 행들을 한 배치로 할당 */
    List<Credential> assign(List<Long> ids, String subject, String batchId) throws Exception;

    Optional<Credential> lockById(long id) throws Exception;
    Optional<Credential> findById(long id) throws Exception;

    /** @return true if an assignment was cleared */
    boolean clearAssignment(long id) throws Exception;
    void updatePartition(long id, Partition partition) throws Exception;
    void retire(long id) throws Exception;

    List<Credential> findAssignedTo(String subject) throws Exception;
    List<Credential> findBatch(String subject, String batchId) throws Exception;

    /** 주체의 배치별 개수와 최초 할당 시각. 최근 배치부터. */
    List<RequestBatch> findBatches(String subject) throws Exception;
    PoolStats stats(Partition partition) throws Exception;
}
