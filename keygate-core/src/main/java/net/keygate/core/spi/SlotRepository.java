package net.keygate.core.spi;

import net.keygate.core.model.Slot;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

public interface SlotRepository {
    Slot insertGranted(long productId, String holder, String holderAddress, Duration ttl) throws Exception;

    int countGranted(long productId) throws Exception;

    /**
     * 비어 있는 용량 단위 하나를 잠근다(SKIP LOCKED). 번호가 maxUnits 이하인 단위만 대상.
     * 단위가 비었다는 건 묶인 슬롯이 없거나 이미 terminal이라는 뜻.
     * @return 잠근 단위 번호, 없으면 empty
     */
    Optional<Integer> claimFreeUnit(long productId, int maxUnits) throws Exception;

    /** 잠근 단위에 새 슬롯을 묶는다 */
    void bindUnit(long productId, int unitNo, long slotId) throws Exception;

    Optional<Slot> lockById(long id) throws Exception;

    /** GRANTED → terminal. 이미 terminal이면 false */
    boolean markTerminal(long id, Slot.Status status, Integer elapsedSeconds) throws Exception;

    /** 해당 상품의 만료된 GRANTED 슬롯을 REAPED_EXPIRED로 (잠긴 행은 건너뜀) */
    int reapExpiredForProduct(long productId) throws Exception;

    /** 전체 상품 대상 배치 리핑 */
    int reapExpired(int limit) throws Exception;

    List<Slot> recentCompletions(long productId, int limit) throws Exception;
}
