package net.keygate.core.service;

import net.keygate.core.error.ResourceNotFoundException;
import net.keygate.core.model.AcquireResult;
import net.keygate.core.model.IssuedToken;
import net.keygate.core.model.Product;
import net.keygate.core.model.QueueStatus;
import net.keygate.core.model.ReleaseOutcome;
import net.keygate.core.model.Slot;
import net.keygate.core.model.SlotResult;
import net.keygate.core.model.TokenPurpose;
import net.keygate.core.policy.PolicyDefaults;
import net.keygate.core.spi.ProductRepository;
import net.keygate.core.spi.SlotRepository;
import net.keygate.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/** 상품별 동시 설치 슬롯 원장 */
public final class SlotLedgerService {
    private static final Logger log = LoggerFactory.getLogger(SlotLedgerService.class);

    public static final int RECENT_COMPLETIONS = 10;

    private final ProductRepository products;
    private final SlotRepository slots;
    private final TokenIssuer tokens;
    private final TxRunner tx;
    private final PolicyDefaults defaults;

    public SlotLedgerService(ProductRepository products, SlotRepository slots, TokenIssuer tokens,
                             TxRunner tx, PolicyDefaults defaults) {
        this.products = products; this.slots = slots; this.tokens = tokens; this.tx = tx; this.defaults = defaults;
    }

    /**
     * 절대 대기하지 않는다. 상품 행 공유 잠금 → 만료분 정리 → 빈 용량 단위 잠금 → 슬롯 + 반납 토큰.
     * 용량 단위는 상한 개수만큼만 있으므로 동시 acquire도 상한을 넘지 못한다.
     * 상품 행을 카탈로그 갱신이 잡고 있을 때만 CONTENDED.
     */
    public AcquireResult acquire(long productId, String holder, String holderAddress) throws Exception {
        if (holder == null || holder.isBlank()) throw new IllegalArgumentException("holder is required");

        return tx.required(() -> {
            Optional<Product> locked = products.tryShareLockById(productId);
            if (locked.isEmpty()) {
                // 없거나, 정책 변경 중이거나
                Product p = products.findById(productId)
                        .filter(Product::active)
                        .orElseThrow(() -> new ResourceNotFoundException("Product", productId));
                int active = slots.countGranted(productId);
                log.debug("Acquire contended by catalog update: product={}, active={}", productId, active);
                return AcquireResult.waitFor(AcquireResult.WaitReason.CONTENDED, active,
                        p.maxConcurrentSlots(), defaults.retryAfter());
            }

            Product p = locked.get();
            if (!p.active()) throw new ResourceNotFoundException("Product", productId);

            int reaped = slots.reapExpiredForProduct(productId);
            if (reaped > 0) log.info("Reaped {} expired slot(s) of product {} before acquire", reaped, p.name());

            Optional<Integer> unit = slots.claimFreeUnit(productId, p.maxConcurrentSlots());
            if (unit.isEmpty()) {
                int active = slots.countGranted(productId);
                return AcquireResult.waitFor(AcquireResult.WaitReason.CAPACITY_FULL, active,
                        p.maxConcurrentSlots(), defaults.retryAfter());
            }

            Slot slot = slots.insertGranted(productId, holder, holderAddress, p.slotTtl());
            slots.bindUnit(productId, unit.get(), slot.id());
            IssuedToken token = tokens.issue(TokenPurpose.SLOT_RELEASE, String.valueOf(slot.id()), p.slotTtl());
            int active = slots.countGranted(productId);
            log.info("Slot granted: product={}, slot={}, unit={}, holder={}, active={}/{}",
                    p.name(), slot.id(), unit.get(), holder, active, p.maxConcurrentSlots());
            return AcquireResult.granted(slot.id(), token, active, p.maxConcurrentSlots());
        });
    }

    /** 행 잠금 후 조회. 반납 전 토큰 대조용. */
    public Slot lock(long slotId) throws Exception {
        return tx.required(() -> slots.lockById(slotId))
                .orElseThrow(() -> new ResourceNotFoundException("Slot", slotId));
    }

    /** GRANTED → terminal, 한 번만. 두 번째부터는 ALREADY_RELEASED */
    public ReleaseOutcome release(long slotId, SlotResult result, Integer elapsedSeconds) throws Exception {
        if (result == null) throw new IllegalArgumentException("result is required");
        if (elapsedSeconds != null && elapsedSeconds < 0) throw new IllegalArgumentException("elapsedSeconds must be >= 0");

        return tx.required(() -> {
            Slot s = slots.lockById(slotId).orElseThrow(() -> new ResourceNotFoundException("Slot", slotId));
            if (s.status().terminal()) return ReleaseOutcome.ALREADY_RELEASED;
            if (!slots.markTerminal(slotId, result.terminalStatus(), elapsedSeconds)) {
                return ReleaseOutcome.ALREADY_RELEASED;
            }
            log.info("Slot released: slot={}, product={}, result={}, elapsed={}s",
                    slotId, s.productId(), result, elapsedSeconds);
            return ReleaseOutcome.RELEASED;
        });
    }

    /** productId가 null이면 전체 상품 */
    public List<QueueStatus> queueStatus(Long productId) throws Exception {
        return tx.required(() -> {
            List<Product> targets;
            if (productId == null) {
                targets = products.findAll();
            } else {
                targets = List.of(products.findById(productId)
                        .orElseThrow(() -> new ResourceNotFoundException("Product", productId)));
            }
            List<QueueStatus> out = new ArrayList<>();
            for (Product p : targets) {
                out.add(new QueueStatus(p.id(), p.name(), slots.countGranted(p.id()), p.maxConcurrentSlots(),
                        slots.recentCompletions(p.id(), RECENT_COMPLETIONS)));
            }
            return out;
        });
    }
}
