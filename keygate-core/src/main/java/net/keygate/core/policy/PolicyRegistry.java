package net.keygate.core.policy;

import net.keygate.core.model.Product;
import net.keygate.core.spi.Clock;
import net.keygate.core.spi.ProductRepository;
import net.keygate.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 현재 {@link PolicySnapshot}을 들고 있다가 invalidate 시 통째로 교체한다.
 * 첫 조회 때 지연 로드.
 */
public final class PolicyRegistry {
    private static final Logger log = LoggerFactory.getLogger(PolicyRegistry.class);

    private final ProductRepository products;
    private final TxRunner tx;
    private final Clock clock;
    private final PolicyDefaults defaults;
    private final AtomicReference<PolicySnapshot> current = new AtomicReference<>();

    public PolicyRegistry(ProductRepository products, TxRunner tx, Clock clock, PolicyDefaults defaults) {
        this.products = products; this.tx = tx; this.clock = clock; this.defaults = defaults;
    }

    public PolicySnapshot snapshot() throws Exception {
        PolicySnapshot s = current.get();
        return s != null ? s : invalidate();
    }

    public PolicyDefaults defaults() {
        return defaults;
    }

    /** 스냅샷에 없으면 한 번 다시 읽고 재조회 */
    public Optional<PolicySnapshot.ProductPolicy> product(long productId) throws Exception {
        Optional<PolicySnapshot.ProductPolicy> hit = snapshot().product(productId);
        if (hit.isPresent()) return hit;
        return invalidate().product(productId);
    }

    public PolicySnapshot invalidate() throws Exception {
        List<Product> all = tx.required(products::findAll);
        PolicySnapshot fresh = new PolicySnapshot(defaults, all, clock.now());
        current.set(fresh);
        log.debug("Policy snapshot loaded: products={}", fresh.productCount());
        return fresh;
    }
}
