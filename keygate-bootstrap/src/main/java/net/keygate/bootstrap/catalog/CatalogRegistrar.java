package net.keygate.bootstrap.catalog;

import net.keygate.bootstrap.props.KeygateProperties;
import net.keygate.core.model.Product;
import net.keygate.core.policy.PolicyRegistry;
import net.keygate.core.spi.ProductRepository;
import net.keygate.core.spi.SlotRepository;
import net.keygate.core.spi.TxRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * 설정의 상품 카탈로그를 이름 기준으로 upsert.
 * 라이브 슬롯이 있는 상품의 상한/payload/TTL 변경은 건너뛰고 경고만 남긴다.
 * 상품 행을 배타 잠금한 뒤 슬롯을 세므로 그 사이 acquire가 끼어들지 못한다.
 */
public class CatalogRegistrar {
    private static final Logger log = LoggerFactory.getLogger(CatalogRegistrar.class);

    private final ProductRepository products;
    private final SlotRepository slots;
    private final PolicyRegistry policy;
    private final TxRunner tx;

    public CatalogRegistrar(ProductRepository products,
                            SlotRepository slots,
                            PolicyRegistry policy,
                            TxRunner tx) {
        this.products = products;
        this.slots = slots;
        this.policy = policy;
        this.tx = tx;
    }

    /** @return upsert된 상품 수 */
    public int register(KeygateProperties.Catalog catalog) throws Exception {
        int applied = 0;
        for (var def : catalog.getProducts()) {
            if (upsertProduct(def)) applied++;
        }
        policy.invalidate();
        return applied;
    }

    private boolean upsertProduct(KeygateProperties.ProductDef def) throws Exception {
        if (def.getName() == null || def.getName().isBlank() || def.getPayload() == null) {
            throw new IllegalArgumentException("product.name and product.payload are required");
        }
        if (def.getMaxConcurrentSlots() < 1) {
            throw new IllegalArgumentException("product.maxConcurrentSlots must be >= 1: " + def.getName());
        }
        if (belowOneSecond(def.getSlotTtl()) || belowOneSecond(def.getTokenTtl())) {
            throw new IllegalArgumentException("product.slotTtl and product.tokenTtl must be at least 1 second: "
                    + def.getName());
        }

        var wanted = new Product(null, def.getName(), def.getDescription(), def.getPayload(),
                def.getMaxConcurrentSlots(), def.getSlotTtl(), def.getTokenTtl(), def.isActive(),
                def.getDownloadFilename(), Instant.now(), Instant.now());

        return tx.required(() -> {
            var existing = products.lockByName(def.getName());
            if (existing.isPresent() && !existing.get().samePolicyAs(wanted)) {
                int live = slots.countGranted(existing.get().id());
                if (live > 0) {
                    log.warn("Catalog update skipped: product='{}' has {} live slot(s)", def.getName(), live);
                    return false;
                }
            }
            var saved = products.upsertByName(wanted);
            log.info("Catalog registered: product='{}' id={} max={} active={}",
                    saved.name(), saved.id(), saved.maxConcurrentSlots(), saved.active());
            return true;
        });
    }

    private static boolean belowOneSecond(Duration d) {
        return d == null || d.compareTo(Duration.ofSeconds(1)) < 0;
    }
}
