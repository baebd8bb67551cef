package net.keygate.core.policy;

import net.keygate.core.model.Product;

import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/** 로드 시점의 상품 정책 + 기본값. 불변. */
public final class PolicySnapshot {

    /** 상품별 정책 (payload 제외) */
    public record ProductPolicy(long productId, String name, int maxConcurrentSlots,
                                Duration slotTtl, Duration tokenTtl, boolean active, String downloadFilename) {
        static ProductPolicy of(Product p) {
            return new ProductPolicy(p.id(), p.name(), p.maxConcurrentSlots(), p.slotTtl(), p.tokenTtl(),
                    p.active(), p.downloadFilename());
        }
    }

    private final PolicyDefaults defaults;
    private final Map<Long, ProductPolicy> products;
    private final Instant loadedAt;

    public PolicySnapshot(PolicyDefaults defaults, Collection<Product> products, Instant loadedAt) {
        this.defaults = defaults;
        Map<Long, ProductPolicy> m = new LinkedHashMap<>();
        for (Product p : products) m.put(p.id(), ProductPolicy.of(p));
        this.products = Map.copyOf(m);
        this.loadedAt = loadedAt;
    }

    public PolicyDefaults defaults() { return defaults; }

    public Optional<ProductPolicy> product(long productId) {
        return Optional.ofNullable(products.get(productId));
    }

    public int productCount() { return products.size(); }

    public Instant loadedAt() { return loadedAt; }
}
