package net.keygate.core.spi;

import net.keygate.core.model.Product;

import java.util.List;
import java.util.Optional;

public interface ProductRepository {
    /** name 기준 upsert. 상한만큼 용량 단위 행도 보장한다. */
    Product upsertByName(Product p) throws Exception;
    Optional<Product> findById(long id) throws Exception;

    /** 정책 변경용 배타 잠금. 진행 중인 acquire가 끝날 때까지 기다린다. */
    Optional<Product> lockByName(String name) throws Exception;

    /**
     * acquire끼리는 공유하는 잠금. 정책 변경이 배타 잠금을 잡고 있으면 empty (SKIP LOCKED).
     */
    Optional<Product> tryShareLockById(long id) throws Exception;

    List<Product> findAll() throws Exception;
}
