package net.keygate.core.spi;

import java.util.concurrent.Callable;

/** 트랜잭션 경계. 본문이 던지면 롤백 후 같은 예외를 그대로 다시 던진다. */
public interface TxRunner {
    <T> T required(Callable<T> body) throws Exception;
    <T> T requiresNew(Callable<T> body) throws Exception;
    default void required(Runnable body) throws Exception { required(() -> { body.run(); return null; }); }
    default void requiresNew(Runnable body) throws Exception { requiresNew(() -> { body.run(); return null; }); }
}
