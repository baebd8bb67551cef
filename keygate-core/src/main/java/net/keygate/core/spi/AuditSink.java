package net.keygate.core.spi;

/** 감사 이벤트 수신자. 저장/표시는 외부 책임. */
public interface AuditSink {
    void record(AuditEvent event) throws Exception;
}
