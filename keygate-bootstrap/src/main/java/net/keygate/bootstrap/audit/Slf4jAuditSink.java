package net.keygate.bootstrap.audit;

import net.keygate.core.spi.AuditEvent;
import net.keygate.core.spi.AuditSink;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** 기본 감사 싱크: 전용 로거 {@code keygate.audit}로 한 줄씩 */
public class Slf4jAuditSink implements AuditSink {
    public static final String LOGGER_NAME = "keygate.audit";

    private static final Logger audit = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public void record(AuditEvent e) {
        audit.info("action={} outcome={} subject={} details={} at={}",
                e.action(), e.outcome(), e.subject(), e.details(), e.at());
    }
}
