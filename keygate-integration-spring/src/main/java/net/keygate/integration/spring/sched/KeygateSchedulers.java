package net.keygate.integration.spring.sched;

import net.keygate.core.maintenance.ExpiryReaper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;

/** 리퍼 주기 실행. 실패는 리퍼가 로그로 남기고 다음 주기에 다시 시도한다. */
public class KeygateSchedulers {
    private static final Logger log = LoggerFactory.getLogger(KeygateSchedulers.class);

    private final ExpiryReaper reaper;
    private boolean purgeEnabled = true;

    public KeygateSchedulers(ExpiryReaper reaper) {
        this.reaper = reaper;
    }

    @Scheduled(fixedDelayString = "${keygate.reaper.slot-delay-ms:60000}")
    public void reapSlots() {
        int n = reaper.reapSlots();
        if (n > 0) log.debug("slot reaper tick: {}", n);
    }

    @Scheduled(fixedDelayString = "${keygate.reaper.token-delay-ms:30000}")
    public void reapTokens() {
        int n = reaper.reapTokens();
        if (purgeEnabled) reaper.purgeTokens();
        if (n > 0) log.debug("token reaper tick: {}", n);
    }

    public void setPurgeEnabled(boolean purgeEnabled) {
        this.purgeEnabled = purgeEnabled;
    }
}
