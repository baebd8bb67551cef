package net.keygate.integration.spring.tx;

import net.keygate.adapter.jdbc.TxContext;
import net.keygate.core.spi.TxRunner;
import org.springframework.jdbc.datasource.DataSourceUtils;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.Connection;
import java.util.concurrent.Callable;

/**
 * 스프링 트랜잭션 위에서 도는 TxRunner.
 * 본문이 던진 예외는 롤백 후 감싸지 않고 그대로 다시 던진다.
 */
public final class SpringTxRunner implements TxRunner {
    private final TransactionTemplate required;
    private final TransactionTemplate requiresNew;
    private final DataSource ds;

    public SpringTxRunner(PlatformTransactionManager tm, DataSource ds) {
        this.required = new TransactionTemplate(tm);
        this.required.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        this.requiresNew = new TransactionTemplate(tm);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.ds = ds;
    }

    @Override
    public <T> T required(Callable<T> body) throws Exception {
        if (TxContext.get() != null) {
            // 이미 TxContext가 있다면 그대로 사용 (중첩 호출)
            return body.call();
        }
        return execute(required, body);
    }

    @Override
    public <T> T requiresNew(Callable<T> body) throws Exception {
        Connection suspended = TxContext.get();
        try {
            return execute(requiresNew, body);
        } finally {
            if (suspended != null) TxContext.set(suspended);
        }
    }

    private <T> T execute(TransactionTemplate tpl, Callable<T> body) throws Exception {
        try {
            return tpl.execute(status -> {
                // 스프링 트랜잭션의 물리 커넥션을 끌어와 TxContext에 꽂아줌
                Connection con = DataSourceUtils.getConnection(ds);
                try {
                    TxContext.set(con);
                    return body.call();
                } catch (RuntimeException re) {
                    throw re;
                } catch (Exception e) {
                    throw new CheckedBodyException(e);
                } finally {
                    TxContext.clear();
                    DataSourceUtils.releaseConnection(con, ds); // 스프링이 관리하는 방식으로 반납
                }
            });
        } catch (CheckedBodyException e) {
            throw e.checked;
        }
    }

    /** 템플릿 밖으로 검사 예외를 운반하는 용도 */
    private static final class CheckedBodyException extends RuntimeException {
        private final Exception checked;

        CheckedBodyException(Exception checked) {
            super(checked);
            this.checked = checked;
        }
    }
}
