package net.keygate.integration.spring;

import net.keygate.adapter.jdbc.repo.*;
import net.keygate.core.spi.*;
import net.keygate.integration.spring.tx.SpringTxRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.transaction.PlatformTransactionManager;

import javax.sql.DataSource;

@Configuration
public class KeygateSpringConfig {

    // TxRunner (Spring)
    @Bean
    public TxRunner txRunner(PlatformTransactionManager tm, DataSource ds) {
        return new SpringTxRunner(tm, ds);
    }

    // Repository 구현 등록 (adapter-jdbc 재사용)
    @Bean public CredentialRepository credentialRepository(DataSource ds) { return new JdbcCredentialRepository(ds); }
    @Bean public ProductRepository productRepository(DataSource ds) { return new JdbcProductRepository(ds); }
    @Bean public SlotRepository slotRepository(DataSource ds) { return new JdbcSlotRepository(ds); }
    @Bean public TokenRepository tokenRepository(DataSource ds) { return new JdbcTokenRepository(ds); }

    @Bean public Clock systemClock() { return java.time.Instant::now; }
}
