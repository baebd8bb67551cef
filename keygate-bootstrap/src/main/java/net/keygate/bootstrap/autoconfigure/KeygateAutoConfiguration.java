package net.keygate.bootstrap.autoconfigure;

import net.keygate.bootstrap.audit.Slf4jAuditSink;
import net.keygate.bootstrap.catalog.CatalogRegistrar;
import net.keygate.bootstrap.props.KeygateProperties;
import net.keygate.core.maintenance.ExpiryReaper;
import net.keygate.core.policy.PolicyDefaults;
import net.keygate.core.policy.PolicyRegistry;
import net.keygate.core.service.*;
import net.keygate.core.spi.*;
import net.keygate.core.token.TokenHasher;
import net.keygate.integration.spring.KeygateSpringConfig;
import net.keygate.integration.spring.sched.KeygateSchedulers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Import;

import java.time.Duration;

@AutoConfiguration(after = {DataSourceAutoConfiguration.class, DataSourceTransactionManagerAutoConfiguration.class})
@EnableConfigurationProperties(KeygateProperties.class)
@Import(KeygateSpringConfig.class) // integration-spring: repos/tx/clock wiring
public class KeygateAutoConfiguration {
    private static final Logger log = LoggerFactory.getLogger(KeygateAutoConfiguration.class);

    // --- SPI 기본 구현(없으면) 제공 ---

    @Bean
    @ConditionalOnMissingBean
    public AuditSink auditSink() {
        return new Slf4jAuditSink();
    }

    /** 키가 없거나 짧으면 여기서 기동 실패 */
    @Bean
    @ConditionalOnMissingBean
    public TokenHasher tokenHasher(KeygateProperties props) {
        return TokenHasher.fromBase64(props.getToken().getHmacKey());
    }

    @Bean
    @ConditionalOnMissingBean
    public PolicyDefaults policyDefaults(KeygateProperties props) {
        return new PolicyDefaults(
                props.getToken().getCredentialTtl(),
                props.getPool().getMaxClaimCount(),
                props.getPool().getRetryAfter(),
                props.getPool().isReleaseOnSubjectDeletion());
    }

    // --- 코어 서비스 조립 ---

    @Bean
    @ConditionalOnMissingBean
    public PolicyRegistry policyRegistry(ProductRepository products, TxRunner tx, Clock clock, PolicyDefaults defaults) {
        return new PolicyRegistry(products, tx, clock, defaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public TokenIssuer tokenIssuer(TokenRepository tokens, TokenHasher hasher, TxRunner tx) {
        return new TokenIssuer(tokens, hasher, tx);
    }

    @Bean
    @ConditionalOnMissingBean
    public ResourcePoolService resourcePool(CredentialRepository credentials, TxRunner tx, PolicyDefaults defaults) {
        return new ResourcePoolService(credentials, tx, defaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public SlotLedgerService slotLedger(ProductRepository products,
                                        SlotRepository slots,
                                        TokenIssuer tokens,
                                        TxRunner tx,
                                        PolicyDefaults defaults) {
        return new SlotLedgerService(products, slots, tokens, tx, defaults);
    }

    @Bean
    @ConditionalOnMissingBean
    public AllocationCoordinator allocationCoordinator(ResourcePoolService pool,
                                                       SlotLedgerService ledger,
                                                       TokenIssuer tokens,
                                                       ProductRepository products,
                                                       PolicyRegistry policy,
                                                       TxRunner tx,
                                                       AuditSink audit,
                                                       Clock clock,
                                                       KeygateProperties props) {
        return new AllocationCoordinator(pool, ledger, tokens, products, policy, tx, audit, clock,
                props.getHandoff().getBaseUrl());
    }

    @Bean
    @ConditionalOnMissingBean
    public ExpiryReaper expiryReaper(SlotRepository slots,
                                     TokenRepository tokens,
                                     TxRunner tx,
                                     Clock clock,
                                     KeygateProperties props) {
        return new ExpiryReaper(slots, tokens, tx, clock,
                props.getReaper().getTokenRetention(), props.getReaper().getBatchSize());
    }

    // --- 스케줄러 등록 (주기는 keygate.reaper.*-delay-ms) ---

    @Bean
    @ConditionalOnProperty(prefix = "keygate.reaper", name = "enabled", havingValue = "true", matchIfMissing = true)
    public KeygateSchedulers keygateSchedulers(ExpiryReaper reaper, KeygateProperties props) {
        var s = new KeygateSchedulers(reaper);
        Duration retention = props.getReaper().getTokenRetention();
        s.setPurgeEnabled(retention != null && !retention.isZero() && !retention.isNegative());
        return s;
    }

    @Bean
    public CatalogRegistrar catalogRegistrar(ProductRepository products,
                                             SlotRepository slots,
                                             PolicyRegistry policy,
                                             TxRunner tx) {
        return new CatalogRegistrar(products, slots, policy, tx);
    }

    @Bean
    @ConditionalOnProperty(prefix = "keygate.catalog", name = "enabled", havingValue = "true", matchIfMissing = true)
    public ApplicationRunner catalogRunner(CatalogRegistrar registrar, KeygateProperties props) {
        log.info("Keygate catalog: {} product(s) configured", props.getCatalog().getProducts().size());
        return args -> registrar.register(props.getCatalog());
    }
}
