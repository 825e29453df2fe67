package com.flagship.points_ledger.config;

import jakarta.persistence.EntityManagerFactory;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.orm.jpa.JpaTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Transaction configuration for the ledger core.
 *
 * One {@link JpaTransactionManager} drives both JPA repositories and
 * {@code JdbcTemplate} statements, so a ledger insert, an idempotency key
 * update and a job status change can share one database transaction.
 *
 * Two settings differ from the Spring Boot defaults:
 * <ul>
 *   <li>Nested transactions are allowed. They are JDBC savepoints, used to
 *       isolate a job handler or a best-effort enqueue from the enclosing
 *       transaction.</li>
 *   <li>A failing participant does not mark the whole transaction
 *       rollback-only. The transaction originator (the worker, the idempotent
 *       executor) decides whether to roll back or to roll back to a
 *       savepoint and continue.</li>
 * </ul>
 */
@Configuration
@Slf4j
public class TransactionConfig {

    public static final String NESTED_TRANSACTION_TEMPLATE = "nestedTransactionTemplate";

    @Bean(name = "transactionManager")
    public PlatformTransactionManager transactionManager(EntityManagerFactory entityManagerFactory) {
        JpaTransactionManager transactionManager = new JpaTransactionManager(entityManagerFactory);
        transactionManager.setNestedTransactionAllowed(true);
        transactionManager.setGlobalRollbackOnParticipationFailure(false);
        transactionManager.setRollbackOnCommitFailure(true);

        log.info("JpaTransactionManager configured with savepoint support");
        return transactionManager;
    }

    @Bean
    @Primary
    public TransactionTemplate transactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRED);
        template.setIsolationLevel(TransactionDefinition.ISOLATION_READ_COMMITTED);
        return template;
    }

    /**
     * Runs the callback inside a savepoint when a transaction is active,
     * or in a fresh transaction otherwise.
     */
    @Bean(name = NESTED_TRANSACTION_TEMPLATE)
    public TransactionTemplate nestedTransactionTemplate(PlatformTransactionManager transactionManager) {
        TransactionTemplate template = new TransactionTemplate(transactionManager);
        template.setPropagationBehavior(TransactionDefinition.PROPAGATION_NESTED);
        return template;
    }
}
