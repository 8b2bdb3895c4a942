package com.gridcast.core.decisionlog;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;

/**
 * Provides the {@link DecisionLedger} bean.
 * <p>
 * With {@code gridcast.ledger.store=jdbc} the ledger is persisted to PostgreSQL and its
 * tables are created on startup. Otherwise an in-memory ledger is used, which is lost
 * when the process exits.
 */
@Configuration
public class LedgerConfig {

    private static final Logger log = LoggerFactory.getLogger(LedgerConfig.class);

    @Bean
    @ConditionalOnProperty(prefix = "gridcast.ledger", name = "store", havingValue = "jdbc")
    public DecisionLedger jdbcDecisionLedger(DataSource dataSource, ObjectMapper objectMapper) throws Exception {
        log.info("Configuring JDBC decision ledger (PostgreSQL)");
        var ledger = new JdbcDecisionLedger(dataSource, objectMapper);
        ledger.createTables();
        return ledger;
    }

    @Bean
    @ConditionalOnMissingBean(DecisionLedger.class)
    public DecisionLedger inMemoryDecisionLedger() {
        log.info("Using in-memory decision ledger (history will not persist across restarts)");
        return new InMemoryDecisionLedger();
    }
}
