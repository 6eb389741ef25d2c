package com.stravatalk.activity.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.support.JdbcTransactionManager;

import javax.sql.DataSource;

@Configuration
public class PersistenceConfig {

    /**
     * Read-only transactions issue SET TRANSACTION READ ONLY, so the server itself
     * refuses writes from the query gateway whatever the statement text says.
     */
    @Bean
    public JdbcTransactionManager transactionManager(DataSource dataSource) {
        JdbcTransactionManager transactionManager = new JdbcTransactionManager(dataSource);
        transactionManager.setEnforceReadOnly(true);
        return transactionManager;
    }
}
