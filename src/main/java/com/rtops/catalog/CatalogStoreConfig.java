package com.rtops.catalog;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;

/**
 * Configuration for the relational catalog store.
 * Embedded H2 by default; any JDBC URL with a matching driver works.
 */
@Configuration
@ConditionalOnProperty(name = "rtops.catalog.store", havingValue = "jdbc", matchIfMissing = true)
public class CatalogStoreConfig {
    private static final Logger logger = LoggerFactory.getLogger(CatalogStoreConfig.class);
    
    @Value("${rtops.catalog.datasource.url:jdbc:h2:file:./data/rtops;AUTO_SERVER=TRUE}")
    private String url;
    
    @Value("${rtops.catalog.datasource.username:sa}")
    private String username;
    
    @Value("${rtops.catalog.datasource.password:}")
    private String password;
    
    @Value("${rtops.catalog.datasource.pool.size:4}")
    private int poolSize;
    
    @Bean(name = "catalogDataSource")
    public DataSource catalogDataSource() {
        try {
            HikariConfig config = new HikariConfig();
            config.setJdbcUrl(url);
            config.setUsername(username);
            config.setPassword(password);
            config.setPoolName("rtops-catalog");
            
            config.setMaximumPoolSize(poolSize);
            config.setMinimumIdle(1);
            config.setConnectionTimeout(30000);
            config.setIdleTimeout(600000);
            config.setMaxLifetime(1800000);
            
            HikariDataSource dataSource = new HikariDataSource(config);
            
            logger.info("Catalog DataSource initialized: {}", url);
            return dataSource;
            
        } catch (Exception e) {
            logger.error("Failed to initialize catalog DataSource", e);
            throw new IllegalStateException("Catalog DataSource initialization failed", e);
        }
    }
    
    @Bean(name = "catalogJdbcTemplate")
    public JdbcTemplate catalogJdbcTemplate(DataSource catalogDataSource) {
        return new JdbcTemplate(catalogDataSource);
    }
    
    @Bean(name = "catalogTransactionManager")
    public PlatformTransactionManager catalogTransactionManager(DataSource catalogDataSource) {
        return new DataSourceTransactionManager(catalogDataSource);
    }
    
    /**
     * One transaction per imported source file
     */
    @Bean(name = "catalogTransactionTemplate")
    public TransactionTemplate catalogTransactionTemplate(PlatformTransactionManager catalogTransactionManager) {
        return new TransactionTemplate(catalogTransactionManager);
    }
}
