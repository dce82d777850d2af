package com.weblens.credits.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Primary;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.datasource.DataSourceTransactionManager;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.annotation.EnableTransactionManagement;

import javax.sql.DataSource;

@Configuration
@EnableTransactionManagement
public class JdbcConfig {

    /**
     * Hikari pool for the ledger store. The URL has already been normalized by
     * {@link JdbcUrlNormalizer}.
     */
    @Bean
    @Primary
    public DataSource dataSource(
            @Value("${spring.datasource.url}") String url,
            @Value("${spring.datasource.username:}") String username,
            @Value("${spring.datasource.password:}") String password,
            @Value("${spring.datasource.hikari.maximum-pool-size:20}") int maxPoolSize,
            @Value("${spring.datasource.hikari.minimum-idle:2}") int minIdle) {

        HikariConfig config = new HikariConfig();
        config.setDriverClassName("org.postgresql.Driver");  // must be explicit when bypassing Spring Boot auto-config
        config.setJdbcUrl(url);
        if (username != null && !username.isEmpty()) config.setUsername(username);
        if (password != null && !password.isEmpty()) config.setPassword(password);
        config.setMaximumPoolSize(maxPoolSize);
        config.setMinimumIdle(minIdle);
        config.setConnectionTimeout(10000);
        config.setIdleTimeout(600000);
        config.setMaxLifetime(1800000);
        config.setPoolName("CreditLedgerHikariPool");

        return new HikariDataSource(config);
    }

    /**
     * Every statement gets the configured query timeout so a stalled database
     * surfaces as a storage failure instead of blocking a wallet actor forever.
     */
    @Bean
    public NamedParameterJdbcTemplate namedParameterJdbcTemplate(DataSource dataSource,
                                                                 CreditProperties properties) {
        NamedParameterJdbcTemplate template = new NamedParameterJdbcTemplate(dataSource);
        long seconds = Math.max(1, properties.getStorage().getQueryTimeout().toSeconds());
        template.getJdbcTemplate().setQueryTimeout((int) seconds);
        return template;
    }

    @Bean
    public PlatformTransactionManager transactionManager(DataSource dataSource) {
        return new DataSourceTransactionManager(dataSource);
    }
}
