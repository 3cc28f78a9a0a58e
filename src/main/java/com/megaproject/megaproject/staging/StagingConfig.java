package com.megaproject.megaproject.staging;

import com.megaproject.megaproject.query.H2SqlDialect;
import com.megaproject.megaproject.query.PostgresSqlDialect;
import com.megaproject.megaproject.query.SqlDialect;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * Binds staging properties and picks the SQL dialect matching the configured datasource.
 */
@Configuration
@EnableConfigurationProperties(StagingProperties.class)
public class StagingConfig {

    private static final Logger log = LoggerFactory.getLogger(StagingConfig.class);

    @Bean
    public SqlDialect sqlDialect(DataSource dataSource) {
        String productName;
        try (Connection connection = dataSource.getConnection()) {
            productName = connection.getMetaData().getDatabaseProductName();
        } catch (SQLException ex) {
            throw new IllegalStateException("Unable to determine database product", ex);
        }

        String normalized = productName == null ? "" : productName.toLowerCase(Locale.ROOT);
        SqlDialect dialect;
        if (normalized.contains("postgresql")) {
            dialect = new PostgresSqlDialect();
        } else if (normalized.contains("h2")) {
            dialect = new H2SqlDialect();
        } else {
            throw new IllegalStateException("Unsupported database product: " + productName);
        }
        log.info("Using {} SQL dialect", dialect.productName());
        return dialect;
    }
}
