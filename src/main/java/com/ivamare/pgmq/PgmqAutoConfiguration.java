package com.ivamare.pgmq;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.ivamare.pgmq.api.PgmqClient;
import com.ivamare.pgmq.api.PgmqClientBuilder;
import io.r2dbc.spi.ConnectionFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.autoconfigure.jdbc.DataSourceAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.DataSourceTransactionManagerAutoConfiguration;
import org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration;
import org.springframework.boot.autoconfigure.r2dbc.R2dbcAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;

/**
 * Auto-configuration for the PGMQ client.
 *
 * <p>Automatically configures:
 * <ul>
 *   <li>Object Mapper (when none is defined)</li>
 *   <li>PGMQ Client, blocking over a JdbcTemplate or suspending over an R2DBC ConnectionFactory</li>
 * </ul>
 *
 * <p>To disable auto-configuration:
 * <pre>
 * pgmq.enabled=false
 * </pre>
 */
@AutoConfiguration(after = {
    DataSourceAutoConfiguration.class,
    JdbcTemplateAutoConfiguration.class,
    DataSourceTransactionManagerAutoConfiguration.class,
    R2dbcAutoConfiguration.class
})
@ConditionalOnProperty(prefix = "pgmq", name = "enabled", havingValue = "true", matchIfMissing = true)
@EnableConfigurationProperties(PgmqProperties.class)
public class PgmqAutoConfiguration {

    private static final Logger log = LoggerFactory.getLogger(PgmqAutoConfiguration.class);

    // --- Object Mapper ---

    @Bean
    @ConditionalOnMissingBean
    public ObjectMapper pgmqObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.findAndRegisterModules(); // Register JSR310 module
        return mapper;
    }

    // --- PGMQ Client ---

    @Bean
    @ConditionalOnMissingBean
    public PgmqClient pgmqClient(
            PgmqProperties properties,
            ObjectMapper objectMapper,
            ObjectProvider<JdbcTemplate> jdbcTemplate,
            ObjectProvider<PlatformTransactionManager> transactionManager,
            ObjectProvider<ConnectionFactory> connectionFactory) {

        PgmqClient client = new PgmqClientBuilder()
            .jdbcTemplate(jdbcTemplate.getIfUnique())
            .transactionManager(transactionManager.getIfUnique())
            .connectionFactory(connectionFactory.getIfUnique())
            .executionMode(properties.getExecutionMode())
            .objectMapper(objectMapper)
            .visibilityTimeout(properties.getVisibilityTimeout())
            .delay(properties.getDelay())
            .pollStrategy(properties.getPoll().getStrategy())
            .maxPollSeconds(properties.getPoll().getMaxPollSeconds())
            .pollIntervalMs(properties.getPoll().getPollIntervalMs())
            .build();

        log.info("Configured PGMQ client in {} mode", client.executionMode());

        if (properties.isCreateExtension()) {
            client.ensureExtension();
        }
        return client;
    }
}
