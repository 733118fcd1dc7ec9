package com.abathur.core.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;

/**
 * Chooses the {@link TaskStore} implementation from {@code abathur.store.type}.
 * <p>
 * {@code jdbc} (the default) persists to the configured {@link DataSource}, an embedded H2
 * file database unless overridden. {@code memory} keeps everything on the heap and is lost
 * on restart.
 */
@Configuration
public class TaskStoreConfig {

    private static final Logger log = LoggerFactory.getLogger(TaskStoreConfig.class);

    @Bean
    @ConditionalOnProperty(name = "abathur.store.type", havingValue = "jdbc", matchIfMissing = true)
    public TaskStore jdbcTaskStore(DataSource dataSource, Clock clock) throws SQLException {
        log.info("Configuring JDBC task store");
        var store = new JdbcTaskStore(dataSource, clock);
        store.createTables();
        return store;
    }

    @Bean
    @ConditionalOnProperty(name = "abathur.store.type", havingValue = "memory")
    public TaskStore inMemoryTaskStore(Clock clock) {
        log.info("Using in-memory task store (state will not persist across restarts)");
        return new InMemoryTaskStore(clock);
    }
}
