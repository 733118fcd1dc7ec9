package com.abathur.core.store;

import com.abathur.core.model.Task;
import com.abathur.core.model.TaskStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.jdbc.datasource.DriverManagerDataSource;

import javax.sql.DataSource;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Runs the store contract against an in-memory H2 database.
 */
class JdbcTaskStoreTest extends AbstractTaskStoreTest {

    private DataSource dataSource;

    @Override
    protected TaskStore createStore() throws Exception {
        dataSource = new DriverManagerDataSource(
                "jdbc:h2:mem:abathur-" + UUID.randomUUID() + ";DB_CLOSE_DELAY=-1", "sa", "");
        JdbcTaskStore jdbcStore = new JdbcTaskStore(dataSource, clock);
        jdbcStore.createTables();
        return jdbcStore;
    }

    @Test
    @DisplayName("createTables is idempotent and keeps existing rows")
    void createTablesTwice() throws Exception {
        insert("a", TaskStatus.READY, 10);

        ((JdbcTaskStore) store).createTables();

        assertTrue(store.getTask("a").isPresent());
    }

    @Test
    @DisplayName("a second store on the same database sees committed writes")
    void sharedDatabase() {
        insert("a", TaskStatus.READY, 10);
        TaskStore other = new JdbcTaskStore(dataSource, clock);

        Task loaded = other.requireTask("a");
        assertEquals(TaskStatus.READY, loaded.status());
        assertEquals(1, loaded.version());
    }

    @Test
    @DisplayName("isAvailable is false when the database cannot be reached")
    void unavailable() {
        var broken = new JdbcTaskStore(new DriverManagerDataSource("jdbc:h2:tcp://127.0.0.1:1/none", "sa", ""), clock);
        assertFalse(broken.isAvailable());
    }
}
