package com.abathur.core.store;

import com.abathur.core.model.CircularDependencyException;
import com.abathur.core.model.DependencyType;
import com.abathur.core.model.Task;
import com.abathur.core.model.TaskNotFoundException;
import com.abathur.core.model.TaskQueueException;
import com.abathur.core.model.TaskSource;
import com.abathur.core.model.TaskStatus;
import com.abathur.core.model.VersionConflictException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * JDBC-backed {@link TaskStore} for H2 or PostgreSQL.
 * <p>
 * Tasks live in {@code tasks}; edges live in {@code task_dependencies} with an index on the
 * prerequisite column serving {@link #findDependents}. Updates are conditional on the
 * stored version. Writers inside this process are serialized by a lock so that the cycle
 * check and the edge insert cannot interleave with another writer.
 * <p>
 * Tables are created by {@link #createTables()}.
 */
public class JdbcTaskStore implements TaskStore {

    private static final Logger log = LoggerFactory.getLogger(JdbcTaskStore.class);

    private static final String COLUMNS = """
            id, summary, description, agent_type, status, base_priority, calculated_priority,
            dependency_type, required_completions, source, deadline, estimated_duration_seconds,
            max_execution_timeout_seconds, retry_count, max_retries, error_message,
            parent_task_id, spawned_by_task_id, dependency_depth, submitted_at, started_at,
            completed_at, version""";

    private static final String CREATE_TASKS_SQL = """
            CREATE TABLE IF NOT EXISTS tasks (
                id                            VARCHAR(64) PRIMARY KEY,
                summary                       VARCHAR(255),
                description                   VARCHAR,
                agent_type                    VARCHAR(100),
                status                        VARCHAR(32) NOT NULL,
                base_priority                 INT NOT NULL,
                calculated_priority           DOUBLE PRECISION NOT NULL,
                dependency_type               VARCHAR(16) NOT NULL,
                required_completions          INT,
                source                        VARCHAR(32) NOT NULL,
                deadline                      TIMESTAMP WITH TIME ZONE,
                estimated_duration_seconds    BIGINT,
                max_execution_timeout_seconds BIGINT NOT NULL,
                retry_count                   INT NOT NULL,
                max_retries                   INT NOT NULL,
                error_message                 VARCHAR,
                parent_task_id                VARCHAR(64),
                spawned_by_task_id            VARCHAR(64),
                dependency_depth              INT NOT NULL,
                submitted_at                  TIMESTAMP WITH TIME ZONE NOT NULL,
                started_at                    TIMESTAMP WITH TIME ZONE,
                completed_at                  TIMESTAMP WITH TIME ZONE,
                version                       BIGINT NOT NULL
            )
            """;

    private static final String CREATE_DEPENDENCIES_SQL = """
            CREATE TABLE IF NOT EXISTS task_dependencies (
                task_id              VARCHAR(64) NOT NULL REFERENCES tasks(id),
                prerequisite_task_id VARCHAR(64) NOT NULL REFERENCES tasks(id),
                edge_order           INT NOT NULL,
                PRIMARY KEY (task_id, prerequisite_task_id)
            )
            """;

    private static final String CREATE_DISPATCH_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_tasks_dispatch
            ON tasks (status, calculated_priority, submitted_at)
            """;

    private static final String CREATE_PREREQUISITE_INDEX_SQL = """
            CREATE INDEX IF NOT EXISTS idx_task_dependencies_prerequisite
            ON task_dependencies (prerequisite_task_id)
            """;

    private static final String INSERT_TASK_SQL = """
            INSERT INTO tasks (%s)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            """.formatted(COLUMNS);

    private static final String UPDATE_TASK_SQL = """
            UPDATE tasks SET summary = ?, description = ?, agent_type = ?, status = ?,
                base_priority = ?, calculated_priority = ?, dependency_type = ?,
                required_completions = ?, source = ?, deadline = ?, estimated_duration_seconds = ?,
                max_execution_timeout_seconds = ?, retry_count = ?, max_retries = ?,
                error_message = ?, parent_task_id = ?, spawned_by_task_id = ?,
                dependency_depth = ?, submitted_at = ?, started_at = ?, completed_at = ?,
                version = ?
            WHERE id = ? AND version = ?
            """;

    private static final String BUMP_VERSION_SQL = """
            UPDATE tasks SET version = version + 1 WHERE id = ? AND version = ?
            """;

    private static final String SELECT_BY_ID_SQL = """
            SELECT %s FROM tasks WHERE id = ?
            """.formatted(COLUMNS);

    private static final String SELECT_VERSION_SQL = """
            SELECT version FROM tasks WHERE id = ?
            """;

    private static final String SELECT_NEXT_READY_SQL = """
            SELECT %s FROM tasks
            WHERE status = 'READY'
            ORDER BY calculated_priority DESC, submitted_at ASC, id ASC
            LIMIT 1
            """.formatted(COLUMNS);

    private static final String SELECT_ALL_SQL = """
            SELECT %s FROM tasks
            ORDER BY calculated_priority DESC, submitted_at ASC, id ASC
            LIMIT ?
            """.formatted(COLUMNS);

    private static final String SELECT_BY_STATUS_SQL = """
            SELECT %s FROM tasks
            WHERE status IN (%%s)
            ORDER BY calculated_priority DESC, submitted_at ASC, id ASC
            LIMIT ?
            """.formatted(COLUMNS);

    private static final String INSERT_DEPENDENCY_SQL = """
            INSERT INTO task_dependencies (task_id, prerequisite_task_id, edge_order)
            VALUES (?, ?, ?)
            """;

    private static final String SELECT_DEPENDENCIES_SQL = """
            SELECT prerequisite_task_id FROM task_dependencies
            WHERE task_id = ?
            ORDER BY edge_order ASC
            """;

    private static final String SELECT_DEPENDENTS_SQL = """
            SELECT task_id FROM task_dependencies
            WHERE prerequisite_task_id = ?
            ORDER BY task_id ASC
            """;

    private final DataSource dataSource;
    private final Clock clock;
    private final ReentrantLock writeLock = new ReentrantLock();

    public JdbcTaskStore(DataSource dataSource, Clock clock) {
        this.dataSource = Objects.requireNonNull(dataSource, "DataSource must not be null");
        this.clock = clock;
    }

    /**
     * Creates the task tables and indexes if they do not already exist.
     */
    public void createTables() throws SQLException {
        try (Connection conn = dataSource.getConnection()) {
            for (String sql : List.of(CREATE_TASKS_SQL, CREATE_DEPENDENCIES_SQL,
                    CREATE_DISPATCH_INDEX_SQL, CREATE_PREREQUISITE_INDEX_SQL)) {
                try (PreparedStatement stmt = conn.prepareStatement(sql)) {
                    stmt.execute();
                }
            }
            log.info("Task tables ensured");
        }
    }

    @Override
    public Optional<Task> getTask(String id) {
        try (Connection conn = dataSource.getConnection()) {
            return selectTask(conn, id);
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to load task " + id, e);
        }
    }

    @Override
    public Task insertTask(Task task) {
        writeLock.lock();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                if (selectVersion(conn, task.id()).isPresent()) {
                    throw new TaskQueueException("Task already exists: " + task.id());
                }
                for (String dep : task.dependencies()) {
                    if (dep.equals(task.id())) {
                        throw new CircularDependencyException("Task cannot depend on itself", List.of(dep, dep));
                    }
                    if (selectVersion(conn, dep).isEmpty()) {
                        throw new TaskNotFoundException(dep);
                    }
                }
                var builder = task.toBuilder().version(1);
                if (task.submittedAt() == null) {
                    builder.submittedAt(clock.instant());
                }
                Task stored = builder.build();
                try (PreparedStatement stmt = conn.prepareStatement(INSERT_TASK_SQL)) {
                    stmt.setString(1, stored.id());
                    bindColumns(stmt, stored, 2);
                    stmt.executeUpdate();
                }
                int order = 0;
                for (String dep : stored.dependencies()) {
                    insertEdge(conn, stored.id(), dep, order++);
                }
                conn.commit();
                log.debug("Inserted task {} with {} dependencies", stored.id(), stored.dependencies().size());
                return stored;
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to insert task " + task.id(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Task updateTask(Task task, long expectedVersion) {
        writeLock.lock();
        try (Connection conn = dataSource.getConnection()) {
            Task stored;
            try (PreparedStatement stmt = conn.prepareStatement(UPDATE_TASK_SQL)) {
                stored = task.toBuilder().version(expectedVersion + 1).build();
                int next = bindColumns(stmt, stored, 1);
                stmt.setString(next, task.id());
                stmt.setLong(next + 1, expectedVersion);
                if (stmt.executeUpdate() == 0) {
                    long actual = selectVersion(conn, task.id())
                            .orElseThrow(() -> new TaskNotFoundException(task.id()));
                    throw new VersionConflictException(task.id(), expectedVersion, actual);
                }
            }
            return stored.toBuilder().dependencies(selectDependencies(conn, task.id())).build();
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to update task " + task.id(), e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public Optional<Task> getNextReadyTask() {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_NEXT_READY_SQL);
             ResultSet rs = stmt.executeQuery()) {
            if (rs.next()) {
                return Optional.of(fromResultSet(conn, rs));
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to query next ready task", e);
        }
    }

    @Override
    public List<Task> listTasks(Set<TaskStatus> statusFilter, int limit) {
        boolean filtered = statusFilter != null && !statusFilter.isEmpty();
        String sql = filtered
                ? SELECT_BY_STATUS_SQL.formatted(Collections.nCopies(statusFilter.size(), "?")
                        .stream().collect(Collectors.joining(", ")))
                : SELECT_ALL_SQL;
        List<Task> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(sql)) {
            int index = 1;
            if (filtered) {
                for (TaskStatus status : statusFilter) {
                    stmt.setString(index++, status.name());
                }
            }
            stmt.setInt(index, limit);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    result.add(fromResultSet(conn, rs));
                }
            }
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to list tasks", e);
        }
        return result;
    }

    @Override
    public Task insertDependency(String taskId, String dependencyId) {
        writeLock.lock();
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            try {
                Task task = selectTask(conn, taskId).orElseThrow(() -> new TaskNotFoundException(taskId));
                if (selectVersion(conn, dependencyId).isEmpty()) {
                    throw new TaskNotFoundException(dependencyId);
                }
                if (task.dependencies().contains(dependencyId)) {
                    conn.rollback();
                    return task;
                }
                var cycle = DependencyPaths.cycleIfAdded(taskId, dependencyId,
                        id -> selectDependenciesUnchecked(conn, id));
                if (cycle.isPresent()) {
                    throw new CircularDependencyException("Dependency would create a cycle", cycle.get());
                }
                insertEdge(conn, taskId, dependencyId, task.dependencies().size());
                try (PreparedStatement stmt = conn.prepareStatement(BUMP_VERSION_SQL)) {
                    stmt.setString(1, taskId);
                    stmt.setLong(2, task.version());
                    if (stmt.executeUpdate() == 0) {
                        long actual = selectVersion(conn, taskId).orElse(-1L);
                        throw new VersionConflictException(taskId, task.version(), actual);
                    }
                }
                conn.commit();
                List<String> deps = new ArrayList<>(task.dependencies());
                deps.add(dependencyId);
                return task.toBuilder().dependencies(deps).version(task.version() + 1).build();
            } catch (SQLException | RuntimeException e) {
                conn.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to add dependency " + taskId + " -> " + dependencyId, e);
        } finally {
            writeLock.unlock();
        }
    }

    @Override
    public List<String> findDependents(String prerequisiteId) {
        List<String> ids = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement stmt = conn.prepareStatement(SELECT_DEPENDENTS_SQL)) {
            stmt.setString(1, prerequisiteId);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    ids.add(rs.getString("task_id"));
                }
            }
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to find dependents of " + prerequisiteId, e);
        }
        return ids;
    }

    @Override
    public boolean isAvailable() {
        try (Connection conn = dataSource.getConnection()) {
            return conn.isValid(2);
        } catch (SQLException e) {
            log.warn("Task store unreachable: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public Clock clock() {
        return clock;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private Optional<Task> selectTask(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_BY_ID_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(fromResultSet(conn, rs));
                }
            }
        }
        return Optional.empty();
    }

    private Optional<Long> selectVersion(Connection conn, String id) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_VERSION_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next() ? Optional.of(rs.getLong(1)) : Optional.empty();
            }
        }
    }

    private List<String> selectDependencies(Connection conn, String id) throws SQLException {
        List<String> deps = new ArrayList<>();
        try (PreparedStatement stmt = conn.prepareStatement(SELECT_DEPENDENCIES_SQL)) {
            stmt.setString(1, id);
            try (ResultSet rs = stmt.executeQuery()) {
                while (rs.next()) {
                    deps.add(rs.getString(1));
                }
            }
        }
        return deps;
    }

    private List<String> selectDependenciesUnchecked(Connection conn, String id) {
        try {
            return selectDependencies(conn, id);
        } catch (SQLException e) {
            throw new TaskQueueException("Failed to load dependencies of " + id, e);
        }
    }

    private void insertEdge(Connection conn, String taskId, String dependencyId, int order) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(INSERT_DEPENDENCY_SQL)) {
            stmt.setString(1, taskId);
            stmt.setString(2, dependencyId);
            stmt.setInt(3, order);
            stmt.executeUpdate();
        }
    }

    /**
     * Binds every column after {@code id}, in {@link #COLUMNS} order, starting at {@code index}.
     *
     * @return the next free parameter index
     */
    private int bindColumns(PreparedStatement stmt, Task t, int index) throws SQLException {
        stmt.setString(index++, t.summary());
        stmt.setString(index++, t.description());
        stmt.setString(index++, t.agentType());
        stmt.setString(index++, t.status().name());
        stmt.setInt(index++, t.basePriority());
        stmt.setDouble(index++, t.calculatedPriority());
        stmt.setString(index++, t.dependencyType().name());
        setNullableInt(stmt, index++, t.requiredCompletions());
        stmt.setString(index++, t.source() == null ? TaskSource.HUMAN.name() : t.source().name());
        setInstant(stmt, index++, t.deadline());
        setNullableLong(stmt, index++, t.estimatedDurationSeconds());
        stmt.setLong(index++, t.maxExecutionTimeoutSeconds());
        stmt.setInt(index++, t.retryCount());
        stmt.setInt(index++, t.maxRetries());
        stmt.setString(index++, t.errorMessage());
        stmt.setString(index++, t.parentTaskId());
        stmt.setString(index++, t.spawnedByTaskId());
        stmt.setInt(index++, t.dependencyDepth());
        setInstant(stmt, index++, t.submittedAt());
        setInstant(stmt, index++, t.startedAt());
        setInstant(stmt, index++, t.completedAt());
        stmt.setLong(index++, t.version());
        return index;
    }

    private Task fromResultSet(Connection conn, ResultSet rs) throws SQLException {
        String id = rs.getString("id");
        int required = rs.getInt("required_completions");
        Integer requiredCompletions = rs.wasNull() ? null : required;
        long estimated = rs.getLong("estimated_duration_seconds");
        Long estimatedDuration = rs.wasNull() ? null : estimated;

        return Task.builder(id)
                .summary(rs.getString("summary"))
                .description(rs.getString("description"))
                .agentType(rs.getString("agent_type"))
                .status(TaskStatus.valueOf(rs.getString("status")))
                .basePriority(rs.getInt("base_priority"))
                .calculatedPriority(rs.getDouble("calculated_priority"))
                .dependencies(selectDependencies(conn, id))
                .dependencyType(DependencyType.valueOf(rs.getString("dependency_type")))
                .requiredCompletions(requiredCompletions)
                .source(TaskSource.valueOf(rs.getString("source")))
                .deadline(getInstant(rs, "deadline"))
                .estimatedDurationSeconds(estimatedDuration)
                .maxExecutionTimeoutSeconds(rs.getLong("max_execution_timeout_seconds"))
                .retryCount(rs.getInt("retry_count"))
                .maxRetries(rs.getInt("max_retries"))
                .errorMessage(rs.getString("error_message"))
                .parentTaskId(rs.getString("parent_task_id"))
                .spawnedByTaskId(rs.getString("spawned_by_task_id"))
                .dependencyDepth(rs.getInt("dependency_depth"))
                .submittedAt(getInstant(rs, "submitted_at"))
                .startedAt(getInstant(rs, "started_at"))
                .completedAt(getInstant(rs, "completed_at"))
                .version(rs.getLong("version"))
                .build();
    }

    private static void setInstant(PreparedStatement stmt, int index, Instant value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.TIMESTAMP_WITH_TIMEZONE);
        } else {
            stmt.setObject(index, value.atOffset(ZoneOffset.UTC));
        }
    }

    private static Instant getInstant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static void setNullableInt(PreparedStatement stmt, int index, Integer value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.INTEGER);
        } else {
            stmt.setInt(index, value);
        }
    }

    private static void setNullableLong(PreparedStatement stmt, int index, Long value) throws SQLException {
        if (value == null) {
            stmt.setNull(index, Types.BIGINT);
        } else {
            stmt.setLong(index, value);
        }
    }
}
