package io.ration.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import io.ration.core.QueueItem;
import io.ration.cost.CacheStats;
import io.ration.cost.ClientBudget;
import io.ration.cost.CostLine;
import io.ration.cost.CostSummary;
import io.ration.error.FailureReason;
import io.ration.pool.DedicatedPoolConfig;
import io.ration.pool.ResourceAllocation;
import io.ration.scheduler.Alert;
import io.ration.scheduler.ExecutionRecord;
import io.ration.scheduler.ExecutionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.Date;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Plain JDBC implementation. Opens a connection per call; multi-statement writes run in one transaction and
 * roll back on failure.
 */
public class JdbcSchedulerStore implements SchedulerStore {
    private static final Logger log = LoggerFactory.getLogger(JdbcSchedulerStore.class);
    private static final String SCHEMA = "/db/schema.sql";
    private static final String NOT_TERMINAL = " AND status NOT IN ('completed', 'failed')";

    private final String jdbcUrl;
    private final String user;
    private final String password;

    public JdbcSchedulerStore(String jdbcUrl, String user, String password) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
    }

    /** Creates missing tables from the bundled schema. */
    public void initSchema() {
        String script;
        try (InputStream in = JdbcSchedulerStore.class.getResourceAsStream(SCHEMA)) {
            if (in == null) throw new StoreException("Missing " + SCHEMA, null);
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Could not read " + SCHEMA, e);
        }
        try (Connection c = getConnection(); Statement st = c.createStatement()) {
            for (String sql : script.split(";")) {
                if (!sql.isBlank()) st.execute(sql.trim());
            }
        } catch (SQLException e) {
            throw new StoreException("Schema initialization failed", e);
        }
        log.info("Schema ready at {}", jdbcUrl);
    }

    @Override
    public void recordAllocation(ResourceAllocation a) {
        update("INSERT INTO resource_allocations (allocation_id, request_id, client_id, resource_type, amount_allocated, "
                        + "from_pool, allocated_at, cost_usd, quota_name) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)",
                a.allocationId(), a.requestId(), a.clientId(), a.resourceType(), a.amountAllocated(),
                a.fromPool().code(), a.allocatedAt(), a.costUsd(), a.quotaName());
    }

    @Override
    public void markAllocationReleased(String allocationId, long releasedAt, boolean rolledBack) {
        update("UPDATE resource_allocations SET released_at = ?, rolled_back = ? WHERE allocation_id = ? AND released_at IS NULL",
                releasedAt, rolledBack, allocationId);
    }

    @Override
    public Optional<DedicatedPoolConfig> findDedicatedPool(String clientId, String resourceType) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT capacity, refill_rate FROM dedicated_pools WHERE client_id = ? AND resource_type = ?")) {
            ps.setString(1, clientId);
            ps.setString(2, resourceType);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                return Optional.of(new DedicatedPoolConfig(clientId, resourceType, rs.getDouble(1), rs.getDouble(2)));
            }
        } catch (SQLException e) {
            throw new StoreException("Dedicated pool lookup failed for " + clientId, e);
        }
    }

    @Override
    public void saveDedicatedPool(DedicatedPoolConfig p) {
        int n = update("UPDATE dedicated_pools SET capacity = ?, refill_rate = ? WHERE client_id = ? AND resource_type = ?",
                p.capacity(), p.refillRatePerSecond(), p.clientId(), p.resourceType());
        if (n == 0) {
            update("INSERT INTO dedicated_pools (client_id, resource_type, capacity, refill_rate) VALUES (?, ?, ?, ?)",
                    p.clientId(), p.resourceType(), p.capacity(), p.refillRatePerSecond());
        }
    }

    @Override
    public void recordQueued(QueueItem item, String queueName, int position, long estimatedWaitMillis) {
        String requirements = Json.write(item.requirements().asMap());
        int n = update("UPDATE resource_queue SET priority = ?, queue_name = ?, resource_requirements = ?, "
                        + "estimated_wait_ms = ?, status = 'queued', updated_at = ?, error_message = NULL WHERE request_id = ?",
                item.priority(), queueName, requirements, estimatedWaitMillis, item.enqueuedAt(), item.requestId());
        if (n == 0) {
            update("INSERT INTO resource_queue (request_id, client_id, template_name, priority, queue_name, "
                            + "resource_requirements, estimated_wait_ms, status, enqueued_at) VALUES (?, ?, ?, ?, ?, ?, ?, 'queued', ?)",
                    item.requestId(), item.clientId(), item.templateName(), item.priority(), queueName, requirements,
                    estimatedWaitMillis, item.enqueuedAt());
        }
    }

    @Override
    public void updateQueueStatus(String requestId, String status, String errorMessage, long at) {
        update("UPDATE resource_queue SET status = ?, error_message = ?, updated_at = ? WHERE request_id = ?",
                status, truncate(errorMessage), at, requestId);
    }

    @Override
    public void createExecution(ExecutionRecord r) {
        update("INSERT INTO execution_records (request_id, attempt, client_id, template_name, status, created_at) "
                        + "VALUES (?, ?, ?, ?, ?, ?)",
                r.requestId(), r.attempt(), r.clientId(), r.templateName(), r.status().code(), r.createdAt());
    }

    @Override
    public boolean updateExecutionStatus(String requestId, int attempt, ExecutionStatus status, long at) {
        String startedAt = status == ExecutionStatus.EXECUTING ? ", started_at = ?" : "";
        List<Object> args = new ArrayList<>();
        args.add(status.code());
        if (!startedAt.isEmpty()) args.add(at);
        args.add(requestId);
        args.add(attempt);
        return update("UPDATE execution_records SET status = ?" + startedAt + " WHERE request_id = ? AND attempt = ?"
                + NOT_TERMINAL, args.toArray()) > 0;
    }

    @Override
    public boolean completeExecution(String requestId, int attempt, long completedAt, long durationMillis,
                                     double totalCostUsd, String outputData, boolean cacheHit) {
        return update("UPDATE execution_records SET status = 'completed', completed_at = ?, duration_ms = ?, "
                        + "total_cost = ?, output_data = ?, cache_hit = ? WHERE request_id = ? AND attempt = ?" + NOT_TERMINAL,
                completedAt, durationMillis, totalCostUsd, outputData, cacheHit, requestId, attempt) > 0;
    }

    @Override
    public boolean failExecution(String requestId, int attempt, FailureReason reason, String errorMessage, long completedAt) {
        return update("UPDATE execution_records SET status = 'failed', failure_reason = ?, error_message = ?, "
                        + "completed_at = ? WHERE request_id = ? AND attempt = ?" + NOT_TERMINAL,
                reason.code(), truncate(errorMessage), completedAt, requestId, attempt) > 0;
    }

    @Override
    public Optional<ExecutionRecord> latestExecution(String requestId) {
        List<ExecutionRecord> all = executions(requestId);
        return all.isEmpty() ? Optional.empty() : Optional.of(all.get(all.size() - 1));
    }

    @Override
    public List<ExecutionRecord> executions(String requestId) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT * FROM execution_records WHERE request_id = ? ORDER BY attempt")) {
            ps.setString(1, requestId);
            List<ExecutionRecord> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) out.add(readExecution(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Execution lookup failed for " + requestId, e);
        }
    }

    @Override
    public void recordCosts(String requestId, String clientId, List<CostLine> lines, double total, LocalDate day, long at) {
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement ins = c.prepareStatement(
                         "INSERT INTO cost_records (request_id, client_id, provider, resource_type, amount_used, total_cost, recorded_at) "
                                 + "VALUES (?, ?, ?, ?, ?, ?, ?)");
                 PreparedStatement upd = c.prepareStatement(
                         "UPDATE client_budgets SET cost_today = cost_today + ?, requests_today = requests_today + 1 "
                                 + "WHERE client_id = ? AND budget_date = ?")) {
                for (CostLine line : lines) {
                    ins.setString(1, requestId);
                    ins.setString(2, clientId);
                    ins.setString(3, line.provider());
                    ins.setString(4, line.resourceType());
                    ins.setDouble(5, line.amountUsed());
                    ins.setDouble(6, line.costUsd());
                    ins.setLong(7, at);
                    ins.addBatch();
                }
                if (!lines.isEmpty()) ins.executeBatch();
                upd.setDouble(1, total);
                upd.setString(2, clientId);
                upd.setDate(3, Date.valueOf(day));
                if (upd.executeUpdate() == 0) {
                    try (PreparedStatement first = c.prepareStatement(
                            "INSERT INTO client_budgets (client_id, budget_date, cost_today, requests_today) VALUES (?, ?, ?, 1)")) {
                        first.setString(1, clientId);
                        first.setDate(2, Date.valueOf(day));
                        first.setDouble(3, total);
                        first.executeUpdate();
                    }
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Cost recording failed for " + requestId, e);
        }
    }

    @Override
    public ClientBudget clientBudget(String clientId, LocalDate day) {
        LocalDate monthStart = day.withDayOfMonth(1);
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT budget_date, cost_today, requests_today FROM client_budgets "
                             + "WHERE client_id = ? AND budget_date >= ? AND budget_date <= ?")) {
            ps.setString(1, clientId);
            ps.setDate(2, Date.valueOf(monthStart));
            ps.setDate(3, Date.valueOf(day));
            double costToday = 0, costMonth = 0;
            long reqToday = 0, reqMonth = 0;
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    double cost = rs.getDouble(2);
                    long requests = rs.getLong(3);
                    costMonth += cost;
                    reqMonth += requests;
                    if (rs.getDate(1).toLocalDate().equals(day)) {
                        costToday = cost;
                        reqToday = requests;
                    }
                }
            }
            return new ClientBudget(clientId, day, costToday, costMonth, reqToday, reqMonth, 0);
        } catch (SQLException e) {
            throw new StoreException("Budget lookup failed for " + clientId, e);
        }
    }

    @Override
    public List<CostSummary> costSummary(String clientId, long sinceMillis) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT provider, resource_type, SUM(amount_used), SUM(total_cost), COUNT(DISTINCT request_id) "
                             + "FROM cost_records WHERE client_id = ? AND recorded_at >= ? "
                             + "GROUP BY provider, resource_type ORDER BY SUM(total_cost) DESC")) {
            ps.setString(1, clientId);
            ps.setLong(2, sinceMillis);
            List<CostSummary> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new CostSummary(rs.getString(1), rs.getString(2), rs.getDouble(3), rs.getDouble(4), rs.getLong(5)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Cost summary failed for " + clientId, e);
        }
    }

    @Override
    public CacheStats cacheStats(String clientId, long sinceMillis) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT COUNT(*), COALESCE(SUM(CASE WHEN cache_hit THEN 1 ELSE 0 END), 0) FROM execution_records "
                             + "WHERE client_id = ? AND created_at >= ? AND status = 'completed'")) {
            ps.setString(1, clientId);
            ps.setLong(2, sinceMillis);
            try (ResultSet rs = ps.executeQuery()) {
                rs.next();
                return new CacheStats(rs.getLong(1), rs.getLong(2));
            }
        } catch (SQLException e) {
            throw new StoreException("Cache stats failed for " + clientId, e);
        }
    }

    @Override
    public Optional<String> templateRequirements(String templateName) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT resource_requirements FROM pipeline_templates WHERE name = ?")) {
            ps.setString(1, templateName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(rs.getString(1)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new StoreException("Template lookup failed for " + templateName, e);
        }
    }

    @Override
    public void saveTemplateRequirements(String templateName, String requirementsJson) {
        int n = update("UPDATE pipeline_templates SET resource_requirements = ? WHERE name = ?", requirementsJson, templateName);
        if (n == 0) {
            update("INSERT INTO pipeline_templates (name, resource_requirements) VALUES (?, ?)", templateName, requirementsJson);
        }
    }

    @Override
    public Alert insertAlert(Alert a) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "INSERT INTO resource_alerts (alert_type, severity, client_id, message, details, created_at) "
                             + "VALUES (?, ?, ?, ?, ?, ?)", Statement.RETURN_GENERATED_KEYS)) {
            bind(ps, a.type().code(), a.severity().code(), a.clientId(), truncate(a.message()), Json.write(a.details()), a.createdAt());
            ps.executeUpdate();
            try (ResultSet keys = ps.getGeneratedKeys()) {
                Long id = keys.next() ? keys.getLong(1) : null;
                return new Alert(id, a.type(), a.severity(), a.clientId(), a.message(), a.details(), a.createdAt());
            }
        } catch (SQLException e) {
            throw new StoreException("Alert insert failed", e);
        }
    }

    @Override
    public List<Alert> openAlerts(int limit) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement(
                     "SELECT id, alert_type, severity, client_id, message, details, created_at FROM resource_alerts "
                             + "WHERE resolved = FALSE ORDER BY created_at DESC, id DESC LIMIT ?")) {
            ps.setInt(1, Math.max(1, limit));
            List<Alert> out = new ArrayList<>();
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Alert(rs.getLong(1),
                            Alert.Type.valueOf(rs.getString(2).toUpperCase(Locale.ROOT)),
                            Alert.Severity.valueOf(rs.getString(3).toUpperCase(Locale.ROOT)),
                            rs.getString(4), rs.getString(5), readDetails(rs.getString(6)), rs.getLong(7)));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new StoreException("Alert listing failed", e);
        }
    }

    private ExecutionRecord readExecution(ResultSet rs) throws SQLException {
        String reason = rs.getString("failure_reason");
        return new ExecutionRecord(
                rs.getString("request_id"),
                rs.getInt("attempt"),
                rs.getString("client_id"),
                rs.getString("template_name"),
                ExecutionStatus.fromCode(rs.getString("status")),
                reason == null ? null : FailureReason.valueOf(reason.toUpperCase(Locale.ROOT)),
                rs.getString("error_message"),
                rs.getLong("created_at"),
                rs.getObject("started_at", Long.class),
                rs.getObject("completed_at", Long.class),
                rs.getObject("duration_ms", Long.class),
                rs.getDouble("total_cost"),
                rs.getString("output_data"),
                rs.getBoolean("cache_hit"));
    }

    private static Map<String, Object> readDetails(String json) {
        if (json == null || json.isBlank()) return Map.of();
        try {
            return Json.mapper().readValue(json, new TypeReference<Map<String, Object>>() {});
        } catch (JsonProcessingException e) {
            log.warn("Unreadable alert details: {}", e.getMessage());
            return Map.of();
        }
    }

    private int update(String sql, Object... args) {
        try (Connection c = getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            bind(ps, args);
            return ps.executeUpdate();
        } catch (SQLException e) {
            throw new StoreException("Statement failed: " + sql, e);
        }
    }

    private static void bind(PreparedStatement ps, Object... args) throws SQLException {
        for (int i = 0; i < args.length; i++) {
            Object v = args[i];
            if (v == null) ps.setNull(i + 1, Types.VARCHAR);
            else ps.setObject(i + 1, v);
        }
    }

    private static String truncate(String s) {
        return s == null || s.length() <= 2000 ? s : s.substring(0, 2000);
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
