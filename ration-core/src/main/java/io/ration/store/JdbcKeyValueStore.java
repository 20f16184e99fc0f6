package io.ration.store;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.util.Optional;

/**
 * Key-value entries in the {@code kv_entries} table, so checkpoints outlive the process. An {@code expires_at} of
 * zero never expires; expired rows are deleted when read.
 */
public class JdbcKeyValueStore implements KeyValueStore {
    private final String jdbcUrl;
    private final String user;
    private final String password;
    private final Clock clock;

    public JdbcKeyValueStore(String jdbcUrl, String user, String password, Clock clock) {
        this.jdbcUrl = jdbcUrl;
        this.user = user;
        this.password = password;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    @Override
    public Optional<String> get(String key) {
        try (Connection c = getConnection();
             PreparedStatement ps = c.prepareStatement("SELECT entry_val, expires_at FROM kv_entries WHERE entry_key = ?")) {
            ps.setString(1, key);
            try (ResultSet rs = ps.executeQuery()) {
                if (!rs.next()) return Optional.empty();
                long expiresAt = rs.getLong(2);
                if (expiresAt > 0 && clock.millis() >= expiresAt) {
                    delete(c, key);
                    return Optional.empty();
                }
                return Optional.of(rs.getString(1));
            }
        } catch (SQLException e) {
            throw new StoreException("Read of " + key + " failed", e);
        }
    }

    @Override
    public void put(String key, String value) {
        write(key, value, 0);
    }

    @Override
    public void put(String key, String value, Duration ttl) {
        long expiresAt = (ttl == null || ttl.isZero() || ttl.isNegative()) ? 0 : clock.millis() + ttl.toMillis();
        write(key, value, expiresAt);
    }

    @Override
    public void delete(String key) {
        try (Connection c = getConnection()) {
            delete(c, key);
        } catch (SQLException e) {
            throw new StoreException("Delete of " + key + " failed", e);
        }
    }

    private void write(String key, String value, long expiresAt) {
        try (Connection c = getConnection()) {
            c.setAutoCommit(false);
            try (PreparedStatement upd = c.prepareStatement("UPDATE kv_entries SET entry_val = ?, expires_at = ? WHERE entry_key = ?")) {
                upd.setString(1, value);
                upd.setLong(2, expiresAt);
                upd.setString(3, key);
                if (upd.executeUpdate() == 0) {
                    try (PreparedStatement ins = c.prepareStatement("INSERT INTO kv_entries (entry_key, entry_val, expires_at) VALUES (?, ?, ?)")) {
                        ins.setString(1, key);
                        ins.setString(2, value);
                        ins.setLong(3, expiresAt);
                        ins.executeUpdate();
                    }
                }
                c.commit();
            } catch (SQLException e) {
                c.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new StoreException("Write of " + key + " failed", e);
        }
    }

    private static void delete(Connection c, String key) throws SQLException {
        try (PreparedStatement ps = c.prepareStatement("DELETE FROM kv_entries WHERE entry_key = ?")) {
            ps.setString(1, key);
            ps.executeUpdate();
        }
    }

    private Connection getConnection() throws SQLException {
        return (user == null) ? DriverManager.getConnection(jdbcUrl) : DriverManager.getConnection(jdbcUrl, user, password);
    }
}
