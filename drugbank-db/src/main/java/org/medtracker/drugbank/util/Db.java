package org.medtracker.drugbank.util;

/*
 * This file is part of MedTracker.
 *
 * Copyright (C) 2025 The MedTracker Authors
 *
 * MedTracker is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * MedTracker is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with MedTracker.  If not, see <https://www.gnu.org/licenses/>.
 */

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Minimal JDBC helper with connection retries and small query/transaction
 * utilities. Used against the embedded H2 drug store.
 *
 * <p><b>Usage</b>:
 * <pre>
 * try (Connection c = Db.getConnection(jdbcUrl, "sa", "", "org.h2.Driver",
 *                                       1, Duration.ofMillis(100))) {
 *   List&lt;String&gt; names = Db.runQuery(c, "SELECT name FROM drugs WHERE id = ?",
 *       ps -&gt; ps.setString(1, "DB00001"),
 *       rs -&gt; rs.getString(1));
 * }
 * </pre>
 *
 * <p>This class does <i>not</i> own the {@link Connection} lifecycle; callers open and close it.</p>
 */
public final class Db {

    private Db() {}

    /* ---------------------------- Functional types ---------------------------- */

    /** Sets parameters on a PreparedStatement. */
    @FunctionalInterface
    public interface ParamSetter {
        void accept(PreparedStatement ps) throws Exception;
    }

    /** Maps the current row of a ResultSet. */
    @FunctionalInterface
    public interface RowMapper<T> {
        T map(ResultSet rs) throws Exception;
    }

    @FunctionalInterface
    public interface RunnableEx {
        void run() throws Exception;
    }

    /* ---------------------------- Connection helpers ---------------------------- */

    /**
     * Get a JDBC connection with simple retry + exponential backoff.
     * If {@code driverClass} is provided, we try to load it once (ignore if missing).
     */
    public static Connection getConnection(String jdbcUrl,
                                           String user,
                                           String pass,
                                           String driverClass,
                                           int maxRetries,
                                           Duration initialBackoff) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl must not be null");
        Objects.requireNonNull(user, "user must not be null");
        Objects.requireNonNull(pass, "pass must not be null");
        if (maxRetries < 0) throw new IllegalArgumentException("maxRetries must be >= 0");
        if (initialBackoff == null || initialBackoff.isNegative() || initialBackoff.isZero()) {
            initialBackoff = Duration.ofMillis(200);
        }

        if (driverClass != null && !driverClass.isEmpty()) {
            try {
                Class.forName(driverClass);
            } catch (ClassNotFoundException ignored) {
                // rely on service loader registration
            }
        }

        int attempt = 0;
        long sleepMs = initialBackoff.toMillis();
        while (true) {
            try {
                Properties props = new Properties();
                props.setProperty("user", user);
                props.setProperty("password", pass);
                return DriverManager.getConnection(jdbcUrl, props);
            } catch (SQLException ex) {
                attempt++;
                if (attempt > maxRetries) {
                    throw new IllegalStateException("DB connection failed after " + maxRetries + " retries: " + ex, ex);
                }
                try {
                    Thread.sleep(sleepMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new IllegalStateException("DB connection retry interrupted", ie);
                }
                sleepMs = Math.min((long) (sleepMs * 2.0), Duration.ofSeconds(30).toMillis());
            }
        }
    }

    /* ---------------------------- Query helpers ---------------------------- */

    /**
     * Run a small query and collect all rows via RowMapper.
     */
    public static <T> List<T> runQuery(Connection conn,
                                       String sql,
                                       ParamSetter params,
                                       RowMapper<T> mapper) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        List<T> out = new ArrayList<>();
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(mapper.map(rs));
                }
            }
        }
        return out;
    }

    /**
     * First row of a query, or empty if there is none.
     */
    public static <T> Optional<T> querySingle(Connection conn,
                                              String sql,
                                              ParamSetter params,
                                              RowMapper<T> mapper) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");
        Objects.requireNonNull(mapper, "mapper must not be null");

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setMaxRows(1);
            if (params != null) params.accept(ps);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? Optional.ofNullable(mapper.map(rs)) : Optional.empty();
            }
        }
    }

    /**
     * Execute DDL/DML that doesn't return rows (INSERT/UPDATE/DELETE/DDL).
     * Returns the update count.
     */
    public static int execute(Connection conn, String sql, ParamSetter params) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        Objects.requireNonNull(sql, "sql must not be null");

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            if (params != null) params.accept(ps);
            return ps.executeUpdate();
        }
    }

    /* ---------------------------- Transaction helpers ---------------------------- */

    public static void withTransaction(Connection conn, RunnableEx body) throws Exception {
        Objects.requireNonNull(conn, "conn must not be null");
        boolean prevAuto = conn.getAutoCommit();
        conn.setAutoCommit(false);
        try {
            body.run();
            conn.commit();
        } catch (Exception ex) {
            try {
                conn.rollback();
            } catch (SQLException rollbackEx) {
                ex.addSuppressed(rollbackEx);
            }
            throw ex;
        } finally {
            try {
                conn.setAutoCommit(prevAuto);
            } catch (SQLException restoreEx) {
                Logger.warn("Unable to restore auto-commit: {}", restoreEx.getMessage());
            }
        }
    }
}
