package com.lineage.core.persistence.migration;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * SQLite catalog queries used to detect table shapes.
 */
public final class SchemaInspector {

    private SchemaInspector() {}

    public static boolean tableExists(Connection conn, String table) throws SQLException {
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT 1 FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                return rs.next();
            }
        }
    }

    /**
     * Column names of {@code table}, empty when the table does not exist.
     * The name must already be a validated identifier.
     */
    public static Set<String> columns(Connection conn, String table) throws SQLException {
        Set<String> columns = new LinkedHashSet<>();
        try (Statement stmt = conn.createStatement();
             ResultSet rs = stmt.executeQuery("PRAGMA table_info(" + table + ")")) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    /**
     * Creates {@code copy} with the same column definitions and constraints as
     * {@code table}, then copies every row across. Indexes are not copied.
     */
    public static void copyTable(Connection conn, String table, String copy) throws SQLException {
        String definition;
        try (PreparedStatement stmt = conn.prepareStatement(
                "SELECT sql FROM sqlite_master WHERE type = 'table' AND name = ?")) {
            stmt.setString(1, table);
            try (ResultSet rs = stmt.executeQuery()) {
                if (!rs.next() || rs.getString(1) == null) {
                    throw new SQLException("No definition found for table " + table);
                }
                definition = rs.getString(1);
            }
        }
        int columnsStart = definition.indexOf('(');
        if (columnsStart < 0) {
            throw new SQLException("Unexpected definition for table " + table + ": " + definition);
        }
        execute(conn, "CREATE TABLE " + copy + " " + definition.substring(columnsStart));
        execute(conn, "INSERT INTO " + copy + " SELECT * FROM " + table + " ORDER BY rowid");
    }

    public static boolean hasColumn(Connection conn, String table, String column) throws SQLException {
        return columns(conn, table).contains(column);
    }

    public static void execute(Connection conn, String sql) throws SQLException {
        try (Statement stmt = conn.createStatement()) {
            stmt.execute(sql);
        }
    }
}
