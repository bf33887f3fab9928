package com.quicklook.db;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

public class ExposureCatalogDao {

    private final String dbPath;

    public ExposureCatalogDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    /**
     * Returns the exposure with this name, creating it with {@code typicalPath}
     * (the first path seen) if it does not exist yet.
     */
    public ExposureRecord getOrCreate(String name, int exposureNumber, String typicalPath) throws SQLException {
        try (Connection conn = connect()) {
            Optional<ExposureRecord> existing = findByNameInternal(conn, name);
            if (existing.isPresent()) {
                return existing.get();
            }

            long now = System.currentTimeMillis();
            try (PreparedStatement ps = conn.prepareStatement(
                    "INSERT INTO exposure (name, exposure_number, typical_path, created_ts) VALUES (?, ?, ?, ?)",
                    Statement.RETURN_GENERATED_KEYS)) {
                ps.setString(1, name);
                ps.setInt(2, exposureNumber);
                ps.setString(3, typicalPath);
                ps.setLong(4, now);
                ps.executeUpdate();

                try (ResultSet rs = ps.getGeneratedKeys()) {
                    if (rs.next()) {
                        return new ExposureRecord(rs.getLong(1), name, exposureNumber, typicalPath, now);
                    } else {
                        throw new SQLException("Creating exposure failed, no ID obtained.");
                    }
                }
            } catch (SQLException e) {
                // Created by someone else in between
                if (e.getMessage() != null && e.getMessage().contains("UNIQUE constraint failed")) {
                    return findByNameInternal(conn, name)
                            .orElseThrow(() -> new SQLException(
                                    "Failed to find exposure after UNIQUE constraint violation", e));
                }
                throw e;
            }
        }
    }

    /**
     * Records a frame path under an exposure. Returns false if it was already
     * recorded.
     */
    public boolean addFrame(long exposureId, String path) throws SQLException {
        String sql = "INSERT OR IGNORE INTO exposure_frame (exposure_id, path, created_ts) VALUES (?, ?, ?)";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, exposureId);
            ps.setString(2, path);
            ps.setLong(3, System.currentTimeMillis());
            return ps.executeUpdate() > 0;
        }
    }

    public List<String> findFrames(long exposureId) throws SQLException {
        String sql = "SELECT path FROM exposure_frame WHERE exposure_id = ? ORDER BY path";
        List<String> paths = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setLong(1, exposureId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    paths.add(rs.getString("path"));
                }
            }
        }
        return paths;
    }

    public Optional<ExposureRecord> findByName(String name) throws SQLException {
        try (Connection conn = connect()) {
            return findByNameInternal(conn, name);
        }
    }

    public List<ExposureRecord> listRecent(int limit) throws SQLException {
        String sql = "SELECT id, name, exposure_number, typical_path, created_ts FROM exposure " +
                "ORDER BY exposure_number DESC LIMIT ?";
        List<ExposureRecord> records = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(map(rs));
                }
            }
        }
        return records;
    }

    private Optional<ExposureRecord> findByNameInternal(Connection conn, String name) throws SQLException {
        String sql = "SELECT id, name, exposure_number, typical_path, created_ts FROM exposure WHERE name = ?";
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, name);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(map(rs));
                }
            }
        }
        return Optional.empty();
    }

    private static ExposureRecord map(ResultSet rs) throws SQLException {
        return new ExposureRecord(
                rs.getLong("id"),
                rs.getString("name"),
                rs.getInt("exposure_number"),
                rs.getString("typical_path"),
                rs.getLong("created_ts"));
    }
}
