package com.quicklook.db;

import java.sql.*;
import java.util.ArrayList;
import java.util.List;

public class MosaicTileDao {

    private final String dbPath;

    public MosaicTileDao(String dbPath) {
        this.dbPath = dbPath;
    }

    private Connection connect() throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + dbPath);
    }

    public long insert(String exposureName, String detectorIds, int frameFirst, int frameLast, int width,
            int height, boolean flatApplied) throws SQLException {
        String sql = "INSERT INTO mosaic_tile (exposure_name, detector_ids, frame_first, frame_last, " +
                "width, height, flat_applied, created_ts) VALUES (?, ?, ?, ?, ?, ?, ?, ?)";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql, Statement.RETURN_GENERATED_KEYS)) {
            ps.setString(1, exposureName);
            ps.setString(2, detectorIds);
            ps.setInt(3, frameFirst);
            ps.setInt(4, frameLast);
            ps.setInt(5, width);
            ps.setInt(6, height);
            ps.setInt(7, flatApplied ? 1 : 0);
            ps.setLong(8, System.currentTimeMillis());
            ps.executeUpdate();
            try (ResultSet rs = ps.getGeneratedKeys()) {
                if (rs.next()) {
                    return rs.getLong(1);
                }
                throw new SQLException("Creating mosaic_tile failed, no ID obtained.");
            }
        }
    }

    public List<MosaicTileRecord> findByExposure(String exposureName) throws SQLException {
        String sql = "SELECT id, exposure_name, detector_ids, frame_first, frame_last, width, height, " +
                "flat_applied, created_ts FROM mosaic_tile WHERE exposure_name = ? ORDER BY id";
        List<MosaicTileRecord> records = new ArrayList<>();
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, exposureName);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    records.add(new MosaicTileRecord(
                            rs.getLong("id"),
                            rs.getString("exposure_name"),
                            rs.getString("detector_ids"),
                            rs.getInt("frame_first"),
                            rs.getInt("frame_last"),
                            rs.getInt("width"),
                            rs.getInt("height"),
                            rs.getInt("flat_applied") != 0,
                            rs.getLong("created_ts")));
                }
            }
        }
        return records;
    }

    public int countByExposure(String exposureName) throws SQLException {
        String sql = "SELECT COUNT(*) FROM mosaic_tile WHERE exposure_name = ?";
        try (Connection conn = connect();
                PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, exposureName);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        }
    }
}
