package com.quicklook.db;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.sql.Statement;

public class SqliteInitializer {

    public static void initialize(String dbPath) throws SQLException {
        String url = "jdbc:sqlite:" + dbPath;
        try (Connection conn = DriverManager.getConnection(url)) {
            try (Statement stmt = conn.createStatement()) {
                // Enable WAL mode
                stmt.execute("PRAGMA journal_mode = WAL;");

                // One row per exposure ever seen
                stmt.execute("CREATE TABLE IF NOT EXISTS exposure (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "name TEXT NOT NULL UNIQUE, " +
                        "exposure_number INTEGER NOT NULL, " +
                        "typical_path TEXT, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE TABLE IF NOT EXISTS exposure_frame (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "exposure_id INTEGER NOT NULL, " +
                        "path TEXT NOT NULL, " +
                        "created_ts INTEGER NOT NULL, " +
                        "UNIQUE (exposure_id, path), " +
                        "FOREIGN KEY (exposure_id) REFERENCES exposure(id) ON DELETE CASCADE" +
                        ");");

                // Provenance of tiles handed to the display; pixels are not stored
                stmt.execute("CREATE TABLE IF NOT EXISTS mosaic_tile (" +
                        "id INTEGER PRIMARY KEY AUTOINCREMENT, " +
                        "exposure_name TEXT NOT NULL, " +
                        "detector_ids TEXT NOT NULL, " +
                        "frame_first INTEGER NOT NULL, " +
                        "frame_last INTEGER NOT NULL, " +
                        "width INTEGER NOT NULL, " +
                        "height INTEGER NOT NULL, " +
                        "flat_applied INTEGER NOT NULL, " +
                        "created_ts INTEGER NOT NULL" +
                        ");");

                stmt.execute("CREATE INDEX IF NOT EXISTS idx_tile_exposure " +
                        "ON mosaic_tile (exposure_name);");
            }
        }
    }
}
