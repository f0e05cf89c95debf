package com.pallet.checkdigit.repository;

import com.pallet.checkdigit.model.StationRecord;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.*;
import java.time.Instant;
import java.util.*;

/**
 * JDBC-based repository for the {@code station_check_digit} table.
 *
 * Every query is building-scoped except {@link #deleteAll()} and {@link #countAll()}.
 * Keys passed in must already be canonical ({@code AA-PP}); interpretation of operator
 * shorthand belongs to the normalizer, not here.
 *
 * All methods translate {@link SQLException} into {@link StationStorageException}.
 */
@Singleton
public class StationRepository {

    private static final Logger log = LoggerFactory.getLogger(StationRepository.class);

    private static final String SELECT_COLUMNS = """
            SELECT building_id, station_key, check_digit, description, usage_count, last_updated
              FROM station_check_digit
            """;

    private final DataSource dataSource;

    @Inject
    public StationRepository(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    // -----------------------------------------------------------------------
    // Read operations
    // -----------------------------------------------------------------------

    /**
     * Resolves the check digit for a station.
     *
     * @param buildingId building id
     * @param stationKey canonical key
     * @return the check digit if the station is known
     */
    public Optional<String> findCheckDigit(int buildingId, String stationKey) {
        final String sql = "SELECT check_digit FROM station_check_digit WHERE building_id = ? AND station_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, buildingId);
            ps.setString(2, stationKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(rs.getString("check_digit"));
                }
            }
        } catch (SQLException e) {
            log.error("Error in findCheckDigit building={} key={}", buildingId, stationKey, e);
            throw new StationStorageException("findCheckDigit", e);
        }
        return Optional.empty();
    }

    /**
     * Loads the full row for a station.
     *
     * @param buildingId building id
     * @param stationKey canonical key
     * @return the row if present
     */
    public Optional<StationRecord> find(int buildingId, String stationKey) {
        final String sql = SELECT_COLUMNS + " WHERE building_id = ? AND station_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, buildingId);
            ps.setString(2, stationKey);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in find building={} key={}", buildingId, stationKey, e);
            throw new StationStorageException("find", e);
        }
        return Optional.empty();
    }

    public boolean exists(int buildingId, String stationKey) {
        final String sql = "SELECT 1 FROM station_check_digit WHERE building_id = ? AND station_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, buildingId);
            ps.setString(2, stationKey);
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next();
            }
        } catch (SQLException e) {
            log.error("Error in exists building={} key={}", buildingId, stationKey, e);
            throw new StationStorageException("exists", e);
        }
    }

    /**
     * Read model for the station list screen: most used first, then by key.
     *
     * @param buildingId building id
     * @return all rows of the building (may be empty)
     */
    public List<StationRecord> findAllByBuilding(int buildingId) {
        final String sql = SELECT_COLUMNS + """
                 WHERE building_id = ?
                 ORDER BY usage_count DESC, station_key ASC
                """;
        return queryList("findAllByBuilding", sql, ps -> ps.setInt(1, buildingId));
    }

    /**
     * Case-insensitive substring search over key, description and check digit.
     *
     * @param buildingId building id
     * @param term       search text; {@code %} and {@code _} are matched literally
     * @return matching rows, most used first
     */
    public List<StationRecord> search(int buildingId, String term) {
        final String sql = SELECT_COLUMNS + """
                 WHERE building_id = ?
                   AND (LOWER(station_key) LIKE ? ESCAPE '\\'
                        OR LOWER(description) LIKE ? ESCAPE '\\'
                        OR LOWER(check_digit) LIKE ? ESCAPE '\\')
                 ORDER BY usage_count DESC, station_key ASC
                """;
        final String pattern = "%" + escapeLike(term.toLowerCase(Locale.ROOT)) + "%";
        return queryList("search", sql, ps -> {
            ps.setInt(1, buildingId);
            ps.setString(2, pattern);
            ps.setString(3, pattern);
            ps.setString(4, pattern);
        });
    }

    /**
     * All stations of one aisle, ordered by position.
     *
     * @param buildingId building id
     * @param aisle      two-digit aisle
     * @return rows of the aisle
     */
    public List<StationRecord> findByAisle(int buildingId, String aisle) {
        final String sql = SELECT_COLUMNS + """
                 WHERE building_id = ?
                   AND station_key LIKE ?
                 ORDER BY station_key ASC
                """;
        return queryList("findByAisle", sql, ps -> {
            ps.setInt(1, buildingId);
            ps.setString(2, aisle + "-%");
        });
    }

    /**
     * Stations with at least {@code minUsage} uses, most used first, then by key.
     *
     * @param buildingId building id
     * @param minUsage   lower bound on usage count (inclusive, at least 1)
     * @param limit      maximum rows
     * @return ranked rows
     */
    public List<StationRecord> findMostUsed(int buildingId, int minUsage, int limit) {
        final String sql = SELECT_COLUMNS + """
                 WHERE building_id = ?
                   AND usage_count >= ?
                 ORDER BY usage_count DESC, station_key ASC
                 LIMIT ?
                """;
        return queryList("findMostUsed", sql, ps -> {
            ps.setInt(1, buildingId);
            ps.setInt(2, Math.max(1, minUsage));
            ps.setInt(3, limit);
        });
    }

    public int count(int buildingId) {
        return queryCount("count", "SELECT COUNT(*) FROM station_check_digit WHERE building_id = ?", buildingId);
    }

    public int countAll() {
        return queryCount("countAll", "SELECT COUNT(*) FROM station_check_digit", null);
    }

    // -----------------------------------------------------------------------
    // Write operations
    // -----------------------------------------------------------------------

    /**
     * Increments the usage counter of an existing station. Unknown stations are left alone;
     * no row is ever created here.
     *
     * @param buildingId building id
     * @param stationKey canonical key
     * @return true if a row was updated
     */
    public boolean incrementUsage(int buildingId, String stationKey) {
        final String sql = """
                UPDATE station_check_digit
                   SET usage_count = usage_count + 1
                 WHERE building_id = ?
                   AND station_key = ?
                """;

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, buildingId);
            ps.setString(2, stationKey);
            int rows = ps.executeUpdate();
            log.debug("Incremented usage building={} key={} rows={}", buildingId, stationKey, rows);
            return rows > 0;

        } catch (SQLException e) {
            log.error("Error incrementing usage building={} key={}", buildingId, stationKey, e);
            throw new StationStorageException("incrementUsage", e);
        }
    }

    /**
     * Inserts the station, or replaces check digit and description of an existing one.
     *
     * @param station       the row to write; {@code usageCount} is used for inserts only
     *                      unless {@code preserveUsage} is false
     * @param preserveUsage keep the stored usage count on conflict
     * @return true if a new row was inserted, false if an existing one was replaced
     */
    public boolean upsert(StationRecord station, boolean preserveUsage) {
        try (Connection conn = dataSource.getConnection()) {
            conn.setAutoCommit(false);
            boolean inserted;
            try {
                inserted = upsert(conn, station, preserveUsage);
                conn.commit();
            } catch (SQLException e) {
                rollback(conn, "upsert");
                log.error("Error committing upsert building={} key={}",
                        station.getBuildingId(), station.getStationKey(), e);
                throw new StationStorageException("upsert (commit)", e);
            } catch (RuntimeException e) {
                rollback(conn, "upsert");
                throw e;
            }
            return inserted;
        } catch (SQLException e) {
            log.error("Connection error in upsert building={} key={}",
                    station.getBuildingId(), station.getStationKey(), e);
            throw new StationStorageException("upsert (connection)", e);
        }
    }

    /**
     * Upsert on a caller-supplied connection (supports batch use from the importer).
     * Runs an UPDATE first and falls back to INSERT when no row matched.
     *
     * @param conn          active JDBC connection
     * @param station       the row to write
     * @param preserveUsage keep the stored usage count on conflict
     * @return true if a new row was inserted
     */
    public boolean upsert(Connection conn, StationRecord station, boolean preserveUsage) {
        final String updateSql = preserveUsage
                ? """
                  UPDATE station_check_digit
                     SET check_digit  = ?,
                         description  = ?,
                         last_updated = ?
                   WHERE building_id = ?
                     AND station_key = ?
                  """
                : """
                  UPDATE station_check_digit
                     SET check_digit  = ?,
                         description  = ?,
                         last_updated = ?,
                         usage_count  = 0
                   WHERE building_id = ?
                     AND station_key = ?
                  """;
        final String insertSql = """
                INSERT INTO station_check_digit
                    (building_id, station_key, check_digit, description, usage_count, last_updated)
                VALUES (?, ?, ?, ?, ?, ?)
                """;

        Instant now = station.getLastUpdated() == null ? Instant.now() : station.getLastUpdated();
        String description = station.getDescription() == null ? "" : station.getDescription();

        try (PreparedStatement update = conn.prepareStatement(updateSql)) {
            update.setString(1, station.getCheckDigit());
            update.setString(2, description);
            update.setTimestamp(3, Timestamp.from(now));
            update.setInt(4, station.getBuildingId());
            update.setString(5, station.getStationKey());

            if (update.executeUpdate() > 0) {
                log.debug("Replaced station building={} key={}", station.getBuildingId(), station.getStationKey());
                return false;
            }

            try (PreparedStatement insert = conn.prepareStatement(insertSql)) {
                insert.setInt(1, station.getBuildingId());
                insert.setString(2, station.getStationKey());
                insert.setString(3, station.getCheckDigit());
                insert.setString(4, description);
                insert.setInt(5, Math.max(0, station.getUsageCount()));
                insert.setTimestamp(6, Timestamp.from(now));
                insert.executeUpdate();
            }
            log.debug("Inserted station building={} key={}", station.getBuildingId(), station.getStationKey());
            return true;

        } catch (SQLException e) {
            log.error("Error in upsert building={} key={}", station.getBuildingId(), station.getStationKey(), e);
            throw new StationStorageException("upsert", e);
        }
    }

    /**
     * Deletes one station.
     *
     * @return true if a row was removed
     */
    public boolean delete(int buildingId, String stationKey) {
        final String sql = "DELETE FROM station_check_digit WHERE building_id = ? AND station_key = ?";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setInt(1, buildingId);
            ps.setString(2, stationKey);
            int rows = ps.executeUpdate();
            log.info("Deleted station building={} key={} rows={}", buildingId, stationKey, rows);
            return rows > 0;

        } catch (SQLException e) {
            log.error("Error deleting station building={} key={}", buildingId, stationKey, e);
            throw new StationStorageException("delete", e);
        }
    }

    /**
     * Deletes every station of a building.
     *
     * @return number of rows removed
     */
    public int deleteAllByBuilding(int buildingId) {
        try (Connection conn = dataSource.getConnection()) {
            return deleteAllByBuilding(conn, buildingId);
        } catch (SQLException e) {
            log.error("Error acquiring connection for deleteAllByBuilding building={}", buildingId, e);
            throw new StationStorageException("deleteAllByBuilding (connection acquire)", e);
        }
    }

    /**
     * Deletes every station of a building on a caller-supplied connection, so that a
     * re-import can wipe and refill inside one transaction.
     *
     * @param conn       active JDBC connection
     * @param buildingId building id
     * @return number of rows removed
     */
    public int deleteAllByBuilding(Connection conn, int buildingId) {
        final String sql = "DELETE FROM station_check_digit WHERE building_id = ?";

        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setInt(1, buildingId);
            int rows = ps.executeUpdate();
            log.info("Deleted all stations building={} rows={}", buildingId, rows);
            return rows;

        } catch (SQLException e) {
            log.error("Error deleting all stations for building={}", buildingId, e);
            throw new StationStorageException("deleteAllByBuilding", e);
        }
    }

    /**
     * Wipes the whole table, all buildings.
     *
     * @return number of rows removed
     */
    public int deleteAll() {
        final String sql = "DELETE FROM station_check_digit";

        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            int rows = ps.executeUpdate();
            log.info("Deleted all stations rows={}", rows);
            return rows;

        } catch (SQLException e) {
            log.error("Error wiping station table", e);
            throw new StationStorageException("deleteAll", e);
        }
    }

    // -----------------------------------------------------------------------
    // DataSource accessor, used by the importer for batch connections
    // -----------------------------------------------------------------------

    /**
     * Returns the underlying {@link DataSource} so that batch callers can hold one
     * connection across many {@link #upsert(Connection, StationRecord, boolean)} calls.
     *
     * @return the injected DataSource
     */
    public DataSource getDataSource() {
        return dataSource;
    }

    // -----------------------------------------------------------------------
    // Private helpers
    // -----------------------------------------------------------------------

    private static void rollback(Connection conn, String operation) {
        try {
            conn.rollback();
        } catch (SQLException rollbackEx) {
            log.error("Rollback failed for {}", operation, rollbackEx);
        }
    }

    @FunctionalInterface
    private interface Binder {
        void bind(PreparedStatement ps) throws SQLException;
    }

    private List<StationRecord> queryList(String operation, String sql, Binder binder) {
        List<StationRecord> result = new ArrayList<>();
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            binder.bind(ps);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    result.add(mapRow(rs));
                }
            }
        } catch (SQLException e) {
            log.error("Error in {}", operation, e);
            throw new StationStorageException(operation, e);
        }
        return result;
    }

    private int queryCount(String operation, String sql, Integer buildingId) {
        try (Connection conn = dataSource.getConnection();
             PreparedStatement ps = conn.prepareStatement(sql)) {

            if (buildingId != null) {
                ps.setInt(1, buildingId);
            }
            try (ResultSet rs = ps.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            log.error("Error in {} building={}", operation, buildingId, e);
            throw new StationStorageException(operation, e);
        }
    }

    private StationRecord mapRow(ResultSet rs) throws SQLException {
        StationRecord s = new StationRecord();
        s.setBuildingId(rs.getInt("building_id"));
        s.setStationKey(rs.getString("station_key"));
        s.setCheckDigit(rs.getString("check_digit"));
        String description = rs.getString("description");
        s.setDescription(description == null ? "" : description);
        s.setUsageCount(rs.getInt("usage_count"));
        s.setLastUpdated(toInstant(rs.getTimestamp("last_updated")));
        return s;
    }

    private static String escapeLike(String term) {
        return term.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
