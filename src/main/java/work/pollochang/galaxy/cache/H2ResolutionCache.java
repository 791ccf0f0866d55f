package work.pollochang.galaxy.cache;

import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * H2 座標解析快取。
 * 批次開始前整批載入記憶體，批次結束後一次寫回。
 */
@Slf4j
public class H2ResolutionCache implements AutoCloseable {

    private final Connection connection;

    private static final String MERGE_SQL = "MERGE INTO RESOLVED_COORDINATES (RA_DEG, DEC_DEG, MAX_RADIUS, FOUND, OBJID) " +
            "KEY(RA_DEG, DEC_DEG, MAX_RADIUS) VALUES (?, ?, ?, ?, ?)";

    /**
     * @param dbPath H2 資料庫檔案的路徑 (可含或不含 .mv.db)。
     */
    public H2ResolutionCache(Path dbPath) {
        // JDBC URL 不含 .mv.db
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        String jdbcUrl = String.format("jdbc:h2:%s;AUTO_SERVER=TRUE", pathStr);
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new IllegalStateException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 資料表不存在時建立。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS RESOLVED_COORDINATES (" +
                "RA_DEG DOUBLE, " +
                "DEC_DEG DOUBLE, " +
                "MAX_RADIUS DOUBLE, " +
                "FOUND BOOLEAN, " +
                "OBJID BIGINT, " +
                "PRIMARY KEY (RA_DEG, DEC_DEG, MAX_RADIUS)" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.info("H2 資料表 'RESOLVED_COORDINATES' 已確認存在。");
        } catch (SQLException e) {
            throw new IllegalStateException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 讀取所有快取紀錄。讀取失敗時回傳空 map，批次照常執行、只是不使用快取。
     */
    public Map<CoordinateKey, CachedResolution> loadAllToMap() {
        Map<CoordinateKey, CachedResolution> cache = new ConcurrentHashMap<>();
        String selectSql = "SELECT RA_DEG, DEC_DEG, MAX_RADIUS, FOUND, OBJID FROM RESOLVED_COORDINATES";

        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(selectSql)) {

            while (rs.next()) {
                CoordinateKey key = new CoordinateKey(
                        rs.getDouble("RA_DEG"),
                        rs.getDouble("DEC_DEG"),
                        rs.getDouble("MAX_RADIUS")
                );
                cache.put(key, new CachedResolution(rs.getBoolean("FOUND"), rs.getLong("OBJID")));
            }
        } catch (SQLException e) {
            log.error("從 H2 載入快取時發生錯誤，本次不使用快取", e);
            cache.clear();
        }
        log.info("從 H2 資料庫成功載入 {} 筆座標快取紀錄。", cache.size());
        return cache;
    }

    /**
     * 批次寫回，單一交易，失敗時回滾。
     */
    public void saveAllFromMap(Map<CoordinateKey, CachedResolution> cache) {
        if (cache == null || cache.isEmpty()) {
            log.info("記憶體快取為空，無需儲存至 H2。");
            return;
        }

        log.info("準備將 {} 筆快取紀錄批次寫入 H2 資料庫...", cache.size());
        int batchSize = 0;
        final int MAX_BATCH_SIZE = 1000;

        try (PreparedStatement ps = connection.prepareStatement(MERGE_SQL)) {
            connection.setAutoCommit(false);

            for (Map.Entry<CoordinateKey, CachedResolution> entry : cache.entrySet()) {
                CoordinateKey key = entry.getKey();
                CachedResolution value = entry.getValue();

                ps.setDouble(1, key.ra());
                ps.setDouble(2, key.dec());
                ps.setDouble(3, key.maxRadius());
                ps.setBoolean(4, value.found());
                if (value.found()) {
                    ps.setLong(5, value.objectId());
                } else {
                    ps.setNull(5, Types.BIGINT);
                }
                ps.addBatch();
                batchSize++;

                if (batchSize % MAX_BATCH_SIZE == 0) {
                    ps.executeBatch();
                    log.debug("已提交 {} 筆紀錄至 H2...", batchSize);
                }
            }

            if (batchSize % MAX_BATCH_SIZE != 0) {
                ps.executeBatch();
            }

            connection.commit();
            log.info("成功將 {} 筆紀錄儲存/更新至 H2 資料庫。", batchSize);

        } catch (SQLException e) {
            log.error("批次儲存快取至 H2 時發生錯誤", e);
            try {
                connection.rollback();
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
        } finally {
            try {
                connection.setAutoCommit(true);
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    @Override
    public void close() {
        try {
            log.info("正在關閉 H2 資料庫連線...");
            connection.close();
            log.info("H2 資料庫連線已關閉。");
        } catch (SQLException e) {
            log.error("關閉 H2 資料庫連線時發生錯誤。", e);
        }
    }
}
