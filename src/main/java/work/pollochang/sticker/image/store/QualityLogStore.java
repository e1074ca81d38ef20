package work.pollochang.sticker.image.store;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.report.StickerReport;

import java.nio.file.Path;
import java.sql.*;
import java.util.ArrayList;
import java.util.List;

/**
 * H2 品質紀錄庫。
 * 每次批次處理後，把每一格的品質結果寫入 QUALITY_LOG，方便日後追查哪些合成圖需要重新生成。
 */
@Slf4j
public class QualityLogStore implements AutoCloseable {

    private Connection connection;
    private final ObjectMapper mapper = new ObjectMapper();

    private static final String INSERT_SQL = "INSERT INTO QUALITY_LOG (SESSION_ID, CELL_INDEX, RESULT, OK, ERRORS, WARNINGS, METRICS) " +
            "VALUES (?, ?, ?, ?, ?, ?, ?)";

    /**
     * 建構子，開啟 H2 資料庫連線。
     * @param dbPath H2 資料庫檔案的路徑。
     */
    public QualityLogStore(Path dbPath) {
        // 移除 .mv.db 副檔名 (如果有的話)，因為 JDBC URL 不需要
        String pathStr = dbPath.toAbsolutePath().toString().replace(".mv.db", "");
        String jdbcUrl = "jdbc:h2:" + pathStr;
        try {
            this.connection = DriverManager.getConnection(jdbcUrl, "sa", "");
            log.info("成功連線至 H2 資料庫: {}", dbPath);
        } catch (SQLException e) {
            throw new RuntimeException("無法建立 H2 資料庫連線: " + jdbcUrl, e);
        }
    }

    /**
     * 初始化資料庫，如果資料表不存在，則建立它。
     */
    public void initSchema() {
        String createTableSql = "CREATE TABLE IF NOT EXISTS QUALITY_LOG (" +
                "ID BIGINT AUTO_INCREMENT PRIMARY KEY, " +
                "SESSION_ID VARCHAR(128) NOT NULL, " +
                "CELL_INDEX INT NOT NULL, " +
                "RESULT VARCHAR(32) NOT NULL, " +
                "OK BOOLEAN NOT NULL, " +
                "ERRORS CLOB, " +
                "WARNINGS CLOB, " +
                "METRICS CLOB, " +
                "CREATED_AT TIMESTAMP DEFAULT CURRENT_TIMESTAMP" +
                ")";
        try (Statement stmt = connection.createStatement()) {
            stmt.execute(createTableSql);
            log.info("H2 資料表 'QUALITY_LOG' 已確認存在。");
        } catch (SQLException e) {
            throw new RuntimeException("無法初始化 H2 資料庫 Schema", e);
        }
    }

    /**
     * 批次寫入一個 session 的所有結果，整批在同一個交易內。
     * @return 寫入筆數，失敗回滾時為 0
     */
    public int saveAll(String sessionId, List<StickerReport> reports) {
        if (reports == null || reports.isEmpty()) {
            log.info("沒有品質紀錄需要寫入。");
            return 0;
        }

        int count = 0;
        try (PreparedStatement ps = connection.prepareStatement(INSERT_SQL)) {
            // 關閉自動提交，手動管理交易
            connection.setAutoCommit(false);

            for (StickerReport report : reports) {
                boolean hasQuality = report.quality() != null;
                ps.setString(1, sessionId);
                ps.setInt(2, report.index());
                ps.setString(3, report.result().name());
                ps.setBoolean(4, hasQuality && report.quality().ok());
                ps.setString(5, hasQuality ? String.join("\n", report.quality().errors()) : null);
                ps.setString(6, hasQuality ? String.join("\n", report.quality().warnings()) : null);
                ps.setString(7, hasQuality ? mapper.writeValueAsString(report.quality().metrics()) : null);
                ps.addBatch();
                count++;
            }
            ps.executeBatch();
            connection.commit(); // 提交整個交易
            log.info("成功將 {} 筆品質紀錄寫入 H2 (session={})。", count, sessionId);
            return count;

        } catch (SQLException | JsonProcessingException e) {
            log.error("批次寫入品質紀錄至 H2 時發生錯誤", e);
            try {
                connection.rollback(); // 如果出錯，則回滾交易
                log.warn("H2 交易已回滾。");
            } catch (SQLException ex) {
                log.error("回滾 H2 交易失敗", ex);
            }
            return 0;
        } finally {
            try {
                connection.setAutoCommit(true); // 恢復自動提交模式
            } catch (SQLException e) {
                log.error("無法恢復 H2 連線的自動提交模式", e);
            }
        }
    }

    /**
     * 讀取一個 session 的所有紀錄，依格子序號排序。
     */
    public List<QualityLogEntry> findBySession(String sessionId) {
        String selectSql = "SELECT SESSION_ID, CELL_INDEX, RESULT, OK, ERRORS, WARNINGS, METRICS, CREATED_AT " +
                "FROM QUALITY_LOG WHERE SESSION_ID = ? ORDER BY CELL_INDEX, ID";
        List<QualityLogEntry> entries = new ArrayList<>();
        try (PreparedStatement ps = connection.prepareStatement(selectSql)) {
            ps.setString(1, sessionId);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    entries.add(new QualityLogEntry(
                            rs.getString("SESSION_ID"),
                            rs.getInt("CELL_INDEX"),
                            rs.getString("RESULT"),
                            rs.getBoolean("OK"),
                            splitLines(rs.getString("ERRORS")),
                            splitLines(rs.getString("WARNINGS")),
                            rs.getString("METRICS"),
                            rs.getTimestamp("CREATED_AT")
                    ));
                }
            }
        } catch (SQLException e) {
            throw new RuntimeException("讀取品質紀錄失敗: session=" + sessionId, e);
        }
        log.debug("從 H2 讀取 {} 筆品質紀錄 (session={})", entries.size(), sessionId);
        return entries;
    }

    private static List<String> splitLines(String value) {
        if (value == null || value.isEmpty()) {
            return List.of();
        }
        return List.of(value.split("\n"));
    }

    /**
     * 關閉資料庫連線，釋放資源。
     */
    @Override
    public void close() {
        if (connection != null) {
            try {
                log.info("正在關閉 H2 資料庫連線...");
                connection.close();
                log.info("H2 資料庫連線已關閉。");
            } catch (SQLException e) {
                log.error("關閉 H2 資料庫連線時發生錯誤。", e);
            }
        }
    }
}
