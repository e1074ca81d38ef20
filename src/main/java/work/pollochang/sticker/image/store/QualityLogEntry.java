package work.pollochang.sticker.image.store;

import java.sql.Timestamp;
import java.util.List;

/**
 * QUALITY_LOG 的一筆紀錄。
 * @param metricsJson 指標的 JSON 字串
 */
public record QualityLogEntry(
        String sessionId,
        int cellIndex,
        String result,
        boolean ok,
        List<String> errors,
        List<String> warnings,
        String metricsJson,
        Timestamp createdAt
) {}
