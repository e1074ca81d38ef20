package work.pollochang.sticker.image.quality;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 單張貼圖的品質報告，建立後不可修改。
 *
 * @param ok       沒有任何致命錯誤時為 true，且只有此時為 true
 * @param metrics  依計算順序排列的指標，值為數字或布林
 * @param errors   致命錯誤說明
 * @param warnings 警告說明
 */
public record QualityReport(boolean ok, Map<String, Object> metrics, List<String> errors, List<String> warnings) {

    public QualityReport {
        if (ok != errors.isEmpty()) {
            throw new IllegalArgumentException("ok 必須與致命錯誤是否為空一致: ok=" + ok + ", errors=" + errors);
        }
        metrics = Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        errors = List.copyOf(errors);
        warnings = List.copyOf(warnings);
    }

    public static QualityReport of(Map<String, Object> metrics, List<String> errors, List<String> warnings) {
        return new QualityReport(errors.isEmpty(), metrics, errors, warnings);
    }

    public boolean hasError(QualityCheck check) {
        return errors.stream().anyMatch(e -> e.startsWith(check.key() + ":"));
    }

    public boolean hasWarning(QualityCheck check) {
        return warnings.stream().anyMatch(w -> w.startsWith(check.key() + ":"));
    }

    public double metric(String name) {
        Object value = metrics.get(name);
        if (value instanceof Number) {
            return ((Number) value).doubleValue();
        }
        throw new IllegalArgumentException("指標不存在或不是數值: " + name);
    }
}
