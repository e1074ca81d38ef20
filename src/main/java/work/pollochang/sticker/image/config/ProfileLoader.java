package work.pollochang.sticker.image.config;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.core.PipelineSettings;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Map;

/**
 * 從 JSON 設定檔讀取管線參數。
 * <p>
 * 設定檔只需列出要覆寫的欄位，其餘沿用 {@link PipelineSettings#defaults()}，例如：
 * <pre>{@code
 * {
 *   "outlineRadius": 4,
 *   "background": { "tolerance": 60 },
 *   "quality": { "maxWidth": 740, "maxHeight": 640 }
 * }
 * }</pre>
 * 未知欄位或不合法的數值會直接丟出例外，不會默默忽略。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ProfileLoader {

    private final ObjectMapper mapper = new ObjectMapper();

    /**
     * @param path 設定檔路徑，為 null 時回傳預設值
     * @throws IOException 檔案無法讀取、JSON 格式錯誤、含有未知欄位或數值不合法
     */
    public PipelineSettings load(Path path) throws IOException {
        if (path == null) {
            log.info("未指定設定檔，使用預設參數。");
            return PipelineSettings.defaults();
        }
        if (!Files.exists(path)) {
            throw new IOException("設定檔不存在: " + path);
        }
        JsonNode overrides = mapper.readTree(path.toFile());
        PipelineSettings settings = merge(overrides);
        log.info("成功從 {} 讀取設定檔。", path);
        return settings;
    }

    /**
     * 把覆寫值合併到預設值上。
     */
    public PipelineSettings merge(JsonNode overrides) throws IOException {
        ObjectNode base = mapper.valueToTree(PipelineSettings.defaults());
        if (overrides != null && !overrides.isNull()) {
            if (!overrides.isObject()) {
                throw new IOException("設定檔最外層必須是 JSON 物件");
            }
            deepMerge(base, (ObjectNode) overrides);
        }
        // 數值檢查在各 record 的建構子，失敗時由 Jackson 包成 JsonMappingException
        return mapper.treeToValue(base, PipelineSettings.class);
    }

    private static void deepMerge(ObjectNode target, ObjectNode source) {
        Iterator<Map.Entry<String, JsonNode>> fields = source.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode existing = target.get(field.getKey());
            if (existing != null && existing.isObject() && field.getValue().isObject()) {
                deepMerge((ObjectNode) existing, (ObjectNode) field.getValue());
            } else {
                target.set(field.getKey(), field.getValue());
            }
        }
    }
}
