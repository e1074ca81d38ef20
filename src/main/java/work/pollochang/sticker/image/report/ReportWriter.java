package work.pollochang.sticker.image.report;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 以 JSON 輸出品質報告。
 */
@Slf4j
public class ReportWriter {

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = new ObjectMapper();
        mapper.enable(SerializationFeature.INDENT_OUTPUT); // 讓 JSON 格式化，方便閱讀
    }

    /**
     * 單張貼圖的報告。
     */
    public void write(Path path, StickerReport report) throws IOException {
        mapper.writeValue(path.toFile(), report);
        log.debug("{} - 報告已寫入", path);
    }

    /**
     * 整批的彙總報告。
     */
    public void writeSummary(Path path, Map<String, Object> header, List<StickerReport> reports) throws IOException {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("batch", header);
        summary.put("stickers", reports);
        mapper.writeValue(path.toFile(), summary);
        log.info("{} - 彙總報告已寫入 ({} 筆)", path, reports.size());
    }
}
