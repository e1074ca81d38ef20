package work.pollochang.sticker.image.store;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.sticker.image.core.StickerResult;
import work.pollochang.sticker.image.quality.QualityReport;
import work.pollochang.sticker.image.report.StickerReport;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityLogStoreTest {

    private StickerReport createReport(int index, boolean ok) {
        Map<String, Object> metrics = new LinkedHashMap<>();
        metrics.put("visible_pixels", 1200);
        metrics.put("touches_edge", false);
        List<String> errors = ok ? List.of() : List.of("bg_remain: 背景色殘留 (3.00% > 1.00%)");
        QualityReport quality = QualityReport.of(metrics, errors, List.of("semi_transparent: 存在半透明像素 (0.10%)"));
        return new StickerReport(index, ok ? StickerResult.ACCEPTED : StickerResult.REJECTED,
                String.format("%02d.png", index + 1), quality);
    }

    /**
     * 寫入後依格子序號讀回
     */
    @Test
    void testSaveAndFind(@TempDir Path tempDir) {
        try (QualityLogStore store = new QualityLogStore(tempDir.resolve("quality"))) {
            store.initSchema();

            int saved = store.saveAll("batch-1", List.of(createReport(1, false), createReport(0, true)));
            store.saveAll("batch-2", List.of(createReport(0, true)));

            assertEquals(2, saved);
            List<QualityLogEntry> entries = store.findBySession("batch-1");
            assertEquals(2, entries.size());

            QualityLogEntry first = entries.get(0);
            assertEquals(0, first.cellIndex());
            assertEquals("ACCEPTED", first.result());
            assertTrue(first.ok());
            assertTrue(first.errors().isEmpty());
            assertEquals(1, first.warnings().size());
            assertTrue(first.metricsJson().contains("\"visible_pixels\":1200"));
            assertNotNull(first.createdAt());

            QualityLogEntry second = entries.get(1);
            assertFalse(second.ok());
            assertEquals(List.of("bg_remain: 背景色殘留 (3.00% > 1.00%)"), second.errors());
        }
    }

    /**
     * 沒有品質報告的失敗紀錄也能寫入
     */
    @Test
    void testSaveFailedCell(@TempDir Path tempDir) {
        try (QualityLogStore store = new QualityLogStore(tempDir.resolve("quality"))) {
            store.initSchema();

            store.saveAll("batch-1", List.of(new StickerReport(3, StickerResult.FAILED_IO_ERROR, null, null)));

            List<QualityLogEntry> entries = store.findBySession("batch-1");
            assertEquals(1, entries.size());
            assertEquals("FAILED_IO_ERROR", entries.get(0).result());
            assertFalse(entries.get(0).ok());
            assertNull(entries.get(0).metricsJson());
        }
    }

    @Test
    void testEmptyReports_ShouldSaveNothing(@TempDir Path tempDir) {
        try (QualityLogStore store = new QualityLogStore(tempDir.resolve("quality"))) {
            store.initSchema();

            assertEquals(0, store.saveAll("batch-1", List.of()));
            assertTrue(store.findBySession("batch-1").isEmpty());
        }
    }
}
