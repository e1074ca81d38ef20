package work.pollochang.sticker.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.sticker.image.core.RasterImage;
import work.pollochang.sticker.image.core.StickerResult;
import work.pollochang.sticker.image.report.StickerReport;
import work.pollochang.sticker.image.store.QualityLogEntry;
import work.pollochang.sticker.image.store.QualityLogStore;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StickerBatchTest {

    private StickerBatch createBatch(Path input, Path output) {
        StickerBatch batch = new StickerBatch();
        batch.setInputPath(input);
        batch.setSaveDir(output);
        batch.setRows(1);
        batch.setCols(2);
        batch.setTargetAspect(370.0 / 320.0);
        return batch;
    }

    /**
     * 一張 1x2 的合成圖：兩格都通過，輸出貼圖與報告
     */
    @Test
    void testExecute_ShouldWriteStickersAndReports(@TempDir Path tempDir) throws IOException {
        RasterImage composite = StickerFixtures.sideBySide(StickerFixtures.onGreen(), StickerFixtures.onGreen());
        Path input = StickerFixtures.writePng(composite, tempDir.resolve("composite.png"));
        Path output = tempDir.resolve("out");

        List<StickerReport> reports = createBatch(input, output).execute();

        assertEquals(2, reports.size());
        for (StickerReport report : reports) {
            assertEquals(StickerResult.ACCEPTED, report.result());
            assertTrue(report.quality().ok());
        }
        assertEquals(0, reports.get(0).index());
        assertEquals("02.png", reports.get(1).file());

        assertTrue(Files.exists(output.resolve("01.png")));
        assertTrue(Files.exists(output.resolve("02.png")));
        assertTrue(Files.exists(output.resolve("01.json")));
        assertTrue(Files.exists(output.resolve("report.json")));

        BufferedImage sticker = ImageIO.read(output.resolve("01.png").toFile());
        assertEquals(366, sticker.getWidth());
        assertEquals(316, sticker.getHeight());
        assertEquals(0, sticker.getRGB(0, 0) >>> 24);
        // 寫出的檔案大小與品質報告中的大小一致
        assertEquals(Files.size(output.resolve("01.png")), (long) reports.get(0).quality().metric("file_bytes"));
    }

    @Test
    void testExecute_WithQualityLog_ShouldPersistSession(@TempDir Path tempDir) throws IOException {
        RasterImage composite = StickerFixtures.sideBySide(StickerFixtures.onGreen(), StickerFixtures.onGreen());
        Path input = StickerFixtures.writePng(composite, tempDir.resolve("composite.png"));
        Path db = tempDir.resolve("quality");

        StickerBatch batch = createBatch(input, tempDir.resolve("out"));
        batch.setQualityLogPath(db);
        batch.setSessionId("session-a");
        batch.execute();

        try (QualityLogStore store = new QualityLogStore(db)) {
            List<QualityLogEntry> entries = store.findBySession("session-a");
            assertEquals(2, entries.size());
            assertTrue(entries.stream().allMatch(QualityLogEntry::ok));
        }
    }

    /**
     * 合成圖不存在時不丟例外，回傳空結果
     */
    @Test
    void testExecute_MissingInput_ShouldReturnEmpty(@TempDir Path tempDir) {
        List<StickerReport> reports = createBatch(tempDir.resolve("missing.png"), tempDir.resolve("out")).execute();

        assertTrue(reports.isEmpty());
    }
}
