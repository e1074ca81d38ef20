package work.pollochang.sticker.image;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;
import work.pollochang.sticker.image.core.RasterImage;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ExecuteTest {

    @Test
    void testAllAccepted_ShouldExitZero(@TempDir Path tempDir) throws IOException {
        RasterImage composite = StickerFixtures.sideBySide(StickerFixtures.onGreen(), StickerFixtures.onGreen());
        Path input = StickerFixtures.writePng(composite, tempDir.resolve("composite.png"));
        Path output = tempDir.resolve("out");

        int exitCode = new CommandLine(new Execute()).execute(
                "-i", input.toString(), "-o", output.toString(), "-r", "1", "-c", "2", "--bg-color", "#00FF00");

        assertEquals(0, exitCode);
        assertTrue(Files.exists(output.resolve("report.json")));
    }

    /**
     * 只有背景的格子不合格，結束碼為 1
     */
    @Test
    void testRejectedCell_ShouldExitOne(@TempDir Path tempDir) throws IOException {
        RasterImage empty = RasterImage.blank(370, 320);
        empty.fill(0, 0, 370, 320, 0, 255, 0, 255);
        RasterImage composite = StickerFixtures.sideBySide(StickerFixtures.onGreen(), empty);
        Path input = StickerFixtures.writePng(composite, tempDir.resolve("composite.png"));

        int exitCode = new CommandLine(new Execute()).execute(
                "-i", input.toString(), "-o", tempDir.resolve("out").toString(), "-r", "1", "-c", "2");

        assertEquals(1, exitCode);
    }

    @Test
    void testMissingRequiredOption_ShouldBeUsageError() {
        int exitCode = new CommandLine(new Execute()).execute("-o", "out");

        assertEquals(2, exitCode);
    }

    @Test
    void testInvalidColor_ShouldBeUsageError(@TempDir Path tempDir) {
        int exitCode = new CommandLine(new Execute()).execute(
                "-i", tempDir.resolve("a.png").toString(), "-o", tempDir.toString(), "--bg-color", "zzz");

        assertEquals(2, exitCode);
    }
}
