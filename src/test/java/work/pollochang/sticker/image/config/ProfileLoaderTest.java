package work.pollochang.sticker.image.config;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import work.pollochang.sticker.image.core.PipelineSettings;
import work.pollochang.sticker.image.core.RgbColor;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProfileLoaderTest {

    private final ProfileLoader loader = new ProfileLoader();

    private Path writeProfile(Path dir, String json) throws IOException {
        Path file = dir.resolve("profile.json");
        Files.write(file, json.getBytes(StandardCharsets.UTF_8));
        return file;
    }

    @Test
    void testNullPath_ShouldReturnDefaults() throws IOException {
        assertEquals(PipelineSettings.defaults(), loader.load(null));
    }

    /**
     * 只覆寫列出的欄位，其餘沿用預設值
     */
    @Test
    void testPartialOverride_ShouldMergeIntoDefaults(@TempDir Path tempDir) throws IOException {
        Path profile = writeProfile(tempDir, "{"
                + "\"outlineRadius\": 4,"
                + "\"background\": {\"tolerance\": 60, \"fixedColors\": [{\"r\": 255, \"g\": 0, \"b\": 255}]},"
                + "\"quality\": {\"maxWidth\": 740, \"maxHeight\": 640}"
                + "}");

        PipelineSettings settings = loader.load(profile);
        PipelineSettings defaults = PipelineSettings.defaults();

        assertEquals(4, settings.outlineRadius());
        assertEquals(60, settings.background().tolerance());
        assertEquals(List.of(new RgbColor(255, 0, 255)), settings.background().fixedColors());
        assertEquals(defaults.background().quantizeStep(), settings.background().quantizeStep());
        assertEquals(740, settings.quality().maxWidth());
        assertEquals(640, settings.quality().maxHeight());
        assertEquals(defaults.quality().alphaCut(), settings.quality().alphaCut());
        assertEquals(RgbColor.WHITE, settings.outlineColor());
    }

    @Test
    void testUnknownField_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path profile = writeProfile(tempDir, "{\"outlineRadios\": 4}");

        assertThrows(IOException.class, () -> loader.load(profile));
    }

    /**
     * 數值不合法時拒絕，不會默默套用
     */
    @Test
    void testInvalidValue_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path profile = writeProfile(tempDir, "{\"background\": {\"tolerance\": 0}}");

        assertThrows(IOException.class, () -> loader.load(profile));
    }

    @Test
    void testMissingFile_ShouldThrow(@TempDir Path tempDir) {
        assertThrows(IOException.class, () -> loader.load(tempDir.resolve("missing.json")));
    }

    @Test
    void testNonObjectRoot_ShouldThrow(@TempDir Path tempDir) throws IOException {
        Path profile = writeProfile(tempDir, "[1, 2]");

        assertThrows(IOException.class, () -> loader.load(profile));
    }
}
