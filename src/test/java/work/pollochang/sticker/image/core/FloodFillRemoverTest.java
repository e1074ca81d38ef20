package work.pollochang.sticker.image.core;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FloodFillRemoverTest {

    private final BackgroundConfig config = BackgroundConfig.defaults();

    private RasterImage createTestImage() {
        RasterImage image = RasterImage.blank(60, 60);
        image.fill(0, 0, 60, 60, 0, 255, 0, 255);
        image.fill(15, 15, 45, 45, 255, 0, 0, 255);
        return image;
    }

    /**
     * 與邊界相連的背景全部移除，角色不受影響
     */
    @Test
    void testRemove_ShouldClearBorderConnectedBackground() {
        RasterImage image = createTestImage();
        BackgroundEstimate estimate = BackgroundEstimator.estimate(image, config);

        int removed = FloodFillRemover.remove(image, estimate, config);

        assertEquals(60 * 60 - 30 * 30, removed);
        assertEquals(0, image.alpha(0, 0));
        assertEquals(0, image.alpha(14, 30));
        assertEquals(255, image.alpha(15, 30));
        // 顏色保留，只動 alpha
        assertEquals(255, image.green(image.index(0, 0)));
    }

    /**
     * 被角色包圍的背景色區塊不處理
     */
    @Test
    void testRemove_ShouldKeepEnclosedBackground() {
        RasterImage image = createTestImage();
        image.fill(25, 25, 35, 35, 0, 255, 0, 255);
        BackgroundEstimate estimate = BackgroundEstimator.estimate(image, config);

        FloodFillRemover.remove(image, estimate, config);

        assertEquals(255, image.alpha(30, 30));
    }

    @Test
    void testRemove_ShouldHonorTolerance() {
        RasterImage image = createTestImage();
        // 距離² = 1025，在 48² 以內
        image.fill(0, 0, 60, 5, 20, 240, 20, 255);
        // 距離² = 2425，超出 48²
        image.fill(0, 55, 60, 60, 30, 230, 30, 255);
        BackgroundEstimate estimate = new BackgroundEstimate(List.of(RgbColor.GREEN), 1, true);

        FloodFillRemover.remove(image, estimate, config);

        assertEquals(0, image.alpha(30, 2));
        assertEquals(255, image.alpha(30, 57));
        assertEquals(0, image.alpha(30, 50));
    }

    @Test
    void testRemove_AlreadyTransparentPixels_ShouldPropagate() {
        RasterImage image = RasterImage.blank(40, 40);
        image.fill(10, 10, 30, 30, 255, 0, 0, 255);
        BackgroundEstimate estimate = new BackgroundEstimate(List.of(RgbColor.GREEN), 1, true);

        int removed = FloodFillRemover.remove(image, estimate, config);

        assertEquals(40 * 40 - 20 * 20, removed);
        assertEquals(255, image.alpha(20, 20));
    }

    /**
     * 指定背景色且整張都是該色：全部變透明
     */
    @Test
    void testRemove_FixedColorFlatImage_ShouldClearEverything() {
        RasterImage image = RasterImage.blank(30, 20);
        image.fill(0, 0, 30, 20, 0, 0, 255, 255);
        BackgroundConfig fixed = config.withFixedColors(List.of(new RgbColor(0, 0, 255)));
        BackgroundEstimate estimate = BackgroundEstimator.estimate(image, fixed);

        int removed = FloodFillRemover.remove(image, estimate, fixed);

        assertEquals(30 * 20, removed);
        for (int i = 0; i < 30 * 20; i++) {
            assertEquals(0, image.alpha(i));
        }
    }

    /**
     * 沒有任何像素接近候選背景色：影像不變
     */
    @Test
    void testRemove_NoMatchingPixel_ShouldLeaveImageUnchanged() {
        RasterImage image = RasterImage.blank(30, 20);
        image.fill(0, 0, 30, 20, 255, 0, 0, 255);
        RasterImage original = image.copy();
        BackgroundEstimate estimate = new BackgroundEstimate(List.of(RgbColor.GREEN), 1, true);

        int removed = FloodFillRemover.remove(image, estimate, config);

        assertEquals(0, removed);
        assertTrue(original.sameContent(image));
    }
}
