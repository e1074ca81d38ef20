package work.pollochang.sticker.image;

import work.pollochang.sticker.image.core.RasterImage;
import work.pollochang.sticker.image.core.RgbColor;

import javax.imageio.ImageIO;
import java.io.IOException;
import java.nio.file.Path;

/**
 * 測試共用的合成影像。
 */
public final class StickerFixtures {

    public static final int WIDTH = 370;
    public static final int HEIGHT = 320;

    private StickerFixtures() {}

    /**
     * 已經處理乾淨的貼圖：透明背景、紅色角色、外圍 4px 純白描邊。
     */
    public static RasterImage cleanSticker(int width, int height) {
        RasterImage image = RasterImage.blank(width, height);
        image.fill(60, 60, width - 60, height - 60, 255, 255, 255, 255);
        image.fill(64, 64, width - 64, height - 64, 255, 0, 0, 255);
        return image;
    }

    public static RasterImage cleanSticker() {
        return cleanSticker(WIDTH, HEIGHT);
    }

    /**
     * 生成器的原始輸出：綠色背景上同樣的角色。
     */
    public static RasterImage onGreen(int width, int height) {
        RasterImage image = cleanSticker(width, height);
        for (int i = 0; i < image.pixelCount(); i++) {
            if (!image.isVisible(i)) {
                image.setPixel(i, RgbColor.GREEN.r(), RgbColor.GREEN.g(), RgbColor.GREEN.b(), 255);
            }
        }
        return image;
    }

    public static RasterImage onGreen() {
        return onGreen(WIDTH, HEIGHT);
    }

    /**
     * 把多張影像左右拼成一張合成圖。
     */
    public static RasterImage sideBySide(RasterImage... cells) {
        int width = 0;
        int height = 0;
        for (RasterImage cell : cells) {
            width += cell.width();
            height = Math.max(height, cell.height());
        }
        RasterImage composite = RasterImage.blank(width, height);
        int offset = 0;
        for (RasterImage cell : cells) {
            for (int y = 0; y < cell.height(); y++) {
                for (int x = 0; x < cell.width(); x++) {
                    int i = cell.index(x, y);
                    composite.setPixel(composite.index(offset + x, y),
                            cell.red(i), cell.green(i), cell.blue(i), cell.alpha(i));
                }
            }
            offset += cell.width();
        }
        return composite;
    }

    public static Path writePng(RasterImage image, Path file) throws IOException {
        ImageIO.write(image.toBufferedImage(), "png", file.toFile());
        return file;
    }
}
