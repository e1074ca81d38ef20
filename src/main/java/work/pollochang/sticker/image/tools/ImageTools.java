package work.pollochang.sticker.image.tools;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.core.RasterImage;

import java.awt.*;
import java.awt.image.BufferedImage;

@Slf4j
public class ImageTools {

    public static BufferedImage resizeImage(BufferedImage originalImage, int newWidth, int newHeight) {
        // 保留 Alpha 通道
        int imageType = originalImage.getType();
        if (imageType == 0 || imageType == BufferedImage.TYPE_CUSTOM) {
            imageType = originalImage.getAlphaRaster() != null ? BufferedImage.TYPE_INT_ARGB : BufferedImage.TYPE_INT_RGB;
        }

        BufferedImage resizedImage = new BufferedImage(newWidth, newHeight, imageType);
        Graphics2D g2d = resizedImage.createGraphics();
        // 使用更高品質的縮放演算法
        g2d.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
        g2d.setRenderingHint(RenderingHints.KEY_RENDERING, RenderingHints.VALUE_RENDER_QUALITY);
        g2d.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        g2d.drawImage(originalImage, 0, 0, newWidth, newHeight, null);
        g2d.dispose();
        return resizedImage;
    }

    /**
     * 若超過 {@code maxWidth × maxHeight} 則等比縮小到框內，否則直接回傳原影像。
     */
    public static RasterImage fitWithin(RasterImage image, int maxWidth, int maxHeight) {
        if (image.width() <= maxWidth && image.height() <= maxHeight) {
            return image;
        }
        // 選擇較小的比例，以確保縮放後的圖片能完全放入目標框內
        double scale = Math.min((double) maxWidth / image.width(), (double) maxHeight / image.height());
        int newWidth = Math.max(1, Math.min(maxWidth, (int) Math.round(image.width() * scale)));
        int newHeight = Math.max(1, Math.min(maxHeight, (int) Math.round(image.height() * scale)));
        log.debug("尺寸 {}x{} 超過上限 {}x{}，縮放至 {}x{}", image.width(), image.height(),
                maxWidth, maxHeight, newWidth, newHeight);

        BufferedImage source = image.toBufferedImage();
        BufferedImage resized = resizeImage(source, newWidth, newHeight);
        try {
            return RasterImage.fromBufferedImage(resized);
        } finally {
            source.flush();
            resized.flush();
        }
    }
}
