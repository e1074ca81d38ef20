package work.pollochang.sticker.image.core;

import javax.imageio.ImageReader;
import java.awt.image.BufferedImage;

// 封裝解碼後的圖片和其讀取器，轉成 RasterImage 後即可關閉釋放
record DecodedImage(BufferedImage image, ImageReader reader, String formatName) implements AutoCloseable {

    RasterImage toRaster() {
        return RasterImage.fromBufferedImage(image);
    }

    @Override
    public void close() {
        if (image != null) {
            image.flush();
        }
        if (reader != null) {
            reader.dispose();
        }
    }
}
