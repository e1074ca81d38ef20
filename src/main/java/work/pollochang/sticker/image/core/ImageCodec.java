package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;

import javax.imageio.ImageIO;
import javax.imageio.ImageReader;
import javax.imageio.spi.IIORegistry;
import javax.imageio.stream.ImageInputStream;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.Objects;

/**
 * 管線的輸入輸出邊界：解碼任何 ImageIO 支援的格式成 RGBA，並編碼成 PNG。
 * <p>
 * 色彩模型的轉換只在這裡發生，核心處理只接受 {@link RasterImage}。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class ImageCodec {

    // 註冊 ImageIO 外掛程式，禁用磁碟快取，強制使用記憶體操作，避免 I/O 瓶頸。
    static {
        IIORegistry.getDefaultInstance().registerApplicationClasspathSpis();
        ImageIO.setUseCache(false);
    }

    private ImageCodec() {}

    /**
     * 讀取圖片檔並轉成 RGBA。
     *
     * @throws IOException 檔案不存在、無法讀取或格式不支援
     */
    public static RasterImage read(Path inputPath) throws IOException {
        Objects.requireNonNull(inputPath, "inputPath must not be null");
        if (!Files.exists(inputPath) || !Files.isReadable(inputPath)) {
            throw new IOException("檔案不存在或不可讀: " + inputPath);
        }
        try (DecodedImage decoded = decode(inputPath)) {
            log.debug("{} - 解碼完成 ({}, {}x{})", inputPath, decoded.formatName(),
                    decoded.image().getWidth(), decoded.image().getHeight());
            return decoded.toRaster();
        }
    }

    private static DecodedImage decode(Path inputPath) throws IOException {
        try (InputStream raw = Files.newInputStream(inputPath);
             ImageInputStream in = ImageIO.createImageInputStream(raw)) {
            if (in == null) {
                throw new IOException("無法建立圖片輸入流: " + inputPath);
            }
            Iterator<ImageReader> readers = ImageIO.getImageReaders(in);
            if (!readers.hasNext()) {
                throw new IOException("找不到對應的圖片讀取器: " + inputPath);
            }
            ImageReader reader = readers.next();
            reader.setInput(in, true, true);
            try {
                BufferedImage image = reader.read(0);
                String format = reader.getOriginatingProvider() == null
                        ? "unknown" : reader.getOriginatingProvider().getFormatNames()[0].toLowerCase();
                // reader 交由 DecodedImage 關閉
                return new DecodedImage(image, reader, format);
            } catch (IOException | RuntimeException e) {
                reader.dispose();
                throw e;
            }
        }
    }

    /**
     * 編碼成 PNG 位元組，用於檔案大小檢查與寫檔。
     */
    public static byte[] encodePng(RasterImage image) throws IOException {
        BufferedImage buffered = image.toBufferedImage();
        try (ByteArrayOutputStream bos = new ByteArrayOutputStream()) {
            if (!ImageIO.write(buffered, "png", bos)) {
                throw new IOException("找不到 PNG 編碼器");
            }
            return bos.toByteArray();
        } finally {
            buffered.flush();
        }
    }

    /**
     * 寫出已編碼的 PNG 並回傳檔案大小。
     */
    public static long writePng(byte[] png, Path outputFile) throws IOException {
        Files.write(outputFile, png);
        return png.length;
    }
}
