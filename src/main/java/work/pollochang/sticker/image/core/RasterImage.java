package work.pollochang.sticker.image.core;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * RGBA 8-bit 像素緩衝區，每個像素依序為 R、G、B、A 四個位元組。
 * <p>
 * 透明度只由 alpha 通道決定，不做預乘。緩衝區由持有它的處理階段獨佔，
 * 各階段要嘛就地修改，要嘛回傳新的影像，不會共用同一個陣列。
 * <p>
 * 像素以線性索引存取：{@code index = y * width + x}。
 *
 * @author PolloChang
 * @since 0.1.0
 */
public final class RasterImage {

    private final int width;
    private final int height;
    private final byte[] data;

    /**
     * 以既有的 RGBA 緩衝區建立影像，緩衝區的所有權移交給此物件。
     *
     * @param width  寬度，需大於 0
     * @param height 高度，需大於 0
     * @param data   長度必須為 {@code width * height * 4}
     * @throws IllegalArgumentException 尺寸為零或緩衝區長度不符
     */
    public RasterImage(int width, int height, byte[] data) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("影像尺寸必須大於 0: " + width + "x" + height);
        }
        if (data == null || (long) width * height * 4 != data.length) {
            throw new IllegalArgumentException("RGBA 緩衝區長度不符: 預期 " + ((long) width * height * 4)
                    + "，實際 " + (data == null ? "null" : data.length));
        }
        this.width = width;
        this.height = height;
        this.data = data;
    }

    /**
     * 建立全透明的空白影像。
     *
     * @throws IllegalArgumentException 尺寸不大於 0，或 RGBA 緩衝區超過陣列上限
     */
    public static RasterImage blank(int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("影像尺寸必須大於 0: " + width + "x" + height);
        }
        long size = (long) width * height * 4;
        if (size > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("影像尺寸過大: " + width + "x" + height);
        }
        return new RasterImage(width, height, new byte[(int) size]);
    }

    /**
     * 從 {@link BufferedImage} 轉換，任何色彩模型都會被轉成非預乘的 RGBA。
     */
    public static RasterImage fromBufferedImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        byte[] buf = new byte[w * h * 4];
        for (int i = 0; i < argb.length; i++) {
            int p = argb[i];
            int o = i * 4;
            buf[o] = (byte) (p >> 16);
            buf[o + 1] = (byte) (p >> 8);
            buf[o + 2] = (byte) p;
            buf[o + 3] = (byte) (p >>> 24);
        }
        return new RasterImage(w, h, buf);
    }

    public BufferedImage toBufferedImage() {
        int[] argb = new int[width * height];
        for (int i = 0; i < argb.length; i++) {
            argb[i] = argb(i);
        }
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_ARGB);
        image.setRGB(0, 0, width, height, argb, 0, width);
        return image;
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int pixelCount() {
        return width * height;
    }

    public int index(int x, int y) {
        return y * width + x;
    }

    public int red(int i) {
        return data[i * 4] & 0xFF;
    }

    public int green(int i) {
        return data[i * 4 + 1] & 0xFF;
    }

    public int blue(int i) {
        return data[i * 4 + 2] & 0xFF;
    }

    public int alpha(int i) {
        return data[i * 4 + 3] & 0xFF;
    }

    public int alpha(int x, int y) {
        return alpha(index(x, y));
    }

    public boolean isVisible(int i) {
        return alpha(i) > 0;
    }

    /** 打包成 {@code 0xAARRGGBB}。 */
    public int argb(int i) {
        return (alpha(i) << 24) | (red(i) << 16) | (green(i) << 8) | blue(i);
    }

    public RgbColor color(int i) {
        return new RgbColor(red(i), green(i), blue(i));
    }

    public void setAlpha(int i, int a) {
        data[i * 4 + 3] = (byte) a;
    }

    public void setRgb(int i, int r, int g, int b) {
        int o = i * 4;
        data[o] = (byte) r;
        data[o + 1] = (byte) g;
        data[o + 2] = (byte) b;
    }

    public void setRgb(int i, RgbColor c) {
        setRgb(i, c.r(), c.g(), c.b());
    }

    public void setPixel(int i, int r, int g, int b, int a) {
        setRgb(i, r, g, b);
        setAlpha(i, a);
    }

    /**
     * 將矩形區域填入同一顏色，座標超出範圍的部分會被裁掉。
     */
    public void fill(int x0, int y0, int x1, int y1, int r, int g, int b, int a) {
        for (int y = Math.max(0, y0); y < Math.min(height, y1); y++) {
            for (int x = Math.max(0, x0); x < Math.min(width, x1); x++) {
                setPixel(index(x, y), r, g, b, a);
            }
        }
    }

    public RasterImage copy() {
        return new RasterImage(width, height, data.clone());
    }

    /**
     * 裁切出 {@code [x, x+w) × [y, y+h)} 的新影像。
     */
    public RasterImage crop(int x, int y, int w, int h) {
        if (w <= 0 || h <= 0 || x < 0 || y < 0 || x + w > width || y + h > height) {
            throw new IllegalArgumentException(String.format("裁切範圍超出影像 %dx%d: (%d,%d) %dx%d",
                    width, height, x, y, w, h));
        }
        byte[] out = new byte[w * h * 4];
        for (int row = 0; row < h; row++) {
            System.arraycopy(data, ((y + row) * width + x) * 4, out, row * w * 4, w * 4);
        }
        return new RasterImage(w, h, out);
    }

    /** 回傳緩衝區的複本。 */
    public byte[] toByteArray() {
        return data.clone();
    }

    public boolean sameContent(RasterImage other) {
        return other != null && width == other.width && height == other.height && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return "RasterImage[" + width + "x" + height + "]";
    }
}
