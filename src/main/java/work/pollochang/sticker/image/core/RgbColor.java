package work.pollochang.sticker.image.core;

/**
 * 不含透明度的顏色，三個通道皆為 0–255。
 * 背景比對一律使用量化或平方歐氏距離，不做完全相等比較。
 *
 * @param r 紅
 * @param g 綠
 * @param b 藍
 */
public record RgbColor(int r, int g, int b) {

    public static final RgbColor WHITE = new RgbColor(255, 255, 255);
    public static final RgbColor GREEN = new RgbColor(0, 255, 0);

    public RgbColor {
        if (r < 0 || r > 255 || g < 0 || g > 255 || b < 0 || b > 255) {
            throw new IllegalArgumentException("顏色通道必須介於 0-255: (" + r + "," + g + "," + b + ")");
        }
    }

    /**
     * 解析 {@code #RRGGBB} 或 {@code RRGGBB}。
     */
    public static RgbColor parseHex(String hex) {
        String s = hex.trim();
        if (s.startsWith("#")) {
            s = s.substring(1);
        }
        if (s.length() != 6) {
            throw new IllegalArgumentException("無法解析顏色: " + hex);
        }
        try {
            int v = Integer.parseInt(s, 16);
            return new RgbColor((v >> 16) & 0xFF, (v >> 8) & 0xFF, v & 0xFF);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("無法解析顏色: " + hex, e);
        }
    }

    public static RgbColor fromPacked(int rgb) {
        return new RgbColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    public int packed() {
        return (r << 16) | (g << 8) | b;
    }

    public int distanceSquared(int r2, int g2, int b2) {
        int dr = r - r2;
        int dg = g - g2;
        int db = b - b2;
        return dr * dr + dg * dg + db * db;
    }

    public int distanceSquared(RgbColor other) {
        return distanceSquared(other.r, other.g, other.b);
    }

    /**
     * 每個通道四捨五入到最接近的 {@code step} 倍數。
     */
    public static int quantize(int channel, int step) {
        return Math.min(255, Math.round((float) channel / step) * step);
    }

    public String toHex() {
        return String.format("#%02X%02X%02X", r, g, b);
    }
}
