package work.pollochang.sticker.image.core;

import java.util.function.IntConsumer;

/**
 * 修補與品質檢查共用的像素判斷與遮罩運算。
 */
public final class PixelMasks {

    private PixelMasks() {}

    /**
     * 綠色主導：綠色高於下限，且比紅、藍中較大者高出至少 {@code gap}。
     */
    public static boolean isGreenDominant(int r, int g, int b, int floor, int gap) {
        return g >= floor && g - Math.max(r, b) >= gap;
    }

    public static boolean isGreenDominant(RasterImage img, int i, int floor, int gap) {
        return isGreenDominant(img.red(i), img.green(i), img.blue(i), floor, gap);
    }

    /** 三個通道皆不低於 {@code floor}。 */
    public static boolean isNearWhite(int r, int g, int b, int floor) {
        return r >= floor && g >= floor && b >= floor;
    }

    public static boolean isNearWhite(RasterImage img, int i, int floor) {
        return isNearWhite(img.red(i), img.green(i), img.blue(i), floor);
    }

    /**
     * {@code (x, y)} 下方 {@code rows} 列內是否有可見像素。
     */
    public static boolean isSupportedFromBelow(RasterImage img, int x, int y, int rows) {
        for (int dy = 1; dy <= rows && y + dy < img.height(); dy++) {
            if (img.isVisible(img.index(x, y + dy))) {
                return true;
            }
        }
        return false;
    }

    /**
     * 依序走訪距離影像邊界 {@code band} 以內的每個像素。
     */
    public static void forEachBandPixel(int width, int height, int band, IntConsumer action) {
        for (int y = 0; y < height; y++) {
            boolean fullRow = y < band || y >= height - band;
            if (fullRow) {
                for (int x = 0; x < width; x++) {
                    action.accept(y * width + x);
                }
            } else {
                int side = Math.min(band, width);
                for (int x = 0; x < side; x++) {
                    action.accept(y * width + x);
                }
                for (int x = Math.max(side, width - band); x < width; x++) {
                    action.accept(y * width + x);
                }
            }
        }
    }

    /**
     * 輪廓帶：可見像素中，距離透明像素 {@code thickness} 以內者。
     * <p>
     * 先取有透明 4 鄰居的可見像素，再於可見遮罩內做 {@code thickness - 1} 次 4 鄰居膨脹。
     * 影像外不視為透明。
     */
    public static boolean[] boundaryBand(RasterImage img, int thickness) {
        int w = img.width();
        int h = img.height();
        boolean[] band = new boolean[w * h];
        if (thickness <= 0) {
            return band;
        }
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (!img.isVisible(i)) {
                    continue;
                }
                if ((x > 0 && !img.isVisible(i - 1))
                        || (x < w - 1 && !img.isVisible(i + 1))
                        || (y > 0 && !img.isVisible(i - w))
                        || (y < h - 1 && !img.isVisible(i + w))) {
                    band[i] = true;
                }
            }
        }
        for (int round = 1; round < thickness; round++) {
            boolean[] next = band.clone();
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int i = y * w + x;
                    if (band[i] || !img.isVisible(i)) {
                        continue;
                    }
                    if ((x > 0 && band[i - 1]) || (x < w - 1 && band[i + 1])
                            || (y > 0 && band[i - w]) || (y < h - 1 && band[i + w])) {
                        next[i] = true;
                    }
                }
            }
            band = next;
        }
        return band;
    }

    /**
     * 外部區域：從碰到影像邊界的透明像素出發，經由透明像素可抵達的所有像素。
     * 未被標記者即為被輪廓包圍的內部 (含所有可見像素)。
     */
    public static boolean[] exteriorMask(RasterImage img) {
        int w = img.width();
        int h = img.height();
        boolean[] exterior = new boolean[w * h];
        int[] queue = new int[w * h];
        int tail = 0;
        for (Edge edge : Edge.values()) {
            for (int i : edge.layer(w, h, 0)) {
                if (!exterior[i] && img.alpha(i) == 0) {
                    exterior[i] = true;
                    queue[tail++] = i;
                }
            }
        }
        int head = 0;
        while (head < tail) {
            int i = queue[head++];
            int x = i % w;
            int y = i / w;
            if (x > 0) tail = visitTransparent(img, exterior, queue, tail, i - 1);
            if (x < w - 1) tail = visitTransparent(img, exterior, queue, tail, i + 1);
            if (y > 0) tail = visitTransparent(img, exterior, queue, tail, i - w);
            if (y < h - 1) tail = visitTransparent(img, exterior, queue, tail, i + w);
        }
        return exterior;
    }

    private static int visitTransparent(RasterImage img, boolean[] exterior, int[] queue, int tail, int n) {
        if (!exterior[n] && img.alpha(n) == 0) {
            exterior[n] = true;
            queue[tail++] = n;
        }
        return tail;
    }

    /**
     * 可見遮罩以 4 鄰居侵蝕 {@code rounds} 次，影像外視為不可見。
     */
    public static boolean[] erodeVisible(RasterImage img, int rounds) {
        int w = img.width();
        int h = img.height();
        boolean[] mask = new boolean[w * h];
        for (int i = 0; i < mask.length; i++) {
            mask[i] = img.isVisible(i);
        }
        for (int round = 0; round < rounds; round++) {
            boolean[] next = new boolean[mask.length];
            for (int y = 0; y < h; y++) {
                for (int x = 0; x < w; x++) {
                    int i = y * w + x;
                    next[i] = mask[i]
                            && x > 0 && mask[i - 1]
                            && x < w - 1 && mask[i + 1]
                            && y > 0 && mask[i - w]
                            && y < h - 1 && mask[i + w];
                }
            }
            mask = next;
        }
        return mask;
    }
}
