package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;

import java.util.Objects;

/**
 * 在角色外圍加上一圈固定寬度的描邊。
 *
 * <p>先清除輪廓上混到背景色的半透明邊 (fringe)，避免新描邊下方露出一圈背景色；
 * 再把 alpha 以 {@code 2 × radius + 1} 的視窗做最大值膨脹，原本透明、膨脹後不透明的位置
 * 畫上描邊色，最後把原圖以 source-over 疊回上方。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class OutlineCompositor {

    private final int radius;
    private final RgbColor outlineColor;
    private final int fringeTolerance;

    /**
     * @param radius          描邊寬度 (px)，0 表示只清除 fringe
     * @param outlineColor    描邊顏色
     * @param fringeTolerance 與背景色距離在此範圍內的邊緣像素視為 fringe
     */
    public OutlineCompositor(int radius, RgbColor outlineColor, int fringeTolerance) {
        if (radius < 0) {
            throw new IllegalArgumentException("描邊寬度不可為負數: " + radius);
        }
        if (fringeTolerance <= 0) {
            throw new IllegalArgumentException("fringeTolerance 必須大於 0: " + fringeTolerance);
        }
        this.radius = radius;
        this.outlineColor = Objects.requireNonNull(outlineColor, "outlineColor must not be null");
        this.fringeTolerance = fringeTolerance;
    }

    /**
     * 清除 fringe 後加上描邊，回傳新影像；輸入影像的 fringe 會被就地清除。
     */
    public RasterImage apply(RasterImage image, RgbColor background) {
        int cleared = removeFringe(image, background);
        RasterImage outlined = addOutline(image);
        log.debug("描邊: 清除 fringe {} 像素, 描邊寬度 {}px", cleared, radius);
        return outlined;
    }

    /**
     * 接近背景色的半透明像素，以及接近背景色且有完全透明 4 鄰居的不透明像素，全部清為透明。
     * 判斷依據為處理前的 alpha，不會連鎖向內侵蝕。
     */
    public int removeFringe(RasterImage image, RgbColor background) {
        Objects.requireNonNull(background, "background must not be null");
        int w = image.width();
        int h = image.height();
        int toleranceSq = fringeTolerance * fringeTolerance;
        boolean[] clear = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                int a = image.alpha(i);
                if (a == 0 || background.distanceSquared(image.red(i), image.green(i), image.blue(i)) > toleranceSq) {
                    continue;
                }
                if (a < 255) {
                    clear[i] = true;
                } else if ((x > 0 && image.alpha(i - 1) == 0)
                        || (x < w - 1 && image.alpha(i + 1) == 0)
                        || (y > 0 && image.alpha(i - w) == 0)
                        || (y < h - 1 && image.alpha(i + w) == 0)) {
                    clear[i] = true;
                }
            }
        }
        int cleared = 0;
        for (int i = 0; i < clear.length; i++) {
            if (clear[i]) {
                image.setAlpha(i, 0);
                cleared++;
            }
        }
        return cleared;
    }

    /**
     * alpha 膨脹後產生描邊層，再把原圖疊上去。
     */
    public RasterImage addOutline(RasterImage image) {
        if (radius == 0) {
            return image.copy();
        }
        int w = image.width();
        int h = image.height();
        int[] expanded = dilateAlpha(image, radius);

        RasterImage out = RasterImage.blank(w, h);
        for (int i = 0; i < w * h; i++) {
            int sa = image.alpha(i);
            int oa = (sa == 0 && expanded[i] > 0) ? expanded[i] : 0;
            compositeOver(out, i, image.red(i), image.green(i), image.blue(i), sa,
                    outlineColor.r(), outlineColor.g(), outlineColor.b(), oa);
        }
        return out;
    }

    /**
     * 可分離的最大值濾波：先水平再垂直，視窗大小 {@code 2r+1}。
     */
    static int[] dilateAlpha(RasterImage image, int r) {
        int w = image.width();
        int h = image.height();
        int[] horizontal = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int max = 0;
                for (int k = Math.max(0, x - r); k <= Math.min(w - 1, x + r); k++) {
                    max = Math.max(max, image.alpha(y * w + k));
                }
                horizontal[y * w + x] = max;
            }
        }
        int[] result = new int[w * h];
        for (int x = 0; x < w; x++) {
            for (int y = 0; y < h; y++) {
                int max = 0;
                for (int k = Math.max(0, y - r); k <= Math.min(h - 1, y + r); k++) {
                    max = Math.max(max, horizontal[k * w + x]);
                }
                result[y * w + x] = max;
            }
        }
        return result;
    }

    /**
     * 非預乘 source-over：src 疊在 dst 上，結果寫入 {@code out} 的第 {@code i} 個像素。
     */
    static void compositeOver(RasterImage out, int i,
                              int sr, int sg, int sb, int sa,
                              int dr, int dg, int db, int da) {
        if (sa == 255 || da == 0) {
            out.setPixel(i, sr, sg, sb, sa);
            return;
        }
        if (sa == 0) {
            out.setPixel(i, dr, dg, db, da);
            return;
        }
        double srcA = sa / 255.0;
        double dstA = da / 255.0 * (1.0 - srcA);
        double outA = srcA + dstA;
        int r = (int) Math.round((sr * srcA + dr * dstA) / outA);
        int g = (int) Math.round((sg * srcA + dg * dstA) / outA);
        int b = (int) Math.round((sb * srcA + db * dstA) / outA);
        out.setPixel(i, r, g, b, (int) Math.round(outA * 255.0));
    }
}
