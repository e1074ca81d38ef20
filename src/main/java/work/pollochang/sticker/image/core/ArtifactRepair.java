package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.quality.QualityConfig;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;

/**
 * 洪水填充之後的瑕疵修補。
 *
 * <p>{@link #repair(RasterImage)} 依固定順序執行七個步驟，順序不可調換：
 * <ol>
 *   <li>{@link #cleanBorderSeams} 邊緣接縫</li>
 *   <li>{@link #stripBottomColorLines} 底部綠線</li>
 *   <li>{@link #whitenOutline} 描邊轉純白</li>
 *   <li>{@link #removeWhiteTint} 白色去綠</li>
 *   <li>{@link #fillInteriorCavities} 內部封閉背景</li>
 *   <li>{@link #stripTopStrayWhite} 頂部懸空白點</li>
 *   <li>{@link #stripEdgeWhiteLines} 邊緣白線</li>
 * </ol>
 * 每個步驟只會移除不透明度或改顏色，不會移動或縮放內容。
 * 對已經乾淨的影像重複執行結果不變。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class ArtifactRepair {

    private static final int SEAM_QUANTIZE_STEP = 16;
    private static final int TRANSPARENT_KEY = -1;

    private final QualityConfig config;

    public ArtifactRepair(QualityConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * 依序執行全部修補步驟，就地修改。
     *
     * @return 被修改的像素總數
     */
    public int repair(RasterImage image) {
        Objects.requireNonNull(image, "image must not be null");
        int seams = cleanBorderSeams(image);
        int bottom = stripBottomColorLines(image);
        int outline = whitenOutline(image);
        int tint = removeWhiteTint(image);
        int cavities = fillInteriorCavities(image);
        int top = stripTopStrayWhite(image);
        int edges = stripEdgeWhiteLines(image);
        log.debug("瑕疵修補: 接縫 {}, 底部綠線 {}, 描邊 {}, 去綠 {}, 內部空洞 {}, 頂部白點 {}, 邊緣白線 {}",
                seams, bottom, outline, tint, cavities, top, edges);
        return seams + bottom + outline + tint + cavities + top + edges;
    }

    /**
     * 網格切割留下的接縫：最外 {@code seamLayers} 層中，若某層的可見像素有 {@code seamUniformRatio} 以上是同一種顏色，
     * 且該顏色接近白色或與內側局部背景明顯不同，該層的可見像素改成局部背景。
     * 接縫不必佔滿整條邊，只看可見像素。
     * 局部背景為透明時整層清成透明。
     */
    public int cleanBorderSeams(RasterImage image) {
        int changed = 0;
        for (int layer = 0; layer < config.seamLayers(); layer++) {
            for (Edge edge : Edge.values()) {
                changed += cleanSeamLayer(image, edge, layer);
            }
        }
        return changed;
    }

    private int cleanSeamLayer(RasterImage image, Edge edge, int layer) {
        int[] pixels = edge.layer(image.width(), image.height(), layer);
        if (pixels.length == 0) {
            return 0;
        }

        Map<Integer, Integer> histogram = new HashMap<>();
        int visible = 0;
        for (int i : pixels) {
            if (image.isVisible(i)) {
                visible++;
                histogram.merge(quantizedKey(image, i), 1, Integer::sum);
            }
        }
        if (visible == 0) {
            return 0;
        }
        Map.Entry<Integer, Integer> seam = dominant(histogram);
        if (seam.getValue() < config.seamUniformRatio() * visible) {
            return 0;
        }
        RgbColor seamColor = RgbColor.fromPacked(seam.getKey());

        int[] sample = edge.band(image.width(), image.height(), layer + 1, config.seamSampleDepth());
        if (sample.length == 0) {
            return 0;
        }
        Map<Integer, Integer> local = new HashMap<>();
        for (int i : sample) {
            local.merge(image.isVisible(i) ? quantizedKey(image, i) : TRANSPARENT_KEY, 1, Integer::sum);
        }
        int localKey = dominant(local).getKey();
        boolean localTransparent = localKey == TRANSPARENT_KEY;

        int distinct = config.seamDistinctDistance();
        boolean nearWhite = PixelMasks.isNearWhite(seamColor.r(), seamColor.g(), seamColor.b(), config.whiteFloor());
        boolean differs = localTransparent
                || seamColor.distanceSquared(RgbColor.fromPacked(localKey)) > distinct * distinct;
        if (!nearWhite && !differs) {
            return 0;
        }

        int changed = 0;
        if (localTransparent) {
            for (int i : pixels) {
                if (image.isVisible(i)) {
                    image.setAlpha(i, 0);
                    changed++;
                }
            }
        } else {
            RgbColor localColor = RgbColor.fromPacked(localKey);
            // 只改接縫本身，被角色遮住而透明的部分維持透明
            for (int i : pixels) {
                if (image.isVisible(i)) {
                    image.setRgb(i, localColor);
                    image.setAlpha(i, 255);
                    changed++;
                }
            }
        }
        log.trace("{} 第 {} 層接縫 {} 已改為 {}", edge.key(), layer, seamColor.toHex(),
                localTransparent ? "透明" : RgbColor.fromPacked(localKey).toHex());
        return changed;
    }

    /**
     * 底部 {@code bottomBandRows} 列中綠色主導的像素視為生成器殘留的色線，設為透明。
     */
    public int stripBottomColorLines(RasterImage image) {
        int w = image.width();
        int h = image.height();
        int changed = 0;
        for (int y = Math.max(0, h - config.bottomBandRows()); y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (image.isVisible(i) && isGreenDominant(image, i)) {
                    image.setAlpha(i, 0);
                    changed++;
                }
            }
        }
        return changed;
    }

    /**
     * 輪廓帶內的可見像素全部改為純白，alpha 不變。
     */
    public int whitenOutline(RasterImage image) {
        boolean[] band = PixelMasks.boundaryBand(image, config.outlineThickness());
        int changed = 0;
        for (int i = 0; i < band.length; i++) {
            if (band[i] && (image.red(i) != 255 || image.green(i) != 255 || image.blue(i) != 255)) {
                image.setRgb(i, RgbColor.WHITE);
                changed++;
            }
        }
        return changed;
    }

    /**
     * 近白色但帶綠色溢色的像素改回純白。
     */
    public int removeWhiteTint(RasterImage image) {
        int changed = 0;
        int floor = config.tintFloor();
        for (int i = 0; i < image.pixelCount(); i++) {
            if (!image.isVisible(i)) {
                continue;
            }
            int r = image.red(i);
            int g = image.green(i);
            int b = image.blue(i);
            if (PixelMasks.isNearWhite(r, g, b, floor) && g - Math.max(r, b) >= config.tintGap()) {
                image.setRgb(i, RgbColor.WHITE);
                changed++;
            }
        }
        return changed;
    }

    /**
     * 從邊界透明像素再做一次填充標記外部，未被標記且綠色主導的可見像素設為透明。
     * 處理困在輪廓凹處、洪水填充到不了的背景。
     */
    public int fillInteriorCavities(RasterImage image) {
        boolean[] exterior = PixelMasks.exteriorMask(image);
        int changed = 0;
        for (int i = 0; i < exterior.length; i++) {
            if (!exterior[i] && image.isVisible(i) && isGreenDominant(image, i)) {
                image.setAlpha(i, 0);
                changed++;
            }
        }
        return changed;
    }

    /**
     * 頂部 {@code topBandRows} 列中，下方 {@code topSupportRows} 列內沒有可見像素支撐的近白色像素視為懸空線條。
     * 由下往上處理，較厚的白線會被逐列剝除。
     */
    public int stripTopStrayWhite(RasterImage image) {
        int w = image.width();
        int h = image.height();
        int changed = 0;
        for (int y = Math.min(config.topBandRows(), h) - 1; y >= 0; y--) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (image.isVisible(i) && PixelMasks.isNearWhite(image, i, config.whiteFloor())
                        && !PixelMasks.isSupportedFromBelow(image, x, y, config.topSupportRows())) {
                    image.setAlpha(i, 0);
                    changed++;
                }
            }
        }
        return changed;
    }

    /**
     * 邊緣白線：最外 {@code edgeLineLayers} 層中，白色佔可見像素達 {@code edgeLineWhiteRatio} 時清除該層白色像素；
     * 最後最外層的近白色像素一律清除，剛切割完的內容不該貼齊邊界。
     */
    public int stripEdgeWhiteLines(RasterImage image) {
        int w = image.width();
        int h = image.height();
        int changed = 0;
        for (int layer = 0; layer < config.edgeLineLayers(); layer++) {
            for (Edge edge : Edge.values()) {
                int[] pixels = edge.layer(w, h, layer);
                int visible = 0;
                int white = 0;
                for (int i : pixels) {
                    if (image.isVisible(i)) {
                        visible++;
                        if (PixelMasks.isNearWhite(image, i, config.whiteFloor())) {
                            white++;
                        }
                    }
                }
                if (visible > 0 && white >= config.edgeLineWhiteRatio() * visible) {
                    changed += clearWhite(image, pixels);
                }
            }
        }
        for (Edge edge : Edge.values()) {
            changed += clearWhite(image, edge.layer(w, h, 0));
        }
        return changed;
    }

    private int clearWhite(RasterImage image, int[] pixels) {
        int changed = 0;
        for (int i : pixels) {
            if (image.isVisible(i) && PixelMasks.isNearWhite(image, i, config.whiteFloor())) {
                image.setAlpha(i, 0);
                changed++;
            }
        }
        return changed;
    }

    /**
     * alpha 二值化：小於 {@code alphaCut} 設為 0，其餘設為 255。
     */
    public int binarizeAlpha(RasterImage image) {
        int cut = config.alphaCut();
        int changed = 0;
        for (int i = 0; i < image.pixelCount(); i++) {
            int a = image.alpha(i);
            int target = a < cut ? 0 : 255;
            if (a != target) {
                image.setAlpha(i, target);
                changed++;
            }
        }
        return changed;
    }

    private boolean isGreenDominant(RasterImage image, int i) {
        return PixelMasks.isGreenDominant(image, i, config.greenFloor(), config.greenGap());
    }

    private static int quantizedKey(RasterImage image, int i) {
        return (RgbColor.quantize(image.red(i), SEAM_QUANTIZE_STEP) << 16)
                | (RgbColor.quantize(image.green(i), SEAM_QUANTIZE_STEP) << 8)
                | RgbColor.quantize(image.blue(i), SEAM_QUANTIZE_STEP);
    }

    private static Map.Entry<Integer, Integer> dominant(Map<Integer, Integer> histogram) {
        Map.Entry<Integer, Integer> best = null;
        for (Map.Entry<Integer, Integer> entry : histogram.entrySet()) {
            if (best == null || entry.getValue() > best.getValue()
                    || (entry.getValue().equals(best.getValue()) && entry.getKey() < best.getKey())) {
                best = entry;
            }
        }
        return best;
    }
}
