package work.pollochang.sticker.image.quality;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.core.Edge;
import work.pollochang.sticker.image.core.ImageCodec;
import work.pollochang.sticker.image.core.PixelMasks;
import work.pollochang.sticker.image.core.RasterImage;
import work.pollochang.sticker.image.core.RgbColor;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 計算貼圖的品質指標並產生報告。
 *
 * <p>致命錯誤 (報告 ok = false)：
 * <ul>
 *   <li>背景殘留超過 {@code bgRemainMaxPct}</li>
 *   <li>封閉區域綠色超過 {@code interiorGreenMaxPct}</li>
 *   <li>底部綠線超過 {@code bottomGreenMaxPct}</li>
 *   <li>尺寸或檔案大小超出限制</li>
 *   <li>任一邊的白線比例超過 {@code edgeWhiteMaxRatio}</li>
 *   <li>完全沒有可見像素</li>
 * </ul>
 * 警告：少量背景殘留、半透明像素、內部半透明破洞、頂部懸空白點、貼齊邊界或邊距不足。
 *
 * <p>品質不佳是預期中、可重試的結果，一律寫進報告，不會丟出例外。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class QualityEvaluator {

    private final QualityConfig config;

    public QualityEvaluator(QualityConfig config) {
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * 以 PNG 編碼後的大小做檔案大小檢查。
     */
    public QualityReport evaluate(RasterImage image, RgbColor background) {
        Objects.requireNonNull(image, "image must not be null");
        long encodedBytes;
        try {
            encodedBytes = ImageCodec.encodePng(image).length;
        } catch (IOException e) {
            throw new UncheckedIOException("PNG 編碼失敗，無法檢查檔案大小", e);
        }
        return evaluate(image, background, encodedBytes);
    }

    public QualityReport evaluate(RasterImage image, RgbColor background, long encodedBytes) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(background, "background must not be null");

        int w = image.width();
        int h = image.height();
        int total = w * h;
        Map<String, Object> metrics = new LinkedHashMap<>();
        List<String> errors = new ArrayList<>();
        List<String> warnings = new ArrayList<>();

        // 全圖掃描：可見、背景殘留、半透明、綠色 fringe
        int bgTolSq = config.bgTolerance() * config.bgTolerance();
        int visible = 0;
        int bgNear = 0;
        int semi = 0;
        int fringe = 0;
        for (int i = 0; i < total; i++) {
            int a = image.alpha(i);
            if (a == 0) {
                continue;
            }
            visible++;
            if (a < 255) {
                semi++;
            }
            if (background.distanceSquared(image.red(i), image.green(i), image.blue(i)) <= bgTolSq) {
                bgNear++;
            }
            if (isGreenDominant(image, i)) {
                fringe++;
            }
        }
        double bgRemainPct = pct(bgNear, visible);
        double semiPct = pct(semi, total);
        metrics.put("visible_pixels", visible);
        metrics.put("bg_remain_pct", bgRemainPct);
        metrics.put("semi_pct", semiPct);
        metrics.put("fringe_count", fringe);

        // 底部綠線
        int bottomStart = Math.max(0, h - config.bottomBandRows());
        boolean[] lineArtifact = new boolean[total];
        int bottomGreen = 0;
        for (int y = bottomStart; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (image.isVisible(i) && isGreenDominant(image, i)) {
                    bottomGreen++;
                    lineArtifact[i] = true;
                }
            }
        }
        double bottomGreenPct = pct(bottomGreen, (h - bottomStart) * w);
        metrics.put("bottom_green_pct", bottomGreenPct);

        // 頂部懸空白點
        int topStray = 0;
        for (int y = 0; y < Math.min(config.topBandRows(), h); y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (image.isVisible(i) && PixelMasks.isNearWhite(image, i, config.whiteFloor())
                        && !PixelMasks.isSupportedFromBelow(image, x, y, config.topSupportRows())) {
                    topStray++;
                }
            }
        }
        metrics.put("top_stray_white", topStray);

        // 描邊白色比例
        boolean[] band = PixelMasks.boundaryBand(image, config.outlineThickness());
        int bandCount = 0;
        int bandWhite = 0;
        for (int i = 0; i < total; i++) {
            if (band[i]) {
                bandCount++;
                if (PixelMasks.isNearWhite(image, i, config.whiteFloor())) {
                    bandWhite++;
                }
            }
        }
        metrics.put("outline_white_ratio", ratio(bandWhite, bandCount));

        // 封閉區域內的綠色
        boolean[] exterior = PixelMasks.exteriorMask(image);
        int interior = 0;
        int interiorGreen = 0;
        for (int i = 0; i < total; i++) {
            if (!exterior[i] && image.isVisible(i)) {
                interior++;
                if (isGreenDominant(image, i)) {
                    interiorGreen++;
                }
            }
        }
        double interiorGreenPct = pct(interiorGreen, interior);
        metrics.put("interior_green_pct", interiorGreenPct);

        // 角色內部的半透明破洞
        boolean[] core = PixelMasks.erodeVisible(image, config.ghostErosion());
        int coreCount = 0;
        int ghost = 0;
        for (int i = 0; i < total; i++) {
            if (core[i]) {
                coreCount++;
                if (image.alpha(i) < 255) {
                    ghost++;
                }
            }
        }
        double ghostPct = pct(ghost, coreCount);
        metrics.put("interior_ghost_pct", ghostPct);

        // 邊距，已列為底部綠線的像素不重複計算
        int minX = w;
        int minY = h;
        int maxX = -1;
        int maxY = -1;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int i = y * w + x;
                if (image.isVisible(i) && !lineArtifact[i]) {
                    minX = Math.min(minX, x);
                    maxX = Math.max(maxX, x);
                    minY = Math.min(minY, y);
                    maxY = Math.max(maxY, y);
                }
            }
        }
        boolean hasContent = maxX >= 0;
        Map<Edge, Integer> margins = new EnumMap<>(Edge.class);
        if (hasContent) {
            margins.put(Edge.TOP, minY);
            margins.put(Edge.BOTTOM, h - 1 - maxY);
            margins.put(Edge.LEFT, minX);
            margins.put(Edge.RIGHT, w - 1 - maxX);
        }
        for (Edge edge : Edge.values()) {
            metrics.put("margin_" + edge.key(), margins.getOrDefault(edge, -1));
        }
        boolean touchesEdge = margins.values().stream().anyMatch(m -> m == 0);
        metrics.put("touches_edge", touchesEdge);

        // 尺寸與檔案大小
        metrics.put("width", w);
        metrics.put("height", h);
        metrics.put("file_bytes", encodedBytes);

        // 邊緣白線
        Map<Edge, Double> edgeWhite = new EnumMap<>(Edge.class);
        for (Edge edge : Edge.values()) {
            int[] pixels = edge.band(w, h, 0, config.edgeBand());
            int white = 0;
            for (int i : pixels) {
                if (image.isVisible(i) && PixelMasks.isNearWhite(image, i, config.whiteFloor())) {
                    white++;
                }
            }
            double r = ratio(white, pixels.length);
            edgeWhite.put(edge, r);
            metrics.put("edge_white_" + edge.key(), r);
        }

        // 判定
        if (visible == 0) {
            errors.add(QualityCheck.EMPTY_CANVAS.message(w + "x" + h));
        }
        if (bgRemainPct > config.bgRemainMaxPct()) {
            errors.add(QualityCheck.BACKGROUND_RESIDUE.message(
                    format(bgRemainPct) + "% > " + format(config.bgRemainMaxPct()) + "%"));
        } else if (bgRemainPct > 0) {
            warnings.add(QualityCheck.BACKGROUND_TRACE.message(format(bgRemainPct) + "%"));
        }
        if (interiorGreenPct > config.interiorGreenMaxPct()) {
            errors.add(QualityCheck.INTERIOR_GREEN_CAVITY.message(
                    format(interiorGreenPct) + "% > " + format(config.interiorGreenMaxPct()) + "%"));
        }
        if (bottomGreenPct > config.bottomGreenMaxPct()) {
            errors.add(QualityCheck.BOTTOM_GREEN_LINE.message(
                    format(bottomGreenPct) + "% > " + format(config.bottomGreenMaxPct()) + "%"));
        }
        if (w > config.maxWidth() || h > config.maxHeight()) {
            errors.add(QualityCheck.DIMENSION_TOO_LARGE.message(
                    w + "x" + h + " > " + config.maxWidth() + "x" + config.maxHeight()));
        }
        if (w < config.minWidth() || h < config.minHeight()) {
            errors.add(QualityCheck.DIMENSION_TOO_SMALL.message(
                    w + "x" + h + " < " + config.minWidth() + "x" + config.minHeight()));
        }
        if (encodedBytes > config.maxFileBytes()) {
            errors.add(QualityCheck.FILE_TOO_LARGE.message(encodedBytes + " > " + config.maxFileBytes() + " bytes"));
        }
        for (Map.Entry<Edge, Double> entry : edgeWhite.entrySet()) {
            if (entry.getValue() > config.edgeWhiteMaxRatio()) {
                errors.add(QualityCheck.EDGE_WHITE_LINE.message(
                        entry.getKey().key() + " " + format(entry.getValue()) + " > " + format(config.edgeWhiteMaxRatio())));
            }
        }

        if (semiPct > 0) {
            warnings.add(QualityCheck.SEMI_TRANSPARENT.message(format(semiPct) + "%"));
        }
        if (ghostPct > config.interiorGhostMaxPct()) {
            warnings.add(QualityCheck.INTERIOR_GHOST.message(format(ghostPct) + "%"));
        }
        if (topStray > 0) {
            warnings.add(QualityCheck.TOP_STRAY_WHITE.message(topStray + " px"));
        }
        if (touchesEdge) {
            warnings.add(QualityCheck.EDGE_TOUCH.message(margins.toString()));
        } else if (hasContent && margins.values().stream().anyMatch(m -> m < config.minMargin())) {
            warnings.add(QualityCheck.MARGIN_TOO_SMALL.message(margins + " < " + config.minMargin()));
        }

        QualityReport report = QualityReport.of(metrics, errors, warnings);
        log.debug("品質檢查 {}x{}: ok={}, 錯誤 {} 項, 警告 {} 項", w, h, report.ok(), errors.size(), warnings.size());
        return report;
    }

    private boolean isGreenDominant(RasterImage image, int i) {
        return PixelMasks.isGreenDominant(image, i, config.greenFloor(), config.greenGap());
    }

    private static double pct(int part, int whole) {
        return whole == 0 ? 0.0 : round4(100.0 * part / whole);
    }

    private static double ratio(int part, int whole) {
        return whole == 0 ? 0.0 : round4((double) part / whole);
    }

    private static double round4(double v) {
        return Math.round(v * 10000.0) / 10000.0;
    }

    private static String format(double v) {
        return String.format("%.2f", v);
    }
}
