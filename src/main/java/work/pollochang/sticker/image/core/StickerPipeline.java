package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.quality.QualityConfig;
import work.pollochang.sticker.image.quality.QualityEvaluator;
import work.pollochang.sticker.image.quality.QualityReport;
import work.pollochang.sticker.image.tools.ImageTools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import java.util.Objects;

/**
 * 貼圖後製管線。
 *
 * <p>流程：
 * <ol>
 *   <li>{@link BackgroundEstimator} 估計背景色</li>
 *   <li>{@link FloodFillRemover} 移除與邊界相連的背景</li>
 *   <li>{@link ArtifactRepair} 修補殘留瑕疵</li>
 *   <li>{@link OutlineCompositor} 清除 fringe 並加描邊</li>
 *   <li>超過尺寸上限時等比縮小</li>
 *   <li>alpha 二值化</li>
 *   <li>編碼成 PNG，以實際大小做檔案大小檢查</li>
 *   <li>{@link QualityEvaluator} 產生品質報告</li>
 * </ol>
 *
 * <p>管線不保存任何狀態，可在多個執行緒同時處理不同影像；
 * 品質不合格時是否重新生成由呼叫端決定。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class StickerPipeline {

    private final PipelineSettings settings;
    private final ArtifactRepair repair;
    private final OutlineCompositor compositor;
    private final QualityEvaluator evaluator;
    private final GridSplitter splitter;

    public StickerPipeline(PipelineSettings settings) {
        this.settings = Objects.requireNonNull(settings, "settings must not be null");
        this.repair = new ArtifactRepair(settings.quality());
        this.compositor = new OutlineCompositor(settings.outlineRadius(), settings.outlineColor(), settings.fringeTolerance());
        this.evaluator = new QualityEvaluator(settings.quality());
        this.splitter = new GridSplitter(settings.gridTrim());
    }

    public PipelineSettings settings() {
        return settings;
    }

    /**
     * 處理單張貼圖。輸入影像不會被修改。
     *
     * @throws IllegalArgumentException 輸入影像不合法
     * @throws UncheckedIOException     PNG 編碼失敗
     */
    public StickerOutcome process(RasterImage input) {
        Objects.requireNonNull(input, "input must not be null");
        RasterImage image = input.copy();

        BackgroundEstimate estimate = BackgroundEstimator.estimate(image, settings.background());
        int removed = FloodFillRemover.remove(image, estimate, settings.background());
        int repaired = repair.repair(image);
        RasterImage outlined = compositor.apply(image, estimate.primary());

        QualityConfig quality = settings.quality();
        RasterImage fitted = ImageTools.fitWithin(outlined, quality.maxWidth(), quality.maxHeight());
        repair.binarizeAlpha(fitted);

        byte[] png;
        try {
            png = ImageCodec.encodePng(fitted);
        } catch (IOException e) {
            throw new UncheckedIOException("PNG 編碼失敗", e);
        }
        QualityReport report = evaluator.evaluate(fitted, estimate.primary(), png.length);
        log.debug("管線完成 {} -> {}: 背景 {}, 移除 {} 像素, 修補 {} 像素, ok={}",
                input, fitted, estimate.primary().toHex(), removed, repaired, report.ok());
        return new StickerOutcome(fitted, estimate.primary(), report, png);
    }

    /**
     * 切割合成圖，不做後製。
     */
    public GridSplitter.GridSplit splitGrid(RasterImage composite, int rows, int cols, double targetAspect) {
        return splitter.split(composite, rows, cols, targetAspect);
    }

    /**
     * 切割後依序處理每一格。
     */
    public List<StickerOutcome> processGrid(RasterImage composite, int rows, int cols, double targetAspect) {
        return splitGrid(composite, rows, cols, targetAspect).cells().stream()
                .map(this::process)
                .toList();
    }
}
