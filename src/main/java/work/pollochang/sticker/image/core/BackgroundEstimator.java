package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * 從影像邊框取樣估計背景色。
 *
 * <p>流程：
 * <ol>
 *   <li>若設定了 {@code fixedColors}，直接回傳，不取樣。</li>
 *   <li>取寬度為 {@code min(maxBand, bandRatio × 短邊)} 的邊框。</li>
 *   <li>alpha 高於門檻的像素量化後統計頻率，眾數為主要背景色。</li>
 *   <li>其餘顏色頻率達眾數的 {@code candidateRatio} 倍者依序加入，最多 {@code maxCandidates} 個。</li>
 *   <li>邊框內沒有不透明像素時，退回取影像中心點的顏色。</li>
 * </ol>
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class BackgroundEstimator {

    private BackgroundEstimator() {}

    public static BackgroundEstimate estimate(RasterImage image, BackgroundConfig config) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(config, "config must not be null");

        if (config.hasFixedColors()) {
            log.debug("使用指定背景色 {}，略過邊框取樣", config.fixedColors());
            return new BackgroundEstimate(config.fixedColors(), 1, true);
        }

        int band = bandWidth(image, config);
        int step = config.quantizeStep();
        int alphaThreshold = config.alphaThreshold();

        Map<Integer, Integer> histogram = new HashMap<>();
        PixelMasks.forEachBandPixel(image.width(), image.height(), band, i -> {
            if (image.alpha(i) <= alphaThreshold) {
                return;
            }
            int key = (RgbColor.quantize(image.red(i), step) << 16)
                    | (RgbColor.quantize(image.green(i), step) << 8)
                    | RgbColor.quantize(image.blue(i), step);
            histogram.merge(key, 1, Integer::sum);
        });

        if (histogram.isEmpty()) {
            int center = image.index(image.width() / 2, image.height() / 2);
            RgbColor fallback = image.color(center);
            log.debug("邊框 {}px 內沒有不透明像素，改用中心點顏色 {}", band, fallback.toHex());
            return new BackgroundEstimate(List.of(fallback), band, false);
        }

        List<Map.Entry<Integer, Integer>> ranked = new ArrayList<>(histogram.entrySet());
        // 頻率高者優先，同頻率以色值排序確保結果穩定
        ranked.sort((a, b) -> {
            int byCount = Integer.compare(b.getValue(), a.getValue());
            return byCount != 0 ? byCount : Integer.compare(a.getKey(), b.getKey());
        });

        int modeCount = ranked.get(0).getValue();
        List<RgbColor> candidates = new ArrayList<>();
        for (Map.Entry<Integer, Integer> entry : ranked) {
            if (candidates.size() >= config.maxCandidates()) {
                break;
            }
            if (!candidates.isEmpty() && entry.getValue() < config.candidateRatio() * modeCount) {
                break;
            }
            candidates.add(RgbColor.fromPacked(entry.getKey()));
        }

        log.debug("背景估計: 邊框 {}px, 顏色桶 {} 個, 候選色 {}", band, histogram.size(), candidates);
        return new BackgroundEstimate(candidates, band, false);
    }

    /**
     * 取樣邊框寬度，至少 1 px，且不超過短邊的一半。
     */
    static int bandWidth(RasterImage image, BackgroundConfig config) {
        int shorter = Math.min(image.width(), image.height());
        long byRatio = Math.round(config.bandRatio() * shorter);
        int band = (int) Math.min(config.maxBand(), byRatio);
        return Math.max(1, Math.min(band, (shorter + 1) / 2));
    }
}
