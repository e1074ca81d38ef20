package work.pollochang.sticker.image.core;

import lombok.Builder;
import work.pollochang.sticker.image.quality.QualityConfig;

import java.util.Objects;

/**
 * 一次管線執行所需的全部設定。
 *
 * @param background      背景估計與移除
 * @param quality         修補與品質檢查門檻
 * @param outlineRadius   描邊寬度 (px)，0 表示不加描邊
 * @param outlineColor    描邊顏色
 * @param fringeTolerance fringe 判定距離
 * @param gridTrim        網格切割時每格四邊裁掉的像素數
 */
@Builder(toBuilder = true)
public record PipelineSettings(
        BackgroundConfig background,
        QualityConfig quality,
        int outlineRadius,
        RgbColor outlineColor,
        int fringeTolerance,
        int gridTrim
) {

    public PipelineSettings {
        Objects.requireNonNull(background, "background must not be null");
        Objects.requireNonNull(quality, "quality must not be null");
        Objects.requireNonNull(outlineColor, "outlineColor must not be null");
        if (outlineRadius < 0 || gridTrim < 0) {
            throw new IllegalArgumentException("outlineRadius 與 gridTrim 不可為負數");
        }
        if (fringeTolerance <= 0) {
            throw new IllegalArgumentException("fringeTolerance 必須大於 0: " + fringeTolerance);
        }
    }

    public static PipelineSettings defaults() {
        return PipelineSettings.builder()
                .background(BackgroundConfig.defaults())
                .quality(QualityConfig.defaults())
                .outlineRadius(3)
                .outlineColor(RgbColor.WHITE)
                .fringeTolerance(80)
                .gridTrim(2)
                .build();
    }
}
