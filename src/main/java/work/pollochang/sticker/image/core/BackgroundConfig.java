package work.pollochang.sticker.image.core;

import lombok.Builder;

import java.util.List;

/**
 * 背景估計與洪水填充的參數。
 *
 * @param bandRatio       邊框取樣寬度佔短邊的比例
 * @param maxBand         邊框取樣寬度上限 (px)
 * @param quantizeStep    顏色量化的桶大小
 * @param tolerance       視為背景的最大顏色距離
 * @param alphaThreshold  alpha 小於等於此值視為已透明
 * @param candidateRatio  第二、第三候選色最少需達到眾數頻率的比例
 * @param maxCandidates   候選色數量上限
 * @param fixedColors     指定背景色，非空時略過取樣
 */
@Builder(toBuilder = true)
public record BackgroundConfig(
        double bandRatio,
        int maxBand,
        int quantizeStep,
        int tolerance,
        int alphaThreshold,
        double candidateRatio,
        int maxCandidates,
        List<RgbColor> fixedColors
) {

    public BackgroundConfig {
        if (tolerance <= 0) {
            throw new IllegalArgumentException("tolerance 必須大於 0: " + tolerance);
        }
        if (quantizeStep <= 0) {
            throw new IllegalArgumentException("quantizeStep 必須大於 0: " + quantizeStep);
        }
        if (bandRatio <= 0 || maxBand <= 0) {
            throw new IllegalArgumentException("邊框取樣設定必須大於 0: bandRatio=" + bandRatio + ", maxBand=" + maxBand);
        }
        if (maxCandidates <= 0) {
            throw new IllegalArgumentException("maxCandidates 必須大於 0: " + maxCandidates);
        }
        fixedColors = fixedColors == null ? List.of() : List.copyOf(fixedColors);
    }

    public static BackgroundConfig defaults() {
        return BackgroundConfig.builder()
                .bandRatio(0.04)
                .maxBand(12)
                .quantizeStep(8)
                .tolerance(48)
                .alphaThreshold(8)
                .candidateRatio(0.25)
                .maxCandidates(3)
                .fixedColors(List.of())
                .build();
    }

    public boolean hasFixedColors() {
        return !fixedColors.isEmpty();
    }

    public BackgroundConfig withFixedColors(List<RgbColor> colors) {
        return toBuilder().fixedColors(colors).build();
    }
}
