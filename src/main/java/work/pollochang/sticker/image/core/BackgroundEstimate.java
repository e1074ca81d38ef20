package work.pollochang.sticker.image.core;

import java.util.List;

/**
 * 背景估計結果。
 *
 * @param candidates 依頻率排序的背景候選色，第一個為主要背景色
 * @param bandWidth  實際使用的邊框寬度，洪水填充以此作為種子範圍
 * @param fixed      是否來自指定背景色 (未取樣)
 */
public record BackgroundEstimate(List<RgbColor> candidates, int bandWidth, boolean fixed) {

    public BackgroundEstimate {
        if (candidates == null || candidates.isEmpty()) {
            throw new IllegalArgumentException("背景候選色不可為空");
        }
        candidates = List.copyOf(candidates);
    }

    public RgbColor primary() {
        return candidates.get(0);
    }
}
