package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.Objects;

/**
 * 從影像邊界出發，以廣度優先搜尋移除與邊界相連的背景。
 *
 * <p>符合以下任一條件的像素視為背景：
 * <ul>
 *   <li>alpha 小於等於 {@code alphaThreshold} (已經透明)。</li>
 *   <li>與任一候選背景色的平方距離不超過 {@code tolerance²}。</li>
 * </ul>
 * 背景像素的 alpha 設為 0，顏色保留。被角色完全包圍的背景色區塊不會被處理，
 * 那部分交給 {@link ArtifactRepair#fillInteriorCavities(RasterImage)}。
 *
 * <p>每個像素最多被檢查一次，時間複雜度 O(width × height)。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public final class FloodFillRemover {

    private FloodFillRemover() {}

    /**
     * 就地移除背景。
     *
     * @param image    要處理的影像，會被修改
     * @param estimate 背景估計結果；指定背景色時只以最外圈 1 px 為種子
     * @param config   容許誤差與透明門檻
     * @return 被設為透明的像素數
     */
    public static int remove(RasterImage image, BackgroundEstimate estimate, BackgroundConfig config) {
        Objects.requireNonNull(image, "image must not be null");
        Objects.requireNonNull(estimate, "estimate must not be null");
        Objects.requireNonNull(config, "config must not be null");

        int w = image.width();
        int h = image.height();
        int seedBand = estimate.fixed() ? 1 : estimate.bandWidth();
        int toleranceSq = config.tolerance() * config.tolerance();
        int alphaThreshold = config.alphaThreshold();
        List<RgbColor> candidates = estimate.candidates();

        boolean[] visited = new boolean[w * h];
        boolean[] removal = new boolean[w * h];
        int[] queue = new int[w * h];
        int[] tail = {0};

        PixelMasks.forEachBandPixel(w, h, seedBand, i -> {
            if (!visited[i]) {
                visited[i] = true;
                queue[tail[0]++] = i;
            }
        });

        int head = 0;
        int removed = 0;
        while (head < tail[0]) {
            int i = queue[head++];
            if (!isBackground(image, i, candidates, toleranceSq, alphaThreshold)) {
                continue;
            }
            removal[i] = true;
            removed++;
            int x = i % w;
            int y = i / w;
            if (x > 0) tail[0] = enqueue(visited, queue, tail[0], i - 1);
            if (x < w - 1) tail[0] = enqueue(visited, queue, tail[0], i + 1);
            if (y > 0) tail[0] = enqueue(visited, queue, tail[0], i - w);
            if (y < h - 1) tail[0] = enqueue(visited, queue, tail[0], i + w);
        }

        for (int i = 0; i < removal.length; i++) {
            if (removal[i]) {
                image.setAlpha(i, 0);
            }
        }

        log.debug("洪水填充: 種子邊框 {}px, 移除 {} / {} 像素", seedBand, removed, w * h);
        return removed;
    }

    private static int enqueue(boolean[] visited, int[] queue, int tail, int n) {
        if (!visited[n]) {
            visited[n] = true;
            queue[tail++] = n;
        }
        return tail;
    }

    static boolean isBackground(RasterImage image, int i, List<RgbColor> candidates, int toleranceSq, int alphaThreshold) {
        if (image.alpha(i) <= alphaThreshold) {
            return true;
        }
        int r = image.red(i);
        int g = image.green(i);
        int b = image.blue(i);
        for (RgbColor c : candidates) {
            if (c.distanceSquared(r, g, b) <= toleranceSq) {
                return true;
            }
        }
        return false;
    }
}
