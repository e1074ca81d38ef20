package work.pollochang.sticker.image.generate;

import work.pollochang.sticker.image.core.RasterImage;

/**
 * 外部影像生成服務的邊界。實作負責呼叫生成 API 並把結果解碼成 {@link RasterImage}。
 */
@FunctionalInterface
public interface StickerGenerator {

    /**
     * @param attempt 第幾次嘗試，從 1 開始
     * @throws GenerationException 生成服務回傳錯誤或沒有可用影像
     */
    RasterImage generate(int attempt) throws GenerationException;
}
