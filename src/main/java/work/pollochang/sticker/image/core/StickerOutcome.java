package work.pollochang.sticker.image.core;

import work.pollochang.sticker.image.quality.QualityReport;

/**
 * 單張貼圖的管線輸出。
 *
 * @param image      處理後的影像
 * @param background 移除時使用的主要背景色
 * @param report     品質報告
 * @param png        檢查檔案大小時編碼的 PNG，寫檔直接使用，不再重新編碼
 */
public record StickerOutcome(RasterImage image, RgbColor background, QualityReport report, byte[] png) {

    public boolean accepted() {
        return report.ok();
    }
}
