package work.pollochang.sticker.image.report;

import work.pollochang.sticker.image.core.StickerResult;
import work.pollochang.sticker.image.quality.QualityReport;

/**
 * 批次中單一格的處理結果。
 *
 * @param index   格子序號 (列優先，從 0 開始)
 * @param result  處理結果
 * @param file    輸出檔名，失敗時為 null
 * @param quality 品質報告，未完成處理時為 null
 */
public record StickerReport(int index, StickerResult result, String file, QualityReport quality) {}
