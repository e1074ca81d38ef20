package work.pollochang.sticker.image.quality;

import lombok.Builder;

/**
 * 瑕疵修補與品質檢查使用的所有門檻值。
 * <p>
 * 這些數值是依實際產出樣本調校的預設值，可透過設定檔整組替換成更嚴格或寬鬆的版本。
 *
 * @param bgTolerance           可見像素與背景色距離在此範圍內視為背景殘留
 * @param alphaCut              alpha 二值化門檻，小於此值設為 0，其餘設為 255
 * @param bottomBandRows        底部瑕疵帶高度 (列)
 * @param topBandRows           頂部瑕疵帶高度 (列)
 * @param topSupportRows        頂部白點需在下方幾列內有支撐
 * @param outlineThickness      白色描邊寬度
 * @param whiteFloor            近白色：三個通道皆不低於此值
 * @param tintFloor             去綠時近白色的下限
 * @param tintGap               去綠時綠色高出紅、藍的最小差距
 * @param greenFloor            綠色主導的綠色下限
 * @param greenGap              綠色主導時綠色高出紅、藍的最小差距
 * @param seamLayers            邊緣接縫處理層數
 * @param seamSampleDepth       接縫旁取樣局部背景的深度
 * @param seamUniformRatio      接縫層單一顏色佔比門檻
 * @param seamDistinctDistance  接縫色與局部背景的最小距離
 * @param edgeLineLayers        邊緣白線處理層數
 * @param edgeLineWhiteRatio    邊緣層白色佔可見像素比例達此值時清除白線
 * @param bgRemainMaxPct        背景殘留百分比上限 (超過為致命)
 * @param bottomGreenMaxPct     底部綠線百分比上限 (超過為致命)
 * @param interiorGreenMaxPct   內部封閉綠色百分比上限 (超過為致命)
 * @param interiorGhostMaxPct   內部半透明百分比上限 (超過僅警告)
 * @param ghostErosion          判定內部像素的侵蝕寬度
 * @param minMargin             角色與四邊的最小距離
 * @param minWidth              最小寬度
 * @param minHeight             最小高度
 * @param maxWidth              最大寬度
 * @param maxHeight             最大高度
 * @param maxFileBytes          輸出檔案大小上限
 * @param edgeBand              邊緣白線檢查的寬度
 * @param edgeWhiteMaxRatio     邊緣白線比例上限 (超過為致命)
 */
@Builder(toBuilder = true)
public record QualityConfig(
        int bgTolerance,
        int alphaCut,
        int bottomBandRows,
        int topBandRows,
        int topSupportRows,
        int outlineThickness,
        int whiteFloor,
        int tintFloor,
        int tintGap,
        int greenFloor,
        int greenGap,
        int seamLayers,
        int seamSampleDepth,
        double seamUniformRatio,
        int seamDistinctDistance,
        int edgeLineLayers,
        double edgeLineWhiteRatio,
        double bgRemainMaxPct,
        double bottomGreenMaxPct,
        double interiorGreenMaxPct,
        double interiorGhostMaxPct,
        int ghostErosion,
        int minMargin,
        int minWidth,
        int minHeight,
        int maxWidth,
        int maxHeight,
        long maxFileBytes,
        int edgeBand,
        double edgeWhiteMaxRatio
) {

    public QualityConfig {
        if (bgTolerance <= 0) {
            throw new IllegalArgumentException("bgTolerance 必須大於 0: " + bgTolerance);
        }
        if (alphaCut < 0 || alphaCut > 255) {
            throw new IllegalArgumentException("alphaCut 必須介於 0-255: " + alphaCut);
        }
        if (minWidth <= 0 || minHeight <= 0 || maxWidth < minWidth || maxHeight < minHeight) {
            throw new IllegalArgumentException(String.format("尺寸限制不合理: min %dx%d, max %dx%d",
                    minWidth, minHeight, maxWidth, maxHeight));
        }
        if (maxFileBytes <= 0) {
            throw new IllegalArgumentException("maxFileBytes 必須大於 0: " + maxFileBytes);
        }
        if (bottomBandRows < 0 || topBandRows < 0 || outlineThickness < 0 || edgeBand < 0
                || seamLayers < 0 || edgeLineLayers < 0 || ghostErosion < 0) {
            throw new IllegalArgumentException("帶狀範圍設定不可為負數");
        }
    }

    /**
     * 預設值對應 370x320、1MB 的貼圖規格。
     */
    public static QualityConfig defaults() {
        return QualityConfig.builder()
                .bgTolerance(40)
                .alphaCut(128)
                .bottomBandRows(12)
                .topBandRows(12)
                .topSupportRows(2)
                .outlineThickness(4)
                .whiteFloor(220)
                .tintFloor(180)
                .tintGap(4)
                .greenFloor(100)
                .greenGap(40)
                .seamLayers(2)
                .seamSampleDepth(6)
                .seamUniformRatio(0.98)
                .seamDistinctDistance(60)
                .edgeLineLayers(2)
                .edgeLineWhiteRatio(0.15)
                .bgRemainMaxPct(1.0)
                .bottomGreenMaxPct(1.0)
                .interiorGreenMaxPct(0.5)
                .interiorGhostMaxPct(0.0)
                .ghostErosion(3)
                .minMargin(10)
                .minWidth(64)
                .minHeight(64)
                .maxWidth(370)
                .maxHeight(320)
                .maxFileBytes(1_048_576L)
                .edgeBand(2)
                .edgeWhiteMaxRatio(0.15)
                .build();
    }
}
