package work.pollochang.sticker.image.quality;

import org.junit.jupiter.api.Test;
import work.pollochang.sticker.image.StickerFixtures;
import work.pollochang.sticker.image.core.RasterImage;
import work.pollochang.sticker.image.core.RgbColor;

import static org.junit.jupiter.api.Assertions.*;

class QualityEvaluatorTest {

    private final QualityEvaluator evaluator = new QualityEvaluator(QualityConfig.defaults());

    private QualityReport evaluate(RasterImage image) {
        return evaluator.evaluate(image, RgbColor.GREEN, 10_000);
    }

    /**
     * 乾淨的 370x320 貼圖：沒有錯誤也沒有警告
     */
    @Test
    void testCleanSticker_ShouldPass() {
        QualityReport report = evaluator.evaluate(StickerFixtures.cleanSticker(), RgbColor.GREEN);

        assertTrue(report.ok());
        assertTrue(report.errors().isEmpty());
        assertTrue(report.warnings().isEmpty(), report.warnings()::toString);
        assertEquals(0.0, report.metric("bg_remain_pct"));
        assertEquals(0.0, report.metric("semi_pct"));
        assertEquals(1.0, report.metric("outline_white_ratio"));
        assertEquals(60.0, report.metric("margin_top"));
        assertEquals(Boolean.FALSE, report.metrics().get("touches_edge"));
        assertTrue(report.metric("file_bytes") > 0);
    }

    /**
     * 底部 4 列塗成綠色：底部綠線為致命錯誤，警告不受影響
     */
    @Test
    void testBottomGreenRows_ShouldFailWithoutExtraWarnings() {
        RasterImage image = StickerFixtures.cleanSticker();
        image.fill(0, 316, 370, 320, 0, 255, 0, 255);

        QualityReport report = evaluate(image);

        assertFalse(report.ok());
        assertTrue(report.hasError(QualityCheck.BOTTOM_GREEN_LINE));
        assertTrue(report.warnings().isEmpty(), report.warnings()::toString);
        assertEquals(60.0, report.metric("margin_bottom"));
    }

    @Test
    void testEmptyCanvas_ShouldFail() {
        QualityReport report = evaluate(RasterImage.blank(370, 320));

        assertFalse(report.ok());
        assertTrue(report.hasError(QualityCheck.EMPTY_CANVAS));
        assertEquals(-1.0, report.metric("margin_left"));
    }

    /**
     * 剛好等於上限通過，任一邊多 1 px 即失敗
     */
    @Test
    void testDimensionBoundary() {
        assertFalse(evaluate(StickerFixtures.cleanSticker(370, 320)).hasError(QualityCheck.DIMENSION_TOO_LARGE));
        assertTrue(evaluate(StickerFixtures.cleanSticker(371, 320)).hasError(QualityCheck.DIMENSION_TOO_LARGE));
        assertTrue(evaluate(StickerFixtures.cleanSticker(370, 321)).hasError(QualityCheck.DIMENSION_TOO_LARGE));
    }

    @Test
    void testTooSmall_ShouldFail() {
        RasterImage image = RasterImage.blank(40, 40);
        image.fill(10, 10, 30, 30, 255, 0, 0, 255);

        assertTrue(evaluate(image).hasError(QualityCheck.DIMENSION_TOO_SMALL));
    }

    @Test
    void testFileSize_ShouldFailAboveCap() {
        QualityReport report = evaluator.evaluate(StickerFixtures.cleanSticker(), RgbColor.GREEN, 2_000_000);

        assertTrue(report.hasError(QualityCheck.FILE_TOO_LARGE));
    }

    /**
     * 背景殘留超過 1% 為錯誤，以下只警告
     */
    @Test
    void testBackgroundResidue() {
        RasterImage heavy = StickerFixtures.cleanSticker();
        heavy.fill(100, 100, 200, 120, 0, 250, 0, 255);
        QualityReport heavyReport = evaluate(heavy);
        assertTrue(heavyReport.hasError(QualityCheck.BACKGROUND_RESIDUE));

        RasterImage light = StickerFixtures.cleanSticker();
        light.fill(100, 100, 110, 110, 0, 250, 0, 255);
        QualityReport lightReport = evaluate(light);
        assertFalse(lightReport.hasError(QualityCheck.BACKGROUND_RESIDUE));
        assertTrue(lightReport.hasWarning(QualityCheck.BACKGROUND_TRACE));
    }

    @Test
    void testInteriorGreen_ShouldFail() {
        RasterImage image = StickerFixtures.cleanSticker();
        image.fill(150, 140, 170, 160, 0, 200, 0, 255);

        QualityReport report = evaluate(image);

        assertTrue(report.hasError(QualityCheck.INTERIOR_GREEN_CAVITY));
    }

    /**
     * 角色內部的半透明像素：半透明與內部破洞都只是警告
     */
    @Test
    void testInteriorSemiTransparent_ShouldWarn() {
        RasterImage image = StickerFixtures.cleanSticker();
        image.setAlpha(image.index(180, 160), 100);

        QualityReport report = evaluate(image);

        assertTrue(report.ok());
        assertTrue(report.hasWarning(QualityCheck.SEMI_TRANSPARENT));
        assertTrue(report.hasWarning(QualityCheck.INTERIOR_GHOST));
    }

    @Test
    void testTopStrayWhite_ShouldWarn() {
        RasterImage image = StickerFixtures.cleanSticker();
        image.setPixel(image.index(200, 5), 255, 255, 255, 255);

        QualityReport report = evaluate(image);

        assertTrue(report.ok());
        assertEquals(1.0, report.metric("top_stray_white"));
        assertTrue(report.hasWarning(QualityCheck.TOP_STRAY_WHITE));
        assertTrue(report.hasWarning(QualityCheck.MARGIN_TOO_SMALL));
    }

    @Test
    void testTouchingEdge_ShouldWarn() {
        RasterImage image = StickerFixtures.cleanSticker();
        image.fill(0, 150, 60, 170, 255, 0, 0, 255);

        QualityReport report = evaluate(image);

        assertTrue(report.ok());
        assertTrue(report.hasWarning(QualityCheck.EDGE_TOUCH));
        assertFalse(report.hasWarning(QualityCheck.MARGIN_TOO_SMALL));
    }

    @Test
    void testEdgeWhiteLine_ShouldFail() {
        RasterImage image = StickerFixtures.cleanSticker();
        image.fill(0, 0, 1, 320, 255, 255, 255, 255);

        QualityReport report = evaluate(image);

        assertFalse(report.ok());
        assertTrue(report.hasError(QualityCheck.EDGE_WHITE_LINE));
        assertEquals(0.5, report.metric("edge_white_left"));
    }
}
