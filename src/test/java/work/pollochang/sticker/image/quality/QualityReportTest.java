package work.pollochang.sticker.image.quality;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class QualityReportTest {

    /**
     * 有致命錯誤卻標記為通過：拒絕建立
     */
    @Test
    void testConstructor_OkWithErrors_ShouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new QualityReport(true, Map.of(), List.of("bg_remain: 3.2%"), List.of()));
    }

    /**
     * 沒有致命錯誤卻標記為不通過：拒絕建立
     */
    @Test
    void testConstructor_NotOkWithoutErrors_ShouldThrow() {
        assertThrows(IllegalArgumentException.class,
                () -> new QualityReport(false, Map.of(), List.of(), List.of("margin_small: 2px")));
    }

    @Test
    void testOf_ShouldDeriveOkFromErrors() {
        QualityReport failed = QualityReport.of(Map.of("bg_remain_pct", 3.2), List.of("bg_remain: 3.2%"), List.of());
        QualityReport passed = QualityReport.of(Map.of("bg_remain_pct", 0.1), List.of(), List.of("margin_small: 2px"));

        assertFalse(failed.ok());
        assertTrue(failed.hasError(QualityCheck.BACKGROUND_RESIDUE));
        assertTrue(passed.ok());
        assertEquals(0.1, passed.metric("bg_remain_pct"));
    }
}
