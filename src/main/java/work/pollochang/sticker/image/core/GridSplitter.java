package work.pollochang.sticker.image.core;

import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 把一張合成圖切成 R×C 張等大的貼圖。
 *
 * <p>生成器有時會把要求的排列轉置 (例如要 4 列 3 欄卻給 3 列 4 欄)，
 * 所以同時計算 R×C 與 C×R 兩種切法，取第一格寬高比最接近目標比例者。
 * 每格四邊再裁掉 {@code trim} px，避免相鄰格的接縫滲入。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class GridSplitter {

    private final int trim;

    /**
     * @param trim 每格四邊裁掉的像素數
     */
    public GridSplitter(int trim) {
        if (trim < 0) {
            throw new IllegalArgumentException("trim 不可為負數: " + trim);
        }
        this.trim = trim;
    }

    /**
     * 切割結果。
     *
     * @param rows    實際採用的列數
     * @param cols    實際採用的欄數
     * @param swapped 是否採用轉置後的排列
     * @param cells   依列優先順序排列的格子
     */
    public record GridSplit(int rows, int cols, boolean swapped, List<RasterImage> cells) {
        public GridSplit {
            cells = List.copyOf(cells);
        }
    }

    /**
     * @param composite    合成圖
     * @param rows         要求的列數
     * @param cols         要求的欄數
     * @param targetAspect 目標格子寬高比 (寬 / 高)
     */
    public GridSplit split(RasterImage composite, int rows, int cols, double targetAspect) {
        Objects.requireNonNull(composite, "composite must not be null");
        if (rows <= 0 || cols <= 0) {
            throw new IllegalArgumentException("列數與欄數必須大於 0: " + rows + "x" + cols);
        }
        if (!(targetAspect > 0) || Double.isInfinite(targetAspect)) {
            throw new IllegalArgumentException("目標寬高比必須大於 0: " + targetAspect);
        }

        boolean swapped = false;
        int useRows = rows;
        int useCols = cols;
        if (rows != cols && fits(composite, cols, rows)) {
            double direct = fits(composite, rows, cols)
                    ? Math.abs(firstCellAspect(composite, rows, cols) - targetAspect)
                    : Double.MAX_VALUE;
            double transposed = Math.abs(firstCellAspect(composite, cols, rows) - targetAspect);
            if (transposed < direct) {
                swapped = true;
                useRows = cols;
                useCols = rows;
            }
        }
        if (!fits(composite, useRows, useCols)) {
            throw new IllegalArgumentException(String.format("影像 %dx%d 無法切成 %d 列 %d 欄",
                    composite.width(), composite.height(), useRows, useCols));
        }

        int[] xs = boundaries(composite.width(), useCols);
        int[] ys = boundaries(composite.height(), useRows);
        List<RasterImage> cells = new ArrayList<>(useRows * useCols);
        for (int r = 0; r < useRows; r++) {
            for (int c = 0; c < useCols; c++) {
                int[] xSpan = trimmed(xs[c], xs[c + 1]);
                int[] ySpan = trimmed(ys[r], ys[r + 1]);
                cells.add(composite.crop(xSpan[0], ySpan[0], xSpan[1] - xSpan[0], ySpan[1] - ySpan[0]));
            }
        }

        log.info("網格切割: 影像 {}x{}, 要求 {}x{}, 採用 {} 列 {} 欄{}", composite.width(), composite.height(),
                rows, cols, useRows, useCols, swapped ? " (偵測到轉置)" : "");
        return new GridSplit(useRows, useCols, swapped, cells);
    }

    /**
     * 四捨五入的累積邊界，長度 {@code n + 1}，首尾分別為 0 與 {@code length}，不重疊也不留縫。
     */
    static int[] boundaries(int length, int n) {
        int[] b = new int[n + 1];
        for (int i = 0; i <= n; i++) {
            b[i] = (int) Math.round((double) i * length / n);
        }
        return b;
    }

    double firstCellAspect(RasterImage composite, int rows, int cols) {
        int[] xs = boundaries(composite.width(), cols);
        int[] ys = boundaries(composite.height(), rows);
        int[] xSpan = trimmed(xs[0], xs[1]);
        int[] ySpan = trimmed(ys[0], ys[1]);
        return (double) (xSpan[1] - xSpan[0]) / (ySpan[1] - ySpan[0]);
    }

    private int[] trimmed(int start, int end) {
        int t = Math.min(trim, (end - start - 1) / 2);
        return new int[]{start + t, end - t};
    }

    private static boolean fits(RasterImage composite, int rows, int cols) {
        return composite.width() >= cols && composite.height() >= rows;
    }
}
