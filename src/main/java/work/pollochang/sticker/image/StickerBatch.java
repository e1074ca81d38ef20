package work.pollochang.sticker.image;

import lombok.Setter;
import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.core.GridSplitter;
import work.pollochang.sticker.image.core.ImageCodec;
import work.pollochang.sticker.image.core.PipelineSettings;
import work.pollochang.sticker.image.core.RasterImage;
import work.pollochang.sticker.image.core.StickerOutcome;
import work.pollochang.sticker.image.core.StickerPipeline;
import work.pollochang.sticker.image.core.StickerResult;
import work.pollochang.sticker.image.report.ReportWriter;
import work.pollochang.sticker.image.report.StickerReport;
import work.pollochang.sticker.image.store.QualityLogStore;
import work.pollochang.sticker.image.tools.FileTools;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * 批次處理一張合成圖：切割後每一格各自跑完整管線。
 * 各格之間沒有共用狀態，以固定大小執行緒池平行處理。
 */
@Setter
@Slf4j
public class StickerBatch {

    private Path inputPath;
    private Path saveDir;
    private int rows;
    private int cols;
    private double targetAspect;
    private PipelineSettings settings = PipelineSettings.defaults();
    private long timeOutMinutes = 60;
    private Path qualityLogPath;
    private String sessionId;

    /**
     * @return 依格子序號排序的結果；合成圖本身無法讀取或切割時回傳空清單
     */
    public List<StickerReport> execute() {
        FileTools.ensureDirectoryExists(saveDir);
        if (sessionId == null) {
            sessionId = inputPath.getFileName().toString();
        }
        StickerPipeline pipeline = new StickerPipeline(settings);
        ReportWriter writer = new ReportWriter();

        List<RasterImage> cells;
        try {
            RasterImage composite = ImageCodec.read(inputPath);
            GridSplitter.GridSplit split = pipeline.splitGrid(composite, rows, cols, targetAspect);
            cells = split.cells();
        } catch (IOException e) {
            log.error("{} - 無法讀取合成圖", inputPath, e);
            return List.of();
        } catch (IllegalArgumentException e) {
            log.error("{} - 合成圖不合法: {}", inputPath, e.getMessage(), e);
            return List.of();
        }

        // 使用 EnumMap 和 AtomicLong 進行線程安全的計數
        Map<StickerResult, AtomicLong> counters = new EnumMap<>(StickerResult.class);
        for (StickerResult result : StickerResult.values()) {
            counters.put(result, new AtomicLong(0));
        }
        ConcurrentLinkedQueue<StickerReport> reports = new ConcurrentLinkedQueue<>();

        int coreCount = Math.max(1, Math.min(cells.size(), Runtime.getRuntime().availableProcessors()));
        log.info("共 {} 格，建立固定大小為 {} 的執行緒池。", cells.size(), coreCount);
        ExecutorService executor = Executors.newFixedThreadPool(coreCount);
        try {
            for (int index = 0; index < cells.size(); index++) {
                final int cellIndex = index;
                final RasterImage cell = cells.get(index);
                executor.submit(() -> {
                    StickerReport report = processCell(pipeline, writer, cellIndex, cell);
                    counters.get(report.result()).incrementAndGet();
                    reports.add(report);
                });
            }

            log.info("所有任務已提交，等待處理完成...");
            executor.shutdown();

            try {
                if (!executor.awaitTermination(timeOutMinutes, TimeUnit.MINUTES)) {
                    log.warn("執行緒池等待逾時，部分任務可能未完成。");
                    executor.shutdownNow();
                }
            } catch (InterruptedException e) {
                log.error("執行緒池被中斷。", e);
                executor.shutdownNow();
                Thread.currentThread().interrupt(); // 恢復中斷狀態
            }
        } finally {
            if (!executor.isShutdown()) {
                executor.shutdownNow();
            }
        }

        List<StickerReport> ordered = new ArrayList<>(reports);
        ordered.sort(Comparator.comparingInt(StickerReport::index));

        writeSummary(writer, ordered);
        if (qualityLogPath != null) {
            try (QualityLogStore store = new QualityLogStore(qualityLogPath)) {
                store.initSchema();
                store.saveAll(sessionId, ordered);
            } catch (RuntimeException e) {
                log.error("{} - 寫入品質紀錄失敗", qualityLogPath, e);
            }
        }

        long accepted = counters.get(StickerResult.ACCEPTED).get();
        long rejected = counters.get(StickerResult.REJECTED).get();
        long failed = ordered.size() - accepted - rejected;
        log.info("處理結果 -> 總計: {}, 通過: {}, 未通過: {}, 失敗: {}", cells.size(), accepted, rejected, failed);
        return ordered;
    }

    private StickerReport processCell(StickerPipeline pipeline, ReportWriter writer, int index, RasterImage cell) {
        String fileName = FileTools.stickerFileName(index, "png");
        try {
            StickerOutcome outcome = pipeline.process(cell);
            Path outputFile = saveDir.resolve(fileName);
            long size = ImageCodec.writePng(outcome.png(), outputFile);

            StickerResult result = outcome.accepted() ? StickerResult.ACCEPTED : StickerResult.REJECTED;
            StickerReport report = new StickerReport(index, result, fileName, outcome.report());
            writer.write(saveDir.resolve(FileTools.stickerFileName(index, "json")), report);

            if (outcome.accepted()) {
                log.info("{} - 處理成功 ({}x{}, {})", fileName, outcome.image().width(), outcome.image().height(),
                        FileTools.formatFileSize(size));
            } else {
                log.warn("{} - 品質檢查未通過: {}", fileName, outcome.report().errors());
            }
            return report;
        } catch (IllegalArgumentException e) {
            log.warn("{} - 輸入影像不合法: {}", fileName, e.getMessage(), e);
            return new StickerReport(index, StickerResult.FAILED_INVALID_INPUT, null, null);
        } catch (IOException | UncheckedIOException e) {
            log.warn("{} - 編碼或寫出檔案時發生 I/O 錯誤", fileName, e);
            return new StickerReport(index, StickerResult.FAILED_IO_ERROR, null, null);
        } catch (OutOfMemoryError e) {
            log.error("{} - 處理時發生記憶體溢位錯誤", fileName, e);
            return new StickerReport(index, StickerResult.FAILED_OUT_OF_MEMORY, null, null);
        } catch (Exception e) {
            log.error("{} - 處理時發生未知錯誤", fileName, e);
            return new StickerReport(index, StickerResult.FAILED_UNKNOWN, null, null);
        }
    }

    private void writeSummary(ReportWriter writer, List<StickerReport> ordered) {
        Map<String, Object> header = new LinkedHashMap<>();
        header.put("input", inputPath.toString());
        header.put("session", sessionId);
        header.put("rows", rows);
        header.put("cols", cols);
        header.put("targetAspect", targetAspect);
        header.put("accepted", ordered.stream().filter(r -> r.result() == StickerResult.ACCEPTED).count());
        header.put("total", ordered.size());
        try {
            writer.writeSummary(saveDir.resolve("report.json"), header, ordered);
        } catch (IOException e) {
            log.error("{} - 彙總報告寫入失敗", saveDir, e);
        }
    }
}
