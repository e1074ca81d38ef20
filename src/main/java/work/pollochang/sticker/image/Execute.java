package work.pollochang.sticker.image;

import lombok.extern.slf4j.Slf4j;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import work.pollochang.sticker.image.config.ProfileLoader;
import work.pollochang.sticker.image.core.PipelineSettings;
import work.pollochang.sticker.image.core.RgbColor;
import work.pollochang.sticker.image.core.StickerResult;
import work.pollochang.sticker.image.report.StickerReport;

import java.io.File;
import java.util.List;
import java.util.concurrent.Callable;

@Slf4j
@Command(name = "sticker-pipeline",
        mixinStandardHelpOptions = true,
        version = "0.1.0",
        description = "貼圖後製工具：切割合成圖、移除背景、修補瑕疵、加描邊並做品質檢查")
public class Execute implements Callable<Integer> {

    @Option(names = {"-i", "--input"}, required = true, description = "生成器輸出的合成圖。")
    private File input;

    @Option(names = {"-o", "--output-dir"}, required = true, description = "貼圖與報告的儲存目錄。")
    private File saveDir;

    @Option(names = {"-r", "--rows"}, defaultValue = "4", description = "合成圖的列數 (預設: 4)。")
    private int rows;

    @Option(names = {"-c", "--cols"}, defaultValue = "3", description = "合成圖的欄數 (預設: 3)。")
    private int cols;

    @Option(names = {"-a", "--aspect"}, defaultValue = "1.15625", description = "單張貼圖的目標寬高比 (預設: 370/320)。")
    private double targetAspect;

    @Option(names = {"-b", "--bg-color"}, split = ",", converter = RgbColorConverter.class,
            description = "指定背景色 (#RRGGBB，可用逗號分隔多個)，指定後不做邊框取樣。")
    private List<RgbColor> bgColors;

    @Option(names = {"--outline-radius"}, description = "描邊寬度 (px)，覆寫設定檔。")
    private Integer outlineRadius;

    @Option(names = {"-p", "--profile"}, description = "JSON 參數設定檔，只需列出要覆寫的欄位。")
    private File profile;

    @Option(names = {"--quality-log"}, description = "H2 品質紀錄資料庫的檔案路徑。")
    private File qualityLog;

    @Option(names = {"--session"}, description = "寫入品質紀錄時使用的 session 名稱 (預設: 輸入檔名)。")
    private String sessionId;

    @Option(names = {"--timeOut"}, defaultValue = "60", description = "設定執行時間超時(分鐘) (預設: 60 分鐘)。")
    private long timeOutMinutes;

    @Override
    public Integer call() throws Exception {
        PipelineSettings settings = new ProfileLoader().load(profile == null ? null : profile.toPath());
        if (bgColors != null && !bgColors.isEmpty()) {
            settings = settings.toBuilder().background(settings.background().withFixedColors(bgColors)).build();
        }
        if (outlineRadius != null) {
            settings = settings.toBuilder().outlineRadius(outlineRadius).build();
        }

        log.info("========================================貼圖處理參數設定========================================");
        log.info("合成圖: {}", input.getAbsolutePath());
        log.info("輸出目錄: {}", saveDir.getAbsolutePath());
        log.info("網格: {} 列 x {} 欄, 目標寬高比: {}", rows, cols, targetAspect);
        log.info("背景色: {}", settings.background().hasFixedColors() ? settings.background().fixedColors() : "自動偵測");
        log.info("描邊寬度: {} px", settings.outlineRadius());
        log.info("尺寸上限: {}x{}", settings.quality().maxWidth(), settings.quality().maxHeight());
        log.info("品質紀錄資料庫: {}", qualityLog == null ? "不記錄" : qualityLog.getAbsolutePath());
        log.info("========================================貼圖處理參數設定========================================");

        StickerBatch batch = new StickerBatch();
        batch.setInputPath(input.toPath());
        batch.setSaveDir(saveDir.toPath());
        batch.setRows(rows);
        batch.setCols(cols);
        batch.setTargetAspect(targetAspect);
        batch.setSettings(settings);
        batch.setTimeOutMinutes(timeOutMinutes);
        batch.setQualityLogPath(qualityLog == null ? null : qualityLog.toPath());
        batch.setSessionId(sessionId);
        List<StickerReport> reports = batch.execute();

        boolean allAccepted = !reports.isEmpty()
                && reports.stream().allMatch(r -> r.result() == StickerResult.ACCEPTED);
        log.info("所有任務執行完畢");
        return allAccepted ? 0 : 1;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Execute()).execute(args);
        System.exit(exitCode);
    }

    public static class RgbColorConverter implements CommandLine.ITypeConverter<RgbColor> {
        @Override
        public RgbColor convert(String value) {
            return RgbColor.parseHex(value);
        }
    }
}
