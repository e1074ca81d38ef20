package work.pollochang.sticker.image.generate;

import lombok.extern.slf4j.Slf4j;
import work.pollochang.sticker.image.core.RasterImage;
import work.pollochang.sticker.image.core.StickerOutcome;
import work.pollochang.sticker.image.core.StickerPipeline;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 呼叫端持有的重新生成流程。
 *
 * <p>每次嘗試：生成 → 跑完整管線 → 品質通過則接受；不通過且還有次數則重新生成，否則放棄。
 * 生成服務失敗也算一次嘗試。管線本身不記得之前的嘗試，每次都是獨立執行。
 *
 * @author PolloChang
 * @since 0.1.0
 */
@Slf4j
public class RegenerationLoop {

    private final StickerPipeline pipeline;
    private final int maxAttempts;

    public RegenerationLoop(StickerPipeline pipeline, int maxAttempts) {
        if (maxAttempts <= 0) {
            throw new IllegalArgumentException("maxAttempts 必須大於 0: " + maxAttempts);
        }
        this.pipeline = Objects.requireNonNull(pipeline, "pipeline must not be null");
        this.maxAttempts = maxAttempts;
    }

    public RegenerationResult run(StickerGenerator generator) {
        Objects.requireNonNull(generator, "generator must not be null");

        List<AttemptState> history = new ArrayList<>();
        AttemptState state = AttemptState.GENERATE;
        StickerOutcome last = null;
        RasterImage generated = null;
        int attempt = 0;

        while (!state.terminal()) {
            history.add(state);
            switch (state) {
                case GENERATE:
                    attempt++;
                    try {
                        generated = generator.generate(attempt);
                        state = AttemptState.EVALUATE;
                    } catch (GenerationException e) {
                        log.warn("第 {} 次生成失敗: {}", attempt, e.getMessage(), e);
                        generated = null;
                        state = attempt < maxAttempts ? AttemptState.REGENERATE : AttemptState.GIVE_UP;
                    }
                    break;
                case EVALUATE:
                    last = pipeline.process(generated);
                    if (last.accepted()) {
                        state = AttemptState.ACCEPT;
                    } else {
                        log.warn("第 {} 次生成未通過品質檢查: {}", attempt, last.report().errors());
                        state = attempt < maxAttempts ? AttemptState.REGENERATE : AttemptState.GIVE_UP;
                    }
                    break;
                case REGENERATE:
                    state = AttemptState.GENERATE;
                    break;
                default:
                    throw new IllegalStateException("未預期的狀態: " + state);
            }
        }
        history.add(state);

        if (state == AttemptState.ACCEPT) {
            log.info("第 {} 次生成通過品質檢查", attempt);
        } else {
            log.warn("已嘗試 {} 次仍未通過品質檢查，放棄", attempt);
        }
        return new RegenerationResult(state, attempt, last, history);
    }
}
