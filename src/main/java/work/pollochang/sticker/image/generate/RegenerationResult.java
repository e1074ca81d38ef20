package work.pollochang.sticker.image.generate;

import work.pollochang.sticker.image.core.StickerOutcome;

import java.util.List;

/**
 * 重新生成流程的結果。
 *
 * @param state    最終狀態，ACCEPT 或 GIVE_UP
 * @param attempts 實際嘗試次數
 * @param outcome  最後一次成功跑完管線的結果，全部生成失敗時為 null
 * @param history  依序經過的狀態
 */
public record RegenerationResult(AttemptState state, int attempts, StickerOutcome outcome, List<AttemptState> history) {

    public RegenerationResult {
        history = List.copyOf(history);
    }

    public boolean accepted() {
        return state == AttemptState.ACCEPT;
    }
}
