package work.pollochang.sticker.image.generate;

/**
 * 重新生成流程的狀態：GENERATE → EVALUATE → {ACCEPT, REGENERATE, GIVE_UP}。
 */
public enum AttemptState {
    GENERATE,
    EVALUATE,
    ACCEPT,
    REGENERATE,
    GIVE_UP;

    public boolean terminal() {
        return this == ACCEPT || this == GIVE_UP;
    }
}
