package work.pollochang.sticker.image.core;

public enum StickerResult {
    ACCEPTED("品質檢查通過"),
    REJECTED("品質檢查未通過"),
    FAILED_INVALID_INPUT("輸入影像不合法"),
    FAILED_IO_ERROR("IO錯誤"),
    FAILED_OUT_OF_MEMORY("記憶體溢位"),
    FAILED_UNKNOWN("未知錯誤");

    private final String description;
    StickerResult(String description) { this.description = description; }
    public String getDescription() { return description; }
}
