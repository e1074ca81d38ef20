package work.pollochang.sticker.image.quality;

/**
 * 品質檢查項目。致命項目會讓 {@link QualityReport#ok()} 為 false，其餘只列為警告。
 */
public enum QualityCheck {
    EMPTY_CANVAS("empty_canvas", true, "沒有任何可見像素"),
    BACKGROUND_RESIDUE("bg_remain", true, "背景色殘留"),
    INTERIOR_GREEN_CAVITY("interior_green", true, "封閉區域內殘留綠色"),
    BOTTOM_GREEN_LINE("bottom_green_line", true, "底部綠線殘留"),
    DIMENSION_TOO_LARGE("dimension_too_large", true, "尺寸超過上限"),
    DIMENSION_TOO_SMALL("dimension_too_small", true, "尺寸低於下限"),
    FILE_TOO_LARGE("file_too_large", true, "檔案大小超過上限"),
    EDGE_WHITE_LINE("edge_white_line", true, "邊緣殘留白線"),

    BACKGROUND_TRACE("bg_trace", false, "少量背景色殘留"),
    SEMI_TRANSPARENT("semi_transparent", false, "存在半透明像素"),
    INTERIOR_GHOST("interior_ghost", false, "角色內部有半透明破洞"),
    TOP_STRAY_WHITE("top_stray_white", false, "頂部有懸空白點"),
    EDGE_TOUCH("edge_touch", false, "角色貼齊邊界"),
    MARGIN_TOO_SMALL("margin_too_small", false, "角色距離邊界過近");

    private final String key;
    private final boolean fatal;
    private final String description;

    QualityCheck(String key, boolean fatal, String description) {
        this.key = key;
        this.fatal = fatal;
        this.description = description;
    }

    public String key() {
        return key;
    }

    public boolean fatal() {
        return fatal;
    }

    public String description() {
        return description;
    }

    /** 格式化成 {@code key: 說明 (細節)}。 */
    public String message(String detail) {
        return key + ": " + description + " (" + detail + ")";
    }
}
