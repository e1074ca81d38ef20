package work.pollochang.sticker.image.core;

/**
 * 影像的四個邊，用於逐層處理邊緣像素。
 */
public enum Edge {
    TOP("top"),
    BOTTOM("bottom"),
    LEFT("left"),
    RIGHT("right");

    private final String key;

    Edge(String key) {
        this.key = key;
    }

    public String key() {
        return key;
    }

    /**
     * 此邊第 {@code layer} 層 (0 為最外層) 的像素索引，超出影像時回傳空陣列。
     */
    public int[] layer(int width, int height, int layer) {
        boolean horizontal = this == TOP || this == BOTTOM;
        int depth = horizontal ? height : width;
        if (layer < 0 || layer >= depth) {
            return new int[0];
        }
        int length = horizontal ? width : height;
        int[] out = new int[length];
        for (int k = 0; k < length; k++) {
            switch (this) {
                case TOP:
                    out[k] = layer * width + k;
                    break;
                case BOTTOM:
                    out[k] = (height - 1 - layer) * width + k;
                    break;
                case LEFT:
                    out[k] = k * width + layer;
                    break;
                default:
                    out[k] = k * width + (width - 1 - layer);
                    break;
            }
        }
        return out;
    }

    /**
     * 從第 {@code fromLayer} 層開始往內 {@code depth} 層的像素索引。
     */
    public int[] band(int width, int height, int fromLayer, int depth) {
        boolean horizontal = this == TOP || this == BOTTOM;
        int limit = horizontal ? height : width;
        int to = Math.min(limit, fromLayer + depth);
        if (fromLayer >= to) {
            return new int[0];
        }
        int length = horizontal ? width : height;
        int[] out = new int[(to - fromLayer) * length];
        int n = 0;
        for (int layer = fromLayer; layer < to; layer++) {
            for (int i : layer(width, height, layer)) {
                out[n++] = i;
            }
        }
        return out;
    }
}
