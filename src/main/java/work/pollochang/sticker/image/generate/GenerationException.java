package work.pollochang.sticker.image.generate;

/**
 * 生成服務失敗。
 */
public class GenerationException extends Exception {

    public GenerationException(String message) {
        super(message);
    }

    public GenerationException(String message, Throwable cause) {
        super(message, cause);
    }
}
