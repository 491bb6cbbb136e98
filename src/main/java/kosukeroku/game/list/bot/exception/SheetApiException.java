package kosukeroku.game.list.bot.exception;

public class SheetApiException extends RuntimeException {

    public SheetApiException(String message) {
        super("Google Sheets API error: " + message);
    }

    public SheetApiException(String message, Throwable cause) {
        super("Google Sheets API error: " + message, cause);
    }
}
