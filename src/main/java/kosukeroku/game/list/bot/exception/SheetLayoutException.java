package kosukeroku.game.list.bot.exception;

// the spreadsheet itself is laid out in a way the parser can't follow
public class SheetLayoutException extends GameListException {
    public SheetLayoutException(String message) {
        super(message);
    }
}
