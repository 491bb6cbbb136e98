package kosukeroku.game.list.bot.exception;

public class InvalidArgumentException extends GameListException {
    public InvalidArgumentException(String message) {
        super(message);
    }
}
