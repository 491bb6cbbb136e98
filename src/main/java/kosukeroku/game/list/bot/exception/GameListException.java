package kosukeroku.game.list.bot.exception;

// base for every user-caused failure; the message is shown to the user as is
public class GameListException extends RuntimeException {
    public GameListException(String message) {
        super(message);
    }
}
