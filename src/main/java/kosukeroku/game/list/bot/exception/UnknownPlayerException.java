package kosukeroku.game.list.bot.exception;

public class UnknownPlayerException extends GameListException {
    public UnknownPlayerException(String name) {
        super("There is no column called \"" + name + "\" in the game list. Names are case-sensitive.");
    }
}
