package kosukeroku.game.list.bot.exception;

public class UnknownCommandException extends GameListException {
    public UnknownCommandException(String name) {
        super("I don't know a command called !" + name + ". Say !help for the list.");
    }
}
