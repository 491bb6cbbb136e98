package kosukeroku.game.list.bot.exception;

public class NoMatchingGamesException extends GameListException {

    public NoMatchingGamesException() {
        super("I couldn't find a single game everyone can play. Time to buy something new?");
    }

    public NoMatchingGamesException(String title) {
        super("I couldn't find any game with \"" + title + "\" in its title.");
    }
}
