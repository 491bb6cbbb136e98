package kosukeroku.game.list.bot.exception;

public class UnresolvedMentionException extends GameListException {
    public UnresolvedMentionException(String handle) {
        super("I don't know who @" + handle + " is. They need to tell me their name with !iam <name> first.");
    }
}
