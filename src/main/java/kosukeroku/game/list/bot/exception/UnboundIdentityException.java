package kosukeroku.game.list.bot.exception;

import kosukeroku.game.list.bot.service.ReplyFormatter;

public class UnboundIdentityException extends GameListException {
    public UnboundIdentityException(long userId) {
        super("I don't know what name " + ReplyFormatter.mention(userId)
                + " goes by in the game list. Tell me with !iam <name>.");
    }
}
