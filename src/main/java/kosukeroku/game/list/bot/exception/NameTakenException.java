package kosukeroku.game.list.bot.exception;

import kosukeroku.game.list.bot.service.ReplyFormatter;

public class NameTakenException extends GameListException {
    public NameTakenException(long ownerId) {
        super("That name is already taken by " + ReplyFormatter.mention(ownerId) + ".");
    }
}
