package kosukeroku.game.list.bot.command;

@FunctionalInterface
public interface CommandHandler {
    CommandOutcome handle(CommandContext context, long senderId, String args);
}
