package kosukeroku.game.list.bot.command;

public record CommandSpec(
        String name,
        CommandHandler handler,
        String argHint, // null for commands without arguments
        String helpText
) {}
