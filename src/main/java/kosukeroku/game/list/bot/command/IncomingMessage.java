package kosukeroku.game.list.bot.command;

public record IncomingMessage(
        String text,      // mentions already rewritten to <@id> tokens
        long senderId,
        boolean addressed // private chat, reply to the bot or the bot was mentioned
) {}
