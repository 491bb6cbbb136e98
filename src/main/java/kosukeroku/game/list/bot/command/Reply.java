package kosukeroku.game.list.bot.command;

import java.util.Map;

public record Reply(
        String text,
        Map<Long, String> displayNames // user id -> sheet name, for mentions in the text
) {}
