package kosukeroku.game.list.bot.command;

import java.util.List;
import java.util.Map;

public record CommandOutcome(
        Kind kind,
        String message,
        List<Long> mentionIds,         // pinged in front of the reply after the sender
        Map<Long, String> displayNames // labels for mentioned users the transport may not know
) {
    public enum Kind {
        REPLY,
        DOMAIN_ERROR,
        UNEXPECTED_ERROR
    }

    public CommandOutcome {
        mentionIds = List.copyOf(mentionIds);
        displayNames = Map.copyOf(displayNames);
    }

    public static CommandOutcome reply(String body) {
        return new CommandOutcome(Kind.REPLY, body, List.of(), Map.of());
    }

    public static CommandOutcome reply(String body, List<Long> mentionIds) {
        return new CommandOutcome(Kind.REPLY, body, mentionIds, Map.of());
    }

    public static CommandOutcome reply(String body, List<Long> mentionIds, Map<Long, String> displayNames) {
        return new CommandOutcome(Kind.REPLY, body, mentionIds, displayNames);
    }

    public static CommandOutcome domainError(String message) {
        return new CommandOutcome(Kind.DOMAIN_ERROR, message, List.of(), Map.of());
    }

    public static CommandOutcome unexpectedError(String description) {
        return new CommandOutcome(Kind.UNEXPECTED_ERROR, description, List.of(), Map.of());
    }
}
