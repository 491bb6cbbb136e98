package kosukeroku.game.list.bot.command;

import kosukeroku.game.list.bot.exception.GameListException;
import kosukeroku.game.list.bot.exception.UnknownCommandException;
import kosukeroku.game.list.bot.service.ReplyFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Slf4j
@Component
@RequiredArgsConstructor
public class Dispatcher {

    private static final Pattern COMMAND_PATTERN = Pattern.compile("(!?)([a-z]+)(?:\\s+(.*))?", Pattern.DOTALL);
    private static final String HELP_NUDGE = "Say !help to see what I can do.";
    private static final String GENERIC_ERROR = "Oops, something went wrong on my end";

    private final CommandContext context;

    record ParsedCommand(String name, String args) {}

    // returns the reply to send, empty when the message is not meant for the bot
    public Optional<Reply> dispatch(IncomingMessage message) {
        Optional<ParsedCommand> command = parse(message.text(), message.addressed());
        if (command.isEmpty()) {
            if (message.addressed()) {
                return Optional.of(new Reply(ReplyFormatter.renderReply(message.senderId(), List.of(), HELP_NUDGE), Map.of()));
            }
            return Optional.empty();
        }

        CommandOutcome outcome = execute(command.get(), message.senderId());
        return Optional.of(render(outcome, message.senderId()));
    }

    // the leading '!' can only be left out when talking to the bot directly
    static Optional<ParsedCommand> parse(String text, boolean addressed) {
        if (text == null) {
            return Optional.empty();
        }
        Matcher matcher = COMMAND_PATTERN.matcher(text);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        if (matcher.group(1).isEmpty() && !addressed) {
            return Optional.empty();
        }
        String args = matcher.group(3) == null ? "" : matcher.group(3).stripTrailing();
        return Optional.of(new ParsedCommand(matcher.group(2), args));
    }

    private CommandOutcome execute(ParsedCommand command, long senderId) {
        try {
            CommandSpec spec = context.registry().lookup(command.name())
                    .orElseThrow(() -> new UnknownCommandException(command.name()));
            log.info("Handling !{} from user {}", command.name(), senderId);
            return spec.handler().handle(context, senderId, command.args());
        } catch (GameListException e) {
            log.debug("!{} from user {} refused: {}", command.name(), senderId, e.getMessage());
            return CommandOutcome.domainError(e.getMessage());
        } catch (Exception e) {
            log.error("Error handling !{} from user {}: {}", command.name(), senderId, e.getMessage(), e);
            return CommandOutcome.unexpectedError(shortDescription(e));
        }
    }

    private Reply render(CommandOutcome outcome, long senderId) {
        String body = switch (outcome.kind()) {
            case REPLY, DOMAIN_ERROR -> outcome.message();
            case UNEXPECTED_ERROR -> GENERIC_ERROR + " (" + outcome.message() + ").";
        };
        return new Reply(ReplyFormatter.renderReply(senderId, outcome.mentionIds(), body), outcome.displayNames());
    }

    private static String shortDescription(Exception e) {
        return e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
    }
}
