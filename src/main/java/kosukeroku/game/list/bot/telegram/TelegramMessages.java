package kosukeroku.game.list.bot.telegram;

import kosukeroku.game.list.bot.command.IncomingMessage;
import kosukeroku.game.list.bot.service.ReplyFormatter;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.MessageEntity;
import org.telegram.telegrambots.meta.api.objects.User;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Converts between Telegram messages and the transport-neutral text the dispatcher works on.
 * Inbound, users picked from the mention menu and {@code @username} mentions of known users
 * become {@code <@id>} tokens; outbound, those tokens become {@code tg://user} links.
 */
public final class TelegramMessages {

    private static final String TEXT_MENTION = "text_mention";
    private static final String MENTION = "mention";
    private static final Pattern SLASH_COMMAND_PATTERN = Pattern.compile("^/([a-z]+)(?:@(\\w+))?");
    private static final String DEFAULT_LINK_TEXT = "player";

    public record Inbound(IncomingMessage message, Map<Long, String> displayNames) {}

    private TelegramMessages() {
    }

    // null when there is nothing to dispatch
    public static Inbound toInbound(Message message, String botUsername,
                                    Function<String, Optional<Long>> usernameResolver) {
        String text = message.hasText() ? message.getText() : message.getCaption();
        if (text == null || message.getFrom() == null) {
            return null;
        }
        List<MessageEntity> entities = message.hasText() ? message.getEntities() : message.getCaptionEntities();

        Map<Long, String> displayNames = new HashMap<>();
        displayNames.put(message.getFrom().getId(), message.getFrom().getFirstName());

        boolean addressed = isPrivateChat(message) || isReplyToBot(message, botUsername);
        String botMention = "@" + botUsername;

        StringBuilder rewritten = new StringBuilder();
        int position = 0;
        List<MessageEntity> sorted = entities == null ? List.of() : new ArrayList<>(entities);
        sorted.sort(Comparator.comparing(MessageEntity::getOffset));
        for (MessageEntity entity : sorted) {
            int start = entity.getOffset();
            int end = start + entity.getLength();
            if (start < position || end > text.length()) {
                continue;
            }

            if (TEXT_MENTION.equals(entity.getType()) && entity.getUser() != null) {
                User user = entity.getUser();
                displayNames.put(user.getId(), user.getFirstName());
                rewritten.append(text, position, start).append(ReplyFormatter.mention(user.getId()));
                position = end;
            } else if (MENTION.equals(entity.getType())) {
                String handle = text.substring(start, end);
                if (handle.equalsIgnoreCase(botMention)) {
                    addressed = true;
                    rewritten.append(text, position, start);
                    position = end;
                } else {
                    // unknown usernames stay as plain text for the command to report
                    Optional<Long> userId = usernameResolver.apply(handle.substring(1));
                    if (userId.isPresent()) {
                        rewritten.append(text, position, start).append(ReplyFormatter.mention(userId.get()));
                        position = end;
                    }
                }
            }
        }
        rewritten.append(text.substring(position));

        String normalized = rewritten.toString().strip();
        Matcher slash = SLASH_COMMAND_PATTERN.matcher(normalized);
        if (slash.find()) {
            String target = slash.group(2);
            if (target != null && !target.equalsIgnoreCase(botUsername)) {
                return null; // someone else's command
            }
            normalized = "!" + slash.group(1) + normalized.substring(slash.end());
        }

        IncomingMessage incoming = new IncomingMessage(normalized, message.getFrom().getId(), addressed);
        return new Inbound(incoming, displayNames);
    }

    public static String toMarkdown(String reply, Map<Long, String> displayNames) {
        String escaped = escapeMarkdown(reply);

        StringBuilder result = new StringBuilder();
        Matcher matcher = ReplyFormatter.mentionPattern().matcher(escaped);
        while (matcher.find()) {
            long userId = Long.parseLong(matcher.group(1));
            String name = displayNames.getOrDefault(userId, DEFAULT_LINK_TEXT);
            String link = "[" + escapeMarkdown(name.replace("]", "")) + "](tg://user?id=" + userId + ")";
            matcher.appendReplacement(result, Matcher.quoteReplacement(link));
        }
        matcher.appendTail(result);
        return result.toString();
    }

    // legacy Markdown only treats these four as special
    static String escapeMarkdown(String text) {
        return text.replaceAll("([_*`\\[])", "\\\\$1");
    }

    private static boolean isPrivateChat(Message message) {
        return message.getChat() != null && message.getChat().isUserChat();
    }

    private static boolean isReplyToBot(Message message, String botUsername) {
        Message repliedTo = message.getReplyToMessage();
        return repliedTo != null
                && repliedTo.getFrom() != null
                && Boolean.TRUE.equals(repliedTo.getFrom().getIsBot())
                && botUsername.equalsIgnoreCase(repliedTo.getFrom().getUserName());
    }
}
