package kosukeroku.game.list.bot.service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Text helpers shared by every reply. Mentions are kept as {@code <@id>} tokens
 * until the transport turns them into whatever its chat client renders as a ping.
 */
public final class ReplyFormatter {

    private static final Pattern MENTION_PATTERN = Pattern.compile("<@(\\d+)>");
    // a handle the transport could not turn into a mention token
    private static final Pattern HANDLE_PATTERN = Pattern.compile("(?<![\\w<])@(\\w+)");

    public enum Conjunction {
        AND("and"),
        OR("or");

        private final String word;

        Conjunction(String word) {
            this.word = word;
        }

        public String word() {
            return word;
        }
    }

    private ReplyFormatter() {
    }

    // "A", "A and B", "A, B, and C"
    public static String joinWithConjunction(List<String> items, Conjunction conjunction) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("Cannot join an empty list");
        }
        if (items.size() == 1) {
            return items.get(0);
        }
        String last = items.get(items.size() - 1);
        if (items.size() == 2) {
            return items.get(0) + " " + conjunction.word() + " " + last;
        }
        return String.join(", ", items.subList(0, items.size() - 1)) + ", " + conjunction.word() + " " + last;
    }

    public static <T> List<T> dedupPreserveOrder(List<T> items) {
        return new ArrayList<>(new LinkedHashSet<>(items));
    }

    public static String mention(long userId) {
        return "<@" + userId + ">";
    }

    // ids in order of appearance, duplicates kept
    public static List<Long> extractMentions(String text) {
        List<Long> ids = new ArrayList<>();
        Matcher matcher = MENTION_PATTERN.matcher(text);
        while (matcher.find()) {
            ids.add(Long.parseLong(matcher.group(1)));
        }
        return ids;
    }

    public static List<String> extractUnresolvedHandles(String text) {
        List<String> handles = new ArrayList<>();
        Matcher matcher = HANDLE_PATTERN.matcher(text);
        while (matcher.find()) {
            handles.add(matcher.group(1));
        }
        return handles;
    }

    public static Pattern mentionPattern() {
        return MENTION_PATTERN;
    }

    public static String renderReply(long primaryId, List<Long> extraIds, String body) {
        List<Long> ids = new ArrayList<>();
        ids.add(primaryId);
        ids.addAll(extraIds);

        String prefix = dedupPreserveOrder(ids).stream()
                .map(ReplyFormatter::mention)
                .collect(Collectors.joining(" "));
        String separator = body.contains("\n") ? "\n" : " ";
        return prefix + separator + body;
    }
}
