package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.exception.SheetLayoutException;
import kosukeroku.game.list.bot.modelDTO.Game;
import kosukeroku.game.list.bot.modelDTO.GameCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns the raw cell grid of the game list into a {@link GameCatalog}.
 *
 * <p>Row 0 holds the headings, row 2 the player names under the "who owns" heading,
 * and games start at row 3. The owners heading covers every following column with a
 * blank heading and a non-blank player name.</p>
 */
@Slf4j
@Component
public class SheetParser {

    private static final int HEADING_ROW = 0;
    private static final int SUB_HEADING_ROW = 2;
    private static final int DATA_BEGIN_ROW = 3;

    private static final Pattern NUMBER_PATTERN = Pattern.compile("[0-9]+");
    private static final Pattern NUMBER_PLUS_PATTERN = Pattern.compile("([0-9]+)\\+");
    private static final int MAX_SIGNIFICANT_DIGITS = 10;

    enum Field {
        TITLE("title"),
        PLATFORM("platform"),
        MAX_PLAYERS("max.+player"),
        GOOD_PLAYERS("good.+player"),
        OWNS("who.+owns");

        private final Pattern headingPattern;

        Field(String regex) {
            this.headingPattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
        }

        boolean matches(String heading) {
            return headingPattern.matcher(heading).find();
        }

        String pattern() {
            return headingPattern.pattern();
        }
    }

    private record ColumnSpan(int begin, int end) {}

    private final int partySizeCap;

    public SheetParser(@Value("${game-list.sheet.party-size-cap:100}") int partySizeCap) {
        this.partySizeCap = partySizeCap;
    }

    public GameCatalog parse(List<List<String>> rawRows) {
        List<List<String>> rows = rawRows.stream()
                .map(row -> row.stream()
                        .map(cell -> cell == null ? "" : cell.strip())
                        .collect(Collectors.toList()))
                .collect(Collectors.toList());

        Map<Field, ColumnSpan> spans = locateColumns(rows);
        List<String> names = ownerNames(rows, spans.get(Field.OWNS));

        List<Game> games = new ArrayList<>();
        for (int rowIndex = DATA_BEGIN_ROW; rowIndex < rows.size(); rowIndex++) {
            List<String> row = rows.get(rowIndex);
            String title = cell(row, spans.get(Field.TITLE).begin());
            if (title.isEmpty()) {
                continue; // title is the only required field
            }
            games.add(parseGame(title, row, spans, names));
        }

        log.info("Parsed {} games and {} players from the game list", games.size(), names.size());
        return new GameCatalog(new LinkedHashSet<>(names), games);
    }

    private Game parseGame(String title, List<String> row, Map<Field, ColumnSpan> spans, List<String> names) {
        String platform = cell(row, spans.get(Field.PLATFORM).begin());
        Integer maxPlayers = maxNumber(cell(row, spans.get(Field.MAX_PLAYERS).begin()));
        Set<Integer> goodPlayers = parseGoodPlayers(cell(row, spans.get(Field.GOOD_PLAYERS).begin()), maxPlayers);

        Map<String, Boolean> owns = new LinkedHashMap<>();
        int ownsBegin = spans.get(Field.OWNS).begin();
        for (int i = 0; i < names.size(); i++) {
            owns.put(names.get(i), !cell(row, ownsBegin + i).isEmpty());
        }

        return new Game(title, platform.isEmpty() ? null : platform, maxPlayers, goodPlayers, owns);
    }

    /// //////////////////////////////////////////////
    // HEADINGS
    /// //////////////////////////////////////////////

    private Map<Field, ColumnSpan> locateColumns(List<List<String>> rows) {
        List<String> headings = row(rows, HEADING_ROW);
        List<String> subHeadings = row(rows, SUB_HEADING_ROW);

        Map<Field, Integer> begins = new EnumMap<>(Field.class);
        Map<Field, Integer> ends = new EnumMap<>(Field.class);
        Field continuing = null;

        int width = Math.max(headings.size(), subHeadings.size());
        for (int col = 0; col < width; col++) {
            String heading = cell(headings, col);
            if (!heading.isEmpty()) {
                continuing = null;
                for (Field field : Field.values()) {
                    if (!field.matches(heading)) {
                        continue;
                    }
                    if (begins.containsKey(field)) {
                        throw new SheetLayoutException(
                                "I found multiple headings matching \"" + field.pattern() + "\" in the game list.");
                    }
                    begins.put(field, col);
                    ends.put(field, col + 1);
                    if (field == Field.OWNS) {
                        continuing = field;
                    }
                    break;
                }
            } else if (continuing != null) {
                // blank heading continues the owners block while there is a player name below it
                if (!cell(subHeadings, col).isEmpty()) {
                    ends.put(continuing, col + 1);
                } else {
                    continuing = null;
                }
            }
        }

        Map<Field, ColumnSpan> spans = new EnumMap<>(Field.class);
        for (Field field : Field.values()) {
            if (!begins.containsKey(field)) {
                throw new SheetLayoutException(
                        "I couldn't find a heading matching \"" + field.pattern() + "\" in the game list.");
            }
            spans.put(field, new ColumnSpan(begins.get(field), ends.get(field)));
        }
        return spans;
    }

    private List<String> ownerNames(List<List<String>> rows, ColumnSpan span) {
        List<String> subHeadings = row(rows, SUB_HEADING_ROW);
        String heading = cell(row(rows, HEADING_ROW), span.begin());

        List<String> names = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (int col = span.begin(); col < span.end(); col++) {
            String name = cell(subHeadings, col);
            if (!seen.add(name)) {
                throw new SheetLayoutException("There are multiple columns in the game list under " + heading
                        + " with the same sub-heading (" + name + ").");
            }
            names.add(name);
        }
        return names;
    }

    /// //////////////////////////////////////////////
    // CELL VALUES
    /// //////////////////////////////////////////////

    static Integer maxNumber(String cell) {
        return numbers(cell).stream()
                .max(Integer::compare)
                .orElse(null);
    }

    // "2-4", "4 even", "3+" -> explicit party sizes, clipped to 1..max players and the party size cap
    Set<Integer> parseGoodPlayers(String cell, Integer maxPlayers) {
        int step = cell.toLowerCase(Locale.ROOT).contains("even") ? 2 : 1;
        int upperBound = maxPlayers != null ? Math.min(maxPlayers, partySizeCap) : partySizeCap;

        int low;
        int high;
        Matcher plus = NUMBER_PLUS_PATTERN.matcher(cell);
        if (plus.find()) {
            low = parseClamped(plus.group(1));
            high = upperBound;
        } else {
            List<Integer> numbers = numbers(cell);
            if (numbers.isEmpty()) {
                return null;
            }
            low = Collections.min(numbers);
            high = Collections.max(numbers);
        }

        Set<Integer> sizes = new TreeSet<>();
        for (int size = Math.max(low, 1); size <= Math.min(high, upperBound); size++) {
            if (size % step == 0) {
                sizes.add(size);
            }
        }

        if (sizes.isEmpty()) {
            // most likely a cell we did not understand
            log.warn("Ignoring good players value '{}' (max players {})", cell, maxPlayers);
            return null;
        }
        return sizes;
    }

    private static List<Integer> numbers(String cell) {
        List<Integer> numbers = new ArrayList<>();
        Matcher matcher = NUMBER_PATTERN.matcher(cell);
        while (matcher.find()) {
            numbers.add(parseClamped(matcher.group()));
        }
        return numbers;
    }

    // digit runs too long for an int read as Integer.MAX_VALUE
    static int parseClamped(String digits) {
        String significant = digits.replaceFirst("^0+(?=.)", "");
        if (significant.length() > MAX_SIGNIFICANT_DIGITS) {
            return Integer.MAX_VALUE;
        }
        return (int) Math.min(Long.parseLong(significant), Integer.MAX_VALUE);
    }

    private static List<String> row(List<List<String>> rows, int index) {
        return index < rows.size() ? rows.get(index) : List.of();
    }

    private static String cell(List<String> row, int col) {
        return col < row.size() ? row.get(col) : "";
    }
}
