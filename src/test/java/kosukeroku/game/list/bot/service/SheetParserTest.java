package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.exception.SheetLayoutException;
import kosukeroku.game.list.bot.modelDTO.Game;
import kosukeroku.game.list.bot.modelDTO.GameCatalog;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class SheetParserTest {

    private final SheetParser parser = new SheetParser(16);

    private static final List<String> HEADINGS = List.of("Title", "Platform", "Max players", "Good # players", "Who owns?");
    private static final List<String> NOTES = List.of("", "", "", "", "");
    private static final List<String> NAMES = List.of("", "", "", "", "Alice", "Bob", "Carol");

    @Test
    void parsesGamesAndOwnerColumns() {
        List<List<String>> rows = List.of(
                HEADINGS,
                NOTES,
                NAMES,
                List.of(" Portal 2 ", "PC", "2", "2", "x", "x"),
                List.of("Celeste", "", "", "", "", "", "yes"));

        GameCatalog catalog = parser.parse(rows);

        assertEquals(List.of("Alice", "Bob", "Carol"), List.copyOf(catalog.names()));
        assertEquals(2, catalog.games().size());

        Game portal = catalog.games().get(0);
        assertEquals("Portal 2", portal.title());
        assertEquals("PC", portal.platform());
        assertEquals(2, portal.maxPlayers());
        assertEquals(Set.of(2), portal.goodPlayers());
        assertTrue(portal.isOwnedBy("Alice"));
        assertTrue(portal.isOwnedBy("Bob"));
        assertFalse(portal.isOwnedBy("Carol"));

        Game celeste = catalog.games().get(1);
        assertNull(celeste.platform());
        assertNull(celeste.maxPlayers());
        assertNull(celeste.goodPlayers());
        assertFalse(celeste.hasDetails());
        assertTrue(celeste.isOwnedBy("Carol"));
    }

    @Test
    void rowsWithoutTitleAreSkipped() {
        List<List<String>> rows = List.of(HEADINGS, NOTES, NAMES,
                List.of("", "PC", "4"),
                List.of("Real Game"));

        GameCatalog catalog = parser.parse(rows);

        assertEquals(1, catalog.games().size());
        assertEquals("Real Game", catalog.games().get(0).title());
    }

    @Test
    void ownersBlockEndsAtFirstBlankName() {
        List<List<String>> rows = List.of(
                List.of("Title", "Platform", "Max players", "Good players", "Who owns", "", "", ""),
                NOTES,
                List.of("", "", "", "", "Alice", "Bob", "", "Stray"));

        assertEquals(Set.of("Alice", "Bob"), parser.parse(rows).names());
    }

    @Test
    void missingHeadingIsALayoutError() {
        List<List<String>> rows = List.of(List.of("Title", "Platform", "Who owns"), NOTES, NAMES);

        SheetLayoutException e = assertThrows(SheetLayoutException.class, () -> parser.parse(rows));
        assertThat(e.getMessage()).contains("max.+player");
    }

    @Test
    void duplicateHeadingIsALayoutError() {
        List<List<String>> rows = List.of(
                List.of("Title", "Platform", "Max players", "Good players", "Who owns", "Title"), NOTES, NAMES);

        assertThrows(SheetLayoutException.class, () -> parser.parse(rows));
    }

    @Test
    void duplicateOwnerNameIsALayoutError() {
        List<List<String>> rows = List.of(HEADINGS, NOTES, List.of("", "", "", "", "Alice", "Alice"));

        SheetLayoutException e = assertThrows(SheetLayoutException.class, () -> parser.parse(rows));
        assertThat(e.getMessage()).contains("Alice");
    }

    @Test
    void emptySheetIsALayoutError() {
        assertThrows(SheetLayoutException.class, () -> parser.parse(List.of()));
    }

    @Test
    void maxPlayersTakesTheLargestNumber() {
        assertEquals(8, SheetParser.maxNumber("4 (8 with expansion)"));
        assertNull(SheetParser.maxNumber("lots"));
        assertEquals(1234567890, SheetParser.maxNumber("1234567890"));
    }

    @Test
    void goodPlayersRangesAreExpandedAndClipped() {
        assertEquals(Set.of(2, 3, 4), parser.parseGoodPlayers("2-4", 6));
        assertEquals(Set.of(3, 4, 5), parser.parseGoodPlayers("3+", 5));
        assertEquals(Set.of(2, 4, 6), parser.parseGoodPlayers("2-6 even", null));
        assertEquals(Set.of(2, 3), parser.parseGoodPlayers("2-8", 3));
        assertEquals(15, parser.parseGoodPlayers("2+", null).size());
    }

    @Test
    void unusableGoodPlayersBecomeUnknown() {
        assertNull(parser.parseGoodPlayers("", 4));
        assertNull(parser.parseGoodPlayers("3 even", 4));
        assertNull(parser.parseGoodPlayers("6", 4));
    }

    @Test
    void overlongNumbersAreClampedNotSplit() {
        assertEquals(Integer.MAX_VALUE, SheetParser.maxNumber("99999999999 players"));
        assertEquals(Integer.MAX_VALUE, SheetParser.parseClamped("2147483648"));
        assertEquals(7, SheetParser.parseClamped("0000000000007"));
    }

    @Test
    void hugeMaxPlayersStillStopsAtTheCap() {
        assertEquals(15, parser.parseGoodPlayers("2+", Integer.MAX_VALUE).size());
        assertNull(parser.parseGoodPlayers("12345678901+", null));
    }
}
