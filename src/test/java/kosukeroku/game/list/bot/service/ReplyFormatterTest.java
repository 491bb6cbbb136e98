package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.service.ReplyFormatter.Conjunction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ReplyFormatterTest {

    @Test
    void singleItemIsReturnedVerbatim() {
        assertEquals("Portal", ReplyFormatter.joinWithConjunction(List.of("Portal"), Conjunction.OR));
    }

    @Test
    void twoItemsAreJoinedWithoutComma() {
        assertEquals("Portal and Celeste",
                ReplyFormatter.joinWithConjunction(List.of("Portal", "Celeste"), Conjunction.AND));
    }

    @Test
    void threeOrMoreItemsUseOxfordComma() {
        assertEquals("A, B, C, or D",
                ReplyFormatter.joinWithConjunction(List.of("A", "B", "C", "D"), Conjunction.OR));
        assertEquals("A, B, and C",
                ReplyFormatter.joinWithConjunction(List.of("A", "B", "C"), Conjunction.AND));
    }

    @Test
    void joiningNothingIsAProgrammingError() {
        assertThrows(IllegalArgumentException.class,
                () -> ReplyFormatter.joinWithConjunction(List.of(), Conjunction.AND));
    }

    @Test
    void dedupKeepsFirstOccurrence() {
        assertEquals(List.of(5, 3, 7), ReplyFormatter.dedupPreserveOrder(List.of(5, 3, 5, 7, 3)));
    }

    @Test
    void extractsMentionsInOrderWithDuplicates() {
        assertEquals(List.of(22L, 11L, 22L), ReplyFormatter.extractMentions("<@22> and <@11> <@22> <@x>"));
        assertTrue(ReplyFormatter.extractMentions("nobody here").isEmpty());
    }

    @Test
    void replyPrefixIsDeduplicatedAndSpaceSeparated() {
        assertEquals("<@1> <@2> Perhaps Portal?",
                ReplyFormatter.renderReply(1L, List.of(2L, 1L, 2L), "Perhaps Portal?"));
    }

    @Test
    void multiLineBodyStartsOnItsOwnLine() {
        assertEquals("<@1>\nfirst\nsecond", ReplyFormatter.renderReply(1L, List.of(), "first\nsecond"));
    }

    @Test
    void unresolvedHandlesIgnoreMentionTokensAndEmails() {
        assertEquals(List.of("bob", "carol_1"),
                ReplyFormatter.extractUnresolvedHandles("<@2> @bob and @carol_1, not me@example.com"));
    }
}
