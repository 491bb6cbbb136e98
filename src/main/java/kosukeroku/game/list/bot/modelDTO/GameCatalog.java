package kosukeroku.game.list.bot.modelDTO;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

// one fetch of the spreadsheet, never reused across requests
public record GameCatalog(
        Set<String> names,  // valid player columns
        List<Game> games    // spreadsheet row order
) {
    public GameCatalog {
        names = Collections.unmodifiableSet(new LinkedHashSet<>(names));
        games = List.copyOf(games);
    }
}
