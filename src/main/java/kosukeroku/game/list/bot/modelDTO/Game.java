package kosukeroku.game.list.bot.modelDTO;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

public record Game(
        String title,
        String platform,            // null when the cell is blank
        Integer maxPlayers,         // null when no number was found in the cell
        Set<Integer> goodPlayers,   // party sizes the game is best with, null when unknown
        Map<String, Boolean> owns   // player column -> owns the game, in column order
) {
    public Game {
        owns = Collections.unmodifiableMap(new LinkedHashMap<>(owns));
        if (goodPlayers != null) {
            goodPlayers = Collections.unmodifiableSet(new TreeSet<>(goodPlayers));
        }
    }

    public boolean isOwnedBy(String name) {
        return Boolean.TRUE.equals(owns.get(name));
    }

    public boolean hasDetails() {
        return platform != null || maxPlayers != null || goodPlayers != null;
    }
}
