package kosukeroku.game.list.bot.service;

import kosukeroku.game.list.bot.exception.InvalidArgumentException;
import kosukeroku.game.list.bot.exception.NoMatchingGamesException;
import kosukeroku.game.list.bot.exception.UnknownPlayerException;
import kosukeroku.game.list.bot.modelDTO.Game;
import kosukeroku.game.list.bot.modelDTO.GameCatalog;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Predicate;
import java.util.stream.Collectors;

@Slf4j
@Service
public class MatchingService {

    /// //////////////////////////////////////////////
    // RECOMMENDATIONS FOR A PARTY
    /// //////////////////////////////////////////////

    // games rated good for the party size first, then anything everyone owns and that fits the party
    public List<Game> gamesForNames(Set<String> names, GameCatalog catalog) {
        if (names.isEmpty()) {
            throw new IllegalArgumentException("A party needs at least one player");
        }

        // column names are matched case-sensitively
        for (String name : names) {
            if (!catalog.names().contains(name)) {
                throw new UnknownPlayerException(name);
            }
        }

        int partySize = names.size();
        Predicate<Game> ok = game -> names.stream().allMatch(game::isOwnedBy)
                && (game.maxPlayers() == null || partySize <= game.maxPlayers());
        Predicate<Game> good = ok.and(game -> game.goodPlayers() == null
                || game.goodPlayers().contains(partySize));

        List<Game> goodGames = filter(catalog.games(), good);
        if (!goodGames.isEmpty()) {
            log.info("Found {} good games for {} players", goodGames.size(), partySize);
            return goodGames;
        }

        List<Game> okGames = filter(catalog.games(), ok);
        if (!okGames.isEmpty()) {
            log.info("No good games for {} players, falling back to {} playable ones", partySize, okGames.size());
            return okGames;
        }

        throw new NoMatchingGamesException();
    }

    /// //////////////////////////////////////////////
    // TITLE LOOKUP
    /// //////////////////////////////////////////////

    // titles are matched case-insensitively, unlike player names
    public List<Game> matchingGames(String title, GameCatalog catalog) {
        requireTitle(title);

        String needle = title.toLowerCase(Locale.ROOT);
        List<Game> matches = filter(catalog.games(),
                game -> game.title().toLowerCase(Locale.ROOT).contains(needle));

        if (matches.isEmpty()) {
            throw new NoMatchingGamesException(title);
        }
        return matches;
    }

    public void requireTitle(String title) {
        if (title == null || title.isBlank()) {
            throw new InvalidArgumentException("Which game? Give me (part of) its title.");
        }
    }

    private static List<Game> filter(List<Game> games, Predicate<Game> predicate) {
        return games.stream()
                .filter(predicate)
                .collect(Collectors.toList());
    }
}
