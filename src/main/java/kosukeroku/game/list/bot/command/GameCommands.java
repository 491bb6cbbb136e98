package kosukeroku.game.list.bot.command;

import kosukeroku.game.list.bot.exception.InvalidArgumentException;
import kosukeroku.game.list.bot.exception.UnknownPlayerException;
import kosukeroku.game.list.bot.exception.UnresolvedMentionException;
import kosukeroku.game.list.bot.modelDTO.Game;
import kosukeroku.game.list.bot.modelDTO.GameCatalog;
import kosukeroku.game.list.bot.service.ReplyFormatter;
import kosukeroku.game.list.bot.service.ReplyFormatter.Conjunction;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Every chat command the bot understands. {@link #createRegistry()} is the only place
 * commands are registered, and the order there is the order {@code !help} lists them in.
 */
public final class GameCommands {

    private static final int DEFAULT_DIE_SIDES = 100;
    private static final Pattern DIGITS_PATTERN = Pattern.compile("[0-9]+");
    private static final int MAX_DIE_DIGITS = 9;

    private GameCommands() {
    }

    public static CommandRegistry createRegistry() {
        return CommandRegistry.builder()
                .register("iam", "<name>", "Tell me your name in the game list", GameCommands::iam)
                .register("whoami", null, "Show the name I know you by", GameCommands::whoami)
                .register("forgetme", null, "Make me forget your name", GameCommands::forgetme)
                .register("sheet", null, "Link to the game list", GameCommands::sheet)
                .register("games", "<@players>", "Games you and the mentioned players can play together", GameCommands::games)
                .register("game", "<@players>", "Pick one game you and the mentioned players can play", GameCommands::game)
                .register("deets", "<title>", "Platform and player counts of a game", GameCommands::deets)
                .register("whohas", "<title>", "Who owns a game", GameCommands::whohas)
                .register("roll", "[sides]", "Roll a die, 100 sides unless told otherwise", GameCommands::roll)
                .register("help", null, "This list", GameCommands::help)
                .build();
    }

    /// //////////////////////////////////////////////
    // IDENTITY
    /// //////////////////////////////////////////////

    static CommandOutcome iam(CommandContext context, long senderId, String args) {
        String name = args.strip();
        if (name.isEmpty()) {
            throw new InvalidArgumentException("Tell me your name as it's written in the game list, like !iam Alice.");
        }

        GameCatalog catalog = context.sheetService().fetch(context.spreadsheetId());
        if (!catalog.names().contains(name)) {
            throw new UnknownPlayerException(name);
        }

        context.identityService().bind(senderId, name);
        return CommandOutcome.reply("OK, you're " + name + " in the game list.");
    }

    static CommandOutcome whoami(CommandContext context, long senderId, String args) {
        String name = context.identityService().requireSheetName(senderId);
        return CommandOutcome.reply("You're " + name + ".");
    }

    static CommandOutcome forgetme(CommandContext context, long senderId, String args) {
        context.identityService().forget(senderId);
        return CommandOutcome.reply("OK, I've forgotten who you are.");
    }

    static CommandOutcome sheet(CommandContext context, long senderId, String args) {
        return CommandOutcome.reply(context.sheetService().spreadsheetUrl(context.spreadsheetId()));
    }

    /// //////////////////////////////////////////////
    // RECOMMENDATIONS
    /// //////////////////////////////////////////////

    static CommandOutcome games(CommandContext context, long senderId, String args) {
        List<Long> mentioned = ReplyFormatter.extractMentions(args);
        List<String> titles = gamesForParty(context, senderId, args, mentioned).stream()
                .map(Game::title)
                .collect(Collectors.toList());
        return CommandOutcome.reply("Perhaps " + ReplyFormatter.joinWithConjunction(titles, Conjunction.OR) + "?", mentioned);
    }

    static CommandOutcome game(CommandContext context, long senderId, String args) {
        List<Long> mentioned = ReplyFormatter.extractMentions(args);
        List<Game> games = gamesForParty(context, senderId, args, mentioned);
        Game pick = games.get(context.random().nextInt(games.size()));
        return CommandOutcome.reply("How about " + pick.title() + "?", mentioned);
    }

    // the sender always plays, identities are read before the spreadsheet is fetched
    private static List<Game> gamesForParty(CommandContext context, long senderId, String args, List<Long> mentioned) {
        List<Long> players = new ArrayList<>();
        players.add(senderId);
        players.addAll(mentioned);

        // usernames nobody has bound to a sheet name are left as plain @handles
        List<String> unresolved = ReplyFormatter.extractUnresolvedHandles(args);
        if (!unresolved.isEmpty()) {
            throw new UnresolvedMentionException(unresolved.get(0));
        }

        Set<String> names = new LinkedHashSet<>();
        for (long playerId : ReplyFormatter.dedupPreserveOrder(players)) {
            names.add(context.identityService().requireSheetName(playerId));
        }

        GameCatalog catalog = context.sheetService().fetch(context.spreadsheetId());
        return context.matchingService().gamesForNames(names, catalog);
    }

    /// //////////////////////////////////////////////
    // GAME LOOKUP
    /// //////////////////////////////////////////////

    static CommandOutcome deets(CommandContext context, long senderId, String args) {
        List<String> lines = lookUp(context, args).stream()
                .map(game -> describe(game, context.partySizeCap()))
                .collect(Collectors.toList());
        return CommandOutcome.reply(String.join("\n", lines));
    }

    static CommandOutcome whohas(CommandContext context, long senderId, String args) {
        List<String> lines = new ArrayList<>();
        Map<Long, String> displayNames = new HashMap<>();
        for (Game game : lookUp(context, args)) {
            List<String> owners = new ArrayList<>();
            for (Map.Entry<String, Boolean> entry : game.owns().entrySet()) {
                if (!entry.getValue()) {
                    continue;
                }
                String name = entry.getKey();
                Optional<Long> ownerId = context.identityService().findUserId(name);
                if (ownerId.isPresent()) {
                    displayNames.put(ownerId.get(), name);
                    owners.add(ReplyFormatter.mention(ownerId.get()));
                } else {
                    owners.add(name);
                }
            }

            if (owners.isEmpty()) {
                lines.add("Nobody owns " + game.title() + ".");
            } else {
                lines.add("Who owns " + game.title() + "? " + ReplyFormatter.joinWithConjunction(owners, Conjunction.AND) + ".");
            }
        }
        return CommandOutcome.reply(String.join("\n", lines), List.of(), displayNames);
    }

    private static List<Game> lookUp(CommandContext context, String title) {
        context.matchingService().requireTitle(title);
        GameCatalog catalog = context.sheetService().fetch(context.spreadsheetId());
        return context.matchingService().matchingGames(title, catalog);
    }

    static String describe(Game game, int partySizeCap) {
        if (!game.hasDetails()) {
            return game.title() + ": details not filled in.";
        }

        List<String> facts = new ArrayList<>();
        if (game.platform() != null) {
            facts.add("platform " + game.platform());
        }
        if (game.maxPlayers() != null) {
            facts.add("max players " + game.maxPlayers());
        }
        if (game.goodPlayers() != null) {
            // counts reaching the cap came from an open-ended cell like "3+"
            boolean openEnded = Collections.max(game.goodPlayers()) >= partySizeCap - 1
                    && (game.maxPlayers() == null || game.maxPlayers() > partySizeCap);
            facts.add("good with " + describePlayerCounts(game.goodPlayers(), openEnded));
        }
        return game.title() + ": " + String.join(", ", facts) + ".";
    }

    // {2, 3, 4, 6} -> "2..4 or 6"; open-ended {3, 4, ..., cap} -> "3+"
    static String describePlayerCounts(Set<Integer> counts, boolean openEnded) {
        TreeSet<Integer> sorted = new TreeSet<>(counts);
        if (openEnded && isEvenRun(sorted)) {
            return sorted.first() + "+ even";
        }

        List<String> runs = new ArrayList<>();
        Integer runStart = null;
        Integer previous = null;
        for (int count : sorted) {
            if (previous != null && count == previous + 1) {
                previous = count;
                continue;
            }
            if (runStart != null) {
                runs.add(formatRun(runStart, previous));
            }
            runStart = count;
            previous = count;
        }
        if (runStart != null) {
            runs.add(openEnded ? runStart + "+" : formatRun(runStart, previous));
        }
        return ReplyFormatter.joinWithConjunction(runs, Conjunction.OR);
    }

    private static boolean isEvenRun(TreeSet<Integer> counts) {
        if (counts.size() < 2 || counts.first() % 2 != 0) {
            return false;
        }
        return counts.last() - counts.first() == 2 * (counts.size() - 1);
    }

    private static String formatRun(int start, int end) {
        return start == end ? String.valueOf(start) : start + ".." + end;
    }

    /// //////////////////////////////////////////////
    // MISC
    /// //////////////////////////////////////////////

    static CommandOutcome roll(CommandContext context, long senderId, String args) {
        int sides = DEFAULT_DIE_SIDES;
        Matcher matcher = DIGITS_PATTERN.matcher(args);
        if (matcher.find()) {
            String digits = matcher.group();
            if (digits.length() > MAX_DIE_DIGITS) {
                throw new InvalidArgumentException("That die is too big for me to roll.");
            }
            sides = Integer.parseInt(digits);
        }
        if (sides < 2) {
            throw new InvalidArgumentException("A die needs at least 2 sides.");
        }

        int result = 1 + context.random().nextInt(sides);
        return CommandOutcome.reply("Rolled " + result + " (1-" + sides + ").");
    }

    static CommandOutcome help(CommandContext context, long senderId, String args) {
        String lines = context.registry().listAll().stream()
                .map(spec -> "!" + spec.name()
                        + (spec.argHint() == null ? "" : " " + spec.argHint())
                        + ": " + spec.helpText())
                .collect(Collectors.joining("\n"));
        return CommandOutcome.reply(lines);
    }
}
