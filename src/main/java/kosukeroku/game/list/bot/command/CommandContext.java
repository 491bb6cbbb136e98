package kosukeroku.game.list.bot.command;

import kosukeroku.game.list.bot.service.IdentityService;
import kosukeroku.game.list.bot.service.MatchingService;
import kosukeroku.game.list.bot.service.SheetService;

import java.util.Random;

// built once at startup and handed to every command
public record CommandContext(
        IdentityService identityService,
        SheetService sheetService,
        MatchingService matchingService,
        CommandRegistry registry,
        String spreadsheetId,
        int partySizeCap, // good player counts never go past this
        Random random
) {}
