package kosukeroku.game.list.bot.config;

import kosukeroku.game.list.bot.command.CommandContext;
import kosukeroku.game.list.bot.command.CommandRegistry;
import kosukeroku.game.list.bot.command.GameCommands;
import kosukeroku.game.list.bot.service.IdentityService;
import kosukeroku.game.list.bot.service.MatchingService;
import kosukeroku.game.list.bot.service.SheetService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.security.SecureRandom;

@Configuration
public class CommandConfig {

    @Bean
    public CommandRegistry commandRegistry() {
        return GameCommands.createRegistry();
    }

    @Bean
    public CommandContext commandContext(
            IdentityService identityService,
            SheetService sheetService,
            MatchingService matchingService,
            CommandRegistry commandRegistry,
            @Value("${game-list.spreadsheet-id}") String spreadsheetId,
            @Value("${game-list.sheet.party-size-cap:100}") int partySizeCap) {
        return new CommandContext(identityService, sheetService, matchingService, commandRegistry,
                spreadsheetId, partySizeCap, new SecureRandom());
    }
}
