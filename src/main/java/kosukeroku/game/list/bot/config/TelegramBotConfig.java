package kosukeroku.game.list.bot.config;

import kosukeroku.game.list.bot.telegram.GameListBot;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Slf4j
@Configuration
@ConditionalOnProperty(name = "telegram.bot.enabled", havingValue = "true", matchIfMissing = true)
public class TelegramBotConfig {

    // starts long polling once the command context exists
    @Bean
    public TelegramBotsApi telegramBotsApi(GameListBot gameListBot) throws TelegramApiException {
        TelegramBotsApi botsApi = new TelegramBotsApi(DefaultBotSession.class);
        botsApi.registerBot(gameListBot);
        log.info("Registered bot @{}", gameListBot.getBotUsername());
        return botsApi;
    }
}
