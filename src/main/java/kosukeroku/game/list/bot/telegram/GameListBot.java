package kosukeroku.game.list.bot.telegram;

import kosukeroku.game.list.bot.command.Dispatcher;
import kosukeroku.game.list.bot.command.Reply;
import kosukeroku.game.list.bot.service.IdentityService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

@Component
@Slf4j
public class GameListBot extends TelegramLongPollingBot {

    private final String botUsername;
    private final Dispatcher dispatcher;
    private final IdentityService identityService;

    public GameListBot(
            @Value("${telegram.bot.token}") String botToken,
            @Value("${telegram.bot.username}") String botUsername,
            Dispatcher dispatcher,
            IdentityService identityService) {
        super(botToken);
        this.botUsername = botUsername;
        this.dispatcher = dispatcher;
        this.identityService = identityService;
    }

    @Override
    public String getBotUsername() {
        return botUsername;
    }

    @Override
    public void onUpdateReceived(Update update) {
        try {
            if (update.hasMessage()) {
                handleMessage(update.getMessage());
            }
        } catch (Exception e) {
            log.error("Error processing update: {}", e.getMessage(), e);
        }
    }

    private void handleMessage(Message message) throws TelegramApiException {
        TelegramMessages.Inbound inbound = TelegramMessages.toInbound(message, botUsername,
                identityService::findUserIdByUsername);
        if (inbound == null) {
            return;
        }

        Optional<Reply> reply = dispatcher.dispatch(inbound.message());
        if (reply.isEmpty()) {
            return;
        }

        // names from the chat win over sheet names
        Map<Long, String> displayNames = new HashMap<>(reply.get().displayNames());
        displayNames.putAll(inbound.displayNames());

        SendMessage response = new SendMessage();
        response.setChatId(String.valueOf(message.getChatId()));
        response.setText(TelegramMessages.toMarkdown(reply.get().text(), displayNames));
        response.setParseMode("Markdown");
        response.setReplyToMessageId(message.getMessageId());

        execute(response);

        // lets others @mention this user in later commands, starting with the reply to !iam
        identityService.rememberUsername(inbound.message().senderId(), message.getFrom().getUserName());
    }
}
