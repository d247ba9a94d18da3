package dev.univer.feedback.config;

import dev.univer.feedback.album.AlbumForwarder;
import dev.univer.feedback.service.CommandMenuService;
import dev.univer.feedback.service.TelegramProperties;
import dev.univer.feedback.service.TelegramSender;
import dev.univer.feedback.service.TelegramWrapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.DependsOn;
import org.telegram.telegrambots.meta.TelegramBotsApi;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.generics.BotSession;
import org.telegram.telegrambots.updatesreceivers.DefaultBotSession;

@Configuration
@RequiredArgsConstructor
@Slf4j
public class TelegramBotConfig {

    private final TelegramWrapper telegramWrapper;

    @Bean
    public TelegramBotsApi telegramBotsApi() throws TelegramApiException {
        return new TelegramBotsApi(DefaultBotSession.class);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public AlbumForwarder albumForwarder(TelegramSender sender, TelegramProperties props) {
        return new AlbumForwarder(sender, props.getAlbumWaitTimeout());
    }

    // Polling starts after the album forwarder and is stopped before it, so no update
    // reaches a stopped forwarder.
    @Bean(destroyMethod = "stop")
    @DependsOn("albumForwarder")
    public BotSession botSession(TelegramBotsApi api, CommandMenuService commandMenu) {
        try {
            BotSession session = api.registerBot(telegramWrapper);
            commandMenu.installAll();
            log.info("Bot @{} registered", telegramWrapper.getBotUsername());
            return session;
        } catch (TelegramApiException e) {
            throw new IllegalStateException("Failed to register Telegram bot", e);
        }
    }
}
