package dev.univer.feedback.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.bots.TelegramLongPollingBot;
import org.telegram.telegrambots.meta.api.objects.Update;

/**
 * Long polling entry point. Hands messages and button presses over to the {@code bot} package
 * as Spring events; edits, channel posts and other update kinds are not relayed.
 */
@Component
@Slf4j
public class TelegramWrapper extends TelegramLongPollingBot {

    private final TelegramProperties props;
    private final ApplicationEventPublisher publisher;

    public TelegramWrapper(TelegramProperties props, ApplicationEventPublisher publisher) {
        super(props.getToken());
        this.props = props;
        this.publisher = publisher;
    }

    @Override
    public String getBotUsername() {
        return props.getUsername();
    }

    @Override
    public void onUpdateReceived(Update update) {
        if (!update.hasMessage() && !update.hasCallbackQuery()) {
            log.debug("Skip update {} without message or callback", update.getUpdateId());
            return;
        }
        log.debug("Incoming update: {}", update.getUpdateId());
        publisher.publishEvent(update);
    }
}
