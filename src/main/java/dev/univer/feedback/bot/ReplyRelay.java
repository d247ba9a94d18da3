package dev.univer.feedback.bot;

import dev.univer.feedback.album.AlbumForwarder;
import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.model.StoppedChat;
import dev.univer.feedback.service.BotStateService;
import dev.univer.feedback.service.ChatService;
import dev.univer.feedback.service.StoppedChatService;
import dev.univer.feedback.service.TelegramSender;
import dev.univer.feedback.util.HtmlUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Optional;

/**
 * Delivers an operator reply (from the admin chat or the group) to the current reply target.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplyRelay {

    private final BotStateService state;
    private final ChatService chatService;
    private final StoppedChatService stoppedService;
    private final AlbumForwarder albumForwarder;
    private final TelegramSender sender;

    public void sendToCurrentUser(Message message) throws TelegramApiException {
        Long fromChatId = message.getChatId();
        Optional<KnownChat> current = state.currentChat();
        if (current.isEmpty() && message.getMediaGroupId() != null) {
            // the first album item already consumed the target, the rest join its album
            albumForwarder.submit(message);
            log.debug("Add next media group item to forwarder");
            return;
        }
        if (current.isEmpty()) {
            sender.send(fromChatId, "Нет текущего пользователя");
            log.debug("Skip message to user: no current user");
            return;
        }
        KnownChat target = current.get();

        Optional<StoppedChat> stopped = stoppedService.find(target.getChatId());
        if (stopped.isPresent()) {
            sender.sendHtml(fromChatId, HtmlUtil.userLink(target) + " меня заблокировал "
                    + stoppedService.formatStoppedAt(stopped.get()) + ".");
            return;
        }

        if (message.getMediaGroupId() != null) {
            albumForwarder.submit(message, target.getChatId(), false);
            log.debug("Add first media group item to forwarder");
            return;
        }

        log.debug("Send message to chat {}", target.getChatId());
        try {
            sender.copy(target.getChatId(), fromChatId, message.getMessageId());
        } catch (TelegramApiException e) {
            if (!TelegramSender.isForbidden(e)) throw e;
            chatService.removeFromRecent(target.getChatId());
            stoppedService.stop(target.getChatId(), true);
            sender.sendHtml(fromChatId, HtmlUtil.userLink(target) + " меня заблокировал.");
            log.info("Blocked by user {}", target.getChatId());
            return;
        }
        sender.sendHtml(fromChatId, "Сообщение отправлено " + HtmlUtil.userLink(target) + ".");
    }
}
