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
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Optional;

/**
 * Private chats with users who leave feedback.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class UserChatHandler {
    static final String HELP = String.join("\n",
            "Пришлите сообщение или задайте вопрос.",
            "",
            "Также вы можете использовать следующие команды:",
            "/help — Помощь",
            "/stop — Остановить и не получать больше сообщения");

    private final ChatService chatService;
    private final BotStateService state;
    private final StoppedChatService stoppedService;
    private final AlbumForwarder albumForwarder;
    private final TelegramSender sender;

    /** @return false if the command is not a user command and should be handled as a message */
    public boolean handleCommand(Message msg, String command) throws TelegramApiException {
        switch (command) {
            case "start" -> start(msg);
            case "help" -> {
                log.info("Help command from user {}", msg.getFrom().getId());
                sender.send(msg.getChatId(), HELP);
            }
            case "stop" -> stop(msg);
            default -> {
                return false;
            }
        }
        return true;
    }

    private void start(Message msg) throws TelegramApiException {
        log.info("Start command from user {}", msg.getFrom().getId());
        resumeIfStopped(msg);
        chatService.remember(msg.getChat());
        sender.send(msg.getChatId(), HELP);
    }

    private void stop(Message msg) throws TelegramApiException {
        User from = msg.getFrom();
        Long userChatId = from.getId();
        log.info("Stop command from user {}", userChatId);
        StoppedChat stopped = stoppedService.stop(userChatId, false);
        chatService.removeFromRecent(userChatId);

        Optional<Long> notifyChatId = operatorChatId();
        if (notifyChatId.isEmpty()) {
            log.error("Admin chat id is not set");
            return;
        }
        sender.sendHtml(notifyChatId.get(), HtmlUtil.userLink(from) + " меня заблокировал "
                + stoppedService.formatStoppedAt(stopped) + ".");

        Optional<KnownChat> current = state.currentChat();
        if (current.isPresent() && current.get().getChatId().equals(userChatId)) {
            state.resetReply();
        }
    }

    public void handleMessage(Message msg) throws TelegramApiException {
        log.info("Message from user {}", msg.getFrom().getId());
        chatService.remember(msg.getChat());
        resumeIfStopped(msg);

        Optional<Long> forwardChatId = operatorChatId();
        if (forwardChatId.isEmpty()) {
            sender.send(msg.getFrom().getId(), "Что-то сломалось внутри бота.");
            log.error("Admin chat id is not set");
            return;
        }
        Long destination = forwardChatId.get();

        // forwarded audio and stickers do not show their author
        if (msg.getAudio() != null || msg.getSticker() != null) {
            sender.sendFrom(destination, msg.getChat());
        }

        if (msg.getMediaGroupId() != null) {
            albumForwarder.submit(msg, destination, true);
        } else {
            sender.forward(destination, msg.getChatId(), msg.getMessageId());
        }

        chatService.addToRecent(msg.getChat());
    }

    private void resumeIfStopped(Message msg) throws TelegramApiException {
        if (stoppedService.resume(msg.getChatId())) {
            sender.send(msg.getChatId(), "С возвращением!");
        }
    }

    /** Group chat when the bot works in a group, otherwise the admin's private chat. */
    private Optional<Long> operatorChatId() {
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent()) {
            return Optional.of(group.get().getChatId());
        }
        return state.adminChatId();
    }
}
