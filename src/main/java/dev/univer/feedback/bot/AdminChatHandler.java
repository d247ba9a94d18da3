package dev.univer.feedback.bot;

import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.service.BotStateService;
import dev.univer.feedback.service.TelegramSender;
import dev.univer.feedback.util.HtmlUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Optional;

/**
 * Private chat with the operator.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class AdminChatHandler {
    static final String HELP = String.join("\n",
            "/help — Помощь",
            "/reply — Ответить пользователю",
            "/add_to_group — Добавить в группу",
            "/remove_from_group — Удалить из группы",
            "/reset — Сбросить состояние");

    private final BotStateService state;
    private final ReplyRelay replyRelay;
    private final ReplyMenu replyMenu;
    private final TelegramSender sender;

    public boolean handleCommand(Message msg, String command) throws TelegramApiException {
        Long chatId = msg.getChatId();
        switch (command) {
            case "start" -> {
                log.info("Start command from admin");
                state.setAdminChatId(chatId);
                sender.send(chatId, HELP);
            }
            case "help" -> {
                log.info("Help command from admin");
                sender.send(chatId, HELP);
            }
            case "reset" -> {
                log.info("Reset command from admin");
                state.resetReply();
                sender.send(chatId, "Состояние сброшено.");
            }
            case "add_to_group" -> addToGroup(chatId);
            case "remove_from_group" -> removeFromGroup(chatId);
            case "reply" -> reply(chatId);
            default -> {
                return false;
            }
        }
        return true;
    }

    private void addToGroup(Long chatId) throws TelegramApiException {
        log.info("Add to group command from admin");
        if (state.groupChat().isPresent()) {
            sender.send(chatId, "Уже в группе.");
            return;
        }
        String link = "tg://resolve?domain=" + sender.getMe().getUserName() + "&startgroup=startgroup";
        sender.sendHtml(chatId, "Для добавления в группу <a href=\"" + link + "\">перейдите по ссылке</a>.");
    }

    private void removeFromGroup(Long chatId) throws TelegramApiException {
        log.info("Remove from group command from admin");
        Optional<KnownChat> group = state.groupChat();
        if (group.isEmpty()) {
            sender.send(chatId, "Не в группе.");
            return;
        }
        try {
            sender.leaveChat(group.get().getChatId());
        } catch (TelegramApiException e) {
            log.error("Leave chat error: {}", e.getMessage());
        }
        sender.sendHtml(chatId, "Удален из группы " + HtmlUtil.bold(group.get().getTitle()) + ".");
        state.setGroupChatId(null);
        state.setCurrentChatId(null);
    }

    private void reply(Long chatId) throws TelegramApiException {
        log.info("Reply command from admin");
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent()) {
            sender.sendHtml(chatId, "Принимаю сообщения в группе " + HtmlUtil.bold(group.get().getTitle()) + ".");
            log.debug("Ignore reply command in private chat");
            return;
        }
        if (state.waitReplyFromId().isPresent()) {
            sender.send(chatId, "Уже жду сообщение.");
            log.debug("Already wait message. Ignore command");
            return;
        }
        replyMenu.send(chatId);
    }

    public void handleMessage(Message msg) throws TelegramApiException {
        log.info("Message from admin, message {}", msg.getMessageId());
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent()) {
            sender.sendHtml(msg.getChatId(), "Принимаю сообщения в группе " + HtmlUtil.bold(group.get().getTitle()) + ".");
            log.info("Ignore message in private chat with admin");
            return;
        }
        if (state.waitReplyFromId().isEmpty() && msg.getMediaGroupId() == null) {
            log.info("Ignore message from admin");
            return;
        }
        replyRelay.sendToCurrentUser(msg);
        state.resetReply();
    }
}
