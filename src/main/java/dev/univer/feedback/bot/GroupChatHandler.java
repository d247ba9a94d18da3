package dev.univer.feedback.bot;

import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.service.BotStateService;
import dev.univer.feedback.service.ChatService;
import dev.univer.feedback.service.CommandMenuService;
import dev.univer.feedback.service.TelegramSender;
import dev.univer.feedback.util.HtmlUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Objects;
import java.util.Optional;

/**
 * Group chat where operators read feedback and reply to users.
 * Only one group is served; the bot leaves any other group it finds itself in.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class GroupChatHandler {
    static final String HELP = String.join("\n",
            "/help — Помощь",
            "/reply — Ответить пользователю");

    private final BotStateService state;
    private final ChatService chatService;
    private final ReplyRelay replyRelay;
    private final ReplyMenu replyMenu;
    private final CommandMenuService commandMenu;
    private final TelegramSender sender;

    public boolean handleCommand(Message msg, String command, boolean fromAdmin) throws TelegramApiException {
        switch (command) {
            case "start" -> {
                if (!fromAdmin) return false;
                start(msg);
            }
            case "help" -> {
                log.info("Help command in group from {}", msg.getFrom().getId());
                sender.send(msg.getChatId(), HELP);
            }
            case "reply" -> reply(msg);
            default -> {
                return false;
            }
        }
        return true;
    }

    private void start(Message msg) throws TelegramApiException {
        Chat chat = msg.getChat();
        log.info("Start command in group {} from admin", chat.getId());
        if (state.groupChat().isPresent()) {
            log.info("Attempt start in group {}", chat.getId());
            return;
        }
        chatService.remember(chat);
        state.setGroupChatId(chat.getId());
        state.setCurrentChatId(null);
        commandMenu.installGroup(chat.getId());

        Optional<Long> adminChatId = state.adminChatId();
        if (adminChatId.isEmpty()) {
            sender.send(msg.getFrom().getId(), "Что-то сломалось внутри бота.");
            log.error("Admin chat id is not set");
            return;
        }
        sender.sendHtml(adminChatId.get(), "Запущен в " + HtmlUtil.bold(chat.getTitle()) + ".");
        log.info("Started in group {}", chat.getId());
    }

    private void reply(Message msg) throws TelegramApiException {
        Long chatId = msg.getChatId();
        log.info("Reply command in group from {}", msg.getFrom().getId());
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent() && !group.get().getChatId().equals(chatId)) {
            sender.leaveChat(chatId);
            return;
        }
        if (group.isEmpty()) {
            sender.send(chatId, "Не принимаю сообщения.");
            log.debug("Ignore reply command in group");
            return;
        }
        Optional<Long> waitReplyFromId = state.waitReplyFromId();
        if (waitReplyFromId.isPresent()) {
            User member = sender.getChatMember(chatId, waitReplyFromId.get());
            String memberLink = member.getUserName() == null
                    ? HtmlUtil.userLink(member)
                    : "@" + member.getUserName();
            sender.sendHtml(chatId, "Уже жду сообщение от " + memberLink + ".");
            log.debug("Already wait message. Ignore command");
            return;
        }
        replyMenu.send(chatId);
    }

    public void handleNewMembers(Message msg) throws TelegramApiException {
        Chat chat = msg.getChat();
        log.info("New group members in chat {}", chat.getId());
        User me = sender.getMe();
        Optional<Long> adminChatId = state.adminChatId();
        if (adminChatId.isEmpty()) {
            log.error("Admin chat id is not set");
            return;
        }
        boolean botAdded = msg.getNewChatMembers().stream().anyMatch(u -> u.getId().equals(me.getId()));
        if (!botAdded) return;

        sender.sendHtml(adminChatId.get(), "Добавлен в группу " + HtmlUtil.bold(chat.getTitle()) + ".");
        log.info("Bot added to group {}", chat.getId());
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent() && !group.get().getChatId().equals(chat.getId())) {
            sender.leaveChat(chat.getId());
        } else if (group.isPresent()) {
            commandMenu.installGroup(chat.getId());
        }
    }

    public void handleLeftMember(Message msg) throws TelegramApiException {
        Chat chat = msg.getChat();
        log.info("Left group member in chat {}", chat.getId());
        User me = sender.getMe();
        Optional<Long> adminChatId = state.adminChatId();
        if (adminChatId.isEmpty()) {
            log.error("Admin chat id is not set");
            return;
        }
        if (!msg.getLeftChatMember().getId().equals(me.getId())) return;

        sender.sendHtml(adminChatId.get(), "Вышел из группы " + HtmlUtil.bold(chat.getTitle()) + ".");
        log.info("Leave chat {}", chat.getId());
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent() && group.get().getChatId().equals(chat.getId())) {
            state.setGroupChatId(null);
            log.info("Forget chat {}", chat.getId());
        }
    }

    public void handleMessage(Message msg) throws TelegramApiException {
        Long chatId = msg.getChatId();
        Long fromId = msg.getFrom().getId();
        log.info("Reply message in group from {}", fromId);
        Optional<KnownChat> group = state.groupChat();
        if (group.isPresent() && !group.get().getChatId().equals(chatId)) {
            sender.leaveChat(chatId);
            return;
        }
        Long waitReplyFromId = state.waitReplyFromId().orElse(null);
        if (!Objects.equals(waitReplyFromId, fromId) && msg.getMediaGroupId() == null) {
            log.info("Ignore message in group {} from {}", chatId, fromId);
            return;
        }
        replyRelay.sendToCurrentUser(msg);
        state.resetReply();
    }
}
