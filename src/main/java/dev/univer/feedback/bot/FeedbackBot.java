package dev.univer.feedback.bot;

import dev.univer.feedback.service.TelegramProperties;
import dev.univer.feedback.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.Update;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

/**
 * Routes incoming updates: private chats of users, the admin's private chat, the group chat
 * and reply-menu callbacks. Commands go first, then membership events, then plain messages.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FeedbackBot {

    private final TelegramProperties props;
    private final UserChatHandler userHandler;
    private final AdminChatHandler adminHandler;
    private final GroupChatHandler groupHandler;
    private final ReplyCallbackHandler callbackHandler;

    @EventListener
    public void onUpdate(Update update) {
        try { handle(update); } catch (Exception e) { log.error("Error processing update {}", update.getUpdateId(), e); }
    }

    void handle(Update update) throws TelegramApiException {
        if (update.hasCallbackQuery()) {
            CallbackQuery query = update.getCallbackQuery();
            if (ParseUtil.isReplyData(query.getData()) && query.getMessage() != null) {
                callbackHandler.handle(query);
            }
            return;
        }
        if (!update.hasMessage()) return;
        Message msg = update.getMessage();
        Chat chat = msg.getChat();
        if (chat == null || msg.getFrom() == null) return;

        boolean fromAdmin = props.getAdminUsername().equals(msg.getFrom().getUserName());
        String command = ParseUtil.parseCommand(msg.getText());

        if (isPrivate(chat)) {
            if (fromAdmin) {
                if (command != null && adminHandler.handleCommand(msg, command)) return;
                adminHandler.handleMessage(msg);
            } else {
                if (command != null && userHandler.handleCommand(msg, command)) return;
                userHandler.handleMessage(msg);
            }
        } else if (isGroup(chat)) {
            if (command != null && groupHandler.handleCommand(msg, command, fromAdmin)) return;
            if (msg.getNewChatMembers() != null && !msg.getNewChatMembers().isEmpty()) {
                groupHandler.handleNewMembers(msg);
            } else if (msg.getLeftChatMember() != null) {
                groupHandler.handleLeftMember(msg);
            } else {
                groupHandler.handleMessage(msg);
            }
        }
    }

    private static boolean isPrivate(Chat chat) {
        return "private".equals(chat.getType());
    }

    private static boolean isGroup(Chat chat) {
        return "group".equals(chat.getType()) || "supergroup".equals(chat.getType());
    }
}
