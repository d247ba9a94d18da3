package dev.univer.feedback.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeAllPrivateChats;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScopeChat;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.List;

/**
 * Installs the "/" command menus: one for users, one for the admin chat and one for the group.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class CommandMenuService {
    public static final List<BotCommand> USER_COMMANDS = List.of(
            new BotCommand("help", "Помощь"),
            new BotCommand("stop", "Остановить и не получать больше сообщения")
    );
    public static final List<BotCommand> ADMIN_COMMANDS = List.of(
            new BotCommand("help", "Помощь"),
            new BotCommand("reply", "Ответить пользователю"),
            new BotCommand("add_to_group", "Добавить в группу"),
            new BotCommand("remove_from_group", "Удалить из группы"),
            new BotCommand("reset", "Сбросить состояние")
    );
    public static final List<BotCommand> GROUP_COMMANDS = List.of(
            new BotCommand("help", "Помощь"),
            new BotCommand("reply", "Ответить пользователю")
    );

    private final TelegramSender sender;
    private final BotStateService state;

    public void installAll() throws TelegramApiException {
        sender.deleteCommands();
        sender.setCommands(USER_COMMANDS, new BotCommandScopeAllPrivateChats());
        var adminChatId = state.adminChatId();
        if (adminChatId.isPresent()) {
            sender.setCommands(ADMIN_COMMANDS, chatScope(adminChatId.get()));
        }
        var groupChat = state.groupChat();
        if (groupChat.isPresent()) {
            try {
                installGroup(groupChat.get().getChatId());
            } catch (TelegramApiException e) {
                if (!TelegramSender.isForbidden(e)) throw e;
                log.info("Can't set commands in chat {}: {}", groupChat.get().getChatId(), e.getMessage());
            }
        }
        log.info("Bot commands installed");
    }

    public void installGroup(Long groupChatId) throws TelegramApiException {
        sender.setCommands(GROUP_COMMANDS, chatScope(groupChatId));
    }

    private static BotCommandScopeChat chatScope(Long chatId) {
        return BotCommandScopeChat.builder().chatId(chatId.toString()).build();
    }
}
