package dev.univer.feedback.bot;

import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.service.ChatService;
import dev.univer.feedback.service.TelegramSender;
import dev.univer.feedback.util.HtmlUtil;
import dev.univer.feedback.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.buttons.InlineKeyboardButton;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.ArrayList;
import java.util.List;

@Component
@RequiredArgsConstructor
public class ReplyMenu {
    private static final int BUTTONS_PER_ROW = 2;

    private final ChatService chatService;
    private final TelegramSender sender;

    public void send(Long chatId) throws TelegramApiException {
        List<KnownChat> chats = chatService.recent();
        if (chats.isEmpty()) {
            sender.send(chatId, "Некому отвечать.");
            return;
        }
        sender.sendMenu(chatId, "Выберите пользователя для ответа.", keyboard(chats));
    }

    static InlineKeyboardMarkup keyboard(List<KnownChat> chats) {
        List<List<InlineKeyboardButton>> rows = new ArrayList<>();
        for (int i = 0; i < chats.size(); i += BUTTONS_PER_ROW) {
            List<InlineKeyboardButton> row = new ArrayList<>();
            for (KnownChat chat : chats.subList(i, Math.min(i + BUTTONS_PER_ROW, chats.size()))) {
                InlineKeyboardButton btn = new InlineKeyboardButton(HtmlUtil.userName(chat));
                btn.setCallbackData(ParseUtil.replyData(chat.getChatId()));
                row.add(btn);
            }
            rows.add(row);
        }
        return new InlineKeyboardMarkup(rows);
    }
}
