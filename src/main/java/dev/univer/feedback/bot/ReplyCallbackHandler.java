package dev.univer.feedback.bot;

import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.model.StoppedChat;
import dev.univer.feedback.service.BotStateService;
import dev.univer.feedback.service.ChatService;
import dev.univer.feedback.service.StoppedChatService;
import dev.univer.feedback.service.TelegramSender;
import dev.univer.feedback.util.HtmlUtil;
import dev.univer.feedback.util.ParseUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.telegram.telegrambots.meta.api.objects.CallbackQuery;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.util.Optional;

/**
 * Button of the reply menu: makes the chosen user the target of the next operator message.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ReplyCallbackHandler {

    private final ChatService chatService;
    private final BotStateService state;
    private final StoppedChatService stoppedService;
    private final TelegramSender sender;

    public void handle(CallbackQuery query) throws TelegramApiException {
        log.info("Reply callback query from {}", query.getFrom().getId());
        sender.answerCallback(query.getId());

        Message menu = query.getMessage();
        Long targetChatId = ParseUtil.parseReplyChatId(query.getData());
        Optional<KnownChat> target = chatService.find(targetChatId);
        if (target.isEmpty()) {
            sender.editText(menu.getChatId(), menu.getMessageId(), "Ошибка. Сообщение не отправить.");
            log.info("Skip message sending to unknown chat {}", targetChatId);
            return;
        }
        Optional<StoppedChat> stopped = stoppedService.find(targetChatId);
        if (stopped.isPresent()) {
            sender.editHtml(menu.getChatId(), menu.getMessageId(), HtmlUtil.userLink(target.get())
                    + " меня заблокировал " + stoppedService.formatStoppedAt(stopped.get()) + ".");
            return;
        }
        state.setWaitReplyFromId(query.getFrom().getId());
        state.setCurrentChatId(targetChatId);
        sender.editHtml(menu.getChatId(), menu.getMessageId(),
                "Введите сообщение для " + HtmlUtil.userLink(target.get()) + ".");
    }
}
