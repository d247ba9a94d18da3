package dev.univer.feedback.service;

import dev.univer.feedback.util.HtmlUtil;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.telegram.telegrambots.meta.api.methods.AnswerCallbackQuery;
import org.telegram.telegrambots.meta.api.methods.CopyMessage;
import org.telegram.telegrambots.meta.api.methods.ForwardMessage;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.commands.DeleteMyCommands;
import org.telegram.telegrambots.meta.api.methods.commands.SetMyCommands;
import org.telegram.telegrambots.meta.api.methods.groupadministration.GetChatMember;
import org.telegram.telegrambots.meta.api.methods.groupadministration.LeaveChat;
import org.telegram.telegrambots.meta.api.methods.send.SendAudio;
import org.telegram.telegrambots.meta.api.methods.send.SendDocument;
import org.telegram.telegrambots.meta.api.methods.send.SendMediaGroup;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.methods.updatingmessages.EditMessageText;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.InputFile;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.commands.BotCommand;
import org.telegram.telegrambots.meta.api.objects.commands.scope.BotCommandScope;
import org.telegram.telegrambots.meta.api.objects.media.InputMedia;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaAudio;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaDocument;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaPhoto;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaVideo;
import org.telegram.telegrambots.meta.api.objects.replykeyboard.InlineKeyboardMarkup;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.List;

@Service
@RequiredArgsConstructor
@Slf4j
public class TelegramSender {
    private static final int FORBIDDEN = 403;

    private final AbsSender sender;

    public void send(Long chatId, String text) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .build();
        sender.execute(sm);
    }

    public void sendHtml(Long chatId, String html) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(html)
                .parseMode(ParseMode.HTML)
                .disableWebPagePreview(true)
                .build();
        sender.execute(sm);
    }

    public void sendMenu(Long chatId, String text, InlineKeyboardMarkup markup) throws TelegramApiException {
        SendMessage sm = SendMessage.builder()
                .chatId(chatId.toString())
                .text(text)
                .replyMarkup(markup)
                .build();
        sender.execute(sm);
    }

    /** Provenance line put in front of content that Telegram forwards without author. */
    public void sendFrom(Long chatId, Chat fromChat) throws TelegramApiException {
        sendHtml(chatId, "От " + HtmlUtil.userLink(fromChat));
    }

    /**
     * Sends album entries as one media group. The Bot API rejects groups of a single item,
     * so a lone entry goes out as the matching single-media message.
     */
    public void sendAlbum(Long chatId, List<InputMedia> media) throws TelegramApiException {
        if (media.isEmpty()) {
            throw new IllegalArgumentException("Album must contain at least one item");
        }
        if (media.size() == 1) {
            sendSingle(chatId, media.get(0));
            return;
        }
        SendMediaGroup group = new SendMediaGroup();
        group.setChatId(chatId.toString());
        group.setMedias(media);
        sender.execute(group);
    }

    private void sendSingle(Long chatId, InputMedia media) throws TelegramApiException {
        InputFile file = new InputFile(media.getMedia());
        if (media instanceof InputMediaPhoto) {
            SendPhoto sp = new SendPhoto();
            sp.setChatId(chatId.toString());
            sp.setPhoto(file);
            sp.setCaption(media.getCaption());
            sp.setCaptionEntities(media.getCaptionEntities());
            sender.execute(sp);
        } else if (media instanceof InputMediaVideo video) {
            SendVideo sv = new SendVideo();
            sv.setChatId(chatId.toString());
            sv.setVideo(file);
            sv.setCaption(video.getCaption());
            sv.setCaptionEntities(video.getCaptionEntities());
            sv.setWidth(video.getWidth());
            sv.setHeight(video.getHeight());
            sv.setDuration(video.getDuration());
            sender.execute(sv);
        } else if (media instanceof InputMediaAudio audio) {
            SendAudio sa = new SendAudio();
            sa.setChatId(chatId.toString());
            sa.setAudio(file);
            sa.setCaption(audio.getCaption());
            sa.setCaptionEntities(audio.getCaptionEntities());
            sa.setDuration(audio.getDuration());
            sa.setPerformer(audio.getPerformer());
            sa.setTitle(audio.getTitle());
            sender.execute(sa);
        } else if (media instanceof InputMediaDocument) {
            SendDocument sd = new SendDocument();
            sd.setChatId(chatId.toString());
            sd.setDocument(file);
            sd.setCaption(media.getCaption());
            sd.setCaptionEntities(media.getCaptionEntities());
            sender.execute(sd);
        } else {
            throw new IllegalArgumentException("Unsupported album item: " + media.getClass().getSimpleName());
        }
    }

    public void copy(Long toChatId, Long fromChatId, Integer messageId) throws TelegramApiException {
        CopyMessage cm = CopyMessage.builder()
                .chatId(toChatId.toString())
                .fromChatId(fromChatId.toString())
                .messageId(messageId)
                .build();
        sender.execute(cm);
    }

    public void forward(Long toChatId, Long fromChatId, Integer messageId) throws TelegramApiException {
        ForwardMessage fm = ForwardMessage.builder()
                .chatId(toChatId.toString())
                .fromChatId(fromChatId.toString())
                .messageId(messageId)
                .build();
        sender.execute(fm);
    }

    public void editText(Long chatId, Integer messageId, String text) throws TelegramApiException {
        edit(chatId, messageId, text, null);
    }

    public void editHtml(Long chatId, Integer messageId, String html) throws TelegramApiException {
        edit(chatId, messageId, html, ParseMode.HTML);
    }

    private void edit(Long chatId, Integer messageId, String text, String parseMode) throws TelegramApiException {
        EditMessageText edit = new EditMessageText();
        edit.setChatId(chatId.toString());
        edit.setMessageId(messageId);
        edit.setText(text);
        edit.setParseMode(parseMode);
        edit.setDisableWebPagePreview(true);
        sender.execute(edit);
    }

    public void answerCallback(String callbackQueryId) throws TelegramApiException {
        sender.execute(AnswerCallbackQuery.builder().callbackQueryId(callbackQueryId).build());
    }

    public void leaveChat(Long chatId) throws TelegramApiException {
        sender.execute(LeaveChat.builder().chatId(chatId.toString()).build());
    }

    public User getMe() throws TelegramApiException {
        return sender.execute(new GetMe());
    }

    public User getChatMember(Long chatId, Long userId) throws TelegramApiException {
        GetChatMember req = GetChatMember.builder().chatId(chatId.toString()).userId(userId).build();
        return sender.execute(req).getUser();
    }

    public void setCommands(List<BotCommand> commands, BotCommandScope scope) throws TelegramApiException {
        SetMyCommands set = new SetMyCommands();
        set.setCommands(commands);
        set.setScope(scope);
        sender.execute(set);
    }

    public void deleteCommands() throws TelegramApiException {
        sender.execute(new DeleteMyCommands());
    }

    /** Bot API answers 403 when the user blocked the bot or the bot was removed from the chat. */
    public static boolean isForbidden(TelegramApiException e) {
        return e instanceof TelegramApiRequestException r
                && r.getErrorCode() != null
                && r.getErrorCode() == FORBIDDEN;
    }
}
