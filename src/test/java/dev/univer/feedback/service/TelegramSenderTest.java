package dev.univer.feedback.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.telegram.telegrambots.meta.api.methods.GetMe;
import org.telegram.telegrambots.meta.api.methods.ParseMode;
import org.telegram.telegrambots.meta.api.methods.send.SendMediaGroup;
import org.telegram.telegrambots.meta.api.methods.send.SendMessage;
import org.telegram.telegrambots.meta.api.methods.send.SendPhoto;
import org.telegram.telegrambots.meta.api.methods.send.SendVideo;
import org.telegram.telegrambots.meta.api.objects.User;
import org.telegram.telegrambots.meta.api.objects.media.InputMedia;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaPhoto;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaVideo;
import org.telegram.telegrambots.meta.bots.AbsSender;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.util.List;

import static dev.univer.feedback.testsupport.TestMessages.privateChat;
import static dev.univer.feedback.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class TelegramSenderTest {

    private AbsSender absSender;
    private TelegramSender sender;

    @BeforeEach
    void setUp() {
        absSender = mock(AbsSender.class);
        sender = new TelegramSender(absSender);
    }

    private static InputMediaPhoto photo(String fileId, String caption) {
        InputMediaPhoto photo = new InputMediaPhoto();
        photo.setMedia(fileId);
        photo.setCaption(caption);
        return photo;
    }

    @Test
    void shouldSendSeveralItemsAsMediaGroup() throws Exception {
        List<InputMedia> media = List.of(photo("a", null), photo("b", "second"));

        sender.sendAlbum(42L, media);

        ArgumentCaptor<SendMediaGroup> captor = ArgumentCaptor.forClass(SendMediaGroup.class);
        verify(absSender).execute(captor.capture());
        assertEquals("42", captor.getValue().getChatId());
        assertEquals(media, captor.getValue().getMedias());
    }

    @Test
    void shouldSendSinglePhotoAsPlainPhoto() throws Exception {
        sender.sendAlbum(42L, List.of(photo("a", "only one")));

        ArgumentCaptor<SendPhoto> captor = ArgumentCaptor.forClass(SendPhoto.class);
        verify(absSender).execute(captor.capture());
        assertEquals("a", captor.getValue().getPhoto().getAttachName());
        assertEquals("only one", captor.getValue().getCaption());
        verify(absSender, never()).execute(any(SendMediaGroup.class));
    }

    @Test
    void shouldSendSingleVideoWithItsAttributes() throws Exception {
        InputMediaVideo video = new InputMediaVideo();
        video.setMedia("clip");
        video.setWidth(640);
        video.setHeight(480);
        video.setDuration(7);

        sender.sendAlbum(42L, List.of(video));

        ArgumentCaptor<SendVideo> captor = ArgumentCaptor.forClass(SendVideo.class);
        verify(absSender).execute(captor.capture());
        assertEquals("clip", captor.getValue().getVideo().getAttachName());
        assertEquals(640, captor.getValue().getWidth());
        assertEquals(7, captor.getValue().getDuration());
    }

    @Test
    void shouldRejectEmptyAlbum() {
        assertThrows(IllegalArgumentException.class, () -> sender.sendAlbum(42L, List.of()));
        verifyNoInteractions(absSender);
    }

    @Test
    void shouldSendProvenanceLineAsHtml() throws Exception {
        sender.sendFrom(7L, privateChat(100L, "Ivan <Admin>"));

        ArgumentCaptor<SendMessage> captor = ArgumentCaptor.forClass(SendMessage.class);
        verify(absSender).execute(captor.capture());
        SendMessage sent = captor.getValue();
        assertEquals("7", sent.getChatId());
        assertEquals(ParseMode.HTML, sent.getParseMode());
        assertEquals("От <a href=\"tg://user?id=100\">Ivan &lt;Admin&gt;</a>", sent.getText());
    }

    @Test
    void shouldRecognizeForbiddenAnswer() {
        TelegramApiRequestException forbidden = mock(TelegramApiRequestException.class);
        when(forbidden.getErrorCode()).thenReturn(403);
        TelegramApiRequestException badRequest = mock(TelegramApiRequestException.class);
        when(badRequest.getErrorCode()).thenReturn(400);

        assertTrue(TelegramSender.isForbidden(forbidden));
        assertFalse(TelegramSender.isForbidden(badRequest));
        assertFalse(TelegramSender.isForbidden(new TelegramApiException("network")));
    }

    @Test
    void shouldAskTelegramForBotUser() throws Exception {
        User me = user(1L, "Feedback", "feedback_bot");
        when(absSender.execute(any(GetMe.class))).thenReturn(me);

        assertSame(me, sender.getMe());
    }
}
