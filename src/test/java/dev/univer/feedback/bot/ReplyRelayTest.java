package dev.univer.feedback.bot;

import dev.univer.feedback.album.AlbumForwarder;
import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.model.StoppedChat;
import dev.univer.feedback.service.BotStateService;
import dev.univer.feedback.service.ChatService;
import dev.univer.feedback.service.StoppedChatService;
import dev.univer.feedback.service.TelegramSender;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;
import org.telegram.telegrambots.meta.exceptions.TelegramApiRequestException;

import java.time.Instant;
import java.util.Optional;

import static dev.univer.feedback.testsupport.TestMessages.albumPhoto;
import static dev.univer.feedback.testsupport.TestMessages.privateChat;
import static dev.univer.feedback.testsupport.TestMessages.text;
import static dev.univer.feedback.testsupport.TestMessages.user;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ReplyRelayTest {

    private static final String TARGET_LINK = "<a href=\"tg://user?id=10\">Ivan</a>";

    private BotStateService state;
    private ChatService chatService;
    private StoppedChatService stoppedService;
    private AlbumForwarder albumForwarder;
    private TelegramSender sender;
    private ReplyRelay relay;

    private final Chat adminChat = privateChat(5L, "Operator");
    private final KnownChat target = KnownChat.builder().chatId(10L).type("private").firstName("Ivan").build();

    @BeforeEach
    void setUp() {
        state = mock(BotStateService.class);
        chatService = mock(ChatService.class);
        stoppedService = mock(StoppedChatService.class);
        albumForwarder = mock(AlbumForwarder.class);
        sender = mock(TelegramSender.class);
        relay = new ReplyRelay(state, chatService, stoppedService, albumForwarder, sender);
        when(stoppedService.find(anyLong())).thenReturn(Optional.empty());
    }

    private Message reply() {
        return text(adminChat, user(5L, "Operator", "operator"), "hello");
    }

    @Test
    void shouldCopyReplyAndConfirm() throws Exception {
        when(state.currentChat()).thenReturn(Optional.of(target));
        Message msg = reply();

        relay.sendToCurrentUser(msg);

        verify(sender).copy(10L, 5L, msg.getMessageId());
        verify(sender).sendHtml(5L, "Сообщение отправлено " + TARGET_LINK + ".");
    }

    @Test
    void shouldComplainWithoutCurrentUser() throws Exception {
        when(state.currentChat()).thenReturn(Optional.empty());

        relay.sendToCurrentUser(reply());

        verify(sender).send(5L, "Нет текущего пользователя");
        verify(sender, never()).copy(any(), any(), any());
    }

    @Test
    void shouldStartAlbumForCurrentUser() throws Exception {
        when(state.currentChat()).thenReturn(Optional.of(target));
        Message item = albumPhoto(adminChat, "g1", "p");

        relay.sendToCurrentUser(item);

        verify(albumForwarder).submit(item, 10L, false);
        verify(sender, never()).copy(any(), any(), any());
    }

    @Test
    void shouldPassFollowingAlbumItemsToForwarder() throws Exception {
        when(state.currentChat()).thenReturn(Optional.empty());
        Message item = albumPhoto(adminChat, "g1", "p");

        relay.sendToCurrentUser(item);

        verify(albumForwarder).submit(item);
        verify(sender, never()).send(anyLong(), any());
    }

    @Test
    void shouldRefuseStoppedUser() throws Exception {
        StoppedChat stopped = StoppedChat.builder().chatId(10L).stoppedAt(Instant.EPOCH).build();
        when(state.currentChat()).thenReturn(Optional.of(target));
        when(stoppedService.find(10L)).thenReturn(Optional.of(stopped));
        when(stoppedService.formatStoppedAt(stopped)).thenReturn("1970-01-01 00:00:00 UTC");

        relay.sendToCurrentUser(albumPhoto(adminChat, "g1", "p"));

        verify(sender).sendHtml(5L, TARGET_LINK + " меня заблокировал 1970-01-01 00:00:00 UTC.");
        verify(albumForwarder, never()).submit(any(), any(), anyBoolean());
    }

    @Test
    void shouldMarkUserStoppedWhenTelegramForbidsDelivery() throws Exception {
        TelegramApiRequestException forbidden = mock(TelegramApiRequestException.class);
        when(forbidden.getErrorCode()).thenReturn(403);
        when(state.currentChat()).thenReturn(Optional.of(target));
        Message msg = reply();
        doThrow(forbidden).when(sender).copy(10L, 5L, msg.getMessageId());

        relay.sendToCurrentUser(msg);

        verify(chatService).removeFromRecent(10L);
        verify(stoppedService).stop(10L, true);
        verify(sender).sendHtml(5L, TARGET_LINK + " меня заблокировал.");
    }

    @Test
    void shouldPropagateOtherDeliveryErrors() throws Exception {
        when(state.currentChat()).thenReturn(Optional.of(target));
        Message msg = reply();
        doThrow(new TelegramApiException("timeout")).when(sender).copy(10L, 5L, msg.getMessageId());

        assertThrows(TelegramApiException.class, () -> relay.sendToCurrentUser(msg));
        verify(stoppedService, never()).stop(any(), anyBoolean());
    }
}
