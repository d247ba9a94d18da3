package dev.univer.feedback.service;

import dev.univer.feedback.model.StoppedChat;
import dev.univer.feedback.repo.StoppedChatRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DataJpaTest
class StoppedChatServiceTest {

    @Autowired
    private StoppedChatRepository repo;

    private TelegramProperties props;
    private StoppedChatService stoppedService;

    @BeforeEach
    void setUp() {
        props = new TelegramProperties();
        stoppedService = new StoppedChatService(repo, props);
    }

    @Test
    void shouldRememberStopAndResumeOnce() {
        stoppedService.stop(10L, false);

        StoppedChat stopped = stoppedService.find(10L).orElseThrow();
        assertFalse(stopped.isBlocked());
        assertTrue(stoppedService.resume(10L));
        assertFalse(stoppedService.resume(10L));
        assertTrue(stoppedService.find(10L).isEmpty());
    }

    @Test
    void shouldOverwritePreviousStop() {
        stoppedService.stop(10L, false);
        stoppedService.stop(10L, true);

        assertTrue(stoppedService.find(10L).orElseThrow().isBlocked());
        assertEquals(1, repo.count());
    }

    @Test
    void shouldFormatStopTimeInConfiguredZone() {
        StoppedChat stopped = StoppedChat.builder()
                .chatId(1L)
                .stoppedAt(Instant.parse("2024-03-01T21:30:00Z"))
                .build();

        assertEquals("2024-03-01 21:30:00 UTC", stoppedService.formatStoppedAt(stopped));
        props.setZoneId("Europe/Moscow");
        assertTrue(stoppedService.formatStoppedAt(stopped).startsWith("2024-03-02 00:30:00 "));
    }
}
