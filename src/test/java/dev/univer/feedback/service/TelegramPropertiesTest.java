package dev.univer.feedback.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.DateTimeException;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TelegramPropertiesTest {

    private TelegramProperties props;

    @BeforeEach
    void setUp() {
        props = new TelegramProperties();
        props.setUsername("feedback_bot");
        props.setToken("123:abc");
        props.setAdminUsername("operator");
    }

    @Test
    void shouldAcceptDefaults() {
        assertDoesNotThrow(() -> props.validate());
    }

    @Test
    void shouldRequireToken() {
        props.setToken(" ");

        assertThrows(IllegalStateException.class, () -> props.validate());
    }

    @Test
    void shouldRejectMalformedAdminUsername() {
        props.setAdminUsername("@op");

        assertThrows(IllegalStateException.class, () -> props.validate());
    }

    @Test
    void shouldLimitChatListSize() {
        props.setChatListSize(21);

        assertThrows(IllegalStateException.class, () -> props.validate());
    }

    @Test
    void shouldRequirePositiveAlbumWaitTimeout() {
        props.setAlbumWaitTimeout(Duration.ZERO);

        assertThrows(IllegalStateException.class, () -> props.validate());
    }

    @Test
    void shouldRejectUnknownZone() {
        props.setZoneId("Mars/Olympus");

        assertThrows(DateTimeException.class, () -> props.validate());
    }
}
