package dev.univer.feedback.service;

import jakarta.annotation.PostConstruct;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.time.ZoneId;
import java.util.regex.Pattern;

@Configuration
@ConfigurationProperties(prefix = "bot")
@Getter @Setter
public class TelegramProperties {
    private static final Pattern USERNAME = Pattern.compile("[A-Za-z][A-Za-z0-9_]{4,31}");

    private String username;
    private String token;
    private String adminUsername;
    private int chatListSize = 10;
    private String zoneId = "UTC";
    // how long an album may stay silent before it is considered complete
    private Duration albumWaitTimeout = Duration.ofSeconds(1);

    @PostConstruct
    void validate() {
        if (token == null || token.isBlank()) {
            throw new IllegalStateException("Missing required property: bot.token");
        }
        if (username == null || username.isBlank()) {
            throw new IllegalStateException("Missing required property: bot.username");
        }
        if (adminUsername == null || !USERNAME.matcher(adminUsername).matches()) {
            throw new IllegalStateException("bot.admin-username must match " + USERNAME.pattern());
        }
        if (chatListSize < 1 || chatListSize > 20) {
            throw new IllegalStateException("bot.chat-list-size must be within 1..20");
        }
        if (albumWaitTimeout == null || albumWaitTimeout.isNegative() || albumWaitTimeout.isZero()) {
            throw new IllegalStateException("bot.album-wait-timeout must be positive");
        }
        ZoneId.of(zoneId);
    }

    public ZoneId zone() {
        return ZoneId.of(zoneId);
    }
}
