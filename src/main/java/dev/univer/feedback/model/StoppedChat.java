package dev.univer.feedback.model;

import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;

@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class StoppedChat {
    @Id
    private Long chatId;

    @Column(nullable = false)
    private Instant stoppedAt;

    // true when Telegram reported that the user blocked the bot, false for /stop
    private boolean blocked;
}
