package dev.univer.feedback.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Last seen snapshot of a Telegram chat the bot talks to.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class KnownChat {
    @Id
    private Long chatId;

    private String type; // private, group, supergroup
    private String title;
    private String firstName;
    private String lastName;
    private String userName;
}
