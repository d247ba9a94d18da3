package dev.univer.feedback.model;

import jakarta.persistence.*;
import lombok.*;

/**
 * Routing flags of the bot. The table always holds a single row.
 */
@Entity
@Getter @Setter @NoArgsConstructor @AllArgsConstructor @Builder
public class BotState {
    public static final Long SINGLETON_ID = 1L;

    @Id
    private Long id;

    // private chat with the operator, known after the operator's /start
    private Long adminChatId;

    // group that receives feedback instead of the admin chat
    private Long groupChatId;

    // chat the next operator reply goes to
    private Long currentChatId;

    // user id whose next message is the reply
    private Long waitReplyFromId;
}
