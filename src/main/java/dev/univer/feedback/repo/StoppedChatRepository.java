package dev.univer.feedback.repo;

import dev.univer.feedback.model.StoppedChat;
import org.springframework.data.jpa.repository.JpaRepository;

public interface StoppedChatRepository extends JpaRepository<StoppedChat, Long> {
}
