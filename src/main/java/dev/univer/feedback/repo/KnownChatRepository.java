package dev.univer.feedback.repo;

import dev.univer.feedback.model.KnownChat;
import org.springframework.data.jpa.repository.JpaRepository;

public interface KnownChatRepository extends JpaRepository<KnownChat, Long> {
}
