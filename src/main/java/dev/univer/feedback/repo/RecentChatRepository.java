package dev.univer.feedback.repo;

import dev.univer.feedback.model.RecentChat;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface RecentChatRepository extends JpaRepository<RecentChat, Long> {
    List<RecentChat> findAllByOrderByIdAsc();
    boolean existsByChatChatId(Long chatId);
    void deleteByChatChatId(Long chatId);
}
