package dev.univer.feedback.repo;

import dev.univer.feedback.model.BotState;
import org.springframework.data.jpa.repository.JpaRepository;

public interface BotStateRepository extends JpaRepository<BotState, Long> {
}
