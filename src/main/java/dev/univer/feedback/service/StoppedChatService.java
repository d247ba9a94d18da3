package dev.univer.feedback.service;

import dev.univer.feedback.model.StoppedChat;
import dev.univer.feedback.repo.StoppedChatRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class StoppedChatService {
    private static final DateTimeFormatter STOPPED_AT_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final StoppedChatRepository repo;
    private final TelegramProperties props;

    @Transactional
    public StoppedChat stop(Long chatId, boolean blocked) {
        StoppedChat s = StoppedChat.builder()
                .chatId(chatId)
                .stoppedAt(Instant.now())
                .blocked(blocked)
                .build();
        return repo.save(s);
    }

    @Transactional(readOnly = true)
    public Optional<StoppedChat> find(Long chatId) {
        return repo.findById(chatId);
    }

    /** @return true if the chat was stopped before */
    @Transactional
    public boolean resume(Long chatId) {
        if (!repo.existsById(chatId)) return false;
        repo.deleteById(chatId);
        return true;
    }

    public String formatStoppedAt(StoppedChat s) {
        return STOPPED_AT_FMT.format(s.getStoppedAt().atZone(props.zone()));
    }
}
