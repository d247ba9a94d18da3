package dev.univer.feedback.service;

import dev.univer.feedback.model.BotState;
import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.repo.BotStateRepository;
import dev.univer.feedback.repo.KnownChatRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Service
@RequiredArgsConstructor
public class BotStateService {
    private final BotStateRepository repo;
    private final KnownChatRepository chatRepository;

    @Transactional(readOnly = true)
    public Optional<Long> adminChatId() {
        return read().map(BotState::getAdminChatId);
    }

    @Transactional
    public void setAdminChatId(Long chatId) {
        state().setAdminChatId(chatId);
    }

    @Transactional(readOnly = true)
    public Optional<KnownChat> groupChat() {
        return read().map(BotState::getGroupChatId).flatMap(chatRepository::findById);
    }

    /** Pass {@code null} to forget the group. */
    @Transactional
    public void setGroupChatId(Long chatId) {
        state().setGroupChatId(chatId);
    }

    @Transactional(readOnly = true)
    public Optional<KnownChat> currentChat() {
        return read().map(BotState::getCurrentChatId).flatMap(chatRepository::findById);
    }

    @Transactional
    public void setCurrentChatId(Long chatId) {
        state().setCurrentChatId(chatId);
    }

    @Transactional(readOnly = true)
    public Optional<Long> waitReplyFromId() {
        return read().map(BotState::getWaitReplyFromId);
    }

    @Transactional
    public void setWaitReplyFromId(Long userId) {
        state().setWaitReplyFromId(userId);
    }

    /** Drops the reply target together with the pending reply author. */
    @Transactional
    public void resetReply() {
        BotState s = state();
        s.setWaitReplyFromId(null);
        s.setCurrentChatId(null);
    }

    private Optional<BotState> read() {
        return repo.findById(BotState.SINGLETON_ID);
    }

    private BotState state() {
        return repo.findById(BotState.SINGLETON_ID)
                .orElseGet(() -> repo.save(BotState.builder().id(BotState.SINGLETON_ID).build()));
    }
}
