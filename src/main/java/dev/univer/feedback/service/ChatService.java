package dev.univer.feedback.service;

import dev.univer.feedback.model.KnownChat;
import dev.univer.feedback.model.RecentChat;
import dev.univer.feedback.repo.KnownChatRepository;
import dev.univer.feedback.repo.RecentChatRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.telegram.telegrambots.meta.api.objects.Chat;

import java.util.List;
import java.util.Optional;

/**
 * Known chats and the bounded list of chats the operator can reply to.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class ChatService {
    private final KnownChatRepository chatRepository;
    private final RecentChatRepository recentRepository;
    private final TelegramProperties props;

    @Transactional
    public KnownChat remember(Chat chat) {
        KnownChat known = chatRepository.findById(chat.getId())
                .orElseGet(() -> KnownChat.builder().chatId(chat.getId()).build());
        known.setType(chat.getType());
        known.setTitle(chat.getTitle());
        known.setFirstName(chat.getFirstName());
        known.setLastName(chat.getLastName());
        known.setUserName(chat.getUserName());
        return chatRepository.save(known);
    }

    @Transactional(readOnly = true)
    public Optional<KnownChat> find(Long chatId) {
        return chatRepository.findById(chatId);
    }

    @Transactional(readOnly = true)
    public List<KnownChat> recent() {
        return recentRepository.findAllByOrderByIdAsc().stream()
                .map(RecentChat::getChat)
                .toList();
    }

    /** Appends the chat to the recent list unless present; the oldest entries fall out first. */
    @Transactional
    public void addToRecent(Chat chat) {
        KnownChat known = remember(chat);
        if (recentRepository.existsByChatChatId(known.getChatId())) return;
        recentRepository.save(RecentChat.builder().chat(known).build());

        List<RecentChat> all = recentRepository.findAllByOrderByIdAsc();
        int overflow = all.size() - props.getChatListSize();
        if (overflow > 0) {
            recentRepository.deleteAll(all.subList(0, overflow));
            log.debug("Evicted {} chats from recent list", overflow);
        }
    }

    @Transactional
    public void removeFromRecent(Long chatId) {
        recentRepository.deleteByChatChatId(chatId);
    }
}
