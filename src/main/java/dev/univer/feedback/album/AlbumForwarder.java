package dev.univer.feedback.album;

import dev.univer.feedback.service.TelegramSender;
import lombok.extern.slf4j.Slf4j;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.media.InputMedia;
import org.telegram.telegrambots.meta.exceptions.TelegramApiException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * Collects the messages of a Telegram album (media group) and forwards them as one media group.
 * <p>
 * Telegram delivers every album item as a separate update and never says that an album is
 * over. Each new group gets its own assembly job, which keeps reading the group's queue until
 * no item arrives within {@code waitTimeout}. The first item of a group decides where the album
 * goes; items of a group without a pending session are dropped unless they carry a destination.
 * <p>
 * Must be {@link #start() started} before {@link #submit} and {@link #stop() stopped} on shutdown.
 */
@Slf4j
public class AlbumForwarder {

    private final TelegramSender sender;
    private final Duration waitTimeout;

    // guards sessions and the hand-over between a submitting thread and a finishing job
    private final Object lock = new Object();
    private final Map<String, AlbumSession> sessions = new HashMap<>();

    private volatile JobScheduler scheduler;

    public AlbumForwarder(TelegramSender sender, Duration waitTimeout) {
        this.sender = sender;
        this.waitTimeout = waitTimeout;
    }

    public void start() {
        synchronized (lock) {
            if (scheduler != null) {
                throw new IllegalStateException("Album forwarder already started");
            }
            scheduler = new JobScheduler("album", AlbumForwarder::onJobError);
        }
        log.info("Album forwarder started, wait timeout {} ms", waitTimeout.toMillis());
    }

    /**
     * Blocks until every pending album is assembled and sent. Albums still receiving items
     * are flushed with what they have after the wait timeout.
     */
    public void stop() {
        JobScheduler current;
        synchronized (lock) {
            current = scheduler;
            if (current == null || current.isClosed()) {
                throw new IllegalStateException("Album forwarder not started");
            }
        }
        log.info("Stopping album forwarder, pending albums: {}", pendingGroupIds().size());
        current.close();
        synchronized (lock) {
            if (!sessions.isEmpty()) {
                log.warn("Dropping {} unfinished albums", sessions.size());
                sessions.clear();
            }
        }
        log.info("Album forwarder stopped");
    }

    public void submit(Message message) {
        submit(message, null, false);
    }

    /**
     * Queues an album item. Returns at once; forwarding happens in the background.
     *
     * @param destinationChatId where the album goes; only used by the first item of a group,
     *                          {@code null} for items that may only join an existing group
     * @param addFromInfo       send a line naming the original sender before the album
     */
    public void submit(Message message, Long destinationChatId, boolean addFromInfo) {
        AlbumSession session;
        JobScheduler current;
        String groupId = message.getMediaGroupId();
        synchronized (lock) {
            current = scheduler;
            if (current == null || current.isClosed()) {
                throw new IllegalStateException("Album forwarder not started");
            }
            if (groupId == null || groupId.isEmpty()) {
                throw new IllegalArgumentException("Message in album must have media group id");
            }
            AlbumSession existing = sessions.get(groupId);
            if (existing != null) {
                existing.queue.add(message);
                return;
            }
            if (destinationChatId == null) {
                log.warn("Skip media group item as latecomer: group {}, message {} in chat {}",
                        groupId, message.getMessageId(), message.getChatId());
                return;
            }
            session = new AlbumSession(groupId, destinationChatId, addFromInfo);
            session.queue.add(message);
            sessions.put(groupId, session);
        }
        try {
            current.spawn("album-" + groupId, () -> assemble(session));
        } catch (IllegalStateException e) {
            release(session);
            throw e;
        }
        log.debug("Started album {} for chat {}", groupId, destinationChatId);
    }

    public Set<String> pendingGroupIds() {
        synchronized (lock) {
            return Set.copyOf(sessions.keySet());
        }
    }

    private void assemble(AlbumSession session) throws TelegramApiException {
        List<InputMedia> media = new ArrayList<>();
        Chat fromChat = null;
        int count = 0;
        try {
            Message message;
            while ((message = next(session)) != null) {
                count++;
                fromChat = message.getChat();
                AlbumMediaMapper.toInputMedia(message).ifPresent(media::add);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Album {} interrupted after {} items, nothing forwarded", session.groupId, count);
            return;
        } finally {
            release(session);
        }

        if (!media.isEmpty()) {
            if (session.addFromInfo) {
                sender.sendFrom(session.destinationChatId, fromChat);
            }
            sender.sendAlbum(session.destinationChatId, media);
            sender.send(fromChat.getId(), "Переслано элементов группы: " + media.size());
            log.debug("Forwarded {} media group items to {}", media.size(), session.destinationChatId);
        } else if (fromChat != null) {
            sender.send(fromChat.getId(), "Не удалось переслать элементов неподдерживаемого типа: " + count);
            log.debug("Failed to forward {} media group items of unsupported type", count);
        } else {
            log.debug("No media group items to forward");
        }
    }

    /**
     * Next item of the album, or null once the album stayed silent for the wait timeout.
     * A null result also closes the session, so later items of the group are latecomers.
     */
    private Message next(AlbumSession session) throws InterruptedException {
        Message message = session.queue.poll(waitTimeout.toMillis(), TimeUnit.MILLISECONDS);
        if (message != null) {
            return message;
        }
        synchronized (lock) {
            message = session.queue.poll();
            if (message == null) {
                sessions.remove(session.groupId, session);
            }
            return message;
        }
    }

    private void release(AlbumSession session) {
        synchronized (lock) {
            sessions.remove(session.groupId, session);
        }
    }

    private static void onJobError(String jobName, Throwable e) {
        log.error("Album forward error in {}", jobName, e);
    }

    private static final class AlbumSession {
        final String groupId;
        final Long destinationChatId;
        final boolean addFromInfo;
        final BlockingQueue<Message> queue = new LinkedBlockingQueue<>();

        AlbumSession(String groupId, Long destinationChatId, boolean addFromInfo) {
            this.groupId = groupId;
            this.destinationChatId = destinationChatId;
            this.addFromInfo = addFromInfo;
        }
    }
}
