package dev.univer.feedback.album;

import org.telegram.telegrambots.meta.api.objects.Audio;
import org.telegram.telegrambots.meta.api.objects.Message;
import org.telegram.telegrambots.meta.api.objects.PhotoSize;
import org.telegram.telegrambots.meta.api.objects.Video;
import org.telegram.telegrambots.meta.api.objects.media.InputMedia;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaAudio;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaDocument;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaPhoto;
import org.telegram.telegrambots.meta.api.objects.media.InputMediaVideo;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Turns an incoming album item into the entry re-sent in the outgoing media group.
 * Only audio, document, photo and video can travel in a media group.
 */
public final class AlbumMediaMapper {

    private static final Comparator<PhotoSize> BY_FILE_SIZE =
            Comparator.comparingInt(p -> p.getFileSize() == null ? 0 : p.getFileSize());

    private AlbumMediaMapper() {
    }

    public static Optional<InputMedia> toInputMedia(Message message) {
        if (message.getAudio() != null) {
            Audio audio = message.getAudio();
            InputMediaAudio media = new InputMediaAudio();
            fill(media, audio.getFileId(), message);
            media.setDuration(audio.getDuration());
            media.setPerformer(audio.getPerformer());
            media.setTitle(audio.getTitle());
            return Optional.of(media);
        }
        if (message.getDocument() != null) {
            InputMediaDocument media = new InputMediaDocument();
            fill(media, message.getDocument().getFileId(), message);
            return Optional.of(media);
        }
        if (message.getPhoto() != null && !message.getPhoto().isEmpty()) {
            InputMediaPhoto media = new InputMediaPhoto();
            fill(media, largest(message.getPhoto()).getFileId(), message);
            return Optional.of(media);
        }
        if (message.getVideo() != null) {
            Video video = message.getVideo();
            InputMediaVideo media = new InputMediaVideo();
            fill(media, video.getFileId(), message);
            media.setWidth(video.getWidth());
            media.setHeight(video.getHeight());
            media.setDuration(video.getDuration());
            return Optional.of(media);
        }
        return Optional.empty();
    }

    /** Telegram lists several sizes of the same photo; the one with the biggest file is the original. */
    static PhotoSize largest(List<PhotoSize> sizes) {
        return sizes.stream().max(BY_FILE_SIZE).orElseThrow();
    }

    private static void fill(InputMedia media, String fileId, Message message) {
        media.setMedia(fileId);
        media.setCaption(message.getCaption());
        media.setCaptionEntities(message.getCaptionEntities());
    }
}
