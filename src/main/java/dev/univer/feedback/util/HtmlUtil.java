package dev.univer.feedback.util;

import dev.univer.feedback.model.KnownChat;
import org.telegram.telegrambots.meta.api.objects.Chat;
import org.telegram.telegrambots.meta.api.objects.User;

/**
 * Helpers for Telegram HTML parse mode.
 */
public final class HtmlUtil {

    private HtmlUtil() {
    }

    public static String escape(String text) {
        if (text == null) return "";
        return text.replace("&", "&amp;")
                .replace("<", "&lt;")
                .replace(">", "&gt;")
                .replace("\"", "&quot;");
    }

    public static String bold(String text) {
        return "<b>" + escape(text) + "</b>";
    }

    public static String userName(String firstName, String lastName) {
        if (firstName == null || firstName.isBlank()) {
            throw new IllegalStateException("First name of private chat must be not empty");
        }
        return lastName == null ? firstName : firstName + " " + lastName;
    }

    public static String userName(User user) {
        return userName(user.getFirstName(), user.getLastName());
    }

    public static String userName(Chat chat) {
        return userName(chat.getFirstName(), chat.getLastName());
    }

    public static String userName(KnownChat chat) {
        return userName(chat.getFirstName(), chat.getLastName());
    }

    public static String userLink(Long userId, String name) {
        return "<a href=\"tg://user?id=" + userId + "\">" + escape(name) + "</a>";
    }

    public static String userLink(User user) {
        return userLink(user.getId(), userName(user));
    }

    public static String userLink(Chat chat) {
        return userLink(chat.getId(), userName(chat));
    }

    public static String userLink(KnownChat chat) {
        return userLink(chat.getChatId(), userName(chat));
    }
}
