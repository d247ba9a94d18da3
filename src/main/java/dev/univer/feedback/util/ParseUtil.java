package dev.univer.feedback.util;

import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public class ParseUtil {
    public static final String REPLY_PREFIX = "reply";

    // "/command", "/command@bot_name", optionally followed by arguments
    private static final Pattern COMMAND = Pattern.compile("^/(?<name>[A-Za-z0-9_]{1,32})(?:@\\w+)?(?:\\s.*)?$", Pattern.DOTALL);
    // callback data of reply menu buttons: "reply|<chat id>"
    private static final Pattern REPLY_DATA = Pattern.compile("^" + REPLY_PREFIX + "\\|(?<chatId>-?\\d+)$");

    private ParseUtil() {
    }

    /** Lower-cased command name without slash and bot mention, or null when the text is not a command. */
    public static String parseCommand(String text) {
        if (text == null) return null;
        Matcher m = COMMAND.matcher(text.trim());
        if (!m.matches()) return null;
        return m.group("name").toLowerCase(Locale.ROOT);
    }

    public static String replyData(Long chatId) {
        return REPLY_PREFIX + "|" + chatId;
    }

    public static boolean isReplyData(String data) {
        return data != null && REPLY_DATA.matcher(data).matches();
    }

    public static Long parseReplyChatId(String data) {
        Matcher m = REPLY_DATA.matcher(data);
        if (!m.matches()) {
            throw new IllegalArgumentException("Reply data must match format: " + data);
        }
        return Long.parseLong(m.group("chatId"));
    }
}
