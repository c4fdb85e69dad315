package jump.email.sorter.service;

import org.springframework.stereotype.Component;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Computes the cache key of a message. Two messages with the same fingerprint are treated as the
 * same kind of message, which is all the cache needs.
 */
@Component
public class MessageFingerprinter {
    private static final int SUBJECT_LENGTH = 50;
    private static final Pattern REPLY_PREFIX = Pattern.compile("^((re|fw|fwd|tr)\\s*:\\s*)+");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    public String fingerprint(String sender, String subject) {
        return md5(normalizeSender(sender) + "|" + normalizeSubject(subject));
    }

    public static String normalizeSender(String sender) {
        if (sender == null) {
            return "";
        }
        String value = sender.trim();
        int open = value.lastIndexOf('<');
        int close = value.lastIndexOf('>');
        if (open >= 0 && close > open) {
            value = value.substring(open + 1, close);
        }
        return value.trim().toLowerCase(Locale.ROOT);
    }

    public static String normalizeSubject(String subject) {
        if (subject == null) {
            return "";
        }
        String value = subject.trim().toLowerCase(Locale.ROOT);
        value = REPLY_PREFIX.matcher(value).replaceFirst("");
        value = DIGITS.matcher(value).replaceAll("#");
        value = WHITESPACE.matcher(value).replaceAll(" ").trim();
        return value.length() > SUBJECT_LENGTH ? value.substring(0, SUBJECT_LENGTH) : value;
    }

    /**
     * @return the lower-cased part after the last {@code @}, or an empty string
     */
    public static String domainOf(String sender) {
        String address = normalizeSender(sender);
        int at = address.lastIndexOf('@');
        return at >= 0 && at < address.length() - 1 ? address.substring(at + 1) : "";
    }

    private static String md5(String value) {
        return DigestUtils.md5DigestAsHex(value.getBytes(StandardCharsets.UTF_8));
    }
}
