package jump.email.sorter.service;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Result of one chat-completion round trip: either the assistant's text or the kind of failure.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ChatOutcome {
    public enum ErrorKind {
        /** No API key; nothing was sent. */
        NOT_CONFIGURED,
        /** Connection refused, reset or timed out. */
        TRANSPORT,
        /** Non-2xx response other than a quota refusal. */
        HTTP_STATUS,
        /** 429 or an explicit quota message. */
        QUOTA,
        /** 2xx response without usable content. */
        MALFORMED
    }

    String content;
    ErrorKind error;
    String detail;

    public static ChatOutcome success(String content) {
        return new ChatOutcome(content, null, null);
    }

    public static ChatOutcome failure(ErrorKind error, String detail) {
        return new ChatOutcome(null, error, detail);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
