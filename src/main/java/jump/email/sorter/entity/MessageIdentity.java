package jump.email.sorter.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Composite key of a message: the folder it was found in and the identifier the mail store
 * assigned to it. Both parts are strings and compared by value everywhere the key is used
 * (checkpoint, batch result maps, logs).
 */
@Getter
@EqualsAndHashCode
public final class MessageIdentity {
    private final String folder;
    private final String messageId;

    private MessageIdentity(String folder, String messageId) {
        this.folder = folder;
        this.messageId = messageId;
    }

    public static MessageIdentity of(String folder, String messageId) {
        if (folder == null || folder.isEmpty()) {
            throw new IllegalArgumentException("folder must not be empty");
        }
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be empty");
        }
        return new MessageIdentity(folder, messageId.trim());
    }

    /**
     * Parses the {@code folder:messageId} form produced by {@link #key()}.
     * Folder names may themselves contain colons, message identifiers never do.
     */
    @JsonCreator
    public static MessageIdentity parse(String key) {
        if (key == null) {
            throw new IllegalArgumentException("identity key must not be null");
        }
        int separator = key.lastIndexOf(':');
        if (separator <= 0 || separator == key.length() - 1) {
            throw new IllegalArgumentException("Malformed message identity: " + key);
        }
        return of(key.substring(0, separator), key.substring(separator + 1));
    }

    @JsonValue
    public String key() {
        return folder + ":" + messageId;
    }

    @Override
    public String toString() {
        return key();
    }
}
