package jump.email.sorter.mail;

/**
 * A mail-store round trip failed: connection, protocol state or server refusal.
 * Always local to the folder (or message) being worked on.
 */
public class MailStoreException extends Exception {
    public MailStoreException(String message) {
        super(message);
    }

    public MailStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
