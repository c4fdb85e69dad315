package jump.email.sorter.entity;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A decoded message as handed over by the mail store.
 */
@Value
@Builder
public class MailMessage {
    MessageIdentity identity;
    String sender;
    String subject;
    String body;
    Instant receivedAt;

    public String getSender() {
        return sender != null ? sender : "";
    }

    public String getSubject() {
        return subject != null ? subject : "";
    }

    public String getBody() {
        return body != null ? body : "";
    }
}
