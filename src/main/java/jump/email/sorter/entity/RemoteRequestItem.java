package jump.email.sorter.entity;

import lombok.Value;

/**
 * One message as submitted to the remote classifier: its identity key plus the text used
 * for classification.
 */
@Value
public class RemoteRequestItem {
    String id;
    String subject;
    String body;
}
