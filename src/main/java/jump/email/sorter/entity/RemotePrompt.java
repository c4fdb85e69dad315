package jump.email.sorter.entity;

import lombok.Value;

@Value
public class RemotePrompt {
    String system;
    String user;
}
