package jump.email.sorter.mail;

import lombok.Value;

@Value
public class FolderDescriptor {
    /** Full {@code /}-separated path of the folder. */
    String name;
    /** False for pure container folders that cannot be selected. */
    boolean selectable;
}
