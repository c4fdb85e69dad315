package jump.email.sorter.entity;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * A sorting category: where its messages go and how the keyword tier recognises it.
 * Categories are configuration and never change while the process runs.
 */
@Value
@Builder
public class Category {
    public static final String UNKNOWN = "UNKNOWN";

    String name;
    /** Destination folder path, {@code /}-separated. Null for categories that are never moved. */
    String folder;
    @Singular
    List<String> keywords;
    @Builder.Default
    double confidenceThreshold = 0.6;
    int priority;
    String description;

    public boolean hasDestination() {
        return folder != null && !folder.isBlank() && !UNKNOWN.equals(name);
    }
}
