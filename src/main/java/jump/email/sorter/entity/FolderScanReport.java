package jump.email.sorter.entity;

import lombok.Builder;
import lombok.Value;

/**
 * Summary of one folder pass.
 */
@Value
@Builder
public class FolderScanReport {
    String folder;
    boolean skipped;
    int candidates;
    int classified;
    int moved;
    int failures;

    public static FolderScanReport skipped(String folder) {
        return FolderScanReport.builder().folder(folder).skipped(true).build();
    }
}
