package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.MessageIdentity;
import jump.email.sorter.mail.FolderDescriptor;
import jump.email.sorter.mail.MailStore;
import jump.email.sorter.mail.MailStoreException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Maps categories to destination folders, creates missing folders and moves messages.
 * A move is a copy followed by a deleted flag on the source; a crash in between leaves a
 * duplicate, never a lost message.
 */
@Slf4j
@Service
public class FolderRouter {
    private final MailStore mailStore;
    private final CategoryRegistry categoryRegistry;
    private final long settleMillis;
    private final Sleeper sleeper;
    private final Set<String> knownFolders = ConcurrentHashMap.newKeySet();
    private volatile boolean listed;

    @Autowired
    public FolderRouter(MailStore mailStore, CategoryRegistry categoryRegistry, SorterProperties properties) {
        this(mailStore, categoryRegistry, properties.getScan().getFolderCreateSettleMs(), Sleeper.THREAD);
    }

    FolderRouter(MailStore mailStore, CategoryRegistry categoryRegistry, long settleMillis, Sleeper sleeper) {
        this.mailStore = mailStore;
        this.categoryRegistry = categoryRegistry;
        this.settleMillis = settleMillis;
        this.sleeper = sleeper;
    }

    public Optional<String> resolveDestination(String category) {
        return categoryRegistry.destinationOf(category);
    }

    /**
     * Replace the folder-existence cache with a listing the caller already holds.
     */
    public void seed(List<FolderDescriptor> folders) {
        knownFolders.clear();
        folders.forEach(folder -> knownFolders.add(folder.getName()));
        listed = true;
    }

    /**
     * Make sure every segment of a {@code /}-separated path exists, creating parents first.
     * A folder the store accepted but does not list yet is assumed to exist.
     * @return false if a segment could not be created
     */
    public boolean ensureFolderExists(String path) {
        String target = normalize(path);
        if (target.isEmpty()) {
            return false;
        }
        if (knownFolders.contains(target)) {
            return true;
        }
        if (!listed && !refresh()) {
            return false;
        }

        StringBuilder current = new StringBuilder();
        for (String segment : target.split("/")) {
            if (segment.isEmpty()) {
                continue;
            }
            if (current.length() > 0) {
                current.append('/');
            }
            current.append(segment);
            String folder = current.toString();
            if (knownFolders.contains(folder)) {
                continue;
            }

            log.info("Creating folder {}", folder);
            try {
                mailStore.createFolder(folder);
            } catch (MailStoreException e) {
                refresh();
                if (!knownFolders.contains(folder)) {
                    log.error("Could not create folder {}: {}", folder, e.getMessage(), e);
                    return false;
                }
                continue;
            }

            pause();
            refresh();
            if (!knownFolders.contains(folder)) {
                log.warn("Folder {} created but not listed yet, assuming it exists", folder);
                knownFolders.add(folder);
            }
        }
        return true;
    }

    /**
     * Move a message out of the currently selected folder.
     * @return false if the destination is unavailable or the copy failed; the message stays eligible for retry
     */
    public boolean move(MessageIdentity identity, String sourceFolder, String destination) {
        if (!ensureFolderExists(destination)) {
            log.error("Destination {} unavailable, {} not moved", destination, identity);
            return false;
        }
        try {
            mailStore.copy(identity.getMessageId(), normalize(destination));
        } catch (MailStoreException e) {
            log.error("Copy of {} to {} failed: {}", identity, destination, e.getMessage(), e);
            return false;
        }
        try {
            mailStore.markDeleted(identity.getMessageId());
        } catch (MailStoreException e) {
            log.warn("{} copied to {} but could not be flagged deleted in {}; a duplicate remains: {}",
                identity, destination, sourceFolder, e.getMessage());
        }
        log.info("Moved {} from {} to {}", identity, sourceFolder, destination);
        return true;
    }

    private boolean refresh() {
        try {
            seed(mailStore.listFolders());
            return true;
        } catch (MailStoreException e) {
            log.error("Folder listing failed: {}", e.getMessage(), e);
            return false;
        }
    }

    private void pause() {
        if (settleMillis <= 0) {
            return;
        }
        try {
            sleeper.sleep(settleMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static String normalize(String path) {
        if (path == null) {
            return "";
        }
        String value = path.trim();
        while (value.startsWith("/")) {
            value = value.substring(1);
        }
        while (value.endsWith("/")) {
            value = value.substring(0, value.length() - 1);
        }
        return value;
    }
}
