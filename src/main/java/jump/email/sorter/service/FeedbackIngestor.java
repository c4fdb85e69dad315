package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.Category;
import jump.email.sorter.entity.MailMessage;
import jump.email.sorter.mail.FolderDescriptor;
import jump.email.sorter.mail.MailStore;
import jump.email.sorter.mail.MailStoreException;
import jump.email.sorter.mail.SearchScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;

/**
 * Absorbs user corrections. Every message the user drops into {@code <root>/<CATEGORY>} is
 * learned as belonging to that category, then removed from the correction folder.
 */
@Slf4j
@Service
public class FeedbackIngestor {
    private static final int BODY_PREVIEW_LENGTH = 200;

    private final MailStore mailStore;
    private final RuleStore ruleStore;
    private final ClassificationCache cache;
    private final MessageFingerprinter fingerprinter;
    private final CategoryRegistry categoryRegistry;
    private final String root;

    public FeedbackIngestor(MailStore mailStore, RuleStore ruleStore, ClassificationCache cache,
                            MessageFingerprinter fingerprinter, CategoryRegistry categoryRegistry,
                            SorterProperties properties) {
        this.mailStore = mailStore;
        this.ruleStore = ruleStore;
        this.cache = cache;
        this.fingerprinter = fingerprinter;
        this.categoryRegistry = categoryRegistry;
        this.root = properties.getFeedback().getRoot();
    }

    /**
     * @param folders the current folder listing
     * @return number of corrections absorbed
     */
    public int ingest(List<FolderDescriptor> folders) {
        String prefix = root + "/";
        int absorbed = 0;
        for (FolderDescriptor folder : folders) {
            if (!folder.isSelectable() || !folder.getName().startsWith(prefix)) {
                continue;
            }
            String categoryName = folder.getName().substring(prefix.length());
            Optional<Category> category = categoryRegistry.find(categoryName);
            if (category.isEmpty()) {
                log.warn("Correction folder {} does not name a configured category, skipping", folder.getName());
                continue;
            }
            absorbed += ingestFolder(folder.getName(), category.get());
        }
        if (absorbed > 0) {
            log.info("Absorbed {} correction(s), rules now: {}", absorbed, ruleStore.stats());
        }
        return absorbed;
    }

    int ingestFolder(String folder, Category category) {
        List<String> ids;
        try {
            mailStore.select(folder);
            ids = mailStore.search(SearchScope.ALL);
        } catch (MailStoreException e) {
            log.error("Could not read correction folder {}: {}", folder, e.getMessage(), e);
            return 0;
        }
        if (ids.isEmpty()) {
            return 0;
        }

        int absorbed = 0;
        for (String id : ids) {
            MailMessage message;
            try {
                message = mailStore.fetchMessage(id);
            } catch (MailStoreException e) {
                log.warn("Could not fetch correction {} in {}: {}", id, folder, e.getMessage());
                continue;
            }
            String body = message.getBody();
            ruleStore.learnFromCorrection(message.getSender(), message.getSubject(),
                body.length() > BODY_PREVIEW_LENGTH ? body.substring(0, BODY_PREVIEW_LENGTH) : body,
                null, category.getName());
            cache.override(fingerprinter.fingerprint(message.getSender(), message.getSubject()),
                category.getName(), MessageFingerprinter.domainOf(message.getSender()));
            try {
                mailStore.markDeleted(id);
            } catch (MailStoreException e) {
                log.warn("Correction {} in {} learned but not flagged deleted: {}", id, folder, e.getMessage());
            }
            absorbed++;
        }

        if (absorbed > 0) {
            try {
                mailStore.expunge();
            } catch (MailStoreException e) {
                log.error("Purge of correction folder {} failed: {}", folder, e.getMessage(), e);
            }
        }
        log.info("Correction folder {}: {} message(s) learned as {}", folder, absorbed, category.getName());
        return absorbed;
    }
}
