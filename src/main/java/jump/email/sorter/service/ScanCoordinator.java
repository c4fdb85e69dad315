package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.ClassificationResult;
import jump.email.sorter.entity.FolderScanReport;
import jump.email.sorter.entity.MailMessage;
import jump.email.sorter.entity.MessageIdentity;
import jump.email.sorter.mail.FolderDescriptor;
import jump.email.sorter.mail.MailStore;
import jump.email.sorter.mail.MailStoreException;
import jump.email.sorter.mail.SearchScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Runs scan cycles: folders one after another, and inside a folder
 * select, search, fetch and classify on the worker pool, then move and checkpoint in
 * classification order, then a single purge.
 */
@Slf4j
@Service
public class ScanCoordinator {
    private final MailStore mailStore;
    private final Checkpoint checkpoint;
    private final ClassificationEngine classificationEngine;
    private final FolderRouter folderRouter;
    private final FeedbackIngestor feedbackIngestor;
    private final RuleStore ruleStore;
    private final ClassificationCache cache;
    private final ClassificationMetrics metrics;
    private final SieveFilterExporter sieveFilterExporter;
    private final CancellationToken cancellationToken;
    private final SorterProperties properties;
    private final Executor executor;

    public ScanCoordinator(MailStore mailStore, Checkpoint checkpoint, ClassificationEngine classificationEngine,
                           FolderRouter folderRouter, FeedbackIngestor feedbackIngestor, RuleStore ruleStore,
                           ClassificationCache cache, ClassificationMetrics metrics,
                           SieveFilterExporter sieveFilterExporter, CancellationToken cancellationToken,
                           SorterProperties properties,
                           @Qualifier("classificationExecutor") Executor executor) {
        this.mailStore = mailStore;
        this.checkpoint = checkpoint;
        this.classificationEngine = classificationEngine;
        this.folderRouter = folderRouter;
        this.feedbackIngestor = feedbackIngestor;
        this.ruleStore = ruleStore;
        this.cache = cache;
        this.metrics = metrics;
        this.sieveFilterExporter = sieveFilterExporter;
        this.cancellationToken = cancellationToken;
        this.properties = properties;
        this.executor = executor;
    }

    /**
     * One full cycle over every eligible folder, followed by feedback ingestion and a state save.
     * @throws MailStoreException if the store cannot be reached or listed; no folder was touched then
     */
    public List<FolderScanReport> runCycle() throws MailStoreException {
        List<FolderScanReport> reports = new ArrayList<>();
        if (cancellationToken.isCancelled()) {
            return reports;
        }

        mailStore.open();
        List<FolderDescriptor> folders = mailStore.listFolders();
        folderRouter.seed(folders);

        for (FolderDescriptor folder : folders) {
            if (cancellationToken.isCancelled()) {
                log.info("Shutdown requested, stopping before folder {}", folder.getName());
                break;
            }
            if (!folder.isSelectable() || shouldSkip(folder.getName())) {
                log.debug("Skipping folder {}", folder.getName());
                continue;
            }
            reports.add(processFolder(folder.getName()));
        }

        if (properties.getFeedback().isEnabled() && !cancellationToken.isCancelled()) {
            if (properties.isDryRun()) {
                log.info("DRY-RUN: correction folders left untouched");
            } else {
                feedbackIngestor.ingest(folders);
            }
        }

        boolean complete = !cancellationToken.isCancelled();
        if (complete && !checkpoint.isInitialScanDone()) {
            checkpoint.markInitialScanDone();
            log.info("Initial scan complete, following cycles only look at new messages");
        }
        persistState();

        int moved = reports.stream().mapToInt(FolderScanReport::getMoved).sum();
        int classified = reports.stream().mapToInt(FolderScanReport::getClassified).sum();
        log.info("Cycle finished: {} folder(s) scanned, {} message(s) classified, {} moved",
            reports.size(), classified, moved);
        return reports;
    }

    /**
     * Scan one folder. A failing SELECT skips the folder; any later failure ends the pass early
     * but still records the folder as checked and saves the checkpoint.
     */
    public FolderScanReport processFolder(String folder) {
        try {
            mailStore.select(folder);
        } catch (MailStoreException e) {
            log.error("Could not select folder {}: {}", folder, e.getMessage(), e);
            return FolderScanReport.skipped(folder);
        }

        FolderScanReport.FolderScanReportBuilder report = FolderScanReport.builder().folder(folder);
        int moved = 0;
        int failures = 0;
        int classified = 0;
        try {
            SearchScope scope = searchScope();
            List<String> found = mailStore.search(scope);
            List<String> pending = new ArrayList<>();
            for (String id : new LinkedHashSet<>(found)) {
                if (!checkpoint.isProcessed(MessageIdentity.of(folder, id))) {
                    pending.add(id);
                }
            }

            int limit = limitFor(folder);
            if (pending.size() > limit) {
                log.warn("{} pending messages in {}, keeping the {} most recent", pending.size(), folder, limit);
                pending = selectMostRecent(pending, limit);
            }
            report.candidates(pending.size());
            if (pending.isEmpty()) {
                log.debug("Nothing to process in {} ({} search)", folder, scope);
                return report.build();
            }
            log.info("{} message(s) to process in {} ({} found by {} search)", pending.size(), folder, found.size(), scope);

            Map<String, MailMessage> fetched = fetchAll(folder, pending);
            failures += pending.size() - fetched.size();

            Map<MessageIdentity, ClassificationResult> results = classifyAll(new ArrayList<>(fetched.values()));
            failures += fetched.size() - results.size();
            classified = results.size();

            for (ClassificationResult result : results.values()) {
                if (cancellationToken.isCancelled()) {
                    log.info("Shutdown requested, leaving remaining messages of {} for later", folder);
                    break;
                }
                RouteOutcome outcome = route(folder, result);
                if (outcome == RouteOutcome.MOVED) {
                    moved++;
                } else if (outcome == RouteOutcome.FAILED) {
                    failures++;
                }
            }

            if (moved > 0) {
                log.info("Purging {} moved message(s) from {}", moved, folder);
                try {
                    mailStore.expunge();
                } catch (MailStoreException e) {
                    log.error("Purge of {} failed: {}", folder, e.getMessage(), e);
                }
            }
        } catch (MailStoreException e) {
            log.error("Error processing folder {}: {}", folder, e.getMessage(), e);
        } finally {
            checkpoint.recordFolderChecked(folder);
            checkpoint.save();
        }
        return report.classified(classified).moved(moved).failures(failures).build();
    }

    /**
     * Keep the {@code limit} most recently received messages. Messages without a readable date sort last.
     */
    List<String> selectMostRecent(List<String> ids, int limit) {
        Map<String, Instant> dates = new LinkedHashMap<>();
        for (String id : ids) {
            Instant date = Instant.EPOCH;
            try {
                date = mailStore.fetchInternalDate(id).orElse(Instant.EPOCH);
            } catch (MailStoreException e) {
                log.debug("No date for message {}: {}", id, e.getMessage());
            }
            dates.put(id, date);
        }
        List<String> sorted = new ArrayList<>(ids);
        sorted.sort(Comparator.comparing(dates::get, Comparator.reverseOrder()));
        return new ArrayList<>(sorted.subList(0, Math.min(limit, sorted.size())));
    }

    /**
     * Save checkpoint, rules, cache, metrics and Sieve filters. Failures are logged by the repositories.
     */
    public void persistState() {
        checkpoint.save();
        ruleStore.save();
        cache.save();
        metrics.logAndSave();
        if (properties.getSieve().isEnabled()) {
            sieveFilterExporter.export();
        }
    }

    private Map<String, MailMessage> fetchAll(String folder, List<String> ids) {
        Map<String, CompletableFuture<Optional<MailMessage>>> futures = new LinkedHashMap<>();
        for (String id : ids) {
            if (cancellationToken.isCancelled()) {
                break;
            }
            futures.put(id, CompletableFuture.supplyAsync(() -> fetchOne(folder, id), executor));
        }
        Map<String, MailMessage> messages = new LinkedHashMap<>();
        futures.forEach((id, future) -> join(future).flatMap(m -> m).ifPresent(message -> messages.put(id, message)));
        return messages;
    }

    private Optional<MailMessage> fetchOne(String folder, String id) {
        try {
            return Optional.of(mailStore.fetchMessage(id));
        } catch (MailStoreException e) {
            log.error("Could not fetch message {} in {}: {}", id, folder, e.getMessage());
            return Optional.empty();
        }
    }

    private Map<MessageIdentity, ClassificationResult> classifyAll(List<MailMessage> messages) {
        int batchSize = properties.getScan().effectiveBatchSize();
        List<CompletableFuture<Map<MessageIdentity, ClassificationResult>>> batches = new ArrayList<>();
        for (int start = 0; start < messages.size(); start += batchSize) {
            List<MailMessage> batch = messages.subList(start, Math.min(start + batchSize, messages.size()));
            batches.add(CompletableFuture.supplyAsync(() -> classificationEngine.classifyBatch(batch), executor));
        }
        Map<MessageIdentity, ClassificationResult> results = new LinkedHashMap<>();
        for (CompletableFuture<Map<MessageIdentity, ClassificationResult>> batch : batches) {
            join(batch).ifPresent(results::putAll);
        }
        return results;
    }

    private <T> Optional<T> join(CompletableFuture<T> future) {
        try {
            return Optional.ofNullable(future.join());
        } catch (CompletionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.error("Worker task failed: {}", cause.getMessage(), cause);
            return Optional.empty();
        }
    }

    private RouteOutcome route(String folder, ClassificationResult result) {
        MessageIdentity identity = result.getIdentity();
        Optional<String> destination = result.isUnknown()
            ? Optional.empty()
            : folderRouter.resolveDestination(result.getCategory());
        if (destination.isEmpty()) {
            log.debug("{} stays in {} (category {})", identity, folder, result.getCategory());
            checkpoint.markProcessed(identity);
            return RouteOutcome.KEPT;
        }
        if (destination.get().equals(folder)) {
            checkpoint.markProcessed(identity);
            return RouteOutcome.KEPT;
        }
        if (properties.isDryRun()) {
            log.info("DRY-RUN: {} would be moved to {}", identity, destination.get());
            checkpoint.markProcessed(identity);
            return RouteOutcome.KEPT;
        }
        if (folderRouter.move(identity, folder, destination.get())) {
            checkpoint.markProcessed(identity);
            return RouteOutcome.MOVED;
        }
        return RouteOutcome.FAILED;
    }

    private SearchScope searchScope() {
        if (!checkpoint.isInitialScanDone()) {
            return SearchScope.ALL;
        }
        return properties.isUnseenOnly() ? SearchScope.UNSEEN : SearchScope.ALL;
    }

    int limitFor(String folder) {
        String lower = folder.toLowerCase(Locale.ROOT);
        SorterProperties.Scan scan = properties.getScan();
        for (String marker : scan.getSpamTrashMarkers()) {
            if (lower.contains(marker.toLowerCase(Locale.ROOT))) {
                return scan.getSpamTrashLimit();
            }
        }
        return scan.getMaxEmailsPerFolder();
    }

    boolean shouldSkip(String folder) {
        SorterProperties.Scan scan = properties.getScan();
        for (String system : scan.getSkipFolders()) {
            if (folder.contains(system)) {
                return true;
            }
        }
        for (String prefix : scan.getSkipPrefixes()) {
            if (folder.startsWith(prefix)) {
                return true;
            }
        }
        String feedbackRoot = properties.getFeedback().getRoot();
        return folder.equals(feedbackRoot) || folder.startsWith(feedbackRoot + "/");
    }

    private enum RouteOutcome {
        MOVED,
        KEPT,
        FAILED
    }
}
