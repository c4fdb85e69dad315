package jump.email.sorter.service;

import jump.email.sorter.entity.CheckpointState;
import jump.email.sorter.entity.MessageIdentity;
import jump.email.sorter.repository.CheckpointRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Durable scan progress. Identities are only ever added: a processed message is never
 * classified or moved again, whatever a later classification would say.
 */
@Slf4j
@Service
public class Checkpoint {
    private final CheckpointRepository repository;
    private final Clock clock;
    private final Set<String> processed = ConcurrentHashMap.newKeySet();
    private final Map<String, Instant> lastCheck = new ConcurrentHashMap<>();
    private volatile boolean initialScanDone;

    public Checkpoint(CheckpointRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
        repository.load().ifPresent(this::restore);
        if (initialScanDone) {
            log.info("Resuming from checkpoint ({} messages already processed)", processed.size());
        } else {
            log.info("No completed initial scan recorded, the first cycle scans every message");
        }
    }

    public boolean isProcessed(MessageIdentity identity) {
        return processed.contains(identity.key());
    }

    public void markProcessed(MessageIdentity identity) {
        processed.add(identity.key());
    }

    public int processedCount() {
        return processed.size();
    }

    public boolean isInitialScanDone() {
        return initialScanDone;
    }

    public void markInitialScanDone() {
        initialScanDone = true;
    }

    public void recordFolderChecked(String folder) {
        lastCheck.put(folder, Instant.now(clock));
    }

    public Optional<Instant> lastCheckedAt(String folder) {
        return Optional.ofNullable(lastCheck.get(folder));
    }

    public boolean save() {
        CheckpointState state = new CheckpointState();
        state.setInitialScanDone(initialScanDone);
        state.setLastCheck(new LinkedHashMap<>(lastCheck));
        List<String> identities = new ArrayList<>(processed);
        Collections.sort(identities);
        state.setProcessed(identities);
        state.setLastUpdate(Instant.now(clock));
        boolean saved = repository.save(state);
        if (saved) {
            log.debug("Checkpoint saved ({} messages processed)", identities.size());
        }
        return saved;
    }

    private void restore(CheckpointState state) {
        initialScanDone = state.isInitialScanDone();
        if (state.getLastCheck() != null) {
            state.getLastCheck().forEach((folder, at) -> {
                if (at != null) {
                    lastCheck.put(folder, at);
                }
            });
        }
        if (state.getProcessed() != null) {
            for (String key : state.getProcessed()) {
                try {
                    processed.add(MessageIdentity.parse(key).key());
                } catch (IllegalArgumentException e) {
                    log.warn("Skipping malformed checkpoint entry '{}'", key);
                }
            }
        }
    }
}
