package jump.email.sorter.service;

import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.CachedPattern;
import jump.email.sorter.repository.SieveFilterRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Turns frequently seen sender domains into server-side Sieve rules, so the mail server can
 * file those messages before the sorter ever sees them.
 */
@Slf4j
@Service
public class SieveFilterExporter {
    private final ClassificationCache cache;
    private final CategoryRegistry categoryRegistry;
    private final SieveFilterRepository repository;
    private final Clock clock;
    private final int minOccurrences;

    public SieveFilterExporter(ClassificationCache cache, CategoryRegistry categoryRegistry,
                               SieveFilterRepository repository, SorterProperties properties, Clock clock) {
        this.cache = cache;
        this.categoryRegistry = categoryRegistry;
        this.repository = repository;
        this.clock = clock;
        this.minOccurrences = properties.getSieve().getMinOccurrences();
    }

    public String render() {
        // domain -> category -> accumulated hits
        Map<String, Map<String, Long>> byDomain = new TreeMap<>();
        for (CachedPattern pattern : cache.snapshot().values()) {
            if (pattern.getHitCount() < minOccurrences || pattern.getSourceDomain() == null
                || pattern.getSourceDomain().isBlank()) {
                continue;
            }
            byDomain.computeIfAbsent(pattern.getSourceDomain(), d -> new TreeMap<>())
                .merge(pattern.getCategory(), pattern.getHitCount(), Long::sum);
        }

        StringBuilder script = new StringBuilder();
        script.append("# Mail sorter - generated rules\n");
        script.append("# Date: ").append(Instant.now(clock)).append('\n');
        script.append("require [\"fileinto\"];\n\n");

        int rules = 0;
        for (Map.Entry<String, Map<String, Long>> domain : byDomain.entrySet()) {
            Map.Entry<String, Long> best = domain.getValue().entrySet().stream()
                .max(Map.Entry.comparingByValue())
                .orElse(null);
            if (best == null || best.getValue() < minOccurrences) {
                continue;
            }
            Optional<String> folder = categoryRegistry.destinationOf(best.getKey());
            if (folder.isEmpty()) {
                continue;
            }
            script.append("# ").append(domain.getKey()).append(" -> ").append(best.getKey())
                .append(" (").append(best.getValue()).append(" emails)\n");
            script.append("if header :contains \"From\" \"").append(quote(domain.getKey())).append("\" {\n");
            script.append("    fileinto \"").append(quote(folder.get())).append("\";\n");
            script.append("    stop;\n");
            script.append("}\n\n");
            rules++;
        }
        log.debug("Rendered {} Sieve rule(s)", rules);
        return script.toString();
    }

    public boolean export() {
        boolean written = repository.save(render());
        if (written) {
            log.info("Sieve filters exported to {}", SieveFilterRepository.FILE_NAME);
        }
        return written;
    }

    private static String quote(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
