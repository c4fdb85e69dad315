package jump.email.sorter.config;

import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.ArrayList;
import java.util.List;

/**
 * Settings of the sorter, bound from the {@code sorter.*} tree of application.yml.
 * Read once at startup and treated as immutable afterwards.
 */
@ConfigurationProperties(prefix = "sorter")
@NoArgsConstructor
@Getter
@Setter
public class SorterProperties {

    /** Delay between two scan cycles, in ms. */
    private long pollIntervalMs = 60_000;

    /** Classify and log but never copy, flag or expunge. */
    private boolean dryRun = false;

    /** After the initial scan, only look at unseen messages. */
    private boolean unseenOnly = true;

    /** Directory holding checkpoint, rules, cache, corrections and metrics documents. */
    private String dataDir = System.getProperty("user.home") + "/.mail-sorter/data";

    private Imap imap = new Imap();
    private Scan scan = new Scan();
    private Classification classification = new Classification();
    private Remote remote = new Remote();
    private Feedback feedback = new Feedback();
    private Sieve sieve = new Sieve();
    private List<CategoryProperties> categories = new ArrayList<>();

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Imap {
        private String host = "127.0.0.1";
        private int port = 1143;
        private String username;
        private String password;
        private boolean starttls = true;
        private boolean trustAll = true;
        private int timeoutMs = 10_000;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Scan {
        private int maxEmailsPerFolder = 100;
        private int spamTrashLimit = 10;
        /** Folder-name fragments that mark a trash or spam folder. */
        private List<String> spamTrashMarkers = new ArrayList<>(List.of("spam", "trash", "corbeille", "junk"));
        /** Folder-name fragments of system folders that are never scanned. */
        private List<String> skipFolders = new ArrayList<>(List.of(
            "All Mail", "Tous les messages", "[Gmail]", "[Imap]", "[Sent]", "[Trash]", "[Draft]"));
        /** Folder-name prefixes that are never scanned. */
        private List<String> skipPrefixes = new ArrayList<>(List.of("Training"));
        /** Messages per classification batch and per remote request. */
        private int batchSize = 15;
        /** Worker threads for fetch and classification, clamped to 1..10. */
        private int workers = 5;
        /** Pause between CREATE and the re-listing that confirms it, in ms. */
        private long folderCreateSettleMs = 500;

        public int effectiveWorkers() {
            return Math.max(1, Math.min(workers, 10));
        }

        public int effectiveBatchSize() {
            return Math.max(1, batchSize);
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Classification {
        private double ruleMinConfidence = 0.75;
        private double keywordMinConfidence = 0.1;
        private double keywordWeight = 0.85;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Remote {
        /** http (OpenAI-compatible endpoint through RestTemplate) or openai (OpenAI client library). */
        private String provider = "http";
        private String apiUrl = "https://api.perplexity.ai/chat/completions";
        private String apiKey;
        private String model = "sonar-pro";
        private int timeoutMs = 30_000;
        private double temperature = 0.1;
        private int maxCalls = 50;
        private int windowSeconds = 60;
        private double costPerCallUsd = 0.005;
        private int fewShotExamples = 5;

        public boolean hasApiKey() {
            return apiKey != null && !apiKey.isBlank() && !apiKey.startsWith("${");
        }
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Feedback {
        private boolean enabled = true;
        /** Correction folders live at {@code <root>/<CATEGORY>}. */
        private String root = "Feedback";
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class Sieve {
        private boolean enabled = true;
        private int minOccurrences = 5;
    }

    @NoArgsConstructor
    @Getter
    @Setter
    public static class CategoryProperties {
        private String name;
        private String folder;
        private List<String> keywords = new ArrayList<>();
        private double confidenceThreshold = 0.6;
        private int priority;
        private String description = "";
    }
}
