package jump.email.sorter.mail;

import jump.email.sorter.entity.MailMessage;
import jump.email.sorter.entity.MessageIdentity;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Mail store kept in memory for tests. Enforces SELECT before message commands and parent
 * folders before children, like strict IMAP servers do.
 */
public class InMemoryMailStore implements MailStore {
    private final Map<String, List<StoredMessage>> folders = new LinkedHashMap<>();
    private final Map<String, Integer> expunges = new HashMap<>();
    private final List<String> fetched = new ArrayList<>();
    private final List<SearchScope> searches = new ArrayList<>();
    private final Set<String> failingSelects = new HashSet<>();
    private final Set<String> failingCopies = new HashSet<>();
    private final Set<String> failingFetches = new HashSet<>();
    private final Set<String> hiddenFolders = new HashSet<>();
    private String selected;
    private long nextUid = 1;
    private boolean opened;

    public static class StoredMessage {
        public final String uid;
        public final String sender;
        public final String subject;
        public final String body;
        public final Instant received;
        public boolean deleted;

        StoredMessage(String uid, String sender, String subject, String body, Instant received) {
            this.uid = uid;
            this.sender = sender;
            this.subject = subject;
            this.body = body;
            this.received = received;
        }
    }

    public InMemoryMailStore folder(String name) {
        folders.putIfAbsent(name, new ArrayList<>());
        return this;
    }

    public String addMessage(String folder, String sender, String subject, String body, Instant received) {
        folder(folder);
        String uid = String.valueOf(nextUid++);
        folders.get(folder).add(new StoredMessage(uid, sender, subject, body, received));
        return uid;
    }

    public void failSelect(String folder) {
        failingSelects.add(folder);
    }

    public void failCopyTo(String folder) {
        failingCopies.add(folder);
    }

    /**
     * The next fetch of this message fails, later fetches succeed.
     */
    public void failFetch(String folder, String messageId) {
        failingFetches.add(folder + ":" + messageId);
    }

    /**
     * Folders created with this name are accepted but not listed, like a lagging server.
     */
    public void hideOnCreate(String folder) {
        hiddenFolders.add(folder);
    }

    public List<StoredMessage> messagesIn(String folder) {
        return new ArrayList<>(folders.getOrDefault(folder, List.of()));
    }

    public List<String> subjectsIn(String folder) {
        return messagesIn(folder).stream().map(m -> m.subject).collect(Collectors.toList());
    }

    public boolean hasFolder(String folder) {
        return folders.containsKey(folder);
    }

    public int expungeCount(String folder) {
        return expunges.getOrDefault(folder, 0);
    }

    public List<String> fetchedIds() {
        return new ArrayList<>(fetched);
    }

    public List<SearchScope> searchScopes() {
        return new ArrayList<>(searches);
    }

    @Override
    public synchronized void open() {
        opened = true;
    }

    @Override
    public synchronized List<FolderDescriptor> listFolders() throws MailStoreException {
        requireOpen();
        return folders.keySet().stream()
            .filter(name -> !hiddenFolders.contains(name))
            .map(name -> new FolderDescriptor(name, true))
            .collect(Collectors.toList());
    }

    @Override
    public synchronized void select(String folder) throws MailStoreException {
        requireOpen();
        selected = null;
        if (failingSelects.contains(folder) || !folders.containsKey(folder)) {
            throw new MailStoreException("SELECT " + folder + " failed");
        }
        selected = folder;
    }

    @Override
    public synchronized List<String> search(SearchScope scope) throws MailStoreException {
        searches.add(scope);
        return current("SEARCH").stream().map(m -> m.uid).collect(Collectors.toList());
    }

    @Override
    public synchronized Optional<Instant> fetchInternalDate(String messageId) throws MailStoreException {
        return Optional.ofNullable(find(messageId).received);
    }

    @Override
    public synchronized MailMessage fetchMessage(String messageId) throws MailStoreException {
        StoredMessage message = find(messageId);
        fetched.add(selected + ":" + messageId);
        if (failingFetches.remove(selected + ":" + messageId)) {
            throw new MailStoreException("FETCH " + messageId + " failed");
        }
        return MailMessage.builder()
            .identity(MessageIdentity.of(selected, messageId))
            .sender(message.sender)
            .subject(message.subject)
            .body(message.body)
            .receivedAt(message.received)
            .build();
    }

    @Override
    public synchronized void copy(String messageId, String destination) throws MailStoreException {
        StoredMessage message = find(messageId);
        if (failingCopies.contains(destination) || !folders.containsKey(destination)) {
            throw new MailStoreException("COPY to " + destination + " failed");
        }
        addMessage(destination, message.sender, message.subject, message.body, message.received);
    }

    @Override
    public synchronized void markDeleted(String messageId) throws MailStoreException {
        find(messageId).deleted = true;
    }

    @Override
    public synchronized void expunge() throws MailStoreException {
        current("EXPUNGE").removeIf(m -> m.deleted);
        expunges.merge(selected, 1, Integer::sum);
    }

    @Override
    public synchronized void createFolder(String path) throws MailStoreException {
        requireOpen();
        int slash = path.lastIndexOf('/');
        if (slash > 0 && !folders.containsKey(path.substring(0, slash))) {
            throw new MailStoreException("CREATE " + path + " failed: parent does not exist");
        }
        folder(path);
    }

    @Override
    public synchronized void close() {
        opened = false;
        selected = null;
    }

    private void requireOpen() throws MailStoreException {
        if (!opened) {
            throw new MailStoreException("not connected");
        }
    }

    private List<StoredMessage> current(String command) throws MailStoreException {
        requireOpen();
        if (selected == null) {
            throw new MailStoreException(command + " issued before SELECT");
        }
        return folders.get(selected);
    }

    private StoredMessage find(String messageId) throws MailStoreException {
        return current("FETCH").stream()
            .filter(m -> m.uid.equals(messageId))
            .findFirst()
            .orElseThrow(() -> new MailStoreException("Message " + messageId + " not found in " + selected));
    }
}
