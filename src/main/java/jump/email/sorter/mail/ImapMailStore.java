package jump.email.sorter.mail;

import jakarta.mail.Address;
import jakarta.mail.BodyPart;
import jakarta.mail.Flags;
import jakarta.mail.Folder;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Multipart;
import jakarta.mail.Part;
import jakarta.mail.Session;
import jakarta.mail.Store;
import jakarta.mail.UIDFolder;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.search.FlagTerm;
import jump.email.sorter.config.SorterProperties;
import jump.email.sorter.entity.MailMessage;
import jump.email.sorter.entity.MessageIdentity;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Properties;

/**
 * IMAP implementation of {@link MailStore} over a single STARTTLS connection.
 * The connection is shared by all workers, so every round trip holds the instance lock.
 */
@Slf4j
public class ImapMailStore implements MailStore {
    private final SorterProperties.Imap settings;
    private Store store;
    private Folder selected;

    public ImapMailStore(SorterProperties.Imap settings) {
        this.settings = settings;
    }

    @Override
    public synchronized void open() throws MailStoreException {
        if (store != null && store.isConnected()) {
            return;
        }
        Properties props = new Properties();
        props.put("mail.store.protocol", "imap");
        props.put("mail.imap.host", settings.getHost());
        props.put("mail.imap.port", String.valueOf(settings.getPort()));
        props.put("mail.imap.starttls.enable", String.valueOf(settings.isStarttls()));
        props.put("mail.imap.connectiontimeout", String.valueOf(settings.getTimeoutMs()));
        props.put("mail.imap.timeout", String.valueOf(settings.getTimeoutMs()));
        // Fetch bodies with BODY.PEEK so classification does not mark mail as read
        props.put("mail.imap.peek", "true");
        if (settings.isTrustAll()) {
            // Local bridges present self-signed certificates
            props.put("mail.imap.ssl.trust", "*");
        }

        try {
            log.debug("Connecting to IMAP {}:{}", settings.getHost(), settings.getPort());
            Session session = Session.getInstance(props);
            Store imapStore = session.getStore("imap");
            imapStore.connect(settings.getHost(), settings.getPort(), settings.getUsername(), settings.getPassword());
            this.store = imapStore;
            log.info("Connected to IMAP {}:{} as {}", settings.getHost(), settings.getPort(), settings.getUsername());
        } catch (MessagingException e) {
            throw new MailStoreException("IMAP connection to " + settings.getHost() + ":" + settings.getPort()
                + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<FolderDescriptor> listFolders() throws MailStoreException {
        requireConnected();
        try {
            List<FolderDescriptor> folders = new ArrayList<>();
            for (Folder folder : store.getDefaultFolder().list("*")) {
                boolean selectable = (folder.getType() & Folder.HOLDS_MESSAGES) != 0;
                folders.add(new FolderDescriptor(folder.getFullName(), selectable));
            }
            return folders;
        } catch (MessagingException e) {
            throw new MailStoreException("LIST failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void select(String folderName) throws MailStoreException {
        requireConnected();
        closeSelected();
        try {
            Folder folder = store.getFolder(folderName);
            folder.open(Folder.READ_WRITE);
            this.selected = folder;
        } catch (MessagingException e) {
            throw new MailStoreException("SELECT " + folderName + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized List<String> search(SearchScope scope) throws MailStoreException {
        Folder folder = requireSelected("SEARCH");
        try {
            Message[] messages = scope == SearchScope.UNSEEN
                ? folder.search(new FlagTerm(new Flags(Flags.Flag.SEEN), false))
                : folder.getMessages();
            UIDFolder uidFolder = (UIDFolder) folder;
            List<String> ids = new ArrayList<>(messages.length);
            for (Message message : messages) {
                ids.add(String.valueOf(uidFolder.getUID(message)));
            }
            return ids;
        } catch (MessagingException e) {
            throw new MailStoreException("SEARCH " + scope + " in " + folder.getFullName() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized Optional<Instant> fetchInternalDate(String messageId) throws MailStoreException {
        Message message = lookup(messageId);
        try {
            return Optional.ofNullable(message.getReceivedDate()).map(java.util.Date::toInstant);
        } catch (MessagingException e) {
            throw new MailStoreException("FETCH INTERNALDATE " + messageId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized MailMessage fetchMessage(String messageId) throws MailStoreException {
        Message message = lookup(messageId);
        try {
            Instant received = message.getReceivedDate() != null ? message.getReceivedDate().toInstant() : null;
            return MailMessage.builder()
                .identity(MessageIdentity.of(selected.getFullName(), messageId))
                .sender(extractSender(message))
                .subject(message.getSubject())
                .body(extractBody(message))
                .receivedAt(received)
                .build();
        } catch (MessagingException | IOException e) {
            throw new MailStoreException("FETCH " + messageId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void copy(String messageId, String destination) throws MailStoreException {
        Message message = lookup(messageId);
        try {
            Folder target = store.getFolder(destination);
            selected.copyMessages(new Message[]{message}, target);
        } catch (MessagingException e) {
            throw new MailStoreException("COPY " + messageId + " to " + destination + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void markDeleted(String messageId) throws MailStoreException {
        Message message = lookup(messageId);
        try {
            message.setFlag(Flags.Flag.DELETED, true);
        } catch (MessagingException e) {
            throw new MailStoreException("STORE +FLAGS \\Deleted " + messageId + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void expunge() throws MailStoreException {
        Folder folder = requireSelected("EXPUNGE");
        try {
            folder.expunge();
        } catch (MessagingException e) {
            throw new MailStoreException("EXPUNGE in " + folder.getFullName() + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void createFolder(String path) throws MailStoreException {
        requireConnected();
        try {
            Folder folder = store.getFolder(path);
            if (folder.exists()) {
                return;
            }
            if (!folder.create(Folder.HOLDS_MESSAGES | Folder.HOLDS_FOLDERS)) {
                throw new MailStoreException("CREATE " + path + " refused by server");
            }
        } catch (MessagingException e) {
            throw new MailStoreException("CREATE " + path + " failed: " + e.getMessage(), e);
        }
    }

    @Override
    public synchronized void close() {
        closeSelected();
        if (store != null) {
            try {
                store.close();
            } catch (MessagingException e) {
                log.warn("Error closing IMAP connection: {}", e.getMessage());
            }
            store = null;
        }
    }

    private void closeSelected() {
        if (selected != null && selected.isOpen()) {
            try {
                // Expunge is always explicit, never a side effect of switching folders
                selected.close(false);
            } catch (MessagingException e) {
                log.warn("Error closing folder {}: {}", selected.getFullName(), e.getMessage());
            }
        }
        selected = null;
    }

    private void requireConnected() throws MailStoreException {
        if (store == null || !store.isConnected()) {
            throw new MailStoreException("IMAP connection is not open");
        }
    }

    private Folder requireSelected(String command) throws MailStoreException {
        requireConnected();
        if (selected == null || !selected.isOpen()) {
            throw new MailStoreException(command + " issued before SELECT");
        }
        return selected;
    }

    private Message lookup(String messageId) throws MailStoreException {
        Folder folder = requireSelected("FETCH");
        try {
            Message message = ((UIDFolder) folder).getMessageByUID(Long.parseLong(messageId));
            if (message == null) {
                throw new MailStoreException("Message " + messageId + " not found in " + folder.getFullName());
            }
            return message;
        } catch (NumberFormatException e) {
            throw new MailStoreException("Invalid IMAP UID: " + messageId, e);
        } catch (MessagingException e) {
            throw new MailStoreException("UID lookup " + messageId + " failed: " + e.getMessage(), e);
        }
    }

    private String extractSender(Message message) throws MessagingException {
        Address[] from = message.getFrom();
        if (from == null || from.length == 0) {
            return "";
        }
        if (from[0] instanceof InternetAddress) {
            return ((InternetAddress) from[0]).getAddress();
        }
        return from[0].toString();
    }

    private String extractBody(Part part) throws MessagingException, IOException {
        BodyText text = new BodyText();
        collectBody(part, text);
        if (text.plain.length() > 0) {
            return text.plain.toString();
        }
        return text.html.toString().replaceAll("<[^>]+>", " ").replaceAll("\\s+", " ").trim();
    }

    /**
     * Helper class to accumulate plain text and HTML content found in message parts
     */
    private static class BodyText {
        final StringBuilder plain = new StringBuilder();
        final StringBuilder html = new StringBuilder();
    }

    private void collectBody(Part part, BodyText text) throws MessagingException, IOException {
        if (Part.ATTACHMENT.equalsIgnoreCase(part.getDisposition())) {
            return;
        }
        if (part.isMimeType("text/plain")) {
            appendLine(text.plain, part.getContent());
        } else if (part.isMimeType("text/html")) {
            appendLine(text.html, part.getContent());
        } else if (part.isMimeType("multipart/*")) {
            Multipart multipart = (Multipart) part.getContent();
            for (int i = 0; i < multipart.getCount(); i++) {
                BodyPart bodyPart = multipart.getBodyPart(i);
                collectBody(bodyPart, text);
            }
        }
    }

    private void appendLine(StringBuilder target, Object content) {
        if (content == null) {
            return;
        }
        if (target.length() > 0) {
            target.append('\n');
        }
        target.append(content);
    }
}
