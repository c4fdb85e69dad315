package jump.email.sorter.mail;

import jump.email.sorter.entity.MailMessage;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Interface for mail-store operations.
 * Calls against one folder must follow select, then search, then fetch/copy/mark, then expunge.
 * Message identifiers are the store's unique identifiers rendered as strings.
 */
public interface MailStore extends AutoCloseable {
    /**
     * Open the connection and authenticate.
     * @throws MailStoreException if the store cannot be reached or refuses the credentials
     */
    void open() throws MailStoreException;

    /**
     * List every folder of the store.
     * @return folder descriptors with full paths
     * @throws MailStoreException if the listing fails
     */
    List<FolderDescriptor> listFolders() throws MailStoreException;

    /**
     * Select a folder for the following search/fetch/copy/store/expunge calls.
     * @param folder full folder path
     * @throws MailStoreException if the folder does not exist or cannot be opened
     */
    void select(String folder) throws MailStoreException;

    /**
     * Search the selected folder.
     * @param scope ALL or UNSEEN
     * @return message identifiers in store order
     * @throws MailStoreException if no folder is selected or the search fails
     */
    List<String> search(SearchScope scope) throws MailStoreException;

    /**
     * Fetch the date the store received a message.
     * @param messageId identifier in the selected folder
     * @return the internal date, or empty when the store does not report one
     * @throws MailStoreException if the fetch fails
     */
    Optional<Instant> fetchInternalDate(String messageId) throws MailStoreException;

    /**
     * Fetch and decode a message of the selected folder.
     * @param messageId identifier in the selected folder
     * @return the decoded message, its identity bound to the selected folder
     * @throws MailStoreException if the message is gone or cannot be read
     */
    MailMessage fetchMessage(String messageId) throws MailStoreException;

    /**
     * Copy a message of the selected folder into another folder.
     * @throws MailStoreException if the copy is refused
     */
    void copy(String messageId, String destination) throws MailStoreException;

    /**
     * Flag a message of the selected folder as deleted.
     * @throws MailStoreException if the flag cannot be stored
     */
    void markDeleted(String messageId) throws MailStoreException;

    /**
     * Permanently remove the deleted-flagged messages of the selected folder.
     * @throws MailStoreException if the purge fails
     */
    void expunge() throws MailStoreException;

    /**
     * Create a single folder. Its parent must already exist on some servers.
     * @throws MailStoreException if creation fails
     */
    void createFolder(String path) throws MailStoreException;

    /**
     * Close the connection. Never throws.
     */
    @Override
    void close();
}
