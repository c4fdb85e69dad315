package jump.email.sorter.service;

import jump.email.sorter.entity.MessageIdentity;
import jump.email.sorter.mail.FolderDescriptor;
import jump.email.sorter.mail.InMemoryMailStore;
import jump.email.sorter.mail.MailStoreException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FolderRouterTest {

    private InMemoryMailStore mailStore;
    private List<Long> pauses;
    private FolderRouter router;

    @BeforeEach
    void setUp() {
        mailStore = new InMemoryMailStore().folder("INBOX");
        mailStore.open();
        pauses = new ArrayList<>();
        router = new FolderRouter(mailStore, TestData.registry(TestData.properties()), 250, pauses::add);
    }

    @Test
    void resolveDestination_ShouldMapCategoryToFolder() {
        assertEquals(Optional.of("Folders/Banque"), router.resolveDestination("banque"));
        assertTrue(router.resolveDestination("UNKNOWN").isEmpty());
    }

    @Test
    void ensureFolderExists_WithMissingParent_ShouldCreateAncestorsFirst() {
        // When
        boolean available = router.ensureFolderExists("Folders/Travail");

        // Then
        assertTrue(available);
        assertTrue(mailStore.hasFolder("Folders"));
        assertTrue(mailStore.hasFolder("Folders/Travail"));
        assertEquals(List.of(250L, 250L), pauses);
    }

    @Test
    void ensureFolderExists_WithKnownFolder_ShouldNotCreateAgain() {
        // Given
        mailStore.folder("Spam");

        // When
        boolean available = router.ensureFolderExists("/Spam/");

        // Then
        assertTrue(available);
        assertTrue(pauses.isEmpty());
    }

    @Test
    void ensureFolderExists_WhenServerDoesNotListNewFolder_ShouldAssumeItExists() {
        // Given
        mailStore.hideOnCreate("Spam");

        // When
        boolean first = router.ensureFolderExists("Spam");
        boolean second = router.ensureFolderExists("Spam");

        // Then
        assertTrue(first);
        assertTrue(second);
        assertEquals(1, pauses.size());
    }

    @Test
    void move_ShouldCopyThenFlagSource() throws MailStoreException {
        // Given
        String uid = mailStore.addMessage("INBOX", "billing@bank.fr", "Facture", "", Instant.now());
        mailStore.select("INBOX");

        // When
        boolean moved = router.move(MessageIdentity.of("INBOX", uid), "INBOX", "Folders/Banque");

        // Then
        assertTrue(moved);
        assertEquals(List.of("Facture"), mailStore.subjectsIn("Folders/Banque"));
        assertTrue(mailStore.messagesIn("INBOX").get(0).deleted);
        mailStore.expunge();
        assertTrue(mailStore.messagesIn("INBOX").isEmpty());
    }

    @Test
    void move_WhenCopyFails_ShouldLeaveSourceUntouched() throws MailStoreException {
        // Given
        String uid = mailStore.addMessage("INBOX", "boss@acme.com", "Projet", "", Instant.now());
        mailStore.folder("Folders").folder("Folders/Travail");
        mailStore.failCopyTo("Folders/Travail");
        mailStore.select("INBOX");

        // When
        boolean moved = router.move(MessageIdentity.of("INBOX", uid), "INBOX", "Folders/Travail");

        // Then
        assertFalse(moved);
        assertFalse(mailStore.messagesIn("INBOX").get(0).deleted);
        assertTrue(mailStore.messagesIn("Folders/Travail").isEmpty());
    }

    @Test
    void seed_ShouldReplaceKnownFolders() {
        // Given
        router.seed(List.of(new FolderDescriptor("Spam", true)));

        // When
        boolean available = router.ensureFolderExists("Spam");

        // Then
        assertTrue(available);
        assertFalse(mailStore.hasFolder("Spam"));
    }
}
