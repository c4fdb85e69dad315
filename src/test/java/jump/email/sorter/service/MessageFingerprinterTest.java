package jump.email.sorter.service;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MessageFingerprinterTest {

    private final MessageFingerprinter fingerprinter = new MessageFingerprinter();

    @Test
    void fingerprint_WithReplyPrefixAndDifferentNumbers_ShouldMatchOriginal() {
        // Given
        String original = fingerprinter.fingerprint("billing@shop.com", "Votre facture 1234");

        // When
        String reply = fingerprinter.fingerprint("Shop Billing <Billing@Shop.com>", "RE: Fwd:  votre   facture 98");

        // Then
        assertEquals(original, reply);
    }

    @Test
    void fingerprint_WithDifferentSender_ShouldDiffer() {
        assertNotEquals(
            fingerprinter.fingerprint("a@shop.com", "Votre facture"),
            fingerprinter.fingerprint("b@shop.com", "Votre facture"));
    }

    @Test
    void normalizeSubject_ShouldTruncateToFiftyCharacters() {
        // When
        String normalized = MessageFingerprinter.normalizeSubject("x".repeat(80));

        // Then
        assertEquals(50, normalized.length());
    }

    @Test
    void domainOf_ShouldReturnLowerCaseDomainOrEmpty() {
        assertEquals("credit.fr", MessageFingerprinter.domainOf("Banque <Alerts@Credit.FR>"));
        assertEquals("", MessageFingerprinter.domainOf("no-address"));
        assertEquals("", MessageFingerprinter.domainOf(null));
    }
}
