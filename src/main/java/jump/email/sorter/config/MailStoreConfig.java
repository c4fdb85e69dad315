package jump.email.sorter.config;

import jump.email.sorter.mail.ImapMailStore;
import jump.email.sorter.mail.MailStore;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class MailStoreConfig {

    /**
     * Missing credentials are the one configuration error that stops the process at startup.
     */
    @Bean(destroyMethod = "close")
    public MailStore mailStore(SorterProperties properties) {
        SorterProperties.Imap imap = properties.getImap();
        if (imap.getUsername() == null || imap.getUsername().isBlank()) {
            throw new IllegalStateException("IMAP username is not configured. Please set sorter.imap.username (SORTER_IMAP_USERNAME)");
        }
        if (imap.getPassword() == null || imap.getPassword().isBlank()) {
            throw new IllegalStateException("IMAP password is not configured. Please set sorter.imap.password (SORTER_IMAP_PASSWORD)");
        }
        return new ImapMailStore(imap);
    }
}
