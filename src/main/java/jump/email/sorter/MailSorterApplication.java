package jump.email.sorter;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class MailSorterApplication {

    public static void main(String[] args) {
        SpringApplication.run(MailSorterApplication.class, args);
    }
}
