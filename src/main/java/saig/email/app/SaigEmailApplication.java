package saig.email.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class SaigEmailApplication {

    public static void main(String[] args) {
        SpringApplication.run(SaigEmailApplication.class, args);
    }
}
