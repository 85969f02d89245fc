package tech.noetzold.verification_api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class VerificationApiApplication {

    public static void main(String[] args) {
        SpringApplication.run(VerificationApiApplication.class, args);
    }
}
