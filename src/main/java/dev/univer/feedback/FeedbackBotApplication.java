package dev.univer.feedback;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class FeedbackBotApplication {
    public static void main(String[] args) {
        SpringApplication.run(FeedbackBotApplication.class, args);
    }
}
