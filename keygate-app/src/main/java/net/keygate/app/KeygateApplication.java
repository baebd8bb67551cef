package net.keygate.app;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication
@EnableScheduling
public class KeygateApplication {

    public static void main(String[] args) {
        SpringApplication.run(KeygateApplication.class, args);
    }
}
