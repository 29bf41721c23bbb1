package io.github.drompincen.remindpal.gateway;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

@SpringBootApplication(scanBasePackages = "io.github.drompincen.remindpal")
@EnableScheduling
public class RemindPalApplication {

    public static void main(String[] args) {
        SpringApplication.run(RemindPalApplication.class, args);
    }
}
