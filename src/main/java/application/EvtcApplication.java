package application;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication(scanBasePackages = {"application", "common", "controller", "engine", "service"})
public class EvtcApplication {
    public static void main(String[] args) {
        SpringApplication.run(EvtcApplication.class, args);
    }
}
