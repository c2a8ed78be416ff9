package ch.so.arp.nexa;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class NexaSupportApplication {

    public static void main(String[] args) {
        SpringApplication.run(NexaSupportApplication.class, args);
    }
}
