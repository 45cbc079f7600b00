package eu.virtualparadox.ragservice;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class RagServiceApplication {

    public static void main(final String[] args) {
        SpringApplication.run(RagServiceApplication.class, args);
    }

}
