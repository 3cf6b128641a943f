package de.vzg.reposis.crossref;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class CrossrefApplication {

    public static void main(String[] args) {
        SpringApplication.run(CrossrefApplication.class, args);
    }
}
