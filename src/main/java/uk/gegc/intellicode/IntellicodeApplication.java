package uk.gegc.intellicode;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class IntellicodeApplication {

    public static void main(String[] args) {
        SpringApplication.run(IntellicodeApplication.class, args);
    }
}
