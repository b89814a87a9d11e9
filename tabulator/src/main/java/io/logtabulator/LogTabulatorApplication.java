package io.logtabulator;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

@SpringBootApplication
@ConfigurationPropertiesScan
public class LogTabulatorApplication {

    public static void main(String[] args) {
        SpringApplication.run(LogTabulatorApplication.class, args);
    }
}
