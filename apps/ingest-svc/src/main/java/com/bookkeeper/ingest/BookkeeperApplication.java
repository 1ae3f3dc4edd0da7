package com.bookkeeper.ingest;

import com.bookkeeper.ingest.config.BookkeepingProperties;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties(BookkeepingProperties.class)
public class BookkeeperApplication {

    public static void main(String[] args) {
        System.exit(SpringApplication.exit(SpringApplication.run(BookkeeperApplication.class, args)));
    }
}
