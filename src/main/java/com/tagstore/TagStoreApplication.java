package com.tagstore;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for the tag store query layer.
 *
 * The tag store answers questions about event tags (which keys exist, the top
 * values of a key on an issue, which issues a set of users touched) by
 * translating them into time-bounded aggregation queries against ClickHouse
 * and mapping the tabular results back to typed records.
 */
@SpringBootApplication
public class TagStoreApplication {

    /**
     * Main entry point for the tag store application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(TagStoreApplication.class, args);
    }
}
