package com.tracelake;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Main application class for TraceLake.
 *
 * TraceLake turns MongoDB structured JSON server logs into a local columnar
 * dataset: events are normalized into slow queries, authentications and
 * connections, written as compressed Parquet partitions under a versioned
 * manifest, indexed by record key back to their exact source bytes, and
 * served through aggregate, trend and search queries.
 *
 * @version 1.0.0
 */
@SpringBootApplication
public class TraceLakeApplication {

    /**
     * Main entry point for the TraceLake application.
     *
     * @param args command line arguments
     */
    public static void main(String[] args) {
        SpringApplication.run(TraceLakeApplication.class, args);
    }
}
