package com.sqlrecall;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Main application class for SQL Recall - persistent query-result cache for natural-language SQL questions.
 */
@SpringBootApplication
@EnableScheduling
public class SqlRecallApplication {

    public static void main(String[] args) {
        SpringApplication.run(SqlRecallApplication.class, args);
    }
}
