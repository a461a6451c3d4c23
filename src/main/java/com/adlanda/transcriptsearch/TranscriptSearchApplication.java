package com.adlanda.transcriptsearch;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Transcript Search - Main Application
 *
 * Merges short transcript segments into overlapping windows, embeds them
 * and stores them in Milvus so they can be searched by meaning.
 *
 * This application uses:
 * - Spring Boot 3.4 with Java 17
 * - Spring AI for embedding generation via OpenAI
 * - Milvus for vector storage and similarity search
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class TranscriptSearchApplication {

    public static void main(String[] args) {
        SpringApplication.run(TranscriptSearchApplication.class, args);
    }
}
