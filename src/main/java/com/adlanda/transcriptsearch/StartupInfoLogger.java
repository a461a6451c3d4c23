package com.adlanda.transcriptsearch;

import com.adlanda.transcriptsearch.config.MilvusProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

@Component
@Order(2) // Run after IngestionRunner
public class StartupInfoLogger implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(StartupInfoLogger.class);

    private final MilvusProperties milvusProperties;

    @Value("${server.port:8080}")
    private int port;

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String version;

    public StartupInfoLogger(MilvusProperties milvusProperties) {
        this.milvusProperties = milvusProperties;
    }

    @Override
    public void run(ApplicationArguments args) {
        log.info("""

            Transcript Search v{}
            Milvus: {}:{} collection '{}'

            API Endpoints:
              GET  http://localhost:{}/api/v1
              POST http://localhost:{}/api/v1/query
              GET  http://localhost:{}/api/v1/collection

            Health:
              GET  http://localhost:{}/actuator/health
            """,
            version, milvusProperties.getHost(), milvusProperties.getPort(),
            milvusProperties.getCollectionName(), port, port, port, port
        );
    }
}
