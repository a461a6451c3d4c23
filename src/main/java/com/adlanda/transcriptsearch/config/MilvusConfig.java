package com.adlanda.transcriptsearch.config;

import io.milvus.client.MilvusServiceClient;
import io.milvus.param.ConnectParam;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Creates the Milvus client from {@link MilvusProperties}.
 */
@Configuration
public class MilvusConfig {

    @Bean(destroyMethod = "close")
    public MilvusServiceClient milvusClient(MilvusProperties properties) {
        ConnectParam.Builder builder = ConnectParam.newBuilder()
                .withHost(properties.getHost())
                .withPort(properties.getPort())
                .withDatabaseName(properties.getDatabase());

        if (!properties.getToken().isBlank()) {
            builder.withToken(properties.getToken());
        }

        return new MilvusServiceClient(builder.build());
    }
}
