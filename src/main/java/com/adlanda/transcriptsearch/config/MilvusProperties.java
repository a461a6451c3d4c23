package com.adlanda.transcriptsearch.config;

import io.milvus.param.IndexType;
import io.milvus.param.MetricType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import org.springframework.validation.annotation.Validated;

/**
 * Connection and collection settings for Milvus.
 *
 * Maps to properties prefixed with 'transcripts.milvus'.
 */
@Component
@Validated
@ConfigurationProperties(prefix = "transcripts.milvus")
public class MilvusProperties {

    @NotBlank
    private String host = "localhost";

    @Positive
    private int port = 19530;

    /**
     * "user:password" or API key; empty for an unauthenticated server.
     */
    private String token = "";

    @NotBlank
    private String database = "default";

    @NotBlank
    private String collectionName = "youtube";

    @NotBlank
    private String idField = "id";

    @NotBlank
    private String vectorField = "embedding";

    @NotBlank
    private String textField = "text";

    @Positive
    private int idMaxLength = 64;

    @Positive
    private int textMaxLength = 65535;

    /**
     * Vector length; must match the embedding model (1536 for text-embedding-ada-002).
     */
    @Positive
    private int dimension = 1536;

    @NotNull
    private IndexType indexType = IndexType.IVF_FLAT;

    @NotNull
    private MetricType metricType = MetricType.L2;

    @NotBlank
    private String indexParams = "{\"nlist\":1536}";

    @NotBlank
    private String searchParams = "{\"nprobe\":10}";

    public String getHost() {
        return host;
    }

    public void setHost(String host) {
        this.host = host;
    }

    public int getPort() {
        return port;
    }

    public void setPort(int port) {
        this.port = port;
    }

    public String getToken() {
        return token;
    }

    public void setToken(String token) {
        this.token = token;
    }

    public String getDatabase() {
        return database;
    }

    public void setDatabase(String database) {
        this.database = database;
    }

    public String getCollectionName() {
        return collectionName;
    }

    public void setCollectionName(String collectionName) {
        this.collectionName = collectionName;
    }

    public String getIdField() {
        return idField;
    }

    public void setIdField(String idField) {
        this.idField = idField;
    }

    public String getVectorField() {
        return vectorField;
    }

    public void setVectorField(String vectorField) {
        this.vectorField = vectorField;
    }

    public String getTextField() {
        return textField;
    }

    public void setTextField(String textField) {
        this.textField = textField;
    }

    public int getIdMaxLength() {
        return idMaxLength;
    }

    public void setIdMaxLength(int idMaxLength) {
        this.idMaxLength = idMaxLength;
    }

    public int getTextMaxLength() {
        return textMaxLength;
    }

    public void setTextMaxLength(int textMaxLength) {
        this.textMaxLength = textMaxLength;
    }

    public int getDimension() {
        return dimension;
    }

    public void setDimension(int dimension) {
        this.dimension = dimension;
    }

    public IndexType getIndexType() {
        return indexType;
    }

    public void setIndexType(IndexType indexType) {
        this.indexType = indexType;
    }

    public MetricType getMetricType() {
        return metricType;
    }

    public void setMetricType(MetricType metricType) {
        this.metricType = metricType;
    }

    public String getIndexParams() {
        return indexParams;
    }

    public void setIndexParams(String indexParams) {
        this.indexParams = indexParams;
    }

    public String getSearchParams() {
        return searchParams;
    }

    public void setSearchParams(String searchParams) {
        this.searchParams = searchParams;
    }
}
