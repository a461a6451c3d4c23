package com.adlanda.transcriptsearch.repository;

import com.adlanda.transcriptsearch.config.MilvusProperties;
import com.adlanda.transcriptsearch.exception.VectorStoreException;
import com.adlanda.transcriptsearch.model.SearchHit;
import io.milvus.client.MilvusClient;
import io.milvus.common.clientenum.ConsistencyLevelEnum;
import io.milvus.grpc.DataType;
import io.milvus.grpc.GetCollectionStatisticsResponse;
import io.milvus.grpc.MutationResult;
import io.milvus.grpc.SearchResults;
import io.milvus.param.R;
import io.milvus.param.collection.CollectionSchemaParam;
import io.milvus.param.collection.CreateCollectionParam;
import io.milvus.param.collection.DropCollectionParam;
import io.milvus.param.collection.FieldType;
import io.milvus.param.collection.GetCollectionStatisticsParam;
import io.milvus.param.collection.HasCollectionParam;
import io.milvus.param.collection.LoadCollectionParam;
import io.milvus.param.dml.InsertParam;
import io.milvus.param.dml.SearchParam;
import io.milvus.param.index.CreateIndexParam;
import io.milvus.response.GetCollStatResponseWrapper;
import io.milvus.response.SearchResultsWrapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.List;

/**
 * Milvus-backed collection of transcript chunks.
 *
 * Schema: VarChar primary key (not auto-generated), FloatVector of the configured
 * dimension, VarChar text. Field names, index and metric come from {@link MilvusProperties}.
 */
@Repository
public class MilvusVectorCollection implements VectorCollection {

    private static final Logger log = LoggerFactory.getLogger(MilvusVectorCollection.class);

    private static final int SHARDS = 2;

    private final MilvusClient client;
    private final MilvusProperties properties;

    public MilvusVectorCollection(MilvusClient client, MilvusProperties properties) {
        this.client = client;
        this.properties = properties;
    }

    @Override
    public long insert(List<String> ids, List<float[]> vectors, List<String> texts) {
        if (ids.size() != vectors.size() || ids.size() != texts.size()) {
            throw new VectorStoreException("Insert payload lists differ in length: ids=" + ids.size()
                    + ", vectors=" + vectors.size() + ", texts=" + texts.size());
        }

        List<InsertParam.Field> fields = List.of(
                new InsertParam.Field(properties.getIdField(), ids),
                new InsertParam.Field(properties.getVectorField(), toFloatLists(vectors)),
                new InsertParam.Field(properties.getTextField(), texts)
        );

        InsertParam param = InsertParam.newBuilder()
                .withCollectionName(properties.getCollectionName())
                .withFields(fields)
                .build();

        MutationResult result = check(client.insert(param), "insert");
        log.debug("Inserted {} entities into {}", result.getInsertCnt(), properties.getCollectionName());
        return result.getInsertCnt();
    }

    @Override
    public void createIndex() {
        CreateIndexParam param = CreateIndexParam.newBuilder()
                .withCollectionName(properties.getCollectionName())
                .withFieldName(properties.getVectorField())
                .withIndexType(properties.getIndexType())
                .withMetricType(properties.getMetricType())
                .withExtraParam(properties.getIndexParams())
                .withSyncMode(Boolean.TRUE)
                .build();

        check(client.createIndex(param), "createIndex");
        log.info("Created {} index ({}) on {}.{}", properties.getIndexType(), properties.getMetricType(),
                properties.getCollectionName(), properties.getVectorField());
    }

    @Override
    public List<List<SearchHit>> search(List<float[]> vectors, int limit) {
        if (vectors.isEmpty()) {
            return List.of();
        }

        SearchParam param = SearchParam.newBuilder()
                .withCollectionName(properties.getCollectionName())
                .withMetricType(properties.getMetricType())
                .withOutFields(List.of(properties.getTextField()))
                .withTopK(limit)
                .withVectors(toFloatLists(vectors))
                .withVectorFieldName(properties.getVectorField())
                .withParams(properties.getSearchParams())
                .withConsistencyLevel(ConsistencyLevelEnum.STRONG)
                .build();

        SearchResults results = check(client.search(param), "search");
        SearchResultsWrapper wrapper = new SearchResultsWrapper(results.getResults());

        List<List<SearchHit>> hits = new ArrayList<>(vectors.size());
        for (int i = 0; i < vectors.size(); i++) {
            hits.add(wrapper.getIDScore(i).stream()
                    .map(score -> new SearchHit(
                            score.getStrID(),
                            String.valueOf(score.get(properties.getTextField())),
                            score.getScore()))
                    .toList());
        }
        return hits;
    }

    @Override
    public void recreate() {
        String name = properties.getCollectionName();

        Boolean exists = check(client.hasCollection(HasCollectionParam.newBuilder()
                .withCollectionName(name)
                .build()), "hasCollection");
        if (Boolean.TRUE.equals(exists)) {
            check(client.dropCollection(DropCollectionParam.newBuilder()
                    .withCollectionName(name)
                    .build()), "dropCollection");
            log.info("Dropped existing collection {}", name);
        }

        CollectionSchemaParam schema = CollectionSchemaParam.newBuilder()
                .addFieldType(FieldType.newBuilder()
                        .withName(properties.getIdField())
                        .withDataType(DataType.VarChar)
                        .withMaxLength(properties.getIdMaxLength())
                        .withPrimaryKey(true)
                        .withAutoID(false)
                        .build())
                .addFieldType(FieldType.newBuilder()
                        .withName(properties.getVectorField())
                        .withDataType(DataType.FloatVector)
                        .withDimension(properties.getDimension())
                        .build())
                .addFieldType(FieldType.newBuilder()
                        .withName(properties.getTextField())
                        .withDataType(DataType.VarChar)
                        .withMaxLength(properties.getTextMaxLength())
                        .build())
                .build();

        check(client.createCollection(CreateCollectionParam.newBuilder()
                .withCollectionName(name)
                .withDescription("Windowed transcript chunks")
                .withShardsNum(SHARDS)
                .withSchema(schema)
                .build()), "createCollection");
        log.info("Created collection {} (dimension {})", name, properties.getDimension());
    }

    @Override
    public void load() {
        check(client.loadCollection(LoadCollectionParam.newBuilder()
                .withCollectionName(properties.getCollectionName())
                .build()), "loadCollection");
        log.info("Loaded collection {}", properties.getCollectionName());
    }

    @Override
    public long count() {
        GetCollectionStatisticsResponse response = check(client.getCollectionStatistics(
                GetCollectionStatisticsParam.newBuilder()
                        .withCollectionName(properties.getCollectionName())
                        .build()), "getCollectionStatistics");
        return new GetCollStatResponseWrapper(response).getRowCount();
    }

    private <T> T check(R<T> response, String operation) {
        if (response.getStatus() != R.Status.Success.getCode()) {
            throw new VectorStoreException("Milvus " + operation + " on " + properties.getCollectionName()
                    + " failed: " + response.getMessage(), response.getException());
        }
        return response.getData();
    }

    private static List<List<Float>> toFloatLists(List<float[]> vectors) {
        List<List<Float>> lists = new ArrayList<>(vectors.size());
        for (float[] vector : vectors) {
            List<Float> list = new ArrayList<>(vector.length);
            for (float value : vector) {
                list.add(value);
            }
            lists.add(list);
        }
        return lists;
    }
}
