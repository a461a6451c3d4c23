package com.adlanda.transcriptsearch.service;

import com.adlanda.transcriptsearch.exception.DataIntegrityException;
import com.adlanda.transcriptsearch.exception.EmbeddingFailedException;
import com.adlanda.transcriptsearch.exception.EmbeddingProviderException;
import com.adlanda.transcriptsearch.exception.IngestionCancelledException;
import com.adlanda.transcriptsearch.exception.TransientEmbeddingException;
import com.adlanda.transcriptsearch.exception.VectorStoreException;
import com.adlanda.transcriptsearch.model.Chunk;
import com.adlanda.transcriptsearch.model.EmbeddedChunk;
import com.adlanda.transcriptsearch.model.IngestionResult;
import com.adlanda.transcriptsearch.repository.VectorCollection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.retry.RetryCallback;
import org.springframework.retry.RetryContext;
import org.springframework.retry.RetryListener;
import org.springframework.retry.backoff.BackOffInterruptedException;
import org.springframework.retry.backoff.FixedBackOffPolicy;
import org.springframework.retry.support.RetryTemplate;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Embeds chunks in fixed-size batches and inserts each batch into the vector collection.
 *
 * Batches run strictly one after another. Transient embedding failures are retried
 * forever with a fixed delay; everything else aborts the run, leaving earlier batches
 * committed.
 */
public class IngestionPipeline {

    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);

    private final EmbeddingProvider embeddingProvider;
    private final VectorCollection collection;
    private final PipelineSettings settings;
    private final RetryWait retryWait;

    public IngestionPipeline(EmbeddingProvider embeddingProvider,
                             VectorCollection collection,
                             PipelineSettings settings) {
        this(embeddingProvider, collection, settings, CancellationToken::await);
    }

    IngestionPipeline(EmbeddingProvider embeddingProvider,
                      VectorCollection collection,
                      PipelineSettings settings,
                      RetryWait retryWait) {
        this.embeddingProvider = embeddingProvider;
        this.collection = collection;
        this.settings = settings;
        this.retryWait = retryWait;
    }

    public IngestionResult ingest(List<Chunk> chunks) {
        return ingest(chunks, CancellationToken.none());
    }

    /**
     * Embeds and stores all chunks.
     *
     * @param chunks Chunks in the order they should be inserted
     * @param token  Checked before every batch and every embedding attempt
     * @return total number of entities stored
     * @throws EmbeddingFailedException if the provider fails with a non-transient error
     * @throws DataIntegrityException if the provider returns vectors of the wrong shape
     * @throws VectorStoreException if an insert fails
     * @throws IngestionCancelledException if the token is cancelled or the thread interrupted
     */
    public IngestionResult ingest(List<Chunk> chunks, CancellationToken token) {
        if (chunks.isEmpty()) {
            log.info("No chunks to ingest");
            return IngestionResult.empty();
        }

        int batchSize = settings.batchSize();
        int batchCount = (int) ((chunks.size() + (long) batchSize - 1) / batchSize);
        log.info("Ingesting {} chunks in {} batches of up to {}", chunks.size(), batchCount, batchSize);

        long stored = 0;
        for (int batchIndex = 0; batchIndex < batchCount; batchIndex++) {
            int from = batchIndex * batchSize;
            int to = (int) Math.min((long) from + batchSize, chunks.size());
            List<Chunk> batch = chunks.subList(from, to);

            checkCancelled(token, batchIndex, batch, stored);

            List<float[]> vectors = embedWithRetry(batch, batchIndex, token, stored);
            List<EmbeddedChunk> embedded = pair(batch, vectors, batchIndex, stored);
            stored += insert(embedded, batchIndex, stored);

            log.info("Stored batch {}/{} ({} entities so far)", batchIndex + 1, batchCount, stored);
        }

        return new IngestionResult(stored, batchCount);
    }

    private List<float[]> embedWithRetry(List<Chunk> batch, int batchIndex,
                                         CancellationToken token, long stored) {
        List<String> texts = batch.stream().map(Chunk::text).toList();
        RetryTemplate retryTemplate = retryTemplate(batchIndex, token);

        try {
            return retryTemplate.execute((RetryCallback<List<float[]>, RuntimeException>) context -> {
                checkCancelled(token, batchIndex, batch, stored);
                return embeddingProvider.embed(texts);
            });
        } catch (BackOffInterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IngestionCancelledException(batchIndex, batch.get(0).id(), stored);
        } catch (EmbeddingProviderException e) {
            throw new EmbeddingFailedException(
                    "Batch " + batchIndex + ": embedding failed: " + e.getMessage(),
                    batchIndex, batch.get(0).id(), stored, e);
        }
    }

    private RetryTemplate retryTemplate(int batchIndex, CancellationToken token) {
        Duration delay = settings.retryDelay();

        FixedBackOffPolicy backOff = new FixedBackOffPolicy();
        backOff.setBackOffPeriod(delay.toMillis());
        backOff.setSleeper(period -> retryWait.await(token, Duration.ofMillis(period)));

        return RetryTemplate.builder()
                .infiniteRetry()
                .retryOn(TransientEmbeddingException.class)
                .customBackoff(backOff)
                .withListener(new RetryListener() {
                    @Override
                    public <T, E extends Throwable> void onError(RetryContext context,
                                                                 RetryCallback<T, E> callback,
                                                                 Throwable throwable) {
                        if (throwable instanceof TransientEmbeddingException) {
                            log.warn("Embedding batch {} failed (attempt {}): {}. Retrying in {}",
                                    batchIndex, context.getRetryCount(), throwable.getMessage(), delay);
                        }
                    }
                })
                .build();
    }

    private List<EmbeddedChunk> pair(List<Chunk> batch, List<float[]> vectors, int batchIndex, long stored) {
        if (vectors == null || vectors.size() != batch.size()) {
            throw new DataIntegrityException(
                    "Batch " + batchIndex + ": expected " + batch.size() + " embeddings, got "
                            + (vectors == null ? 0 : vectors.size()),
                    batchIndex, batch.get(0).id(), stored);
        }

        List<EmbeddedChunk> embedded = new ArrayList<>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            EmbeddedChunk chunk = batch.get(i).withEmbedding(vectors.get(i));
            if (chunk.dimension() != settings.embeddingDimension()) {
                throw new DataIntegrityException(
                        "Batch " + batchIndex + ": chunk " + chunk.id() + " has embedding dimension "
                                + chunk.dimension() + ", expected " + settings.embeddingDimension(),
                        batchIndex, chunk.id(), stored);
            }
            embedded.add(chunk);
        }
        return embedded;
    }

    private long insert(List<EmbeddedChunk> embedded, int batchIndex, long stored) {
        List<String> ids = new ArrayList<>(embedded.size());
        List<float[]> vectors = new ArrayList<>(embedded.size());
        List<String> texts = new ArrayList<>(embedded.size());
        for (EmbeddedChunk chunk : embedded) {
            ids.add(chunk.id());
            vectors.add(chunk.embedding());
            texts.add(chunk.text());
        }

        try {
            return collection.insert(ids, vectors, texts);
        } catch (RuntimeException e) {
            throw new VectorStoreException(
                    "Batch " + batchIndex + ": insert failed: " + e.getMessage(),
                    batchIndex, ids.get(0), stored, e);
        }
    }

    private void checkCancelled(CancellationToken token, int batchIndex, List<Chunk> batch, long stored) {
        if (token.isCancelled() || Thread.currentThread().isInterrupted()) {
            throw new IngestionCancelledException(batchIndex, batch.get(0).id(), stored);
        }
    }

    /**
     * Waits between embedding attempts.
     */
    @FunctionalInterface
    interface RetryWait {
        void await(CancellationToken token, Duration delay) throws InterruptedException;
    }
}
