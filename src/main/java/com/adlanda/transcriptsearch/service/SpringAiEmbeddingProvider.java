package com.adlanda.transcriptsearch.service;

import com.adlanda.transcriptsearch.exception.EmbeddingProviderException;
import com.adlanda.transcriptsearch.exception.TransientEmbeddingException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.embedding.Embedding;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.ai.embedding.EmbeddingResponse;
import org.springframework.ai.retry.NonTransientAiException;
import org.springframework.ai.retry.TransientAiException;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;

import java.util.Comparator;
import java.util.List;

/**
 * Embedding provider backed by Spring AI's EmbeddingModel (OpenAI in production).
 *
 * Translates provider failures into {@link TransientEmbeddingException} when a retry
 * may succeed and {@link EmbeddingProviderException} otherwise.
 */
@Service
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private static final Logger log = LoggerFactory.getLogger(SpringAiEmbeddingProvider.class);

    private final EmbeddingModel embeddingModel;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel) {
        this.embeddingModel = embeddingModel;
    }

    @Override
    public List<float[]> embed(List<String> texts) {
        if (texts.isEmpty()) {
            return List.of();
        }

        EmbeddingResponse response;
        try {
            response = embeddingModel.embedForResponse(texts);
        } catch (TransientAiException | ResourceAccessException | HttpServerErrorException e) {
            throw new TransientEmbeddingException("Embedding request failed: " + e.getMessage(), e);
        } catch (HttpClientErrorException.TooManyRequests e) {
            throw new TransientEmbeddingException("Embedding request rate limited", e);
        } catch (NonTransientAiException e) {
            if (isRateLimited(e)) {
                throw new TransientEmbeddingException("Embedding request rate limited: " + e.getMessage(), e);
            }
            throw new EmbeddingProviderException("Embedding request rejected: " + e.getMessage(), e);
        } catch (RuntimeException e) {
            throw new EmbeddingProviderException("Embedding request failed: " + e.getMessage(), e);
        }

        List<float[]> vectors = response.getResults().stream()
                .sorted(Comparator.comparing(Embedding::getIndex))
                .map(Embedding::getOutput)
                .toList();

        log.debug("Embedded {} texts", vectors.size());
        return vectors;
    }

    /**
     * Spring AI reports every 4xx as non-transient, with the status code leading the message.
     */
    private boolean isRateLimited(NonTransientAiException e) {
        return e.getMessage() != null && e.getMessage().startsWith("429");
    }
}
