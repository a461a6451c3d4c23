package com.adlanda.transcriptsearch.service;

import java.util.List;

/**
 * Turns text into vectors.
 */
public interface EmbeddingProvider {

    /**
     * Embeds the given texts.
     *
     * @param texts Texts to embed
     * @return one vector per text, in input order
     * @throws com.adlanda.transcriptsearch.exception.TransientEmbeddingException on rate limiting,
     *         server or network faults
     * @throws com.adlanda.transcriptsearch.exception.EmbeddingProviderException on any other failure
     */
    List<float[]> embed(List<String> texts);

    /**
     * Embeds a single text.
     */
    default float[] embed(String text) {
        return embed(List.of(text)).get(0);
    }
}
