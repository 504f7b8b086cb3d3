package com.tunechat.match.embed;

import java.util.List;

public interface EmbeddingProvider {
    /**
     * Embeds the text into a fixed-length vector.
     *
     * @throws EmbeddingUnavailableException when the text is empty or the provider cannot answer
     */
    List<Double> embed(String text);
}
