package com.tomeqa.index.embed;

import java.util.List;

public interface EmbeddingsClient {

    float[] embed(String text);

    /**
     * Embeds all texts in one call. The result has the same size and order as the input.
     */
    List<float[]> embedBatch(List<String> texts);
}
