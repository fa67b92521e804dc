package me.golemcore.commentator.adapter.outbound.embedding;

import me.golemcore.commentator.domain.exception.EmbeddingUnavailableException;
import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import org.junit.jupiter.api.Test;

import java.util.concurrent.ExecutionException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;

class Langchain4jEmbeddingAdapterTest {

    @Test
    void shouldBeUnavailableWithoutApiKey() {
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(new CommentatorProperties());

        assertFalse(adapter.isAvailable());
        ExecutionException e = assertThrows(ExecutionException.class, () -> adapter.embed("text").get());
        assertInstanceOf(EmbeddingUnavailableException.class, e.getCause());
    }

    @Test
    void shouldExposeConfiguredModelAndDimension() {
        CommentatorProperties properties = new CommentatorProperties();
        properties.getSemantic().getEmbedding().setModel("custom-embed");
        properties.getSemantic().getEmbedding().setDimension(384);
        Langchain4jEmbeddingAdapter adapter = new Langchain4jEmbeddingAdapter(properties);

        assertEquals("custom-embed", adapter.getModel());
        assertEquals(384, adapter.getDimension());
    }

    @Test
    void shouldDefaultModelName() {
        CommentatorProperties properties = new CommentatorProperties();
        properties.getSemantic().getEmbedding().setModel(" ");

        assertEquals("text-embedding-3-small", new Langchain4jEmbeddingAdapter(properties).getModel());
    }
}
