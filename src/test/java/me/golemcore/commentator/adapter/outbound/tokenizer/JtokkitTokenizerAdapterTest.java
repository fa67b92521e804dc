package me.golemcore.commentator.adapter.outbound.tokenizer;

import me.golemcore.commentator.infrastructure.config.CommentatorProperties;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JtokkitTokenizerAdapterTest {

    @Test
    void shouldCountTokensWithDefaultEncoding() {
        JtokkitTokenizerAdapter adapter = new JtokkitTokenizerAdapter(new CommentatorProperties());

        assertEquals("cl100k_base", adapter.getEncodingName());
        assertEquals(2, adapter.countTokens("hello world"));
        assertTrue(adapter.countTokens("Sletty tamed a level 150 Tek Parasaur!") > 5);
    }

    @Test
    void shouldReturnZeroForEmptyText() {
        JtokkitTokenizerAdapter adapter = new JtokkitTokenizerAdapter(new CommentatorProperties());

        assertEquals(0, adapter.countTokens(""));
    }

    @Test
    void shouldFailForUnknownEncoding() {
        CommentatorProperties properties = new CommentatorProperties();
        properties.getBudget().setTokenizerEncoding("no_such_encoding");
        JtokkitTokenizerAdapter adapter = new JtokkitTokenizerAdapter(properties);

        assertThrows(IllegalStateException.class, () -> adapter.countTokens("hello"));
    }
}
