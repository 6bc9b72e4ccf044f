package com.naag.docsync.embed;

import com.naag.docsync.llm.EmbeddingsClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HybridEmbedderTest {

    @Mock
    private EmbeddingsClient embeddingsClient;

    private HybridEmbedder embedder;

    @BeforeEach
    void setUp() {
        embedder = new HybridEmbedder(embeddingsClient, new SparseVectorizer(), 3);
    }

    @Test
    @DisplayName("Document embedding failures propagate")
    void documentEmbeddingFailurePropagates() {
        when(embeddingsClient.embed(anyString())).thenThrow(new EmbeddingException("503 from provider"));

        assertThatThrownBy(() -> embedder.embedDocument("text"))
                .isInstanceOf(EmbeddingException.class)
                .hasMessageContaining("503");
    }

    @Test
    @DisplayName("Empty vectors are rejected on the ingestion path")
    void emptyVectorRejected() {
        when(embeddingsClient.embed(anyString())).thenReturn(List.of());

        assertThatThrownBy(() -> embedder.embedDocument("text")).isInstanceOf(EmbeddingException.class);
    }

    @Test
    @DisplayName("Query embedding falls back to a zero vector of the configured dimension")
    void queryFallsBackToZeroVector() {
        when(embeddingsClient.embed(anyString())).thenThrow(new EmbeddingException("timeout"));

        assertThat(embedder.embedQuery("export permit")).containsExactly(0.0, 0.0, 0.0);
    }

    @Test
    @DisplayName("Sparse side does not call the embedding service")
    void sparseIsLocal() {
        assertThat(embedder.sparse("export permit procedure").indices()).hasSize(3);
    }
}
