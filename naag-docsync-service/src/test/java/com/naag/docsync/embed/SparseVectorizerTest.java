package com.naag.docsync.embed;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SparseVectorizerTest {

    private final SparseVectorizer vectorizer = new SparseVectorizer();

    @Nested
    @DisplayName("vectorize")
    class Vectorize {

        @Test
        @DisplayName("Should weight terms by frequency and drop short tokens")
        void shouldWeightTermsByFrequency() {
            SparseVector v = vectorizer.vectorize("Export permit export of goods");

            // "of" is too short; "export" appears twice (case-insensitive)
            assertThat(v.indices()).hasSize(3);
            int exportIdx = v.indices().indexOf(vectorizer.termId("export"));
            assertThat(v.values().get(exportIdx)).isEqualTo(2.0);
            assertThat(v.values().get(v.indices().indexOf(vectorizer.termId("permit")))).isEqualTo(1.0);
        }

        @Test
        @DisplayName("Should produce sorted unique indices")
        void shouldProduceSortedIndices() {
            SparseVector v = vectorizer.vectorize("zebra apple mango apple banana cherry");

            assertThat(v.indices()).isSorted().doesNotHaveDuplicates();
        }

        @Test
        @DisplayName("Should sum frequencies of colliding terms")
        void shouldSumCollisions() {
            SparseVectorizer tiny = new SparseVectorizer(1);

            SparseVector v = tiny.vectorize("alpha beta gamma");

            assertThat(v.indices()).containsExactly(0);
            assertThat(v.values()).containsExactly(3.0);
        }

        @Test
        @DisplayName("Should return empty vector for blank text")
        void shouldReturnEmptyForBlank() {
            assertThat(vectorizer.vectorize("   ").isEmpty()).isTrue();
            assertThat(vectorizer.vectorize(null).isEmpty()).isTrue();
            assertThat(vectorizer.vectorize("a an to").isEmpty()).isTrue();
        }

        @Test
        @DisplayName("Should be deterministic across instances")
        void shouldBeDeterministic() {
            assertThat(new SparseVectorizer().vectorize("customs clearance procedure"))
                    .isEqualTo(vectorizer.vectorize("customs clearance procedure"));
        }
    }

    @Test
    @DisplayName("Term ids stay within the modulus")
    void termIdsWithinModulus() {
        SparseVectorizer small = new SparseVectorizer(97);
        for (String term : new String[]{"import", "export", "permit", "lartas", "pabean"}) {
            assertThat(small.termId(term)).isBetween(0, 96);
        }
    }

    @Test
    @DisplayName("Rejects a non-positive modulus")
    void rejectsInvalidModulus() {
        assertThatThrownBy(() -> new SparseVectorizer(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Dot product only counts shared indices")
    void dotProduct() {
        SparseVector a = new SparseVector(List.of(1, 3, 5), List.of(1.0, 2.0, 3.0));
        SparseVector b = new SparseVector(List.of(3, 4, 5), List.of(4.0, 9.0, 1.0));

        assertThat(a.dot(b)).isEqualTo(2.0 * 4.0 + 3.0 * 1.0);
        assertThat(a.dot(SparseVector.EMPTY)).isZero();
    }
}
