package com.openforge.memorylane.retrieval;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class QueryEntityExtractorTest {

    private final QueryEntityExtractor extractor = new QueryEntityExtractor();

    @Test
    @DisplayName("capitalised words, quoted strings and labelled names are collected once each")
    void extract_mixed() {
        assertThat(extractor.extract("What did Alice decide about \"billing service\" for project: Atlas?"))
                .containsExactly("What", "Alice", "Atlas", "billing service");
    }

    @Test
    @DisplayName("lower-case text without markers yields nothing")
    void extract_none() {
        assertThat(extractor.extract("how do we deploy")).isEmpty();
        assertThat(extractor.extract(null)).isEmpty();
        assertThat(extractor.extract("  ")).isEmpty();
    }
}
