package com.tomeqa.index.config;

import com.tomeqa.index.lifecycle.LifecycleSettings;
import com.tomeqa.index.search.HybridIndex;
import com.tomeqa.index.search.RetrievalService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.env.YamlPropertySourceLoader;
import org.springframework.core.env.PropertySource;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/** Keeps application.yml in line with the fallbacks used when a key is absent. */
class ApplicationDefaultsTest {

    private PropertySource<?> yaml;

    @BeforeEach
    void setUp() throws Exception {
        List<PropertySource<?>> sources = new YamlPropertySourceLoader()
                .load("application", new ClassPathResource("application.yml"));
        yaml = sources.get(0);
    }

    private String property(String key) {
        return String.valueOf(yaml.getProperty(key));
    }

    @Test
    @DisplayName("Should search the same default collection with or without application.yml")
    void shouldAlignDefaultCollection() {
        assertThat(property("tomeqa.index.retrieval.default-collection"))
                .isEqualTo(RetrievalService.DEFAULT_COLLECTION);
    }

    @Test
    @DisplayName("Should warm the whole collection by default")
    void shouldAlignWarmupLimit() {
        assertThat(property("tomeqa.index.warmup.limit"))
                .isEqualTo(String.valueOf(HybridIndex.DEFAULT_WARMUP_LIMIT));
        assertThat(property("tomeqa.index.warmup.collections")).isEqualTo("pages,semantic");
    }

    @Test
    @DisplayName("Should retain the same number of finished runs with or without application.yml")
    void shouldAlignRetainedRuns() {
        assertThat(property("tomeqa.index.rebuild.retained-runs"))
                .isEqualTo(String.valueOf(LifecycleSettings.DEFAULT_RETAINED_RUNS));
    }
}
