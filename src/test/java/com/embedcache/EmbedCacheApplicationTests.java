package com.embedcache;

import com.embedcache.repository.CacheStore;
import com.embedcache.repository.InMemoryCacheStore;
import com.embedcache.service.EmbeddingsCache;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Wiring test: the default configuration selects the in-memory backend.
 */
@SpringBootTest(properties = "embedcache.cache.backend=memory")
class EmbedCacheApplicationTests {

    @Autowired
    private CacheStore cacheStore;

    @Autowired
    private EmbeddingsCache embeddingsCache;

    @Test
    void contextUsesInMemoryStore() {
        assertThat(cacheStore).isInstanceOf(InMemoryCacheStore.class);
    }

    @Test
    void cacheRoundTripThroughContext() {
        embeddingsCache.update("wiring check", new float[]{0.25f, 0.5f});

        assertThat(embeddingsCache.lookup("wiring check"))
                .hasValueSatisfying(v -> assertThat(v).containsExactly(0.25f, 0.5f));
        assertThat(embeddingsCache.getStats().getBackend()).isEqualTo("memory");
    }
}
