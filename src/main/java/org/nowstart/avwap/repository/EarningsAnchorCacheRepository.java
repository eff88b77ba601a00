package org.nowstart.avwap.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import lombok.extern.slf4j.Slf4j;
import org.nowstart.avwap.data.property.AvwapProperties;
import org.nowstart.avwap.service.EarningsAnchorCacheNormalizer;
import org.nowstart.avwap.signal.core.EarningsAnchorCache;
import org.springframework.stereotype.Repository;

@Slf4j
@Repository
public class EarningsAnchorCacheRepository {

    private final ObjectMapper objectMapper;
    private final EarningsAnchorCacheNormalizer normalizer;
    private final Path path;

    public EarningsAnchorCacheRepository(
            ObjectMapper objectMapper,
            EarningsAnchorCacheNormalizer normalizer,
            AvwapProperties avwapProperties
    ) {
        this(objectMapper, normalizer, Path.of(avwapProperties.earningsCacheFile()));
    }

    EarningsAnchorCacheRepository(ObjectMapper objectMapper, EarningsAnchorCacheNormalizer normalizer, Path path) {
        this.objectMapper = objectMapper;
        this.normalizer = normalizer;
        this.path = path;
    }

    public EarningsAnchorCache load() {
        if (!Files.exists(path)) {
            return new EarningsAnchorCache();
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(Files.readString(path, StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            log.warn("Earnings cache file is corrupt. Starting with an empty cache. path={}", path, e);
            return new EarningsAnchorCache();
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read earnings cache " + path, e);
        }

        if (root == null || !root.isObject()) {
            log.warn("Earnings cache root is not an object. Starting with an empty cache. path={}", path);
            return new EarningsAnchorCache();
        }
        return new EarningsAnchorCache(normalizer.normalizeAll(root));
    }

    public void save(EarningsAnchorCache cache) {
        try {
            Path parent = path.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            String json = objectMapper.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(normalizer.serializeAll(cache.entries()));
            Files.writeString(path, json, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write earnings cache " + path, e);
        }
    }
}
