package com.tunechat.match.lexicon;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;

public class PhraseLexiconLoader {
    private static final Logger log = LoggerFactory.getLogger(PhraseLexiconLoader.class);

    private final ResourceLoader resourceLoader;
    private final ObjectMapper objectMapper;

    public PhraseLexiconLoader(ResourceLoader resourceLoader, ObjectMapper objectMapper) {
        this.resourceLoader = resourceLoader;
        this.objectMapper = objectMapper;
    }

    public PhraseLexicon load(String location, boolean strict) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            return fail(strict, "lexicon resource not found: " + location, null);
        }
        try (InputStream input = resource.getInputStream()) {
            Map<String, List<String>> mapping = objectMapper.readValue(
                input,
                new TypeReference<Map<String, List<String>>>() {}
            );
            PhraseLexicon lexicon = new PhraseLexicon(mapping);
            LexiconStats stats = lexicon.stats();
            log.info(
                "lexicon loaded phrases={} mappings={} indexed_words={} resource={}",
                stats.totalPhrases(),
                stats.totalSongMappings(),
                stats.indexedWords(),
                location
            );
            return lexicon;
        } catch (IOException | RuntimeException e) {
            return fail(strict, "lexicon resource unreadable: " + location, e);
        }
    }

    private PhraseLexicon fail(boolean strict, String message, Exception cause) {
        if (strict) {
            throw new IllegalStateException(message, cause);
        }
        log.warn("{}; continuing with an empty lexicon", message, cause);
        return PhraseLexicon.empty();
    }
}
