package com.datainsight.infrastructure.analysis.sentiment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Reads a word list: one word per line, blank lines and {@code #} comments ignored.
 */
@Slf4j
public final class LexiconLoader {

    private LexiconLoader() {
    }

    public static Set<String> load(Resource resource) {
        Set<String> words = new LinkedHashSet<>();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            while ((line = reader.readLine()) != null) {
                String word = line.trim().toLowerCase(Locale.ROOT);
                if (word.isEmpty() || word.startsWith("#")) {
                    continue;
                }
                words.add(word);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load lexicon " + resource.getDescription(), e);
        }

        log.info("Loaded {} lexicon entries from {}", words.size(), resource.getDescription());
        return words;
    }
}
