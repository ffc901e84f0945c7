package com.anonrelay.sentiment;

import org.yaml.snakeyaml.Yaml;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Term sets driving the classifier. Terms are stored lower-cased; multi-word terms and emoji are
 * allowed and only ever match as substrings.
 */
public record Lexicon(Set<String> positive, Set<String> negative, Set<String> urgent) {

    private static final String DEFAULT_RESOURCE = "/lexicon.yaml";

    public Lexicon {
        positive = normalize(positive);
        negative = normalize(negative);
        urgent = normalize(urgent);
    }

    public static Lexicon defaults() {
        try (var in = Lexicon.class.getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) throw new IllegalStateException("Missing classpath resource " + DEFAULT_RESOURCE);
            return parse(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load default lexicon", e);
        }
    }

    public static Lexicon load(Path path) {
        try (var in = Files.newInputStream(path)) {
            return parse(in);
        } catch (IOException e) {
            throw new RuntimeException("Failed to load lexicon: " + path, e);
        }
    }

    @SuppressWarnings("unchecked")
    static Lexicon parse(InputStream in) {
        Map<String, Object> raw = new Yaml().load(in);
        if (raw == null) raw = Map.of();
        return new Lexicon(
                Set.copyOf(terms(raw.get("positive"))),
                Set.copyOf(terms(raw.get("negative"))),
                Set.copyOf(terms(raw.get("urgent"))));
    }

    private static List<String> terms(Object value) {
        if (!(value instanceof Collection<?> list)) return List.of();
        return list.stream().map(String::valueOf).collect(Collectors.toList());
    }

    private static Set<String> normalize(Set<String> terms) {
        if (terms == null) return Set.of();
        return terms.stream()
                .map(t -> t.strip().toLowerCase(Locale.ROOT))
                .filter(t -> !t.isEmpty())
                .collect(Collectors.toUnmodifiableSet());
    }
}
