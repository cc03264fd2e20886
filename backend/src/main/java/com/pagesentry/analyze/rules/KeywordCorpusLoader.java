package com.pagesentry.analyze.rules;

import com.pagesentry.analyze.model.KeywordRule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the keyword corpus YAML once. Expected shape:
 * <pre>
 * keywords:
 *   - term: weed
 *     category: narcotics
 *     patterns: ["\\bweed\\b"]
 *     aliases: [ganja]
 *     brands: []
 * </pre>
 */
@Component
public class KeywordCorpusLoader {
    private static final Logger log = LoggerFactory.getLogger(KeywordCorpusLoader.class);
    private static final String DEFAULT_CATEGORY = "uncat";

    private final ResourceLoader resourceLoader;

    public KeywordCorpusLoader(ResourceLoader resourceLoader) {
        this.resourceLoader = resourceLoader;
    }

    public List<KeywordRule> load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("Keyword corpus not found at {}; matcher will only use built-in patterns", location);
            return List.of();
        }
        try (InputStream in = resource.getInputStream()) {
            List<KeywordRule> rules = parse(new InputStreamReader(in, StandardCharsets.UTF_8));
            log.info("Loaded {} keyword rules from {}", rules.size(), location);
            return rules;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read keyword corpus " + location, e);
        }
    }

    static List<KeywordRule> parse(Reader reader) {
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(reader);
        if (!(root instanceof Map<?, ?> rootMap)) {
            return List.of();
        }
        Object entries = rootMap.get("keywords");
        if (!(entries instanceof List<?> entryList)) {
            return List.of();
        }
        List<KeywordRule> rules = new ArrayList<>();
        for (Object entry : entryList) {
            if (!(entry instanceof Map<?, ?> map)) {
                continue;
            }
            String term = stringValue(map.get("term"));
            if (term.isEmpty()) {
                log.warn("Skipping keyword entry without term: {}", map);
                continue;
            }
            String category = stringValue(map.get("category"));
            rules.add(new KeywordRule(
                term,
                category.isEmpty() ? DEFAULT_CATEGORY : category,
                stringList(map.get("patterns")),
                stringList(map.get("aliases")),
                stringList(map.get("brands"))
            ));
        }
        return rules;
    }

    private static String stringValue(Object value) {
        return value == null ? "" : value.toString().trim();
    }

    private static List<String> stringList(Object value) {
        if (!(value instanceof List<?> list)) {
            return List.of();
        }
        List<String> out = new ArrayList<>();
        for (Object item : list) {
            if (item != null && !item.toString().isBlank()) {
                out.add(item.toString());
            }
        }
        return out;
    }
}
