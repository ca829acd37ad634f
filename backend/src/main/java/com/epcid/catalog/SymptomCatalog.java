package com.epcid.catalog;

import com.epcid.domain.Child;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Service;

import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Red-flag symptom knowledge base.
 *
 * Loaded once from a JSON resource and read-only afterwards. The picker
 * ({@link #filterSymptoms}) and the free-text/voice path ({@link #findByFreeText})
 * share one phrase normalization so both entry points agree on what matches.
 */
@Service
@Slf4j
public class SymptomCatalog {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    @Value("${epcid.catalog.location:classpath:catalog/symptoms.json}")
    private String catalogLocation;

    private List<SymptomDefinition> definitions = List.of();
    private Map<String, SymptomDefinition> byId = Map.of();

    public SymptomCatalog(ObjectMapper objectMapper, ResourceLoader resourceLoader) {
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
    }

    @PostConstruct
    public void load() {
        Resource resource = resourceLoader.getResource(catalogLocation);
        try (InputStream in = resource.getInputStream()) {
            List<SymptomDefinition> loaded = objectMapper.readValue(in, new TypeReference<List<SymptomDefinition>>() {});
            replaceDefinitions(loaded);
            log.info("Symptom catalog loaded: {} definitions ({} red flags) from {}",
                definitions.size(), definitions.stream().filter(SymptomDefinition::isRedFlag).count(),
                catalogLocation);
        } catch (IOException e) {
            throw new IllegalStateException("Unable to load symptom catalog from " + catalogLocation, e);
        }
    }

    void replaceDefinitions(List<SymptomDefinition> loaded) {
        Map<String, SymptomDefinition> index = new LinkedHashMap<>();
        for (SymptomDefinition def : loaded) {
            if (def.getId() == null || def.getId().isBlank()) {
                throw new IllegalStateException("Symptom definition without id: " + def.getDisplayName());
            }
            if (def.getBodyRegion() == null) {
                throw new IllegalStateException("Symptom " + def.getId() + " has no body region");
            }
            if (index.putIfAbsent(def.getId(), def) != null) {
                throw new IllegalStateException("Duplicate symptom id: " + def.getId());
            }
        }
        this.definitions = List.copyOf(index.values());
        this.byId = Collections.unmodifiableMap(index);
    }

    public List<SymptomDefinition> all() {
        return definitions;
    }

    public Optional<SymptomDefinition> findById(String id) {
        return Optional.ofNullable(id).map(byId::get);
    }

    public boolean isRedFlag(String id) {
        return findById(id).map(SymptomDefinition::isRedFlag).orElse(false);
    }

    /**
     * Filters the catalog for a child. Rules apply in order: age bounds, gender
     * tag, region, then search text against display name or any alias.
     *
     * @param ageMonths null when the age is unknown; age bounds are then not applied
     */
    public List<SymptomDefinition> filterSymptoms(Integer ageMonths, Child.Gender gender,
                                                  BodyRegion region, String searchText) {
        String query = normalizePhrase(searchText);
        return definitions.stream()
            .filter(def -> ageMonths == null || def.appliesToAge(ageMonths))
            .filter(def -> def.appliesToGender(gender))
            .filter(def -> region == null || def.getBodyRegion() == region)
            .filter(def -> query.isEmpty() || matchesSearch(def, query))
            .collect(Collectors.toList());
    }

    /**
     * Matches a free-text or voice transcript. A definition matches when the
     * transcript mentions its name or one of its aliases, or when the transcript
     * is itself a fragment the search box would accept.
     */
    public List<SymptomDefinition> findByFreeText(String transcript) {
        String text = normalizePhrase(transcript);
        if (text.isEmpty()) {
            return List.of();
        }
        List<SymptomDefinition> matches = definitions.stream()
            .filter(def -> mentions(text, def) || matchesSearch(def, text))
            .collect(Collectors.toList());
        log.debug("Free text '{}' matched {} symptoms", transcript, matches.size());
        return matches;
    }

    public Optional<String> warningFor(BodyRegion region) {
        return region == null ? Optional.empty() : region.getEmergencyWarning();
    }

    private static boolean matchesSearch(SymptomDefinition def, String query) {
        if (normalizePhrase(def.getDisplayName()).contains(query)) {
            return true;
        }
        return def.getAliasPhrases().stream().anyMatch(alias -> normalizePhrase(alias).contains(query));
    }

    private static boolean mentions(String text, SymptomDefinition def) {
        String name = normalizePhrase(def.getDisplayName());
        if (!name.isEmpty() && text.contains(name)) {
            return true;
        }
        return def.getAliasPhrases().stream()
            .map(SymptomCatalog::normalizePhrase)
            .anyMatch(alias -> !alias.isEmpty() && text.contains(alias));
    }

    // lower case, no apostrophes, single spaces
    static String normalizePhrase(String raw) {
        if (raw == null) {
            return "";
        }
        return raw.toLowerCase(Locale.ROOT)
            .replace("'", "")
            .replace("’", "")
            .replaceAll("\\s+", " ")
            .trim();
    }
}
