package com.netcracker.core.ddisync.service.mapping;

import com.netcracker.core.ddisync.configuration.SyncSettings;
import com.netcracker.core.ddisync.model.AttributeMapping;
import com.netcracker.core.ddisync.model.AttributeValue;
import com.netcracker.core.ddisync.model.MappingRule;
import com.netcracker.core.ddisync.model.MappingSuggestions;
import com.netcracker.core.ddisync.model.NetworkRecord;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Suggests which target attribute a source tag key corresponds to and rewrites tags into
 * target attribute form.
 * <p>
 * A candidate scores the highest of: 0.95 when both keys are spellings of the same known name, the
 * sequence similarity of the normalized keys, 0.85 when one normalized key contains the other, and 0.7
 * when one starts with the first three characters of the other. Candidates under the threshold are
 * dropped; the rest are ranked by score, then by target key.
 */
@ApplicationScoped
@Slf4j
public class AttributeMapper {
    public static final double DEFAULT_THRESHOLD = 0.8;
    public static final int MAX_SUGGESTIONS = 3;

    static final double SYNONYM_SCORE = 0.95;
    static final double SUBSTRING_SCORE = 0.85;
    static final double PREFIX_SCORE = 0.7;
    private static final int PREFIX_LENGTH = 3;
    private static final Pattern SEPARATORS = Pattern.compile("[-\\s]+");

    private final SynonymTable synonyms;
    private final double threshold;

    public AttributeMapper() {
        this(SynonymTable.defaults(), DEFAULT_THRESHOLD);
    }

    @Inject
    public AttributeMapper(SyncSettings settings) {
        this(SynonymTable.defaults(), settings.getMappingThreshold());
    }

    public AttributeMapper(SynonymTable synonyms, double threshold) {
        this.synonyms = synonyms;
        this.threshold = threshold;
    }

    public static String normalize(String key) {
        return SEPARATORS.matcher(key.toLowerCase(Locale.ROOT)).replaceAll("_");
    }

    public double score(String sourceKey, String targetKey) {
        String source = normalize(sourceKey);
        String target = normalize(targetKey);

        double score = SequenceSimilarity.ratio(source, target);
        if (synonyms.areSynonyms(source, target)) {
            score = Math.max(score, SYNONYM_SCORE);
        }
        if (source.contains(target) || target.contains(source)) {
            score = Math.max(score, SUBSTRING_SCORE);
        }
        if (source.startsWith(prefix(target)) || target.startsWith(prefix(source))) {
            score = Math.max(score, PREFIX_SCORE);
        }
        return score;
    }

    /**
     * Ranked candidates for one source key, at most {@link #MAX_SUGGESTIONS}. Same inputs always
     * give the same list in the same order.
     */
    public List<AttributeMapping> findSimilarAttributes(String sourceKey, List<String> targetKeys) {
        List<AttributeMapping> matches = new ArrayList<>();
        if (sourceKey == null || sourceKey.isBlank()) {
            return matches;
        }
        for (String targetKey : new LinkedHashSet<>(targetKeys)) {
            if (targetKey == null || targetKey.isBlank()) {
                continue;
            }
            double score = score(sourceKey, targetKey);
            if (score >= threshold) {
                matches.add(new AttributeMapping(sourceKey, targetKey, score, score == 1.0));
            }
        }
        matches.sort(Comparator.comparingDouble(AttributeMapping::confidence).reversed()
                .thenComparing(AttributeMapping::targetKey));
        return matches.size() > MAX_SUGGESTIONS ? List.copyOf(matches.subList(0, MAX_SUGGESTIONS)) : matches;
    }

    public Map<String, MappingSuggestions> suggestMappings(List<String> sourceKeys, List<String> targetKeys) {
        Map<String, MappingSuggestions> suggestions = new LinkedHashMap<>();
        for (String sourceKey : sourceKeys) {
            suggestions.put(sourceKey, new MappingSuggestions(sourceKey, findSimilarAttributes(sourceKey, targetKeys), true));
        }
        log.debug("Suggested mappings for {} source keys against {} target attributes", sourceKeys.size(), targetKeys.size());
        return suggestions;
    }

    /**
     * Rewrites tags into mapped attributes using plain {@code sourceKey -> targetKey} choices.
     * A blank target skips the tag; tags without a choice are dropped.
     */
    public List<NetworkRecord> applyMappings(List<NetworkRecord> networks, Map<String, String> mappings) {
        Map<String, MappingRule> rules = new LinkedHashMap<>();
        mappings.forEach((source, target) -> rules.put(source, MappingRule.to(target)));
        return applyMappingRules(networks, rules);
    }

    public List<NetworkRecord> applyMappingRules(List<NetworkRecord> networks, Map<String, MappingRule> rules) {
        List<NetworkRecord> mapped = new ArrayList<>(networks.size());
        for (NetworkRecord network : networks) {
            Map<String, AttributeValue> attributes = new LinkedHashMap<>();
            network.tags().forEach((tag, value) -> {
                MappingRule rule = rules.get(tag);
                if (rule != null && !rule.isSkipped()) {
                    attributes.put(rule.targetKey(), new AttributeValue(rule.transform().apply(String.valueOf(value))));
                }
            });
            mapped.add(network.withMappedAttributes(attributes));
        }
        return mapped;
    }

    private static String prefix(String normalized) {
        return normalized.length() <= PREFIX_LENGTH ? normalized : normalized.substring(0, PREFIX_LENGTH);
    }
}
