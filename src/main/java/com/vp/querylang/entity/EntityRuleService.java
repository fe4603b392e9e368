package com.vp.querylang.entity;

import com.vp.querylang.config.QueryLanguageConfig;
import com.vp.querylang.config.QueryLanguageConfig.EntityDefinition;
import com.vp.querylang.match.EntityMatcher;
import com.vp.querylang.query.QueryParser;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.UnsanitizedFragment;
import com.vp.querylang.sql.SqlRestrictionBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Applies the per-entity query lists from the configuration.
 *
 * <p>Ignored queries decide which records of an entity type are left out of change tracking.
 * Frequently-written queries are turned into an SQL restriction that selects the records written
 * so often that they are handled separately.
 */
public class EntityRuleService {

    private static final Logger log = LoggerFactory.getLogger(EntityRuleService.class);

    private final EntityMatcher matcher;
    private final SqlRestrictionBuilder restrictionBuilder;
    private final Map<String, List<Rule>> ignoredRules = new HashMap<>();
    private final Map<String, List<Rule>> frequentlyWrittenRules = new HashMap<>();

    public EntityRuleService(QueryLanguageConfig config) {
        this(config, config.createMatcher(), config.createSqlRestrictionBuilder());
    }

    public EntityRuleService(QueryLanguageConfig config, EntityMatcher matcher, SqlRestrictionBuilder restrictionBuilder) {
        this.matcher = matcher;
        this.restrictionBuilder = restrictionBuilder;

        for (Map.Entry<String, EntityDefinition> entry : config.getEntities().entrySet()) {
            EntityDefinition definition = entry.getValue();
            ignoredRules.put(entry.getKey(), QueryParser.parseRules(definition.getIgnored(), config.isAllowEmptyValues()));
            frequentlyWrittenRules.put(entry.getKey(),
                QueryParser.parseRules(definition.getFrequentlyWritten(), config.isAllowEmptyValues()));
        }
        log.debug("Loaded query lists for {} entity type(s)", ignoredRules.size());
    }

    public boolean isIgnored(String entityName, Map<String, ?> record) {
        List<Rule> rules = ignoredRules(entityName);
        return !rules.isEmpty() && matcher.matches(record, rules);
    }

    public Optional<UnsanitizedFragment> frequentlyWrittenRestriction(String entityName) {
        List<Rule> rules = frequentlyWrittenRules(entityName);
        if (rules.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(restrictionBuilder.buildRestriction(rules));
    }

    public List<Rule> ignoredRules(String entityName) {
        return ignoredRules.getOrDefault(entityName, List.of());
    }

    public List<Rule> frequentlyWrittenRules(String entityName) {
        return frequentlyWrittenRules.getOrDefault(entityName, List.of());
    }

    public boolean isKnownEntity(String entityName) {
        return ignoredRules.containsKey(entityName);
    }
}
