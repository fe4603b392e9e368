package com.vp.querylang.config;

import com.vp.querylang.QueryLanguageException;
import com.vp.querylang.git.GitLogQueryBuilder;
import com.vp.querylang.match.EntityMatcher;
import com.vp.querylang.query.CaseMode;
import com.vp.querylang.sql.SqlRestrictionBuilder;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Settings for the parser and compilers, plus per-entity query lists.
 *
 * <pre>
 * parser:
 *   allowEmpty: false
 * matcher:
 *   caseMode: fold
 * gitLog:
 *   caseMode: delegate
 *   timeZone: UTC
 * sql:
 *   caseMode: delegate
 * entities:
 *   post:
 *     ignored:
 *       - "post_type: revision"
 *     frequentlyWritten:
 *       - "post_status: auto-draft"
 * </pre>
 */
public class QueryLanguageConfig {

    private boolean allowEmptyValues = false;
    private CaseMode matcherCaseMode = CaseMode.FOLD;
    private CaseMode gitLogCaseMode = CaseMode.DELEGATE;
    private ZoneId timeZone = ZoneId.systemDefault();
    private CaseMode sqlCaseMode = CaseMode.DELEGATE;
    private Map<String, EntityDefinition> entities = new LinkedHashMap<>();

    public static class EntityDefinition {
        private List<String> ignored = new ArrayList<>();
        private List<String> frequentlyWritten = new ArrayList<>();

        public List<String> getIgnored() {
            return ignored;
        }

        public void setIgnored(List<String> ignored) {
            this.ignored = ignored;
        }

        public List<String> getFrequentlyWritten() {
            return frequentlyWritten;
        }

        public void setFrequentlyWritten(List<String> frequentlyWritten) {
            this.frequentlyWritten = frequentlyWritten;
        }
    }

    public static QueryLanguageConfig fromYaml(String filePath) {
        try (InputStream input = new FileInputStream(filePath)) {
            return fromYaml(input);
        } catch (IOException e) {
            throw new QueryLanguageException("Cannot read configuration file " + filePath, e);
        }
    }

    public static QueryLanguageConfig fromYaml(InputStream input) {
        Yaml yaml = new Yaml();
        try {
            Map<String, Object> data = yaml.load(input);
            return data == null ? new QueryLanguageConfig() : fromMap(data);
        } catch (YAMLException | ClassCastException | IllegalArgumentException | DateTimeException e) {
            throw new QueryLanguageException("Invalid configuration: " + e.getMessage(), e);
        }
    }

    @SuppressWarnings("unchecked")
    private static QueryLanguageConfig fromMap(Map<String, Object> data) {
        QueryLanguageConfig config = new QueryLanguageConfig();

        // Parse parser settings
        if (data.containsKey("parser")) {
            Map<String, Object> parser = (Map<String, Object>) data.get("parser");
            if (parser.containsKey("allowEmpty")) {
                config.setAllowEmptyValues((Boolean) parser.get("allowEmpty"));
            }
        }

        // Parse compiler settings
        if (data.containsKey("matcher")) {
            Map<String, Object> matcher = (Map<String, Object>) data.get("matcher");
            if (matcher.containsKey("caseMode")) {
                config.setMatcherCaseMode(CaseMode.fromString((String) matcher.get("caseMode")));
            }
        }
        if (data.containsKey("gitLog")) {
            Map<String, Object> gitLog = (Map<String, Object>) data.get("gitLog");
            if (gitLog.containsKey("caseMode")) {
                config.setGitLogCaseMode(CaseMode.fromString((String) gitLog.get("caseMode")));
            }
            if (gitLog.containsKey("timeZone")) {
                config.setTimeZone(ZoneId.of((String) gitLog.get("timeZone")));
            }
        }
        if (data.containsKey("sql")) {
            Map<String, Object> sql = (Map<String, Object>) data.get("sql");
            if (sql.containsKey("caseMode")) {
                config.setSqlCaseMode(CaseMode.fromString((String) sql.get("caseMode")));
            }
        }

        // Parse entity query lists
        if (data.containsKey("entities")) {
            Map<String, Map<String, Object>> entities = (Map<String, Map<String, Object>>) data.get("entities");
            for (Map.Entry<String, Map<String, Object>> entry : entities.entrySet()) {
                EntityDefinition definition = new EntityDefinition();
                Map<String, Object> e = entry.getValue() != null ? entry.getValue() : Map.of();
                if (e.containsKey("ignored")) {
                    definition.setIgnored(toStrings((List<Object>) e.get("ignored")));
                }
                if (e.containsKey("frequentlyWritten")) {
                    definition.setFrequentlyWritten(toStrings((List<Object>) e.get("frequentlyWritten")));
                }
                config.entities.put(entry.getKey(), definition);
            }
        }

        return config;
    }

    // YAML turns unquoted values like 2020 or true into non-strings
    private static List<String> toStrings(List<Object> values) {
        List<String> strings = new ArrayList<>();
        if (values != null) {
            for (Object value : values) {
                strings.add(String.valueOf(value));
            }
        }
        return strings;
    }

    public EntityMatcher createMatcher() {
        return new EntityMatcher(matcherCaseMode);
    }

    public GitLogQueryBuilder createGitLogQueryBuilder() {
        return new GitLogQueryBuilder(gitLogCaseMode, Clock.system(timeZone));
    }

    public SqlRestrictionBuilder createSqlRestrictionBuilder() {
        return new SqlRestrictionBuilder(sqlCaseMode);
    }

    // Getters and setters
    public boolean isAllowEmptyValues() {
        return allowEmptyValues;
    }

    public void setAllowEmptyValues(boolean allowEmptyValues) {
        this.allowEmptyValues = allowEmptyValues;
    }

    public CaseMode getMatcherCaseMode() {
        return matcherCaseMode;
    }

    public void setMatcherCaseMode(CaseMode matcherCaseMode) {
        this.matcherCaseMode = matcherCaseMode;
    }

    public CaseMode getGitLogCaseMode() {
        return gitLogCaseMode;
    }

    public void setGitLogCaseMode(CaseMode gitLogCaseMode) {
        this.gitLogCaseMode = gitLogCaseMode;
    }

    public ZoneId getTimeZone() {
        return timeZone;
    }

    public void setTimeZone(ZoneId timeZone) {
        this.timeZone = timeZone;
    }

    public CaseMode getSqlCaseMode() {
        return sqlCaseMode;
    }

    public void setSqlCaseMode(CaseMode sqlCaseMode) {
        this.sqlCaseMode = sqlCaseMode;
    }

    public Map<String, EntityDefinition> getEntities() {
        return entities;
    }

    public void setEntities(Map<String, EntityDefinition> entities) {
        this.entities = entities;
    }
}
