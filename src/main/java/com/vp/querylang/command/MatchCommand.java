package com.vp.querylang.command;

import com.vp.querylang.config.QueryLanguageConfig;
import com.vp.querylang.entity.EntityRuleService;
import com.vp.querylang.loader.RecordFileReader;
import com.vp.querylang.match.EntityMatcher;
import com.vp.querylang.query.CaseMode;
import com.vp.querylang.query.QueryParser;
import com.vp.querylang.query.Rule;
import com.vp.querylang.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.function.Predicate;

@Command(
    name = "match",
    description = "List the records from a YAML file that match queries, or that an entity's ignored queries exclude",
    mixinStandardHelpOptions = true
)
public class MatchCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(MatchCommand.class);

    @Parameters(arity = "0..*", paramLabel = "QUERY", description = "Query strings, one rule each")
    private List<String> queries = List.of();

    @Option(names = {"-r", "--records"}, description = "YAML file with a list of records", required = true)
    private String recordsFile;

    @Option(names = {"-f", "--config-file"}, description = "Query language configuration YAML file")
    private String configFile;

    @Option(names = {"-e", "--entity"}, description = "Use the ignored queries of this entity from the config file")
    private String entityName;

    @Option(names = {"--case-sensitive"}, description = "Compare field names and values exactly", defaultValue = "false")
    private boolean caseSensitive;

    @Option(names = {"-q", "--quiet"}, description = "Print only the matching records", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            QueryLanguageConfig config = configFile != null
                ? QueryLanguageConfig.fromYaml(configFile)
                : new QueryLanguageConfig();

            // CLI options override config file
            if (caseSensitive) {
                config.setMatcherCaseMode(CaseMode.SENSITIVE);
            }

            Predicate<Map<String, String>> selector;
            if (entityName != null) {
                EntityRuleService entityRules = new EntityRuleService(config);
                if (!entityRules.isKnownEntity(entityName)) {
                    System.err.println("No entity found with name: " + entityName);
                    return 1;
                }
                selector = record -> entityRules.isIgnored(entityName, record);
            } else if (!queries.isEmpty()) {
                EntityMatcher matcher = config.createMatcher();
                List<Rule> rules = QueryParser.parseRules(queries, config.isAllowEmptyValues());
                selector = record -> matcher.matches(record, rules);
            } else {
                System.err.println("Either queries or --entity is required");
                return 2;
            }

            List<Map<String, String>> records = new RecordFileReader().read(recordsFile);

            ConsoleReporter reporter = new ConsoleReporter(quiet);
            reporter.printHeader("Match", entityName != null ? List.of("ignored by " + entityName) : queries);
            reporter.printRecords(records.stream().filter(selector).toList(), records.size());
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            log.debug("match failed", e);
            return 1;
        }
    }
}
