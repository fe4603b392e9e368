package com.vp.querylang.command;

import com.vp.querylang.config.QueryLanguageConfig;
import com.vp.querylang.entity.EntityRuleService;
import com.vp.querylang.query.CaseMode;
import com.vp.querylang.query.QueryParser;
import com.vp.querylang.query.UnsanitizedFragment;
import com.vp.querylang.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "sql",
    description = "Print the SQL WHERE restriction for queries (rules are OR-ed)",
    mixinStandardHelpOptions = true
)
public class SqlCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(SqlCommand.class);

    @Parameters(arity = "0..*", paramLabel = "QUERY", description = "Query strings, one rule each")
    private List<String> queries = List.of();

    @Option(names = {"-f", "--config-file"}, description = "Query language configuration YAML file")
    private String configFile;

    @Option(names = {"-e", "--entity"}, description = "Use the frequently-written queries of this entity from the config file")
    private String entityName;

    @Option(names = {"--case-sensitive"}, description = "Compare with BINARY", defaultValue = "false")
    private boolean caseSensitive;

    @Option(names = {"-q", "--quiet"}, description = "Print only the restriction", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            QueryLanguageConfig config = configFile != null
                ? QueryLanguageConfig.fromYaml(configFile)
                : new QueryLanguageConfig();

            // CLI options override config file
            if (caseSensitive) {
                config.setSqlCaseMode(CaseMode.SENSITIVE);
            }

            UnsanitizedFragment restriction;
            if (entityName != null) {
                EntityRuleService entityRules = new EntityRuleService(config);
                if (!entityRules.isKnownEntity(entityName)) {
                    System.err.println("No entity found with name: " + entityName);
                    return 1;
                }
                restriction = entityRules.frequentlyWrittenRestriction(entityName)
                    .orElse(UnsanitizedFragment.empty(UnsanitizedFragment.Target.SQL_RESTRICTION));
            } else if (!queries.isEmpty()) {
                restriction = config.createSqlRestrictionBuilder()
                    .buildRestriction(QueryParser.parseRules(queries, config.isAllowEmptyValues()));
            } else {
                System.err.println("Either queries or --entity is required");
                return 2;
            }

            ConsoleReporter reporter = new ConsoleReporter(quiet);
            reporter.printHeader("SQL restriction", entityName != null ? List.of("entity " + entityName) : queries);
            reporter.printFragments(restriction.isEmpty() ? List.of() : List.of(restriction));
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            log.debug("sql failed", e);
            return 1;
        }
    }
}
