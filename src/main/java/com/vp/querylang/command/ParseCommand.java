package com.vp.querylang.command;

import com.vp.querylang.config.QueryLanguageConfig;
import com.vp.querylang.query.QueryParser;
import com.vp.querylang.query.Rule;
import com.vp.querylang.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "parse",
    description = "Show the rules parsed from queries",
    mixinStandardHelpOptions = true
)
public class ParseCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(ParseCommand.class);

    @Parameters(arity = "1..*", paramLabel = "QUERY", description = "Query strings, one rule each")
    private List<String> queries;

    @Option(names = {"-f", "--config-file"}, description = "Query language configuration YAML file")
    private String configFile;

    @Option(names = {"--allow-empty"}, description = "Keep empty quoted values", defaultValue = "false")
    private boolean allowEmpty;

    @Option(names = {"-q", "--quiet"}, description = "Print only the parsed rules", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            QueryLanguageConfig config = configFile != null
                ? QueryLanguageConfig.fromYaml(configFile)
                : new QueryLanguageConfig();

            // CLI options override config file
            if (allowEmpty) {
                config.setAllowEmptyValues(true);
            }

            ConsoleReporter reporter = new ConsoleReporter(quiet);
            reporter.printHeader("Parse", queries);

            List<Rule> rules = QueryParser.parseRules(queries, config.isAllowEmptyValues());
            reporter.printRules(rules);
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            log.debug("parse failed", e);
            return 1;
        }
    }
}
