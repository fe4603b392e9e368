package com.vp.querylang.command;

import com.vp.querylang.config.QueryLanguageConfig;
import com.vp.querylang.git.GitLogQueryBuilder;
import com.vp.querylang.query.CaseMode;
import com.vp.querylang.query.QueryParser;
import com.vp.querylang.query.Rule;
import com.vp.querylang.query.UnsanitizedFragment;
import com.vp.querylang.report.ConsoleReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

@Command(
    name = "git-log",
    description = "Print git log arguments selecting the commits that match each query",
    mixinStandardHelpOptions = true
)
public class GitLogCommand implements Callable<Integer> {

    private static final Logger log = LoggerFactory.getLogger(GitLogCommand.class);

    @Parameters(arity = "1..*", paramLabel = "QUERY", description = "Query strings, one git log argument list each")
    private List<String> queries;

    @Option(names = {"-f", "--config-file"}, description = "Query language configuration YAML file")
    private String configFile;

    @Option(names = {"--case-sensitive"}, description = "Do not pass -i to git", defaultValue = "false")
    private boolean caseSensitive;

    @Option(names = {"-q", "--quiet"}, description = "Print only the git log arguments", defaultValue = "false")
    private boolean quiet;

    @Override
    public Integer call() {
        try {
            QueryLanguageConfig config = configFile != null
                ? QueryLanguageConfig.fromYaml(configFile)
                : new QueryLanguageConfig();

            // CLI options override config file
            if (caseSensitive) {
                config.setGitLogCaseMode(CaseMode.SENSITIVE);
            }

            ConsoleReporter reporter = new ConsoleReporter(quiet);
            reporter.printHeader("git log", queries);

            GitLogQueryBuilder builder = config.createGitLogQueryBuilder();
            List<UnsanitizedFragment> fragments = new ArrayList<>();
            for (Rule rule : QueryParser.parseRules(queries, config.isAllowEmptyValues())) {
                fragments.add(builder.buildQuery(rule));
            }

            reporter.printFragments(fragments);
            return 0;
        } catch (Exception e) {
            System.err.println("Error: " + e.getMessage());
            log.debug("git-log failed", e);
            return 1;
        }
    }
}
