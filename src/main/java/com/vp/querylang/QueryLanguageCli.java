package com.vp.querylang;

import ch.qos.logback.classic.Level;
import com.vp.querylang.command.GitLogCommand;
import com.vp.querylang.command.MatchCommand;
import com.vp.querylang.command.ParseCommand;
import com.vp.querylang.command.SqlCommand;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.concurrent.Callable;

@Command(
    name = "vp-query",
    mixinStandardHelpOptions = true,
    version = "vp-query 1.0.0",
    description = "Parse entity/history queries and compile them to matches, git log arguments or SQL restrictions",
    subcommands = {
        ParseCommand.class,
        MatchCommand.class,
        GitLogCommand.class,
        SqlCommand.class
    }
)
public class QueryLanguageCli implements Callable<Integer> {

    @Option(names = {"-v", "--verbose"}, description = "Enable verbose logging")
    boolean verbose;

    public static void main(String[] args) {
        System.exit(execute(args));
    }

    static int execute(String... args) {
        QueryLanguageCli cli = new QueryLanguageCli();
        return new CommandLine(cli)
            .setCaseInsensitiveEnumValuesAllowed(true)
            .setExecutionStrategy(parseResult -> {
                cli.applyLogLevel();
                return new CommandLine.RunLast().execute(parseResult);
            })
            .execute(args);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    public boolean isVerbose() {
        return verbose;
    }

    void applyLogLevel() {
        if (!verbose) {
            return;
        }
        Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        if (root instanceof ch.qos.logback.classic.Logger) {
            ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
        }
    }
}
