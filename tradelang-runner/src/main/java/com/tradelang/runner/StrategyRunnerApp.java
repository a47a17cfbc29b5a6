package com.tradelang.runner;

import com.tradelang.core.dsl.StrategyCompiler;
import com.tradelang.core.dsl.StrategyException;
import com.tradelang.core.model.PriceTable;
import com.tradelang.runner.config.RunnerConfig;
import com.tradelang.runner.data.CandleCsvReader;
import com.tradelang.runner.data.StrategyFile;
import com.tradelang.runner.data.StrategyFiles;
import com.tradelang.runner.report.ReportPrinter;
import com.tradelang.runner.report.RunReport;
import com.tradelang.runner.translate.ChatCompletionTranslator;
import com.tradelang.runner.translate.StrategyTranslator;
import com.tradelang.runner.translate.TranslationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Strategy Runner - command line entry point.
 *
 * <pre>
 *   run &lt;strategy-file&gt; &lt;prices.csv&gt; [--capital N] [--json]
 *   translate "&lt;trading rule&gt;" &lt;prices.csv&gt; [--capital N] [--json]
 *   check &lt;strategy-file&gt;
 * </pre>
 */
public class StrategyRunnerApp {
    private static final Logger log = LoggerFactory.getLogger(StrategyRunnerApp.class);

    static final int EXIT_OK = 0;
    static final int EXIT_USAGE = 1;
    static final int EXIT_STRATEGY_ERROR = 2;
    static final int EXIT_IO_ERROR = 3;

    private static final String USAGE = String.join("\n",
        "Usage:",
        "  run <strategy-file> <prices.csv> [--capital N] [--json]",
        "  translate \"<trading rule>\" <prices.csv> [--capital N] [--json]",
        "  check <strategy-file>",
        "",
        "Strategy files are .dsl text, or .yaml/.json with 'name' and either 'dsl' or 'entry'/'exit'.",
        "Prices are CSV with a date or timestamp column and open, high, low, close, volume.");

    private final RunnerConfig config;
    private final StrategyTranslator translator;
    private final PrintStream out;
    private final PrintStream err;

    public StrategyRunnerApp(RunnerConfig config, StrategyTranslator translator, PrintStream out, PrintStream err) {
        this.config = config;
        this.translator = translator;
        this.out = out;
        this.err = err;
    }

    public static void main(String[] args) {
        RunnerConfig config;
        try {
            config = RunnerConfig.load();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(EXIT_USAGE);
            return;
        }
        int code = new StrategyRunnerApp(config, null, System.out, System.err).execute(args);
        System.exit(code);
    }

    /**
     * Run one command and return the process exit code.
     */
    public int execute(String[] args) {
        Options options;
        try {
            options = Options.parse(args, config);
        } catch (IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }

        try {
            return switch (options.command) {
                case "run" -> runFile(options);
                case "translate" -> translate(options);
                case "check" -> check(options);
                default -> {
                    err.println("Unknown command: " + options.command);
                    err.println(USAGE);
                    yield EXIT_USAGE;
                }
            };
        } catch (UsageException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        } catch (StrategyException e) {
            log.debug("Strategy failed", e);
            err.println("Strategy error: " + e.getMessage());
            return EXIT_STRATEGY_ERROR;
        } catch (TranslationException e) {
            log.debug("Translation failed", e);
            err.println("Translation error: " + e.getMessage());
            return EXIT_STRATEGY_ERROR;
        } catch (IOException e) {
            log.debug("I/O failure", e);
            err.println("I/O error: " + e.getMessage());
            return EXIT_IO_ERROR;
        }
    }

    private int runFile(Options options) throws IOException {
        options.requireArgs(2);
        StrategyFile strategy = new StrategyFiles().load(Path.of(options.args.get(0)));
        PriceTable table = new CandleCsvReader().read(Path.of(options.args.get(1)));

        PipelineResult result = new StrategyPipeline().runFromDsl(strategy.dsl(), table, options.capital);
        print(strategy.name(), result, options);
        return EXIT_OK;
    }

    private int translate(Options options) throws IOException, TranslationException {
        options.requireArgs(2);
        PriceTable table = new CandleCsvReader().read(Path.of(options.args.get(1)));

        StrategyTranslator active = translator != null ? translator : new ChatCompletionTranslator(config);
        PipelineResult result = new StrategyPipeline(active).run(options.args.get(0), table, options.capital);
        print("translated", result, options);
        return EXIT_OK;
    }

    private int check(Options options) throws IOException {
        options.requireArgs(1);
        StrategyFile strategy = new StrategyFiles().load(Path.of(options.args.get(0)));

        StrategyCompiler.CompileResult result = new StrategyCompiler().check(strategy.dsl());
        if (result.success()) {
            out.println(strategy.name() + ": OK");
            out.println("  ENTRY: " + result.strategy().entry());
            out.println("  EXIT:  " + result.strategy().exit());
            return EXIT_OK;
        }
        err.println(strategy.name() + ": " + result.error());
        return EXIT_STRATEGY_ERROR;
    }

    private void print(String name, PipelineResult result, Options options) throws IOException {
        ReportPrinter printer = new ReportPrinter();
        if (options.json) {
            out.println(printer.json(RunReport.from(name, result, Instant.now())));
        } else {
            out.print(printer.text(name, result));
        }
    }

    /**
     * Parsed command line.
     */
    static final class Options {
        final String command;
        final List<String> args;
        final double capital;
        final boolean json;

        private Options(String command, List<String> args, double capital, boolean json) {
            this.command = command;
            this.args = args;
            this.capital = capital;
            this.json = json;
        }

        static Options parse(String[] argv, RunnerConfig config) {
            if (argv.length == 0) {
                throw new IllegalArgumentException("No command given");
            }
            List<String> positional = new ArrayList<>();
            double capital = config.getCapital();
            boolean json = config.getReportFormat() == RunnerConfig.ReportFormat.JSON;

            for (int i = 1; i < argv.length; i++) {
                String arg = argv[i];
                if (arg.equals("--json")) {
                    json = true;
                } else if (arg.equals("--capital")) {
                    if (i + 1 >= argv.length) {
                        throw new IllegalArgumentException("--capital needs a value");
                    }
                    capital = parseCapital(argv[++i]);
                } else if (arg.startsWith("--")) {
                    throw new IllegalArgumentException("Unknown option: " + arg);
                } else {
                    positional.add(arg);
                }
            }
            return new Options(argv[0], positional, capital, json);
        }

        private static double parseCapital(String value) {
            try {
                double capital = Double.parseDouble(value);
                if (capital > 0 && !Double.isInfinite(capital)) {
                    return capital;
                }
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("--capital must be a number, got '" + value + "'", e);
            }
            throw new IllegalArgumentException("--capital must be positive, got " + value);
        }

        void requireArgs(int count) {
            if (args.size() != count) {
                throw new UsageException(command + " expects " + count + " argument(s), got " + args.size());
            }
        }
    }

    static final class UsageException extends IllegalArgumentException {
        UsageException(String message) {
            super(message);
        }
    }
}
