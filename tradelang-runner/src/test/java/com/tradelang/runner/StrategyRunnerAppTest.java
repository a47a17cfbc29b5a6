package com.tradelang.runner;

import com.fasterxml.jackson.databind.JsonNode;
import com.tradelang.runner.config.RunnerConfig;
import com.tradelang.runner.data.HttpClientFactory;
import com.tradelang.runner.translate.ConditionIr;
import com.tradelang.runner.translate.StrategyIr;
import com.tradelang.runner.translate.StrategyTranslator;
import com.tradelang.runner.translate.TranslationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Command line tests: commands, options and exit codes.
 */
class StrategyRunnerAppTest {

    private static final String PRICES = """
        date,open,high,low,close,volume
        2024-01-01,40,41,39,40,1000
        2024-01-02,50,51,49,50,1000
        2024-01-03,60,61,59,60,1000
        2024-01-04,45,46,44,45,1000
        """;

    @TempDir
    Path dir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private final ByteArrayOutputStream err = new ByteArrayOutputStream();
    private Path prices;

    @BeforeEach
    void setUp() throws IOException {
        prices = write("prices.csv", PRICES);
    }

    private Path write(String name, String content) throws IOException {
        Path path = dir.resolve(name);
        Files.writeString(path, content);
        return path;
    }

    private int execute(StrategyTranslator translator, String... args) {
        RunnerConfig config = new RunnerConfig(10_000, "https://llm.example.test/v1", "test-model", null,
            RunnerConfig.ReportFormat.TEXT);
        StrategyRunnerApp app = new StrategyRunnerApp(config, translator,
            new PrintStream(out, true, StandardCharsets.UTF_8), new PrintStream(err, true, StandardCharsets.UTF_8));
        return app.execute(args);
    }

    private int execute(String... args) {
        return execute(null, args);
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Nested
    @DisplayName("run")
    class Run {

        @Test
        void printsTextReport() throws IOException {
            Path strategy = write("sizing.dsl", "ENTRY: close == 50\nEXIT: close >= 60\n");

            assertEquals(StrategyRunnerApp.EXIT_OK, execute("run", strategy.toString(), prices.toString()));
            assertTrue(stdout().contains("Strategy: sizing"), stdout());
            assertTrue(stdout().contains("12,000.00"), stdout());
        }

        @Test
        void capitalOptionAndJsonOutput() throws IOException {
            Path strategy = write("sizing.yaml", "name: Sizing\ndsl: \"ENTRY: close == 50 EXIT: close >= 60\"\n");

            int code = execute("run", strategy.toString(), prices.toString(), "--capital", "5000", "--json");

            assertEquals(StrategyRunnerApp.EXIT_OK, code, stderr());
            JsonNode root = HttpClientFactory.getMapper().readTree(stdout());
            assertEquals("Sizing", root.get("strategyName").asText());
            assertEquals(5_000, root.get("initialCapital").asDouble(), 1e-9);
            assertEquals(6_000, root.get("metrics").get("finalEquity").asDouble(), 1e-9);
        }

        @Test
        void invalidStrategyExitsWithStrategyError() throws IOException {
            Path strategy = write("bad.dsl", "ENTRY: bogus_field > 5 EXIT: close < 1");

            assertEquals(StrategyRunnerApp.EXIT_STRATEGY_ERROR, execute("run", strategy.toString(), prices.toString()));
            assertTrue(stderr().contains("Unknown field 'bogus_field'"), stderr());
        }

        @Test
        void missingPriceFileExitsWithIoError() throws IOException {
            Path strategy = write("ok.dsl", "ENTRY: close > 1 EXIT: close < 1");

            assertEquals(StrategyRunnerApp.EXIT_IO_ERROR,
                execute("run", strategy.toString(), dir.resolve("missing.csv").toString()));
        }
    }

    @Nested
    @DisplayName("translate")
    class Translate {

        @Test
        void runsTranslatedStrategy() {
            StrategyTranslator translator = text -> new StrategyIr(
                List.of(new ConditionIr("close", "==", 50, null)),
                List.of(new ConditionIr("close", ">=", 60, null)));

            int code = execute(translator, "translate", "Buy at 50, sell at 60", prices.toString());

            assertEquals(StrategyRunnerApp.EXIT_OK, code, stderr());
            assertTrue(stdout().contains("Input:    Buy at 50, sell at 60"), stdout());
            assertTrue(stdout().contains("close == 50"), stdout());
        }

        @Test
        void translationFailureExitsWithStrategyError() {
            StrategyTranslator translator = text -> {
                throw new TranslationException("Completion API error: 401");
            };

            assertEquals(StrategyRunnerApp.EXIT_STRATEGY_ERROR,
                execute(translator, "translate", "Buy low", prices.toString()));
            assertTrue(stderr().contains("401"));
        }

        @Test
        void missingApiKeyIsReported() {
            assertEquals(StrategyRunnerApp.EXIT_STRATEGY_ERROR, execute("translate", "Buy low", prices.toString()));
            assertTrue(stderr().contains("No API key"), stderr());
        }
    }

    @Nested
    @DisplayName("check")
    class Check {

        @Test
        void validStrategy() throws IOException {
            Path strategy = write("ok.dsl", "ENTRY: RSI(close, 14) < 30 EXIT: RSI(close, 14) > 70");

            assertEquals(StrategyRunnerApp.EXIT_OK, execute("check", strategy.toString()));
            assertTrue(stdout().startsWith("ok: OK"), stdout());
        }

        @Test
        void syntaxErrorShowsPosition() throws IOException {
            Path strategy = write("broken.dsl", "ENTRY: close >\nEXIT: close < 1");

            assertEquals(StrategyRunnerApp.EXIT_STRATEGY_ERROR, execute("check", strategy.toString()));
            assertTrue(stderr().contains("line 2"), stderr());
        }
    }

    @Nested
    @DisplayName("Usage errors")
    class Usage {

        @Test
        void noArguments() {
            assertEquals(StrategyRunnerApp.EXIT_USAGE, execute());
            assertTrue(stderr().contains("Usage:"));
        }

        @Test
        void unknownCommand() {
            assertEquals(StrategyRunnerApp.EXIT_USAGE, execute("optimize", "x"));
        }

        @Test
        void wrongArgumentCount() {
            assertEquals(StrategyRunnerApp.EXIT_USAGE, execute("run", "only-one"));
        }

        @Test
        void badCapital() {
            assertEquals(StrategyRunnerApp.EXIT_USAGE, execute("run", "a", "b", "--capital", "-5"));
            assertEquals(StrategyRunnerApp.EXIT_USAGE, execute("run", "a", "b", "--capital", "lots"));
        }

        @Test
        void unknownOption() {
            assertEquals(StrategyRunnerApp.EXIT_USAGE, execute("run", "a", "b", "--verbose"));
        }
    }
}
