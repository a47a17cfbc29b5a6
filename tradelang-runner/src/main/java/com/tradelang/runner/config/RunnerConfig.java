package com.tradelang.runner.config;

import com.tradelang.core.model.BacktestConfig;

import java.util.Locale;

/**
 * Configuration for the strategy runner.
 *
 * Every value comes from a system property, falling back to an environment
 * variable and then to a default.
 */
public class RunnerConfig {
    private static final String DEFAULT_LLM_URL = "https://api.groq.com/openai/v1";
    private static final String DEFAULT_LLM_MODEL = "openai/gpt-oss-120b";

    public enum ReportFormat { TEXT, JSON }

    private final double capital;
    private final String llmUrl;
    private final String llmModel;
    private final String llmKey;
    private final ReportFormat reportFormat;

    public RunnerConfig(double capital, String llmUrl, String llmModel, String llmKey, ReportFormat reportFormat) {
        if (!(capital > 0) || Double.isInfinite(capital)) {
            throw new IllegalArgumentException("Capital must be a positive number, got " + capital);
        }
        this.capital = capital;
        this.llmUrl = llmUrl;
        this.llmModel = llmModel;
        this.llmKey = llmKey;
        this.reportFormat = reportFormat;
    }

    /**
     * @throws IllegalArgumentException if a configured value cannot be parsed
     */
    public static RunnerConfig load() {
        double capital = Double.parseDouble(setting("tradelang.capital", "TRADELANG_CAPITAL",
            String.valueOf(BacktestConfig.DEFAULT_CAPITAL)));

        String llmUrl = setting("tradelang.llm.url", "TRADELANG_LLM_URL", DEFAULT_LLM_URL);
        String llmModel = setting("tradelang.llm.model", "TRADELANG_LLM_MODEL", DEFAULT_LLM_MODEL);
        String llmKey = setting("tradelang.llm.key", "TRADELANG_LLM_KEY", null);

        String format = setting("tradelang.report.format", "TRADELANG_REPORT_FORMAT", "text");
        ReportFormat reportFormat;
        try {
            reportFormat = ReportFormat.valueOf(format.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown report format '" + format + "', expected text or json", e);
        }

        return new RunnerConfig(capital, llmUrl, llmModel, llmKey, reportFormat);
    }

    private static String setting(String property, String env, String defaultValue) {
        return System.getProperty(property, System.getenv().getOrDefault(env, defaultValue));
    }

    public double getCapital() {
        return capital;
    }

    public String getLlmUrl() {
        return llmUrl;
    }

    public String getLlmModel() {
        return llmModel;
    }

    public String getLlmKey() {
        return llmKey;
    }

    public boolean hasLlmKey() {
        return llmKey != null && !llmKey.isBlank();
    }

    public ReportFormat getReportFormat() {
        return reportFormat;
    }

    public BacktestConfig backtestConfig() {
        return BacktestConfig.withCapital(capital);
    }
}
