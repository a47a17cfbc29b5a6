package com.tradelang.runner.translate;

/**
 * Turns a trading rule written in plain language into the JSON strategy form.
 * Implementations may be non-deterministic.
 */
public interface StrategyTranslator {

    StrategyIr translate(String naturalLanguage) throws TranslationException;
}
