package com.tradelang.runner.data;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.tradelang.runner.translate.JsonToDslConverter;
import com.tradelang.runner.translate.StrategyIr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reads strategy files.
 *
 * {@code .yaml}, {@code .yml} and {@code .json} files are mapped to a
 * {@link StrategyFile}; anything else is read as plain DSL text and named after
 * the file. The returned file always carries DSL text.
 */
public class StrategyFiles {

    private static final Logger log = LoggerFactory.getLogger(StrategyFiles.class);

    private final ObjectMapper json;
    private final ObjectMapper yaml;
    private final JsonToDslConverter converter;

    public StrategyFiles() {
        this(HttpClientFactory.getMapper(), HttpClientFactory.getYamlMapper(), new JsonToDslConverter());
    }

    public StrategyFiles(ObjectMapper json, ObjectMapper yaml, JsonToDslConverter converter) {
        this.json = json;
        this.yaml = yaml;
        this.converter = converter;
    }

    public StrategyFile load(Path path) throws IOException {
        String fileName = path.getFileName().toString();
        String lower = fileName.toLowerCase(Locale.ROOT);
        String baseName = fileName.contains(".") ? fileName.substring(0, fileName.lastIndexOf('.')) : fileName;

        StrategyFile file;
        if (lower.endsWith(".yaml") || lower.endsWith(".yml")) {
            file = resolve(yaml.readValue(path.toFile(), StrategyFile.class), baseName, path);
        } else if (lower.endsWith(".json")) {
            file = resolve(json.readValue(path.toFile(), StrategyFile.class), baseName, path);
        } else {
            String text = Files.readString(path, StandardCharsets.UTF_8);
            if (text.isBlank()) {
                throw new IOException("Strategy file is empty: " + path);
            }
            file = StrategyFile.ofDsl(baseName, text);
        }

        log.debug("Loaded strategy '{}' from {}", file.name(), path);
        return file;
    }

    private StrategyFile resolve(StrategyFile file, String defaultName, Path path) throws IOException {
        if (file == null) {
            throw new IOException("Strategy file is empty: " + path);
        }
        String name = file.name() != null && !file.name().isBlank() ? file.name() : defaultName;

        if (file.hasDsl()) {
            return new StrategyFile(name, file.description(), file.dsl(), file.entry(), file.exit());
        }
        if (file.hasConditions()) {
            String dsl;
            try {
                dsl = converter.convert(new StrategyIr(file.entry(), file.exit()));
            } catch (IllegalArgumentException e) {
                throw new IOException("Invalid conditions in " + path + ": " + e.getMessage(), e);
            }
            return new StrategyFile(name, file.description(), dsl, file.entry(), file.exit());
        }
        throw new IOException("Strategy file " + path + " needs either 'dsl' or 'entry'/'exit' conditions");
    }
}
