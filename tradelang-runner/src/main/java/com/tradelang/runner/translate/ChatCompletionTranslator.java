package com.tradelang.runner.translate;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.tradelang.runner.config.RunnerConfig;
import com.tradelang.runner.data.HttpClientFactory;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;

/**
 * Translator backed by an OpenAI-compatible chat completions endpoint.
 *
 * The model is given the JSON schema and a few worked examples, and its reply is
 * searched for the outermost JSON object, so Markdown code fences or a stray
 * sentence around the object are tolerated.
 */
public class ChatCompletionTranslator implements StrategyTranslator {

    private static final Logger log = LoggerFactory.getLogger(ChatCompletionTranslator.class);
    private static final MediaType JSON_MEDIA = MediaType.get("application/json; charset=utf-8");
    private static final double TEMPERATURE = 0.1;
    private static final int MAX_TOKENS = 2000;

    static final String SYSTEM_PROMPT = """
        You are a trading strategy parser. Convert natural language trading rules into structured JSON.

        Output JSON schema:
        {
          "entry": [
            {
              "left": "field or indicator expression",
              "operator": "comparison operator",
              "right": "value or expression",
              "connector": "AND or OR (optional, omit for last condition)"
            }
          ],
          "exit": [
            {
              "left": "field or indicator expression",
              "operator": "comparison operator",
              "right": "value or expression",
              "connector": "AND or OR (optional)"
            }
          ]
        }

        Available fields: open, high, low, close, volume

        Available indicators (use this exact format):
        - sma(field, period) - Simple Moving Average
        - ema(field, period) - Exponential Moving Average
        - rsi(field, period) - Relative Strength Index

        Available operators: >, <, >=, <=, ==, crosses_above, crosses_below

        Special expressions:
        - prev(field, N) - Value N bars ago (e.g., prev(high, 1) for yesterday's high)
        - For percentage comparisons, convert to decimal (e.g., "30 percent" becomes 0.30)

        Rules:
        1. Use lowercase for field names
        2. Use exact indicator syntax: indicator_name(field, period)
        3. For "crosses above/below", use operator "crosses_above" or "crosses_below"
        4. Convert percentages to decimals
        5. Return ONLY valid JSON, no markdown, no explanations
        6. If entry or exit is not specified, use empty array []

        Examples:

        Input: "Buy when close is above 20-day moving average and volume is above 1 million"
        Output:
        {
          "entry": [
            {"left": "close", "operator": ">", "right": "sma(close, 20)", "connector": "AND"},
            {"left": "volume", "operator": ">", "right": 1000000}
          ],
          "exit": []
        }

        Input: "Enter when price crosses above yesterday's high. Exit when RSI(14) is below 30"
        Output:
        {
          "entry": [
            {"left": "close", "operator": "crosses_above", "right": "prev(high, 1)"}
          ],
          "exit": [
            {"left": "rsi(close, 14)", "operator": "<", "right": 30}
          ]
        }

        Input: "Trigger entry when volume increases by more than 30 percent compared to last week"
        Output:
        {
          "entry": [
            {"left": "volume", "operator": ">", "right": "prev(volume, 7) * 1.30"}
          ],
          "exit": []
        }
        """;

    private final OkHttpClient client;
    private final ObjectMapper mapper;
    private final String baseUrl;
    private final String model;
    private final String apiKey;

    public ChatCompletionTranslator(RunnerConfig config) {
        this(HttpClientFactory.getClient(), HttpClientFactory.getMapper(),
            config.getLlmUrl(), config.getLlmModel(), config.getLlmKey());
    }

    public ChatCompletionTranslator(OkHttpClient client, ObjectMapper mapper, String baseUrl, String model, String apiKey) {
        this.client = client;
        this.mapper = mapper;
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.model = model;
        this.apiKey = apiKey;
    }

    @Override
    public StrategyIr translate(String naturalLanguage) throws TranslationException {
        if (naturalLanguage == null || naturalLanguage.isBlank()) {
            throw new TranslationException("Nothing to translate: input is empty");
        }
        if (apiKey == null || apiKey.isBlank()) {
            throw new TranslationException("No API key configured for " + baseUrl
                + " (set tradelang.llm.key or TRADELANG_LLM_KEY)");
        }

        log.debug("Translating with {}: {}", model, naturalLanguage);
        String content = complete(naturalLanguage);
        StrategyIr strategy = parseReply(content);
        log.info("Translated into {} entry and {} exit conditions", strategy.entry().size(), strategy.exit().size());
        return strategy;
    }

    private String complete(String naturalLanguage) throws TranslationException {
        Request request;
        try {
            request = new Request.Builder()
                .url(baseUrl + "/chat/completions")
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(requestBody(naturalLanguage)), JSON_MEDIA))
                .build();
        } catch (JsonProcessingException e) {
            throw new TranslationException("Failed to encode completion request", e);
        }

        try (Response response = client.newCall(request).execute()) {
            String body = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new TranslationException("Completion API error: " + response.code() + " " + response.message() + " - " + body);
            }

            JsonNode content = mapper.readTree(body).path("choices").path(0).path("message").path("content");
            if (!content.isTextual()) {
                throw new TranslationException("Completion response has no message content: " + body);
            }
            return content.asText();
        } catch (IOException e) {
            throw new TranslationException("Completion request to " + baseUrl + " failed: " + e.getMessage(), e);
        }
    }

    private ObjectNode requestBody(String naturalLanguage) {
        ObjectNode body = mapper.createObjectNode();
        body.put("model", model);
        body.put("temperature", TEMPERATURE);
        body.put("max_tokens", MAX_TOKENS);

        ArrayNode messages = body.putArray("messages");
        messages.addObject().put("role", "system").put("content", SYSTEM_PROMPT);
        messages.addObject().put("role", "user").put("content",
            "Parse this trading rule into JSON:\n\n" + naturalLanguage + "\n\nReturn only the JSON output, no explanations.");
        return body;
    }

    /**
     * Extract and validate the strategy object from a model reply.
     */
    StrategyIr parseReply(String content) throws TranslationException {
        int start = content.indexOf('{');
        int end = content.lastIndexOf('}');
        if (start < 0 || end < start) {
            throw new TranslationException("No JSON object found in response: " + content);
        }

        JsonNode root;
        try {
            root = mapper.readTree(content.substring(start, end + 1));
        } catch (JsonProcessingException e) {
            throw new TranslationException("Response is not valid JSON: " + e.getOriginalMessage(), e);
        }

        validate(root);

        try {
            return mapper.treeToValue(root, StrategyIr.class);
        } catch (JsonProcessingException e) {
            throw new TranslationException("Response does not match the strategy schema: " + e.getOriginalMessage(), e);
        }
    }

    private static void validate(JsonNode root) throws TranslationException {
        if (!root.isObject()) {
            throw new TranslationException("Output must be a JSON object");
        }
        for (String section : new String[] {"entry", "exit"}) {
            JsonNode conditions = root.get(section);
            if (conditions == null) {
                throw new TranslationException("Missing '" + section + "' key");
            }
            if (!conditions.isArray()) {
                throw new TranslationException("'" + section + "' must be a list");
            }
            for (JsonNode condition : conditions) {
                if (!condition.isObject()) {
                    throw new TranslationException("Each condition in '" + section + "' must be an object");
                }
                for (String key : new String[] {"left", "operator", "right"}) {
                    if (!condition.hasNonNull(key)) {
                        throw new TranslationException("Condition in '" + section + "' missing required key: " + key);
                    }
                }
            }
        }
    }
}
