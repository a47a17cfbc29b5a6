package com.tradelang.runner.data;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import okhttp3.ConnectionPool;
import okhttp3.OkHttpClient;

import java.util.concurrent.TimeUnit;

/**
 * Factory for the shared HTTP client and Jackson mappers.
 *
 * The translator, strategy file loader and report writer all use the same
 * configuration: JavaTimeModule registered, ISO timestamps, unknown properties ignored.
 */
public final class HttpClientFactory {

    private static final OkHttpClient SHARED_CLIENT;
    private static final ObjectMapper SHARED_MAPPER;
    private static final ObjectMapper YAML_MAPPER;

    static {
        // Completion calls can take a while on large models
        SHARED_CLIENT = new OkHttpClient.Builder()
            .connectionPool(new ConnectionPool(2, 5, TimeUnit.MINUTES))
            .connectTimeout(30, TimeUnit.SECONDS)
            .readTimeout(90, TimeUnit.SECONDS)
            .writeTimeout(30, TimeUnit.SECONDS)
            .retryOnConnectionFailure(true)
            .build();

        SHARED_MAPPER = configure(new ObjectMapper());
        YAML_MAPPER = configure(new ObjectMapper(new YAMLFactory()));
    }

    private HttpClientFactory() {
        // Prevent instantiation
    }

    private static ObjectMapper configure(ObjectMapper mapper) {
        return mapper
            .registerModule(new JavaTimeModule())
            .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    /**
     * Get the shared OkHttpClient instance.
     */
    public static OkHttpClient getClient() {
        return SHARED_CLIENT;
    }

    /**
     * Get the shared JSON ObjectMapper.
     */
    public static ObjectMapper getMapper() {
        return SHARED_MAPPER;
    }

    /**
     * Get the shared YAML ObjectMapper, configured like {@link #getMapper()}.
     */
    public static ObjectMapper getYamlMapper() {
        return YAML_MAPPER;
    }
}
