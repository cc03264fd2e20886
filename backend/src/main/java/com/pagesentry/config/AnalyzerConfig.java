package com.pagesentry.config;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import dev.langchain4j.model.embedding.EmbeddingModel;
import dev.langchain4j.model.openai.OpenAiEmbeddingModel;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import software.amazon.awssdk.auth.credentials.AwsBasicCredentials;
import software.amazon.awssdk.auth.credentials.StaticCredentialsProvider;
import software.amazon.awssdk.regions.Region;
import software.amazon.awssdk.services.s3.S3Client;

import java.net.URI;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

@Configuration
public class AnalyzerConfig {

    @Bean
    public RuntimeSizing runtimeSizing(AnalyzerProperties properties) {
        return RuntimeSizing.from(properties);
    }

    @Bean(name = "pageExecutor", destroyMethod = "shutdown")
    public ExecutorService pageExecutor(RuntimeSizing sizing) {
        return Executors.newFixedThreadPool(sizing.pageConcurrency(), namedThreads("page-worker"));
    }

    @Bean(name = "cpuExecutor", destroyMethod = "shutdown")
    public ExecutorService cpuExecutor(RuntimeSizing sizing) {
        return Executors.newFixedThreadPool(sizing.cpuPoolSize(), namedThreads("cpu"));
    }

    @Bean(name = "ioExecutor", destroyMethod = "shutdown")
    public ExecutorService ioExecutor(RuntimeSizing sizing) {
        return Executors.newFixedThreadPool(sizing.ioPoolSize(), namedThreads("io"));
    }

    @Bean(name = "dbExecutor", destroyMethod = "shutdown")
    public ExecutorService dbExecutor(RuntimeSizing sizing) {
        return Executors.newFixedThreadPool(sizing.dbPoolSize(), namedThreads("db"));
    }

    @Bean
    public HttpClient analyzerHttpClient(@Qualifier("ioExecutor") ExecutorService ioExecutor) {
        return HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(10))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(ioExecutor)
            .build();
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean(destroyMethod = "close")
    public S3Client s3Client(AnalyzerProperties properties) {
        AnalyzerProperties.Storage storage = properties.getStorage();
        return S3Client.builder()
            .endpointOverride(URI.create(storage.getEndpoint()))
            .region(Region.of(storage.getRegion()))
            .credentialsProvider(StaticCredentialsProvider.create(
                AwsBasicCredentials.create(storage.getAccessKey(), storage.getSecretKey())
            ))
            .forcePathStyle(true)
            .build();
    }

    @Bean
    @ConditionalOnProperty(prefix = "analyzer.validation", name = "enabled", havingValue = "true")
    public EmbeddingModel embeddingModel(AnalyzerProperties properties) {
        AnalyzerProperties.Embedding embedding = properties.getValidation().getEmbedding();
        return OpenAiEmbeddingModel.builder()
            .baseUrl(embedding.getBaseUrl())
            .apiKey(embedding.getApiKey())
            .modelName(embedding.getModelName())
            .timeout(Duration.ofSeconds(embedding.getTimeoutSeconds()))
            .build();
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return runnable -> {
            Thread thread = new Thread(runnable);
            thread.setName(prefix + "-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }
}
