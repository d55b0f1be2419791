package io.github.samzhu.prism.config;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.concurrent.Executor;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.web.client.RestClient;

import com.fasterxml.jackson.databind.ObjectMapper;

import io.github.samzhu.prism.apikey.ApiKeyRecord;
import io.github.samzhu.prism.apikey.ApiKeyService;
import io.github.samzhu.prism.apikey.ApiKeyStore;
import io.github.samzhu.prism.apikey.ApiKeyValidator;
import io.github.samzhu.prism.apikey.InMemoryApiKeyStore;
import io.github.samzhu.prism.apikey.SlidingWindowRateLimiter;
import io.github.samzhu.prism.backend.BackendTransport;
import io.github.samzhu.prism.backend.RestClientBackendTransport;
import io.github.samzhu.prism.format.AnthropicRequestConverter;
import io.github.samzhu.prism.format.AnthropicResponseConverter;
import io.github.samzhu.prism.format.ConverterFactory;
import io.github.samzhu.prism.format.ModelMapper;
import io.github.samzhu.prism.format.OpenAiRequestConverter;
import io.github.samzhu.prism.format.OpenAiResponseConverter;
import io.github.samzhu.prism.pool.AccountPool;
import io.github.samzhu.prism.pool.AccountSelectionStrategy;
import io.github.samzhu.prism.pool.AccountStore;
import io.github.samzhu.prism.pool.HybridStrategy;
import io.github.samzhu.prism.pool.InMemoryAccountStore;
import io.github.samzhu.prism.pool.JsonFileAccountStore;
import io.github.samzhu.prism.pool.RoundRobinStrategy;
import io.github.samzhu.prism.service.ChatGatewayService;
import io.github.samzhu.prism.service.UsageEventPublisher;
import io.github.samzhu.prism.util.SseParser;
import io.micrometer.tracing.Tracer;

/**
 * 核心元件配置
 *
 * <p>組裝帳號池、API Key 驗證、協定轉換與後端傳輸。這些元件本身不依賴 Spring，
 * 在此以建構子注入串接，並指定需要關閉的資源（速率限制器、帳號池）。
 *
 * <p>啟動時：
 * <ul>
 *   <li>匯入 {@code prism.api-keys.keys} 中的 Key</li>
 *   <li>載入帳號檔案並加入 {@code prism.accounts.seed} 中的帳號</li>
 * </ul>
 */
@Configuration
public class CoreConfig {

    private static final Logger log = LoggerFactory.getLogger(CoreConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * 帳號狀態寫入檔案用的單執行緒 executor，確保寫入順序
     */
    @Bean
    public ThreadPoolTaskExecutor accountPersistenceExecutor(TaskDecorator taskDecorator) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("account-store-");
        executor.setTaskDecorator(taskDecorator);
        executor.setWaitForTasksToCompleteOnShutdown(true);
        return executor;
    }

    /**
     * API Key 使用紀錄（次數、最後使用時間）更新用的 executor
     */
    @Bean
    public ThreadPoolTaskExecutor apiKeyUsageExecutor(TaskDecorator taskDecorator) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.setQueueCapacity(10_000);
        executor.setThreadNamePrefix("api-key-usage-");
        executor.setTaskDecorator(taskDecorator);
        return executor;
    }

    @Bean(destroyMethod = "close")
    public SlidingWindowRateLimiter slidingWindowRateLimiter(Clock clock) {
        return new SlidingWindowRateLimiter(clock);
    }

    @Bean
    public ApiKeyStore apiKeyStore() {
        return new InMemoryApiKeyStore();
    }

    @Bean
    public ApiKeyService apiKeyService(ApiKeyStore apiKeyStore,
                                       SlidingWindowRateLimiter rateLimiter,
                                       @Qualifier("apiKeyUsageExecutor") Executor usageExecutor,
                                       Clock clock,
                                       ApiKeyProperties properties) {
        ApiKeyService service = new ApiKeyService(apiKeyStore, rateLimiter, usageExecutor, clock);
        for (ApiKeyProperties.KeyConfig key : properties.keys()) {
            ApiKeyRecord imported = service.importKey(key.value(), key.toSettings());
            log.info("API key imported: id={}, name={}", imported.id(), key.name());
        }
        if (!service.hasApiKeys()) {
            log.warn("No API keys configured; chat endpoints accept unauthenticated requests");
        }
        return service;
    }

    @Bean
    public ApiKeyValidator apiKeyValidator(ApiKeyStore apiKeyStore, SlidingWindowRateLimiter rateLimiter, Clock clock) {
        return new ApiKeyValidator(apiKeyStore, rateLimiter, clock);
    }

    @Bean
    public AccountSelectionStrategy accountSelectionStrategy(AccountProperties properties) {
        String strategy = properties.strategy().trim().toLowerCase();
        if (HybridStrategy.NAME.equals(strategy)) {
            return new HybridStrategy(properties.healthScore(), properties.tokenBucket());
        }
        if (RoundRobinStrategy.NAME.equals(strategy)) {
            return new RoundRobinStrategy();
        }
        throw new IllegalArgumentException("Unknown account selection strategy: " + properties.strategy()
            + " (expected " + RoundRobinStrategy.NAME + " or " + HybridStrategy.NAME + ")");
    }

    @Bean
    public AccountStore accountStore(AccountProperties properties, ObjectMapper objectMapper) {
        if (StringUtils.isBlank(properties.storeFile())) {
            log.info("Account store: in-memory");
            return new InMemoryAccountStore();
        }
        log.info("Account store: file={}", properties.storeFile());
        return new JsonFileAccountStore(Path.of(properties.storeFile()), objectMapper);
    }

    @Bean(destroyMethod = "close")
    public AccountPool accountPool(AccountStore accountStore,
                                   AccountSelectionStrategy strategy,
                                   AccountProperties properties,
                                   Clock clock,
                                   @Qualifier("accountPersistenceExecutor") Executor persistenceExecutor)
            throws IOException {
        AccountPool pool = new AccountPool(accountStore, strategy, properties.healthScore(),
            properties.tokenBucket(), properties.defaultCooldown(), clock, persistenceExecutor);
        pool.load();
        for (AccountProperties.Seed seed : properties.seed()) {
            pool.addAccount(seed.email(), seed.accessToken(), seed.subscriptionTier());
        }
        log.info("Account pool ready: accounts={}, available={}, strategy={}",
            pool.size(), pool.availableCount(), pool.strategyName());
        return pool;
    }

    @Bean
    public ModelMapper modelMapper(ModelProperties properties, Clock clock) {
        return new ModelMapper(properties.mapping(), properties.defaultModel(), clock);
    }

    @Bean
    public ConverterFactory converterFactory(ModelMapper modelMapper, ObjectMapper objectMapper, Clock clock) {
        return new ConverterFactory(
            List.of(new OpenAiRequestConverter(modelMapper, objectMapper), new AnthropicRequestConverter(modelMapper)),
            List.of(new OpenAiResponseConverter(objectMapper, clock), new AnthropicResponseConverter()),
            objectMapper,
            clock);
    }

    @Bean
    public SseParser sseParser(ObjectMapper objectMapper) {
        return new SseParser(objectMapper);
    }

    /**
     * 使用 Spring 自動配置的 {@code RestClient.Builder}，確保 Tracing 自動傳播
     */
    @Bean
    public BackendTransport backendTransport(RestClient.Builder restClientBuilder,
                                             BackendProperties properties,
                                             ObjectMapper objectMapper,
                                             SseParser sseParser) {
        return new RestClientBackendTransport(restClientBuilder, properties, objectMapper, sseParser);
    }

    @Bean
    public ChatGatewayService chatGatewayService(ConverterFactory converterFactory,
                                                 ApiKeyValidator apiKeyValidator,
                                                 ApiKeyService apiKeyService,
                                                 AccountPool accountPool,
                                                 BackendTransport backendTransport,
                                                 UsageEventPublisher usageEventPublisher,
                                                 ObjectMapper objectMapper,
                                                 Tracer tracer,
                                                 Clock clock,
                                                 BackendProperties backendProperties) {
        return new ChatGatewayService(converterFactory, apiKeyValidator, apiKeyService, accountPool,
            backendTransport, usageEventPublisher, objectMapper, tracer, clock, backendProperties.maxRetries());
    }
}
