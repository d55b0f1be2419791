package io.github.samzhu.prism;

import java.net.InetAddress;
import java.net.UnknownHostException;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Arrays;
import java.util.Collection;
import java.util.Optional;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.boot.info.BuildProperties;
import org.springframework.boot.info.GitProperties;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import io.github.samzhu.prism.apikey.ApiKeyService;
import io.github.samzhu.prism.config.BackendProperties;
import io.github.samzhu.prism.pool.AccountPool;
import jakarta.annotation.PostConstruct;

/**
 * 應用程式啟動處理器
 *
 * <p>啟動後輸出存取網址、執行環境、建置資訊、JVM 資訊與閘道狀態（帳號數、選擇策略、後端 URL、Key 驗證）。
 */
@Component
public class ApplicationStartup {

    private static final Logger log = LoggerFactory.getLogger(ApplicationStartup.class);
    private static final DateTimeFormatter DATE_FORMATTER = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss")
        .withZone(ZoneId.systemDefault());

    private final Environment env;
    private final Optional<BuildProperties> buildProperties;
    private final Optional<GitProperties> gitProperties;
    private final AccountPool accountPool;
    private final ApiKeyService apiKeyService;
    private final BackendProperties backendProperties;

    public ApplicationStartup(
            Environment env,
            Optional<BuildProperties> buildProperties,
            Optional<GitProperties> gitProperties,
            AccountPool accountPool,
            ApiKeyService apiKeyService,
            BackendProperties backendProperties) {
        this.env = env;
        this.buildProperties = buildProperties;
        this.gitProperties = gitProperties;
        this.accountPool = accountPool;
        this.apiKeyService = apiKeyService;
        this.backendProperties = backendProperties;
    }

    /**
     * 檢查 Profile 配置，避免衝突的 Profile 同時啟用
     */
    @PostConstruct
    public void initApplication() {
        Collection<String> activeProfiles = Arrays.asList(env.getActiveProfiles());
        if (activeProfiles.contains("dev") && activeProfiles.contains("prod")) {
            log.error("配置錯誤！應用程式不應同時啟用 'dev' 和 'prod' 環境");
        }
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        String protocol = Optional.ofNullable(env.getProperty("server.ssl.key-store"))
            .map(key -> "https")
            .orElse("http");
        String applicationName = env.getProperty("spring.application.name");
        String serverPort = env.getProperty("server.port", "8080");
        String contextPath = Optional.ofNullable(env.getProperty("server.servlet.context-path"))
            .filter(StringUtils::isNotBlank)
            .orElse("/");
        String hostAddress = "localhost";
        try {
            hostAddress = InetAddress.getLocalHost().getHostAddress();
        } catch (UnknownHostException e) {
            log.warn("無法取得主機名稱，使用 `localhost` 作為預設值");
        }

        String[] activeProfiles = env.getActiveProfiles();
        String profiles = Arrays.toString(activeProfiles.length > 0 ? activeProfiles : env.getDefaultProfiles());

        Runtime runtime = Runtime.getRuntime();
        String version = buildProperties.map(BuildProperties::getVersion).orElse("N/A");
        String buildTime = buildProperties
            .map(BuildProperties::getTime)
            .map(DATE_FORMATTER::format)
            .orElse("N/A");
        String gitCommit = gitProperties.map(GitProperties::getShortCommitId).orElse("N/A");

        log.info("""

            ----------------------------------------------------------
            \t應用程式 '{}' 啟動完成！
            ----------------------------------------------------------
            \t存取網址：
            \t  本機：   {}://localhost:{}{}
            \t  外部：   {}://{}:{}{}
            ----------------------------------------------------------
            \t執行環境： {}
            \t版本：     {}（建置時間：{}，Commit：{}）
            \tJava：     {}，最大記憶體：{} MB，處理器數量：{}
            ----------------------------------------------------------
            \t閘道：
            \t  後端：     {}
            \t  帳號數：   {}（可用 {}）
            \t  選擇策略： {}
            \t  Key 驗證： {}
            ----------------------------------------------------------""",
            applicationName,
            protocol, serverPort, contextPath,
            protocol, hostAddress, serverPort, contextPath,
            profiles,
            version, buildTime, gitCommit,
            System.getProperty("java.version"), runtime.maxMemory() / (1024 * 1024), runtime.availableProcessors(),
            backendProperties.baseUrl(),
            accountPool.size(), accountPool.availableCount(),
            accountPool.strategyName(),
            apiKeyService.hasApiKeys() ? "啟用" : "未設定 Key（不驗證）"
        );
    }
}
