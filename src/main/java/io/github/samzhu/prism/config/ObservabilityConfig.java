package io.github.samzhu.prism.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskDecorator;
import org.springframework.core.task.support.ContextPropagatingTaskDecorator;

/**
 * 可觀測性配置
 *
 * <p>帳號狀態寫入與 API Key 使用紀錄更新在背景 executor 執行，透過 {@link TaskDecorator}
 * 把呼叫端的 Tracing Context 帶到背景執行緒，日誌中的 traceId 才能對應到原始請求。
 *
 * @see CoreConfig#accountPersistenceExecutor
 * @see CoreConfig#apiKeyUsageExecutor
 * @see <a href="https://docs.spring.io/spring-boot/reference/actuator/tracing.html">Spring Boot Tracing</a>
 */
@Configuration
public class ObservabilityConfig {

    @Bean
    public TaskDecorator contextPropagatingTaskDecorator() {
        return new ContextPropagatingTaskDecorator();
    }
}
