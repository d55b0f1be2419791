package io.github.samzhu.prism.config;

import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * 客戶端連線配置屬性
 *
 * <p>從 application.yaml 中的 {@code prism.client} 前綴載入配置。
 *
 * <p>預設只採用連線的 socket 位址作為客戶端 IP；只有直接連線端符合
 * {@code trusted-proxies} 時才會解析 {@code X-Forwarded-For}。
 *
 * <pre>
 * prism:
 *   client:
 *     trusted-proxies: ["10.0.0.*", "127.0.0.1"]
 * </pre>
 *
 * @param trustedProxies 受信任的反向代理 IP 萬用字元樣式，空清單代表不信任任何代理
 */
@ConfigurationProperties(prefix = "prism.client")
public record ClientProperties(
    List<String> trustedProxies
) {
    public ClientProperties {
        trustedProxies = trustedProxies == null ? List.of() : List.copyOf(trustedProxies);
    }
}
