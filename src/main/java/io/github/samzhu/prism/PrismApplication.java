package io.github.samzhu.prism;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Prism 應用程式入口
 *
 * <p>協定轉換 LLM 閘道，讓 OpenAI 與 Anthropic 格式的客戶端共用一組後端帳號：
 * <ul>
 *   <li>OpenAI Chat Completions / Anthropic Messages 與後端 Messages 格式互轉（含串流）</li>
 *   <li>帳號池輪換、健康分數與限流冷卻</li>
 *   <li>客戶端 API Key 驗證與每分鐘、每小時速率限制</li>
 *   <li>請求紀錄事件（CloudEvents 格式）</li>
 * </ul>
 */
@SpringBootApplication
@ConfigurationPropertiesScan
@EnableScheduling
public class PrismApplication {

	public static void main(String[] args) {
		SpringApplication.run(PrismApplication.class, args);
	}

}
