package io.github.samzhu.prism.handler;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.prism.format.ClientDialect;
import io.github.samzhu.prism.service.ChatGatewayService;
import io.github.samzhu.prism.service.GatewayReply;

/**
 * 非串流 chat 處理器
 *
 * <p>呼叫 {@link ChatGatewayService#handleChatRequest} 並以 JSON 回應；
 * 錯誤由路由的 {@code onError} 轉為客戶端格式。
 *
 * @see StreamingChatHandler
 */
@Component
public class NonStreamingChatHandler {

    private static final Logger log = LoggerFactory.getLogger(NonStreamingChatHandler.class);

    private final ChatGatewayService chatGatewayService;

    public NonStreamingChatHandler(ChatGatewayService chatGatewayService) {
        this.chatGatewayService = chatGatewayService;
    }

    public ServerResponse handle(ClientDialect dialect, String requestBody, Map<String, String> headers,
                                 String clientIp) {
        GatewayReply reply = chatGatewayService.handleChatRequest(dialect, requestBody, headers, clientIp);
        log.debug("Non-streaming response: dialect={}, status={}", dialect, reply.status());
        return ServerResponse.status(reply.status())
            .contentType(MediaType.APPLICATION_JSON)
            .body(reply.body());
    }
}
