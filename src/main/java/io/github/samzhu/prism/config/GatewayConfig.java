package io.github.samzhu.prism.config;

import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.MediaType;
import org.springframework.web.servlet.function.RouterFunction;
import org.springframework.web.servlet.function.RouterFunctions;
import org.springframework.web.servlet.function.ServerRequest;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.prism.exception.GlobalExceptionHandler;
import io.github.samzhu.prism.filter.ClientContextFilter;
import io.github.samzhu.prism.format.ClientDialect;
import io.github.samzhu.prism.format.ModelMapper;
import io.github.samzhu.prism.handler.NonStreamingChatHandler;
import io.github.samzhu.prism.handler.StreamingChatHandler;
import io.github.samzhu.prism.service.ChatGatewayService;

/**
 * HTTP 路由配置
 *
 * <p>定義對外端點：
 * <ul>
 *   <li>{@code POST /v1/chat/completions} - OpenAI Chat Completions 格式</li>
 *   <li>{@code POST /v1/messages} - Anthropic Messages 格式</li>
 *   <li>{@code GET /v1/models} - 可用模型列表（OpenAI 格式）</li>
 * </ul>
 *
 * <p>chat 端點依請求中的 {@code stream} 參數分流：
 * <ul>
 *   <li>{@code stream: true} → {@link StreamingChatHandler}（SSE）</li>
 *   <li>其他 → {@link NonStreamingChatHandler}（JSON）</li>
 * </ul>
 *
 * <p>所有錯誤交由 {@link GlobalExceptionHandler} 以客戶端協定格式回應。
 */
@Configuration
public class GatewayConfig {

    private static final Logger log = LoggerFactory.getLogger(GatewayConfig.class);

    private final ChatGatewayService chatGatewayService;
    private final StreamingChatHandler streamingChatHandler;
    private final NonStreamingChatHandler nonStreamingChatHandler;
    private final ClientContextFilter clientContextFilter;
    private final GlobalExceptionHandler globalExceptionHandler;
    private final ModelMapper modelMapper;

    public GatewayConfig(
            ChatGatewayService chatGatewayService,
            StreamingChatHandler streamingChatHandler,
            NonStreamingChatHandler nonStreamingChatHandler,
            ClientContextFilter clientContextFilter,
            GlobalExceptionHandler globalExceptionHandler,
            ModelMapper modelMapper) {
        this.chatGatewayService = chatGatewayService;
        this.streamingChatHandler = streamingChatHandler;
        this.nonStreamingChatHandler = nonStreamingChatHandler;
        this.clientContextFilter = clientContextFilter;
        this.globalExceptionHandler = globalExceptionHandler;
        this.modelMapper = modelMapper;
    }

    @Bean
    public RouterFunction<ServerResponse> chatRoutes() {
        return RouterFunctions.route()
            .POST("/v1/chat/completions", request -> handleChat(ClientDialect.OPENAI, request))
            .POST("/v1/messages", request -> handleChat(ClientDialect.ANTHROPIC, request))
            .GET("/v1/models", this::handleModels)
            .before(clientContextFilter)
            .onError(Throwable.class, globalExceptionHandler::handle)
            .build();
    }

    private ServerResponse handleChat(ClientDialect dialect, ServerRequest request) throws Exception {
        String requestBody = request.body(String.class);
        Map<String, String> headers = ClientContextFilter.headers(request);
        String clientIp = ClientContextFilter.clientIp(request);

        boolean streaming = chatGatewayService.isStreamRequested(requestBody);
        log.debug("Routing request: dialect={}, streaming={}, clientIp={}", dialect, streaming, clientIp);

        if (streaming) {
            return streamingChatHandler.handle(dialect, requestBody, headers, clientIp);
        }
        return nonStreamingChatHandler.handle(dialect, requestBody, headers, clientIp);
    }

    private ServerResponse handleModels(ServerRequest request) {
        return ServerResponse.ok()
            .contentType(MediaType.APPLICATION_JSON)
            .body(modelMapper.listModels());
    }
}
