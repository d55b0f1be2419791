package io.github.samzhu.prism.handler;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.servlet.function.ServerResponse;

import io.github.samzhu.prism.format.ClientDialect;
import io.github.samzhu.prism.service.ChatGatewayService;
import io.github.samzhu.prism.service.ChatStream;

/**
 * 串流 chat 處理器
 *
 * <p>先由 {@link ChatGatewayService#handleChatStream} 建立串流（此階段的錯誤仍以一般 JSON 錯誤回應），
 * 再將已格式化的 SSE frame 逐一寫出並 flush。
 *
 * <p>客戶端斷線時停止讀取後端、關閉後端連線，不回報帳號結果。
 *
 * @see NonStreamingChatHandler
 * @see ChatStream
 */
@Component
public class StreamingChatHandler {

    private static final Logger log = LoggerFactory.getLogger(StreamingChatHandler.class);

    private final ChatGatewayService chatGatewayService;

    public StreamingChatHandler(ChatGatewayService chatGatewayService) {
        this.chatGatewayService = chatGatewayService;
    }

    public ServerResponse handle(ClientDialect dialect, String requestBody, Map<String, String> headers,
                                 String clientIp) {
        ChatStream stream = chatGatewayService.handleChatStream(dialect, requestBody, headers, clientIp);

        return ServerResponse.ok()
            .contentType(MediaType.TEXT_EVENT_STREAM)
            .header(HttpHeaders.CACHE_CONTROL, "no-cache")
            .header("X-Accel-Buffering", "no")
            .build((servletRequest, servletResponse) -> {
                try {
                    writeFrames(stream, servletResponse.getOutputStream());
                } catch (Exception e) {
                    if (isClientDisconnectedException(e)) {
                        log.warn("Client disconnected during streaming: {}", e.getMessage());
                    } else {
                        log.error("Unexpected error during streaming: {}", e.getMessage(), e);
                    }
                } finally {
                    stream.close();
                }
                return null;
            });
    }

    static void writeFrames(ChatStream stream, OutputStream out) throws IOException {
        while (stream.hasNext()) {
            out.write(stream.next().getBytes(StandardCharsets.UTF_8));
            out.flush();
        }
    }

    /**
     * 檢查異常是否為客戶端斷開連接導致
     * <p>常見情況：
     * <ul>
     *   <li>Broken pipe - 客戶端關閉連接後伺服器嘗試寫入</li>
     *   <li>Connection reset - 客戶端強制重置連接</li>
     *   <li>ClientAbortException - Tomcat 檢測到客戶端中斷</li>
     * </ul>
     */
    static boolean isClientDisconnectedException(Throwable e) {
        if (e == null) {
            return false;
        }

        String className = e.getClass().getName();
        if (className.contains("ClientAbortException") ||
            className.contains("AsyncRequestNotUsableException")) {
            return true;
        }

        String message = e.getMessage();
        if (message != null) {
            String lowerMessage = message.toLowerCase();
            if (lowerMessage.contains("broken pipe") ||
                lowerMessage.contains("connection reset") ||
                lowerMessage.contains("client disconnected")) {
                return true;
            }
        }

        Throwable cause = e.getCause();
        if (cause != null && cause != e) {
            return isClientDisconnectedException(cause);
        }

        return false;
    }
}
