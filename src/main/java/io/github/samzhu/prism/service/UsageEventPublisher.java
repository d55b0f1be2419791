package io.github.samzhu.prism.service;

import java.net.URI;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.UUID;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageBuilder;
import org.springframework.cloud.stream.function.StreamBridge;
import org.springframework.messaging.Message;
import org.springframework.stereotype.Service;

import io.github.samzhu.prism.model.UsageEventData;

/**
 * 請求紀錄事件發送服務
 *
 * <p>以 CloudEvents v1.0 Binary Mode 透過 Spring Cloud Stream 發送：
 * <ul>
 *   <li>{@code type}: io.github.samzhu.prism.usage.v1</li>
 *   <li>{@code source}: /prism/chat</li>
 *   <li>{@code subject}: API Key ID（未啟用 Key 驗證時為 anonymous）</li>
 *   <li>{@code id}: OpenTelemetry Trace ID，沒有時使用 UUID</li>
 * </ul>
 *
 * <p>發送失敗只記錄日誌，不影響請求本身。
 *
 * @see UsageEventData
 * @see <a href="https://cloudevents.io/">CloudEvents Specification</a>
 */
@Service
public class UsageEventPublisher {

    private static final Logger log = LoggerFactory.getLogger(UsageEventPublisher.class);

    static final String BINDING_NAME = "usageEvent-out-0";
    static final String EVENT_TYPE = "io.github.samzhu.prism.usage.v1";
    private static final URI EVENT_SOURCE = URI.create("/prism/chat");

    private final StreamBridge streamBridge;

    public UsageEventPublisher(StreamBridge streamBridge) {
        this.streamBridge = streamBridge;
        log.info("UsageEventPublisher initialized: bindingName={}", BINDING_NAME);
    }

    /**
     * 發送請求紀錄事件
     *
     * <p>CloudEvents 屬性放在 message headers（{@code ce-} 前綴），data 由 Spring 序列化為 JSON。
     *
     * @param eventData 請求紀錄
     */
    public void publish(UsageEventData eventData) {
        try {
            String eventId = eventData.traceId() != null ? eventData.traceId() : UUID.randomUUID().toString();
            String subject = eventData.apiKeyId() != null ? eventData.apiKeyId() : "anonymous";
            OffsetDateTime eventTime = eventData.eventTime() != null
                ? OffsetDateTime.ofInstant(eventData.eventTime(), ZoneOffset.UTC)
                : OffsetDateTime.now(ZoneOffset.UTC);

            Message<UsageEventData> message = CloudEventMessageBuilder
                .withData(eventData)
                .setId(eventId)
                .setType(EVENT_TYPE)
                .setSource(EVENT_SOURCE)
                .setTime(eventTime)
                .setSubject(subject)
                .setDataContentType("application/json")
                .build();

            if (streamBridge.send(BINDING_NAME, message)) {
                log.debug("Usage event published: id={}, apiKeyId={}, model={}, status={}",
                    eventId, eventData.apiKeyId(), eventData.model(), eventData.status());
            } else {
                log.warn("Failed to publish usage event: id={}", eventId);
            }
        } catch (Exception e) {
            String rootCause = e.getCause() != null ? e.getCause().getClass().getSimpleName() : "N/A";
            log.error("Error publishing usage event: type={}, message={}, rootCause={}, binding={}",
                e.getClass().getSimpleName(), e.getMessage(), rootCause, BINDING_NAME, e);
        }
    }
}
