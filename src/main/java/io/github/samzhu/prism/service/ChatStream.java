package io.github.samzhu.prism.service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.prism.backend.BackendEventStream;
import io.github.samzhu.prism.backend.BackendException;
import io.github.samzhu.prism.format.StreamTranscoder;
import io.github.samzhu.prism.model.BackendEvent;
import io.github.samzhu.prism.model.UsageEventData;
import io.github.samzhu.prism.pool.AccountIdentity;
import io.github.samzhu.prism.pool.AccountPool;
import io.github.samzhu.prism.pool.Outcome;
import io.github.samzhu.prism.util.TokenExtractor;

/**
 * 一次串流請求的客戶端 frame 序列
 *
 * <p>惰性地從後端拉取事件、交給 {@link StreamTranscoder} 轉譯。串流結束時：
 * <ul>
 *   <li>關閉後端連線</li>
 *   <li>回報帳號結果（正常完成為成功；串流內錯誤依錯誤類型判定）</li>
 *   <li>發送請求紀錄事件</li>
 * </ul>
 *
 * <p>客戶端中途斷線時呼叫 {@link #close()}：關閉後端連線，不回報帳號結果，
 * 紀錄狀態為 {@code client_disconnected}。
 *
 * <p>非執行緒安全，由寫出回應的執行緒獨佔使用。
 */
public class ChatStream implements Iterator<String>, AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ChatStream.class);

    private final BackendEventStream events;
    private final StreamTranscoder transcoder;
    private final AccountPool accountPool;
    private final AccountIdentity identity;
    private final UsageEventData.Builder usage;
    private final UsageEventPublisher usageEventPublisher;
    private final Clock clock;
    private final long startMillis;

    private final TokenExtractor tokenExtractor = new TokenExtractor();
    private final Deque<String> frames = new ArrayDeque<>();
    private boolean ended;

    ChatStream(BackendEventStream events,
               StreamTranscoder transcoder,
               AccountPool accountPool,
               AccountIdentity identity,
               UsageEventData.Builder usage,
               UsageEventPublisher usageEventPublisher,
               Clock clock,
               long startMillis) {
        this.events = events;
        this.transcoder = transcoder;
        this.accountPool = accountPool;
        this.identity = identity;
        this.usage = usage;
        this.usageEventPublisher = usageEventPublisher;
        this.clock = clock;
        this.startMillis = startMillis;
    }

    @Override
    public boolean hasNext() {
        while (frames.isEmpty() && !ended) {
            pull();
        }
        return !frames.isEmpty();
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("Chat stream has ended");
        }
        return frames.poll();
    }

    /**
     * 提前結束串流（客戶端斷線或寫出失敗）
     */
    @Override
    public void close() {
        if (ended) {
            return;
        }
        ended = true;
        frames.clear();
        events.close();
        log.warn("Chat stream closed before completion: account={}, outputTokens={}",
            identity.getEmail(), tokenExtractor.getOutputTokens());
        publish("client_disconnected", null, 499);
    }

    public AccountIdentity getIdentity() {
        return identity;
    }

    private void pull() {
        if (transcoder.isFinished()) {
            finish();
            return;
        }
        try {
            if (events.hasNext()) {
                BackendEvent event = events.next();
                tokenExtractor.processEvent(event.payload());
                frames.addAll(transcoder.onEvent(event));
                if (transcoder.isFinished()) {
                    finish();
                }
            } else {
                log.error("Backend stream ended before message_stop: account={}", identity.getEmail());
                frames.addAll(transcoder.onFailure("Backend stream ended unexpectedly"));
                end(Outcome.FAILURE, "error", "api_error", 502);
            }
        } catch (BackendException e) {
            log.error("Backend stream failed: account={}, error={}", identity.getEmail(), e.getMessage());
            frames.addAll(transcoder.onFailure(e.getMessage()));
            end(e.outcome(), "error", e.getErrorType(), e.getStatus());
        }
    }

    private void finish() {
        String errorType = tokenExtractor.getErrorType();
        if (errorType == null) {
            end(Outcome.SUCCESS, "success", null, 200);
        } else if ("rate_limit_error".equals(errorType)) {
            end(Outcome.RATE_LIMITED, "rate_limited", errorType, 429);
        } else if ("invalid_request_error".equals(errorType)) {
            end(Outcome.SUCCESS, "error", errorType, 400);
        } else {
            end(Outcome.FAILURE, "error", errorType, 502);
        }
    }

    private void end(Outcome outcome, String status, String errorType, int httpStatus) {
        if (ended) {
            return;
        }
        ended = true;
        events.close();
        accountPool.recordOutcome(identity, outcome);
        publish(status, errorType, httpStatus);
    }

    private void publish(String status, String errorType, int httpStatus) {
        tokenExtractor.applyTo(usage);
        UsageEventData data = usage
            .status(status)
            .errorType(errorType)
            .httpStatus(httpStatus)
            .latencyMs(clock.millis() - startMillis)
            .eventTime(clock.instant())
            .build();
        log.info("Token usage: apiKeyId={}, account={}, inputTokens={}, outputTokens={}, model={}, latencyMs={}",
            data.apiKeyId(), data.accountEmail(), data.inputTokens(), data.outputTokens(), data.model(),
            data.latencyMs());
        usageEventPublisher.publish(data);
    }
}
