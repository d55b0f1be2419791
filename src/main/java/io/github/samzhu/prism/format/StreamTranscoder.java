package io.github.samzhu.prism.format;

import java.util.List;

import io.github.samzhu.prism.model.BackendEvent;

/**
 * 串流轉譯器：把後端 SSE 事件逐一轉為客戶端 frame
 *
 * <p>每個串流建立一個實例，非執行緒安全。結束（正常完成或錯誤）後忽略之後的所有事件。
 *
 * @see OpenAiStreamTranscoder
 * @see AnthropicStreamTranscoder
 */
public interface StreamTranscoder {

    /**
     * 處理單一後端事件
     *
     * @return 要送給客戶端的 frame（已含 SSE 格式與結尾空行），可能為空
     */
    List<String> onEvent(BackendEvent event);

    /**
     * 後端串流在結束事件前中斷或讀取失敗
     *
     * @return 錯誤 frame；已結束時為空
     */
    List<String> onFailure(String message);

    /**
     * 是否已結束
     */
    boolean isFinished();
}
