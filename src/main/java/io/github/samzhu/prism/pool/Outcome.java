package io.github.samzhu.prism.pool;

/**
 * 單次後端呼叫對帳號的結果
 */
public enum Outcome {
    /** 成功，或客戶端自身造成的 4xx */
    SUCCESS,
    /** 後端回應 429 */
    RATE_LIMITED,
    /** 5xx、連線錯誤或認證被拒 */
    FAILURE
}
