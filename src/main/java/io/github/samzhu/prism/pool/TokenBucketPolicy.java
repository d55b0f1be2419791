package io.github.samzhu.prism.pool;

/**
 * Token bucket 參數
 *
 * @param maxTokens 桶容量
 * @param tokensPerMinute 每分鐘補充數量
 * @param initialTokens 新帳號的初始數量
 */
public record TokenBucketPolicy(
    Integer maxTokens,
    Double tokensPerMinute,
    Integer initialTokens
) {
    public TokenBucketPolicy {
        if (maxTokens == null) {
            maxTokens = 50;
        }
        if (tokensPerMinute == null) {
            tokensPerMinute = 6.0;
        }
        if (initialTokens == null) {
            initialTokens = maxTokens;
        }
    }

    public static TokenBucketPolicy defaults() {
        return new TokenBucketPolicy(null, null, null);
    }
}
