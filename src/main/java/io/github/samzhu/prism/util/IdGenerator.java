package io.github.samzhu.prism.util;

import java.security.SecureRandom;
import java.util.HexFormat;
import java.util.concurrent.ThreadLocalRandom;

/**
 * ID 產生工具
 *
 * <p>{@link #withPrefix} 用於回應 ID（如 {@code chatcmpl-}、{@code call_}），
 * {@link #secureHex} 用於需要密碼學強度的 API Key。
 */
public final class IdGenerator {

    private static final SecureRandom SECURE_RANDOM = new SecureRandom();
    private static final HexFormat HEX = HexFormat.of();

    private IdGenerator() {
    }

    /**
     * 產生指定長度的隨機十六進位字串
     */
    public static String randomHex(int length) {
        byte[] bytes = new byte[(length + 1) / 2];
        ThreadLocalRandom.current().nextBytes(bytes);
        return HEX.formatHex(bytes).substring(0, length);
    }

    /**
     * 產生帶前綴的 ID，如 {@code chatcmpl-3f9a...}
     */
    public static String withPrefix(String prefix, int hexLength) {
        return prefix + randomHex(hexLength);
    }

    /**
     * 以 {@link SecureRandom} 產生十六進位字串
     */
    public static String secureHex(int length) {
        byte[] bytes = new byte[(length + 1) / 2];
        SECURE_RANDOM.nextBytes(bytes);
        return HEX.formatHex(bytes).substring(0, length);
    }
}
