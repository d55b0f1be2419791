package io.github.samzhu.prism.util;

import java.util.Collection;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * 萬用字元樣式比對工具
 *
 * <p>用於 API Key 的模型允許清單與 IP 白名單：
 * <ul>
 *   <li>{@code *} 代表任意長度字元（含空字串）</li>
 *   <li>其餘字元皆為字面比對，不分大小寫</li>
 *   <li>樣式必須比對整個字串</li>
 * </ul>
 *
 * <p>範例：{@code gemini-*} 符合 {@code gemini-3-flash}；{@code *-thinking} 符合
 * {@code claude-opus-4-5-thinking}；{@code 192.168.1.*} 符合 {@code 192.168.1.20}。
 */
public final class GlobPattern {

    private static final String IPV4_MAPPED_PREFIX = "::ffff:";
    private static final String LOOPBACK_V4 = "127.0.0.1";

    private static final Map<String, Pattern> COMPILED = new ConcurrentHashMap<>();

    private GlobPattern() {
    }

    /**
     * 單一樣式比對
     */
    public static boolean matches(String glob, String value) {
        if (glob == null || value == null) {
            return false;
        }
        return COMPILED.computeIfAbsent(glob, GlobPattern::compile).matcher(value).matches();
    }

    /**
     * 任一樣式符合即通過；樣式清單為空代表不限制
     */
    public static boolean matchesAny(Collection<String> globs, String value) {
        if (globs == null || globs.isEmpty()) {
            return true;
        }
        for (String glob : globs) {
            if (matches(glob, value)) {
                return true;
            }
        }
        return false;
    }

    /**
     * IP 白名單比對，雙方皆先經過 {@link #normalizeIp(String)}
     */
    public static boolean ipAllowed(Collection<String> whitelist, String ip) {
        if (whitelist == null || whitelist.isEmpty()) {
            return true;
        }
        String normalized = normalizeIp(ip);
        for (String entry : whitelist) {
            if (matches(normalizeIp(entry), normalized)) {
                return true;
            }
        }
        return false;
    }

    /**
     * 正規化 IP 位址
     *
     * <ul>
     *   <li>{@code ::1}、{@code 0:0:0:0:0:0:0:1} → {@code 127.0.0.1}</li>
     *   <li>{@code ::ffff:10.0.0.1} → {@code 10.0.0.1}</li>
     * </ul>
     */
    public static String normalizeIp(String ip) {
        if (ip == null) {
            return null;
        }
        String trimmed = ip.trim();
        if ("::1".equals(trimmed) || "0:0:0:0:0:0:0:1".equals(trimmed)) {
            return LOOPBACK_V4;
        }
        if (trimmed.toLowerCase(Locale.ROOT).startsWith(IPV4_MAPPED_PREFIX)) {
            return trimmed.substring(IPV4_MAPPED_PREFIX.length());
        }
        return trimmed;
    }

    private static Pattern compile(String glob) {
        StringBuilder regex = new StringBuilder();
        String[] literals = glob.split("\\*", -1);
        for (int i = 0; i < literals.length; i++) {
            if (i > 0) {
                regex.append(".*");
            }
            if (!literals[i].isEmpty()) {
                regex.append(Pattern.quote(literals[i]));
            }
        }
        return Pattern.compile(regex.toString(), Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE | Pattern.DOTALL);
    }
}
