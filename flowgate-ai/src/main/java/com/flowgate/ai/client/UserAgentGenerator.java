package com.flowgate.ai.client;

import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Random;
import java.util.function.Function;

/**
 * 按账号生成固定的 User-Agent。
 * <p>
 * 以账号标识的 MD5 前 8 位为种子创建独立的 {@link Random}，
 * 同一账号总是得到同一个 UA；结果缓存在有界 LRU 中。
 */
@Component
public class UserAgentGenerator {

    private static final int MAX_CACHED = 1024;

    private static final List<String> CHROME = List.of("130.0.0.0", "131.0.0.0", "132.0.0.0", "129.0.0.0");
    private static final List<String> FIREFOX = List.of("133.0", "132.0", "131.0", "134.0");
    private static final List<String> SAFARI = List.of("18.2", "18.1", "18.0", "17.6");
    private static final List<String> EDGE = List.of("130.0.0.0", "131.0.0.0", "132.0.0.0");

    private static final List<List<Function<Random, String>>> PLATFORMS = List.of(
            // Windows
            List.of(
                    r -> "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/"
                            + pick(r, CHROME) + " Safari/537.36",
                    r -> "Mozilla/5.0 (Windows NT 10.0; Win64; x64; rv:" + firefoxMajor(r)
                            + ") Gecko/20100101 Firefox/" + pick(r, FIREFOX),
                    r -> "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/"
                            + pick(r, CHROME) + " Safari/537.36 Edg/" + pick(r, EDGE)),
            // macOS
            List.of(
                    r -> "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/"
                            + pick(r, CHROME) + " Safari/537.36",
                    r -> "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/605.1.15 (KHTML, like Gecko) Version/"
                            + pick(r, SAFARI) + " Safari/605.1.15",
                    r -> "Mozilla/5.0 (Macintosh; Intel Mac OS X 14." + r.nextInt(8) + "; rv:" + firefoxMajor(r)
                            + ") Gecko/20100101 Firefox/" + pick(r, FIREFOX)),
            // Linux
            List.of(
                    r -> "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/"
                            + pick(r, CHROME) + " Safari/537.36",
                    r -> "Mozilla/5.0 (X11; Linux x86_64; rv:" + firefoxMajor(r)
                            + ") Gecko/20100101 Firefox/" + pick(r, FIREFOX),
                    r -> "Mozilla/5.0 (X11; Ubuntu; Linux x86_64; rv:" + firefoxMajor(r)
                            + ") Gecko/20100101 Firefox/" + pick(r, FIREFOX))
    );

    private final Map<String, String> cache = Collections.synchronizedMap(
            new LinkedHashMap<String, String>(64, 0.75f, true) {
                @Override
                protected boolean removeEldestEntry(Map.Entry<String, String> eldest) {
                    return size() > MAX_CACHED;
                }
            });

    /**
     * @param accountId 账号标识（通常是凭证前 16 位）
     */
    public String forAccount(String accountId) {
        return cache.computeIfAbsent(accountId, UserAgentGenerator::generate);
    }

    /**
     * 账号标识：ST 优先，其次 AT，取前 16 位。
     */
    public static String accountIdOf(String credential) {
        if (credential == null || credential.isEmpty()) {
            return "anonymous";
        }
        return credential.length() > 16 ? credential.substring(0, 16) : credential;
    }

    static String generate(String accountId) {
        Random random = new Random(seedOf(accountId));
        List<Function<Random, String>> browsers = PLATFORMS.get(random.nextInt(PLATFORMS.size()));
        return browsers.get(random.nextInt(browsers.size())).apply(random);
    }

    private static long seedOf(String accountId) {
        try {
            byte[] digest = MessageDigest.getInstance("MD5").digest(accountId.getBytes(StandardCharsets.UTF_8));
            long seed = 0;
            for (int i = 0; i < 4; i++) {
                seed = (seed << 8) | (digest[i] & 0xff);
            }
            return seed;
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 不可用", e);
        }
    }

    private static String pick(Random random, List<String> values) {
        return values.get(random.nextInt(values.size()));
    }

    private static String firefoxMajor(Random random) {
        return pick(random, FIREFOX).split("\\.")[0] + ".0";
    }
}
