package com.flowgate.dispatcher.client;

import com.flowgate.common.dto.Token;

import java.util.Optional;

/**
 * Session Token 自动续期（例如通过浏览器重新登录）。
 * <p>
 * 仅在运行配置开启 sessionAutoRenew 时由健康检查调用一次。
 */
public interface SessionRenewer {

    /**
     * @return 新的 Session Token，无法续期时返回 empty
     */
    Optional<String> renew(Token token);
}
