package com.flowgate.dispatcher.proxy;

import lombok.Value;

/**
 * 一次出站调用选中的代理。单代理模式下 poolItemId 为 null。
 */
@Value
public class ProxySelection {

    Long poolItemId;

    String proxyUrl;

    public boolean fromPool() {
        return poolItemId != null;
    }
}
