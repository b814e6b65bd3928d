package com.flowgate.ai.client;

import com.flowgate.dispatcher.proxy.ProxySelection;
import lombok.extern.slf4j.Slf4j;
import okhttp3.Authenticator;
import okhttp3.Credentials;
import okhttp3.OkHttpClient;

import java.net.InetSocketAddress;
import java.net.Proxy;
import java.net.URI;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * 按出口代理派生 OkHttpClient。
 * <p>
 * 派生的客户端共享基础客户端的连接池与线程池，按代理地址缓存复用。
 */
@Slf4j
public class ProxiedHttpClients {

    private final OkHttpClient baseClient;
    private final Map<String, OkHttpClient> clients = new ConcurrentHashMap<>();

    public ProxiedHttpClients(OkHttpClient baseClient) {
        this.baseClient = baseClient;
    }

    public OkHttpClient forSelection(Optional<ProxySelection> selection) {
        if (selection.isEmpty()) {
            return baseClient;
        }
        return clients.computeIfAbsent(selection.get().getProxyUrl(), this::build);
    }

    private OkHttpClient build(String proxyUrl) {
        URI uri = URI.create(proxyUrl);
        String scheme = uri.getScheme() == null ? "http" : uri.getScheme().toLowerCase();
        Proxy.Type type = scheme.startsWith("socks") ? Proxy.Type.SOCKS : Proxy.Type.HTTP;
        int port = uri.getPort() > 0 ? uri.getPort() : (type == Proxy.Type.SOCKS ? 1080 : 8080);

        OkHttpClient.Builder builder = baseClient.newBuilder()
                .proxy(new Proxy(type, InetSocketAddress.createUnresolved(uri.getHost(), port)));

        String userInfo = uri.getUserInfo();
        if (userInfo != null && userInfo.contains(":")) {
            if (type == Proxy.Type.SOCKS) {
                log.warn("SOCKS 代理不支持用户名密码认证, 已忽略: {}:{}", uri.getHost(), port);
            } else {
                String[] parts = userInfo.split(":", 2);
                String credential = Credentials.basic(parts[0], parts[1]);
                Authenticator authenticator = (route, response) -> {
                    if (response.request().header("Proxy-Authorization") != null) {
                        return null;
                    }
                    return response.request().newBuilder()
                            .header("Proxy-Authorization", credential)
                            .build();
                };
                builder.proxyAuthenticator(authenticator);
            }
        }
        log.info("创建代理客户端: {}://{}:{}", scheme, uri.getHost(), port);
        return builder.build();
    }
}
