package com.flowgate.web.dto;

import lombok.Data;

@Data
public class ProxyRequest {

    /** http(s)://user:pass@host:port 或 socks5://host:port */
    private String proxyUrl;
    private String name;
}
