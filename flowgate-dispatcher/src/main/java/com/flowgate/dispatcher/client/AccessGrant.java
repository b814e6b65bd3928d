package com.flowgate.dispatcher.client;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * ST 换取 AT 的结果。
 */
@Value
@Builder
public class AccessGrant {

    String accessToken;

    /** AT 过期时间，上游未返回时为 null */
    Instant expires;

    String email;

    String name;
}
