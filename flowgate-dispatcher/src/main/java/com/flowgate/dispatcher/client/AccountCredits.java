package com.flowgate.dispatcher.client;

import lombok.Value;

/**
 * 账号余额与等级。
 */
@Value
public class AccountCredits {

    int credits;

    String paygateTier;
}
