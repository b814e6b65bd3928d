package com.flowgate.ai.captcha;

import java.util.Optional;

/**
 * reCAPTCHA 令牌获取。尽力而为：失败返回 empty，提交时使用空令牌。
 */
public interface ProofTokenProvider {

    Optional<String> getProofToken(String projectId);
}
