package com.flowgate.dispatcher.client;

/**
 * 账号维度的上游接口（认证、项目、余额）。
 * <p>
 * 由 AI 模块的上游客户端实现；调度模块只依赖此接口。
 * 实现在失败时抛出 {@link com.flowgate.common.exception.UpstreamException} 及其子类。
 */
public interface AccountClient {

    /**
     * 用 Session Token 换取 Access Token 及账号信息。
     */
    AccessGrant exchangeSession(String sessionToken);

    /**
     * 创建上游项目。
     *
     * @return 项目 ID
     */
    String createProject(String sessionToken, String title);

    void deleteProject(String sessionToken, String projectId);

    AccountCredits getCredits(String accessToken);
}
