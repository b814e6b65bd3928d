package com.flowgate.ai.cache;

import java.nio.file.Path;
import java.util.List;

public class CurlDownloader extends ExternalDownloader {

    public CurlDownloader(ProcessRunner processRunner, int timeoutSeconds) {
        super(processRunner, timeoutSeconds);
    }

    @Override
    public String name() {
        return "curl";
    }

    @Override
    protected List<String> command(String url, Path target, int timeoutSeconds) {
        // -w 输出状态码，便于识别 403
        return List.of("curl", "-L", "-s",
                "-o", target.toString(),
                "--max-time", String.valueOf(timeoutSeconds),
                "-w", "HTTP %{http_code}",
                "-H", "Accept: */*",
                "-H", "Accept-Language: zh-CN,zh;q=0.9,en;q=0.8",
                "-H", "Connection: keep-alive",
                "-A", BrowserDownloader.BROWSER_USER_AGENT,
                url);
    }

    @Override
    protected boolean forbidden(ProcessRunner.Result result) {
        return result.getOutput().contains("HTTP 403");
    }

    @Override
    protected boolean succeeded(ProcessRunner.Result result) {
        // curl 对 4xx/5xx 也返回 0
        return result.isSuccess() && result.getOutput().contains("HTTP 2");
    }
}
