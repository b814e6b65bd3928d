package com.flowgate.ai.cache;

import java.nio.file.Path;
import java.util.List;

public class WgetDownloader extends ExternalDownloader {

    public WgetDownloader(ProcessRunner processRunner, int timeoutSeconds) {
        super(processRunner, timeoutSeconds);
    }

    @Override
    public String name() {
        return "wget";
    }

    @Override
    protected List<String> command(String url, Path target, int timeoutSeconds) {
        // -nv 只输出一行结果，HTTP 错误形如 "ERROR 403: Forbidden."
        return List.of("wget", "-nv",
                "-O", target.toString(),
                "--timeout=" + timeoutSeconds,
                "--tries=3",
                "--user-agent=" + BrowserDownloader.BROWSER_USER_AGENT,
                "--header=Accept: */*",
                "--header=Accept-Language: zh-CN,zh;q=0.9,en;q=0.8",
                "--header=Connection: keep-alive",
                url);
    }

    @Override
    protected boolean forbidden(ProcessRunner.Result result) {
        return result.getOutput().contains("ERROR 403");
    }
}
