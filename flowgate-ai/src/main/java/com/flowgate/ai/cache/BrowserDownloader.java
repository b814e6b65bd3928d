package com.flowgate.ai.cache;

import com.flowgate.common.exception.CacheDownloadException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;

/**
 * 模拟浏览器请求头直接下载，不经过代理。
 */
@Slf4j
@RequiredArgsConstructor
public class BrowserDownloader implements Downloader {

    static final String BROWSER_USER_AGENT = "Mozilla/5.0 (Windows NT 10.0; Win64; x64) "
            + "AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36";

    private final OkHttpClient httpClient;

    @Override
    public String name() {
        return "http";
    }

    @Override
    public void download(String url, Path target) {
        Request request = new Request.Builder()
                .url(url)
                .header("Accept", "*/*")
                .header("Accept-Language", "zh-CN,zh;q=0.9,en;q=0.8")
                .header("Connection", "keep-alive")
                .header("Sec-Fetch-Dest", "document")
                .header("Sec-Fetch-Mode", "navigate")
                .header("Sec-Fetch-Site", "none")
                .header("User-Agent", BROWSER_USER_AGENT)
                .get()
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            if (response.code() == 403) {
                throw new ForbiddenDownloadException("HTTP 403");
            }
            ResponseBody body = response.body();
            if (!response.isSuccessful() || body == null) {
                throw new CacheDownloadException("HTTP " + response.code());
            }
            try (InputStream in = body.byteStream()) {
                Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
            }
        } catch (IOException e) {
            throw new CacheDownloadException("下载失败: " + e.getMessage(), e);
        }
    }
}
