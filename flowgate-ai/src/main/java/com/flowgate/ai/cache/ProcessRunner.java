package com.flowgate.ai.cache;

import lombok.Value;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.FutureTask;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * 外部命令执行，合并 stdout/stderr 并限制输出行数。
 * <p>
 * 输出在独立线程中读取，调用线程只负责计时；超时后强制结束子进程。
 */
@Slf4j
public class ProcessRunner {

    private static final int MAX_OUTPUT_LINES = 200;

    /** 进程退出后等待输出读完的时间 */
    private static final long OUTPUT_GRACE_SECONDS = 5;

    @Value
    public static class Result {
        int exitCode;
        String output;

        public boolean isSuccess() {
            return exitCode == 0;
        }
    }

    public Result run(List<String> command, String taskName, long timeoutSeconds)
            throws IOException, InterruptedException, TimeoutException {
        log.debug("执行 {}: {}", taskName, command.get(0));

        ProcessBuilder pb = new ProcessBuilder(command);
        pb.redirectErrorStream(true);
        Process process = pb.start();

        FutureTask<String> output = new FutureTask<>(() -> readOutput(process));
        Thread reader = new Thread(output, "process-output-" + taskName);
        reader.setDaemon(true);
        reader.start();

        if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
            process.destroyForcibly();
            output.cancel(true);
            log.warn("{} 超时 ({}s)，已结束进程", taskName, timeoutSeconds);
            throw new TimeoutException(taskName + " 超时 (" + timeoutSeconds + "s)");
        }

        String text;
        try {
            text = output.get(OUTPUT_GRACE_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException(taskName + " 读取输出失败", e.getCause());
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            log.debug("{} 退出码 {}", taskName, exitCode);
        }
        return new Result(exitCode, text);
    }

    private static String readOutput(Process process) throws IOException {
        StringBuilder output = new StringBuilder();
        try (BufferedReader reader = new BufferedReader(
                new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
            String line;
            int lineCount = 0;
            while ((line = reader.readLine()) != null) {
                if (lineCount++ < MAX_OUTPUT_LINES) {
                    output.append(line).append('\n');
                }
            }
        }
        return output.toString();
    }
}
