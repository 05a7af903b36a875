package com.taskpilot.tools;

import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.Nullable;
import org.springframework.util.StringUtils;

import java.util.concurrent.atomic.AtomicLong;

@Slf4j
final class ToolCallAudit {

    private static final int MAX_SNIPPET = 400;

    private final AtomicLong count = new AtomicLong();
    private final AtomicLong failures = new AtomicLong();

    void recordCall(String name, @Nullable Object input, ToolResult result) {
        long total = count.incrementAndGet();
        if (result.success()) {
            log.info("Tool call #{}: name={}, input={}, output={}", total, name,
                    truncate(String.valueOf(input)), truncate(result.output()));
            return;
        }
        long failed = failures.incrementAndGet();
        log.warn("Tool call #{} failed: name={}, input={}, error={}. Total failures={}.", total, name,
                truncate(String.valueOf(input)), result.error(), failed);
    }

    static String truncate(@Nullable String value) {
        if (!StringUtils.hasText(value)) {
            return "";
        }
        String normalized = value.replace("\r", " ").replace("\n", " ").trim();
        if (normalized.length() <= MAX_SNIPPET) {
            return normalized;
        }
        return normalized.substring(0, MAX_SNIPPET) + "...";
    }
}
