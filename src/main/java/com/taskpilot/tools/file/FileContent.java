package com.taskpilot.tools.file;

public record FileContent(
        String path,
        String content
) {
}
