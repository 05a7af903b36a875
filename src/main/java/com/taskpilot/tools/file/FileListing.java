package com.taskpilot.tools.file;

import java.util.List;

public record FileListing(
        String path,
        List<FileEntry> entries
) {
}
