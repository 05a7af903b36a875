package com.taskpilot.tools.git;

import java.util.List;

public record GitStatusSummary(
        String branch,
        List<String> staged,
        List<String> unstaged,
        List<String> untracked,
        List<String> files
) {
}
