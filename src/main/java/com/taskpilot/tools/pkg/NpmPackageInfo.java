package com.taskpilot.tools.pkg;

public record NpmPackageInfo(
        String name,
        String version,
        String description,
        String license,
        String homepage
) {
}
