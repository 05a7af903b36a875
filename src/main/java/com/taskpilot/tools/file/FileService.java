package com.taskpilot.tools.file;

import com.taskpilot.config.AgentProperties;
import com.taskpilot.tools.ToolExecutionException;
import org.springframework.stereotype.Service;
import org.springframework.util.FileSystemUtils;
import org.springframework.util.StringUtils;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

/**
 * File access confined to the configured workspace root. Every path is resolved against
 * the root and rejected if it would escape it.
 */
@Service
public class FileService {

    private final Path workspaceRoot;

    public FileService(AgentProperties properties) {
        String configuredRoot = properties.getWorkspaceRoot();
        String rootValue = StringUtils.hasText(configuredRoot)
                ? configuredRoot
                : System.getProperty("user.dir");
        this.workspaceRoot = Paths.get(rootValue).toAbsolutePath().normalize();
    }

    public Path workspaceRoot() {
        return workspaceRoot;
    }

    public FileListing list(String path) {
        Path directory = resolvePath(path, true);
        if (!Files.exists(directory)) {
            throw new ToolExecutionException("Directory not found: " + displayPath(path));
        }
        if (!Files.isDirectory(directory)) {
            throw new ToolExecutionException("Path is not a directory: " + displayPath(path));
        }
        try (Stream<Path> stream = Files.list(directory)) {
            List<FileEntry> entries = stream
                    .filter(p -> !isInternal(p))
                    .sorted(Comparator.comparing((Path p) -> !Files.isDirectory(p))
                            .thenComparing(p -> p.getFileName().toString().toLowerCase()))
                    .map(this::toEntry)
                    .toList();
            return new FileListing(toRelative(directory), entries);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to list directory: " + displayPath(path), ex);
        }
    }

    public FileContent read(String path) {
        Path file = resolvePath(path, false);
        if (!Files.exists(file)) {
            throw new ToolExecutionException("File not found: " + path);
        }
        if (!Files.isRegularFile(file)) {
            throw new ToolExecutionException("Path is not a file: " + path);
        }
        try {
            String content = Files.readString(file);
            return new FileContent(toRelative(file), content);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to read file: " + path, ex);
        }
    }

    public FileContent write(String path, String content) {
        Path file = resolvePath(path, false);
        if (Files.exists(file) && !Files.isRegularFile(file)) {
            throw new ToolExecutionException("Path is not a file: " + path);
        }
        String safeContent = content == null ? "" : content;
        try {
            createParents(file);
            Files.writeString(file, safeContent);
            return new FileContent(toRelative(file), safeContent);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to write file: " + path, ex);
        }
    }

    public FileContent append(String path, String content) {
        FileContent existing = read(path);
        return write(path, existing.content() + "\n" + (content == null ? "" : content));
    }

    public String createFile(String path) {
        Path file = resolvePath(path, false);
        try {
            createParents(file);
            Files.createFile(file);
            return toRelative(file);
        } catch (FileAlreadyExistsException ex) {
            throw new ToolExecutionException("File already exists: " + path);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to create file: " + path, ex);
        }
    }

    public String createDirectory(String path) {
        Path directory = resolvePath(path, false);
        if (Files.exists(directory) && !Files.isDirectory(directory)) {
            throw new ToolExecutionException("Path exists and is not a directory: " + path);
        }
        try {
            Files.createDirectories(directory);
            return toRelative(directory);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to create directory: " + path, ex);
        }
    }

    public String delete(String path) {
        Path target = resolvePath(path, false);
        if (target.equals(workspaceRoot)) {
            throw new ToolExecutionException("Refusing to delete the workspace root.");
        }
        if (!Files.exists(target)) {
            throw new ToolExecutionException("File not found: " + path);
        }
        try {
            FileSystemUtils.deleteRecursively(target);
            return toRelative(target);
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to delete: " + path, ex);
        }
    }

    public boolean exists(String path) {
        return Files.exists(resolvePath(path, true));
    }

    /**
     * Every regular file under the workspace, relative paths, in a stable order.
     */
    public List<String> listAllFiles() {
        try (Stream<Path> stream = Files.walk(workspaceRoot)) {
            return stream
                    .filter(Files::isRegularFile)
                    .filter(p -> !isInternal(p))
                    .map(this::toRelative)
                    .sorted()
                    .toList();
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to scan workspace.", ex);
        }
    }

    /**
     * Resolves a workspace path for callers outside this package, rejecting paths that escape the root.
     */
    public Path resolve(String path) {
        return resolvePath(path, true);
    }

    public String toRelative(Path path) {
        Path normalized = path.toAbsolutePath().normalize();
        if (normalized.equals(workspaceRoot)) {
            return "";
        }
        return workspaceRoot.relativize(normalized).toString().replace("\\", "/");
    }

    Path resolvePath(String path, boolean allowDirectoryRoot) {
        if (!StringUtils.hasText(path) || ".".equals(path.trim())) {
            if (!allowDirectoryRoot) {
                throw new ToolExecutionException("Path is required.");
            }
            return workspaceRoot;
        }
        String trimmed = path.trim();
        Path candidate = Paths.get(trimmed);
        Path target = candidate.isAbsolute()
                ? candidate.normalize()
                : workspaceRoot.resolve(trimmed).normalize();
        if (!target.startsWith(workspaceRoot)) {
            throw new ToolExecutionException("Invalid path outside the workspace: " + path);
        }
        if (!allowDirectoryRoot && target.equals(workspaceRoot)) {
            throw new ToolExecutionException("Path must name a file inside the workspace.");
        }
        ensureNoLinkEscape(target, path);
        return target;
    }

    /**
     * Follows symbolic links on the deepest existing part of the path; the real location must
     * still lie under the real workspace root.
     */
    private void ensureNoLinkEscape(Path target, String path) {
        if (!Files.exists(workspaceRoot)) {
            return;
        }
        Path existing = target;
        while (!existing.equals(workspaceRoot) && !Files.exists(existing, LinkOption.NOFOLLOW_LINKS)) {
            existing = existing.getParent();
        }
        Path realTarget;
        Path realRoot;
        try {
            realRoot = workspaceRoot.toRealPath();
            realTarget = existing.toRealPath();
        } catch (IOException ex) {
            throw new ToolExecutionException("Invalid path outside the workspace: " + path, ex);
        }
        if (!realTarget.startsWith(realRoot)) {
            throw new ToolExecutionException("Invalid path outside the workspace: " + path);
        }
    }

    private void createParents(Path file) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    private boolean isInternal(Path path) {
        Path relative = workspaceRoot.relativize(path.toAbsolutePath().normalize());
        return relative.getNameCount() > 0 && ".git".equals(relative.getName(0).toString());
    }

    private String displayPath(String path) {
        return StringUtils.hasText(path) ? path : ".";
    }

    private FileEntry toEntry(Path path) {
        try {
            return new FileEntry(
                    path.getFileName().toString(),
                    toRelative(path),
                    Files.isDirectory(path),
                    Files.isDirectory(path) ? 0L : Files.size(path),
                    Instant.ofEpochMilli(Files.getLastModifiedTime(path).toMillis())
            );
        } catch (IOException ex) {
            return new FileEntry(
                    path.getFileName().toString(),
                    toRelative(path),
                    Files.isDirectory(path),
                    0L,
                    Instant.EPOCH
            );
        }
    }
}
