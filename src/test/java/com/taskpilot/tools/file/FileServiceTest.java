package com.taskpilot.tools.file;

import com.taskpilot.config.AgentProperties;
import com.taskpilot.tools.ToolExecutionException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FileServiceTest {

    private FileService fileService;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.setWorkspaceRoot(tempDir.toString());
        fileService = new FileService(properties);
    }

    @Test
    void testListPutsDirectoriesFirst() throws IOException {
        Files.createFile(tempDir.resolve("b.txt"));
        Files.createDirectory(tempDir.resolve("src"));

        FileListing listing = fileService.list("");

        assertEquals(2, listing.entries().size());
        assertEquals("src", listing.entries().get(0).name());
        assertTrue(listing.entries().get(0).directory());
        assertEquals("b.txt", listing.entries().get(1).name());
    }

    @Test
    void testListHidesGitDirectory() throws IOException {
        Files.createDirectory(tempDir.resolve(".git"));
        Files.createFile(tempDir.resolve("a.txt"));

        FileListing listing = fileService.list(".");

        assertEquals(1, listing.entries().size());
    }

    @Test
    void testRead() throws IOException {
        Files.writeString(tempDir.resolve("test.txt"), "Hello World");

        FileContent content = fileService.read("test.txt");

        assertEquals("Hello World", content.content());
        assertEquals("test.txt", content.path());
    }

    @Test
    void testReadNotFound() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class, () -> fileService.read("missing.txt"));
        assertEquals("File not found: missing.txt", ex.getMessage());
    }

    @Test
    void testWriteCreatesParentDirectories() throws IOException {
        FileContent content = fileService.write("subdir/file.txt", "Sub Content");

        assertEquals("subdir/file.txt", content.path());
        assertEquals("Sub Content", Files.readString(tempDir.resolve("subdir/file.txt")));
    }

    @Test
    void testAppendJoinsWithNewline() throws IOException {
        Files.writeString(tempDir.resolve("log.txt"), "first");

        fileService.append("log.txt", "second");

        assertEquals("first\nsecond", Files.readString(tempDir.resolve("log.txt")));
    }

    @Test
    void testCreateFileFailsWhenPresent() throws IOException {
        Files.createFile(tempDir.resolve("exists.txt"));

        assertThrows(ToolExecutionException.class, () -> fileService.createFile("exists.txt"));
    }

    @Test
    void testDeleteIsRecursive() throws IOException {
        Files.createDirectories(tempDir.resolve("dir/nested"));
        Files.writeString(tempDir.resolve("dir/nested/file.txt"), "x");

        assertEquals("dir", fileService.delete("dir"));
        assertFalse(Files.exists(tempDir.resolve("dir")));
    }

    @Test
    void testDeleteRefusesWorkspaceRoot() {
        assertThrows(ToolExecutionException.class, () -> fileService.delete("."));
        assertTrue(Files.exists(tempDir));
    }

    @Test
    void testPathsOutsideWorkspaceAreRejected() {
        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> fileService.read("../outside.txt"));
        assertTrue(ex.getMessage().startsWith("Invalid path outside the workspace"));
        assertThrows(ToolExecutionException.class, () -> fileService.write("/etc/passwd-copy", "x"));
    }

    @Test
    void testListAllFilesIsSortedAndRelative() throws IOException {
        Files.createDirectories(tempDir.resolve("src/main"));
        Files.writeString(tempDir.resolve("src/main/App.java"), "class App {}");
        Files.writeString(tempDir.resolve("README.md"), "# readme");

        List<String> files = fileService.listAllFiles();

        assertEquals(List.of("README.md", "src/main/App.java"), files);
    }

    @Test
    void testSymlinkedDirectoryCannotLeaveWorkspace() throws IOException {
        Path workspace = Files.createDirectory(tempDir.resolve("ws"));
        Path outside = Files.createDirectory(tempDir.resolve("outside"));
        Files.writeString(outside.resolve("secret.txt"), "host secret");
        Files.createSymbolicLink(workspace.resolve("link"), outside);
        FileService sandboxed = sandboxedAt(workspace);

        ToolExecutionException ex = assertThrows(ToolExecutionException.class,
                () -> sandboxed.read("link/secret.txt"));

        assertTrue(ex.getMessage().startsWith("Invalid path outside the workspace"));
        assertThrows(ToolExecutionException.class, () -> sandboxed.write("link/new.txt", "x"));
        assertFalse(Files.exists(outside.resolve("new.txt")));
    }

    @Test
    void testSymlinkedFileCannotBeOverwritten() throws IOException {
        Path workspace = Files.createDirectory(tempDir.resolve("ws"));
        Path outside = Files.createDirectory(tempDir.resolve("outside"));
        Path secret = Files.writeString(outside.resolve("secret.txt"), "host secret");
        Files.createSymbolicLink(workspace.resolve("file-link"), secret);
        FileService sandboxed = sandboxedAt(workspace);

        assertThrows(ToolExecutionException.class, () -> sandboxed.write("file-link", "overwritten"));
        assertThrows(ToolExecutionException.class, () -> sandboxed.append("file-link", "more"));

        assertEquals("host secret", Files.readString(secret));
    }

    @Test
    void testSymlinkInsideWorkspaceIsAllowed() throws IOException {
        Path workspace = Files.createDirectory(tempDir.resolve("ws"));
        Path docs = Files.createDirectory(workspace.resolve("docs"));
        Files.writeString(docs.resolve("guide.md"), "guide");
        Files.createSymbolicLink(workspace.resolve("alias"), docs);
        FileService sandboxed = sandboxedAt(workspace);

        assertEquals("guide", sandboxed.read("alias/guide.md").content());
    }

    private static FileService sandboxedAt(Path workspace) {
        AgentProperties properties = new AgentProperties();
        properties.setWorkspaceRoot(workspace.toString());
        return new FileService(properties);
    }
}
