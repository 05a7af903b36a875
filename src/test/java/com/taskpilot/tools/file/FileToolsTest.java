package com.taskpilot.tools.file;

import com.taskpilot.config.AgentProperties;
import com.taskpilot.tools.ToolRegistry;
import com.taskpilot.tools.ToolResult;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FileToolsTest {

    private ToolRegistry registry;

    @TempDir
    Path tempDir;

    @BeforeEach
    void setUp() {
        AgentProperties properties = new AgentProperties();
        properties.setWorkspaceRoot(tempDir.toString());
        registry = new ToolRegistry(List.of(new FileTools(new FileService(properties), properties)));
    }

    @Test
    void testListDirectoryFormatsEntries() throws IOException {
        Files.createDirectory(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("index.js"), "");

        ToolResult result = registry.execute("list_directory", Map.of("path", "."));

        assertTrue(result.success());
        assertEquals("[DIR] src\n[FILE] index.js", result.output());
        assertInstanceOf(List.class, result.data());
    }

    @Test
    void testListDirectoryReportsEmptyDirectory() {
        ToolResult result = registry.execute("list_directory", Map.of());

        assertEquals("Empty directory", result.output());
    }

    @Test
    void testWriteThenRead() {
        ToolResult write = registry.execute("write_file", Map.of("path", "notes/a.txt", "content", "hello"));
        ToolResult read = registry.execute("read_file", Map.of("path", "notes/a.txt"));

        assertEquals("File written: notes/a.txt", write.output());
        assertEquals("hello", read.output());
    }

    @Test
    void testReadMissingFileFails() {
        ToolResult result = registry.execute("read_file", Map.of("path", "nope.txt"));

        assertFalse(result.success());
        assertFalse(result.rejected());
        assertEquals("File not found: nope.txt", result.error());
    }

    @Test
    void testSearchFilesIsCaseInsensitive() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "first line\nHello World\n");
        Files.writeString(tempDir.resolve("b.txt"), "nothing here");

        ToolResult result = registry.execute("search_files", Map.of("query", "hello"));

        assertEquals("a.txt:2: Hello World", result.output());
        assertEquals(1, ((Map<?, ?>) result.data()).get("matchCount"));
    }

    @Test
    void testSearchFilesWithoutMatches() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "abc");

        ToolResult result = registry.execute("search_files", Map.of("query", "xyz"));

        assertEquals("No matches found", result.output());
    }

    @Test
    void testFindFilesByGlob() throws IOException {
        Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(tempDir.resolve("src/App.tsx"), "");
        Files.writeString(tempDir.resolve("src/util.ts"), "");

        ToolResult result = registry.execute("find_files", Map.of("pattern", "*.tsx"));

        assertEquals("src/App.tsx", result.output());
        assertEquals(1, ((Map<?, ?>) result.data()).get("count"));
    }

    @Test
    void testFileInfo() throws IOException {
        Files.writeString(tempDir.resolve("doc.md"), "one two\nthree");

        ToolResult result = registry.execute("file_info", Map.of("path", "doc.md"));

        Map<?, ?> data = (Map<?, ?>) result.data();
        assertEquals("md", data.get("type"));
        assertEquals(2, data.get("lines"));
        assertEquals(3, data.get("words"));
        assertEquals(13, data.get("chars"));
    }

    @Test
    void testCountLinesForWholeProject() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "1\n2\n3");
        Files.writeString(tempDir.resolve("b.txt"), "1");

        ToolResult result = registry.execute("count_lines", Map.of());

        assertEquals("Project: 2 files, 4 total lines", result.output());
    }

    @Test
    void testListImports() throws IOException {
        Files.writeString(tempDir.resolve("App.js"), "import React from 'react';\nconst x = 1;\nimport './app.css';\n");

        ToolResult result = registry.execute("list_imports", Map.of("path", "App.js"));

        assertEquals("import React from 'react';\nimport './app.css';", result.output());
    }

    @Test
    void testAppendAndDelete() throws IOException {
        Files.writeString(tempDir.resolve("a.txt"), "x");

        assertTrue(registry.execute("append_file", Map.of("path", "a.txt", "content", "y")).success());
        assertEquals("x\ny", Files.readString(tempDir.resolve("a.txt")));
        assertEquals("Deleted: a.txt", registry.execute("delete_file", Map.of("path", "a.txt")).output());
        assertFalse(Files.exists(tempDir.resolve("a.txt")));
    }

    @Test
    void testGlobToPattern() {
        assertTrue(FileTools.toNamePattern("test.*").matcher("test.java").find());
        assertFalse(FileTools.toNamePattern("test.*").matcher("mytest.java").find());
        assertTrue(FileTools.toNamePattern("Service").matcher("FileService.java").find());
    }

    @Test
    void testCreateComponentDefaultsToReactNative() throws IOException {
        ToolResult result = registry.execute("create_component", Map.of("name", "ProfileCard"));

        assertTrue(result.success(), result.error());
        assertEquals("Created react-native component: components/ProfileCard.tsx", result.output());
        String source = Files.readString(tempDir.resolve("components/ProfileCard.tsx"));
        assertTrue(source.contains("import { View, Text, StyleSheet } from 'react-native';"));
        assertTrue(source.contains("export function ProfileCard() {"));
        assertTrue(source.contains("      <Text>ProfileCard</Text>"));
        Map<?, ?> data = assertInstanceOf(Map.class, result.data());
        assertEquals("components/ProfileCard.tsx", data.get("path"));
        assertEquals(source, data.get("template"));
    }

    @Test
    void testCreateReactComponentAtCustomPath() throws IOException {
        ToolResult result = registry.execute("create_component",
                Map.of("name", "NavBar", "type", "react", "path", "src/ui/NavBar.tsx"));

        assertTrue(result.success(), result.error());
        String source = Files.readString(tempDir.resolve("src/ui/NavBar.tsx"));
        assertTrue(source.startsWith("import React from 'react';\n\nexport function NavBar() {"));
        assertTrue(source.contains("<div className=\"navbar\">"));
        assertTrue(source.contains("<h1>NavBar</h1>"));
        assertFalse(source.contains("react-native"));
    }

    @Test
    void testCreateComponentRejectsUnknownTypeAndBadName() {
        ToolResult unknownType = registry.execute("create_component", Map.of("name", "Card", "type", "vue"));
        ToolResult badName = registry.execute("create_component", Map.of("name", "../Card"));

        assertFalse(unknownType.success());
        assertTrue(unknownType.error().startsWith("Unknown component type \"vue\""));
        assertFalse(badName.success());
        assertEquals("Invalid component name: ../Card", badName.error());
        assertFalse(Files.exists(tempDir.resolve("components")));
    }
}
