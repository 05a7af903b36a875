package com.taskpilot.tools.file;

import com.taskpilot.config.AgentProperties;
import com.taskpilot.tools.ToolDescriptor;
import com.taskpilot.tools.ToolExecutionException;
import com.taskpilot.tools.ToolProvider;
import com.taskpilot.tools.ToolResult;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.MatchResult;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import java.util.stream.Collectors;

import static com.taskpilot.tools.ParameterType.STRING;
import static com.taskpilot.tools.ToolArguments.optionalString;
import static com.taskpilot.tools.ToolArguments.string;
import static com.taskpilot.tools.ToolParameter.optional;
import static com.taskpilot.tools.ToolParameter.required;

/**
 * Workspace file tools: reading, writing, listing and searching project files.
 */
@Component
@Slf4j
public class FileTools implements ToolProvider {

    private static final Pattern COMPONENT_NAME = Pattern.compile("[A-Za-z_$][A-Za-z0-9_$]*");
    private static final Pattern IMPORT_LINE = Pattern.compile("^import .*$", Pattern.MULTILINE);

    private final FileService fileService;
    private final int searchMaxResults;

    public FileTools(FileService fileService, AgentProperties properties) {
        this.fileService = fileService;
        this.searchMaxResults = properties.getSearchMaxResults();
    }

    @Override
    public List<ToolDescriptor> tools() {
        return List.of(
                ToolDescriptor.of("read_file", "Read the contents of a file",
                        List.of(required("path", STRING, "File path to read")),
                        params -> ToolResult.success(fileService.read(string(params, "path")).content())),
                ToolDescriptor.of("write_file", "Write content to a file (creates or overwrites)",
                        List.of(required("path", STRING, "File path to write"),
                                required("content", STRING, "Content to write")),
                        params -> {
                            FileContent written = fileService.write(string(params, "path"), string(params, "content"));
                            return ToolResult.success("File written: " + written.path());
                        }),
                ToolDescriptor.of("create_file", "Create a new empty file",
                        List.of(required("path", STRING, "File path to create")),
                        params -> ToolResult.success("File created: " + fileService.createFile(string(params, "path")))),
                ToolDescriptor.of("delete_file", "Delete a file or folder",
                        List.of(required("path", STRING, "File/folder path to delete")),
                        params -> ToolResult.success("Deleted: " + fileService.delete(string(params, "path")))),
                ToolDescriptor.of("append_file", "Append content to a file",
                        List.of(required("path", STRING, "File path"),
                                required("content", STRING, "Content to append")),
                        params -> {
                            FileContent appended = fileService.append(string(params, "path"), string(params, "content"));
                            return ToolResult.success("Appended to: " + appended.path());
                        }),
                ToolDescriptor.of("list_directory", "List files and folders in a directory",
                        List.of(optional("path", STRING, "Directory path (default: project root)")),
                        this::listDirectory),
                ToolDescriptor.of("search_files", "Search for text across all files",
                        List.of(required("query", STRING, "Text to search for")),
                        this::searchFiles),
                ToolDescriptor.of("find_files", "Find files by name pattern",
                        List.of(required("pattern", STRING, "File name pattern (e.g., \"*.tsx\", \"test.*\")")),
                        this::findFiles),
                ToolDescriptor.of("file_info", "Get file information (size, line count, type)",
                        List.of(required("path", STRING, "File path")),
                        this::fileInfo),
                ToolDescriptor.of("count_lines", "Count total lines in a file or project",
                        List.of(optional("path", STRING, "File path or \"all\" for entire project", "all")),
                        this::countLines),
                ToolDescriptor.of("list_imports", "Extract import statements from a file",
                        List.of(required("path", STRING, "File path")),
                        this::listImports),
                ToolDescriptor.of("create_component", "Create a React/React Native component template",
                        List.of(required("name", STRING, "Component name (PascalCase)"),
                                optional("type", STRING, "Component type: \"react\" or \"react-native\"",
                                        ComponentTemplates.REACT_NATIVE),
                                optional("path", STRING, "File path (default: components/Name.tsx)")),
                        this::createComponent)
        );
    }

    private ToolResult listDirectory(Map<String, Object> params) {
        FileListing listing = fileService.list(string(params, "path"));
        String output = listing.entries().stream()
                .map(entry -> (entry.directory() ? "[DIR] " : "[FILE] ") + entry.name())
                .collect(Collectors.joining("\n"));
        return ToolResult.success(output.isEmpty() ? "Empty directory" : output, listing.entries());
    }

    private ToolResult searchFiles(Map<String, Object> params) {
        String query = string(params, "query").toLowerCase(Locale.ROOT);
        List<String> results = new ArrayList<>();
        for (String path : fileService.listAllFiles()) {
            if (results.size() >= searchMaxResults) {
                break;
            }
            String content;
            try {
                content = fileService.read(path).content();
            } catch (RuntimeException ex) {
                // binary or unreadable files are skipped
                log.debug("Skipping {} during search: {}", path, ex.getMessage());
                continue;
            }
            String[] lines = content.split("\n", -1);
            for (int i = 0; i < lines.length && results.size() < searchMaxResults; i++) {
                if (lines[i].toLowerCase(Locale.ROOT).contains(query)) {
                    results.add(path + ":" + (i + 1) + ": " + lines[i].trim());
                }
            }
        }
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("matchCount", results.size());
        data.put("results", results);
        return ToolResult.success(results.isEmpty() ? "No matches found" : String.join("\n", results), data);
    }

    private ToolResult findFiles(Map<String, Object> params) {
        Pattern pattern = toNamePattern(string(params, "pattern"));
        List<String> matches = fileService.listAllFiles().stream()
                .filter(path -> pattern.matcher(fileName(path)).find())
                .toList();
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("count", matches.size());
        data.put("files", matches);
        return ToolResult.success(matches.isEmpty() ? "No matches found" : String.join("\n", matches), data);
    }

    private ToolResult fileInfo(Map<String, Object> params) {
        String path = string(params, "path");
        String content = fileService.read(path).content();
        int lines = content.split("\n", -1).length;
        int words = countWords(content);
        int chars = content.length();
        int dot = path.lastIndexOf('.');
        String ext = dot >= 0 && dot < path.length() - 1 ? path.substring(dot + 1).toLowerCase(Locale.ROOT) : "unknown";
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("path", path);
        data.put("type", ext);
        data.put("lines", lines);
        data.put("words", words);
        data.put("chars", chars);
        String output = "File: " + path + "\nType: " + ext + "\nLines: " + lines + "\nWords: " + words
                + "\nCharacters: " + chars + "\nSize: " + chars + " bytes";
        return ToolResult.success(output, data);
    }

    private ToolResult countLines(Map<String, Object> params) {
        String path = string(params, "path");
        if (!"all".equals(path)) {
            int lines = fileService.read(path).content().split("\n", -1).length;
            return ToolResult.success("File: " + path + "\nLines: " + lines, Map.of("path", path, "lines", lines));
        }
        long totalLines = 0;
        int fileCount = 0;
        for (String file : fileService.listAllFiles()) {
            try {
                totalLines += fileService.read(file).content().split("\n", -1).length;
                fileCount++;
            } catch (RuntimeException ex) {
                log.debug("Skipping {} while counting lines: {}", file, ex.getMessage());
            }
        }
        return ToolResult.success("Project: " + fileCount + " files, " + totalLines + " total lines",
                Map.of("fileCount", fileCount, "totalLines", totalLines));
    }

    private ToolResult listImports(Map<String, Object> params) {
        String content = fileService.read(string(params, "path")).content().replace("\r", "");
        List<String> imports = IMPORT_LINE.matcher(content).results()
                .map(MatchResult::group)
                .toList();
        return ToolResult.success(imports.isEmpty() ? "No imports found" : String.join("\n", imports),
                Map.of("imports", imports, "count", imports.size()));
    }

    private ToolResult createComponent(Map<String, Object> params) {
        String name = string(params, "name").trim();
        if (!COMPONENT_NAME.matcher(name).matches()) {
            throw new ToolExecutionException("Invalid component name: " + name);
        }
        String type = string(params, "type").trim();
        if (!ComponentTemplates.REACT.equals(type) && !ComponentTemplates.REACT_NATIVE.equals(type)) {
            throw new ToolExecutionException("Unknown component type \"" + type + "\". Use \"react\" or \"react-native\".");
        }
        String path = optionalString(params, "path");
        String template = ComponentTemplates.render(name, type);
        FileContent written = fileService.write(path != null ? path : "components/" + name + ".tsx", template);
        Map<String, Object> data = new LinkedHashMap<>();
        data.put("path", written.path());
        data.put("template", template);
        return ToolResult.success("Created " + type + " component: " + written.path(), data);
    }

    static Pattern toNamePattern(String pattern) {
        if (pattern.contains("*") || pattern.contains("?")) {
            StringBuilder regex = new StringBuilder("^");
            for (char c : pattern.toCharArray()) {
                switch (c) {
                    case '*' -> regex.append(".*");
                    case '?' -> regex.append('.');
                    default -> regex.append(Pattern.quote(String.valueOf(c)));
                }
            }
            return Pattern.compile(regex.append('$').toString(), Pattern.CASE_INSENSITIVE);
        }
        try {
            return Pattern.compile(pattern);
        } catch (PatternSyntaxException ex) {
            return Pattern.compile(Pattern.quote(pattern));
        }
    }

    static int countWords(String content) {
        String trimmed = content.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }

    private static String fileName(String path) {
        int slash = path.lastIndexOf('/');
        return slash >= 0 ? path.substring(slash + 1) : path;
    }
}
