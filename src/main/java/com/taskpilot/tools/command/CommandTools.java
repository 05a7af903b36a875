package com.taskpilot.tools.command;

import com.taskpilot.tools.ToolDescriptor;
import com.taskpilot.tools.ToolProvider;
import com.taskpilot.tools.ToolResult;
import com.taskpilot.tools.file.FileEntry;
import com.taskpilot.tools.file.FileService;
import org.springframework.stereotype.Component;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static com.taskpilot.tools.ParameterType.ARRAY;
import static com.taskpilot.tools.ParameterType.STRING;
import static com.taskpilot.tools.ToolArguments.string;
import static com.taskpilot.tools.ToolArguments.strings;
import static com.taskpilot.tools.ToolParameter.optional;
import static com.taskpilot.tools.ToolParameter.required;

/**
 * Emulated terminal. Commands are interpreted against the workspace through
 * {@link FileService}; no operating-system process is ever started.
 */
@Component
public class CommandTools implements ToolProvider {

    static final List<String> SUPPORTED = List.of(
            "ls", "dir", "pwd", "mkdir", "touch", "cat", "rm", "grep", "head", "tail", "wc", "cp", "mv");
    private static final int DEFAULT_LINES = 10;
    private static final BigInteger MAX_LINES = BigInteger.valueOf(Integer.MAX_VALUE);

    private final FileService fileService;

    public CommandTools(FileService fileService) {
        this.fileService = fileService;
    }

    @Override
    public List<ToolDescriptor> tools() {
        return List.of(ToolDescriptor.of("run_command",
                "Execute a terminal command (emulated for common commands: " + String.join(", ", SUPPORTED) + ")",
                List.of(required("command", STRING, "Command to execute (e.g., ls, pwd, mkdir)"),
                        optional("args", ARRAY, "Command arguments", List.of())),
                this::run));
    }

    ToolResult run(Map<String, Object> params) {
        List<String> tokens = new ArrayList<>(Arrays.asList(string(params, "command").trim().split("\\s+")));
        tokens.addAll(strings(params, "args"));
        tokens.removeIf(String::isBlank);
        if (tokens.isEmpty()) {
            return ToolResult.failure("No command given");
        }
        String command = tokens.get(0).toLowerCase(Locale.ROOT);
        // flags such as "-la" are accepted and ignored
        List<String> args = tokens.subList(1, tokens.size()).stream()
                .filter(arg -> !arg.startsWith("-") || isNumber(arg))
                .toList();

        return switch (command) {
            case "ls", "dir" -> list(args);
            case "pwd" -> ToolResult.success(fileService.workspaceRoot().toString());
            case "mkdir" -> hasArgs(args, 1)
                    ? ToolResult.success("Directory created: " + fileService.createDirectory(args.get(0)))
                    : missing(command, "a directory name");
            case "touch" -> hasArgs(args, 1) ? touch(args.get(0)) : missing(command, "a filename");
            case "cat" -> hasArgs(args, 1)
                    ? ToolResult.success(fileService.read(args.get(0)).content())
                    : missing(command, "a filename");
            case "rm" -> hasArgs(args, 1)
                    ? ToolResult.success("Deleted: " + fileService.delete(args.get(0)))
                    : missing(command, "a filename");
            case "grep" -> hasArgs(args, 2) ? grep(args.get(0), args.get(1)) : missing(command, "pattern and filename");
            case "head" -> hasArgs(args, 1) ? head(args, true) : missing(command, "a filename");
            case "tail" -> hasArgs(args, 1) ? head(args, false) : missing(command, "a filename");
            case "wc" -> hasArgs(args, 1) ? wc(args.get(0)) : missing(command, "a filename");
            case "cp" -> hasArgs(args, 2) ? copy(args.get(0), args.get(1), false) : missing(command, "source and destination");
            case "mv" -> hasArgs(args, 2) ? copy(args.get(0), args.get(1), true) : missing(command, "source and destination");
            default -> ToolResult.failure("Command \"" + command + "\" not supported. Supported: " + String.join(", ", SUPPORTED));
        };
    }

    private ToolResult list(List<String> args) {
        List<FileEntry> entries = fileService.list(args.isEmpty() ? "" : args.get(0)).entries();
        String output = entries.stream()
                .map(entry -> entry.directory() ? entry.name() + "/" : entry.name())
                .collect(Collectors.joining("\n"));
        return ToolResult.success(output, entries);
    }

    private ToolResult touch(String path) {
        if (fileService.exists(path)) {
            return ToolResult.success("File exists: " + path);
        }
        return ToolResult.success("File created: " + fileService.createFile(path));
    }

    private ToolResult grep(String pattern, String path) {
        String needle = pattern.toLowerCase(Locale.ROOT);
        String[] lines = fileService.read(path).content().split("\n", -1);
        String matches = IntStream.range(0, lines.length)
                .filter(i -> lines[i].toLowerCase(Locale.ROOT).contains(needle))
                .mapToObj(i -> (i + 1) + ": " + lines[i])
                .collect(Collectors.joining("\n"));
        return ToolResult.success(matches.isEmpty() ? "No matches" : matches);
    }

    private ToolResult head(List<String> args, boolean fromStart) {
        String file = args.stream().filter(arg -> !isNumber(arg)).findFirst().orElse(args.get(0));
        int count = args.stream().filter(CommandTools::isNumber).findFirst()
                .map(CommandTools::lineCount)
                .orElse(DEFAULT_LINES);
        List<String> lines = Arrays.asList(fileService.read(file).content().split("\n", -1));
        List<String> selected = fromStart
                ? lines.subList(0, Math.min(count, lines.size()))
                : lines.subList(Math.max(0, lines.size() - count), lines.size());
        return ToolResult.success(String.join("\n", selected));
    }

    private ToolResult wc(String path) {
        String content = fileService.read(path).content();
        int lines = content.split("\n", -1).length;
        String trimmed = content.trim();
        int words = trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
        return ToolResult.success(lines + " lines, " + words + " words, " + content.length() + " characters");
    }

    private ToolResult copy(String source, String destination, boolean move) {
        String content = fileService.read(source).content();
        fileService.write(destination, content);
        if (move) {
            fileService.delete(source);
            return ToolResult.success("Moved " + source + " to " + destination);
        }
        return ToolResult.success("Copied " + source + " to " + destination);
    }

    private static boolean hasArgs(List<String> args, int count) {
        return args.size() >= count;
    }

    private ToolResult missing(String command, String what) {
        return ToolResult.failure(command + " requires " + what);
    }

    /**
     * Reads "20" and "-20" alike; counts beyond int range are clamped.
     */
    private static int lineCount(String value) {
        String digits = value.startsWith("-") ? value.substring(1) : value;
        return new BigInteger(digits).min(MAX_LINES).intValueExact();
    }

    private static boolean isNumber(String value) {
        return value.matches("-?\\d+");
    }
}
