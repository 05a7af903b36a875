package com.taskpilot.tools.git;

import com.taskpilot.tools.ToolDescriptor;
import com.taskpilot.tools.ToolParameter;
import com.taskpilot.tools.ToolProvider;
import com.taskpilot.tools.ToolResult;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static com.taskpilot.tools.ParameterType.ARRAY;
import static com.taskpilot.tools.ParameterType.NUMBER;
import static com.taskpilot.tools.ParameterType.STRING;
import static com.taskpilot.tools.ToolArguments.integer;
import static com.taskpilot.tools.ToolArguments.optionalString;
import static com.taskpilot.tools.ToolArguments.string;
import static com.taskpilot.tools.ToolArguments.strings;
import static com.taskpilot.tools.ToolParameter.optional;
import static com.taskpilot.tools.ToolParameter.required;

@Component
public class GitTools implements ToolProvider {

    private final GitService gitService;

    public GitTools(GitService gitService) {
        this.gitService = gitService;
    }

    @Override
    public List<ToolDescriptor> tools() {
        return List.of(
                ToolDescriptor.of("git_init", "Initialize a git repository in the project root", List.of(),
                        params -> ToolResult.success("Initialized git repository in " + gitService.init())),
                ToolDescriptor.of("git_status", "Show the working tree status", List.of(),
                        params -> status()),
                ToolDescriptor.of("git_add", "Stage files for commit",
                        List.of(optional("files", ARRAY, "Files to stage (default: all changes)", List.of("."))),
                        params -> ToolResult.success("Staged: " + String.join(", ", gitService.add(strings(params, "files"))))),
                ToolDescriptor.of("git_commit", "Commit staged changes",
                        List.of(required("message", STRING, "Commit message"),
                                optional("authorName", STRING, "Author name"),
                                optional("authorEmail", STRING, "Author email")),
                        this::commit),
                ToolDescriptor.of("git_log", "Show recent commits",
                        List.of(optional("limit", NUMBER, "Number of commits to show", 10)),
                        this::log),
                ToolDescriptor.of("git_set_remote", "Add or update a git remote",
                        List.of(required("name", STRING, "Remote name (e.g., origin)"),
                                required("url", STRING, "Remote URL")),
                        params -> {
                            gitService.setRemote(string(params, "name"), string(params, "url"));
                            return ToolResult.success("Remote " + string(params, "name") + " set to " + string(params, "url"));
                        }),
                ToolDescriptor.of("git_clone", "Clone a remote repository into the empty project root",
                        List.of(required("url", STRING, "Repository URL"),
                                optional("username", STRING, "Username for authentication"),
                                optional("token", STRING, "Access token or password"),
                                optional("depth", NUMBER, "Shallow clone depth (default: full history)")),
                        this::cloneRepository),
                ToolDescriptor.of("git_pull", "Fetch and merge changes from a remote",
                        remoteParameters(),
                        params -> ToolResult.success("Pulled from " + remote(params) + ": " + gitService.pull(
                                remote(params), optionalString(params, "ref"),
                                optionalString(params, "username"), optionalString(params, "token")))),
                ToolDescriptor.of("git_push", "Push commits to a remote",
                        remoteParameters(),
                        this::push)
        );
    }

    private ToolResult cloneRepository(Map<String, Object> params) {
        String url = string(params, "url");
        String branch = gitService.cloneRepository(url, optionalString(params, "username"),
                optionalString(params, "token"), integer(params, "depth", 0));
        return ToolResult.success("Cloned " + url + " (branch " + branch + ")");
    }

    private ToolResult push(Map<String, Object> params) {
        List<String> updates = gitService.push(remote(params), optionalString(params, "ref"),
                optionalString(params, "username"), optionalString(params, "token"));
        return ToolResult.success("Pushed to " + remote(params) + ": " + String.join(", ", updates), updates);
    }

    private static List<ToolParameter> remoteParameters() {
        return List.of(optional("remote", STRING, "Remote name", "origin"),
                optional("ref", STRING, "Branch to pull or push (default: current branch)"),
                optional("username", STRING, "Username for authentication"),
                optional("token", STRING, "Access token or password"));
    }

    private static String remote(Map<String, Object> params) {
        String remote = optionalString(params, "remote");
        return remote != null ? remote : "origin";
    }

    private ToolResult status() {
        GitStatusSummary summary = gitService.status();
        StringBuilder output = new StringBuilder("On branch ").append(summary.branch());
        appendSection(output, "Staged", summary.staged());
        appendSection(output, "Not staged", summary.unstaged());
        appendSection(output, "Untracked", summary.untracked());
        if (summary.files().isEmpty()) {
            output.append("\nnothing to commit, working tree clean");
        }
        return ToolResult.success(output.toString(), summary);
    }

    private ToolResult commit(Map<String, Object> params) {
        GitCommitInfo commit = gitService.commit(string(params, "message"),
                optionalString(params, "authorName"), optionalString(params, "authorEmail"));
        return ToolResult.success("Committed " + commit.oid().substring(0, 7) + ": " + commit.message(), commit);
    }

    private ToolResult log(Map<String, Object> params) {
        List<GitCommitInfo> commits = gitService.log(integer(params, "limit", 10));
        if (commits.isEmpty()) {
            return ToolResult.success("No commits yet", commits);
        }
        String output = commits.stream()
                .map(commit -> commit.oid().substring(0, 7) + " " + commit.message() + " (" + commit.author() + ")")
                .collect(Collectors.joining("\n"));
        return ToolResult.success(output, commits);
    }

    private static void appendSection(StringBuilder output, String title, List<String> entries) {
        if (entries.isEmpty()) {
            return;
        }
        output.append("\n").append(title).append(":");
        entries.forEach(entry -> output.append("\n  ").append(entry));
    }
}
