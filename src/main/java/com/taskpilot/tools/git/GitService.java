package com.taskpilot.tools.git;

import com.taskpilot.config.AgentProperties;
import com.taskpilot.tools.ToolExecutionException;
import com.taskpilot.tools.file.FileService;
import lombok.extern.slf4j.Slf4j;
import org.eclipse.jgit.api.AddCommand;
import org.eclipse.jgit.api.CloneCommand;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.MergeResult;
import org.eclipse.jgit.api.PullCommand;
import org.eclipse.jgit.api.PullResult;
import org.eclipse.jgit.api.PushCommand;
import org.eclipse.jgit.api.RebaseResult;
import org.eclipse.jgit.api.Status;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.NoHeadException;
import org.eclipse.jgit.lib.PersonIdent;
import org.eclipse.jgit.revwalk.RevCommit;
import org.eclipse.jgit.transport.CredentialsProvider;
import org.eclipse.jgit.transport.PushResult;
import org.eclipse.jgit.transport.RemoteConfig;
import org.eclipse.jgit.transport.RemoteRefUpdate;
import org.eclipse.jgit.transport.URIish;
import org.eclipse.jgit.transport.UsernamePasswordCredentialsProvider;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.io.File;
import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Version control over the workspace root, backed by JGit.
 */
@Slf4j
@Service
public class GitService {

    private final FileService fileService;
    private final AgentProperties.GitConfig gitConfig;

    public GitService(FileService fileService, AgentProperties properties) {
        this.fileService = fileService;
        this.gitConfig = properties.getGit();
    }

    public String init() {
        File directory = workspace();
        if (isRepository()) {
            return directory.getAbsolutePath();
        }
        try (Git ignored = Git.init().setDirectory(directory).setInitialBranch("main").call()) {
            log.info("Initialized git repository in {}", directory);
            return directory.getAbsolutePath();
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git init failed: " + ex.getMessage(), ex);
        }
    }

    public GitStatusSummary status() {
        try (Git git = open()) {
            Status status = git.status().call();
            List<String> staged = new ArrayList<>();
            status.getAdded().forEach(path -> staged.add("added: " + path));
            status.getChanged().forEach(path -> staged.add("modified: " + path));
            status.getRemoved().forEach(path -> staged.add("deleted: " + path));
            List<String> unstaged = new ArrayList<>();
            status.getModified().forEach(path -> unstaged.add("modified: " + path));
            status.getMissing().forEach(path -> unstaged.add("deleted: " + path));
            TreeSet<String> files = new TreeSet<>(status.getUncommittedChanges());
            files.addAll(status.getUntracked());
            return new GitStatusSummary(currentBranch(git), staged, unstaged,
                    new ArrayList<>(new TreeSet<>(status.getUntracked())), new ArrayList<>(files));
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git status failed: " + ex.getMessage(), ex);
        }
    }

    public List<String> add(List<String> files) {
        try (Git git = open()) {
            boolean all = files.isEmpty() || (files.size() == 1 && ".".equals(files.get(0)));
            if (all) {
                git.add().addFilepattern(".").call();
                git.add().addFilepattern(".").setUpdate(true).call();
                return List.of(".");
            }
            List<String> staged = new ArrayList<>();
            AddCommand add = git.add();
            boolean hasAdditions = false;
            for (String file : files) {
                Path target = fileService.resolve(file);
                String relative = fileService.toRelative(target);
                if (Files.exists(target)) {
                    add.addFilepattern(relative);
                    hasAdditions = true;
                } else {
                    git.rm().addFilepattern(relative).call();
                }
                staged.add(relative);
            }
            if (hasAdditions) {
                add.call();
            }
            return staged;
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git add failed: " + ex.getMessage(), ex);
        }
    }

    public GitCommitInfo commit(String message, @Nullable String authorName, @Nullable String authorEmail) {
        String name = StringUtils.hasText(authorName) ? authorName : gitConfig.getAuthorName();
        String email = StringUtils.hasText(authorEmail) ? authorEmail : gitConfig.getAuthorEmail();
        try (Git git = open()) {
            PersonIdent author = new PersonIdent(name, email);
            RevCommit commit = git.commit()
                    .setMessage(message)
                    .setAuthor(author)
                    .setCommitter(author)
                    .call();
            return toInfo(commit);
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git commit failed: " + ex.getMessage(), ex);
        }
    }

    public List<GitCommitInfo> log(int limit) {
        try (Git git = open()) {
            List<GitCommitInfo> commits = new ArrayList<>();
            for (RevCommit commit : git.log().setMaxCount(Math.max(1, limit)).call()) {
                commits.add(toInfo(commit));
            }
            return commits;
        } catch (NoHeadException ex) {
            return List.of();
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git log failed: " + ex.getMessage(), ex);
        }
    }

    public void setRemote(String name, String url) {
        try (Git git = open()) {
            URIish uri = new URIish(url);
            boolean exists = git.remoteList().call().stream()
                    .map(RemoteConfig::getName)
                    .anyMatch(name::equals);
            if (exists) {
                git.remoteSetUrl().setRemoteName(name).setRemoteUri(uri).call();
            } else {
                git.remoteAdd().setName(name).setUri(uri).call();
            }
        } catch (URISyntaxException ex) {
            throw new ToolExecutionException("Invalid remote URL: " + url, ex);
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git remote failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Clones into the workspace root, which must be empty.
     *
     * @param depth history depth for a shallow clone; zero or less clones everything
     * @return the checked-out branch
     */
    public String cloneRepository(String url, @Nullable String username, @Nullable String token, int depth) {
        File directory = workspace();
        if (!isWorkspaceEmpty()) {
            throw new ToolExecutionException("Project directory is not empty. Clear it before cloning.");
        }
        CloneCommand clone = Git.cloneRepository()
                .setURI(url)
                .setDirectory(directory);
        if (depth > 0) {
            clone.setDepth(depth);
        }
        credentials(username, token).ifPresent(clone::setCredentialsProvider);
        try (Git git = clone.call()) {
            String branch = git.getRepository().getBranch();
            log.info("Cloned {} into {} (branch {})", url, directory, branch);
            return branch;
        } catch (GitAPIException | IOException ex) {
            throw new ToolExecutionException("git clone failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * @return how the fetched changes were applied, e.g. {@code Fast-forward}
     */
    public String pull(@Nullable String remote, @Nullable String ref, @Nullable String username,
                       @Nullable String token) {
        try (Git git = open()) {
            PullCommand pull = git.pull().setRemote(remoteName(remote));
            if (StringUtils.hasText(ref)) {
                pull.setRemoteBranchName(ref);
            }
            credentials(username, token).ifPresent(pull::setCredentialsProvider);
            PullResult result = pull.call();
            MergeResult merge = result.getMergeResult();
            RebaseResult rebase = result.getRebaseResult();
            String outcome = merge != null ? merge.getMergeStatus().toString()
                    : rebase != null ? rebase.getStatus().name() : "Already-up-to-date";
            if (!result.isSuccessful()) {
                throw new ToolExecutionException("git pull did not complete: " + outcome);
            }
            log.info("Pulled from {}: {}", remoteName(remote), outcome);
            return outcome;
        } catch (GitAPIException ex) {
            throw new ToolExecutionException("git pull failed: " + ex.getMessage(), ex);
        }
    }

    /**
     * Pushes {@code ref}, or the current branch when none is given.
     *
     * @return one line per updated remote ref
     */
    public List<String> push(@Nullable String remote, @Nullable String ref, @Nullable String username,
                             @Nullable String token) {
        try (Git git = open()) {
            PushCommand push = git.push().setRemote(remoteName(remote));
            push.add(StringUtils.hasText(ref) ? ref : git.getRepository().getBranch());
            credentials(username, token).ifPresent(push::setCredentialsProvider);
            List<String> updates = new ArrayList<>();
            for (PushResult result : push.call()) {
                for (RemoteRefUpdate update : result.getRemoteUpdates()) {
                    RemoteRefUpdate.Status status = update.getStatus();
                    if (status != RemoteRefUpdate.Status.OK && status != RemoteRefUpdate.Status.UP_TO_DATE) {
                        throw new ToolExecutionException("git push rejected for " + update.getRemoteName() + ": "
                                + status + (update.getMessage() != null ? " (" + update.getMessage() + ")" : ""));
                    }
                    updates.add(update.getRemoteName() + (status == RemoteRefUpdate.Status.OK ? " updated" : " up to date"));
                }
            }
            log.info("Pushed to {}: {}", remoteName(remote), updates);
            return updates;
        } catch (GitAPIException | IOException ex) {
            throw new ToolExecutionException("git push failed: " + ex.getMessage(), ex);
        }
    }

    public boolean isRepository() {
        return Files.isDirectory(fileService.workspaceRoot().resolve(".git"));
    }

    private Git open() {
        if (!isRepository()) {
            throw new ToolExecutionException("Not a git repository. Run git_init first.");
        }
        try {
            return Git.open(workspace());
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to open git repository: " + ex.getMessage(), ex);
        }
    }

    private String currentBranch(Git git) {
        try {
            String branch = git.getRepository().getBranch();
            return branch != null ? branch : "main";
        } catch (IOException ex) {
            log.debug("Could not read current branch: {}", ex.getMessage());
            return "main";
        }
    }

    private GitCommitInfo toInfo(RevCommit commit) {
        PersonIdent author = commit.getAuthorIdent();
        return new GitCommitInfo(commit.getName(), commit.getShortMessage(),
                author.getName() + " <" + author.getEmailAddress() + ">",
                author.getWhenAsInstant());
    }

    private boolean isWorkspaceEmpty() {
        Path root = fileService.workspaceRoot();
        if (!Files.exists(root)) {
            return true;
        }
        try (Stream<Path> entries = Files.list(root)) {
            return entries.findAny().isEmpty();
        } catch (IOException ex) {
            throw new ToolExecutionException("Failed to inspect workspace: " + ex.getMessage(), ex);
        }
    }

    private Optional<CredentialsProvider> credentials(@Nullable String username, @Nullable String token) {
        String user = StringUtils.hasText(username) ? username : gitConfig.getUsername();
        String secret = StringUtils.hasText(token) ? token : gitConfig.getToken();
        if (!StringUtils.hasText(user) && !StringUtils.hasText(secret)) {
            return Optional.empty();
        }
        return Optional.of(new UsernamePasswordCredentialsProvider(
                StringUtils.hasText(user) ? user : "x-access-token", secret == null ? "" : secret));
    }

    private static String remoteName(@Nullable String remote) {
        return StringUtils.hasText(remote) ? remote : "origin";
    }

    private File workspace() {
        return fileService.workspaceRoot().toFile();
    }
}
