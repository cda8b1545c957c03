package com.planwright.vcs;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * {@link VersionControl} backed by the {@code git} CLI, run through
 * {@link ProcessBuilder} in the configured working directory.
 */
public class GitCliVersionControl implements VersionControl {

    private static final Logger log = LoggerFactory.getLogger(GitCliVersionControl.class);

    private final Path workDir;

    public GitCliVersionControl(Path workDir) {
        this.workDir = workDir;
    }

    @Override
    public CommitOutcome commit(String message, List<String> files) {
        var add = new ArrayList<String>();
        add.add("add");
        if (files == null || files.isEmpty()) {
            add.add("-A");
        } else {
            add.add("--");
            add.addAll(files);
        }
        var staged = runGit(add.toArray(String[]::new));
        if (staged.exitCode() != 0) {
            throw new VersionControlException("git add failed: " + staged.output());
        }

        var commit = runGit("commit", "-m", message);
        if (commit.exitCode() != 0) {
            if (isNothingToCommit(commit.output())) {
                log.info("Nothing to commit for '{}'", firstLine(message));
                return CommitOutcome.nothingToCommit();
            }
            throw new VersionControlException("git commit failed: " + commit.output());
        }
        var head = runGit("rev-parse", "HEAD");
        if (head.exitCode() != 0) {
            throw new VersionControlException("git rev-parse failed: " + head.output());
        }
        log.info("Committed {} '{}'", head.output().trim(), firstLine(message));
        return new CommitOutcome(head.output().trim());
    }

    @Override
    public Optional<String> findCommit(String marker) {
        var result = runGit("log", "-n", "1", "--fixed-strings", "--grep=" + marker, "--format=%H");
        if (result.exitCode() != 0 || result.output().isBlank()) {
            return Optional.empty();
        }
        return Optional.of(result.output().trim());
    }

    @Override
    public boolean hasUncommittedChanges() {
        var result = runGit("status", "--porcelain");
        if (result.exitCode() != 0) {
            throw new VersionControlException("git status failed: " + result.output());
        }
        return !result.output().isBlank();
    }

    @Override
    public void stash(String message) {
        var result = runGit("stash", "push", "--include-untracked", "-m", message);
        if (result.exitCode() != 0) {
            throw new VersionControlException("git stash failed: " + result.output());
        }
        log.info("Stashed local changes: {}", message);
    }

    record GitResult(int exitCode, String output) {}

    GitResult runGit(String... args) {
        var command = new ArrayList<String>();
        command.add("git");
        command.addAll(List.of(args));
        log.debug("Running: {}", command);
        try {
            var process = new ProcessBuilder(command)
                    .directory(workDir.toFile())
                    .redirectErrorStream(true)
                    .start();
            String output;
            try (var reader = new BufferedReader(
                    new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                output = reader.lines().collect(Collectors.joining("\n"));
            }
            return new GitResult(process.waitFor(), output);
        } catch (IOException e) {
            throw new VersionControlException("Git command failed: " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VersionControlException("Interrupted running " + command, e);
        }
    }

    static boolean isNothingToCommit(String output) {
        return output.contains("nothing to commit") || output.contains("no changes added to commit")
                || output.contains("nothing added to commit");
    }

    private static String firstLine(String message) {
        int nl = message.indexOf('\n');
        return nl < 0 ? message : message.substring(0, nl);
    }
}
