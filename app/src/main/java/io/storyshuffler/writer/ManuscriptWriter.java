package io.storyshuffler.writer;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import org.eclipse.jgit.api.Git;
import org.eclipse.jgit.api.errors.GitAPIException;
import org.eclipse.jgit.api.errors.JGitInternalException;
import org.eclipse.jgit.lib.Repository;
import org.eclipse.jgit.storage.file.FileRepositoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes a shuffled manuscript to disk and, on request, stages it in the enclosing Git work tree.
 */
public class ManuscriptWriter {

    private static final Logger LOGGER = LoggerFactory.getLogger(ManuscriptWriter.class);

    public void write(Path target, String content, boolean stage) {
        if (target == null || content == null) {
            throw new IllegalArgumentException("target and content must be provided");
        }
        Path absolute = target.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
            Files.writeString(absolute, content, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE);
            LOGGER.info("Wrote shuffled manuscript to {}", absolute);
            if (stage) {
                stageIfRepository(absolute);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to write shuffled manuscript: " + absolute, ex);
        }
    }

    private void stageIfRepository(Path target) throws IOException {
        FileRepositoryBuilder builder = new FileRepositoryBuilder().findGitDir(target.getParent().toFile());
        if (builder.getGitDir() == null) {
            LOGGER.debug("No Git repository encloses {}; nothing to stage", target);
            return;
        }
        try (Repository repository = builder.setMustExist(true).build();
             Git git = new Git(repository)) {
            Path workTree = repository.getWorkTree().toPath().toRealPath();
            String relativePath = workTree.relativize(target.toRealPath()).toString().replace('\\', '/');
            git.add().addFilepattern(relativePath).call();
            LOGGER.info("Staged {} in {}", relativePath, workTree);
        } catch (GitAPIException | JGitInternalException ex) {
            throw new IllegalStateException("Wrote but failed to stage shuffled manuscript: " + target, ex);
        }
    }
}
