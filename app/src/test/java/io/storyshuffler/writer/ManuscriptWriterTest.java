package io.storyshuffler.writer;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowable;

import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.eclipse.jgit.api.Git;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ManuscriptWriterTest {

    @TempDir
    Path tempDir;

    @Test
    void writesContentAndCreatesDirectories() throws Exception {
        Path target = tempDir.resolve("drafts/nested/out.md");

        new ManuscriptWriter().write(target, "Beta\n\n* * *\n\nAlpha", false);

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("Beta\n\n* * *\n\nAlpha");
    }

    @Test
    void overwritesExistingFile() throws Exception {
        Path target = tempDir.resolve("out.md");
        Files.writeString(target, "a much longer previous manuscript", StandardCharsets.UTF_8);

        new ManuscriptWriter().write(target, "short", false);

        assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("short");
    }

    @Test
    void stagesOutputWhenRepositoryExists() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            new ManuscriptWriter().write(tempDir.resolve("drafts/out.md"), "shuffled", true);

            assertThat(git.status().call().getAdded()).contains("drafts/out.md");
        }
    }

    @Test
    void stagingOutsideRepositoryOnlyWrites() throws Exception {
        Path target = tempDir.resolve("plain/out.md");

        new ManuscriptWriter().write(target, "shuffled", true);

        assertThat(Files.exists(target)).isTrue();
    }

    @Test
    void lockedIndexFailsStagingAfterWriting() throws Exception {
        try (Git git = Git.init().setDirectory(tempDir.toFile()).call()) {
            Files.createFile(tempDir.resolve(".git/index.lock"));
            Path target = tempDir.resolve("out.md");

            Throwable thrown = catchThrowable(() -> new ManuscriptWriter().write(target, "shuffled", true));

            assertThat(thrown)
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("failed to stage");
            assertThat(Files.readString(target, StandardCharsets.UTF_8)).isEqualTo("shuffled");
        }
    }

    @Test
    void reportsUnwritableTarget() throws Exception {
        Path blocker = tempDir.resolve("blocker");
        Files.writeString(blocker, "file, not a directory");

        Throwable thrown = catchThrowable(() -> new ManuscriptWriter().write(blocker.resolve("out.md"), "x", false));

        assertThat(thrown)
                .isInstanceOf(UncheckedIOException.class)
                .hasMessageContaining("Failed to write shuffled manuscript");
    }
}
