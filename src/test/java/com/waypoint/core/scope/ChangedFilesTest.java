package com.waypoint.core.scope;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ChangedFilesTest {

    @TempDir
    Path workspace;

    @Test
    @DisplayName("paths are normalized to forward slashes without a leading ./")
    void normalizesPaths() {
        var files = ChangedFiles.pathsOnly(List.of("./src/Main.java", "src\\util\\Strings.java", " docs/a.md "));
        assertEquals(List.of("src/Main.java", "src/util/Strings.java", "docs/a.md"),
                files.stream().map(ChangedFile::path).toList());
        assertTrue(files.stream().allMatch(f -> f.content() == null));
    }

    @Test
    @DisplayName("text files are read from the workspace")
    void readsText() throws IOException {
        Files.createDirectories(workspace.resolve("src"));
        Files.writeString(workspace.resolve("src/App.java"), "class App {}");

        var files = ChangedFiles.fromWorkspace(workspace, List.of("src/App.java"));

        assertEquals("class App {}", files.get(0).content());
    }

    @Test
    @DisplayName("deleted and binary files are checked by path only")
    void deletedAndBinary() throws IOException {
        Files.write(workspace.resolve("logo.png"), new byte[] {(byte) 0x89, 'P', 'N', 'G', (byte) 0xFF, (byte) 0xFE});

        var files = ChangedFiles.fromWorkspace(workspace, List.of("gone.txt", "logo.png"));

        assertEquals(2, files.size());
        assertNull(files.get(0).content());
        assertNull(files.get(1).content());
    }

    @Test
    @DisplayName("oversized files are checked by path only")
    void oversized() throws IOException {
        byte[] big = new byte[(int) ChangedFiles.MAX_CONTENT_BYTES + 1];
        Arrays.fill(big, (byte) 'a');
        Files.write(workspace.resolve("big.txt"), big);

        assertNull(ChangedFiles.fromWorkspace(workspace, List.of("big.txt")).get(0).content());
    }

    @Test
    @DisplayName("no workspace -> paths only")
    void noWorkspace() {
        assertNull(ChangedFiles.fromWorkspace(null, List.of("a.txt")).get(0).content());
        assertTrue(ChangedFiles.fromWorkspace(workspace, null).isEmpty());
    }

    @Test
    @DisplayName("content is decoded as UTF-8")
    void utf8() throws IOException {
        Files.write(workspace.resolve("readme.md"), "café".getBytes(StandardCharsets.UTF_8));
        assertEquals("café", ChangedFiles.fromWorkspace(workspace, List.of("readme.md")).get(0).content());
    }
}
