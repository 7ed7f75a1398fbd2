package com.archivist.server.util;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class PathSanitizerTest {

    @ParameterizedTest
    @ValueSource(strings = {
            "repo;rm -rf x", "repo|cat", "repo&", "`whoami`", "$HOME/repo", "repo\\x",
            "../etc/passwd", "repo/../../x", "a..b", "/etc/borgmatic", "repo name", "repo:1", ""
    })
    void shouldRejectUnsafePaths(String path) {
        assertFalse(PathSanitizer.validate(path));
    }

    @ParameterizedTest
    @ValueSource(strings = {"repo", "backups/repo-1", "my_repo.borg", "a/b/c/d", "2024-01-01", "."})
    void shouldAcceptSafeRelativePaths(String path) {
        assertTrue(PathSanitizer.validate(path));
    }

    @Test
    void shouldRejectNull() {
        assertFalse(PathSanitizer.validate(null));
        assertFalse(PathSanitizer.validateArgument(null));
    }

    @Test
    void shouldStripMetacharactersAndTruncate() {
        assertEquals("rm -rf x", PathSanitizer.sanitize(";rm -rf x|&`$\\"));
        assertEquals("", PathSanitizer.sanitize(null));
        String sanitized = PathSanitizer.sanitize("a".repeat(5000));
        assertEquals(PathSanitizer.MAX_ARGUMENT_LENGTH, sanitized.length());
    }

    @Test
    void shouldAcceptArchiveNamesWithColons() {
        assertTrue(PathSanitizer.validateArgument("host-2024-01-15T10:30:00"));
        assertFalse(PathSanitizer.validateArgument("--remote-path=evil"));
        assertFalse(PathSanitizer.validateArgument("archive;ls"));
        assertFalse(PathSanitizer.validateArgument("a..b"));
    }
}
