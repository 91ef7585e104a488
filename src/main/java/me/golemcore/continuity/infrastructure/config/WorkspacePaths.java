package me.golemcore.continuity.infrastructure.config;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Resolves configured paths that may contain {@code ${user.home}} or
 * {@code ${java.io.tmpdir}} placeholders.
 */
public final class WorkspacePaths {

    private static final String USER_HOME = "${user.home}";
    private static final String TMP_DIR = "${java.io.tmpdir}";

    private WorkspacePaths() {
    }

    public static Path resolve(String raw) {
        String expanded = raw
                .replace(USER_HOME, System.getProperty("user.home"))
                .replace(TMP_DIR, System.getProperty("java.io.tmpdir"));
        return Paths.get(expanded).toAbsolutePath().normalize();
    }

    /**
     * Resolves {@code raw} against {@code base} unless it is already absolute.
     */
    public static Path resolveAgainst(Path base, String raw) {
        Path candidate = resolveRelative(raw);
        if (candidate.isAbsolute()) {
            return candidate.normalize();
        }
        return base.resolve(candidate).normalize();
    }

    private static Path resolveRelative(String raw) {
        if (raw.contains(USER_HOME) || raw.contains(TMP_DIR)) {
            return resolve(raw);
        }
        return Paths.get(raw);
    }
}
