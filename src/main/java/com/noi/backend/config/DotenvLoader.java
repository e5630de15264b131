package com.noi.backend.config;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Local-development .env support: copies KEY=VALUE lines into System properties so that
 * {@code openai.api-key=${OPENAI_API_KEY:}} resolves without exporting anything.
 *
 * Existing environment variables and System properties always win.
 */
public final class DotenvLoader {

    private static final Logger log = LoggerFactory.getLogger(DotenvLoader.class);

    static final String PATH_PROPERTY = "noi.dotenv.path";

    private DotenvLoader() {
    }

    public static void loadFromWorkingDirectoryIfPresent() {
        String override = System.getProperty(PATH_PROPERTY);
        Path envPath = override != null && !override.isBlank() ? Path.of(override) : Path.of(".env");
        if (!Files.isRegularFile(envPath)) {
            return;
        }
        int loaded = load(envPath);
        if (loaded > 0) {
            log.info("[DotenvLoader] Loaded {} keys from {} (values hidden)", loaded, envPath.toAbsolutePath());
        }
    }

    /**
     * Loads one file and returns how many keys were set.
     */
    static int load(Path envPath) {
        List<String> lines;
        try {
            lines = Files.readAllLines(envPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("[DotenvLoader] Could not read {}: {}", envPath, e.getMessage());
            return 0;
        }

        int loaded = 0;
        for (String raw : lines) {
            String line = raw == null ? "" : raw.trim();
            if (line.isEmpty() || line.startsWith("#")) continue;
            if (line.startsWith("export ")) {
                line = line.substring("export ".length()).trim();
            }

            int idx = line.indexOf('=');
            if (idx <= 0) continue;

            String key = line.substring(0, idx).trim();
            String value = unquote(line.substring(idx + 1).trim());
            if (value.isEmpty()) continue;

            if (isDefined(System.getenv(key)) || isDefined(System.getProperty(key))) continue;

            System.setProperty(key, value);
            loaded++;
        }
        return loaded;
    }

    private static String unquote(String value) {
        if (value.length() >= 2
                && ((value.startsWith("\"") && value.endsWith("\"")) || (value.startsWith("'") && value.endsWith("'")))) {
            return value.substring(1, value.length() - 1);
        }
        // Unquoted values may carry a trailing comment.
        int hash = value.indexOf(" #");
        return hash >= 0 ? value.substring(0, hash).trim() : value;
    }

    private static boolean isDefined(String value) {
        return value != null && !value.isBlank();
    }
}
