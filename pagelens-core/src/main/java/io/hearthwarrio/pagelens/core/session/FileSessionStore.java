package io.hearthwarrio.pagelens.core.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.Optional;

/**
 * Stores each session as {@code <directory>/<name>.json}. Names are reduced to letters, digits, {@code -} and
 * {@code _}; an empty result becomes {@value #DEFAULT_NAME}.
 */
public class FileSessionStore implements SessionStore {

    private static final Logger logger = LoggerFactory.getLogger(FileSessionStore.class);

    public static final String DEFAULT_NAME = "default";

    private final Path directory;

    public FileSessionStore(Path directory) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null");
    }

    public Path pathFor(String name) {
        return directory.resolve(sanitize(name) + ".json");
    }

    static String sanitize(String name) {
        if (name == null) {
            return DEFAULT_NAME;
        }
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < name.length(); i++) {
            char c = name.charAt(i);
            if (Character.isLetterOrDigit(c) || c == '-' || c == '_') {
                sb.append(c);
            }
        }
        return sb.length() == 0 ? DEFAULT_NAME : sb.toString();
    }

    @Override
    public String save(String name, byte[] state) {
        Objects.requireNonNull(state, "state must not be null");
        Path target = pathFor(name);
        try {
            Files.createDirectories(directory);
            Path tmp = Files.createTempFile(directory, sanitize(name), ".tmp");
            Files.write(tmp, state);
            Files.move(tmp, target, StandardCopyOption.REPLACE_EXISTING);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot save session " + target, e);
        }
        logger.info("Saved session '{}' to {}", name, target);
        return target.toString();
    }

    @Override
    public Optional<byte[]> load(String name) {
        Path path = pathFor(name);
        if (!Files.isRegularFile(path)) {
            return Optional.empty();
        }
        try {
            return Optional.of(Files.readAllBytes(path));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read session " + path, e);
        }
    }

    public Path getDirectory() {
        return directory;
    }
}
