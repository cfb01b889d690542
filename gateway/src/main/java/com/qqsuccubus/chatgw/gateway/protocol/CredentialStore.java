package com.qqsuccubus.chatgw.gateway.protocol;

import com.qqsuccubus.chatgw.core.error.ConnectionException;
import lombok.Getter;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.stream.Stream;

/**
 * Per-session credential directory handed to the protocol client.
 * <p>
 * The gateway only creates and clears the directory; the client owns its contents.
 * </p>
 */
@Getter
public class CredentialStore {
    private final String sessionId;
    private final Path location;

    private CredentialStore(String sessionId, Path location) {
        this.sessionId = sessionId;
        this.location = location;
    }

    /**
     * Resolves and creates the credential directory of a session.
     *
     * @param root      Root directory for all sessions
     * @param sessionId Session identifier
     * @return Store rooted at {@code root/sessionId}
     * @throws ConnectionException if the directory cannot be created
     */
    public static CredentialStore open(Path root, String sessionId) {
        Path location = root.resolve(sessionId).normalize();
        if (!location.startsWith(root.normalize())) {
            throw new ConnectionException("Invalid session id for credential storage: " + sessionId);
        }
        try {
            Files.createDirectories(location);
        } catch (IOException e) {
            throw new ConnectionException("Cannot create credential storage at " + location, e);
        }
        return new CredentialStore(sessionId, location);
    }

    /**
     * Deletes all stored credential material; the next connect starts a fresh pairing.
     */
    public void clear() {
        if (!Files.exists(location)) {
            return;
        }
        try (Stream<Path> paths = Files.walk(location)) {
            paths.sorted(Comparator.reverseOrder())
                .filter(path -> !path.equals(location))
                .forEach(CredentialStore::delete);
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot clear credential storage at " + location, e);
        }
    }

    private static void delete(Path path) {
        try {
            Files.delete(path);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
