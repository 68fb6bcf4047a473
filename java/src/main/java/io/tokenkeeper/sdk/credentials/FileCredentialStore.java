package io.tokenkeeper.sdk.credentials;

import com.fasterxml.jackson.databind.JsonNode;
import io.tokenkeeper.sdk.Config;
import io.tokenkeeper.sdk.internal.Json;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Logger;

/**
 * Reads credentials from JSON files in a credentials directory.
 *
 * <p>
 * The client credentials file must look like:
 * </p>
 * <pre>{@code
 * {"client_id": "id", "client_secret": "secret"}
 * }</pre>
 * <p>
 * The optional user credentials file must look like:
 * </p>
 * <pre>{@code
 * {"username": "name", "password": "secret"}
 * }</pre>
 * <p>
 * {@code application_username} and {@code application_password} are accepted for the user file as well, which is
 * what older credential rotators write.
 * </p>
 *
 * <p>
 * Snapshots are swapped atomically. Reloads are explicit: call {@link #reload()} when the environment signals a
 * credential rotation.
 * </p>
 */
public final class FileCredentialStore implements CredentialStore {

    private static final Logger LOGGER = Logger.getLogger(FileCredentialStore.class.getName());

    private final Path clientFile;
    private final Path userFile;
    private final Clock clock;
    private final AtomicReference<CredentialsSnapshot> snapshot = new AtomicReference<>();
    private final Object reloadLock = new Object();

    public FileCredentialStore(Path credentialsDir, String clientFileName, String userFileName) {
        this(credentialsDir, clientFileName, userFileName, Clock.systemUTC());
    }

    public FileCredentialStore(Path credentialsDir, String clientFileName, String userFileName, Clock clock) {
        Objects.requireNonNull(credentialsDir, "credentialsDir");
        Objects.requireNonNull(clientFileName, "clientFileName");
        this.clientFile = credentialsDir.resolve(clientFileName);
        this.userFile = userFileName == null ? null : credentialsDir.resolve(userFileName);
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Creates a store for the directory and file names in {@code config} and loads it, failing fast when the
     * credentials are unusable.
     */
    public static FileCredentialStore open(Config config) throws CredentialException {
        Objects.requireNonNull(config, "config");
        if (config.getCredentialsDir() == null) {
            throw new IllegalArgumentException("CredentialsDir is required");
        }
        FileCredentialStore store = new FileCredentialStore(
            config.getCredentialsDir(),
            config.getClientCredentialsFileName(),
            config.getUserCredentialsFileName()
        );
        store.load();
        return store;
    }

    @Override
    public CredentialsSnapshot load() throws CredentialException {
        synchronized (reloadLock) {
            CredentialsSnapshot fresh = read();
            snapshot.set(fresh);
            LOGGER.info(() -> String.format(Locale.ROOT, "[tokenkeeper] loaded credentials for client %s from %s",
                fresh.client().id(), clientFile.getParent()));
            return fresh;
        }
    }

    @Override
    public CredentialsSnapshot current() {
        CredentialsSnapshot current = snapshot.get();
        if (current == null) {
            throw new IllegalStateException("credentials have not been loaded");
        }
        return current;
    }

    @Override
    public CredentialsSnapshot reload() throws CredentialException {
        try {
            return load();
        } catch (CredentialException ex) {
            LOGGER.warning(() -> "[tokenkeeper] credential reload failed, keeping previous credentials: "
                + ex.getMessage());
            throw ex;
        }
    }

    private CredentialsSnapshot read() throws CredentialException {
        JsonNode clientNode = readJson(clientFile);
        String clientId = Json.text(clientNode, "client_id");
        String clientSecret = Json.text(clientNode, "client_secret");
        if (clientId == null || clientSecret == null) {
            throw new CredentialException(CredentialException.Kind.MALFORMED, clientFile,
                "client credentials file " + clientFile + " must contain client_id and client_secret", null);
        }

        UserCredentials user = null;
        if (userFile != null) {
            JsonNode userNode = readJson(userFile);
            String username = firstNonNull(Json.text(userNode, "username"), Json.text(userNode, "application_username"));
            String password = firstNonNull(Json.text(userNode, "password"), Json.text(userNode, "application_password"));
            if (username == null || password == null) {
                throw new CredentialException(CredentialException.Kind.MALFORMED, userFile,
                    "user credentials file " + userFile + " must contain username and password", null);
            }
            user = new UserCredentials(username, password);
        }

        return new CredentialsSnapshot(new ClientCredentials(clientId, clientSecret), user, clock.instant());
    }

    private static JsonNode readJson(Path file) throws CredentialException {
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(file);
        } catch (NoSuchFileException ex) {
            throw new CredentialException(CredentialException.Kind.NOT_FOUND, file,
                "credentials file " + file + " does not exist", ex);
        } catch (IOException ex) {
            throw new CredentialException(CredentialException.Kind.NOT_FOUND, file,
                "read credentials file " + file + ": " + ex.getMessage(), ex);
        }

        try {
            JsonNode node = Json.mapper().readTree(bytes);
            if (node == null || !node.isObject()) {
                throw new CredentialException(CredentialException.Kind.MALFORMED, file,
                    "credentials file " + file + " is not a JSON object", null);
            }
            return node;
        } catch (IOException ex) {
            throw new CredentialException(CredentialException.Kind.MALFORMED, file,
                "decode credentials file " + file + ": " + ex.getMessage(), ex);
        }
    }

    private static String firstNonNull(String first, String second) {
        return first != null ? first : second;
    }
}
