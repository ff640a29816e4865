package com.phillippitts.voicedaemon.ipc;

import com.phillippitts.voicedaemon.exception.RuntimeDirectoryException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.attribute.PosixFilePermission;
import java.nio.file.attribute.PosixFilePermissions;
import java.nio.file.attribute.UserPrincipal;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Per-user private directory that holds the daemon socket and pid file.
 *
 * <p>Resolution order: explicit override, {@code $XDG_RUNTIME_DIR/voicedaemon}, then
 * {@code <tmpdir>/voicedaemon_<user>}.
 *
 * <p>{@link #prepare()} creates the directory with mode {@code 0700}. An existing path must be
 * a real directory (never a symbolic link) owned by the current user; its permissions are then
 * tightened to {@code 0700}. Anything else fails with {@link RuntimeDirectoryException}, which
 * blocks socket hijacking through a pre-created or symlinked directory.
 */
public final class SecureRuntimeDirectory {

    private static final Logger LOG = LogManager.getLogger(SecureRuntimeDirectory.class);

    static final String APP_DIR_NAME = "voicedaemon";
    static final Set<PosixFilePermission> OWNER_ONLY = PosixFilePermissions.fromString("rwx------");

    private final Path directory;
    private final UserPrincipal expectedOwner;

    public SecureRuntimeDirectory(Path directory, UserPrincipal expectedOwner) {
        this.directory = Objects.requireNonNull(directory, "directory must not be null").toAbsolutePath();
        this.expectedOwner = Objects.requireNonNull(expectedOwner, "expectedOwner must not be null");
    }

    /**
     * Directory for the current user, owned-by check against the current user.
     */
    public static SecureRuntimeDirectory forCurrentUser(String override) {
        Path dir = resolve(override, System.getenv(), System.getProperty("java.io.tmpdir"),
                System.getProperty("user.name"));
        return new SecureRuntimeDirectory(dir, currentUser(dir));
    }

    static Path resolve(String override, Map<String, String> env, String tmpDir, String userName) {
        if (override != null && !override.isBlank()) {
            return Path.of(override);
        }
        String xdg = env.get("XDG_RUNTIME_DIR");
        if (xdg != null && !xdg.isBlank()) {
            return Path.of(xdg, APP_DIR_NAME);
        }
        return Path.of(tmpDir, APP_DIR_NAME + "_" + userName);
    }

    public Path directory() {
        return directory;
    }

    /**
     * Creates or verifies the directory.
     *
     * @return the verified directory
     * @throws RuntimeDirectoryException if the directory is unsafe or cannot be created
     */
    public Path prepare() {
        boolean posix = directory.getFileSystem().supportedFileAttributeViews().contains("posix");
        if (Files.isSymbolicLink(directory)) {
            throw new RuntimeDirectoryException(directory, "Runtime directory is a symbolic link");
        }
        if (Files.notExists(directory, LinkOption.NOFOLLOW_LINKS)) {
            create(posix);
        }
        if (!Files.isDirectory(directory, LinkOption.NOFOLLOW_LINKS)) {
            throw new RuntimeDirectoryException(directory, "Runtime path is not a directory");
        }
        verifyOwner();
        if (posix) {
            try {
                Files.setPosixFilePermissions(directory, OWNER_ONLY);
            } catch (IOException e) {
                throw new RuntimeDirectoryException(directory, "Cannot restrict runtime directory permissions", e);
            }
        } else {
            LOG.warn("File system of {} has no POSIX permissions; relying on owner check only", directory);
        }
        LOG.debug("Runtime directory ready: {}", directory);
        return directory;
    }

    private void create(boolean posix) {
        try {
            Path parent = directory.getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            if (posix) {
                Files.createDirectory(directory, PosixFilePermissions.asFileAttribute(OWNER_ONLY));
            } else {
                Files.createDirectory(directory);
            }
            LOG.info("Created runtime directory {}", directory);
        } catch (FileAlreadyExistsException e) {
            LOG.debug("Runtime directory {} appeared concurrently; verifying it", directory);
        } catch (IOException e) {
            throw new RuntimeDirectoryException(directory, "Cannot create runtime directory", e);
        }
    }

    private void verifyOwner() {
        UserPrincipal owner;
        try {
            owner = Files.getOwner(directory, LinkOption.NOFOLLOW_LINKS);
        } catch (IOException e) {
            throw new RuntimeDirectoryException(directory, "Cannot read runtime directory owner", e);
        }
        if (!expectedOwner.equals(owner)) {
            throw new RuntimeDirectoryException(directory,
                    "Runtime directory is owned by another user (" + owner.getName() + ")");
        }
    }

    private static UserPrincipal currentUser(Path dir) {
        try {
            return dir.getFileSystem().getUserPrincipalLookupService()
                    .lookupPrincipalByName(System.getProperty("user.name"));
        } catch (IOException e) {
            throw new RuntimeDirectoryException(dir, "Cannot resolve current user", e);
        }
    }
}
