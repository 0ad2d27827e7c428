package org.seisview.storage;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.UUID;

import org.seisview.segy.SegyException;
import org.seisview.segy.volume.VolumeMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Keeps the single "current volume" file at a well-known path.
 * <p>
 * An upload is streamed to a temp file next to the current volume and opened through a
 * {@link VolumeInstaller}. Once it has opened, it is moved over the current file, and only after
 * the move succeeds does the new volume become active. A rejected upload, or one whose move
 * fails, leaves both the current file and the active volume untouched, and its temp file is
 * deleted.
 * <p>
 * The move relies on POSIX rename semantics: the new volume keeps reading through the channel it
 * opened on the temp file, and a volume still open on the replaced file keeps reading the old
 * data until its readers are done.
 * <p>
 * <strong>Configuration:</strong>
 * <pre>
 * storage {
 *   data-directory = "data"
 *   volume-file-name = "latest.sgy"
 * }
 * </pre>
 */
public class VolumeFileStore {

    private static final Logger log = LoggerFactory.getLogger(VolumeFileStore.class);

    private final Path dataDirectory;
    private final Path currentVolume;
    private final Object installLock = new Object();

    public VolumeFileStore(Config options) throws IOException {
        this(Paths.get(options.hasPath("data-directory") ? options.getString("data-directory") : "data"),
            options.hasPath("volume-file-name") ? options.getString("volume-file-name") : "latest.sgy");
    }

    public VolumeFileStore(Path dataDirectory, String volumeFileName) throws IOException {
        if (volumeFileName.isBlank() || volumeFileName.contains("/") || volumeFileName.contains("\\")) {
            throw new IllegalArgumentException("volume-file-name must be a plain file name: " + volumeFileName);
        }
        this.dataDirectory = dataDirectory.toAbsolutePath();
        Files.createDirectories(this.dataDirectory);
        this.currentVolume = this.dataDirectory.resolve(volumeFileName);
        log.debug("Volume store at {}", currentVolume);
    }

    public Path getCurrentVolumePath() {
        return currentVolume;
    }

    public boolean hasCurrentVolume() {
        return Files.isRegularFile(currentVolume);
    }

    /**
     * Persists an uploaded volume and makes it active.
     *
     * @param content   complete file content; read to the end but not closed
     * @param installer opens the persisted file as the active volume
     * @return metadata of the installed volume
     * @throws SegyException if the upload is not a readable volume
     * @throws IOException   if writing, reading or moving the file fails; the previous volume
     *                       stays active
     */
    public VolumeMetadata store(InputStream content, VolumeInstaller installer) throws SegyException, IOException {
        synchronized (installLock) {
            final Path tempFile = dataDirectory.resolve(currentVolume.getFileName() + "." + UUID.randomUUID() + ".tmp");
            try {
                final long bytes = Files.copy(content, tempFile);
                log.debug("Received {} bytes into {}", bytes, tempFile);

                final VolumeMetadata metadata = installer.install(tempFile, () -> Files.move(tempFile, currentVolume,
                    StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING));
                log.info("Stored volume {} ({} bytes)", currentVolume, bytes);
                return metadata;
            } catch (SegyException | IOException | RuntimeException e) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException cleanupEx) {
                    log.warn("Failed to clean up temp file after rejected upload: {}", tempFile, cleanupEx);
                }
                throw e;
            }
        }
    }
}
