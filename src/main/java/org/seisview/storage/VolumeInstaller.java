package org.seisview.storage;

import java.io.IOException;
import java.nio.file.Path;

import org.seisview.segy.SegyException;
import org.seisview.segy.volume.VolumeAccessor.BeforeSwap;
import org.seisview.segy.volume.VolumeMetadata;

/**
 * Makes a fully persisted file the active volume, typically {@code VolumeAccessor::replace}.
 * The installer opens the file, runs {@code persist}, and activates the volume only if
 * {@code persist} succeeded.
 */
@FunctionalInterface
public interface VolumeInstaller {

    VolumeMetadata install(Path path, BeforeSwap persist) throws SegyException, IOException;
}
