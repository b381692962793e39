package com.ganesh.keep.storage;

import com.ganesh.keep.error.StorageIOException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Replaces files without ever exposing a partially written one.
 *
 * <p>Bytes go to a uniquely named {@code .tmp} sibling which is forced to disk and then renamed over
 * the target. A crash before the rename leaves the old file (or no file) plus a stray temp file,
 * never a truncated target. Stores ignore and clean up stray temp files.
 */
public class AtomicFileWriter {
    private static final Logger logger = LoggerFactory.getLogger(AtomicFileWriter.class);

    public static final String TEMP_SUFFIX = ".tmp";

    /**
     * Writes {@code bytes} to {@code target} atomically.
     *
     * @throws StorageIOException if any step fails; the temporary file is removed first.
     */
    public void write(Path target, byte[] bytes) {
        Path temp = target.resolveSibling(target.getFileName() + "." + System.nanoTime()
                + "-" + ThreadLocalRandom.current().nextInt(10_000) + TEMP_SUFFIX);
        try {
            Files.createDirectories(target.getParent());
            try (FileChannel channel = FileChannel.open(temp,
                    StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE)) {
                ByteBuffer buffer = ByteBuffer.wrap(bytes);
                while (buffer.hasRemaining()) {
                    channel.write(buffer);
                }
                channel.force(true);
            }
            rename(temp, target);
        } catch (IOException e) {
            deleteQuietly(temp);
            throw new StorageIOException("Failed to write " + target, e);
        }
    }

    /**
     * Moves the finished temporary file over the target.
     */
    protected void rename(Path temp, Path target) throws IOException {
        try {
            Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
        } catch (AtomicMoveNotSupportedException e) {
            Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING);
        }
    }

    private static void deleteQuietly(Path temp) {
        try {
            Files.deleteIfExists(temp);
        } catch (IOException e) {
            logger.warn("Could not remove temporary file {}", temp, e);
        }
    }
}
