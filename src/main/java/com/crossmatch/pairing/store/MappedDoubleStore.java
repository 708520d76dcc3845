package com.crossmatch.pairing.store;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.DoubleBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Read-only {@link DoubleStore} over a file of little-endian float64 values.
 *
 * <p>The file is mapped in segments so stores larger than 2 GB are supported.
 * Reads use absolute {@link DoubleBuffer#get(int)} and never move buffer
 * positions, so a single instance can be shared by every worker of a run.</p>
 */
public final class MappedDoubleStore implements DoubleStore {
    private static final Logger log = LoggerFactory.getLogger(MappedDoubleStore.class);

    static final int SEGMENT_DOUBLES = 1 << 27;

    private final Path path;
    private final DoubleBuffer[] segments;
    private final long length;

    private MappedDoubleStore(Path path, DoubleBuffer[] segments, long length) {
        this.path = path;
        this.segments = segments;
        this.length = length;
    }

    /**
     * Maps an existing file read-only.
     *
     * @throws UncheckedIOException if the file cannot be opened or mapped
     * @throws IllegalArgumentException if the file size is not a multiple of 8 bytes
     */
    public static MappedDoubleStore open(Path path) {
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long bytes = channel.size();
            if (bytes % Double.BYTES != 0) {
                throw new IllegalArgumentException("File " + path + " holds " + bytes
                        + " bytes, not a whole number of float64 values");
            }
            long length = bytes / Double.BYTES;
            int segmentCount = (int) ((length + SEGMENT_DOUBLES - 1) / SEGMENT_DOUBLES);
            DoubleBuffer[] segments = new DoubleBuffer[segmentCount];
            for (int s = 0; s < segmentCount; s++) {
                long first = (long) s * SEGMENT_DOUBLES;
                long count = Math.min(SEGMENT_DOUBLES, length - first);
                segments[s] = channel.map(FileChannel.MapMode.READ_ONLY, first * Double.BYTES, count * Double.BYTES)
                        .order(ByteOrder.LITTLE_ENDIAN)
                        .asDoubleBuffer();
            }
            log.debug("store.mapped path={} values={} segments={}", path, length, segmentCount);
            return new MappedDoubleStore(path, segments, length);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to map " + path, e);
        }
    }

    /**
     * Writes values in the layout {@link #open(Path)} expects, replacing any existing file.
     */
    public static void write(Path path, double[] values) throws IOException {
        ByteBuffer buffer = ByteBuffer.allocate(values.length * Double.BYTES).order(ByteOrder.LITTLE_ENDIAN);
        buffer.asDoubleBuffer().put(values);
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.CREATE,
                StandardOpenOption.WRITE, StandardOpenOption.TRUNCATE_EXISTING)) {
            while (buffer.hasRemaining()) {
                channel.write(buffer);
            }
        }
    }

    public Path path() {
        return path;
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    public double get(long offset) {
        if (offset < 0 || offset >= length) {
            throw new IndexOutOfBoundsException("offset " + offset + " outside store of length " + length);
        }
        return segments[(int) (offset / SEGMENT_DOUBLES)].get((int) (offset % SEGMENT_DOUBLES));
    }

    @Override
    public boolean isMapped() {
        return true;
    }

    /**
     * Size of the mapped file on disk, for diagnostics.
     */
    public long fileSize() throws IOException {
        return Files.size(path);
    }
}
