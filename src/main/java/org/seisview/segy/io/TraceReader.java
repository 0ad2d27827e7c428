package org.seisview.segy.io;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.channels.AsynchronousFileChannel;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;

import org.seisview.segy.TruncatedTraceException;
import org.seisview.segy.format.SampleFormat;
import org.seisview.segy.format.TraceHeader;

/**
 * Reads and decodes trace samples from an open SEG-Y file.
 * <p>
 * Traces are addressed by index through a {@link TraceDirectory}. With fixed-length traces,
 * trace {@code i} starts at {@code headerRegionSize + i * (240 + samplesPerTrace * bytesPerSample)}
 * and its samples follow the 240-byte trace header.
 * <p>
 * <strong>Thread Safety:</strong> This class is thread-safe. Reads are position-based and go
 * through an {@link AsynchronousFileChannel}, which is not an interruptible channel: a reader
 * whose thread is interrupted gets an {@link InterruptedIOException} while the channel stays
 * open for everyone else. A {@code FileChannel} would be closed by the interrupt.
 */
public class TraceReader {

    private static final double TWO_POW_MINUS_24 = 0x1.0p-24;

    private final AsynchronousFileChannel channel;
    private final SampleFormat format;
    private final TraceDirectory directory;

    public TraceReader(AsynchronousFileChannel channel, SampleFormat format, TraceDirectory directory) {
        this.channel = channel;
        this.format = format;
        this.directory = directory;
    }

    /**
     * Returns the byte offset of a trace's header.
     *
     * @param traceIndex zero-based trace index in file order
     * @return absolute file offset
     */
    public long traceOffset(int traceIndex) {
        return directory.offset(traceIndex);
    }

    /**
     * Reads one trace's samples.
     *
     * @param traceIndex zero-based trace index in file order
     * @return decoded samples, as many as the trace declares
     * @throws TruncatedTraceException if the file ends before all sample bytes were read
     * @throws InterruptedIOException  if the calling thread is interrupted
     * @throws IOException             if the underlying read fails
     */
    public float[] readTrace(int traceIndex) throws TruncatedTraceException, IOException {
        final int samples = directory.sampleCount(traceIndex);
        final ByteBuffer buffer = ByteBuffer.allocate(samples * format.bytesPerSample());
        final long position = traceOffset(traceIndex) + TraceHeader.SIZE;

        readFully(buffer, position, traceIndex);

        buffer.flip();
        final float[] trace = new float[samples];
        decodeSamples(buffer, format, trace);
        return trace;
    }

    private void readFully(ByteBuffer buffer, long position, int traceIndex)
            throws TruncatedTraceException, IOException {
        long offset = position;
        while (buffer.hasRemaining()) {
            int read = readAt(channel, buffer, offset);
            if (read < 0) {
                throw new TruncatedTraceException("Trace " + traceIndex + " is truncated: expected "
                    + buffer.capacity() + " bytes at offset " + position + ", file ends after "
                    + buffer.position());
            }
            offset += read;
        }
    }

    /**
     * Performs one positional read and waits for it.
     *
     * @param channel  channel to read from
     * @param buffer   destination
     * @param position absolute file offset
     * @return bytes read, or -1 at end of file
     * @throws InterruptedIOException if the calling thread is interrupted; its interrupt flag
     *                                stays set
     * @throws IOException            if the read fails
     */
    public static int readAt(AsynchronousFileChannel channel, ByteBuffer buffer, long position) throws IOException {
        if (Thread.currentThread().isInterrupted()) {
            throw new InterruptedIOException("Interrupted before reading at offset " + position);
        }
        final Future<Integer> pending = channel.read(buffer, position);
        try {
            return pending.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("Interrupted while reading at offset " + position);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof IOException) {
                throw (IOException) e.getCause();
            }
            throw new IOException("Read at offset " + position + " failed", e.getCause());
        }
    }

    /**
     * Decodes big-endian samples into {@code target}, promoting integers to float.
     *
     * @param source buffer positioned at the first sample
     * @param format sample encoding
     * @param target destination, filled completely
     */
    public static void decodeSamples(ByteBuffer source, SampleFormat format, float[] target) {
        source.order(ByteOrder.BIG_ENDIAN);
        switch (format) {
            case IBM_FLOAT -> {
                for (int i = 0; i < target.length; i++) {
                    target[i] = ibmToFloat(source.getInt());
                }
            }
            case IEEE_FLOAT -> {
                for (int i = 0; i < target.length; i++) {
                    target[i] = source.getFloat();
                }
            }
            case INT32 -> {
                for (int i = 0; i < target.length; i++) {
                    target[i] = source.getInt();
                }
            }
            case INT16 -> {
                for (int i = 0; i < target.length; i++) {
                    target[i] = source.getShort();
                }
            }
            case INT8 -> {
                for (int i = 0; i < target.length; i++) {
                    target[i] = source.get();
                }
            }
        }
    }

    /**
     * Converts a 32-bit IBM hexadecimal float to IEEE 754.
     * <p>
     * Layout: 1 sign bit, 7-bit base-16 exponent biased by 64, 24-bit fraction. The value is
     * {@code fraction * 2^-24 * 16^(exponent - 64)}, i.e. the fraction scaled by
     * {@code 2^(4 * (exponent - 64) - 24)}. The product is formed in double precision, where it
     * is exact, and rounded once to float. IBM magnitudes beyond the float range become
     * infinities, those below it zero or subnormals.
     *
     * @param bits raw IBM float bits
     * @return the IEEE value
     */
    public static float ibmToFloat(int bits) {
        final int fraction = bits & 0x00FFFFFF;
        if (fraction == 0) {
            return (bits < 0) ? -0.0f : 0.0f;
        }
        final int exponent = (bits >>> 24) & 0x7F;
        final double magnitude = Math.scalb(fraction * TWO_POW_MINUS_24, 4 * (exponent - 64));
        return (float) (bits < 0 ? -magnitude : magnitude);
    }
}
