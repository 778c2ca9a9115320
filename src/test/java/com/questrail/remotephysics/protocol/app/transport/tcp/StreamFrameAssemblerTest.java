package com.questrail.remotephysics.protocol.app.transport.tcp;

import com.questrail.remotephysics.protocol.app.codec.impl.AppWireFormat;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageDecoder;
import com.questrail.remotephysics.protocol.app.codec.impl.DefaultAppMessageEncoder;
import com.questrail.remotephysics.protocol.app.model.*;
import com.questrail.remotephysics.protocol.app.observability.AppDropReason;
import com.questrail.remotephysics.protocol.app.observability.RecordingObservabilitySink;
import com.questrail.remotephysics.api.Vector3;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * StreamFrameAssemblerTest
 * -----------------------------------------------------------------------------
 * Reassembly of length-prefixed messages from arbitrarily split TCP reads.
 */
final class StreamFrameAssemblerTest
{
    private static final int HEADER = AppHeader.SIZE;
    private static final int OFFSET = AppHeader.LENGTH_OFFSET;

    private final DefaultAppMessageEncoder encoder = new DefaultAppMessageEncoder();
    private final StreamFrameAssembler assembler = new StreamFrameAssembler(HEADER, OFFSET, 1 << 20);
    private final List<byte[]> out = new ArrayList<>();

    @Test
    void wholeMessageInOneChunk() throws StreamFramingException
    {
        byte[] msg = encoder.encode(new LogonReady(1), 0, 0f);

        assembler.feed(msg, out::add);

        assertEquals(1, out.size());
        assertArrayEquals(msg, out.get(0));
        assertEquals(0, assembler.buffered());
    }

    @Test
    void severalMessagesInOneChunk() throws StreamFramingException
    {
        byte[] a = encoder.encode(new LogonReady(1), 0, 0f);
        byte[] b = encoder.encode(new Logon(1, "Region"), 1, 0f);
        byte[] c = encoder.encode(new TimeAdvanced(1), 2, 0f);

        assembler.feed(concat(a, b, c), out::add);

        assertEquals(3, out.size());
        assertArrayEquals(a, out.get(0));
        assertArrayEquals(b, out.get(1));
        assertArrayEquals(c, out.get(2));
    }

    @Test
    void everySplitPointYieldsTheSameMessages() throws StreamFramingException
    {
        byte[] a = encoder.encode(new Logon(7, "TestSim"), 0, 0f);
        byte[] b = encoder.encode(new AddConvexMesh(new ShapeId(7, 1),
                List.of(Vector3.ZERO, Vector3.of(1f, 1f, 1f))), 1, 0f);
        byte[] stream = concat(a, b);

        for (int split = 1; split < stream.length; split++) {
            StreamFrameAssembler fresh = new StreamFrameAssembler(HEADER, OFFSET, 1 << 20);
            List<byte[]> frames = new ArrayList<>();

            fresh.feed(Arrays.copyOfRange(stream, 0, split), frames::add);
            fresh.feed(Arrays.copyOfRange(stream, split, stream.length), frames::add);

            assertEquals(2, frames.size(), "split at " + split);
            assertArrayEquals(a, frames.get(0), "split at " + split);
            assertArrayEquals(b, frames.get(1), "split at " + split);
            assertEquals(0, fresh.buffered());
        }
    }

    @Test
    void byteAtATime() throws StreamFramingException
    {
        byte[] a = encoder.encode(new AdvanceTime(3, 0.5f), 0, 0f);
        byte[] b = encoder.encode(new Logoff(3), 1, 0f);
        byte[] stream = concat(a, b);

        for (byte value : stream) {
            assembler.feed(new byte[] { value }, out::add);
        }

        assertEquals(2, out.size());
        assertArrayEquals(a, out.get(0));
        assertArrayEquals(b, out.get(1));
    }

    @Test
    void offsetAndLengthSelectPartOfTheChunk() throws StreamFramingException
    {
        byte[] msg = encoder.encode(new LogonReady(9), 0, 0f);
        byte[] padded = concat(new byte[] { 1, 2, 3 }, msg, new byte[] { 4 });

        assembler.feed(padded, 3, msg.length, out::add);

        assertEquals(1, out.size());
        assertArrayEquals(msg, out.get(0));
    }

    @Test
    void messageLargerThanInitialBufferIsReassembled() throws StreamFramingException
    {
        List<Vector3> points = new ArrayList<>();
        for (int i = 0; i < 10_000; i++) {
            points.add(new Vector3(i, -i, i * 0.5f));
        }
        byte[] big = encoder.encode(new AddConvexMesh(new ShapeId(1, 1), points), 0, 0f);
        assertTrue(big.length > 64 * 1024);

        for (int pos = 0; pos < big.length; pos += 1000) {
            assembler.feed(big, pos, Math.min(1000, big.length - pos), out::add);
        }

        assertEquals(1, out.size());
        assertArrayEquals(big, out.get(0));
    }

    @Test
    void framesWithForeignVersionPassThroughAndDoNotDesynchronize() throws StreamFramingException
    {
        byte[] foreign = encoder.encode(new LogonReady(1), 0, 0f);
        AppWireFormat.putU16(foreign, 0, 9);
        byte[] good = encoder.encode(new LogonReady(2), 1, 0f);
        byte[] stream = concat(foreign, good);

        assembler.feed(Arrays.copyOfRange(stream, 0, 30), out::add);
        assembler.feed(Arrays.copyOfRange(stream, 30, stream.length), out::add);

        RecordingObservabilitySink sink = new RecordingObservabilitySink();
        DefaultAppMessageDecoder decoder = new DefaultAppMessageDecoder(sink);

        assertEquals(2, out.size());
        assertTrue(decoder.decode(out.get(0)).isEmpty());
        assertEquals(AppDropReason.VERSION_MISMATCH, sink.getDrops().get(0).reason());
        assertEquals(new LogonReady(2), decoder.decode(out.get(1)).orElseThrow().message());
    }

    @Test
    void lengthBelowHeaderSizeIsFatal()
    {
        byte[] bad = encoder.encode(new LogonReady(1), 0, 0f);
        AppWireFormat.putU32(bad, OFFSET, 4);

        assertThrows(StreamFramingException.class, () -> assembler.feed(bad, out::add));
        assertTrue(out.isEmpty());
    }

    @Test
    void lengthAboveMaximumIsFatalEvenWhenSplit() throws StreamFramingException
    {
        StreamFrameAssembler small = new StreamFrameAssembler(HEADER, OFFSET, 64);
        byte[] bad = encoder.encode(new LogonReady(1), 0, 0f);
        AppWireFormat.putU32(bad, OFFSET, 65);

        small.feed(Arrays.copyOfRange(bad, 0, 10), out::add);

        assertThrows(StreamFramingException.class,
                () -> small.feed(Arrays.copyOfRange(bad, 10, bad.length), out::add));
    }

    @Test
    void resetDiscardsPartialMessage() throws StreamFramingException
    {
        byte[] msg = encoder.encode(new LogonReady(1), 0, 0f);

        assembler.feed(Arrays.copyOf(msg, 10), out::add);
        assertEquals(10, assembler.buffered());

        assembler.reset();
        assembler.feed(msg, out::add);

        assertEquals(1, out.size());
        assertArrayEquals(msg, out.get(0));
    }

    private static byte[] concat(byte[]... parts)
    {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        for (byte[] p : parts) {
            bytes.writeBytes(p);
        }
        return bytes.toByteArray();
    }
}
