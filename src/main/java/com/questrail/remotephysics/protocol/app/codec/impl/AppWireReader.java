package com.questrail.remotephysics.protocol.app.codec.impl;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;
import com.questrail.remotephysics.protocol.app.internal.decode.AppDecodeException;
import com.questrail.remotephysics.protocol.app.model.ActorId;
import com.questrail.remotephysics.protocol.app.model.IndexTriple;
import com.questrail.remotephysics.protocol.app.model.JointId;
import com.questrail.remotephysics.protocol.app.model.Material;
import com.questrail.remotephysics.protocol.app.model.ShapeId;
import com.questrail.remotephysics.protocol.app.observability.AppDropReason;

/**
 * Sequential reader over one received packet.
 *
 * <p>Every read is bounds-checked against the end of the packet, so a decode
 * routine that miscounts fails with {@link AppDecodeException} instead of an
 * index exception.</p>
 */
final class AppWireReader
{
    private final byte[] buf;
    private final int limit;
    private int pos;

    AppWireReader(byte[] buf, int offset, int limit)
    {
        this.buf = buf;
        this.pos = offset;
        this.limit = limit;
    }

    int remaining()
    {
        return limit - pos;
    }

    int u32()
    {
        require(4);
        int v = AppWireFormat.getU32(buf, pos);
        pos += 4;
        return v;
    }

    float f32()
    {
        require(4);
        float v = AppWireFormat.getF32(buf, pos);
        pos += 4;
        return v;
    }

    /** Reads a fixed-width text field, or whatever is left of the packet if shorter. */
    String fixedString(int width)
    {
        int n = Math.min(width, remaining());
        String s = AppWireFormat.getFixedString(buf, pos, n);
        pos += n;
        return s;
    }

    Vector3 vector()
    {
        return new Vector3(f32(), f32(), f32());
    }

    Quaternion quaternion()
    {
        return new Quaternion(f32(), f32(), f32(), f32());
    }

    ActorId actor()
    {
        return new ActorId(u32(), u32());
    }

    ShapeId shape()
    {
        return new ShapeId(u32(), u32());
    }

    JointId joint()
    {
        return new JointId(u32(), u32());
    }

    Material material()
    {
        return new Material(f32(), f32(), f32(), f32());
    }

    IndexTriple triangle()
    {
        return new IndexTriple(u32(), u32(), u32());
    }

    private void require(int n)
    {
        if (limit - pos < n) {
            throw new AppDecodeException(AppDropReason.INSUFFICIENT_DATA,
                    "Read of " + n + " bytes at offset " + pos + " exceeds packet end " + limit);
        }
    }
}
