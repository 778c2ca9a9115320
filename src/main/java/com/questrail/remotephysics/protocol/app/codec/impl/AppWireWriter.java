package com.questrail.remotephysics.protocol.app.codec.impl;

import com.questrail.remotephysics.api.Quaternion;
import com.questrail.remotephysics.api.Vector3;
import com.questrail.remotephysics.protocol.app.model.ActorId;
import com.questrail.remotephysics.protocol.app.model.IndexTriple;
import com.questrail.remotephysics.protocol.app.model.JointId;
import com.questrail.remotephysics.protocol.app.model.Material;
import com.questrail.remotephysics.protocol.app.model.ShapeId;

/**
 * Sequential writer over a message buffer allocated at its exact encoded size.
 */
final class AppWireWriter
{
    private final byte[] buf;
    private int pos;

    AppWireWriter(int size)
    {
        this.buf = new byte[size];
    }

    AppWireWriter u16(int value)
    {
        AppWireFormat.putU16(buf, pos, value);
        pos += 2;
        return this;
    }

    AppWireWriter u32(int value)
    {
        AppWireFormat.putU32(buf, pos, value);
        pos += 4;
        return this;
    }

    AppWireWriter f32(float value)
    {
        AppWireFormat.putF32(buf, pos, value);
        pos += 4;
        return this;
    }

    AppWireWriter fixedString(int width, String value)
    {
        AppWireFormat.putFixedString(buf, pos, width, value);
        pos += width;
        return this;
    }

    AppWireWriter vector(Vector3 v)
    {
        return f32(v.x()).f32(v.y()).f32(v.z());
    }

    AppWireWriter quaternion(Quaternion q)
    {
        return f32(q.x()).f32(q.y()).f32(q.z()).f32(q.w());
    }

    AppWireWriter actor(ActorId id)
    {
        return u32(id.simulationId()).u32(id.actorId());
    }

    AppWireWriter shape(ShapeId id)
    {
        return u32(id.simulationId()).u32(id.shapeId());
    }

    AppWireWriter joint(JointId id)
    {
        return u32(id.simulationId()).u32(id.jointId());
    }

    AppWireWriter material(Material m)
    {
        return f32(m.density()).f32(m.staticFriction()).f32(m.kineticFriction()).f32(m.restitution());
    }

    AppWireWriter triangle(IndexTriple t)
    {
        return u32(t.p1()).u32(t.p2()).u32(t.p3());
    }

    int position()
    {
        return pos;
    }

    byte[] array()
    {
        return buf;
    }
}
