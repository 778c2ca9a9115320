package com.questrail.remotephysics.protocol.app.model;

/**
 * Three vertex indices forming one triangle of a triangle mesh.
 */
public record IndexTriple(int p1, int p2, int p3)
{
}
