package com.hellblazer.armada;

import com.hellblazer.armada.world.Body;

import javax.vecmath.Point3f;
import javax.vecmath.Tuple3f;
import javax.vecmath.Vector3f;
import java.util.UUID;

/**
 * Mutable stand-in for the player craft.
 *
 * @author hal.hildebrand
 */
public class PlayerBody implements Body {

    private final UUID     id       = UUID.randomUUID();
    private final Point3f  position;
    private final Vector3f velocity = new Vector3f();
    private       float    health   = 100.0f;

    public PlayerBody(Tuple3f position) {
        this.position = new Point3f(position);
    }

    public PlayerBody(float x, float y, float z) {
        this(new Point3f(x, y, z));
    }

    @Override
    public UUID id() {
        return id;
    }

    @Override
    public Point3f position() {
        return position;
    }

    @Override
    public Vector3f velocity() {
        return velocity;
    }

    @Override
    public float health() {
        return health;
    }

    public PlayerBody moveTo(float x, float y, float z) {
        position.set(x, y, z);
        return this;
    }

    public PlayerBody withVelocity(float x, float y, float z) {
        velocity.set(x, y, z);
        return this;
    }

    public void setHealth(float health) {
        this.health = health;
    }
}
