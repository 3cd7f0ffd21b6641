package com.discordsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * The most anomalous window found by a search: its start position and the
 * distance to its nearest non-overlapping neighbour.
 *
 * <p>
 * Immutable.
 * </p>
 *
 * @since 1.0.0
 */
public final class Discord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final int position;
    private final double distance;

    /**
     * @param position start position of the discord window, {@code >= 0}
     * @param distance nearest-neighbour distance, {@code >= 0}
     */
    public Discord(int position, double distance) {
        if (position < 0) {
            throw new IllegalArgumentException("position must be >= 0, got: " + position);
        }
        this.position = position;
        this.distance = distance;
    }

    /**
     * @param offset amount added to the position
     * @return a discord at {@code position + offset} with the same distance
     */
    public Discord withOffset(int offset) {
        return offset == 0 ? this : new Discord(position + offset, distance);
    }

    public int getPosition() {
        return position;
    }

    public double getDistance() {
        return distance;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Discord that))
            return false;
        return position == that.position && Double.compare(distance, that.distance) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(position, distance);
    }

    @Override
    public String toString() {
        return "Discord{position=" + position + ", distance=" + distance + '}';
    }
}
