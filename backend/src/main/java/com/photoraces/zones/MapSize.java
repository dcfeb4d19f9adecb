package com.photoraces.zones;

import java.util.Objects;

/**
 * Viewport size in pixels, used only for zoom fitting.
 */
public final class MapSize {
    private final int width;
    private final int height;

    public MapSize(int width, int height) {
        this.width = width;
        this.height = height;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MapSize other)) {
            return false;
        }
        return width == other.width && height == other.height;
    }

    @Override
    public int hashCode() {
        return Objects.hash(width, height);
    }

    @Override
    public String toString() {
        return width + "x" + height;
    }
}
