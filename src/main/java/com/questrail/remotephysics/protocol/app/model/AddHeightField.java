package com.questrail.remotephysics.protocol.app.model;

import java.util.Arrays;
import java.util.Objects;

/**
 * Regular grid of height posts.
 *
 * <p>{@code posts} holds exactly {@code rows * columns} heights in row-major
 * order. Rows and columns are unsigned on the wire but are restricted to
 * non-negative values here. The array is copied on the way in and on the
 * way out.</p>
 */
public record AddHeightField(
        ShapeId shape,
        int rows,
        int columns,
        float rowSpacing,
        float columnSpacing,
        float[] posts
) implements AppMessage
{
    public AddHeightField {
        Objects.requireNonNull(shape, "shape");
        Objects.requireNonNull(posts, "posts");
        if (rows < 0 || columns < 0) {
            throw new IllegalArgumentException("rows and columns must be non-negative");
        }
        if ((long) rows * columns != posts.length) {
            throw new IllegalArgumentException(
                    "Expected " + ((long) rows * columns) + " posts for " + rows + "x" + columns
                            + " height field, got " + posts.length);
        }
        posts = posts.clone();
    }

    @Override
    public float[] posts() {
        return posts.clone();
    }

    public int postCount() {
        return posts.length;
    }

    /** Height at (row, column) without copying the post array. */
    public float post(int row, int column) {
        return posts[row * columns + column];
    }

    @Override
    public AppMessageType type() {
        return AppMessageType.ADD_HEIGHT_FIELD;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof AddHeightField)) {
            return false;
        }
        AddHeightField other = (AddHeightField) o;
        return rows == other.rows
                && columns == other.columns
                && Float.compare(rowSpacing, other.rowSpacing) == 0
                && Float.compare(columnSpacing, other.columnSpacing) == 0
                && shape.equals(other.shape)
                && Arrays.equals(posts, other.posts);
    }

    @Override
    public int hashCode() {
        int result = Objects.hash(shape, rows, columns, rowSpacing, columnSpacing);
        return 31 * result + Arrays.hashCode(posts);
    }

    @Override
    public String toString() {
        return "AddHeightField[shape=" + shape + ", rows=" + rows + ", columns=" + columns
                + ", rowSpacing=" + rowSpacing + ", columnSpacing=" + columnSpacing
                + ", posts=" + posts.length + "]";
    }
}
