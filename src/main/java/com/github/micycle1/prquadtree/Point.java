package com.github.micycle1.prquadtree;

import org.locationtech.jts.geom.Coordinate;

/**
 * An immutable 2D point carrying a scalar payload.
 * <p>
 * Equality and ordering are defined on the coordinates only; the payload is
 * carried alongside and never compared. As with {@link Double#equals(Object)},
 * {@code -0.0} and {@code 0.0} are distinct values under {@link #equals2D};
 * use {@link #coincides(Point)} for the numeric test.
 *
 * @author Michael Carleton
 */
public final class Point implements Comparable<Point> {

	/**
	 * The all-zero point used to pad unfilled nearest-neighbour slots.
	 */
	public static final Point SENTINEL = new Point(0, 0, 0);

	private final double x;
	private final double y;
	private final double payload;

	public Point(double x, double y) {
		this(x, y, 0);
	}

	public Point(double x, double y, double payload) {
		this.x = x;
		this.y = y;
		this.payload = payload;
	}

	public double getX() {
		return x;
	}

	public double getY() {
		return y;
	}

	public double getPayload() {
		return payload;
	}

	/**
	 * Squared Euclidean distance to another point. No square root is taken, so
	 * the result is only meaningful for comparisons against other squared
	 * distances.
	 */
	public double distanceSq(Point other) {
		double dx = x - other.x;
		double dy = y - other.y;
		return dx * dx + dy * dy;
	}

	/**
	 * @return true if both points share the same coordinates, ignoring payload.
	 *         Consistent with {@link #compareTo(Point)} and {@link #hashCode()}.
	 */
	public boolean equals2D(Point other) {
		return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
	}

	/**
	 * Numeric coordinate equality: true if both points occupy the same location
	 * in the plane, so {@code -0.0} and {@code 0.0} coincide. A point with a NaN
	 * coordinate coincides with nothing.
	 */
	public boolean coincides(Point other) {
		return x == other.x && y == other.y;
	}

	public Coordinate toCoordinate() {
		return new Coordinate(x, y);
	}

	@Override
	public int compareTo(Point other) {
		int c = Double.compare(x, other.x);
		if (c != 0) {
			return c;
		}
		return Double.compare(y, other.y);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Point)) {
			return false;
		}
		return equals2D((Point) o);
	}

	@Override
	public int hashCode() {
		// same scheme as JTS Coordinate#hashCode
		int result = 17;
		result = 37 * result + Coordinate.hashCode(x);
		result = 37 * result + Coordinate.hashCode(y);
		return result;
	}

	@Override
	public String toString() {
		return "(" + x + ", " + y + ", " + payload + ")";
	}
}
