package com.github.micycle1.prquadtree;

import org.locationtech.jts.geom.Envelope;

/**
 * An immutable axis-aligned rectangle in centre form: a centre point plus half
 * the width and half the height. Containment and intersection are evaluated on
 * an equivalent JTS {@link Envelope}, which is inclusive on all four edges.
 */
public final class AxisAlignedBox {

	private final double cx;
	private final double cy;
	private final double halfWidth;
	private final double halfHeight;
	private final Envelope env;

	public AxisAlignedBox(double cx, double cy, double halfWidth, double halfHeight) {
		if (halfWidth < 0 || halfHeight < 0) {
			throw new IllegalArgumentException("Half extents must be non-negative: " + halfWidth + ", " + halfHeight);
		}
		this.cx = cx;
		this.cy = cy;
		this.halfWidth = halfWidth;
		this.halfHeight = halfHeight;
		this.env = new Envelope(cx - halfWidth, cx + halfWidth, cy - halfHeight, cy + halfHeight);
	}

	/**
	 * Builds a box whose edges are exactly those of the given envelope.
	 */
	private AxisAlignedBox(Envelope env) {
		this.env = env;
		this.cx = midpoint(env.getMinX(), env.getMaxX());
		this.cy = midpoint(env.getMinY(), env.getMaxY());
		this.halfWidth = (env.getMaxX() - env.getMinX()) / 2;
		this.halfHeight = (env.getMaxY() - env.getMinY()) / 2;
	}

	private static double midpoint(double min, double max) {
		double mid = (min + max) / 2;
		if (Double.isInfinite(mid)) {
			mid = min / 2 + max / 2;
		}
		return mid;
	}

	public double getCenterX() {
		return cx;
	}

	public double getCenterY() {
		return cy;
	}

	public double getHalfWidth() {
		return halfWidth;
	}

	public double getHalfHeight() {
		return halfHeight;
	}

	/**
	 * Inclusive containment: a point lying exactly on any edge is contained.
	 */
	public boolean contains(Point p) {
		return env.covers(p.getX(), p.getY());
	}

	/**
	 * Separating-axis overlap test. Boxes that only touch along an edge or at a
	 * corner intersect.
	 */
	public boolean intersects(AxisAlignedBox other) {
		return env.intersects(other.env);
	}

	/**
	 * Returns the squared distance from the query point to the nearest point of
	 * this box, or zero if the box contains it. This is a lower bound on the
	 * squared distance to any point stored inside the box.
	 */
	public double squaredDistanceTo(Point p) {
		double qx = p.getX();
		double qy = p.getY();
		double dx = 0.0;
		if (qx < env.getMinX()) {
			dx = env.getMinX() - qx;
		} else if (qx > env.getMaxX()) {
			dx = qx - env.getMaxX();
		}
		double dy = 0.0;
		if (qy < env.getMinY()) {
			dy = env.getMinY() - qy;
		} else if (qy > env.getMaxY()) {
			dy = qy - env.getMaxY();
		}
		return dx * dx + dy * dy;
	}

	/**
	 * Computes the boundary of one quarter of this box. Each quarter takes its
	 * edges from this box's edges and centre lines, so the four quarters share
	 * edges exactly and together cover this box without gaps, however small the
	 * box gets.
	 * <p>
	 * Once the box is too narrow for its centre line to fall strictly between
	 * its edges, a quarter can equal the box itself; see
	 * {@link #hasSameExtent(AxisAlignedBox)}.
	 */
	public AxisAlignedBox quadrant(Quadrant quadrant) {
		double minX = quadrant.signX > 0 ? cx : env.getMinX();
		double maxX = quadrant.signX > 0 ? env.getMaxX() : cx;
		double minY = quadrant.signY > 0 ? cy : env.getMinY();
		double maxY = quadrant.signY > 0 ? env.getMaxY() : cy;
		return new AxisAlignedBox(new Envelope(minX, maxX, minY, maxY));
	}

	/**
	 * @return true if both boxes have exactly the same four edges.
	 */
	public boolean hasSameExtent(AxisAlignedBox other) {
		return env.equals(other.env);
	}

	/**
	 * @return a copy of this box in JTS min/max form.
	 */
	public Envelope toEnvelope() {
		return new Envelope(env);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AxisAlignedBox)) {
			return false;
		}
		AxisAlignedBox other = (AxisAlignedBox) o;
		return Double.compare(cx, other.cx) == 0 && Double.compare(cy, other.cy) == 0 && Double.compare(halfWidth, other.halfWidth) == 0
				&& Double.compare(halfHeight, other.halfHeight) == 0;
	}

	@Override
	public int hashCode() {
		return env.hashCode();
	}

	@Override
	public String toString() {
		return "(" + cx + ", " + cy + ", " + halfWidth + ", " + halfHeight + ")";
	}
}
