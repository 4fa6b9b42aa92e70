package com.github.micycle1.prquadtree;

import java.io.PrintStream;
import java.util.Arrays;
import java.util.EnumMap;
import java.util.List;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Point-region quadtree over a fixed planar boundary.
 * <p>
 * Each leaf stores up to {@link #capacity()} points in a fixed-size buffer.
 * The first insertion into a full leaf splits it into four equal quadrants and
 * pushes its points down; a split node never stores points again. Points are
 * never removed.
 * <p>
 * Not thread-safe.
 *
 * @author Michael Carleton
 */
public class PointQuadTree {

	private static final Logger LOGGER = LoggerFactory.getLogger(PointQuadTree.class);

	/** Per-node point capacity used when none is given. */
	public static final int DEFAULT_CAPACITY = 4;

	final Node root;
	private final int capacity;

	public PointQuadTree(AxisAlignedBox boundary) {
		this(boundary, DEFAULT_CAPACITY);
	}

	/**
	 * @param boundary the region covered by the tree; points outside it are
	 *                 rejected.
	 * @param capacity the number of points a leaf holds before it subdivides.
	 */
	public PointQuadTree(AxisAlignedBox boundary, int capacity) {
		Objects.requireNonNull(boundary, "boundary");
		if (capacity < 1) {
			throw new IllegalArgumentException("Node capacity must be at least 1, was " + capacity);
		}
		this.capacity = capacity;
		this.root = new Node(boundary, capacity);
	}

	/**
	 * Inserts a point.
	 *
	 * @param point the point to insert.
	 * @return false, leaving the tree untouched, if the point lies outside the
	 *         tree boundary; true otherwise.
	 * @throws IllegalStateException if the point would be the
	 *                               {@code capacity + 1}-th point in one leaf
	 *                               that no split can separate: points at the
	 *                               same coordinates, or so close that the
	 *                               quadrants holding them cannot shrink any
	 *                               further. The tree is left unchanged.
	 */
	public boolean insert(Point point) {
		Objects.requireNonNull(point, "point");
		boolean inserted = root.insert(point);
		if (!inserted) {
			LOGGER.trace("Rejected {} outside boundary {}", point, root.boundary);
		}
		return inserted;
	}

	/**
	 * Inserts every point of the given collection.
	 *
	 * @return the number of points that were accepted.
	 */
	public int insertAll(Iterable<Point> points) {
		int accepted = 0;
		for (Point p : points) {
			if (insert(p)) {
				accepted++;
			}
		}
		return accepted;
	}

	/**
	 * Finds the {@code k} stored points closest to {@code target}, closest
	 * first. A stored point with the same coordinates as the target is never
	 * reported. When fewer than {@code k} such points exist the remaining slots
	 * hold {@link Point#SENTINEL}.
	 *
	 * @param target the query point; it need not lie inside the boundary.
	 * @param k      number of neighbours to return.
	 * @return a list of exactly {@code k} points.
	 */
	public List<Point> knn(Point target, int k) {
		return NearestNeighborSearch.search(root, target, k);
	}

	/**
	 * Radius-bounded form of {@link #knn(Point, int)}: only points within
	 * squared distance {@code maxDistSq} of the target are considered.
	 *
	 * @param maxDistSq initial squared search radius (inclusive); pass
	 *                  {@link Double#POSITIVE_INFINITY} for no limit.
	 * @return the neighbours together with the squared distance of the k-th one,
	 *         or {@code maxDistSq} unchanged if fewer than {@code k} were found.
	 */
	public NearestNeighborSearch.Result knn(Point target, int k, double maxDistSq) {
		return NearestNeighborSearch.search(root, target, k, maxDistSq);
	}

	/**
	 * Fixed-buffer form of {@link #knn(Point, int)}: {@code k} is the length of
	 * {@code nearest}, which receives the result.
	 */
	public void nearestNeighbors(Point target, Point[] nearest) {
		nearestNeighbors(target, nearest, Double.POSITIVE_INFINITY);
	}

	/**
	 * Fixed-buffer form of {@link #knn(Point, int, double)}.
	 *
	 * @param maxDistSq initial squared search radius.
	 * @return the squared distance of the {@code nearest.length}-th neighbour,
	 *         or {@code maxDistSq} if the buffer could not be filled.
	 */
	public double nearestNeighbors(Point target, Point[] nearest, double maxDistSq) {
		NearestNeighborSearch.Result result = knn(target, nearest.length, maxDistSq);
		List<Point> neighbors = result.getNeighbors();
		for (int i = 0; i < nearest.length; i++) {
			nearest[i] = neighbors.get(i);
		}
		return result.getMaxDistSq();
	}

	public boolean isSubdivided() {
		return root.subdivided;
	}

	public int capacity() {
		return capacity;
	}

	public AxisAlignedBox getBoundary() {
		return root.boundary;
	}

	public Node getRoot() {
		return root;
	}

	/**
	 * @return the number of points stored in the whole tree.
	 */
	public int size() {
		return root.size();
	}

	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * @return the length of the longest root-to-leaf path; 0 for a single leaf.
	 */
	public int depth() {
		return root.depth();
	}

	public int nodeCount() {
		return root.nodeCount();
	}

	/**
	 * Renders the tree as indented text, four spaces per level. For debugging.
	 */
	public String toDetailString() {
		StringBuilder sb = new StringBuilder();
		sb.append("LEVEL 0:\n");
		root.appendTo(sb, 0);
		return sb.toString();
	}

	public void printTree(PrintStream out) {
		out.print(toDetailString());
	}

	/**
	 * A node of the tree: a leaf holding up to {@code capacity} points, or a
	 * subdivided node owning exactly four children.
	 */
	public static class Node {

		final AxisAlignedBox boundary;
		final Point[] points;
		int count;
		boolean subdivided;
		final EnumMap<Quadrant, Node> children;

		Node(AxisAlignedBox boundary, int capacity) {
			this.boundary = boundary;
			this.points = new Point[capacity];
			this.count = 0;
			this.subdivided = false;
			this.children = new EnumMap<>(Quadrant.class);
		}

		boolean insert(Point point) {
			if (!boundary.contains(point)) {
				return false;
			}

			if (!subdivided && count < points.length) {
				points[count++] = point;
				return true;
			}

			if (!subdivided) {
				checkSplitSeparates(point);
				subdivide();
			}

			if (!insertIntoChildren(point)) {
				throw outsideQuadrants(point, boundary);
			}
			return true;
		}

		private boolean insertIntoChildren(Point point) {
			for (Node child : children.values()) { // EnumMap iterates in declaration order
				if (child.insert(point)) {
					return true;
				}
			}
			return false;
		}

		/**
		 * Follows the full buffer plus {@code point} down the chain of quadrants
		 * they would all fall into together, without changing the node. Fails if
		 * that chain reaches a quadrant as large as its parent, since no number of
		 * splits could then bring the points below capacity.
		 */
		private void checkSplitSeparates(Point point) {
			if (allCoincideWith(point)) {
				throw tooManyPointsAt(point);
			}
			AxisAlignedBox box = boundary;
			while (true) {
				Quadrant shared = quadrantOf(box, point);
				for (int i = 0; i < count; i++) {
					if (quadrantOf(box, points[i]) != shared) {
						return;
					}
				}
				AxisAlignedBox next = box.quadrant(shared);
				if (next.hasSameExtent(box)) {
					throw tooManyPointsAt(point);
				}
				box = next;
			}
		}

		private static Quadrant quadrantOf(AxisAlignedBox box, Point point) {
			for (Quadrant q : Quadrant.values()) {
				if (box.quadrant(q).contains(point)) {
					return q;
				}
			}
			throw outsideQuadrants(point, box);
		}

		private boolean allCoincideWith(Point point) {
			for (int i = 0; i < count; i++) {
				if (!points[i].coincides(point)) {
					return false;
				}
			}
			return true;
		}

		private IllegalStateException tooManyPointsAt(Point point) {
			return new IllegalStateException("Cannot store more than " + points.length + " points at or next to " + point.toCoordinate()
					+ ", try a larger node capacity");
		}

		private static IllegalStateException outsideQuadrants(Point point, AxisAlignedBox box) {
			return new IllegalStateException("Point " + point + " lies in " + box + " but in none of its quadrants");
		}

		/**
		 * Splits this leaf into four quadrants and moves its points into them.
		 */
		private void subdivide() {
			if (count == 0) {
				return;
			}
			for (Quadrant q : Quadrant.values()) {
				children.put(q, new Node(boundary.quadrant(q), points.length));
			}
			for (int i = 0; i < count; i++) {
				if (!insertIntoChildren(points[i])) {
					throw outsideQuadrants(points[i], boundary);
				}
				points[i] = null;
			}
			LOGGER.debug("Subdivided node {} and redistributed {} points", boundary, count);
			count = 0;
			subdivided = true;
		}

		int size() {
			if (!subdivided) {
				return count;
			}
			int total = 0;
			for (Node child : children.values()) {
				total += child.size();
			}
			return total;
		}

		int depth() {
			if (!subdivided) {
				return 0;
			}
			int max = 0;
			for (Node child : children.values()) {
				max = Math.max(max, child.depth());
			}
			return max + 1;
		}

		int nodeCount() {
			int n = 1;
			for (Node child : children.values()) {
				n += child.nodeCount();
			}
			return n;
		}

		void appendTo(StringBuilder sb, int depth) {
			String indent = "    ".repeat(depth);
			sb.append(indent).append("Boundary: ").append(boundary).append('\n');
			sb.append(indent).append("Points: ");
			for (int i = 0; i < count; i++) {
				sb.append(points[i]).append(' ');
			}
			sb.append('\n');

			if (subdivided) {
				sb.append(indent).append("LEVEL ").append(depth + 1).append(":\n");
				for (var e : children.entrySet()) {
					sb.append(indent).append("- ").append(e.getKey()).append(":\n");
					e.getValue().appendTo(sb, depth + 1);
				}
			}
		}

		public AxisAlignedBox getBoundary() {
			return boundary;
		}

		/**
		 * @return the number of points stored directly in this node; always 0 once
		 *         subdivided.
		 */
		public int getPointCount() {
			return count;
		}

		/**
		 * @return a copy of the points stored directly in this node.
		 */
		public List<Point> getPoints() {
			return List.of(Arrays.copyOf(points, count));
		}

		public boolean isLeaf() {
			return !subdivided;
		}

		public boolean isSubdivided() {
			return subdivided;
		}

		/**
		 * @return the child for the quadrant, or null if this node is a leaf.
		 */
		public Node getChild(Quadrant quadrant) {
			return children.get(quadrant);
		}

		public int capacity() {
			return points.length;
		}
	}
}
