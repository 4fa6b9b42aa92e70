package com.github.micycle1.prquadtree;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.PriorityQueue;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.github.micycle1.prquadtree.PointQuadTree.Node;

/**
 * Exact k-nearest-neighbour search by best-first branch-and-bound.
 * <p>
 * Nodes are visited in increasing order of their lower-bound distance to the
 * target (zero if the target lies within the node boundary). The best
 * {@code k} points seen so far are kept in a max-heap, so the current k-th
 * distance is always at its head; once the next node's lower bound exceeds it,
 * no unvisited node can improve the result and the search stops. All
 * distances are squared.
 * <p>
 * Equal distances are resolved in visiting order: equal-bound nodes are
 * expanded in the order they were queued, and a full candidate heap admits
 * only strictly closer points, so the first of several equidistant points
 * wins. This is a property of this implementation, not of the query.
 */
public final class NearestNeighborSearch {

	private static final Logger LOGGER = LoggerFactory.getLogger(NearestNeighborSearch.class);

	private NearestNeighborSearch() {
	}

	/**
	 * Finds the {@code k} points in the subtree of {@code root} closest to
	 * {@code target}, closest first, excluding points that coincide with the
	 * target. Missing results are padded with {@link Point#SENTINEL}.
	 *
	 * @param root   the node whose subtree is searched.
	 * @param target the query point.
	 * @param k      the number of neighbours; zero yields an empty list.
	 * @return a list of exactly {@code k} points.
	 */
	public static List<Point> search(Node root, Point target, int k) {
		return search(root, target, k, Double.POSITIVE_INFINITY).getNeighbors();
	}

	/**
	 * As {@link #search(Node, Point, int)}, but the pruning radius starts at
	 * {@code maxDistSq} rather than infinity: points farther than that from the
	 * target are never reported, and nodes wholly beyond it are never visited.
	 *
	 * @param maxDistSq initial squared search radius, inclusive.
	 * @return the neighbours, and the squared distance of the k-th one if
	 *         {@code k} were found, otherwise {@code maxDistSq}.
	 */
	public static Result search(Node root, Point target, int k, double maxDistSq) {
		Objects.requireNonNull(root, "root");
		Objects.requireNonNull(target, "target");
		if (k < 0) {
			throw new IllegalArgumentException("k must be non-negative, was " + k);
		}
		if (Double.isNaN(maxDistSq) || maxDistSq < 0) {
			throw new IllegalArgumentException("Search radius must be non-negative, was " + maxDistSq);
		}
		if (k == 0) {
			return new Result(new ArrayList<>(), maxDistSq);
		}

		PriorityQueue<SearchItem> queue = new PriorityQueue<>();
		PriorityQueue<Candidate> best = new PriorityQueue<>(k, Comparator.reverseOrder());
		double currentMaxDist = maxDistSq;
		long seq = 0;
		int nodesVisited = 0;
		int pointsExamined = 0;

		queue.offer(new SearchItem(root, root.boundary.squaredDistanceTo(target), seq++));

		while (!queue.isEmpty()) {
			SearchItem item = queue.poll();
			if (item.lowerBoundSq > currentMaxDist) {
				break;
			}
			nodesVisited++;
			Node node = item.node;

			for (int i = 0; i < node.count; i++) {
				Point p = node.points[i];
				if (p.coincides(target)) {
					continue; // a point is not its own neighbour
				}
				pointsExamined++;
				double d = p.distanceSq(target);
				if (best.size() < k) {
					if (d > currentMaxDist) {
						continue;
					}
					best.offer(new Candidate(p, d, seq++));
				} else if (d < best.peek().distSq) {
					best.poll();
					best.offer(new Candidate(p, d, seq++));
				} else {
					continue;
				}
				if (best.size() == k) {
					currentMaxDist = best.peek().distSq;
				}
			}

			if (node.subdivided) {
				for (Node child : node.children.values()) {
					double bound = child.boundary.squaredDistanceTo(target);
					if (bound <= currentMaxDist) {
						queue.offer(new SearchItem(child, bound, seq++));
					}
				}
			}
		}

		Point[] result = new Point[k];
		Arrays.fill(result, Point.SENTINEL);
		// the max-heap drains farthest first
		for (int i = best.size() - 1; i >= 0; i--) {
			result[i] = best.poll().point;
		}

		LOGGER.debug("knn k={} target={} visited {} nodes, examined {} points", k, target, nodesVisited, pointsExamined);
		return new Result(new ArrayList<>(Arrays.asList(result)), currentMaxDist);
	}

	/**
	 * Outcome of a radius-bounded search.
	 */
	public static final class Result {
		private final List<Point> neighbors;
		private final double maxDistSq;

		Result(List<Point> neighbors, double maxDistSq) {
			this.neighbors = neighbors;
			this.maxDistSq = maxDistSq;
		}

		/**
		 * @return exactly {@code k} points, closest first, padded with
		 *         {@link Point#SENTINEL}.
		 */
		public List<Point> getNeighbors() {
			return neighbors;
		}

		/**
		 * @return the squared distance of the k-th neighbour, or the initial
		 *         radius if fewer than {@code k} neighbours were found.
		 */
		public double getMaxDistSq() {
			return maxDistSq;
		}
	}

	/**
	 * A queued node together with the lower bound of its distance to the target.
	 */
	private static class SearchItem implements Comparable<SearchItem> {
		final Node node;
		final double lowerBoundSq;
		final long seq;

		SearchItem(Node node, double lowerBoundSq, long seq) {
			this.node = node;
			this.lowerBoundSq = lowerBoundSq;
			this.seq = seq;
		}

		@Override
		public int compareTo(SearchItem other) {
			int c = Double.compare(lowerBoundSq, other.lowerBoundSq);
			return c != 0 ? c : Long.compare(seq, other.seq);
		}
	}

	private static class Candidate implements Comparable<Candidate> {
		final Point point;
		final double distSq;
		final long seq;

		Candidate(Point point, double distSq, long seq) {
			this.point = point;
			this.distSq = distSq;
			this.seq = seq;
		}

		@Override
		public int compareTo(Candidate other) {
			int c = Double.compare(distSq, other.distSq);
			return c != 0 ? c : Long.compare(seq, other.seq);
		}
	}
}
