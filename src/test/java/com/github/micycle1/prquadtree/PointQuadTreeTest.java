package com.github.micycle1.prquadtree;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import com.github.micycle1.prquadtree.PointQuadTree.Node;

public class PointQuadTreeTest {

	private PointQuadTree tree;

	@BeforeEach
	public void setUp() {
		// 100x100 square with its lower-left corner at the origin
		tree = new PointQuadTree(new AxisAlignedBox(50, 50, 50, 50));
	}

	@Test
	public void testInsertion() {
		assertTrue(tree.insert(new Point(10, 10)));
		assertEquals(1, tree.size());
		assertFalse(tree.isEmpty());
		assertEquals(List.of(new Point(10, 10)), tree.getRoot().getPoints());
	}

	@Test
	public void testOutOfBoundsInsertionLeavesTreeUnchanged() {
		for (int i = 0; i < 4; i++) {
			tree.insert(new Point(10 + i, 10 + i));
		}
		String before = tree.toDetailString();

		assertFalse(tree.insert(new Point(-10, -10)));
		assertFalse(tree.insert(new Point(150, 50)));
		assertFalse(tree.insert(new Point(50, 100.0001)));
		assertFalse(tree.insert(new Point(Math.nextDown(0.0), 50)));

		assertEquals(4, tree.size());
		assertFalse(tree.isSubdivided());
		assertEquals(before, tree.toDetailString());
	}

	@Test
	public void testBoundaryInclusivity() {
		// all four corners and the middle of all four edges lie on the boundary
		double[][] onEdge = { { 0, 0 }, { 100, 0 }, { 0, 100 }, { 100, 100 }, { 0, 50 }, { 100, 50 }, { 50, 0 }, { 50, 100 } };
		for (double[] c : onEdge) {
			assertTrue(tree.insert(new Point(c[0], c[1])), "Edge point must be accepted: " + c[0] + "," + c[1]);
		}
		assertEquals(onEdge.length, tree.size());
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 4, 16 })
	public void testSubdivisionTrigger(int capacity) {
		tree = new PointQuadTree(new AxisAlignedBox(50, 50, 50, 50), capacity);
		assertEquals(capacity, tree.capacity());

		for (int i = 0; i < capacity; i++) {
			assertTrue(tree.insert(new Point(1 + i, 1 + i)));
			assertFalse(tree.isSubdivided(), "Leaf must not split while within capacity");
		}
		assertEquals(capacity, tree.getRoot().getPointCount());

		assertTrue(tree.insert(new Point(99, 99)));
		assertTrue(tree.isSubdivided(), "Inserting capacity + 1 points must split the root");
		assertEquals(0, tree.getRoot().getPointCount());
		assertTrue(tree.getRoot().getPoints().isEmpty());
		assertEquals(capacity + 1, tree.size());
	}

	@Test
	public void testSubdividedNodeHasFourChildrenCoveringItsBoundary() {
		for (int i = 0; i < 5; i++) {
			tree.insert(new Point(10 * i + 5, 10 * i + 5));
		}
		Node root = tree.getRoot();
		assertTrue(root.isSubdivided());
		assertFalse(root.isLeaf());

		assertEquals(new AxisAlignedBox(75, 75, 25, 25), root.getChild(Quadrant.NE).getBoundary());
		assertEquals(new AxisAlignedBox(25, 75, 25, 25), root.getChild(Quadrant.NW).getBoundary());
		assertEquals(new AxisAlignedBox(75, 25, 25, 25), root.getChild(Quadrant.SE).getBoundary());
		assertEquals(new AxisAlignedBox(25, 25, 25, 25), root.getChild(Quadrant.SW).getBoundary());
		for (Quadrant q : Quadrant.values()) {
			assertEquals(tree.capacity(), root.getChild(q).capacity());
		}
	}

	@Test
	public void testChildrenAreNotRecreated() {
		for (int i = 0; i < 5; i++) {
			tree.insert(new Point(1 + i, 1 + i));
		}
		Node sw = tree.getRoot().getChild(Quadrant.SW);
		tree.insert(new Point(90, 90));
		tree.insert(new Point(10, 90));
		assertTrue(sw == tree.getRoot().getChild(Quadrant.SW));
	}

	@Test
	public void testSplitLineQuadrantOrder() {
		tree = new PointQuadTree(new AxisAlignedBox(0, 0, 10, 10));
		tree.insert(new Point(1, 1));
		tree.insert(new Point(-1, 1));
		tree.insert(new Point(1, -1));
		tree.insert(new Point(-1, -1));
		// the centre lies in all four quadrants
		tree.insert(new Point(0, 0));
		tree.insert(new Point(-5, 0));
		tree.insert(new Point(0, -5));

		Node root = tree.getRoot();
		assertTrue(root.getChild(Quadrant.NE).getPoints().contains(new Point(0, 0)));
		assertTrue(root.getChild(Quadrant.NW).getPoints().contains(new Point(-5, 0)));
		assertTrue(root.getChild(Quadrant.SE).getPoints().contains(new Point(0, -5)));
		assertEquals(List.of(new Point(-1, -1)), root.getChild(Quadrant.SW).getPoints());
	}

	@Test
	public void testLeafChildrenAreNull() {
		Node root = tree.getRoot();
		for (Quadrant q : Quadrant.values()) {
			assertNull(root.getChild(q));
		}
	}

	@Test
	public void testDuplicatesAreKept() {
		for (int i = 0; i < 3; i++) {
			assertTrue(tree.insert(new Point(20, 20, i)));
		}
		assertEquals(3, tree.size());
	}

	@Test
	public void testTooManyCoincidentPoints() {
		tree = new PointQuadTree(new AxisAlignedBox(50, 50, 50, 50), 2);
		tree.insert(new Point(20, 20, 1));
		tree.insert(new Point(20, 20, 2));
		assertThrows(IllegalStateException.class, () -> tree.insert(new Point(20, 20, 3)));
		assertFalse(tree.isSubdivided());
		assertEquals(2, tree.size());

		// a distinct point still splits the leaf
		assertTrue(tree.insert(new Point(80, 80)));
		assertTrue(tree.isSubdivided());
	}

	@Test
	public void testNearlyCoincidentPointsAreNeverLost() {
		Random rnd = new Random(17);
		for (int i = 0; i < 2_000; i++) {
			tree = new PointQuadTree(new AxisAlignedBox(50, 50, 50, 50), 1);
			double x = rnd.nextDouble() * 100;
			double y = rnd.nextDouble() * 100;
			Point first = new Point(x, y, 1);
			Point second = new Point(Math.nextUp(x), rnd.nextBoolean() ? y : Math.nextDown(y), 2);
			assertTrue(tree.insert(first));
			String before = tree.toDetailString();

			boolean inserted;
			try {
				inserted = tree.insert(second);
			} catch (IllegalStateException e) {
				// the pair could not be split apart: nothing may have changed
				assertEquals(before, tree.toDetailString());
				assertEquals(List.of(first), collectPoints(tree.getRoot()));
				continue;
			}
			assertTrue(inserted, "In-bounds point " + second + " was rejected");
			assertEquals(2, tree.size());
			List<Point> stored = collectPoints(tree.getRoot());
			assertTrue(stored.contains(first) && stored.contains(second), "Lost a point of " + first + ", " + second);
			checkNodeInvariants(tree.getRoot());
		}
	}

	@Test
	public void testInsertAll() {
		List<Point> points = List.of(new Point(10, 10), new Point(20, 20), new Point(-10, -10), new Point(5, 5), new Point(101, 0));
		assertEquals(3, tree.insertAll(points));
		assertEquals(3, tree.size());
	}

	@Test
	public void testDepthAndNodeCount() {
		assertEquals(0, tree.depth());
		assertEquals(1, tree.nodeCount());

		// five points inside the same leaf-sized corner force repeated splits
		for (int i = 0; i < 5; i++) {
			tree.insert(new Point(1 + i * 0.1, 1 + i * 0.1));
		}
		assertTrue(tree.depth() >= 2);
		assertEquals(1 + 4 * tree.depth(), tree.nodeCount());
	}

	@Test
	public void testInvariantsOnRandomData() {
		Random rnd = new Random(7);
		List<Point> inserted = new ArrayList<>();
		for (int i = 0; i < 2_000; i++) {
			Point p = new Point(rnd.nextDouble() * 120 - 10, rnd.nextDouble() * 120 - 10, i);
			boolean inside = p.getX() >= 0 && p.getX() <= 100 && p.getY() >= 0 && p.getY() <= 100;
			assertEquals(inside, tree.insert(p));
			if (inside) {
				inserted.add(p);
			}
		}
		assertEquals(inserted.size(), tree.size());
		checkNodeInvariants(tree.getRoot());
	}

	@Test
	public void testStructuralReadsDoNotMutate() {
		for (int i = 0; i < 20; i++) {
			tree.insert(new Point(i * 5, 100 - i * 5, i));
		}
		String first = tree.toDetailString();
		int size = tree.size();
		int depth = tree.depth();
		int nodes = tree.nodeCount();
		tree.printTree(System.out);

		assertEquals(first, tree.toDetailString());
		assertEquals(size, tree.size());
		assertEquals(depth, tree.depth());
		assertEquals(nodes, tree.nodeCount());
		assertTrue(tree.isSubdivided());
		assertEquals(0, tree.getRoot().getPointCount());
	}

	@Test
	public void testDetailString() {
		tree.insert(new Point(10, 10, 1.5));
		assertEquals("LEVEL 0:\nBoundary: (50.0, 50.0, 50.0, 50.0)\nPoints: (10.0, 10.0, 1.5) \n", tree.toDetailString());

		for (int i = 0; i < 4; i++) {
			tree.insert(new Point(90, 90 - i));
		}
		String detail = tree.toDetailString();
		assertTrue(detail.contains("LEVEL 1:\n- NE:\n    Boundary: (75.0, 75.0, 25.0, 25.0)\n"));
		assertTrue(detail.contains("- SW:\n    Boundary: (25.0, 25.0, 25.0, 25.0)\n    Points: (10.0, 10.0, 1.5) \n"));
	}

	@Test
	public void testIllegalArguments() {
		AxisAlignedBox box = new AxisAlignedBox(0, 0, 1, 1);
		assertThrows(IllegalArgumentException.class, () -> new PointQuadTree(box, 0));
		assertThrows(NullPointerException.class, () -> new PointQuadTree(null));
		assertThrows(NullPointerException.class, () -> tree.insert(null));
	}

	private static List<Point> collectPoints(Node node) {
		List<Point> points = new ArrayList<>(node.getPoints());
		if (node.isSubdivided()) {
			for (Quadrant q : Quadrant.values()) {
				points.addAll(collectPoints(node.getChild(q)));
			}
		}
		return points;
	}

	/**
	 * Recursively checks: leaves hold at most capacity points, all inside their
	 * boundary; split nodes hold no points and have exactly four children that
	 * lie inside the parent boundary.
	 */
	private void checkNodeInvariants(Node node) {
		assertNotNull(node.getBoundary());
		if (node.isLeaf()) {
			assertTrue(node.getPointCount() <= node.capacity());
			assertEquals(node.getPointCount(), node.getPoints().size());
			for (Point p : node.getPoints()) {
				assertTrue(node.getBoundary().contains(p), "Point " + p + " outside " + node.getBoundary());
			}
			return;
		}
		assertEquals(0, node.getPointCount());
		for (Quadrant q : Quadrant.values()) {
			Node child = node.getChild(q);
			assertNotNull(child);
			assertTrue(node.getBoundary().toEnvelope().covers(child.getBoundary().toEnvelope()));
			checkNodeInvariants(child);
		}
	}
}
