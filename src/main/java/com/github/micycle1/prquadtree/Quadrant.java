package com.github.micycle1.prquadtree;

/**
 * The four children of a subdivided node, declared in the order insertion
 * tries them: NE, NW, SE and then SW. The first quadrant whose boundary contains
 * the point receives it. The y axis grows northwards.
 */
public enum Quadrant {

	NE(1, 1), NW(-1, 1), SE(1, -1), SW(-1, -1);

	/** Positive for the eastern half, negative for the western. */
	final int signX;
	/** Positive for the northern half, negative for the southern. */
	final int signY;

	Quadrant(int signX, int signY) {
		this.signX = signX;
		this.signY = signY;
	}
}
