package com.erdforge.core.graph;

/**
 * Position and size of a node on the canvas.
 *
 * @param x left coordinate
 * @param y top coordinate
 * @param width width
 * @param height height
 */
public record Bounds(double x, double y, double width, double height) {
}
