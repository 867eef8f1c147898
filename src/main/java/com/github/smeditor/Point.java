package com.github.smeditor;

/**
 * Immutable 2D point in diagram coordinates.
 */
public final class Point {
  private final double x;
  private final double y;

  private Point(final double x, final double y) {
    this.x = x;
    this.y = y;
  }

  public static Point of(final double x, final double y) {
    return new Point(x, y);
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Point)) {
      return false;
    }
    Point other = (Point) o;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + Double.hashCode(x);
    result = prime * result + Double.hashCode(y);
    return result;
  }

  @Override
  public String toString() {
    return "Point [x=" + x + ", y=" + y + "]";
  }
}
