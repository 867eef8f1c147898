package com.github.smeditor;

/**
 * Immutable rectangle: top-left position plus size.
 */
public final class Rect {
  private final double x;
  private final double y;
  private final double width;
  private final double height;

  private Rect(final double x, final double y, final double width, final double height) {
    this.x = x;
    this.y = y;
    this.width = width;
    this.height = height;
  }

  public static Rect of(final double x, final double y, final double width,
      final double height) {
    return new Rect(x, y, width, height);
  }

  public double getX() {
    return x;
  }

  public double getY() {
    return y;
  }

  public double getWidth() {
    return width;
  }

  public double getHeight() {
    return height;
  }

  public Point getPosition() {
    return Point.of(x, y);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Rect)) {
      return false;
    }
    Rect other = (Rect) o;
    return Double.compare(x, other.x) == 0 && Double.compare(y, other.y) == 0
        && Double.compare(width, other.width) == 0 && Double.compare(height, other.height) == 0;
  }

  @Override
  public int hashCode() {
    final int prime = 31;
    int result = 1;
    result = prime * result + Double.hashCode(x);
    result = prime * result + Double.hashCode(y);
    result = prime * result + Double.hashCode(width);
    result = prime * result + Double.hashCode(height);
    return result;
  }

  @Override
  public String toString() {
    return "Rect [x=" + x + ", y=" + y + ", width=" + width + ", height=" + height + "]";
  }
}
