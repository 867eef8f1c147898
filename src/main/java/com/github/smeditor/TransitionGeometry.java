package com.github.smeditor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Routing of a transition: where it leaves its source, where it enters its target and the
 * ordered bend points in between.
 */
public final class TransitionGeometry {
  private final Point sourceAnchor;
  private final Point targetAnchor;
  private final List<Point> routePoints;

  public TransitionGeometry(final Point sourceAnchor, final Point targetAnchor,
      final List<Point> routePoints) {
    this.sourceAnchor = sourceAnchor;
    this.targetAnchor = targetAnchor;
    this.routePoints = routePoints == null ? Collections.<Point>emptyList()
        : Collections.unmodifiableList(new ArrayList<>(routePoints));
  }

  public Point getSourceAnchor() {
    return sourceAnchor;
  }

  public Point getTargetAnchor() {
    return targetAnchor;
  }

  public List<Point> getRoutePoints() {
    return routePoints;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof TransitionGeometry)) {
      return false;
    }
    TransitionGeometry other = (TransitionGeometry) o;
    return Objects.equals(sourceAnchor, other.sourceAnchor)
        && Objects.equals(targetAnchor, other.targetAnchor)
        && routePoints.equals(other.routePoints);
  }

  @Override
  public int hashCode() {
    return Objects.hash(sourceAnchor, targetAnchor, routePoints);
  }

  @Override
  public String toString() {
    return "TransitionGeometry [sourceAnchor=" + sourceAnchor + ", targetAnchor=" + targetAnchor
        + ", routePoints=" + routePoints + "]";
  }
}
