package mathedit.selection;

import java.util.Objects;

public class Rect {
  public final double left;
  public final double top;
  public final double right;
  public final double bottom;

  public Rect(double left, double top, double right, double bottom) {
    this.left = left;
    this.top = top;
    this.right = right;
    this.bottom = bottom;
  }

  public static Rect of(double left, double top, double width, double height) {
    return new Rect(left, top, left + width, top + height);
  }

  public boolean contains(Point p) {
    return p.x >= left && p.x < right && p.y >= top && p.y < bottom;
  }

  public Rect inflate(double delta) {
    return new Rect(left - delta, top - delta, right + delta, bottom + delta);
  }

  public double centerX() {
    return (left + right) / 2;
  }

  public double distanceTo(Point p) {
    double dx = 0;
    double dy = 0;
    if (p.x < left) {
      dx = left - p.x;
    }
    else if (p.x > right) {
      dx = p.x - right;
    }
    if (p.y < top) {
      dy = top - p.y;
    }
    else if (p.y > bottom) {
      dy = p.y - bottom;
    }
    return Math.sqrt(dx * dx + dy * dy);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    Rect rect = (Rect)o;
    return Double.compare(rect.left, left) == 0 &&
           Double.compare(rect.top, top) == 0 &&
           Double.compare(rect.right, right) == 0 &&
           Double.compare(rect.bottom, bottom) == 0;
  }

  @Override
  public int hashCode() {
    return Objects.hash(left, top, right, bottom);
  }

  @Override
  public String toString() {
    return "Rect{" +
           "left=" + left +
           ", top=" + top +
           ", right=" + right +
           ", bottom=" + bottom +
           '}';
  }
}
