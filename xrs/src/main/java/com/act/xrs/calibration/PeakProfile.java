/*************************************************************************
*                                                                        *
*  This file is part of the 20n/act project.                             *
*  20n/act enables DNA prediction for synthetic biology/bioengineering.  *
*  Copyright (C) 2017 20n Labs, Inc.                                     *
*                                                                        *
*  Please direct all queries to act@20n.com.                             *
*                                                                        *
*  This program is free software: you can redistribute it and/or modify  *
*  it under the terms of the GNU General Public License as published by  *
*  the Free Software Foundation, either version 3 of the License, or     *
*  (at your option) any later version.                                   *
*                                                                        *
*  This program is distributed in the hope that it will be useful,       *
*  but WITHOUT ANY WARRANTY; without even the implied warranty of        *
*  MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the         *
*  GNU General Public License for more details.                          *
*                                                                        *
*  You should have received a copy of the GNU General Public License     *
*  along with this program.  If not, see <http://www.gnu.org/licenses/>. *
*                                                                        *
*************************************************************************/

package com.act.xrs.calibration;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Numeric helpers for sampled peak curves y(x): trapezoid areas, first moments and full width at half maximum.
 */
public final class PeakProfile {
  private PeakProfile() {
  }

  /**
   * Integrates y over x with the trapezoid rule.  The abscissa may be ascending or descending; a descending axis
   * yields the negated area, exactly as integrating backwards would.
   */
  public static double trapezoid(double[] x, double[] y) {
    checkLengths(x, y);
    double area = 0.0;
    for (int i = 1; i < x.length; i++) {
      area += 0.5 * (y[i] + y[i - 1]) * (x[i] - x[i - 1]);
    }
    return area;
  }

  /**
   * Computes the intensity weighted mean position {@code ∫x·y dx / ∫y dx} over the full sampled range.
   * @return The centroid, or null if the curve has zero area.
   */
  public static Double centroid(double[] x, double[] y) {
    double denominator = trapezoid(x, y);
    if (denominator == 0.0) {
      return null;
    }
    double[] weighted = new double[x.length];
    for (int i = 0; i < x.length; i++) {
      weighted[i] = x[i] * y[i];
    }
    return trapezoid(x, weighted) / denominator;
  }

  /**
   * Return the position of the (first) maximum of y.
   */
  public static double peakPosition(double[] x, double[] y) {
    checkLengths(x, y);
    return x[indexOfMax(y)];
  }

  /**
   * Estimates the full width at half maximum of y(x).  Starting from the maximum, the curve is followed outwards on
   * each side until it drops to half the peak value; the crossing position is linearly interpolated between the two
   * samples that bracket it.
   *
   * @return The width in units of x, or null if the curve does not fall to half maximum on both sides of the peak
   * (flat, monotonic or non-positive data).
   */
  public static Double fwhm(double[] x, double[] y) {
    checkLengths(x, y);
    if (x.length < 3) {
      return null;
    }

    // Work on an ascending copy so that "left" and "right" mean lower and higher x.
    Integer[] order = IntStream.range(0, x.length).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble(i -> x[i]));
    double[] xs = new double[x.length];
    double[] ys = new double[x.length];
    for (int i = 0; i < order.length; i++) {
      xs[i] = x[order[i]];
      ys[i] = y[order[i]];
    }

    int peak = indexOfMax(ys);
    double max = ys[peak];
    if (!(max > 0.0)) {
      return null;
    }
    double half = max / 2.0;

    Double left = null;
    for (int i = peak - 1; i >= 0; i--) {
      if (ys[i] <= half) {
        left = crossing(xs[i], ys[i], xs[i + 1], ys[i + 1], half);
        break;
      }
    }
    Double right = null;
    for (int i = peak + 1; i < ys.length; i++) {
      if (ys[i] <= half) {
        right = crossing(xs[i - 1], ys[i - 1], xs[i], ys[i], half);
        break;
      }
    }

    if (left == null || right == null) {
      return null;
    }
    return right - left;
  }

  private static double crossing(double x1, double y1, double x2, double y2, double level) {
    if (y2 == y1) {
      return x1;
    }
    return x1 + (level - y1) * (x2 - x1) / (y2 - y1);
  }

  private static int indexOfMax(double[] y) {
    int index = 0;
    for (int i = 1; i < y.length; i++) {
      if (y[i] > y[index]) {
        index = i;
      }
    }
    return index;
  }

  private static void checkLengths(double[] x, double[] y) {
    if (x.length != y.length || x.length == 0) {
      throw new IllegalArgumentException(String.format(
          "Expected non-empty curves of equal length, got %d x values and %d y values", x.length, y.length));
    }
  }
}
