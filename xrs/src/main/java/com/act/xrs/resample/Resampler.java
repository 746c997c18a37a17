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

package com.act.xrs.resample;

import com.act.xrs.ChannelData;
import com.act.xrs.calibration.Calibration;
import org.apache.commons.math3.analysis.interpolation.LinearInterpolator;
import org.apache.commons.math3.analysis.polynomials.PolynomialSplineFunction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;
import java.util.Comparator;
import java.util.stream.IntStream;

/**
 * Moves every channel of a scan or group onto one shared energy-loss axis.
 *
 * Channel {@code i} is sampled at {@code (E - centroid_i) * 1000}; those samples are linearly interpolated onto the
 * shared axis {@code (E - centroid_0) * 1000}.  Before interpolating, a zero-intensity guard sample is placed far below
 * and far above the observed range, and any target point outside a channel's observed range is set to exactly 0.
 */
public class Resampler {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Resampler.class);

  // eV; far outside any physically meaningful energy loss.
  public static final double GUARD_ENERGY_LOSS = 1e10;

  private final Calibration calibration;

  public Resampler(Calibration calibration) {
    if (calibration == null) {
      throw new IllegalStateException("Resampling requires a calibration; calibrate against an elastic group first");
    }
    this.calibration = calibration;
  }

  public Calibration getCalibration() {
    return calibration;
  }

  /**
   * Resamples data onto its own shared axis, {@code (E - centroid_0) * 1000}.
   */
  public Spectrum resample(ChannelData data) {
    return resample(data, calibration.toEnergyLoss(data.getEnergy()));
  }

  /**
   * Resamples data onto an arbitrary energy-loss axis (eV).
   */
  public Spectrum resample(ChannelData data, double[] targetAxis) {
    if (data.getNumberOfChannels() != calibration.getNumberOfChannels()) {
      throw new IllegalArgumentException(String.format(
          "%s has %d channels but the calibration covers %d",
          data.getLabel(), data.getNumberOfChannels(), calibration.getNumberOfChannels()));
    }

    double[] energy = data.getEnergy();
    int numberOfChannels = data.getNumberOfChannels();
    double[][] signals = new double[numberOfChannels][];
    double[][] errors = new double[numberOfChannels][];
    for (int channel = 0; channel < numberOfChannels; channel++) {
      double[] channelAxis = calibration.toChannelEnergyLoss(energy, channel);
      try {
        signals[channel] = interpolate(channelAxis, data.getSignal(channel), targetAxis);
        errors[channel] = interpolate(channelAxis, data.getError(channel), targetAxis);
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException(String.format(
            "Cannot resample channel %d of %s: %s", channel, data.getLabel(), e.getMessage()), e);
      }
    }

    LOGGER.debug("Resampled %d channels of %s onto %d points", numberOfChannels, data.getLabel(), targetAxis.length);
    return new Spectrum(data.getLabel(), targetAxis, signals, errors);
  }

  /**
   * Linearly interpolates y(x) at every target point, returning 0 wherever the target lies outside [min x, max x].
   * The samples need not be ordered, but their x values must be distinct.
   */
  public static double[] interpolate(double[] x, double[] y, double[] targets) {
    if (x.length != y.length || x.length == 0) {
      throw new IllegalArgumentException(String.format(
          "Expected non-empty samples of equal length, got %d x values and %d y values", x.length, y.length));
    }

    Integer[] order = IntStream.range(0, x.length).boxed().toArray(Integer[]::new);
    Arrays.sort(order, Comparator.comparingDouble(i -> x[i]));

    double[] knots = new double[x.length + 2];
    double[] values = new double[x.length + 2];
    knots[0] = -GUARD_ENERGY_LOSS;
    knots[knots.length - 1] = GUARD_ENERGY_LOSS;
    for (int i = 0; i < order.length; i++) {
      knots[i + 1] = x[order[i]];
      values[i + 1] = y[order[i]];
      if (knots[i + 1] <= knots[i]) {
        throw new IllegalArgumentException(String.format(
            "sample positions must be distinct and within the guard range, found %f after %f",
            knots[i + 1], knots[i]));
      }
    }
    if (knots[knots.length - 2] >= GUARD_ENERGY_LOSS) {
      throw new IllegalArgumentException(String.format(
          "sample position %f lies beyond the guard range", knots[knots.length - 2]));
    }

    double observedMin = knots[1];
    double observedMax = knots[knots.length - 2];
    PolynomialSplineFunction interpolant = new LinearInterpolator().interpolate(knots, values);

    double[] resampled = new double[targets.length];
    for (int i = 0; i < targets.length; i++) {
      double target = targets[i];
      if (target < observedMin || target > observedMax) {
        resampled[i] = 0.0;
      } else {
        resampled[i] = interpolant.value(target);
      }
    }
    return resampled;
  }
}
