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

import com.act.xrs.ChannelSet;
import com.act.xrs.calibration.PeakProfile;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Per-channel signals and errors sampled on one shared energy-loss axis (eV).  Every channel of a spectrum has exactly
 * one value per axis point.  Spectra are immutable; all transforms return new instances.
 */
public class Spectrum {
  private final String label;
  private final double[] energyLoss;
  private final double[][] signals;
  private final double[][] errors;

  public Spectrum(String label, double[] energyLoss, double[][] signals, double[][] errors) {
    if (signals.length == 0 || signals.length != errors.length) {
      throw new IllegalArgumentException(String.format(
          "Expected matching, non-empty signal and error channel counts, got %d and %d",
          signals.length, errors.length));
    }
    for (int channel = 0; channel < signals.length; channel++) {
      if (signals[channel].length != energyLoss.length || errors[channel].length != energyLoss.length) {
        throw new IllegalArgumentException(String.format(
            "Channel %d of %s has %d signal and %d error values for %d axis points",
            channel, label, signals[channel].length, errors[channel].length, energyLoss.length));
      }
    }
    this.label = label;
    this.energyLoss = Arrays.copyOf(energyLoss, energyLoss.length);
    this.signals = new double[signals.length][];
    this.errors = new double[errors.length][];
    for (int channel = 0; channel < signals.length; channel++) {
      this.signals[channel] = Arrays.copyOf(signals[channel], signals[channel].length);
      this.errors[channel] = Arrays.copyOf(errors[channel], errors[channel].length);
    }
  }

  public String getLabel() {
    return label;
  }

  public int getNumberOfPoints() {
    return energyLoss.length;
  }

  public int getNumberOfChannels() {
    return signals.length;
  }

  public double[] getEnergyLoss() {
    return Arrays.copyOf(energyLoss, energyLoss.length);
  }

  public double[] getSignal(int channel) {
    return Arrays.copyOf(signals[channel], signals[channel].length);
  }

  public double[] getError(int channel) {
    return Arrays.copyOf(errors[channel], errors[channel].length);
  }

  /**
   * Divides the signal and error of each selected channel by the channel's trapezoid area between {@code emin} and
   * {@code emax}.  Unselected channels are copied unchanged.
   * @param channels The channels to normalize.
   * @param emin Lower energy-loss bound in eV, or null for the start of the axis.
   * @param emax Upper energy-loss bound in eV, or null for the end of the axis.
   */
  public Spectrum normalizeArea(ChannelSet channels, Double emin, Double emax) {
    channels.validateAgainst(signals.length);
    double lower = emin == null ? Double.NEGATIVE_INFINITY : emin;
    double upper = emax == null ? Double.POSITIVE_INFINITY : emax;

    List<Integer> inRange = new ArrayList<>();
    for (int i = 0; i < energyLoss.length; i++) {
      if (energyLoss[i] >= lower && energyLoss[i] <= upper) {
        inRange.add(i);
      }
    }
    if (inRange.size() < 2) {
      throw new IllegalArgumentException(String.format(
          "Need at least two points between %f and %f eV to normalize %s, found %d", lower, upper, label,
          inRange.size()));
    }

    double[][] normalizedSignals = new double[signals.length][];
    double[][] normalizedErrors = new double[errors.length][];
    for (int channel = 0; channel < signals.length; channel++) {
      normalizedSignals[channel] = Arrays.copyOf(signals[channel], signals[channel].length);
      normalizedErrors[channel] = Arrays.copyOf(errors[channel], errors[channel].length);
      if (!channels.contains(channel)) {
        continue;
      }

      double[] x = new double[inRange.size()];
      double[] y = new double[inRange.size()];
      for (int i = 0; i < inRange.size(); i++) {
        x[i] = energyLoss[inRange.get(i)];
        y[i] = signals[channel][inRange.get(i)];
      }
      double area = PeakProfile.trapezoid(x, y);
      if (area == 0.0) {
        throw new IllegalArgumentException(String.format(
            "Channel %d of %s has zero area between %f and %f eV", channel, label, lower, upper));
      }
      for (int i = 0; i < energyLoss.length; i++) {
        normalizedSignals[channel][i] /= area;
        normalizedErrors[channel][i] /= area;
      }
    }
    return new Spectrum(label, energyLoss, normalizedSignals, normalizedErrors);
  }

  /**
   * Combines several channels into one.
   *
   * With error weighting, each point is the inverse-variance weighted mean {@code Σ(s/e²) / Σ(1/e²)} with error
   * {@code sqrt(1 / Σ(1/e²))}; every selected error must then be non-zero.  Without weighting, the signals are summed
   * and the error is the square root of the absolute sum.
   *
   * @return A single channel spectrum on the same axis.
   */
  public Spectrum average(ChannelSet channels, boolean errorWeighted) {
    channels.validateAgainst(signals.length);
    double[] combined = new double[energyLoss.length];
    double[] combinedError = new double[energyLoss.length];

    for (int i = 0; i < energyLoss.length; i++) {
      if (errorWeighted) {
        double weightedSum = 0.0;
        double weightSum = 0.0;
        for (int channel : channels) {
          double error = errors[channel][i];
          if (error == 0.0) {
            throw new IllegalArgumentException(String.format(
                "Channel %d of %s has zero error at %f eV; cannot weight by inverse variance",
                channel, label, energyLoss[i]));
          }
          double weight = 1.0 / (error * error);
          weightedSum += signals[channel][i] * weight;
          weightSum += weight;
        }
        combined[i] = weightedSum / weightSum;
        combinedError[i] = Math.sqrt(1.0 / weightSum);
      } else {
        double sum = 0.0;
        for (int channel : channels) {
          sum += signals[channel][i];
        }
        combined[i] = sum;
        combinedError[i] = Math.sqrt(Math.abs(sum));
      }
    }

    return new Spectrum(String.format("%s averaged over %s", label, channels),
        energyLoss, new double[][]{combined}, new double[][]{combinedError});
  }
}
