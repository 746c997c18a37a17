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

package com.act.xrs;

import java.util.Arrays;

/**
 * Array storage shared by {@link ChannelData} implementations.  Signals and errors are stored channel-major, i.e.
 * {@code signals[channel][point]}, and are validated once at construction: every channel must have exactly one value
 * per point of the energy axis.
 */
public abstract class AbstractChannelData implements ChannelData {
  protected final double[] energy;
  protected final double[] monitor;
  protected final double[][] signals;
  protected final double[][] errors;

  protected AbstractChannelData(double[] energy, double[] monitor, double[][] signals, double[][] errors) {
    if (energy == null || monitor == null || signals == null || errors == null) {
      throw new IllegalArgumentException("Energy, monitor, signal and error arrays are all required");
    }
    if (monitor.length != energy.length) {
      throw new IllegalArgumentException(String.format(
          "Monitor has %d points but energy axis has %d", monitor.length, energy.length));
    }
    if (signals.length == 0 || signals.length != errors.length) {
      throw new IllegalArgumentException(String.format(
          "Expected matching, non-empty signal and error channel counts, got %d and %d",
          signals.length, errors.length));
    }
    for (int channel = 0; channel < signals.length; channel++) {
      if (signals[channel].length != energy.length || errors[channel].length != energy.length) {
        throw new IllegalArgumentException(String.format(
            "Channel %d has %d signal and %d error values for %d energy points",
            channel, signals[channel].length, errors[channel].length, energy.length));
      }
    }

    this.energy = Arrays.copyOf(energy, energy.length);
    this.monitor = Arrays.copyOf(monitor, monitor.length);
    this.signals = deepCopy(signals);
    this.errors = deepCopy(errors);
  }

  @Override
  public int getNumberOfPoints() {
    return energy.length;
  }

  @Override
  public int getNumberOfChannels() {
    return signals.length;
  }

  @Override
  public double[] getEnergy() {
    return Arrays.copyOf(energy, energy.length);
  }

  @Override
  public double[] getMonitor() {
    return Arrays.copyOf(monitor, monitor.length);
  }

  @Override
  public double[] getSignal(int channel) {
    checkChannel(channel);
    return Arrays.copyOf(signals[channel], signals[channel].length);
  }

  @Override
  public double[] getError(int channel) {
    checkChannel(channel);
    return Arrays.copyOf(errors[channel], errors[channel].length);
  }

  protected void checkChannel(int channel) {
    if (channel < 0 || channel >= signals.length) {
      throw new IndexOutOfBoundsException(String.format(
          "Channel %d requested from %s, which has %d channels", channel, getLabel(), signals.length));
    }
  }

  /**
   * Rejects any monitor count that is not strictly positive.  Subclasses call this once their label is available.
   * @throws InvalidCounterException Naming the data set and the offending point.
   */
  protected void checkMonitor() {
    for (int point = 0; point < monitor.length; point++) {
      if (!(monitor[point] > 0.0)) {
        throw new InvalidCounterException(String.format(
            "%s has monitor value %f at point %d; monitor counts must be positive", getLabel(), monitor[point], point));
      }
    }
  }

  /**
   * Divides every value by the monitor count of its point.
   */
  protected double[][] divideByMonitor(double[][] values) {
    double[][] divided = new double[values.length][energy.length];
    for (int channel = 0; channel < values.length; channel++) {
      for (int point = 0; point < energy.length; point++) {
        divided[channel][point] = values[channel][point] / monitor[point];
      }
    }
    return divided;
  }

  protected static double[][] deepCopy(double[][] source) {
    double[][] copy = new double[source.length][];
    for (int i = 0; i < source.length; i++) {
      copy[i] = Arrays.copyOf(source[i], source[i].length);
    }
    return copy;
  }
}
