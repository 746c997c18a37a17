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

/**
 * Rebins a spectrum by averaging groups of adjacent points.
 */
public class ChannelBinner {

  /**
   * Averages every {@code binSize} consecutive points, starting at point {@code offset} (taken modulo the bin size;
   * negative offsets count from the next bin).  Axis values and signals are averaged; errors are added in quadrature
   * and divided by the bin size.  Trailing points that do not fill a whole bin are dropped.
   */
  public Spectrum bin(Spectrum spectrum, int binSize, int offset) {
    if (binSize <= 0) {
      throw new IllegalArgumentException(String.format("Bin size must be positive, got %d", binSize));
    }
    int start = offset % binSize;
    if (start < 0) {
      start += binSize;
    }
    int bins = Math.max(0, (spectrum.getNumberOfPoints() - start) / binSize);
    if (bins == 0) {
      throw new IllegalArgumentException(String.format(
          "%s has %d points, too few for one bin of %d starting at %d",
          spectrum.getLabel(), spectrum.getNumberOfPoints(), binSize, start));
    }

    double[] axis = spectrum.getEnergyLoss();
    double[] binnedAxis = new double[bins];
    for (int b = 0; b < bins; b++) {
      binnedAxis[b] = mean(axis, start + b * binSize, binSize);
    }

    int numberOfChannels = spectrum.getNumberOfChannels();
    double[][] signals = new double[numberOfChannels][bins];
    double[][] errors = new double[numberOfChannels][bins];
    for (int channel = 0; channel < numberOfChannels; channel++) {
      double[] signal = spectrum.getSignal(channel);
      double[] error = spectrum.getError(channel);
      for (int b = 0; b < bins; b++) {
        int first = start + b * binSize;
        signals[channel][b] = mean(signal, first, binSize);
        double squares = 0.0;
        for (int i = first; i < first + binSize; i++) {
          squares += error[i] * error[i];
        }
        errors[channel][b] = Math.sqrt(squares) / binSize;
      }
    }
    return new Spectrum(spectrum.getLabel(), binnedAxis, signals, errors);
  }

  private static double mean(double[] values, int first, int count) {
    double sum = 0.0;
    for (int i = first; i < first + count; i++) {
      sum += values[i];
    }
    return sum / count;
  }
}
