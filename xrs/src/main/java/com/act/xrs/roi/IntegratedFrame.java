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

package com.act.xrs.roi;

import java.util.Arrays;

/**
 * Per-channel ROI sums of one frame and their Poisson errors.
 */
public class IntegratedFrame {
  private final double[] signal;
  private final double[] error;

  public IntegratedFrame(double[] signal, double[] error) {
    if (signal.length != error.length) {
      throw new IllegalArgumentException(String.format(
          "Signal has %d channels but error has %d", signal.length, error.length));
    }
    this.signal = signal;
    this.error = error;
  }

  public int getNumberOfChannels() {
    return signal.length;
  }

  public double getSignal(int channel) {
    return signal[channel];
  }

  public double getError(int channel) {
    return error[channel];
  }

  public double[] getSignal() {
    return Arrays.copyOf(signal, signal.length);
  }

  public double[] getError() {
    return Arrays.copyOf(error, error.length);
  }
}
