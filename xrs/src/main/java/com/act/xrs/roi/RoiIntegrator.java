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

import com.act.xrs.RawFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * Reduces detector frames to one intensity per analyzer channel by summing the pixels of each ROI.
 *
 * The error of every sum is its square root (counting statistics), so an empty ROI sum has an error of exactly 0.
 */
public class RoiIntegrator {
  private final RoiSet roiSet;

  public RoiIntegrator(RoiSet roiSet) {
    this.roiSet = roiSet;
  }

  public RoiSet getRoiSet() {
    return roiSet;
  }

  public int getNumberOfChannels() {
    return roiSet.size();
  }

  public IntegratedFrame integrate(RawFrame frame) {
    if (frame.getRows() != roiSet.getDetectorRows() || frame.getColumns() != roiSet.getDetectorColumns()) {
      throw new RoiConfigurationException(String.format(
          "Frame of shape %d x %d does not match the %d x %d detector the ROIs were defined on",
          frame.getRows(), frame.getColumns(), roiSet.getDetectorRows(), roiSet.getDetectorColumns()));
    }

    double[] signal = new double[roiSet.size()];
    double[] error = new double[roiSet.size()];
    for (int channel = 0; channel < roiSet.size(); channel++) {
      Roi roi = roiSet.get(channel);
      double sum = 0.0;
      for (int p = 0; p < roi.getNumberOfPixels(); p++) {
        sum += frame.getValue(roi.getRow(p), roi.getColumn(p));
      }
      signal[channel] = sum;
      error[channel] = Math.sqrt(sum);
    }
    return new IntegratedFrame(signal, error);
  }

  public List<IntegratedFrame> integrateAll(List<RawFrame> frames) {
    List<IntegratedFrame> integrated = new ArrayList<>(frames.size());
    for (RawFrame frame : frames) {
      integrated.add(integrate(frame));
    }
    return integrated;
  }
}
