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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The ordered list of ROIs for a detector of known shape.  A ROI's position in the list is its channel index, which
 * keys every per-channel array produced downstream.
 *
 * All pixel coordinates are checked against the detector shape here, once, so that integration never has to
 * bounds-check individual frames.
 */
public class RoiSet {
  private static final Logger LOGGER = LogManager.getFormatterLogger(RoiSet.class);

  private final List<Roi> rois;
  private final int detectorRows;
  private final int detectorColumns;

  public RoiSet(List<Roi> rois, int detectorRows, int detectorColumns) {
    if (rois == null || rois.isEmpty()) {
      throw new RoiConfigurationException("A ROI set needs at least one ROI");
    }
    if (detectorRows <= 0 || detectorColumns <= 0) {
      throw new RoiConfigurationException(String.format(
          "Invalid detector shape %d x %d", detectorRows, detectorColumns));
    }

    for (int channel = 0; channel < rois.size(); channel++) {
      Roi roi = rois.get(channel);
      if (roi.getNumberOfPixels() == 0) {
        throw new RoiConfigurationException(String.format("ROI %d contains no pixels", channel));
      }
      for (int p = 0; p < roi.getNumberOfPixels(); p++) {
        int row = roi.getRow(p);
        int column = roi.getColumn(p);
        if (row < 0 || row >= detectorRows || column < 0 || column >= detectorColumns) {
          throw new RoiConfigurationException(String.format(
              "ROI %d pixel (%d, %d) lies outside the %d x %d detector", channel, row, column,
              detectorRows, detectorColumns));
        }
      }
    }

    this.rois = Collections.unmodifiableList(new ArrayList<>(rois));
    this.detectorRows = detectorRows;
    this.detectorColumns = detectorColumns;
    LOGGER.debug("Validated %d ROIs against a %d x %d detector", rois.size(), detectorRows, detectorColumns);
  }

  public int size() {
    return rois.size();
  }

  public Roi get(int channel) {
    return rois.get(channel);
  }

  public List<Roi> getRois() {
    return rois;
  }

  public int getDetectorRows() {
    return detectorRows;
  }

  public int getDetectorColumns() {
    return detectorColumns;
  }
}
