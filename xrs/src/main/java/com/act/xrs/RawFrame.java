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
 * One detector image recorded at a single scan point.  Pixel values are non-negative counts addressed as
 * (row, column); the frame is copied on construction and never changes afterwards.
 *
 * Frames are produced by whatever reads the detector's image files; the reduction code only reads them.
 */
public final class RawFrame {
  private final double[][] pixels;
  private final int rows;
  private final int columns;

  public RawFrame(double[][] pixels) {
    if (pixels == null || pixels.length == 0 || pixels[0].length == 0) {
      throw new IllegalArgumentException("A raw frame needs at least one pixel");
    }
    this.rows = pixels.length;
    this.columns = pixels[0].length;
    this.pixels = new double[rows][];
    for (int r = 0; r < rows; r++) {
      if (pixels[r].length != columns) {
        throw new IllegalArgumentException(String.format(
            "Ragged frame: row %d has %d columns, expected %d", r, pixels[r].length, columns));
      }
      for (int c = 0; c < columns; c++) {
        if (pixels[r][c] < 0.0 || Double.isNaN(pixels[r][c])) {
          throw new IllegalArgumentException(String.format(
              "Pixel (%d, %d) has invalid value %f; frames must be non-negative", r, c, pixels[r][c]));
        }
      }
      this.pixels[r] = Arrays.copyOf(pixels[r], columns);
    }
  }

  public static RawFrame fromCounts(int[][] counts) {
    double[][] pixels = new double[counts.length][];
    for (int r = 0; r < counts.length; r++) {
      pixels[r] = new double[counts[r].length];
      for (int c = 0; c < counts[r].length; c++) {
        pixels[r][c] = counts[r][c];
      }
    }
    return new RawFrame(pixels);
  }

  public int getRows() {
    return rows;
  }

  public int getColumns() {
    return columns;
  }

  public double getValue(int row, int column) {
    return pixels[row][column];
  }
}
