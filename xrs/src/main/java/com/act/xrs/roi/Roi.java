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

import org.apache.commons.lang3.tuple.Pair;

import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * A fixed set of detector pixels assigned to one analyzer crystal.  Pixels are stored as parallel row/column arrays
 * in the order they were given; each (row, column) pair may appear only once.
 */
public final class Roi {
  private final int[] rows;
  private final int[] columns;

  public Roi(int[] rows, int[] columns) {
    if (rows.length != columns.length) {
      throw new RoiConfigurationException(String.format(
          "ROI has %d row coordinates but %d column coordinates", rows.length, columns.length));
    }
    Set<Pair<Integer, Integer>> seen = new HashSet<>();
    for (int i = 0; i < rows.length; i++) {
      if (!seen.add(Pair.of(rows[i], columns[i]))) {
        throw new RoiConfigurationException(String.format(
            "ROI lists pixel (%d, %d) more than once", rows[i], columns[i]));
      }
    }
    this.rows = Arrays.copyOf(rows, rows.length);
    this.columns = Arrays.copyOf(columns, columns.length);
  }

  /**
   * Builds a ROI from (row, column) pixel pairs.
   */
  public static Roi fromPixels(List<Pair<Integer, Integer>> pixels) {
    int[] rows = new int[pixels.size()];
    int[] columns = new int[pixels.size()];
    for (int i = 0; i < pixels.size(); i++) {
      rows[i] = pixels.get(i).getLeft();
      columns[i] = pixels.get(i).getRight();
    }
    return new Roi(rows, columns);
  }

  /**
   * Builds a rectangular ROI covering rows [rowStart, rowEnd) and columns [columnStart, columnEnd).
   */
  public static Roi rectangle(int rowStart, int rowEnd, int columnStart, int columnEnd) {
    int height = rowEnd - rowStart;
    int width = columnEnd - columnStart;
    if (height <= 0 || width <= 0) {
      throw new RoiConfigurationException(String.format(
          "Empty rectangle rows [%d, %d) columns [%d, %d)", rowStart, rowEnd, columnStart, columnEnd));
    }
    int[] rows = new int[height * width];
    int[] columns = new int[height * width];
    int i = 0;
    for (int r = rowStart; r < rowEnd; r++) {
      for (int c = columnStart; c < columnEnd; c++) {
        rows[i] = r;
        columns[i] = c;
        i++;
      }
    }
    return new Roi(rows, columns);
  }

  public int getNumberOfPixels() {
    return rows.length;
  }

  public int getRow(int pixel) {
    return rows[pixel];
  }

  public int getColumn(int pixel) {
    return columns[pixel];
  }
}
