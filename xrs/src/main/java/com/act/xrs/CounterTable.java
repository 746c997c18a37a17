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

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Named per-point counter readings for one scan, e.g. the monochromator energy and the incident beam monitor.
 *
 * Column names are matched case-insensitively.  The energy and monitor columns are required and validated when the
 * table is built: all columns must have the same length and every monitor value must be strictly positive.
 */
public class CounterTable {
  public static final String DEFAULT_ENERGY_COLUMN = "energy_cc";
  public static final String DEFAULT_MONITOR_COLUMN = "monitor";

  private final Map<String, double[]> columns;
  private final String energyColumn;
  private final String monitorColumn;
  private final int numberOfPoints;

  public CounterTable(Map<String, double[]> columns) {
    this(columns, DEFAULT_ENERGY_COLUMN, DEFAULT_MONITOR_COLUMN);
  }

  public CounterTable(Map<String, double[]> columns, String energyColumn, String monitorColumn) {
    this.columns = new LinkedHashMap<>();
    for (Map.Entry<String, double[]> entry : columns.entrySet()) {
      this.columns.put(entry.getKey().toLowerCase(), Arrays.copyOf(entry.getValue(), entry.getValue().length));
    }
    this.energyColumn = energyColumn.toLowerCase();
    this.monitorColumn = monitorColumn.toLowerCase();

    if (!this.columns.containsKey(this.energyColumn)) {
      throw new InvalidCounterException(String.format("Energy column '%s' not found among [%s]",
          energyColumn, StringUtils.join(this.columns.keySet(), ", ")));
    }
    if (!this.columns.containsKey(this.monitorColumn)) {
      throw new InvalidCounterException(String.format("Monitor column '%s' not found among [%s]",
          monitorColumn, StringUtils.join(this.columns.keySet(), ", ")));
    }

    this.numberOfPoints = this.columns.get(this.energyColumn).length;
    for (Map.Entry<String, double[]> entry : this.columns.entrySet()) {
      if (entry.getValue().length != numberOfPoints) {
        throw new InvalidCounterException(String.format("Counter '%s' has %d points, energy column has %d",
            entry.getKey(), entry.getValue().length, numberOfPoints));
      }
    }

    double[] monitor = this.columns.get(this.monitorColumn);
    for (int i = 0; i < monitor.length; i++) {
      if (!(monitor[i] > 0.0)) {
        throw new InvalidCounterException(String.format(
            "Monitor value at scan point %d is %f; monitor counts must be positive", i, monitor[i]));
      }
    }
  }

  public int getNumberOfPoints() {
    return numberOfPoints;
  }

  public double[] getEnergy() {
    return getColumn(energyColumn);
  }

  public double[] getMonitor() {
    return getColumn(monitorColumn);
  }

  public boolean hasColumn(String name) {
    return columns.containsKey(name.toLowerCase());
  }

  public double[] getColumn(String name) {
    double[] values = columns.get(name.toLowerCase());
    if (values == null) {
      throw new InvalidCounterException(String.format("No counter named '%s'", name));
    }
    return Arrays.copyOf(values, values.length);
  }

  public Set<String> getColumnNames() {
    return Collections.unmodifiableSet(columns.keySet());
  }
}
