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

import com.act.xrs.roi.IntegratedFrame;
import com.act.xrs.roi.RoiIntegrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * One energy scan reduced to per-channel ROI intensities.
 *
 * Each scan carries a unique number and a free-form type label ("elastic", "edge1", "long", "generic", ...) that
 * decides which group it is summed into.  Signals hold raw counts; monitor normalization is an explicit, separate
 * step ({@link #normalizeByMonitor()}) so the raw counts can always be recovered.
 */
public class Scan extends AbstractChannelData {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Scan.class);

  public static final String GENERIC_TYPE = "generic";

  private final int number;
  private final String type;
  private final boolean monitorNormalized;

  public Scan(int number, String type, double[] energy, double[] monitor, double[][] signals, double[][] errors) {
    this(number, type, energy, monitor, signals, errors, false);
  }

  private Scan(int number, String type, double[] energy, double[] monitor, double[][] signals, double[][] errors,
               boolean monitorNormalized) {
    super(energy, monitor, signals, errors);
    if (type == null || type.isEmpty()) {
      throw new IllegalArgumentException(String.format("Scan %d needs a type label", number));
    }
    this.number = number;
    this.type = type;
    this.monitorNormalized = monitorNormalized;
    checkMonitor();
  }

  /**
   * Integrates every frame of a raw scan and pairs the results with the scan's energy and monitor counters.
   * @param rawScan The frames and counters of the scan.
   * @param type The type label used for grouping.
   * @param integrator The ROI integrator holding the validated ROI set.
   * @return A scan with one signal/error row per ROI.
   */
  public static Scan fromRawScan(RawScan rawScan, String type, RoiIntegrator integrator) {
    List<IntegratedFrame> integrated = integrator.integrateAll(rawScan.getFrames());
    int numberOfChannels = integrator.getNumberOfChannels();
    int numberOfPoints = integrated.size();

    double[][] signals = new double[numberOfChannels][numberOfPoints];
    double[][] errors = new double[numberOfChannels][numberOfPoints];
    for (int point = 0; point < numberOfPoints; point++) {
      IntegratedFrame frame = integrated.get(point);
      for (int channel = 0; channel < numberOfChannels; channel++) {
        signals[channel][point] = frame.getSignal(channel);
        errors[channel][point] = frame.getError(channel);
      }
    }

    LOGGER.info("Integrated %d frames over %d ROIs for scan %d (%s)",
        numberOfPoints, numberOfChannels, rawScan.getScanNumber(), type);
    CounterTable counters = rawScan.getCounters();
    return new Scan(rawScan.getScanNumber(), type, counters.getEnergy(), counters.getMonitor(), signals, errors);
  }

  /**
   * Divides every signal and error value by the monitor count of its scan point.
   * @return A new, normalized scan; this scan is left untouched.
   */
  public Scan normalizeByMonitor() {
    if (monitorNormalized) {
      throw new IllegalStateException(String.format("Scan %d is already monitor normalized", number));
    }
    return new Scan(number, type, energy, monitor, divideByMonitor(signals), divideByMonitor(errors), true);
  }

  public int getNumber() {
    return number;
  }

  public String getType() {
    return type;
  }

  public boolean isMonitorNormalized() {
    return monitorNormalized;
  }

  @Override
  public String getLabel() {
    return String.format("scan %d (%s)", number, type);
  }
}
