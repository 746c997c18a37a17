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

package com.act.xrs.scans;

import com.act.xrs.AbstractChannelData;

import java.util.Collections;
import java.util.List;

/**
 * The sum of all scans that share one type label.  The energy axis is that of the first member; signals and monitors
 * are summed point by point and errors are added in quadrature.
 */
public class ScanGroup extends AbstractChannelData {
  private final String type;
  private final List<Integer> memberScanNumbers;
  private final boolean monitorNormalized;

  public ScanGroup(String type, List<Integer> memberScanNumbers, double[] energy, double[] monitor,
                   double[][] signals, double[][] errors) {
    this(type, memberScanNumbers, energy, monitor, signals, errors, false);
  }

  private ScanGroup(String type, List<Integer> memberScanNumbers, double[] energy, double[] monitor,
                    double[][] signals, double[][] errors, boolean monitorNormalized) {
    super(energy, monitor, signals, errors);
    if (memberScanNumbers.isEmpty()) {
      throw new IllegalArgumentException(String.format("Group '%s' has no member scans", type));
    }
    this.type = type;
    this.memberScanNumbers = Collections.unmodifiableList(memberScanNumbers);
    this.monitorNormalized = monitorNormalized;
    checkMonitor();
  }

  /**
   * Divides the summed signals and errors by the summed monitor.
   * @return A new, normalized group.
   */
  public ScanGroup normalizeByMonitor() {
    if (monitorNormalized) {
      throw new IllegalStateException(String.format("%s is already monitor normalized", getLabel()));
    }
    return new ScanGroup(type, memberScanNumbers, energy, monitor,
        divideByMonitor(signals), divideByMonitor(errors), true);
  }

  public boolean isMonitorNormalized() {
    return monitorNormalized;
  }

  public String getType() {
    return type;
  }

  /**
   * Return the numbers of the scans summed into this group, reference scan first.
   */
  public List<Integer> getMemberScanNumbers() {
    return memberScanNumbers;
  }

  public int getReferenceScanNumber() {
    return memberScanNumbers.get(0);
  }

  /**
   * Return the energy value of the first scan point, used to order groups along the energy axis.  A group without
   * points sorts last.
   */
  public double getStartEnergy() {
    return energy.length == 0 ? Double.POSITIVE_INFINITY : energy[0];
  }

  @Override
  public String getLabel() {
    return String.format("group '%s' (%d scans)", type, memberScanNumbers.size());
  }
}
