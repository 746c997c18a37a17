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

package com.act.xrs.geometry;

import com.act.xrs.calibration.Calibration;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Arrays;

/**
 * Per-channel momentum transfer along an energy-loss axis.  Point {@code i} of channel {@code ch} is q for incident
 * energy {@code E0 + eloss[i] / 1000}, scattered energy {@code E0} and angle {@code tth[ch]}.
 */
public class MomentumTransferTable {
  private static final Logger LOGGER = LogManager.getFormatterLogger(MomentumTransferTable.class);

  private final double referenceEnergy;
  private final double[] energyLoss;
  private final double[] tth;
  private final MomentumTransfer.Units units;
  // q[channel][point]
  private final double[][] q;

  private MomentumTransferTable(double referenceEnergy, double[] energyLoss, double[] tth,
                                MomentumTransfer.Units units, double[][] q) {
    this.referenceEnergy = referenceEnergy;
    this.energyLoss = energyLoss;
    this.tth = tth;
    this.units = units;
    this.q = q;
  }

  /**
   * Builds the table.
   * @param calibration Supplies the reference energy E0 (keV).
   * @param energyLoss The shared energy-loss axis in eV.
   * @param tth One scattering angle per channel, in degrees.
   * @param units Atomic units or inverse Ångström.
   */
  public static MomentumTransferTable compute(Calibration calibration, double[] energyLoss, double[] tth,
                                              MomentumTransfer.Units units) {
    if (tth.length != calibration.getNumberOfChannels()) {
      throw new IllegalArgumentException(String.format(
          "Got %d scattering angles for a calibration of %d channels", tth.length, calibration.getNumberOfChannels()));
    }
    double e0 = calibration.getReferenceEnergy();
    double[][] q = new double[tth.length][energyLoss.length];
    for (int channel = 0; channel < tth.length; channel++) {
      for (int i = 0; i < energyLoss.length; i++) {
        double incident = e0 + energyLoss[i] / Calibration.KEV_TO_EV;
        q[channel][i] = MomentumTransfer.compute(incident, e0, tth[channel], units);
      }
    }
    LOGGER.debug("Computed %s momentum transfer for %d channels at %d energy losses",
        units, tth.length, energyLoss.length);
    return new MomentumTransferTable(e0, Arrays.copyOf(energyLoss, energyLoss.length),
        Arrays.copyOf(tth, tth.length), units, q);
  }

  public double getReferenceEnergy() {
    return referenceEnergy;
  }

  public MomentumTransfer.Units getUnits() {
    return units;
  }

  public int getNumberOfChannels() {
    return tth.length;
  }

  public double[] getEnergyLoss() {
    return Arrays.copyOf(energyLoss, energyLoss.length);
  }

  public double getTth(int channel) {
    return tth[channel];
  }

  public double[] getTth() {
    return Arrays.copyOf(tth, tth.length);
  }

  public double[] getQ(int channel) {
    return Arrays.copyOf(q[channel], q[channel].length);
  }

  /**
   * Returns q of every channel at the axis point closest to {@code eloss} (eV).  Ties go to the earlier point.
   */
  public double[] atEnergyLoss(double eloss) {
    if (energyLoss.length == 0) {
      throw new IllegalStateException("Momentum transfer table has an empty energy-loss axis");
    }
    int nearest = 0;
    for (int i = 1; i < energyLoss.length; i++) {
      if (Math.abs(energyLoss[i] - eloss) < Math.abs(energyLoss[nearest] - eloss)) {
        nearest = i;
      }
    }
    double[] row = new double[tth.length];
    for (int channel = 0; channel < tth.length; channel++) {
      row[channel] = q[channel][nearest];
    }
    return row;
  }
}
