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

/**
 * Momentum transfer for inelastic scattering from an incident energy to a scattered energy at a given scattering angle.
 */
public class MomentumTransfer {
  public enum Units {
    ATOMIC,
    INVERSE_ANGSTROM,
  }

  public static final double RYDBERG_EV = 13.60569172;
  public static final double INVERSE_FINE_STRUCTURE = 137.03599976;

  public static final double ELEMENTARY_CHARGE = 1.602e-19;
  public static final double SPEED_OF_LIGHT = 2.9979e8;
  public static final double REDUCED_PLANCK = 6.626e-34 / 2.0 / Math.PI;
  public static final double METERS_PER_ANGSTROM = 1e-10;

  private MomentumTransfer() {
  }

  /**
   * @param incident Incident energy in keV.
   * @param scattered Scattered energy in keV.
   * @param tth Scattering angle in degrees.
   * @return q in atomic units.
   */
  public static double atomicUnits(double incident, double scattered, double tth) {
    double k1 = incident * 1e3 / RYDBERG_EV / 2.0;
    double k2 = scattered * 1e3 / RYDBERG_EV / 2.0;
    return magnitude(k1, k2, tth) / INVERSE_FINE_STRUCTURE;
  }

  /**
   * @param incident Incident energy in keV.
   * @param scattered Scattered energy in keV.
   * @param tth Scattering angle in degrees.
   * @return q in inverse Ångström.
   */
  public static double inverseAngstrom(double incident, double scattered, double tth) {
    double k1 = incident * 1e3 * ELEMENTARY_CHARGE / SPEED_OF_LIGHT / REDUCED_PLANCK;
    double k2 = scattered * 1e3 * ELEMENTARY_CHARGE / SPEED_OF_LIGHT / REDUCED_PLANCK;
    return magnitude(k1, k2, tth) * METERS_PER_ANGSTROM;
  }

  public static double compute(double incident, double scattered, double tth, Units units) {
    switch (units) {
      case ATOMIC:
        return atomicUnits(incident, scattered, tth);
      case INVERSE_ANGSTROM:
        return inverseAngstrom(incident, scattered, tth);
      default:
        throw new IllegalArgumentException(String.format("Unknown momentum transfer units %s", units));
    }
  }

  private static double magnitude(double k1, double k2, double tth) {
    return Math.sqrt(k1 * k1 + k2 * k2 - 2.0 * k1 * k2 * Math.cos(Math.toRadians(tth)));
  }
}
