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

package com.act.xrs.calibration;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * The energy reference derived from one elastic group: a zero-energy offset (centroid) and a resolution per channel,
 * and the global reference energy E0, the mean of all centroids.
 *
 * A calibration is read-only.  Recalibrating produces a new instance, so spectra derived from an older calibration
 * remain consistent with it.
 */
public class Calibration {
  public static final double KEV_TO_EV = 1000.0;

  private final double[] centroids;
  private final double[] resolutions;
  private final boolean[] resolutionReliable;
  private final double referenceEnergy;
  private final List<Integer> elasticScanNumbers;

  public Calibration(double[] centroids, double[] resolutions, boolean[] resolutionReliable,
                     List<Integer> elasticScanNumbers) {
    if (centroids.length == 0 || centroids.length != resolutions.length
        || centroids.length != resolutionReliable.length) {
      throw new IllegalArgumentException(String.format(
          "Inconsistent calibration: %d centroids, %d resolutions, %d reliability flags",
          centroids.length, resolutions.length, resolutionReliable.length));
    }
    this.centroids = Arrays.copyOf(centroids, centroids.length);
    this.resolutions = Arrays.copyOf(resolutions, resolutions.length);
    this.resolutionReliable = Arrays.copyOf(resolutionReliable, resolutionReliable.length);
    this.elasticScanNumbers = Collections.unmodifiableList(new ArrayList<>(elasticScanNumbers));

    double sum = 0.0;
    for (double centroid : centroids) {
      sum += centroid;
    }
    this.referenceEnergy = sum / centroids.length;
  }

  public int getNumberOfChannels() {
    return centroids.length;
  }

  /**
   * Return the zero-energy offset of a channel, in keV.
   */
  public double getCentroid(int channel) {
    return centroids[channel];
  }

  public double[] getCentroids() {
    return Arrays.copyOf(centroids, centroids.length);
  }

  /**
   * Return the centroid of channel 0, which defines the shared energy-loss axis.
   */
  public double getMasterCentroid() {
    return centroids[0];
  }

  /**
   * Return the FWHM of a channel's elastic line in eV, or 0 if it could not be estimated.
   */
  public double getResolution(int channel) {
    return resolutions[channel];
  }

  public double[] getResolutions() {
    return Arrays.copyOf(resolutions, resolutions.length);
  }

  public boolean isResolutionReliable(int channel) {
    return resolutionReliable[channel];
  }

  /**
   * Return the channels whose resolution fell back to 0, in ascending order; empty if every channel has an estimate.
   */
  public List<Integer> getLowConfidenceChannels() {
    List<Integer> lowConfidence = new ArrayList<>();
    for (int channel = 0; channel < resolutionReliable.length; channel++) {
      if (!resolutionReliable[channel]) {
        lowConfidence.add(channel);
      }
    }
    return Collections.unmodifiableList(lowConfidence);
  }

  /**
   * Return E0, the mean of all channel centroids, in keV.
   */
  public double getReferenceEnergy() {
    return referenceEnergy;
  }

  public List<Integer> getElasticScanNumbers() {
    return elasticScanNumbers;
  }

  /**
   * Converts raw energies (keV) to the shared energy-loss axis (eV), relative to the master centroid.
   */
  public double[] toEnergyLoss(double[] energy) {
    return toChannelEnergyLoss(energy, 0);
  }

  /**
   * Converts raw energies (keV) to energy loss (eV) relative to one channel's own centroid.
   */
  public double[] toChannelEnergyLoss(double[] energy, int channel) {
    double[] eloss = new double[energy.length];
    for (int i = 0; i < energy.length; i++) {
      eloss[i] = (energy[i] - centroids[channel]) * KEV_TO_EV;
    }
    return eloss;
  }
}
