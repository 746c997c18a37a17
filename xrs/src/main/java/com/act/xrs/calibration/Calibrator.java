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

import com.act.xrs.scans.AggregationException;
import com.act.xrs.scans.AggregationResult;
import com.act.xrs.scans.ScanGroup;
import com.act.xrs.scans.ScanRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Map;

/**
 * Derives the per-channel energy zero points and resolutions from the elastic group.
 *
 * For every channel the elastic line's centroid over the raw energy axis is that channel's zero-energy offset.  The
 * resolution is the FWHM of the same line plotted against {@code (E - centroid) * 1000}, i.e. in eV.  A channel whose
 * FWHM cannot be estimated gets a resolution of 0 and is flagged; that does not stop the calibration, as the
 * resolution is informational only.
 */
public class Calibrator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(Calibrator.class);

  private final String elasticType;
  private final Integer expectedNumberOfChannels;

  public Calibrator() {
    this(ScanRegistry.ELASTIC_TYPE);
  }

  public Calibrator(String elasticType) {
    this(elasticType, null);
  }

  /**
   * @param elasticType The group type holding the elastic line.
   * @param expectedNumberOfChannels The size of the ROI set the scans were integrated over, or null to accept any
   *                                 channel count.
   */
  public Calibrator(String elasticType, Integer expectedNumberOfChannels) {
    this.elasticType = elasticType;
    this.expectedNumberOfChannels = expectedNumberOfChannels;
  }

  public String getElasticType() {
    return elasticType;
  }

  public Calibration calibrate(AggregationResult aggregation) throws CalibrationException {
    AggregationException failure = aggregation.getFailures().get(elasticType);
    if (failure != null) {
      throw new CalibrationException(String.format(
          "The '%s' group failed to aggregate, cannot calibrate: %s", elasticType, failure.getMessage()), failure);
    }
    return calibrate(aggregation.getGroups());
  }

  public Calibration calibrate(Map<String, ScanGroup> groups) throws CalibrationException {
    ScanGroup elastic = groups.get(elasticType);
    if (elastic == null) {
      throw new CalibrationException(String.format(
          "No '%s' group available; load at least one elastic scan before calibrating", elasticType));
    }
    return calibrate(elastic);
  }

  public Calibration calibrate(ScanGroup elastic) throws CalibrationException {
    int numberOfChannels = elastic.getNumberOfChannels();
    if (expectedNumberOfChannels != null && numberOfChannels != expectedNumberOfChannels) {
      throw new CalibrationException(String.format(
          "%s has %d channels but the ROI set defines %d", elastic.getLabel(), numberOfChannels,
          expectedNumberOfChannels));
    }
    double[] energy = elastic.getEnergy();
    double[] centroids = new double[numberOfChannels];
    double[] resolutions = new double[numberOfChannels];
    boolean[] reliable = new boolean[numberOfChannels];

    for (int channel = 0; channel < numberOfChannels; channel++) {
      double[] signal = elastic.getSignal(channel);

      Double centroid = PeakProfile.centroid(energy, signal);
      if (centroid == null) {
        throw new CalibrationException(String.format(
            "Elastic line of channel %d has zero integrated intensity in %s; no centroid can be formed",
            channel, elastic.getLabel()));
      }
      centroids[channel] = centroid;

      double[] relativeEnergy = new double[energy.length];
      for (int i = 0; i < energy.length; i++) {
        relativeEnergy[i] = (energy[i] - centroid) * Calibration.KEV_TO_EV;
      }
      Double fwhm = PeakProfile.fwhm(relativeEnergy, signal);
      if (fwhm == null) {
        LOGGER.warn("Could not estimate the elastic FWHM of channel %d; reporting a resolution of 0", channel);
        resolutions[channel] = 0.0;
        reliable[channel] = false;
      } else {
        resolutions[channel] = fwhm;
        reliable[channel] = true;
      }
      LOGGER.debug("Channel %d: centroid %.6f keV, resolution %.3f eV", channel, centroid, resolutions[channel]);
    }

    Calibration calibration = new Calibration(centroids, resolutions, reliable, elastic.getMemberScanNumbers());
    LOGGER.info("Calibrated %d channels from %s: E0 = %.6f keV",
        numberOfChannels, elastic.getLabel(), calibration.getReferenceEnergy());
    return calibration;
  }
}
