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

package com.act.xrs.resample;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Concatenates the spectra of several groups (elastic line, edge regions, long scans, ...) into one spectrum.  Spectra
 * are ordered by the first point of their energy-loss axis; points are not merged where ranges overlap.
 */
public class SpectrumAppender {
  private static final Logger LOGGER = LogManager.getFormatterLogger(SpectrumAppender.class);

  public static final String APPENDED_LABEL = "appended spectrum";

  public Spectrum append(Collection<Spectrum> spectra) {
    if (spectra.isEmpty()) {
      throw new IllegalArgumentException("Nothing to append");
    }

    List<Spectrum> ordered = new ArrayList<>(spectra);
    ordered.sort(Comparator.comparingDouble(s -> s.getNumberOfPoints() == 0 ?
        Double.POSITIVE_INFINITY : s.getEnergyLoss()[0]));

    int numberOfChannels = ordered.get(0).getNumberOfChannels();
    int totalPoints = 0;
    for (Spectrum spectrum : ordered) {
      if (spectrum.getNumberOfChannels() != numberOfChannels) {
        throw new IllegalArgumentException(String.format(
            "Cannot append %s with %d channels to spectra with %d channels",
            spectrum.getLabel(), spectrum.getNumberOfChannels(), numberOfChannels));
      }
      totalPoints += spectrum.getNumberOfPoints();
    }

    double[] energyLoss = new double[totalPoints];
    double[][] signals = new double[numberOfChannels][totalPoints];
    double[][] errors = new double[numberOfChannels][totalPoints];
    int offset = 0;
    for (Spectrum spectrum : ordered) {
      int n = spectrum.getNumberOfPoints();
      System.arraycopy(spectrum.getEnergyLoss(), 0, energyLoss, offset, n);
      for (int channel = 0; channel < numberOfChannels; channel++) {
        System.arraycopy(spectrum.getSignal(channel), 0, signals[channel], offset, n);
        System.arraycopy(spectrum.getError(channel), 0, errors[channel], offset, n);
      }
      offset += n;
    }

    LOGGER.info("Appended %d spectra into %d points", ordered.size(), totalPoints);
    return new Spectrum(APPENDED_LABEL, energyLoss, signals, errors);
  }
}
