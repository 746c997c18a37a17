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

package com.act.xrs.pipeline;

import com.act.xrs.calibration.Calibration;
import com.act.xrs.geometry.MomentumTransferTable;
import com.act.xrs.resample.Spectrum;
import com.act.xrs.scans.AggregationException;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Everything one reduction run produced.  Stages that were not run are null.
 */
public class ReductionResult {
  private final Calibration calibration;
  private final Map<String, Spectrum> groupSpectra;
  private final Spectrum appendedSpectrum;
  private final MomentumTransferTable momentumTransfer;
  private final Map<String, AggregationException> aggregationFailures;

  public ReductionResult(Calibration calibration, Map<String, Spectrum> groupSpectra, Spectrum appendedSpectrum,
                         MomentumTransferTable momentumTransfer,
                         Map<String, AggregationException> aggregationFailures) {
    this.calibration = calibration;
    this.groupSpectra = groupSpectra == null ? null : Collections.unmodifiableMap(new LinkedHashMap<>(groupSpectra));
    this.appendedSpectrum = appendedSpectrum;
    this.momentumTransfer = momentumTransfer;
    this.aggregationFailures = Collections.unmodifiableMap(new LinkedHashMap<>(aggregationFailures));
  }

  public Calibration getCalibration() {
    return calibration;
  }

  public Map<String, Spectrum> getGroupSpectra() {
    return groupSpectra;
  }

  public Spectrum getGroupSpectrum(String type) {
    return groupSpectra == null ? null : groupSpectra.get(type);
  }

  public Spectrum getAppendedSpectrum() {
    return appendedSpectrum;
  }

  public MomentumTransferTable getMomentumTransfer() {
    return momentumTransfer;
  }

  public Map<String, AggregationException> getAggregationFailures() {
    return aggregationFailures;
  }
}
