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
import com.act.xrs.calibration.CalibrationException;
import com.act.xrs.calibration.Calibrator;
import com.act.xrs.geometry.InstrumentGeometry;
import com.act.xrs.geometry.MomentumTransfer;
import com.act.xrs.geometry.MomentumTransferTable;
import com.act.xrs.resample.Resampler;
import com.act.xrs.resample.Spectrum;
import com.act.xrs.resample.SpectrumAppender;
import com.act.xrs.scans.AggregationResult;
import com.act.xrs.scans.GroupAggregator;
import com.act.xrs.scans.ScanGroup;
import com.act.xrs.scans.ScanRegistry;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Drives the reduction of the scans in a registry: aggregation, calibration against the elastic group, then
 * resampling and momentum transfer, which both need a calibration but not each other.
 *
 * Stages may be re-run.  Re-aggregating or recalibrating discards the spectra and q table derived from the previous
 * run.  The calibration survives re-aggregation only while the elastic group still holds exactly the scans it was
 * derived from.
 */
public class ReductionPipeline {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ReductionPipeline.class);

  private final ScanRegistry registry;
  private final InstrumentGeometry geometry;
  private final MomentumTransfer.Units units;
  private final GroupAggregator aggregator;
  private final Calibrator calibrator;
  private final SpectrumAppender appender;

  private AggregationResult aggregation;
  private Calibration calibration;
  private Map<String, Spectrum> groupSpectra;
  private Spectrum appendedSpectrum;
  private MomentumTransferTable momentumTransfer;

  public ReductionPipeline(ScanRegistry registry, InstrumentGeometry geometry, MomentumTransfer.Units units) {
    this(registry, geometry, units, new GroupAggregator(),
        new Calibrator(ScanRegistry.ELASTIC_TYPE, registry.getExpectedNumberOfChannels()), new SpectrumAppender());
  }

  public ReductionPipeline(ScanRegistry registry, InstrumentGeometry geometry, MomentumTransfer.Units units,
                           GroupAggregator aggregator, Calibrator calibrator, SpectrumAppender appender) {
    this.registry = registry;
    this.geometry = geometry;
    this.units = units;
    this.aggregator = aggregator;
    this.calibrator = calibrator;
    this.appender = appender;
  }

  public PipelineState getState() {
    if (calibration == null) {
      return PipelineState.UNCALIBRATED;
    }
    if (momentumTransfer != null) {
      return PipelineState.GEOMETRY_RESOLVED;
    }
    if (appendedSpectrum != null) {
      return PipelineState.RESAMPLED;
    }
    return PipelineState.CALIBRATED;
  }

  public boolean isResampled() {
    return appendedSpectrum != null;
  }

  public boolean isGeometryResolved() {
    return momentumTransfer != null;
  }

  public AggregationResult aggregate() {
    if (registry.isEmpty()) {
      throw new IllegalStateException("No scans loaded; nothing to aggregate");
    }
    aggregation = aggregator.aggregateAll(registry.getScans());
    clearDerived();
    if (calibration != null && !isCalibrationCurrent()) {
      LOGGER.warn("Elastic scans changed from %s; discarding the calibration derived from them",
          calibration.getElasticScanNumbers());
      calibration = null;
    }
    LOGGER.info("Aggregated %d scans into %d groups (%d failed)",
        registry.size(), aggregation.getGroups().size(), aggregation.getFailures().size());
    return aggregation;
  }

  public Calibration calibrate() throws CalibrationException {
    if (aggregation == null) {
      throw new IllegalStateException("Scans must be aggregated before calibrating");
    }
    calibration = calibrator.calibrate(aggregation);
    clearDerived();
    if (!calibration.getLowConfidenceChannels().isEmpty()) {
      LOGGER.warn("Resolution could not be determined for channels %s", calibration.getLowConfidenceChannels());
    }
    return calibration;
  }

  public Map<String, Spectrum> resample() {
    requireCalibration("resampling");
    Resampler resampler = new Resampler(calibration);
    Map<String, Spectrum> spectra = new LinkedHashMap<>();
    for (Map.Entry<String, ScanGroup> entry : aggregation.getGroups().entrySet()) {
      spectra.put(entry.getKey(), resampler.resample(entry.getValue()));
    }
    groupSpectra = spectra;
    appendedSpectrum = appender.append(spectra.values());
    return Collections.unmodifiableMap(groupSpectra);
  }

  public MomentumTransferTable resolveGeometry() {
    requireCalibration("momentum transfer");
    if (geometry == null) {
      throw new IllegalStateException("No instrument geometry configured; cannot compute momentum transfer");
    }
    if (geometry.getNumberOfChannels() != calibration.getNumberOfChannels()) {
      throw new IllegalStateException(String.format(
          "Instrument geometry describes %d channels but the data has %d",
          geometry.getNumberOfChannels(), calibration.getNumberOfChannels()));
    }
    momentumTransfer = MomentumTransferTable.compute(calibration, sharedEnergyLossAxis(), geometry.computeTth(), units);
    return momentumTransfer;
  }

  /**
   * Runs every stage in order.
   */
  public ReductionResult run() throws CalibrationException {
    aggregate();
    calibrate();
    resample();
    resolveGeometry();
    return getResult();
  }

  public ReductionResult getResult() {
    return new ReductionResult(calibration, groupSpectra, appendedSpectrum, momentumTransfer,
        aggregation == null ? Collections.emptyMap() : aggregation.getFailures());
  }

  public Calibration getCalibration() {
    return calibration;
  }

  public AggregationResult getAggregation() {
    return aggregation;
  }

  public ScanRegistry getRegistry() {
    return registry;
  }

  /**
   * The energy-loss axes of all groups, concatenated in the order of their first point.  Matches the axis of the
   * appended spectrum, whether or not resampling has run.
   */
  double[] sharedEnergyLossAxis() {
    List<ScanGroup> groups = new ArrayList<>(aggregation.getGroups().values());
    groups.sort(Comparator.comparingDouble(ScanGroup::getStartEnergy));
    List<double[]> axes = new ArrayList<>();
    for (ScanGroup group : groups) {
      axes.add(calibration.toEnergyLoss(group.getEnergy()));
    }

    int total = axes.stream().mapToInt(axis -> axis.length).sum();
    double[] shared = new double[total];
    int offset = 0;
    for (double[] axis : axes) {
      System.arraycopy(axis, 0, shared, offset, axis.length);
      offset += axis.length;
    }
    return shared;
  }

  private boolean isCalibrationCurrent() {
    ScanGroup elastic = aggregation.getGroups().get(calibrator.getElasticType());
    return elastic != null && elastic.getMemberScanNumbers().equals(calibration.getElasticScanNumbers());
  }

  private void requireCalibration(String stage) {
    if (calibration == null) {
      throw new IllegalStateException(String.format(
          "Cannot run %s before a successful calibration (state is %s)", stage, getState()));
    }
  }

  private void clearDerived() {
    groupSpectra = null;
    appendedSpectrum = null;
    momentumTransfer = null;
  }
}
