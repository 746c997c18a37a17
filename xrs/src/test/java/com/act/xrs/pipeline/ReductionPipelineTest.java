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

import com.act.xrs.Scan;
import com.act.xrs.ScanReader;
import com.act.xrs.calibration.Calibration;
import com.act.xrs.calibration.CalibrationException;
import com.act.xrs.geometry.AnalyzerModule;
import com.act.xrs.geometry.InstrumentGeometry;
import com.act.xrs.geometry.MomentumTransfer;
import com.act.xrs.geometry.MomentumTransferTable;
import com.act.xrs.resample.Resampler;
import com.act.xrs.roi.Roi;
import com.act.xrs.roi.RoiIntegrator;
import com.act.xrs.roi.RoiSet;
import com.act.xrs.resample.Spectrum;
import com.act.xrs.scans.ScanGroup;
import com.act.xrs.scans.ScanRegistry;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;
import static org.mockito.Mockito.mock;

public class ReductionPipelineTest {

  private static final int POINTS = 10;
  private static final int CHANNELS = 3;
  private static final double ELASTIC_ENERGY = 10.000;
  private static final double ELASTIC_FWHM = 0.003;

  private double[] energy;
  private ScanRegistry registry;
  private InstrumentGeometry geometry;

  private Scan scan(int number, String type, double[][] signals) {
    double[][] errors = new double[signals.length][energy.length];
    for (int channel = 0; channel < signals.length; channel++) {
      for (int i = 0; i < energy.length; i++) {
        errors[channel][i] = Math.sqrt(signals[channel][i]);
      }
    }
    double[] monitor = new double[energy.length];
    Arrays.fill(monitor, 1000.0);
    return new Scan(number, type, energy, monitor, signals, errors);
  }

  private double[][] elasticSignals() {
    double sigma = ELASTIC_FWHM / (2.0 * Math.sqrt(2.0 * Math.log(2.0)));
    double[][] signals = new double[CHANNELS][POINTS];
    for (int channel = 0; channel < CHANNELS; channel++) {
      for (int i = 0; i < POINTS; i++) {
        double d = (energy[i] - ELASTIC_ENERGY) / sigma;
        signals[channel][i] = 100.0 * (channel + 1) * Math.exp(-0.5 * d * d);
      }
    }
    return signals;
  }

  private double[][] edgeSignals() {
    double[][] signals = new double[CHANNELS][POINTS];
    for (int channel = 0; channel < CHANNELS; channel++) {
      for (int i = 0; i < POINTS; i++) {
        signals[channel][i] = 10.0 + 5.0 * i + channel;
      }
    }
    return signals;
  }

  @Before
  public void setup() {
    energy = new double[POINTS];
    for (int i = 0; i < POINTS; i++) {
      energy[i] = 9.9955 + 0.001 * i;
    }
    registry = new ScanRegistry();
    registry.add(scan(1, ScanRegistry.ELASTIC_TYPE, elasticSignals()));
    registry.add(scan(2, ScanRegistry.ELASTIC_TYPE, elasticSignals()));
    registry.add(scan(3, "edge1", edgeSignals()));

    geometry = new InstrumentGeometry(new double[] {0.0, 0.0, 0.0}, new double[] {-1.0, 0.0, 1.0},
        Collections.singletonMap(AnalyzerModule.VD, 30.0), Collections.singletonList(AnalyzerModule.VD));
  }

  @Test
  public void testEndToEndReduction() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC);
    ReductionResult result = pipeline.run();

    assertEquals(PipelineState.GEOMETRY_RESOLVED, pipeline.getState());
    assertTrue(result.getAggregationFailures().isEmpty());

    Calibration calibration = result.getCalibration();
    assertEquals("E0 sits on the elastic line", ELASTIC_ENERGY, calibration.getReferenceEnergy(), 1e-4);
    for (int channel = 0; channel < CHANNELS; channel++) {
      assertEquals(ELASTIC_ENERGY, calibration.getCentroid(channel), 1e-6);
      // Half-maximum crossings are interpolated linearly on a 1 eV grid.
      assertEquals("Elastic width in eV", 3.0, calibration.getResolution(channel), 0.3);
    }

    Spectrum elastic = result.getGroupSpectrum(ScanRegistry.ELASTIC_TYPE);
    assertEquals("Eloss axis starts 4.5 eV below the elastic line", -4.5, elastic.getEnergyLoss()[0], 1e-6);
    assertEquals(4.5, elastic.getEnergyLoss()[POINTS - 1], 1e-6);
    assertEquals("Two elastic scans are summed", 2.0 * elasticSignals()[2][4], elastic.getSignal(2)[4], 1e-6);

    Spectrum appended = result.getAppendedSpectrum();
    assertEquals(2 * POINTS, appended.getNumberOfPoints());
    assertEquals(CHANNELS, appended.getNumberOfChannels());

    MomentumTransferTable q = result.getMomentumTransfer();
    assertArrayEquals(new double[] {29.0, 30.0, 31.0}, q.getTth(), 1e-9);
    assertArrayEquals("q is tabulated on the appended axis", appended.getEnergyLoss(), q.getEnergyLoss(), 0.0);
    assertEquals(MomentumTransfer.atomicUnits(calibration.getReferenceEnergy() + 0.0045,
        calibration.getReferenceEnergy(), 30.0), q.getQ(1)[2 * POINTS - 1], 1e-6);
  }

  @Test
  public void testEdgeSignalAtZeroLossIsInterpolatedFromNeighbours() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC);
    pipeline.aggregate();
    Calibration calibration = pipeline.calibrate();

    ScanGroup edge = pipeline.getAggregation().getGroup("edge1");
    Spectrum atZero = new Resampler(calibration).resample(edge, new double[] {0.0});

    double[][] raw = edgeSignals();
    for (int channel = 0; channel < CHANNELS; channel++) {
      double centroid = calibration.getCentroid(channel);
      int below = 0;
      while (energy[below + 1] <= centroid) {
        below++;
      }
      double fraction = (centroid - energy[below]) / (energy[below + 1] - energy[below]);
      double expected = raw[channel][below] + fraction * (raw[channel][below + 1] - raw[channel][below]);
      assertEquals(String.format("Channel %d at zero energy loss", channel), expected, atZero.getSignal(channel)[0],
          1e-6);
    }
  }

  @Test
  public void testStagesRequireCalibration() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC);
    pipeline.aggregate();
    assertEquals(PipelineState.UNCALIBRATED, pipeline.getState());

    try {
      pipeline.resample();
      fail("Resampling before calibration must fail");
    } catch (IllegalStateException e) {
      assertEquals(PipelineState.UNCALIBRATED, pipeline.getState());
    }
    try {
      pipeline.resolveGeometry();
      fail("Momentum transfer before calibration must fail");
    } catch (IllegalStateException e) {
      assertNull(pipeline.getCalibration());
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testCalibrationRequiresAggregation() throws Exception {
    new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC).calibrate();
  }

  @Test
  public void testGeometryDoesNotNeedResampling() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.INVERSE_ANGSTROM);
    pipeline.aggregate();
    pipeline.calibrate();
    MomentumTransferTable q = pipeline.resolveGeometry();

    assertEquals(PipelineState.GEOMETRY_RESOLVED, pipeline.getState());
    assertFalse(pipeline.isResampled());
    assertEquals(2 * POINTS, q.getEnergyLoss().length);
    assertEquals(MomentumTransfer.Units.INVERSE_ANGSTROM, q.getUnits());
  }

  @Test
  public void testRecalibrationDiscardsDerivedResults() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC);
    ReductionResult first = pipeline.run();
    Calibration recalibrated = pipeline.calibrate();

    assertEquals(PipelineState.CALIBRATED, pipeline.getState());
    assertNull(pipeline.getResult().getAppendedSpectrum());
    assertNull(pipeline.getResult().getMomentumTransfer());
    assertNotNull("Earlier results keep their spectra", first.getAppendedSpectrum());
    assertNotSame("A new calibration record is produced", first.getCalibration(), recalibrated);
  }

  @Test
  public void testCalibrationSurvivesOnlyWhileElasticScansAreUnchanged() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC);
    pipeline.aggregate();
    Calibration calibration = pipeline.calibrate();

    pipeline.aggregate();
    assertSame("Same elastic scans keep the calibration", calibration, pipeline.getCalibration());
    assertEquals(PipelineState.CALIBRATED, pipeline.getState());

    registry.drop(Collections.singletonList(2));
    pipeline.aggregate();
    assertNull("Dropping an elastic scan invalidates the calibration", pipeline.getCalibration());
    assertEquals(PipelineState.UNCALIBRATED, pipeline.getState());
  }

  @Test(expected = CalibrationException.class)
  public void testElasticChannelsMustMatchRoiSet() throws Exception {
    RoiIntegrator twoRois = new RoiIntegrator(new RoiSet(
        Arrays.asList(Roi.rectangle(0, 1, 0, 1), Roi.rectangle(1, 2, 0, 1)), 2, 1));
    ScanRegistry integrated = new ScanRegistry(mock(ScanReader.class), twoRois);
    integrated.add(scan(1, ScanRegistry.ELASTIC_TYPE, elasticSignals()));

    ReductionPipeline pipeline = new ReductionPipeline(integrated, geometry, MomentumTransfer.Units.ATOMIC);
    pipeline.aggregate();
    pipeline.calibrate();
  }

  @Test
  public void testGeometryMustDescribeEveryChannel() throws Exception {
    ReductionPipeline pipeline = new ReductionPipeline(registry, InstrumentGeometry.id20(),
        MomentumTransfer.Units.ATOMIC);
    pipeline.aggregate();
    pipeline.calibrate();
    try {
      pipeline.resolveGeometry();
      fail("A 72 channel geometry cannot describe 3 channels");
    } catch (IllegalStateException e) {
      assertTrue(e.getMessage().contains("72"));
    }
  }

  @Test
  public void testMissingElasticScansFailCalibration() throws Exception {
    registry.drop(Arrays.asList(1, 2));
    ReductionPipeline pipeline = new ReductionPipeline(registry, geometry, MomentumTransfer.Units.ATOMIC);
    try {
      pipeline.run();
      fail("Calibration needs an elastic group");
    } catch (CalibrationException e) {
      assertEquals(PipelineState.UNCALIBRATED, pipeline.getState());
    }
  }
}
