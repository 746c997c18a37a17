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

import org.junit.Test;

import java.io.InputStream;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class InstrumentGeometryTest {

  private static final double DELTA = 1e-9;

  private static double tth(double horizontal, double vertical) {
    return Math.toDegrees(Math.acos(Math.cos(Math.toRadians(horizontal)) * Math.cos(Math.toRadians(vertical))));
  }

  @Test
  public void testLoadsGeometryFromJson() throws Exception {
    InstrumentGeometry geometry;
    try (InputStream stream = getClass().getResourceAsStream("test_geometry.json")) {
      geometry = InstrumentGeometry.fromJson(stream);
    }

    assertEquals(Arrays.asList(AnalyzerModule.VD, AnalyzerModule.HL), geometry.getModuleOrder());
    assertEquals(3, geometry.getAnalyzersPerModule());
    assertEquals(6, geometry.getNumberOfChannels());
    assertEquals(30.0, geometry.getMeanAngle(AnalyzerModule.VD), 0.0);
    assertEquals("Unconfigured modules sit at 0", 0.0, geometry.getMeanAngle(AnalyzerModule.HB), 0.0);
  }

  @Test
  public void testTthCombinesModuleAngleWithOffsets() throws Exception {
    InstrumentGeometry geometry;
    try (InputStream stream = getClass().getResourceAsStream("test_geometry.json")) {
      geometry = InstrumentGeometry.fromJson(stream);
    }

    double[] expected = new double[] {
        // VD at 30 degrees: the module angle adds to the vertical offsets.
        20.0, tth(5.0, 30.0), 40.0,
        // HL at 60 degrees: the module angle adds to the horizontal offsets.
        50.0, tth(60.0, 5.0), 70.0,
    };
    assertArrayEquals(expected, geometry.computeTth(), DELTA);
  }

  @Test
  public void testId20Geometry() throws Exception {
    InstrumentGeometry geometry = InstrumentGeometry.id20();
    double[] tth = geometry.computeTth();

    assertEquals("Six modules of twelve analyzers", 72, tth.length);
    assertEquals("Central VD analyzer", 9.75, tth[1], DELTA);
    assertEquals(tth(5.0, -9.71), tth[0], DELTA);
    assertEquals("Mirrored analyzers see the same angle", tth[0], tth[2], DELTA);
    assertEquals("Central HR analyzer", 9.75, tth[37], DELTA);
  }

  @Test
  public void testBundledId20ResourceMatchesBuiltIn() throws Exception {
    assertArrayEquals(InstrumentGeometry.id20().computeTth(), InstrumentGeometry.loadId20().computeTth(), 0.0);
    assertEquals(InstrumentGeometry.ID20_MODULE_ORDER, InstrumentGeometry.loadId20().getModuleOrder());
  }

  @Test
  public void testWithMeanAnglesOnlyChangesNamedModules() throws Exception {
    InstrumentGeometry moved = InstrumentGeometry.id20()
        .withMeanAngles(Collections.singletonMap(AnalyzerModule.VD, 10.0));

    assertEquals(0.25, moved.computeTth()[1], DELTA);
    assertEquals("VU is untouched", 9.75, moved.computeTth()[13], DELTA);
    assertEquals("The original geometry is unchanged", 9.75, InstrumentGeometry.id20().computeTth()[1], DELTA);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testOffsetTablesMustAgreeInLength() throws Exception {
    new InstrumentGeometry(new double[] {1.0, 2.0}, new double[] {1.0}, null,
        Collections.singletonList(AnalyzerModule.VD));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testModuleOrderMustNotRepeat() throws Exception {
    new InstrumentGeometry(new double[] {0.0}, new double[] {0.0}, null,
        Arrays.asList(AnalyzerModule.VD, AnalyzerModule.VD));
  }
}
