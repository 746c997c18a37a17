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

package com.act.xrs.roi;

import com.act.xrs.RawFrame;
import org.apache.commons.lang3.tuple.Pair;
import org.junit.Before;
import org.junit.Test;

import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;

public class RoiIntegratorTest {

  private static final double DELTA = 1e-12;

  private RawFrame frame;

  @Before
  public void setup() {
    frame = RawFrame.fromCounts(new int[][] {
        {1, 2, 0},
        {3, 4, 0},
        {0, 0, 0},
    });
  }

  @Test
  public void testSumsPixelsOfEachRoi() throws Exception {
    RoiSet rois = new RoiSet(Arrays.asList(
        Roi.rectangle(0, 2, 0, 2),
        Roi.fromPixels(Arrays.asList(Pair.of(0, 1), Pair.of(1, 0))),
        Roi.rectangle(2, 3, 0, 3)), 3, 3);
    IntegratedFrame integrated = new RoiIntegrator(rois).integrate(frame);

    assertEquals(3, integrated.getNumberOfChannels());
    assertEquals("Rectangle covering the top left block", 10.0, integrated.getSignal(0), DELTA);
    assertEquals("Error is the square root of the counts", Math.sqrt(10.0), integrated.getError(0), DELTA);
    assertEquals("Pixel list ROI", 5.0, integrated.getSignal(1), DELTA);
    assertEquals("Empty region integrates to zero", 0.0, integrated.getSignal(2), DELTA);
    assertEquals("Zero counts have zero error", 0.0, integrated.getError(2), 0.0);
  }

  @Test(expected = RoiConfigurationException.class)
  public void testRoiOutsideDetectorIsRejected() throws Exception {
    new RoiSet(Collections.singletonList(Roi.rectangle(2, 4, 0, 1)), 3, 3);
  }

  @Test(expected = RoiConfigurationException.class)
  public void testFrameOfWrongShapeIsRejected() throws Exception {
    RoiSet rois = new RoiSet(Collections.singletonList(Roi.rectangle(0, 1, 0, 1)), 4, 4);
    RoiIntegrator integrator = new RoiIntegrator(rois);
    integrator.integrate(frame);
  }

  @Test(expected = RoiConfigurationException.class)
  public void testRepeatedPixelIsRejected() throws Exception {
    Roi.fromPixels(Arrays.asList(Pair.of(0, 0), Pair.of(1, 1), Pair.of(0, 0)));
  }

  @Test(expected = RoiConfigurationException.class)
  public void testEmptyRectangleIsRejected() throws Exception {
    Roi.rectangle(1, 1, 0, 2);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativePixelsAreRejected() throws Exception {
    new RawFrame(new double[][] {{1.0, -1.0}});
  }
}
