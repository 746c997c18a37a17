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

package com.act.xrs.scans;

import com.act.xrs.CounterTable;
import com.act.xrs.RawFrame;
import com.act.xrs.RawScan;
import com.act.xrs.Scan;
import com.act.xrs.ScanReader;
import com.act.xrs.roi.Roi;
import com.act.xrs.roi.RoiIntegrator;
import com.act.xrs.roi.RoiSet;
import org.junit.Before;
import org.junit.Test;
import org.mockito.Mockito;

import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ScanRegistryTest {

  ScanReader mockReader = Mockito.mock(ScanReader.class);

  private ScanRegistry registry;

  private static RawScan rawScan(int number) {
    Map<String, double[]> columns = new HashMap<>();
    columns.put("energy_cc", new double[] {9.999, 10.001});
    columns.put("monitor", new double[] {1.0, 1.0});
    List<RawFrame> frames = Arrays.asList(
        RawFrame.fromCounts(new int[][] {{number, 0}, {0, 1}}),
        RawFrame.fromCounts(new int[][] {{number, 1}, {0, 1}}));
    return new RawScan(number, frames, new CounterTable(columns));
  }

  @Before
  public void setup() throws IOException {
    Mockito.when(mockReader.readScan(Mockito.anyInt()))
        .thenAnswer(invocation -> rawScan(invocation.<Integer>getArgument(0)));
    RoiSet rois = new RoiSet(Arrays.asList(Roi.rectangle(0, 1, 0, 1), Roi.rectangle(1, 2, 0, 2)), 2, 2);
    registry = new ScanRegistry(mockReader, new RoiIntegrator(rois));
  }

  @Test
  public void testLoadIntegratesAndTagsScans() throws Exception {
    List<Scan> loaded = registry.loadElastic(Arrays.asList(3, 4));

    assertEquals(2, loaded.size());
    assertEquals(ScanRegistry.ELASTIC_TYPE, registry.getScan(3).getType());
    assertEquals("ROI 0 picks up the scan number pixel", 4.0, registry.getScan(4).getSignal(0)[0], 0.0);
    assertEquals(Arrays.asList(3, 4), registry.getScanNumbers());
    Mockito.verify(mockReader).readScan(3);
    Mockito.verify(mockReader).readScan(4);
  }

  @Test
  public void testLoadLoopAssignsRegionTypes() throws Exception {
    registry.loadLoop(Arrays.asList(10, 20), 3);

    assertEquals(6, registry.size());
    List<Integer> edge2 = registry.getScansOfType("edge2").stream().map(Scan::getNumber).collect(Collectors.toList());
    assertEquals("The second region of every loop is grouped", Arrays.asList(11, 21), edge2);
    assertTrue(registry.getTypes().containsAll(Arrays.asList("edge1", "edge2", "edge3")));
  }

  @Test
  public void testDuplicateScanIsRejected() throws Exception {
    registry.load(5, ScanRegistry.LONG_TYPE);
    try {
      registry.load(5, "elastic");
      fail("Loading the same scan twice should fail");
    } catch (IllegalArgumentException e) {
      assertEquals("The first copy remains", ScanRegistry.LONG_TYPE, registry.getScan(5).getType());
    }
  }

  @Test
  public void testDropRemovesScans() throws Exception {
    registry.loadElastic(Arrays.asList(1, 2, 3));
    registry.drop(Arrays.asList(1, 3));
    assertEquals(Collections.singletonList(2), registry.getScanNumbers());
    assertFalse(registry.contains(1));
  }

  @Test
  public void testDropOfUnknownScanLeavesRegistryIntact() throws Exception {
    registry.loadElastic(Arrays.asList(1, 2));
    try {
      registry.drop(Arrays.asList(1, 99));
      fail("Dropping an unknown scan should fail");
    } catch (IllegalArgumentException e) {
      assertTrue("Nothing was dropped", registry.contains(1));
    }
  }

  @Test
  public void testReaderFailurePropagates() throws Exception {
    Mockito.when(mockReader.readScan(13)).thenThrow(new IOException("scan 13 is corrupt"));
    try {
      registry.loadElastic(Arrays.asList(12, 13));
      fail("Reader failures should propagate");
    } catch (IOException e) {
      assertTrue("Scans before the failure stay registered", registry.contains(12));
    }
  }

  @Test(expected = IllegalStateException.class)
  public void testLoadWithoutReaderIsAnError() throws Exception {
    new ScanRegistry().load(1, "elastic");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testChannelCountMustMatchRegisteredScans() throws Exception {
    ScanRegistry manual = new ScanRegistry();
    manual.add(new Scan(1, "elastic", new double[] {1.0}, new double[] {1.0},
        new double[][] {{1.0}}, new double[][] {{1.0}}));
    manual.add(new Scan(2, "elastic", new double[] {1.0}, new double[] {1.0},
        new double[][] {{1.0}, {1.0}}, new double[][] {{1.0}, {1.0}}));
  }
}
