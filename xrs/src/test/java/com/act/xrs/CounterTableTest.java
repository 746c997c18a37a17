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

package com.act.xrs;

import org.junit.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CounterTableTest {

  private static Map<String, double[]> counters(double[] energy, double[] monitor) {
    Map<String, double[]> columns = new HashMap<>();
    columns.put("Energy_CC", energy);
    columns.put("Monitor", monitor);
    columns.put("det", new double[energy.length]);
    return columns;
  }

  @Test
  public void testColumnLookupIgnoresCase() throws Exception {
    CounterTable table = new CounterTable(counters(new double[] {9.9, 10.0}, new double[] {100, 200}));
    assertEquals(2, table.getNumberOfPoints());
    assertArrayEquals(new double[] {9.9, 10.0}, table.getEnergy(), 0.0);
    assertArrayEquals(new double[] {100, 200}, table.getMonitor(), 0.0);
    assertTrue("Column names are matched without regard to case", table.hasColumn("DET"));
  }

  @Test
  public void testCustomEnergyAndMonitorColumns() throws Exception {
    Map<String, double[]> columns = new HashMap<>();
    columns.put("anal_energy", new double[] {1.0, 2.0});
    columns.put("kap4dio", new double[] {3.0, 4.0});
    CounterTable table = new CounterTable(columns, "anal_energy", "kap4dio");
    assertArrayEquals(new double[] {3.0, 4.0}, table.getMonitor(), 0.0);
  }

  @Test(expected = InvalidCounterException.class)
  public void testMissingMonitorIsRejected() throws Exception {
    Map<String, double[]> columns = new HashMap<>();
    columns.put("energy_cc", new double[] {1.0});
    new CounterTable(columns);
  }

  @Test(expected = InvalidCounterException.class)
  public void testCountersOfDifferentLengthAreRejected() throws Exception {
    new CounterTable(counters(new double[] {1.0, 2.0}, new double[] {1.0}));
  }

  @Test
  public void testNonPositiveMonitorIsRejected() throws Exception {
    try {
      new CounterTable(counters(new double[] {1.0, 2.0, 3.0}, new double[] {1.0, 0.0, 1.0}));
      fail("A zero monitor count should be rejected");
    } catch (InvalidCounterException e) {
      assertTrue("Message names the offending point", e.getMessage().contains("point 1"));
    }
  }

  @Test(expected = InvalidCounterException.class)
  public void testUnknownColumnIsAnError() throws Exception {
    new CounterTable(counters(new double[] {1.0}, new double[] {1.0})).getColumn("ring_current");
  }
}
