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

import org.junit.Test;

import java.util.Arrays;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class SpectrumAppenderTest {

  @Test
  public void testSpectraAreOrderedByFirstEnergyLoss() throws Exception {
    Spectrum edge = new Spectrum("edge1", new double[] {100.0, 110.0},
        new double[][] {{5.0, 6.0}}, new double[][] {{0.5, 0.6}});
    Spectrum elastic = new Spectrum("elastic", new double[] {-1.0, 0.0, 1.0},
        new double[][] {{1.0, 2.0, 3.0}}, new double[][] {{0.1, 0.2, 0.3}});

    Spectrum appended = new SpectrumAppender().append(Arrays.asList(edge, elastic));

    assertEquals(5, appended.getNumberOfPoints());
    assertArrayEquals(new double[] {-1.0, 0.0, 1.0, 100.0, 110.0}, appended.getEnergyLoss(), 0.0);
    assertArrayEquals(new double[] {1.0, 2.0, 3.0, 5.0, 6.0}, appended.getSignal(0), 0.0);
    assertArrayEquals(new double[] {0.1, 0.2, 0.3, 0.5, 0.6}, appended.getError(0), 0.0);
  }

  @Test(expected = IllegalArgumentException.class)
  public void testChannelCountsMustAgree() throws Exception {
    Spectrum one = new Spectrum("a", new double[] {0.0}, new double[][] {{1.0}}, new double[][] {{1.0}});
    Spectrum two = new Spectrum("b", new double[] {1.0}, new double[][] {{1.0}, {1.0}}, new double[][] {{1.0}, {1.0}});
    new SpectrumAppender().append(Arrays.asList(one, two));
  }
}
