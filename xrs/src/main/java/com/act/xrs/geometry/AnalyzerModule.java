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

/**
 * The analyzer modules of a multi-analyzer spectrometer.  Vertical modules scatter in the vertical plane, so their
 * module angle adds to the vertical offsets of their analyzers; horizontal modules are the reverse.
 */
public enum AnalyzerModule {
  VD(Orientation.VERTICAL),
  VU(Orientation.VERTICAL),
  VB(Orientation.VERTICAL),
  HR(Orientation.HORIZONTAL),
  HL(Orientation.HORIZONTAL),
  HB(Orientation.HORIZONTAL);

  public enum Orientation {
    VERTICAL,
    HORIZONTAL
  }

  private final Orientation orientation;

  AnalyzerModule(Orientation orientation) {
    this.orientation = orientation;
  }

  public Orientation getOrientation() {
    return orientation;
  }
}
