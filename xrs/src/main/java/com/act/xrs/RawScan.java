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

import java.util.Collections;
import java.util.List;

/**
 * The unreduced contents of one scan as delivered by a {@link ScanReader}: one detector frame per scan point plus the
 * counter table for the same points.
 */
public class RawScan {
  private final int scanNumber;
  private final List<RawFrame> frames;
  private final CounterTable counters;

  public RawScan(int scanNumber, List<RawFrame> frames, CounterTable counters) {
    if (frames.size() != counters.getNumberOfPoints()) {
      throw new InvalidCounterException(String.format(
          "Scan %d has %d frames but %d counter readings", scanNumber, frames.size(), counters.getNumberOfPoints()));
    }
    this.scanNumber = scanNumber;
    this.frames = Collections.unmodifiableList(frames);
    this.counters = counters;
  }

  public int getScanNumber() {
    return scanNumber;
  }

  public List<RawFrame> getFrames() {
    return frames;
  }

  public CounterTable getCounters() {
    return counters;
  }
}
