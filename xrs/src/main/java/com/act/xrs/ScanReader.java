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

import java.io.IOException;

/**
 * Source of raw scan data.  Implementations know how to locate and decode an instrument's counter logs and detector
 * images; the reduction code only asks for a scan by number.
 */
public interface ScanReader {
  /**
   * Reads every frame and counter of one scan.
   * @param scanNumber The number of the scan in the acquisition log.
   * @return The raw frames and counters of the scan.
   * @throws IOException If the scan's files cannot be read.
   */
  RawScan readScan(int scanNumber) throws IOException;
}
