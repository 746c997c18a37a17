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

/**
 * Thrown when a scan cannot be summed into its type group because its shape disagrees with the group's reference
 * scan.  Scans are never truncated or padded to make them fit.
 */
public class AggregationException extends Exception {
  private static final long serialVersionUID = 8190345561204387725L;

  private final String type;
  private final int scanNumber;

  public AggregationException(String type, int scanNumber, String message) {
    super(message);
    this.type = type;
    this.scanNumber = scanNumber;
  }

  public String getType() {
    return type;
  }

  /**
   * Return the number of the scan that could not be aggregated.
   */
  public int getScanNumber() {
    return scanNumber;
  }
}
