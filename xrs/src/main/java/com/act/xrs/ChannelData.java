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

/**
 * Per-point, per-channel measurement data on a raw energy axis.  Implemented by single scans and by aggregated groups
 * of scans, so that calibration and resampling can treat both the same way.
 *
 * Arrays returned by implementations are copies; callers may modify them freely.
 */
public interface ChannelData {
  /**
   * Return a short human readable description of the data, used in log and error messages.
   */
  String getLabel();

  /**
   * Return the number of scan points, i.e. the length of every per-point array.
   */
  int getNumberOfPoints();

  /**
   * Return the number of analyzer channels.
   */
  int getNumberOfChannels();

  /**
   * Return the raw energy value (in keV) of every scan point.
   */
  double[] getEnergy();

  /**
   * Return the monitor count of every scan point.
   */
  double[] getMonitor();

  /**
   * Return the integrated signal of one channel at every scan point.
   */
  double[] getSignal(int channel);

  /**
   * Return the error of one channel's signal at every scan point.
   */
  double[] getError(int channel);
}
