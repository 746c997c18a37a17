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

import com.act.xrs.Scan;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Partitions scans by type label and sums each partition into one {@link ScanGroup}.
 *
 * The first scan of a partition (in the order the scans were supplied) is the reference: its energy axis becomes the
 * group's axis and every other member must have the same number of points and channels.  Only lengths are compared;
 * the members' energy values are not checked against each other.
 */
public class GroupAggregator {
  private static final Logger LOGGER = LogManager.getFormatterLogger(GroupAggregator.class);

  /**
   * Splits scans into type partitions, keeping the order in which types and scans first appear.
   */
  public Map<String, List<Scan>> partition(Collection<Scan> scans) {
    Map<String, List<Scan>> partitions = new LinkedHashMap<>();
    for (Scan scan : scans) {
      partitions.computeIfAbsent(scan.getType(), k -> new ArrayList<>()).add(scan);
    }
    return partitions;
  }

  /**
   * Sums scans of one type into a group.
   * @param type The type label shared by all scans.
   * @param scans The member scans, reference scan first.
   * @return The aggregated group.
   * @throws AggregationException If any member's point or channel count disagrees with the reference scan.
   */
  public ScanGroup aggregate(String type, List<Scan> scans) throws AggregationException {
    if (scans.isEmpty()) {
      throw new IllegalArgumentException(String.format("Cannot aggregate an empty list of '%s' scans", type));
    }

    Scan reference = scans.get(0);
    int numberOfPoints = reference.getNumberOfPoints();
    int numberOfChannels = reference.getNumberOfChannels();

    double[] monitor = new double[numberOfPoints];
    double[][] signals = new double[numberOfChannels][numberOfPoints];
    // Accumulates squared errors; the square root is taken once all members are in.
    double[][] squaredErrors = new double[numberOfChannels][numberOfPoints];
    List<Integer> members = new ArrayList<>(scans.size());

    for (Scan scan : scans) {
      if (!type.equals(scan.getType())) {
        throw new IllegalArgumentException(String.format(
            "Scan %d has type '%s' and cannot join group '%s'", scan.getNumber(), scan.getType(), type));
      }
      if (scan.getNumberOfPoints() != numberOfPoints) {
        throw new AggregationException(type, scan.getNumber(), String.format(
            "Scan %d has %d points but reference scan %d of group '%s' has %d",
            scan.getNumber(), scan.getNumberOfPoints(), reference.getNumber(), type, numberOfPoints));
      }
      if (scan.getNumberOfChannels() != numberOfChannels) {
        throw new AggregationException(type, scan.getNumber(), String.format(
            "Scan %d has %d channels but reference scan %d of group '%s' has %d",
            scan.getNumber(), scan.getNumberOfChannels(), reference.getNumber(), type, numberOfChannels));
      }

      double[] scanMonitor = scan.getMonitor();
      for (int point = 0; point < numberOfPoints; point++) {
        monitor[point] += scanMonitor[point];
      }
      for (int channel = 0; channel < numberOfChannels; channel++) {
        double[] signal = scan.getSignal(channel);
        double[] error = scan.getError(channel);
        for (int point = 0; point < numberOfPoints; point++) {
          signals[channel][point] += signal[point];
          squaredErrors[channel][point] += error[point] * error[point];
        }
      }
      members.add(scan.getNumber());
    }

    double[][] errors = new double[numberOfChannels][numberOfPoints];
    for (int channel = 0; channel < numberOfChannels; channel++) {
      for (int point = 0; point < numberOfPoints; point++) {
        errors[channel][point] = Math.sqrt(squaredErrors[channel][point]);
      }
    }

    LOGGER.info("Aggregated %d '%s' scans of %d points", members.size(), type, numberOfPoints);
    return new ScanGroup(type, members, reference.getEnergy(), monitor, signals, errors);
  }

  /**
   * Partitions and aggregates all scans.  A failing group is recorded and skipped so the remaining groups are still
   * produced.
   */
  public AggregationResult aggregateAll(Collection<Scan> scans) {
    Map<String, ScanGroup> groups = new LinkedHashMap<>();
    Map<String, AggregationException> failures = new LinkedHashMap<>();
    for (Map.Entry<String, List<Scan>> partition : partition(scans).entrySet()) {
      try {
        groups.put(partition.getKey(), aggregate(partition.getKey(), partition.getValue()));
      } catch (AggregationException e) {
        LOGGER.error("Could not aggregate group '%s': %s", partition.getKey(), e.getMessage());
        failures.put(partition.getKey(), e);
      }
    }
    return new AggregationResult(groups, failures);
  }
}
