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

import com.act.xrs.RawScan;
import com.act.xrs.Scan;
import com.act.xrs.ScanReader;
import com.act.xrs.roi.RoiIntegrator;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The scans of one reduction session, keyed by scan number in the order they were added.
 *
 * A registry is owned by whoever drives the reduction and handed to the pipeline stages explicitly.  Scans are only
 * added or dropped through the methods below; individual scans are immutable.
 */
public class ScanRegistry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(ScanRegistry.class);

  public static final String ELASTIC_TYPE = "elastic";
  public static final String LONG_TYPE = "long";
  public static final String LOOP_TYPE_PREFIX = "edge";

  private final Map<Integer, Scan> scans = new LinkedHashMap<>();
  private final ScanReader reader;
  private final RoiIntegrator integrator;

  /**
   * Creates a registry that can only hold already integrated scans (see {@link #add(Scan)}).
   */
  public ScanRegistry() {
    this(null, null);
  }

  public ScanRegistry(ScanReader reader, RoiIntegrator integrator) {
    this.reader = reader;
    this.integrator = integrator;
  }

  /**
   * Return the number of ROIs scans are integrated over, or null if this registry only holds pre-integrated scans.
   */
  public Integer getExpectedNumberOfChannels() {
    return integrator == null ? null : integrator.getNumberOfChannels();
  }

  public void add(Scan scan) {
    if (scans.containsKey(scan.getNumber())) {
      throw new IllegalArgumentException(String.format("Scan %d is already registered", scan.getNumber()));
    }
    if (!scans.isEmpty()) {
      int expectedChannels = scans.values().iterator().next().getNumberOfChannels();
      if (scan.getNumberOfChannels() != expectedChannels) {
        throw new IllegalArgumentException(String.format(
            "Scan %d has %d channels, registered scans have %d",
            scan.getNumber(), scan.getNumberOfChannels(), expectedChannels));
      }
    }
    scans.put(scan.getNumber(), scan);
  }

  /**
   * Reads, integrates and registers scans.
   * @param scanNumbers The scans to load.
   * @param type The type label to give every loaded scan.
   * @return The loaded scans, in the order given.
   * @throws IOException If the reader fails on any scan; scans loaded before the failure stay registered.
   */
  public List<Scan> load(List<Integer> scanNumbers, String type) throws IOException {
    if (reader == null || integrator == null) {
      throw new IllegalStateException("This registry has no scan reader and ROI set to load raw scans with");
    }
    List<Scan> loaded = new ArrayList<>(scanNumbers.size());
    for (Integer number : scanNumbers) {
      if (scans.containsKey(number)) {
        throw new IllegalArgumentException(String.format("Scan %d is already registered", number));
      }
      LOGGER.info("Loading scan %d as '%s'", number, type);
      RawScan raw = reader.readScan(number);
      Scan scan = Scan.fromRawScan(raw, type, integrator);
      add(scan);
      loaded.add(scan);
    }
    return loaded;
  }

  public List<Scan> load(int scanNumber, String type) throws IOException {
    return load(Collections.singletonList(scanNumber), type);
  }

  public List<Scan> loadElastic(List<Integer> scanNumbers) throws IOException {
    return load(scanNumbers, ELASTIC_TYPE);
  }

  public List<Scan> loadLong(List<Integer> scanNumbers) throws IOException {
    return load(scanNumbers, LONG_TYPE);
  }

  /**
   * Loads repeated loops of consecutive region scans.  Loop {@code k} consists of scans
   * {@code beginNumbers[k] .. beginNumbers[k] + regionsPerLoop - 1}; the {@code n}-th scan of each loop is given the
   * type {@code "edge" + n} (1-based), so identical regions of different loops end up in the same group.
   */
  public List<Scan> loadLoop(List<Integer> beginNumbers, int regionsPerLoop) throws IOException {
    if (regionsPerLoop <= 0) {
      throw new IllegalArgumentException(String.format("A loop needs at least one region, got %d", regionsPerLoop));
    }
    List<Scan> loaded = new ArrayList<>(beginNumbers.size() * regionsPerLoop);
    for (Integer begin : beginNumbers) {
      for (int region = 0; region < regionsPerLoop; region++) {
        loaded.addAll(load(begin + region, LOOP_TYPE_PREFIX + (region + 1)));
      }
    }
    return loaded;
  }

  /**
   * Removes scans from the session.  Unknown scan numbers are an error.
   */
  public void drop(List<Integer> scanNumbers) {
    for (Integer number : scanNumbers) {
      if (!scans.containsKey(number)) {
        throw new IllegalArgumentException(String.format("Cannot drop scan %d: it is not registered", number));
      }
    }
    for (Integer number : scanNumbers) {
      scans.remove(number);
      LOGGER.info("Dropped scan %d", number);
    }
  }

  public Scan getScan(int number) {
    return scans.get(number);
  }

  public boolean contains(int number) {
    return scans.containsKey(number);
  }

  public Collection<Scan> getScans() {
    return Collections.unmodifiableCollection(scans.values());
  }

  public List<Integer> getScanNumbers() {
    return new ArrayList<>(scans.keySet());
  }

  public List<Scan> getScansOfType(String type) {
    List<Scan> ofType = new ArrayList<>();
    for (Scan scan : scans.values()) {
      if (scan.getType().equals(type)) {
        ofType.add(scan);
      }
    }
    return ofType;
  }

  public Set<String> getTypes() {
    Set<String> types = new LinkedHashSet<>();
    for (Scan scan : scans.values()) {
      types.add(scan.getType());
    }
    return types;
  }

  public int size() {
    return scans.size();
  }

  public boolean isEmpty() {
    return scans.isEmpty();
  }
}
