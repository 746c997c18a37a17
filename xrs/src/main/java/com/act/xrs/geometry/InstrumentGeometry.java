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

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Scattering geometry of a multi-analyzer spectrometer: the per-analyzer angular offsets shared by every module, the
 * mean angle each module is driven to, and the order in which modules map onto detector channels.
 *
 * Each module carries one analyzer per offset pair, so the channel count is {@code offsets.length * modules.size()}.
 * Channel {@code k * offsets.length + n} is analyzer {@code n} of the {@code k}th module in the module order.
 *
 * Geometries are plain configuration and are usually read from JSON:
 * <pre>
 *   {
 *     "fixed_offsets": [5.0, 0.0, -5.0],
 *     "scanning_offsets": [-3.24, 0.0, 3.24],
 *     "mean_angles": {"VD": 35.0},
 *     "module_order": ["VD"]
 *   }
 * </pre>
 */
public class InstrumentGeometry {
  private static final Logger LOGGER = LogManager.getFormatterLogger(InstrumentGeometry.class);
  private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();

  public static final String ID20_GEOMETRY_RESOURCE = "/id20_geometry.json";

  public static final double[] ID20_FIXED_OFFSETS = new double[] {
      5.0, 0.0, -5.0, 5.0, 0.0, -5.0, 5.0, 0.0, -5.0, 5.0, 0.0, -5.0
  };
  public static final double[] ID20_SCANNING_OFFSETS = new double[] {
      -9.71, -9.75, -9.71, -3.24, -3.25, -3.24, 3.24, 3.25, 3.24, 9.71, 9.75, 9.71
  };
  public static final List<AnalyzerModule> ID20_MODULE_ORDER = Collections.unmodifiableList(Arrays.asList(
      AnalyzerModule.VD, AnalyzerModule.VU, AnalyzerModule.VB,
      AnalyzerModule.HR, AnalyzerModule.HL, AnalyzerModule.HB));

  // Offsets perpendicular to the module's scattering plane.
  private final double[] fixedOffsets;
  // Offsets within the module's scattering plane, added to the module's mean angle.
  private final double[] scanningOffsets;
  private final Map<AnalyzerModule, Double> meanAngles;
  private final List<AnalyzerModule> moduleOrder;

  @JsonCreator
  public InstrumentGeometry(@JsonProperty("fixed_offsets") double[] fixedOffsets,
                            @JsonProperty("scanning_offsets") double[] scanningOffsets,
                            @JsonProperty("mean_angles") Map<AnalyzerModule, Double> meanAngles,
                            @JsonProperty("module_order") List<AnalyzerModule> moduleOrder) {
    if (fixedOffsets == null || scanningOffsets == null || fixedOffsets.length != scanningOffsets.length ||
        fixedOffsets.length == 0) {
      throw new IllegalArgumentException(String.format(
          "Fixed and scanning offset tables must be non-empty and equally long, got %s and %s",
          Arrays.toString(fixedOffsets), Arrays.toString(scanningOffsets)));
    }
    if (moduleOrder == null || moduleOrder.isEmpty()) {
      throw new IllegalArgumentException("At least one analyzer module must be listed in the module order");
    }
    if (moduleOrder.size() != moduleOrder.stream().distinct().count()) {
      throw new IllegalArgumentException(String.format("Module order lists a module twice: %s", moduleOrder));
    }

    this.fixedOffsets = Arrays.copyOf(fixedOffsets, fixedOffsets.length);
    this.scanningOffsets = Arrays.copyOf(scanningOffsets, scanningOffsets.length);
    this.meanAngles = new EnumMap<>(AnalyzerModule.class);
    // Modules without a configured mean angle sit at 0 degrees.
    for (AnalyzerModule module : AnalyzerModule.values()) {
      this.meanAngles.put(module, 0.0);
    }
    if (meanAngles != null) {
      this.meanAngles.putAll(meanAngles);
    }
    this.moduleOrder = Collections.unmodifiableList(new ArrayList<>(moduleOrder));
  }

  /**
   * The ID20 spectrometer: six modules of twelve analyzers, all module angles at 0.
   */
  public static InstrumentGeometry id20() {
    return new InstrumentGeometry(ID20_FIXED_OFFSETS, ID20_SCANNING_OFFSETS, null, ID20_MODULE_ORDER);
  }

  /**
   * Loads the ID20 geometry bundled with this library.
   */
  public static InstrumentGeometry loadId20() throws IOException {
    try (InputStream stream = InstrumentGeometry.class.getResourceAsStream(ID20_GEOMETRY_RESOURCE)) {
      if (stream == null) {
        throw new IOException(String.format("Unable to find resource %s", ID20_GEOMETRY_RESOURCE));
      }
      return fromJson(stream);
    }
  }

  public static InstrumentGeometry fromJson(InputStream stream) throws IOException {
    InstrumentGeometry geometry = OBJECT_MAPPER.readValue(stream, InstrumentGeometry.class);
    LOGGER.info("Loaded geometry with %d modules and %d channels",
        geometry.getModuleOrder().size(), geometry.getNumberOfChannels());
    return geometry;
  }

  public static InstrumentGeometry fromFile(File file) throws IOException {
    LOGGER.info("Reading instrument geometry from %s", file.getAbsolutePath());
    InstrumentGeometry geometry = OBJECT_MAPPER.readValue(file, InstrumentGeometry.class);
    LOGGER.info("Loaded geometry with %d modules and %d channels",
        geometry.getModuleOrder().size(), geometry.getNumberOfChannels());
    return geometry;
  }

  /**
   * Returns a copy of this geometry with some module angles replaced; modules not in {@code angles} keep their angle.
   */
  public InstrumentGeometry withMeanAngles(Map<AnalyzerModule, Double> angles) {
    Map<AnalyzerModule, Double> merged = new EnumMap<>(meanAngles);
    merged.putAll(angles);
    return new InstrumentGeometry(fixedOffsets, scanningOffsets, merged, moduleOrder);
  }

  public int getAnalyzersPerModule() {
    return fixedOffsets.length;
  }

  public int getNumberOfChannels() {
    return fixedOffsets.length * moduleOrder.size();
  }

  @JsonProperty("fixed_offsets")
  public double[] getFixedOffsets() {
    return Arrays.copyOf(fixedOffsets, fixedOffsets.length);
  }

  @JsonProperty("scanning_offsets")
  public double[] getScanningOffsets() {
    return Arrays.copyOf(scanningOffsets, scanningOffsets.length);
  }

  @JsonProperty("mean_angles")
  public Map<AnalyzerModule, Double> getMeanAngles() {
    return Collections.unmodifiableMap(meanAngles);
  }

  public double getMeanAngle(AnalyzerModule module) {
    return meanAngles.get(module);
  }

  @JsonProperty("module_order")
  public List<AnalyzerModule> getModuleOrder() {
    return moduleOrder;
  }

  /**
   * Computes the scattering angle two-theta (degrees) of every channel as {@code arccos(cos(h) * cos(v))}, where h and
   * v are the analyzer's horizontal and vertical angles.
   * @return One angle per channel, in module order.
   */
  public double[] computeTth() {
    double[] tth = new double[getNumberOfChannels()];
    int channel = 0;
    for (AnalyzerModule module : moduleOrder) {
      double mean = meanAngles.get(module);
      for (int n = 0; n < fixedOffsets.length; n++) {
        double inPlane = scanningOffsets[n] + mean;
        double outOfPlane = fixedOffsets[n];
        double horizontal, vertical;
        if (module.getOrientation() == AnalyzerModule.Orientation.VERTICAL) {
          vertical = inPlane;
          horizontal = outOfPlane;
        } else {
          horizontal = inPlane;
          vertical = outOfPlane;
        }
        tth[channel++] = scatteringAngle(horizontal, vertical);
      }
    }
    return tth;
  }

  /**
   * Combines a horizontal and a vertical angle (both in degrees) into the total scattering angle, in degrees.
   */
  public static double scatteringAngle(double horizontal, double vertical) {
    return Math.toDegrees(Math.acos(Math.cos(Math.toRadians(horizontal)) * Math.cos(Math.toRadians(vertical))));
  }
}
