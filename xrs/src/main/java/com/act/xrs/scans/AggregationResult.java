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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The groups that were aggregated successfully, keyed by type label, and the failures of those that were not.
 */
public class AggregationResult {
  private final Map<String, ScanGroup> groups;
  private final Map<String, AggregationException> failures;

  public AggregationResult(Map<String, ScanGroup> groups, Map<String, AggregationException> failures) {
    this.groups = Collections.unmodifiableMap(new LinkedHashMap<>(groups));
    this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  public Map<String, ScanGroup> getGroups() {
    return groups;
  }

  public ScanGroup getGroup(String type) {
    return groups.get(type);
  }

  public boolean hasGroup(String type) {
    return groups.containsKey(type);
  }

  public Map<String, AggregationException> getFailures() {
    return failures;
  }

  public boolean hasFailures() {
    return !failures.isEmpty();
  }
}
