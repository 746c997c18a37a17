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

import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.TreeSet;

/**
 * An explicit, immutable set of analyzer channel indices.  Channel selectors are always normalized into one of these
 * before they reach any per-channel operation, so a single channel and a list of channels look the same downstream.
 *
 * Indices are kept in ascending order and are unique.
 */
public final class ChannelSet implements Iterable<Integer> {
  private final int[] channels;

  private ChannelSet(int[] sortedUniqueChannels) {
    this.channels = sortedUniqueChannels;
  }

  public static ChannelSet of(int... channels) {
    if (channels == null || channels.length == 0) {
      throw new IllegalArgumentException("A channel set needs at least one channel index");
    }
    TreeSet<Integer> unique = new TreeSet<>();
    for (int channel : channels) {
      if (channel < 0) {
        throw new IllegalArgumentException(String.format("Channel indices must be non-negative, got %d", channel));
      }
      unique.add(channel);
    }
    return new ChannelSet(unique.stream().mapToInt(Integer::intValue).toArray());
  }

  /**
   * Builds the set {from, from + 1, ..., to - 1}.
   */
  public static ChannelSet range(int from, int to) {
    if (from < 0 || to <= from) {
      throw new IllegalArgumentException(String.format("Invalid channel range [%d, %d)", from, to));
    }
    int[] channels = new int[to - from];
    for (int i = 0; i < channels.length; i++) {
      channels[i] = from + i;
    }
    return new ChannelSet(channels);
  }

  public static ChannelSet all(int numberOfChannels) {
    return range(0, numberOfChannels);
  }

  public int size() {
    return channels.length;
  }

  public boolean contains(int channel) {
    return Arrays.binarySearch(channels, channel) >= 0;
  }

  public int first() {
    return channels[0];
  }

  public int last() {
    return channels[channels.length - 1];
  }

  public int[] toArray() {
    return Arrays.copyOf(channels, channels.length);
  }

  /**
   * Checks that every index addresses one of {@code numberOfChannels} channels.
   * @param numberOfChannels The channel count of the data this set is about to be applied to.
   * @return This set, for chaining.
   */
  public ChannelSet validateAgainst(int numberOfChannels) {
    if (last() >= numberOfChannels) {
      throw new IllegalArgumentException(String.format(
          "Channel index %d is out of range for data with %d channels", last(), numberOfChannels));
    }
    return this;
  }

  @Override
  public Iterator<Integer> iterator() {
    return new Iterator<Integer>() {
      private int position = 0;

      @Override
      public boolean hasNext() {
        return position < channels.length;
      }

      @Override
      public Integer next() {
        if (!hasNext()) {
          throw new NoSuchElementException();
        }
        return channels[position++];
      }
    };
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (o == null || getClass() != o.getClass()) return false;
    return Arrays.equals(channels, ((ChannelSet) o).channels);
  }

  @Override
  public int hashCode() {
    return Arrays.hashCode(channels);
  }

  @Override
  public String toString() {
    return "{" + StringUtils.join(channels, ',') + "}";
  }
}
