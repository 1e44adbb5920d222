/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import loci.common.DataTools;

/**
 * Dense multichannel float image indexed by (row, column, channel).
 * Row corresponds to Y and column to X; the channel axis is labeled
 * with channel display names.
 */
public class Raster {

  private final String name;
  private final Map<String, String> attributes;
  private final int sizeX;
  private final int sizeY;
  private final List<String> channelNames;

  /** Values in (row, column, channel) order. */
  private final float[] data;

  /**
   * @param name image name, may be null
   * @param attributes acquisition metadata
   * @param sizeX number of columns
   * @param sizeY number of rows
   * @param channelNames channel labels
   * @param data values in (row, column, channel) order
   */
  public Raster(String name, Map<String, String> attributes,
    int sizeX, int sizeY, List<String> channelNames, float[] data)
  {
    if ((long) sizeX * sizeY * channelNames.size() != data.length) {
      throw new IllegalArgumentException("Expected " + sizeX + " x " + sizeY +
        " x " + channelNames.size() + " values, found " + data.length);
    }
    this.name = name;
    this.attributes = Collections.unmodifiableMap(
      new LinkedHashMap<String, String>(attributes));
    this.sizeX = sizeX;
    this.sizeY = sizeY;
    this.channelNames =
      Collections.unmodifiableList(new ArrayList<String>(channelNames));
    this.data = data;
  }

  /**
   * Create a copy of this raster with a new name and metadata.
   * Pixel data is shared.
   *
   * @param newName image name
   * @param newAttributes acquisition metadata
   * @return renamed raster
   */
  public Raster withMetadata(String newName,
    Map<String, String> newAttributes)
  {
    return new Raster(newName, newAttributes, sizeX, sizeY, channelNames,
      data);
  }

  public String getName() {
    return name;
  }

  public Map<String, String> getAttributes() {
    return attributes;
  }

  public int getSizeX() {
    return sizeX;
  }

  public int getSizeY() {
    return sizeY;
  }

  public int getSizeC() {
    return channelNames.size();
  }

  public List<String> getChannelNames() {
    return channelNames;
  }

  /**
   * @return X axis labels, 0 to sizeX - 1
   */
  public int[] getXCoordinates() {
    return range(sizeX);
  }

  /**
   * @return Y axis labels, 0 to sizeY - 1
   */
  public int[] getYCoordinates() {
    return range(sizeY);
  }

  /**
   * @param row Y coordinate
   * @param column X coordinate
   * @param channel channel index
   * @return value at the given position
   */
  public float get(int row, int column, int channel) {
    return data[(row * sizeX + column) * getSizeC() + channel];
  }

  /**
   * @param row Y coordinate
   * @param column X coordinate
   * @return copy of every channel value at the given position
   */
  public float[] getPixel(int row, int column) {
    int start = (row * sizeX + column) * getSizeC();
    return Arrays.copyOfRange(data, start, start + getSizeC());
  }

  /**
   * @param channel channel index
   * @return one channel's values in row-major order
   */
  public float[] getPlane(int channel) {
    int sizeC = getSizeC();
    float[] plane = new float[sizeX * sizeY];
    for (int i=0; i<plane.length; i++) {
      plane[i] = data[i * sizeC + channel];
    }
    return plane;
  }

  /**
   * @param channel channel index
   * @param littleEndian byte order of the returned bytes
   * @return one channel's values as 32-bit floats in row-major order
   */
  public byte[] getPlaneBytes(int channel, boolean littleEndian) {
    return DataTools.floatsToBytes(getPlane(channel), littleEndian);
  }

  /**
   * @param channel channel index
   * @return smallest non-NaN value in the channel, or NaN if none
   */
  public float getMinimum(int channel) {
    float min = Float.NaN;
    for (float v : getPlane(channel)) {
      if (!Float.isNaN(v) && (Float.isNaN(min) || v < min)) {
        min = v;
      }
    }
    return min;
  }

  /**
   * @param channel channel index
   * @return largest non-NaN value in the channel, or NaN if none
   */
  public float getMaximum(int channel) {
    float max = Float.NaN;
    for (float v : getPlane(channel)) {
      if (!Float.isNaN(v) && (Float.isNaN(max) || v > max)) {
        max = v;
      }
    }
    return max;
  }

  /**
   * Two rasters are equal if they have the same dimensions, channel names
   * and bit-identical values. Name and attributes are not compared.
   */
  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Raster)) {
      return false;
    }
    Raster other = (Raster) o;
    return sizeX == other.sizeX && sizeY == other.sizeY &&
      channelNames.equals(other.channelNames) &&
      Arrays.equals(data, other.data);
  }

  @Override
  public int hashCode() {
    return 31 * (31 * (31 * sizeX + sizeY) + channelNames.hashCode()) +
      Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "Raster " + name + " [" + sizeY + " x " + sizeX + " x " +
      getSizeC() + "]";
  }

  private static int[] range(int n) {
    int[] values = new int[n];
    for (int i=0; i<n; i++) {
      values[i] = i;
    }
    return values;
  }

}
