/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.util.Arrays;
import java.util.BitSet;
import java.util.Collections;
import java.util.List;

import loci.formats.FormatException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Transforms long-form (X, Y, Z, C1, ..., CN) records into a dense image
 * indexed by (row, column, channel). Each record is placed by its X and Y
 * values, so the order of the records does not matter.
 */
public final class GridReshaper {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(GridReshaper.class);

  private GridReshaper() {
  }

  /**
   * Check whether the records describe a complete rectangular image.
   *
   * @param table decoded records
   * @return true if any value is NaN, or if the number of records differs
   *         from (max(X) + 1) * (max(Y) + 1)
   * @throws FormatException if no record has valid coordinates
   */
  public static boolean isMissingValues(LongFormTable table)
    throws FormatException
  {
    long[] size = getSize(table);
    return table.getRowCount() != size[0] * size[1] || table.containsNaN();
  }

  /**
   * Build a dense image from the given records.
   *
   * If data is missing and a fill value is supplied, every pixel not
   * covered by a record is set to the fill value. NaN values within
   * records that are present are not replaced.
   *
   * @param table decoded records
   * @param channelNames channel labels, in record column order
   * @param fillValue value for missing pixels, or null if missing data
   *                  is an error
   * @return reshaped image, unnamed and without attributes
   * @throws IncompleteDataException if data is missing and fillValue is null
   * @throws FormatException if the records cannot be placed on a grid
   */
  public static Raster reshape(LongFormTable table, List<String> channelNames,
    Float fillValue)
    throws FormatException
  {
    int sizeC = table.getChannelCount();
    if (sizeC != channelNames.size()) {
      throw new FormatException("Records have " + sizeC +
        " channel values, but " + channelNames.size() + " channels are named");
    }

    long[] size = getSize(table);
    long expectedRows;
    long valueCount;
    try {
      expectedRows = Math.multiplyExact(size[0], size[1]);
      valueCount = Math.multiplyExact(expectedRows, Math.max(sizeC, 1));
    }
    catch (ArithmeticException e) {
      throw new FormatException(tooLarge(size, sizeC), e);
    }
    if (valueCount > Integer.MAX_VALUE) {
      throw new FormatException(tooLarge(size, sizeC));
    }
    int sizeX = (int) size[0];
    int sizeY = (int) size[1];
    int rowCount = table.getRowCount();

    boolean containsNaN = table.containsNaN();
    boolean missing = rowCount != expectedRows || containsNaN;
    if (missing) {
      if (fillValue == null) {
        throw new IncompleteDataException(expectedRows, rowCount, containsNaN);
      }
      LOGGER.warn("Image data is missing values (expected {} rows, " +
        "found {}); filling with {}", expectedRows, rowCount, fillValue);
    }

    float[] data = new float[sizeX * sizeY * sizeC];
    BitSet placed = new BitSet(sizeX * sizeY);
    for (int row=0; row<rowCount; row++) {
      float x = table.getX(row);
      float y = table.getY(row);
      if (Float.isNaN(x) || Float.isNaN(y)) {
        // the position is unknown, so the pixel is treated as missing
        continue;
      }
      // within int range, as sizeX * sizeY was checked above
      int pixel = (int) ((long) y * sizeX + (long) x);
      if (placed.get(pixel)) {
        throw new FormatException(
          "Duplicate record for X = " + x + ", Y = " + y);
      }
      placed.set(pixel);
      table.copyChannels(row, data, pixel * sizeC);
    }

    if (missing) {
      for (int pixel=placed.nextClearBit(0); pixel<sizeX * sizeY;
        pixel=placed.nextClearBit(pixel + 1))
      {
        Arrays.fill(data, pixel * sizeC, (pixel + 1) * sizeC, fillValue);
      }
    }

    return new Raster(null, Collections.<String, String>emptyMap(),
      sizeX, sizeY, channelNames, data);
  }

  /**
   * Calculate image dimensions from the largest X and Y values.
   * Records with NaN coordinates are ignored.
   *
   * @param table decoded records
   * @return {sizeX, sizeY}
   * @throws FormatException if a coordinate is negative or fractional,
   *                         or no record has valid coordinates
   */
  private static long[] getSize(LongFormTable table) throws FormatException {
    long maxX = -1;
    long maxY = -1;
    for (int row=0; row<table.getRowCount(); row++) {
      float x = table.getX(row);
      float y = table.getY(row);
      if (Float.isNaN(x) || Float.isNaN(y)) {
        continue;
      }
      checkCoordinate(x, "X", row);
      checkCoordinate(y, "Y", row);
      maxX = Math.max(maxX, (long) x);
      maxY = Math.max(maxY, (long) y);
    }
    if (maxX < 0 || maxY < 0) {
      throw new FormatException("No records with valid X and Y coordinates");
    }
    return new long[] {maxX + 1, maxY + 1};
  }

  private static String tooLarge(long[] size, int sizeC) {
    return "Image is too large (" + size[0] + " x " + size[1] + " x " +
      sizeC + ")";
  }

  private static void checkCoordinate(float value, String axis, int row)
    throws FormatException
  {
    if (value < 0 || value >= Integer.MAX_VALUE ||
      value != Math.floor(value))
    {
      throw new FormatException(
        "Invalid " + axis + " coordinate " + value + " in record " + row);
    }
  }

}
