/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.util.Arrays;

/**
 * Decoded long-form records, one per measured pixel.
 * Each record is (X, Y, Z, C1, ..., CN); records are stored
 * contiguously in a single array.
 */
public class LongFormTable {

  /** Number of leading coordinate values in each record. */
  public static final int COORDINATE_COLUMNS = 3;

  private final float[] values;
  private final int recordWidth;

  /**
   * @param values every record, concatenated
   * @param recordWidth number of values per record, including coordinates
   */
  public LongFormTable(float[] values, int recordWidth) {
    if (recordWidth < COORDINATE_COLUMNS) {
      throw new IllegalArgumentException(
        "Record width must be at least " + COORDINATE_COLUMNS);
    }
    if (values.length % recordWidth != 0) {
      throw new IllegalArgumentException(values.length +
        " values cannot be split into records of width " + recordWidth);
    }
    this.values = values;
    this.recordWidth = recordWidth;
  }

  public int getRecordWidth() {
    return recordWidth;
  }

  /**
   * @return number of channel values in each record
   */
  public int getChannelCount() {
    return recordWidth - COORDINATE_COLUMNS;
  }

  public int getRowCount() {
    return values.length / recordWidth;
  }

  /**
   * @param row record index
   * @param column value index within the record
   * @return the stored value
   */
  public float get(int row, int column) {
    return values[row * recordWidth + column];
  }

  public float getX(int row) {
    return get(row, 0);
  }

  public float getY(int row) {
    return get(row, 1);
  }

  public float getZ(int row) {
    return get(row, 2);
  }

  /**
   * Copy one record's channel values.
   *
   * @param row record index
   * @param dest destination array
   * @param offset index in dest of the first channel value
   */
  public void copyChannels(int row, float[] dest, int offset) {
    System.arraycopy(values, row * recordWidth + COORDINATE_COLUMNS,
      dest, offset, getChannelCount());
  }

  /**
   * @param row record index
   * @return copy of the full record
   */
  public float[] getRow(int row) {
    int start = row * recordWidth;
    return Arrays.copyOfRange(values, start, start + recordWidth);
  }

  /**
   * @return true if any value in any record is NaN
   */
  public boolean containsNaN() {
    for (float v : values) {
      if (Float.isNaN(v)) {
        return true;
      }
    }
    return false;
  }

}
