/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.nio.ByteBuffer;

/**
 * Encodings that may be declared for raw acquisition values
 * (SegmentDataFormat and ValueBytes in the acquisition metadata).
 */
public enum ValueFormat {
  FLOAT32("Float", 4) {
    @Override
    void decode(ByteBuffer src, float[] dest) {
      src.asFloatBuffer().get(dest);
    }
  };

  private final String dataFormat;
  private final int bytes;

  private ValueFormat(String dataFormat, int bytes) {
    this.dataFormat = dataFormat;
    this.bytes = bytes;
  }

  /**
   * @return number of bytes used to store one value
   */
  public int getBytes() {
    return bytes;
  }

  /**
   * @return SegmentDataFormat value matching this encoding
   */
  public String getDataFormat() {
    return dataFormat;
  }

  /**
   * Decode values from the buffer's current position.
   * The buffer's byte order must already be set.
   *
   * @param src buffer containing exactly dest.length encoded values
   * @param dest array to fill
   */
  abstract void decode(ByteBuffer src, float[] dest);

  /**
   * Find the encoding matching an acquisition's declared format.
   *
   * @param acquisitionId acquisition ID, used in the exception message
   * @param dataFormat declared SegmentDataFormat
   * @param valueBytes declared ValueBytes
   * @return matching encoding
   * @throws UnsupportedValueFormatException if no encoding matches
   */
  public static ValueFormat lookup(String acquisitionId, String dataFormat,
    int valueBytes)
    throws UnsupportedValueFormatException
  {
    for (ValueFormat f : values()) {
      if (f.dataFormat.equals(dataFormat) && f.bytes == valueBytes) {
        return f;
      }
    }
    throw new UnsupportedValueFormatException(
      acquisitionId, dataFormat, valueBytes);
  }
}
