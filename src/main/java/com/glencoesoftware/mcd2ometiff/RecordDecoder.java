/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;

import loci.common.RandomAccessInputStream;
import loci.formats.FormatException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a block of raw acquisition data into long-form records.
 * Values are little-endian and stored record by record with no padding;
 * the decoder knows nothing about what the values represent.
 */
public final class RecordDecoder {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(RecordDecoder.class);

  private RecordDecoder() {
  }

  /**
   * Decode an acquisition's raw data.
   *
   * @param in open stream
   * @param acquisition acquisition defining the byte range and record width
   * @return decoded records
   * @throws FormatException if the value format is unsupported or the
   *                         byte range does not hold whole records
   * @throws IOException if the stream cannot be read
   */
  public static LongFormTable decode(RandomAccessInputStream in,
    Acquisition acquisition)
    throws FormatException, IOException
  {
    return decode(in, acquisition.getDataStartOffset(),
      acquisition.getDataEndOffset(), acquisition.getRecordWidth(),
      acquisition.getValueFormat());
  }

  /**
   * Decode the records stored in [start, end).
   *
   * @param in open stream
   * @param start offset of the first byte
   * @param end offset after the last byte
   * @param recordWidth number of values per record
   * @param format value encoding
   * @return decoded records
   * @throws FormatException if the byte range does not hold whole records
   * @throws IOException if the stream cannot be read
   */
  public static LongFormTable decode(RandomAccessInputStream in,
    long start, long end, int recordWidth, ValueFormat format)
    throws FormatException, IOException
  {
    long stride = (long) format.getBytes() * recordWidth;
    long totalBytes = end - start;
    if (totalBytes <= 0 || totalBytes % stride != 0) {
      throw new FormatException("Data range [" + start + ", " + end +
        ") has " + totalBytes + " bytes, expected a positive multiple of " +
        stride + " (" + recordWidth + " values of " + format.getBytes() +
        " bytes)");
    }
    if (start < 0 || end > in.length()) {
      throw new FormatException("Data range [" + start + ", " + end +
        ") is outside of file with length " + in.length());
    }
    if (totalBytes > Integer.MAX_VALUE) {
      throw new FormatException(
        "Data range is too large (" + totalBytes + " bytes)");
    }

    LOGGER.debug("Decoding {} bytes at {} as records of {} values",
      totalBytes, start, recordWidth);
    byte[] raw = new byte[(int) totalBytes];
    in.seek(start);
    in.readFully(raw);

    float[] values = new float[(int) (totalBytes / format.getBytes())];
    format.decode(ByteBuffer.wrap(raw).order(ByteOrder.LITTLE_ENDIAN), values);
    return new LongFormTable(values, recordWidth);
  }

}
