/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Models a single acquisition. This is the raw data.
 */
public class Acquisition {

  /** Acquisition ID, unique within a file. */
  private final String id;
  private final String description;

  /** File pointer indicating start of pixel data. */
  private final long start;

  /** File pointer indicating end of pixel data (exclusive). */
  private final long end;

  /** Declared SegmentDataFormat; only "Float" recognized so far. */
  private final String dataFormat;

  /** Declared ValueBytes. */
  private final int valueBytes;

  /** Measured channels sorted by order number, without X, Y and Z. */
  private final List<AcquisitionChannel> channels;

  /** Every child element of the Acquisition element. */
  private final Map<String, String> attributes;

  /**
   * @param id acquisition ID
   * @param description acquisition description, may be null
   * @param start offset of the first data byte
   * @param end offset after the last data byte
   * @param dataFormat declared SegmentDataFormat
   * @param valueBytes declared ValueBytes
   * @param channels measured channels in column order
   * @param attributes raw metadata values
   */
  public Acquisition(String id, String description, long start, long end,
    String dataFormat, int valueBytes, List<AcquisitionChannel> channels,
    Map<String, String> attributes)
  {
    this.id = id;
    this.description = description;
    this.start = start;
    this.end = end;
    this.dataFormat = dataFormat;
    this.valueBytes = valueBytes;
    this.channels =
      Collections.unmodifiableList(new ArrayList<AcquisitionChannel>(channels));
    this.attributes = Collections.unmodifiableMap(
      new LinkedHashMap<String, String>(attributes));
  }

  public String getId() {
    return id;
  }

  public String getDescription() {
    return description;
  }

  public long getDataStartOffset() {
    return start;
  }

  public long getDataEndOffset() {
    return end;
  }

  /**
   * @return number of raw data bytes
   */
  public long getDataLength() {
    return end - start;
  }

  public String getDataFormat() {
    return dataFormat;
  }

  public int getValueBytes() {
    return valueBytes;
  }

  /**
   * Resolve the declared value encoding.
   *
   * @return the encoding used for this acquisition's raw values
   * @throws UnsupportedValueFormatException if the encoding is not supported
   */
  public ValueFormat getValueFormat() throws UnsupportedValueFormatException {
    return ValueFormat.lookup(id, dataFormat, valueBytes);
  }

  /**
   * @return measured channels, in the order in which values are stored
   */
  public List<AcquisitionChannel> getChannels() {
    return channels;
  }

  /**
   * @return display name of each measured channel, in column order
   */
  public List<String> getChannelNames() {
    List<String> names = new ArrayList<String>();
    for (AcquisitionChannel channel : channels) {
      names.add(channel.getDisplayName());
    }
    return names;
  }

  /**
   * @return number of values in each record (X, Y, Z and every channel)
   */
  public int getRecordWidth() {
    return channels.size() + LongFormTable.COORDINATE_COLUMNS;
  }

  /**
   * @return unmodifiable map of every child element name to its text
   */
  public Map<String, String> getAttributes() {
    return attributes;
  }

  @Override
  public String toString() {
    return "Acquisition " + id +
      (description == null ? "" : " (" + description + ")");
  }

}
