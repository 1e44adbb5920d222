/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import loci.formats.FormatException;

/**
 * Thrown when an acquisition declares a value encoding that
 * cannot be decoded. No pixel bytes are read for such an acquisition.
 */
public class UnsupportedValueFormatException extends FormatException {

  private final String acquisitionId;

  /**
   * @param acquisitionId ID of the offending acquisition
   * @param dataFormat declared SegmentDataFormat
   * @param valueBytes declared ValueBytes
   */
  public UnsupportedValueFormatException(String acquisitionId,
    String dataFormat, int valueBytes)
  {
    super("Acquisition " + acquisitionId + " has unsupported data type '" +
      dataFormat + "' with " + valueBytes + " bytes per value; " +
      "expected 4 byte float");
    this.acquisitionId = acquisitionId;
  }

  /**
   * @return ID of the acquisition that could not be decoded
   */
  public String getAcquisitionId() {
    return acquisitionId;
  }

}
