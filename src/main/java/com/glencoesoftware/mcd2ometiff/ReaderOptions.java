/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Options controlling how an .mcd file is read.
 */
public class ReaderOptions {

  /** Encoding of the XML footer used by Hyperion instruments. */
  public static final Charset DEFAULT_ENCODING = StandardCharsets.UTF_16LE;

  private Float fillValue = null;
  private Charset encoding = DEFAULT_ENCODING;
  private List<String> acquisitionIds = new ArrayList<String>();

  /**
   * @return value used for missing pixels, or null if missing data
   *         is an error
   */
  public Float getFillValue() {
    return fillValue;
  }

  /**
   * Set the value used for pixels that have no record.
   * By default (null) missing data causes an
   * {@link IncompleteDataException}.
   *
   * @param fill fill value, or null
   * @return this
   */
  public ReaderOptions setFillValue(Float fill) {
    fillValue = fill;
    return this;
  }

  public Charset getEncoding() {
    return encoding;
  }

  /**
   * Set the text encoding of the XML footer. The encoding is never
   * detected automatically.
   *
   * @param charset footer encoding, or null for the default
   * @return this
   */
  public ReaderOptions setEncoding(Charset charset) {
    encoding = charset == null ? DEFAULT_ENCODING : charset;
    return this;
  }

  /**
   * @return IDs of acquisitions to read; empty means all
   */
  public List<String> getAcquisitionIds() {
    return acquisitionIds;
  }

  /**
   * Restrict reading to a subset of acquisitions.
   *
   * @param ids acquisition IDs, or null/empty to read all acquisitions
   * @return this
   */
  public ReaderOptions setAcquisitionIds(List<String> ids) {
    acquisitionIds = ids == null ?
      new ArrayList<String>() : new ArrayList<String>(ids);
    return this;
  }

}
