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
 * Thrown when long-form records do not cover every pixel of the
 * acquisition (or contain NaN values) and no fill value was given.
 */
public class IncompleteDataException extends FormatException {

  private final long expectedRows;
  private final long actualRows;
  private final boolean containsNaN;

  /**
   * @param expectedRows row count implied by the maximum X and Y coordinates
   * @param actualRows number of decoded rows
   * @param containsNaN true if at least one decoded value is NaN
   */
  public IncompleteDataException(long expectedRows, long actualRows,
    boolean containsNaN)
  {
    super("Image data is missing values (expected " + expectedRows +
      " rows, found " + actualRows + (containsNaN ? ", some with NaN" : "") +
      "). Try specifying a fill value.");
    this.expectedRows = expectedRows;
    this.actualRows = actualRows;
    this.containsNaN = containsNaN;
  }

  /**
   * @return number of rows needed for a complete image
   */
  public long getExpectedRows() {
    return expectedRows;
  }

  /**
   * @return number of rows actually present
   */
  public long getActualRows() {
    return actualRows;
  }

  /**
   * @return true if NaN values were found in the decoded rows
   */
  public boolean containsNaN() {
    return containsNaN;
  }

}
