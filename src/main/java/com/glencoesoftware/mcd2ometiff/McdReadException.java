/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

/**
 * Unchecked wrapper for errors raised while iterating over acquisitions,
 * where {@link java.util.Iterator#next()} cannot declare checked exceptions.
 * The cause is always a {@link loci.formats.FormatException} or
 * {@link java.io.IOException}.
 */
public class McdReadException extends RuntimeException {

  /**
   * @param message description of the acquisition being read
   * @param cause underlying format or I/O exception
   */
  public McdReadException(String message, Exception cause) {
    super(message, cause);
  }

}
