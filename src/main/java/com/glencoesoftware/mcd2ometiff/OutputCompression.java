/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import loci.formats.out.TiffWriter;

/**
 * Compression types for TIFF output. The string value of each is
 * the name recognized by the Bio-Formats TIFF writers.
 */
public enum OutputCompression {
  raw(TiffWriter.COMPRESSION_UNCOMPRESSED),
  lzw(TiffWriter.COMPRESSION_LZW),
  zlib(TiffWriter.COMPRESSION_ZLIB);

  private final String value;

  private OutputCompression(final String value) {
    this.value = value;
  }

  @Override
  public String toString() {
    return value;
  }
}
