/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.IOException;
import java.nio.charset.Charset;

import loci.common.RandomAccessInputStream;
import loci.formats.FormatException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Locates the MCDPublic XML document stored at the end of an .mcd file.
 * The MCD format documentation recommends searching for the root element
 * from the end of the file; the XML can be preceded by an arbitrary
 * amount of pixel data, which may itself contain the marker bytes.
 */
public final class FooterLocator {

  private static final Logger LOGGER =
    LoggerFactory.getLogger(FooterLocator.class);

  /** Opening of the root element of the public metadata document. */
  public static final String FOOTER_MARKER = "<MCDPublic";

  /** Closing tag of the public metadata document. */
  public static final String FOOTER_END = "</MCDPublic>";

  /** Number of bytes read per step of the reverse scan. */
  public static final int DEFAULT_BLOCK_SIZE = 1024 * 1024;

  private FooterLocator() {
  }

  /**
   * Find the offset of the last occurrence of {@link #FOOTER_MARKER}.
   *
   * @param in open stream
   * @param encoding text encoding of the XML footer
   * @return file offset of the marker, or -1 if not found
   * @throws IOException if the stream cannot be read
   */
  public static long findFooter(RandomAccessInputStream in, Charset encoding)
    throws IOException
  {
    return findFooter(in, encoding, DEFAULT_BLOCK_SIZE);
  }

  /**
   * Find the offset of the last occurrence of {@link #FOOTER_MARKER},
   * reading the stream backwards in blocks of the given size.
   * The search operates on raw bytes; nothing is decoded.
   *
   * @param in open stream
   * @param encoding text encoding of the XML footer
   * @param blockSize number of bytes to read per step
   * @return file offset of the marker, or -1 if not found
   * @throws IOException if the stream cannot be read
   */
  public static long findFooter(RandomAccessInputStream in, Charset encoding,
    int blockSize)
    throws IOException
  {
    if (blockSize <= 0) {
      throw new IllegalArgumentException("Invalid block size: " + blockSize);
    }
    byte[] marker = FOOTER_MARKER.getBytes(encoding);
    int overlap = marker.length - 1;
    long length = in.length();
    byte[] block = new byte[blockSize + overlap];

    // consecutive blocks overlap by one byte less than the marker,
    // so a marker that spans a block boundary is still found
    long end = length;
    while (end >= marker.length) {
      long start = Math.max(0, end - blockSize - overlap);
      int len = (int) (end - start);
      in.seek(start);
      in.readFully(block, 0, len);
      int index = lastIndexOf(block, len, marker);
      if (index >= 0) {
        return start + index;
      }
      if (start == 0) {
        break;
      }
      end = start + overlap;
    }
    return -1;
  }

  /**
   * Read and decode the XML footer.
   * Any bytes following the closing root tag are discarded.
   *
   * @param in open stream
   * @param path file path, used in exception messages
   * @param encoding text encoding of the XML footer
   * @return XML document text starting with {@link #FOOTER_MARKER}
   * @throws FormatException if the footer could not be found
   * @throws IOException if the stream cannot be read
   */
  public static String readFooter(RandomAccessInputStream in, String path,
    Charset encoding)
    throws FormatException, IOException
  {
    long offset = findFooter(in, encoding);
    if (offset < 0) {
      throw new FormatException("'" + path + "' does not contain " +
        "MCDPublic XML footer (try different encoding?)");
    }
    long xmlLength = in.length() - offset;
    if (xmlLength > Integer.MAX_VALUE) {
      throw new FormatException(
        "XML footer at " + offset + " is too large (" + xmlLength + " bytes)");
    }
    LOGGER.debug("Found XML footer at {}; reading {} bytes as {}",
      offset, xmlLength, encoding);

    byte[] xmlBytes = new byte[(int) xmlLength];
    in.seek(offset);
    in.readFully(xmlBytes);
    String xml = new String(xmlBytes, encoding);
    int close = xml.lastIndexOf(FOOTER_END);
    if (close > 0) {
      xml = xml.substring(0, close + FOOTER_END.length());
    }
    LOGGER.trace("MCDPublic XML: {}", xml);
    return xml;
  }

  /**
   * @param buf bytes to search
   * @param len number of valid bytes in buf
   * @param pattern bytes to find
   * @return index of the last occurrence of pattern, or -1
   */
  private static int lastIndexOf(byte[] buf, int len, byte[] pattern) {
    for (int i=len - pattern.length; i>=0; i--) {
      int j = 0;
      while (j < pattern.length && buf[i + j] == pattern[j]) {
        j++;
      }
      if (j == pattern.length) {
        return i;
      }
    }
    return -1;
  }

}
