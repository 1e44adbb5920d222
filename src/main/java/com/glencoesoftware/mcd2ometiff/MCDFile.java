/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import loci.common.RandomAccessInputStream;
import loci.formats.FormatException;

import org.perf4j.slf4j.Slf4JStopWatch;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An open Fluidigm Hyperion .mcd file.
 *
 * Each acquisition is decoded and reshaped only when requested, one at
 * a time. The underlying file stays open until every selected acquisition
 * has been read through {@link #iterator()}, an error occurs, or
 * {@link #close()} is called; callers that may stop early should use
 * try-with-resources:
 *
 * <pre>
 * try (MCDFile mcd = MCDFile.open(path, options)) {
 *   for (Raster raster : mcd) {
 *     ...
 *   }
 * }
 * </pre>
 *
 * Iteration is single-pass; {@link #iterator()} may only be called once.
 */
public class MCDFile implements Closeable, Iterable<Raster> {

  private static final Logger LOGGER = LoggerFactory.getLogger(MCDFile.class);

  private final String path;
  private final String baseName;
  private final ReaderOptions options;
  private final AcquisitionCatalog catalog;
  private final List<Acquisition> selected;

  private RandomAccessInputStream in;
  private boolean iterated = false;

  private MCDFile(String path, String baseName, RandomAccessInputStream in,
    ReaderOptions options, AcquisitionCatalog catalog)
  {
    this.path = path;
    this.baseName = baseName;
    this.in = in;
    this.options = options;
    this.catalog = catalog;
    this.selected = Collections.unmodifiableList(selectAcquisitions());
  }

  /**
   * Open an .mcd file with default options.
   *
   * @param path file to open
   * @return open file
   * @throws FormatException if the metadata footer is missing or invalid
   * @throws IOException if the file cannot be read
   */
  public static MCDFile open(Path path) throws FormatException, IOException {
    return open(path, new ReaderOptions());
  }

  /**
   * Open an .mcd file, locate the metadata footer and parse the
   * acquisition catalog. No pixel data is read.
   *
   * @param path file to open
   * @param options reader options
   * @return open file
   * @throws FormatException if the metadata footer is missing or invalid
   * @throws IOException if the file cannot be read
   */
  public static MCDFile open(Path path, ReaderOptions options)
    throws FormatException, IOException
  {
    String id = path.toString();
    RandomAccessInputStream in = new RandomAccessInputStream(id);
    try {
      Slf4JStopWatch t0 = stopWatch();
      String xml = FooterLocator.readFooter(in, id, options.getEncoding());
      t0.stop("readFooter");
      AcquisitionCatalog catalog = AcquisitionCatalog.parse(xml);
      return new MCDFile(id, getBaseName(path), in, options, catalog);
    }
    catch (FormatException | IOException | RuntimeException e) {
      closeAfterError(in, e);
      throw e;
    }
  }

  /**
   * @return path to the open file
   */
  public String getPath() {
    return path;
  }

  /**
   * @return every acquisition defined in the file, in document order
   */
  public AcquisitionCatalog getCatalog() {
    return catalog;
  }

  /**
   * @return acquisitions that will be returned by {@link #iterator()}
   */
  public List<Acquisition> getSelectedAcquisitions() {
    return selected;
  }

  /**
   * @return true if the file has been closed
   */
  public boolean isClosed() {
    return in == null;
  }

  /**
   * Decode and reshape a single acquisition.
   * The declared value format is checked before any pixel data is read.
   *
   * @param acquisition acquisition from this file's catalog
   * @return image named "{file name}_{acquisition ID}"
   * @throws FormatException if the acquisition cannot be decoded or reshaped
   * @throws IOException if the file cannot be read or is closed
   */
  public Raster readAcquisition(Acquisition acquisition)
    throws FormatException, IOException
  {
    if (isClosed()) {
      throw new IOException(path + " is closed");
    }
    LOGGER.debug("Reading {}", acquisition);
    ValueFormat format = acquisition.getValueFormat();

    Slf4JStopWatch t0 = stopWatch();
    LongFormTable table = RecordDecoder.decode(in,
      acquisition.getDataStartOffset(), acquisition.getDataEndOffset(),
      acquisition.getRecordWidth(), format);
    t0.stop("decode");

    Slf4JStopWatch t1 = stopWatch();
    Raster raster = GridReshaper.reshape(
      table, acquisition.getChannelNames(), options.getFillValue());
    t1.stop("reshape");

    return raster.withMetadata(baseName + "_" + acquisition.getId(),
      acquisition.getAttributes());
  }

  /**
   * Get a single-pass iterator over the selected acquisitions.
   * The file is closed when the last raster has been returned,
   * or when reading fails; {@link RasterIterator#next()} then throws
   * a {@link McdReadException} wrapping the original checked exception,
   * or rethrows the original unchecked exception.
   *
   * @return iterator yielding one raster per acquisition
   * @throws IllegalStateException if called more than once
   */
  @Override
  public RasterIterator iterator() {
    if (iterated) {
      throw new IllegalStateException(
        "Acquisitions in " + path + " can only be iterated once");
    }
    iterated = true;
    return new RasterIterator();
  }

  /**
   * Release the underlying file. Safe to call more than once.
   */
  @Override
  public void close() throws IOException {
    if (in != null) {
      LOGGER.debug("Closing {}", path);
      RandomAccessInputStream s = in;
      in = null;
      s.close();
    }
  }

  // -- Helper methods --

  private List<Acquisition> selectAcquisitions() {
    List<String> ids = options.getAcquisitionIds();
    for (String id : ids) {
      if (catalog.getAcquisition(id) == null) {
        LOGGER.warn("Acquisition {} not found in {}", id, path);
      }
    }
    List<Acquisition> list = new ArrayList<Acquisition>();
    for (Acquisition acq : catalog.getAcquisitions()) {
      if (!ids.isEmpty() && !ids.contains(acq.getId())) {
        continue;
      }
      if (acq.getDataLength() <= 0) {
        LOGGER.warn("Skipping acquisition {} with no pixel data", acq.getId());
        continue;
      }
      list.add(acq);
    }
    return list;
  }

  private static String getBaseName(Path path) {
    String name = path.getFileName().toString();
    int dot = name.lastIndexOf('.');
    return dot > 0 ? name.substring(0, dot) : name;
  }

  private static void closeAfterError(Closeable c, Exception e) {
    try {
      c.close();
    }
    catch (IOException ce) {
      e.addSuppressed(ce);
    }
  }

  private static Slf4JStopWatch stopWatch() {
    return new Slf4JStopWatch(LOGGER, Slf4JStopWatch.DEBUG_LEVEL);
  }

  // -- Helper class --

  /**
   * Forward-only iterator over the selected acquisitions.
   */
  public class RasterIterator implements Iterator<Raster> {

    private int index = 0;

    private RasterIterator() {
    }

    @Override
    public boolean hasNext() {
      return !isClosed() && index < selected.size();
    }

    /**
     * @return index of the next acquisition within
     *         {@link MCDFile#getSelectedAcquisitions()}
     */
    public int nextIndex() {
      return index;
    }

    @Override
    public Raster next() {
      if (!hasNext()) {
        throw new NoSuchElementException();
      }
      Acquisition acq = selected.get(index++);
      try {
        Raster raster = readAcquisition(acq);
        if (index >= selected.size()) {
          close();
        }
        return raster;
      }
      catch (FormatException | IOException e) {
        if (in != null) {
          closeAfterError(MCDFile.this, e);
        }
        throw new McdReadException(
          "Could not read " + acq + " from " + path, e);
      }
      catch (RuntimeException e) {
        if (in != null) {
          closeAfterError(MCDFile.this, e);
        }
        throw e;
      }
    }
  }

}
