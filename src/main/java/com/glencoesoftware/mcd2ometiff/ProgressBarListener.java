/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import me.tongfei.progressbar.DelegatingProgressBarConsumer;
import me.tongfei.progressbar.ProgressBar;
import me.tongfei.progressbar.ProgressBarBuilder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class ProgressBarListener implements IProgressListener {

  // not a typo - the progress bar consumes Converter's logging output
  private static final Logger LOGGER = LoggerFactory.getLogger(Converter.class);

  private String logLevel;
  private ProgressBar pb;
  private int acquisitionCount = 0;

  /**
   * Create a new progress listener that displays a progress bar.
   *
   * @param level logging level
   */
  public ProgressBarListener(String level) {
    logLevel = level;
  }

  @Override
  public void notifyStart(int count) {
    acquisitionCount = count;
  }

  @Override
  public void notifyAcquisitionStart(int acquisition, String id,
    int planeCount)
  {
    ProgressBarBuilder builder = new ProgressBarBuilder()
      .setInitialMax(planeCount)
      .setTaskName(String.format("[%d/%d] %s",
        acquisition + 1, acquisitionCount, id));

    if (!(logLevel.equals("OFF") ||
      logLevel.equals("ERROR") ||
      logLevel.equals("WARN")))
    {
      builder.setConsumer(new DelegatingProgressBarConsumer(LOGGER::trace));
    }
    pb = builder.build();
  }

  @Override
  public void notifyPlaneStart(int plane) {
    // intentional no-op
  }

  @Override
  public void notifyPlaneEnd(int plane) {
    if (pb != null) {
      pb.step();
    }
  }

  @Override
  public void notifyAcquisitionEnd(int acquisition) {
    if (pb != null) {
      pb.close();
      pb = null;
    }
  }

}
