/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

public class NoOpProgressListener implements IProgressListener {

  @Override
  public void notifyStart(int acquisitionCount) {
  }

  @Override
  public void notifyAcquisitionStart(int acquisition, String id,
    int planeCount)
  {
  }

  @Override
  public void notifyAcquisitionEnd(int acquisition) {
  }

  @Override
  public void notifyPlaneStart(int plane) {
  }

  @Override
  public void notifyPlaneEnd(int plane) {
  }

}
