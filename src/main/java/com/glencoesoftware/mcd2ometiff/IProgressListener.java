/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

import java.util.EventListener;

public interface IProgressListener extends EventListener {

  /**
   * Indicates the total number of acquisitions in this conversion.
   *
   * @param acquisitionCount total number of acquisitions to convert
   */
  void notifyStart(int acquisitionCount);

  /**
   * Indicates the beginning of processing a particular acquisition.
   *
   * @param acquisition index of the acquisition being processed
   * @param id acquisition ID
   * @param planeCount number of channel planes to write
   */
  void notifyAcquisitionStart(int acquisition, String id, int planeCount);

  /**
   * Indicates the end of processing a particular acquisition.
   *
   * @param acquisition index of the acquisition being processed
   */
  void notifyAcquisitionEnd(int acquisition);

  /**
   * Indicates that the given plane is about to be written.
   *
   * @param plane channel index
   */
  void notifyPlaneStart(int plane);

  /**
   * Indicates that the given plane has been written.
   *
   * @param plane channel index
   */
  void notifyPlaneEnd(int plane);

}
