/**
 * Copyright (c) 2026 Glencoe Software, Inc. All rights reserved.
 *
 * This software is distributed under the terms described by the LICENSE.txt
 * file you can find at the root of the distribution bundle.  If the file is
 * missing please request a copy by contacting info@glencoesoftware.com
 */
package com.glencoesoftware.mcd2ometiff;

/**
 * Models a single AcquisitionChannel element.
 * Channel definitions are not shared across acquisitions; each one
 * refers back to exactly one acquisition by ID.
 */
public class AcquisitionChannel {

  private final String acquisitionId;
  private final String name;
  private final String label;
  private final int orderNumber;

  /**
   * @param acquisitionId ID of the owning acquisition
   * @param name channel name, e.g. "Ir191"
   * @param label channel label, or null if the label is empty
   * @param orderNumber column index of this channel in the raw records
   */
  public AcquisitionChannel(String acquisitionId, String name, String label,
    int orderNumber)
  {
    this.acquisitionId = acquisitionId;
    this.name = name;
    this.label = label == null || label.isEmpty() ? null : label;
    this.orderNumber = orderNumber;
  }

  /**
   * @return ID of the acquisition to which this channel belongs
   */
  public String getAcquisitionId() {
    return acquisitionId;
  }

  public String getName() {
    return name;
  }

  /**
   * @return channel label, or null if none was defined
   */
  public String getLabel() {
    return label;
  }

  public int getOrderNumber() {
    return orderNumber;
  }

  /**
   * @return "name_label" if a label is defined, otherwise the name
   */
  public String getDisplayName() {
    return label == null ? name : name + "_" + label;
  }

  /**
   * X, Y and Z are stored as channels in the metadata, but are the
   * coordinate columns of each record rather than measured signals.
   *
   * @return true if this is one of the coordinate pseudo-channels
   */
  public boolean isCoordinate() {
    return "X".equals(name) || "Y".equals(name) || "Z".equals(name);
  }

  @Override
  public String toString() {
    return getDisplayName() + " (acquisition " + acquisitionId +
      ", order " + orderNumber + ")";
  }

}
