/*
 * Copyright OpenSearch Contributors
 * SPDX-License-Identifier: Apache-2.0
 */

package org.mohair.sql.exception;

/** Bytes that do not parse as a plan message. */
public class PlanDecodeException extends DecompositionException {

  public PlanDecodeException(String message, Throwable cause) {
    super(message, cause);
  }
}
